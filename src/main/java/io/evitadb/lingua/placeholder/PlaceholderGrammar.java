package io.evitadb.lingua.placeholder;

import javax.annotation.Nonnull;
import java.util.regex.Pattern;

/**
 * Interpolation syntaxes that must survive translation untouched.
 *
 * The declaration order is the matching priority: at any position the first grammar that matches
 * wins, so more specific syntaxes are listed before the ones whose delimiters they contain
 * (`{{name}}` before `{name}`, `%(name)s` before `%s`).
 */
public enum PlaceholderGrammar {

	/** `{{variable}}` as used by i18next and Handlebars. */
	DOUBLE_BRACE("\\{\\{[^}]+}}"),
	/** `{0}`, `{1}` as used by .NET and Java message formats. */
	POSITIONAL_BRACE("\\{[0-9]+}"),
	/** `{name}` as used by Python format strings and Vue i18n. */
	SINGLE_BRACE_NAME("\\{[a-zA-Z_][a-zA-Z0-9_]*}"),
	/** `%(name)s` as used by Python percent formatting. */
	PERCENT_NAMED("%\\([^)]+\\)[sd]"),
	/** `%s`, `%d` as used by C-style formatting. */
	PERCENT_STYLE("%[sd]"),
	/** `${variable}` as used by JavaScript template literals. */
	DOLLAR_BRACE("\\$\\{[^}]+}"),
	/** `[[key]]` as used by some templating frameworks. */
	DOUBLE_BRACKET("\\[\\[[\\w\\s]+]]"),
	/**
	 * A literal marker delimiter already present in the source text. Protecting it keeps such text
	 * from being mistaken for a marker on restore.
	 */
	MARKER_DELIMITER("[" + PlaceholderCodec.MARKER_OPEN + PlaceholderCodec.MARKER_CLOSE + "]");

	@Nonnull
	private final String regex;

	PlaceholderGrammar(@Nonnull String regex) {
		this.regex = regex;
	}

	@Nonnull
	public String getRegex() {
		return this.regex;
	}

	/**
	 * Compiles all grammars into one alternation, one capturing group per grammar in priority order.
	 *
	 * @return combined pattern; group `ordinal() + 1` identifies the matching grammar
	 */
	@Nonnull
	static Pattern combinedPattern() {
		final StringBuilder sb = new StringBuilder();
		for (final PlaceholderGrammar grammar : values()) {
			if (sb.length() > 0) {
				sb.append('|');
			}
			sb.append('(').append(grammar.regex).append(')');
		}
		return Pattern.compile(sb.toString());
	}
}
