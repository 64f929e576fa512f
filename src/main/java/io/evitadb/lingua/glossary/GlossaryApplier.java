package io.evitadb.lingua.glossary;

import io.evitadb.lingua.placeholder.PlaceholderCodec;
import io.evitadb.lingua.placeholder.PlaceholderToken;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;

/**
 * Enforces glossary terminology on translated text.
 *
 * Rules run one after another in declaration order, each over the output of the previous one, so
 * a later rule may rewrite what an earlier rule produced. Within one rule, matches are replaced left
 * to right without overlapping. Matches that touch a placeholder token (`{{car}}`, `%(name)s`, ...)
 * are skipped so restored placeholders are never altered.
 */
public final class GlossaryApplier {

	@Nonnull
	private final PlaceholderCodec placeholderCodec;

	public GlossaryApplier(@Nonnull PlaceholderCodec placeholderCodec) {
		this.placeholderCodec = Objects.requireNonNull(placeholderCodec, "placeholderCodec must not be null");
	}

	/**
	 * Applies the rules to the text.
	 *
	 * @param translatedText text after placeholder restoration
	 * @param rules          rules in declaration order
	 * @return rewritten text
	 */
	@Nonnull
	public String apply(@Nonnull String translatedText, @Nonnull List<GlossaryRule> rules) {
		Objects.requireNonNull(translatedText, "translatedText must not be null");
		Objects.requireNonNull(rules, "rules must not be null");

		String result = translatedText;
		for (final GlossaryRule rule : rules) {
			result = applyRule(result, rule);
		}
		return result;
	}

	@Nonnull
	private String applyRule(@Nonnull String text, @Nonnull GlossaryRule rule) {
		final List<PlaceholderToken> tokens = this.placeholderCodec.findTokens(text);
		final Matcher matcher = rule.toPattern().matcher(text);
		final StringBuilder sb = new StringBuilder(text.length());
		int lastEnd = 0;
		boolean replaced = false;
		while (matcher.find()) {
			if (insideToken(tokens, matcher.start(), matcher.end())) {
				continue;
			}
			sb.append(text, lastEnd, matcher.start());
			sb.append(rule.targetTerm());
			lastEnd = matcher.end();
			replaced = true;
		}
		if (!replaced) {
			return text;
		}
		sb.append(text, lastEnd, text.length());
		return sb.toString();
	}

	private static boolean insideToken(@Nonnull List<PlaceholderToken> tokens, int start, int end) {
		for (final PlaceholderToken token : tokens) {
			if (token.overlaps(start, end)) {
				return true;
			}
		}
		return false;
	}
}
