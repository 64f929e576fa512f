package io.evitadb.lingua.glossary;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Term substitution enforced on translated text. The source term is matched case-insensitively
 * at whole-word boundaries, where letters, digits and `_` count as word characters.
 *
 * @param sourceTerm term to look for in the translated text
 * @param targetTerm term to put in its place
 */
public record GlossaryRule(
	@Nonnull String sourceTerm,
	@Nonnull String targetTerm
) {

	public GlossaryRule {
		Objects.requireNonNull(sourceTerm, "sourceTerm must not be null");
		Objects.requireNonNull(targetTerm, "targetTerm must not be null");
		if (sourceTerm.isBlank()) {
			throw new IllegalArgumentException("sourceTerm must not be blank");
		}
	}

	/**
	 * Compiles the whole-word, case-insensitive matcher for the source term.
	 *
	 * @return compiled pattern
	 */
	@Nonnull
	Pattern toPattern() {
		return Pattern.compile(
			"(?<![\\p{L}\\p{N}_])" + Pattern.quote(this.sourceTerm) + "(?![\\p{L}\\p{N}_])",
			Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
		);
	}
}
