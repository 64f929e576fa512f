package io.evitadb.lingua.placeholder;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Result of {@link PlaceholderCodec#protect(String)}.
 *
 * @param strippedText text with every token replaced by a positional marker
 * @param tokens       extracted tokens in left-to-right order
 */
public record ProtectedText(
	@Nonnull String strippedText,
	@Nonnull List<PlaceholderToken> tokens
) {

	public ProtectedText {
		Objects.requireNonNull(strippedText, "strippedText must not be null");
		tokens = List.copyOf(tokens);
	}

	public boolean hasTokens() {
		return !this.tokens.isEmpty();
	}
}
