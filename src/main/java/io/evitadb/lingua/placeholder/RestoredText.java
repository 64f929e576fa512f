package io.evitadb.lingua.placeholder;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Result of {@link PlaceholderCodec#restore(String, java.util.List)}.
 *
 * @param text           the text with markers replaced by tokens
 * @param markersFound   number of markers found in the translated text
 * @param tokensExpected number of tokens that were extracted before translation
 */
public record RestoredText(
	@Nonnull String text,
	int markersFound,
	int tokensExpected
) {

	public RestoredText {
		Objects.requireNonNull(text, "text must not be null");
	}

	/**
	 * Returns true when the provider dropped or duplicated markers, in which case only the first
	 * `min(markersFound, tokensExpected)` tokens were restored.
	 *
	 * @return true on marker count mismatch
	 */
	public boolean isMismatch() {
		return this.markersFound != this.tokensExpected;
	}
}
