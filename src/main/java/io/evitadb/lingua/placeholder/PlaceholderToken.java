package io.evitadb.lingua.placeholder;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A protected substring found in a text.
 *
 * @param text    the exact source substring, restored verbatim after translation
 * @param grammar the grammar that matched it
 * @param start   start offset in the scanned text (inclusive)
 * @param end     end offset in the scanned text (exclusive)
 */
public record PlaceholderToken(
	@Nonnull String text,
	@Nonnull PlaceholderGrammar grammar,
	int start,
	int end
) {

	public PlaceholderToken {
		Objects.requireNonNull(text, "text must not be null");
		Objects.requireNonNull(grammar, "grammar must not be null");
	}

	/**
	 * Returns true when the token overlaps the range `[from, to)`.
	 *
	 * @param from range start, inclusive
	 * @param to   range end, exclusive
	 * @return true on overlap
	 */
	public boolean overlaps(int from, int to) {
		return from < this.end && this.start < to;
	}
}
