package io.evitadb.lingua.tree;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A translatable string found in a document.
 *
 * @param path location of the string in the document
 * @param text the string value
 */
public record Leaf(
	@Nonnull LeafPath path,
	@Nonnull String text
) {

	public Leaf {
		Objects.requireNonNull(path, "path must not be null");
		Objects.requireNonNull(text, "text must not be null");
	}
}
