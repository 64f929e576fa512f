package io.evitadb.lingua.tree;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Identifies one node of a JSON document by the sequence of object keys and array indices
 * leading to it from the document root. Keys are held as {@link String}, indices as {@link Integer},
 * so the key `"0"` and the index `0` are different segments.
 *
 * Instances are immutable and usable as map keys.
 */
public final class LeafPath implements Comparable<LeafPath> {

	private static final LeafPath ROOT = new LeafPath(List.of());

	@Nonnull
	private final List<Object> segments;

	private LeafPath(@Nonnull List<Object> segments) {
		this.segments = segments;
	}

	/**
	 * Returns the path of the document root.
	 *
	 * @return root path with no segments
	 */
	@Nonnull
	public static LeafPath root() {
		return ROOT;
	}

	/**
	 * Creates a path from the given segments.
	 *
	 * @param segments object keys ({@link String}) and array indices ({@link Integer})
	 * @return new path
	 * @throws IllegalArgumentException when a segment is neither a string nor a non-negative integer
	 */
	@Nonnull
	public static LeafPath of(@Nonnull Object... segments) {
		final List<Object> list = new ArrayList<>(segments.length);
		for (final Object segment : segments) {
			list.add(checkSegment(segment));
		}
		return new LeafPath(Collections.unmodifiableList(list));
	}

	/**
	 * Returns a path extended by an object key.
	 *
	 * @param key object key
	 * @return child path
	 */
	@Nonnull
	public LeafPath child(@Nonnull String key) {
		return append(Objects.requireNonNull(key, "key must not be null"));
	}

	/**
	 * Returns a path extended by an array index.
	 *
	 * @param index array index
	 * @return child path
	 */
	@Nonnull
	public LeafPath child(int index) {
		return append(checkSegment(index));
	}

	/**
	 * Returns the segments of this path.
	 *
	 * @return unmodifiable segment list
	 */
	@Nonnull
	public List<Object> segments() {
		return this.segments;
	}

	public int depth() {
		return this.segments.size();
	}

	/**
	 * Returns true when this path equals `ancestor` or lies below it.
	 *
	 * @param ancestor candidate ancestor
	 * @return true if `ancestor` is a prefix of this path
	 */
	public boolean startsWith(@Nonnull LeafPath ancestor) {
		final List<Object> other = ancestor.segments;
		return other.size() <= this.segments.size() && this.segments.subList(0, other.size()).equals(other);
	}

	@Nonnull
	private LeafPath append(@Nonnull Object segment) {
		final List<Object> list = new ArrayList<>(this.segments.size() + 1);
		list.addAll(this.segments);
		list.add(segment);
		return new LeafPath(Collections.unmodifiableList(list));
	}

	@Nonnull
	private static Object checkSegment(Object segment) {
		if (segment instanceof String) {
			return segment;
		}
		if (segment instanceof Integer index && index >= 0) {
			return index;
		}
		throw new IllegalArgumentException("Path segment must be a key or a non-negative index: " + segment);
	}

	@Override
	public int compareTo(@Nonnull LeafPath o) {
		return toString().compareTo(o.toString());
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof LeafPath that)) {
			return false;
		}
		return this.segments.equals(that.segments);
	}

	@Override
	public int hashCode() {
		return this.segments.hashCode();
	}

	/**
	 * Renders the path as a JSON pointer (RFC 6901), e.g. `/menu/items/0/label`.
	 */
	@Override
	public String toString() {
		if (this.segments.isEmpty()) {
			return "/";
		}
		final StringBuilder sb = new StringBuilder();
		for (final Object segment : this.segments) {
			sb.append('/');
			sb.append(segment.toString().replace("~", "~0").replace("/", "~1"));
		}
		return sb.toString();
	}
}
