package io.evitadb.lingua.diff;

import com.fasterxml.jackson.databind.JsonNode;
import io.evitadb.lingua.tree.Leaf;
import io.evitadb.lingua.tree.LeafPath;
import io.evitadb.lingua.tree.TreeWalker;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Selects the leaves of a new input document that need to be translated again, by comparing it
 * with the previous run.
 *
 * A previous run consists of the output document it produced and the source snapshot it was
 * produced from (see {@link PreviousRun}). The three trees are walked in lock-step by path and a
 * leaf of the new input is selected when:
 *
 * - its path is absent from the previous source or from the previous output,
 * - the previous source text at its path differs from the new text,
 * - the previous output value at its path is not a string,
 * - any ancestor diverged structurally: a container changed its type (object, array, scalar) or
 *   an array changed its length in either previous tree.
 *
 * Everything else is unchanged and reuses the previous output value verbatim.
 */
public final class DiffEngine {

	/**
	 * Returns the paths of all leaves in `newInput` that must be translated again.
	 *
	 * @param previous previous output and the source it was produced from
	 * @param newInput the new input document
	 * @return changed leaf paths, in document order
	 */
	@Nonnull
	public Set<LeafPath> selectChanged(@Nonnull PreviousRun previous, @Nonnull JsonNode newInput) {
		Objects.requireNonNull(previous, "previous must not be null");
		Objects.requireNonNull(newInput, "newInput must not be null");
		final Set<LeafPath> changed = new LinkedHashSet<>();
		walk(newInput, previous.source(), previous.output(), LeafPath.root(), false, changed);
		return changed;
	}

	/**
	 * Collects the previous output values of the leaves that are not changed.
	 *
	 * @param previous previous output and the source it was produced from
	 * @param leaves   all leaves of the new input
	 * @param changed  paths returned by {@link #selectChanged(PreviousRun, JsonNode)}
	 * @return previous translated text by path, for every leaf outside `changed`
	 */
	@Nonnull
	public Map<LeafPath, String> previousValues(
		@Nonnull PreviousRun previous,
		@Nonnull Collection<Leaf> leaves,
		@Nonnull Set<LeafPath> changed
	) {
		final Map<LeafPath, String> values = new LinkedHashMap<>();
		for (final Leaf leaf : leaves) {
			if (changed.contains(leaf.path())) {
				continue;
			}
			final JsonNode node = TreeWalker.nodeAt(previous.output(), leaf.path())
				.filter(JsonNode::isTextual)
				.orElseThrow(() -> new IllegalArgumentException(
					"Leaf " + leaf.path() + " is not changed but has no previous output value"
				));
			values.put(leaf.path(), node.textValue());
		}
		return values;
	}

	private static void walk(
		@Nonnull JsonNode node,
		@Nullable JsonNode previousSource,
		@Nullable JsonNode previousOutput,
		@Nonnull LeafPath path,
		boolean diverged,
		@Nonnull Set<LeafPath> changed
	) {
		if (node.isObject()) {
			final boolean subtreeDiverged = diverged ||
				!isObject(previousSource) || !isObject(previousOutput);
			final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
			while (fields.hasNext()) {
				final Map.Entry<String, JsonNode> field = fields.next();
				walk(
					field.getValue(),
					child(previousSource, field.getKey()),
					child(previousOutput, field.getKey()),
					path.child(field.getKey()),
					subtreeDiverged,
					changed
				);
			}
		} else if (node.isArray()) {
			final boolean subtreeDiverged = diverged ||
				!sameLengthArray(node, previousSource) || !sameLengthArray(node, previousOutput);
			for (int i = 0; i < node.size(); i++) {
				walk(
					node.get(i),
					child(previousSource, i),
					child(previousOutput, i),
					path.child(i),
					subtreeDiverged,
					changed
				);
			}
		} else if (TreeWalker.isTranslatable(node)) {
			final boolean unchanged = !diverged &&
				previousSource != null && previousSource.isTextual() &&
				previousSource.textValue().equals(node.textValue()) &&
				previousOutput != null && previousOutput.isTextual();
			if (!unchanged) {
				changed.add(path);
			}
		}
	}

	private static boolean isObject(@Nullable JsonNode node) {
		return node != null && node.isObject();
	}

	private static boolean sameLengthArray(@Nonnull JsonNode array, @Nullable JsonNode other) {
		return other != null && other.isArray() && other.size() == array.size();
	}

	@Nullable
	private static JsonNode child(@Nullable JsonNode parent, @Nonnull String key) {
		return parent != null && parent.isObject() ? parent.get(key) : null;
	}

	@Nullable
	private static JsonNode child(@Nullable JsonNode parent, int index) {
		return parent != null && parent.isArray() && index < parent.size() ? parent.get(index) : null;
	}
}
