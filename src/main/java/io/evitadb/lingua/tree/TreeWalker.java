package io.evitadb.lingua.tree;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Walks a JSON document, extracting the translatable string leaves and building translated copies.
 *
 * - Leaves are visited depth-first in document order: object members in their declared order,
 *   array elements by index.
 * - Only non-blank strings are leaves. Blank strings, numbers, booleans and nulls are never
 *   extracted and are copied unchanged on reassembly.
 * - The input document is never modified; {@link #reassemble(JsonNode, Map)} builds a new tree.
 */
public final class TreeWalker {

	@Nonnull
	private final JsonNodeFactory nodeFactory;

	public TreeWalker() {
		this(JsonNodeFactory.instance);
	}

	public TreeWalker(@Nonnull JsonNodeFactory nodeFactory) {
		this.nodeFactory = Objects.requireNonNull(nodeFactory, "nodeFactory must not be null");
	}

	/**
	 * Extracts all translatable leaves of the document in document order.
	 *
	 * @param document the parsed document
	 * @return ordered list of leaves, paths are unique
	 */
	@Nonnull
	public List<Leaf> extract(@Nonnull JsonNode document) {
		Objects.requireNonNull(document, "document must not be null");
		final List<Leaf> leaves = new ArrayList<>();
		collect(document, LeafPath.root(), leaves);
		return leaves;
	}

	/**
	 * Collects up to `maxSamples` non-blank strings in document order, used for language detection.
	 *
	 * @param document   the parsed document
	 * @param maxSamples maximum number of samples
	 * @return sample texts
	 */
	@Nonnull
	public List<String> collectSamples(@Nonnull JsonNode document, int maxSamples) {
		final List<String> samples = new ArrayList<>(Math.max(0, maxSamples));
		for (final Leaf leaf : extract(document)) {
			if (samples.size() >= maxSamples) {
				break;
			}
			samples.add(leaf.text());
		}
		return samples;
	}

	/**
	 * Produces a copy of the document where each extracted leaf whose path is present in
	 * `translations` is replaced by the mapped text. Everything else, including leaves without
	 * a mapping, is copied unchanged; key order and array order are kept.
	 *
	 * @param document     the source document, not modified
	 * @param translations replacement texts by leaf path
	 * @return new document of identical shape
	 */
	@Nonnull
	public JsonNode reassemble(@Nonnull JsonNode document, @Nonnull Map<LeafPath, String> translations) {
		Objects.requireNonNull(document, "document must not be null");
		Objects.requireNonNull(translations, "translations must not be null");
		return rebuild(document, LeafPath.root(), path -> {
			final String translated = translations.get(path);
			return translated == null ? null : TextNode.valueOf(translated);
		});
	}

	/**
	 * Produces a copy of the document where the extracted leaves at the given paths are replaced
	 * by JSON null. The shape of the document is kept, so array lengths do not change.
	 *
	 * @param document the source document, not modified
	 * @param paths    paths of the leaves to clear
	 * @return new document of identical shape
	 */
	@Nonnull
	public JsonNode clearLeaves(@Nonnull JsonNode document, @Nonnull Set<LeafPath> paths) {
		Objects.requireNonNull(document, "document must not be null");
		Objects.requireNonNull(paths, "paths must not be null");
		return rebuild(document, LeafPath.root(), path -> paths.contains(path) ? NullNode.getInstance() : null);
	}

	/**
	 * Resolves the node at the given path.
	 *
	 * @param document the document
	 * @param path     path to resolve
	 * @return the node, or empty when any segment is missing or addresses the wrong container type
	 */
	@Nonnull
	public static Optional<JsonNode> nodeAt(@Nonnull JsonNode document, @Nonnull LeafPath path) {
		JsonNode current = document;
		for (final Object segment : path.segments()) {
			if (segment instanceof String key) {
				if (!current.isObject() || !current.has(key)) {
					return Optional.empty();
				}
				current = current.get(key);
			} else {
				final int index = (Integer) segment;
				if (!current.isArray() || index >= current.size()) {
					return Optional.empty();
				}
				current = current.get(index);
			}
		}
		return Optional.of(current);
	}

	/**
	 * Returns true when the node is a string that would be extracted as a leaf.
	 *
	 * @param node node to test
	 * @return true for non-blank textual nodes
	 */
	public static boolean isTranslatable(@Nonnull JsonNode node) {
		return node.isTextual() && !node.textValue().isBlank();
	}

	private void collect(@Nonnull JsonNode node, @Nonnull LeafPath path, @Nonnull List<Leaf> out) {
		if (node.isObject()) {
			final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
			while (fields.hasNext()) {
				final Map.Entry<String, JsonNode> field = fields.next();
				collect(field.getValue(), path.child(field.getKey()), out);
			}
		} else if (node.isArray()) {
			for (int i = 0; i < node.size(); i++) {
				collect(node.get(i), path.child(i), out);
			}
		} else if (isTranslatable(node)) {
			out.add(new Leaf(path, node.textValue()));
		}
	}

	@Nonnull
	private JsonNode rebuild(
		@Nonnull JsonNode node,
		@Nonnull LeafPath path,
		@Nonnull Function<LeafPath, JsonNode> replacement
	) {
		if (node.isObject()) {
			final ObjectNode copy = this.nodeFactory.objectNode();
			final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
			while (fields.hasNext()) {
				final Map.Entry<String, JsonNode> field = fields.next();
				copy.set(field.getKey(), rebuild(field.getValue(), path.child(field.getKey()), replacement));
			}
			return copy;
		} else if (node.isArray()) {
			final ArrayNode copy = this.nodeFactory.arrayNode(node.size());
			for (int i = 0; i < node.size(); i++) {
				copy.add(rebuild(node.get(i), path.child(i), replacement));
			}
			return copy;
		} else if (isTranslatable(node)) {
			final JsonNode replaced = replacement.apply(path);
			return replaced == null ? node : replaced;
		}
		// scalars are immutable in Jackson, sharing them is safe
		return node;
	}
}
