package io.evitadb.lingua.tree;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LeafPath should identify document nodes")
class LeafPathTest {

	@Test
	@DisplayName("renders as JSON pointer with escaping")
	void shouldRenderPointer() {
		assertEquals("/", LeafPath.root().toString());
		assertEquals("/menu/items/0/label", LeafPath.of("menu", "items", 0, "label").toString());
		assertEquals("/a~1b/c~0d", LeafPath.of("a/b", "c~d").toString());
	}

	@Test
	@DisplayName("distinguishes string keys from indices")
	void shouldDistinguishKeyFromIndex() {
		assertNotEquals(LeafPath.of("0"), LeafPath.of(0));
		assertEquals(LeafPath.root().child("a").child(1), LeafPath.of("a", 1));
		assertEquals(LeafPath.of("a", 1).hashCode(), LeafPath.root().child("a").child(1).hashCode());
	}

	@Test
	@DisplayName("detects ancestors")
	void shouldDetectAncestors() {
		final LeafPath leaf = LeafPath.of("menu", "items", 2);

		assertTrue(leaf.startsWith(LeafPath.of("menu")));
		assertTrue(leaf.startsWith(leaf));
		assertTrue(leaf.startsWith(LeafPath.root()));
		assertFalse(LeafPath.of("menu").startsWith(leaf));
		assertEquals(3, leaf.depth());
	}

	@Test
	@DisplayName("rejects invalid segments")
	void shouldRejectInvalidSegments() {
		assertThrows(IllegalArgumentException.class, () -> LeafPath.of(-1));
		assertThrows(IllegalArgumentException.class, () -> LeafPath.of(1.5));
	}
}
