package io.evitadb.lingua.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Language should resolve supported language codes")
class LanguageTest {

	@Test
	@DisplayName("looks up codes ignoring case and separator style")
	void shouldLookUpCodes() {
		assertEquals(Optional.of(Language.SPANISH), Language.fromCode("es"));
		assertEquals(Optional.of(Language.SPANISH), Language.fromCode("ES"));
		assertEquals(Optional.of(Language.CHINESE_SIMPLIFIED), Language.fromCode("zh-cn"));
		assertEquals(Optional.of(Language.CHINESE_SIMPLIFIED), Language.fromCode("zh_CN"));
		assertEquals(Optional.empty(), Language.fromCode("xx"));
		assertEquals(Optional.empty(), Language.fromCode(null));
		assertEquals(Optional.empty(), Language.fromCode(" "));
	}

	@Test
	@DisplayName("sorts by display name")
	void shouldSortByDisplayName() {
		final List<Language> sorted = Language.sortedByDisplayName();

		assertEquals(18, sorted.size());
		assertEquals(Language.ARABIC, sorted.get(0));
		assertEquals(Language.VIETNAMESE, sorted.get(sorted.size() - 1));
	}

	@Test
	@DisplayName("renders name and code")
	void shouldRenderToString() {
		assertEquals("Chinese (Simplified) (zh-CN)", Language.CHINESE_SIMPLIFIED.toString());
	}
}
