package io.evitadb.lingua.cache;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Identity of a cache entry.
 *
 * @param sourceLang source language code
 * @param targetLang target language code
 * @param text       exact source text
 */
record CacheKey(
	@Nonnull String sourceLang,
	@Nonnull String targetLang,
	@Nonnull String text
) {

	CacheKey {
		Objects.requireNonNull(sourceLang, "sourceLang must not be null");
		Objects.requireNonNull(targetLang, "targetLang must not be null");
		Objects.requireNonNull(text, "text must not be null");
	}
}
