package io.evitadb.lingua.cache;

import javax.annotation.Nonnull;
import java.util.Optional;

/**
 * Persistent store of translations keyed by (source language, target language, exact source text).
 *
 * Implementations synchronize internally: any number of threads may call {@link #get} and
 * {@link #put} concurrently without external locking, and a `put` never blocks a `get`.
 * Entries are never changed once written and never expire.
 */
public interface TranslationCache extends AutoCloseable {

	/**
	 * Looks up a translation.
	 *
	 * @param sourceLang source language code
	 * @param targetLang target language code
	 * @param text       exact source text
	 * @return the stored translation or empty on a miss
	 * @throws TranslationCacheException when the underlying storage fails
	 */
	@Nonnull
	Optional<String> get(@Nonnull String sourceLang, @Nonnull String targetLang, @Nonnull String text);

	/**
	 * Stores a translation. Storing a key that already exists leaves the existing value in place,
	 * so repeated or concurrent puts of the same key are harmless.
	 *
	 * @param sourceLang     source language code
	 * @param targetLang     target language code
	 * @param text           exact source text
	 * @param translatedText translation to store
	 * @throws TranslationCacheException when the underlying storage fails
	 */
	void put(@Nonnull String sourceLang, @Nonnull String targetLang, @Nonnull String text, @Nonnull String translatedText);

	/**
	 * Releases the storage. Overridden to drop the checked exception of {@link AutoCloseable}.
	 *
	 * @throws TranslationCacheException when the storage cannot be closed cleanly
	 */
	@Override
	void close();
}
