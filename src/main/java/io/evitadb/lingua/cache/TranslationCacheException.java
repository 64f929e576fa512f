package io.evitadb.lingua.cache;

import javax.annotation.Nonnull;

/**
 * Raised when the cache storage cannot be read or written.
 */
public final class TranslationCacheException extends RuntimeException {

	public TranslationCacheException(@Nonnull String message, @Nonnull Throwable cause) {
		super(message, cause);
	}
}
