package io.evitadb.lingua.provider;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Failure of a remote translation call. Callers contain it per string and keep the original text.
 */
public final class ProviderException extends Exception {

	private final boolean permanent;

	public ProviderException(@Nonnull String message, @Nullable Throwable cause, boolean permanent) {
		super(message, cause);
		this.permanent = permanent;
	}

	public ProviderException(@Nonnull String message, @Nullable Throwable cause) {
		this(message, cause, false);
	}

	/**
	 * Returns true when retrying with the same client cannot succeed (invalid credentials,
	 * invalid request).
	 *
	 * @return true for permanent failures
	 */
	public boolean isPermanent() {
		return this.permanent;
	}
}
