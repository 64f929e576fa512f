package io.evitadb.lingua.model;

import javax.annotation.Nonnull;

/**
 * Thrown when the translation run is misconfigured. It is always raised before any leaf is
 * dispatched to the provider, so no partial work exists when it is thrown.
 */
public final class ConfigurationException extends Exception {

	public ConfigurationException(@Nonnull String message) {
		super(message);
	}

	public ConfigurationException(@Nonnull String message, @Nonnull Throwable cause) {
		super(message, cause);
	}
}
