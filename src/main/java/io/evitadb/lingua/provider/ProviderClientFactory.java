package io.evitadb.lingua.provider;

import javax.annotation.Nonnull;

/**
 * Creates independent {@link ProviderClient} instances, one per worker.
 */
@FunctionalInterface
public interface ProviderClientFactory {

	/**
	 * Creates a new client that shares no mutable state with previously created clients.
	 *
	 * @return fresh client
	 */
	@Nonnull
	ProviderClient create();
}
