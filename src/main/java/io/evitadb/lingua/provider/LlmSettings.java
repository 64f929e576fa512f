package io.evitadb.lingua.provider;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings of the LLM used as translation provider.
 *
 * @param provider   provider name, see {@link ChatModelFactory#PROVIDER_OPENAI} and {@link ChatModelFactory#PROVIDER_ANTHROPIC}
 * @param url        base URL of the endpoint
 * @param token      API key, may be null for local endpoints
 * @param model      model name, null selects the provider default
 * @param timeout    timeout of a single request
 * @param maxRetries retries LangChain4j performs on transient failures
 */
public record LlmSettings(
	@Nonnull String provider,
	@Nonnull String url,
	@Nullable String token,
	@Nullable String model,
	@Nonnull Duration timeout,
	int maxRetries
) {

	public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
	public static final int DEFAULT_MAX_RETRIES = 3;

	public LlmSettings {
		Objects.requireNonNull(provider, "provider must not be null");
		Objects.requireNonNull(url, "url must not be null");
		Objects.requireNonNull(timeout, "timeout must not be null");
		if (maxRetries < 0) {
			throw new IllegalArgumentException("maxRetries must not be negative");
		}
	}

	/**
	 * Creates settings with default timeout and retry count.
	 */
	public LlmSettings(@Nonnull String provider, @Nonnull String url, @Nullable String token, @Nullable String model) {
		this(provider, url, token, model, DEFAULT_TIMEOUT, DEFAULT_MAX_RETRIES);
	}
}
