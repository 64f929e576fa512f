package io.evitadb.lingua.provider;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;

import javax.annotation.Nonnull;
import java.util.Locale;
import java.util.Objects;

/**
 * Factory for LangChain4j ChatModel instances used as translation backends.
 * Supports OpenAI-compatible endpoints (OpenAI, Groq, Ollama, DeepSeek, etc.) and Anthropic.
 *
 * Every call builds a new model with its own HTTP client, so models handed to different workers
 * share nothing.
 */
public final class ChatModelFactory {

	// short UI strings translate best with deterministic sampling
	private static final double TEMPERATURE = 0.0;
	private static final String DEFAULT_OPENAI_MODEL = "gpt-4o-mini";
	private static final String DEFAULT_ANTHROPIC_MODEL = "claude-3-5-haiku-latest";

	public static final String PROVIDER_OPENAI = "openai";
	public static final String PROVIDER_ANTHROPIC = "anthropic";

	private ChatModelFactory() {
		// Utility class - prevent instantiation
	}

	/**
	 * Creates a ChatModel for the given settings.
	 *
	 * @param settings connection settings
	 * @return configured ChatModel instance
	 * @throws IllegalArgumentException if the provider is unknown or the URL is blank
	 */
	@Nonnull
	public static ChatModel create(@Nonnull LlmSettings settings) {
		Objects.requireNonNull(settings, "settings must not be null");
		if (settings.url().isBlank()) {
			throw new IllegalArgumentException("LLM url must not be blank");
		}

		final String baseUrl = normalizeUrl(settings.url());
		return switch (settings.provider().trim().toLowerCase(Locale.ROOT)) {
			case PROVIDER_OPENAI -> OpenAiChatModel.builder()
				.baseUrl(baseUrl)
				// some OpenAI-compatible servers reject requests without any key
				.apiKey(hasText(settings.token()) ? settings.token() : "none")
				.modelName(hasText(settings.model()) ? settings.model() : DEFAULT_OPENAI_MODEL)
				.timeout(settings.timeout())
				.maxRetries(settings.maxRetries())
				.temperature(TEMPERATURE)
				.logRequests(false)
				.logResponses(false)
				.build();
			case PROVIDER_ANTHROPIC -> {
				final AnthropicChatModel.AnthropicChatModelBuilder builder = AnthropicChatModel.builder()
					.baseUrl(baseUrl)
					.modelName(hasText(settings.model()) ? settings.model() : DEFAULT_ANTHROPIC_MODEL)
					.timeout(settings.timeout())
					.maxRetries(settings.maxRetries())
					.temperature(TEMPERATURE)
					.logRequests(false)
					.logResponses(false);
				if (hasText(settings.token())) {
					builder.apiKey(settings.token());
				}
				yield builder.build();
			}
			default -> throw new IllegalArgumentException(
				"Unknown provider: " + settings.provider() + ". Supported providers: " +
					PROVIDER_OPENAI + ", " + PROVIDER_ANTHROPIC
			);
		};
	}

	private static boolean hasText(String value) {
		return value != null && !value.isBlank();
	}

	@Nonnull
	private static String normalizeUrl(@Nonnull String url) {
		String normalized = url.trim();
		while (normalized.endsWith("/")) {
			normalized = normalized.substring(0, normalized.length() - 1);
		}
		return normalized;
	}
}
