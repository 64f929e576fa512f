package io.evitadb.lingua.provider;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.evitadb.lingua.model.Language;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * {@link ProviderClient} that translates through a LangChain4j {@link ChatModel}.
 *
 * LangChain4j already retries transient failures with exponential backoff. This client adds:
 * - conversion of every LangChain4j failure into a {@link ProviderException}
 * - fast-fail after a {@link NonRetriableException} (authentication, invalid request): the remaining
 *   calls of this client fail immediately instead of repeating a request that cannot succeed
 * - preservation of the source's leading and trailing whitespace, which models tend to drop
 *
 * Not thread safe; each worker uses its own instance.
 */
public final class LlmProviderClient implements ProviderClient {

	static final String TRANSLATE_TEMPLATE = "translate-system.txt";
	static final String DETECT_TEMPLATE = "detect-language-system.txt";

	private static final Pattern LANGUAGE_CODE_PATTERN = Pattern.compile("\\b([a-zA-Z]{2,3}(?:[-_][a-zA-Z]{2,4})?)\\b");
	private static final Pattern LEADING_WHITESPACE = Pattern.compile("^\\s*");
	private static final Pattern TRAILING_WHITESPACE = Pattern.compile("\\s*$");

	@Nonnull
	private final ChatModel model;
	@Nonnull
	private final PromptLoader promptLoader;
	@Nullable
	private NonRetriableException permanentFailure;

	/**
	 * Creates a client over the given model.
	 *
	 * @param model        chat model, used by this client only
	 * @param promptLoader prompt template source
	 */
	public LlmProviderClient(@Nonnull ChatModel model, @Nonnull PromptLoader promptLoader) {
		this.model = Objects.requireNonNull(model, "model must not be null");
		this.promptLoader = Objects.requireNonNull(promptLoader, "promptLoader must not be null");
	}

	@Nonnull
	@Override
	public String translate(@Nonnull String text, @Nonnull String sourceLang, @Nonnull String targetLang)
		throws ProviderException {
		Objects.requireNonNull(text, "text must not be null");
		Objects.requireNonNull(sourceLang, "sourceLang must not be null");
		Objects.requireNonNull(targetLang, "targetLang must not be null");

		if (this.permanentFailure != null) {
			throw new ProviderException(
				"Provider client disabled after permanent failure: " + this.permanentFailure.getMessage(),
				this.permanentFailure,
				true
			);
		}

		final String systemPrompt = this.promptLoader.render(
			TRANSLATE_TEMPLATE,
			Map.of(
				"sourceLanguage", describe(sourceLang),
				"targetLanguage", describe(targetLang)
			)
		);
		final List<ChatMessage> messages = List.of(
			SystemMessage.from(systemPrompt),
			UserMessage.from(text)
		);

		final String answer = chat(messages);
		if (answer == null || answer.isBlank()) {
			throw new ProviderException("Provider returned an empty translation", null);
		}
		return leadingWhitespace(text) + answer.strip() + trailingWhitespace(text);
	}

	@Nonnull
	@Override
	public Optional<String> detectLanguage(@Nonnull List<String> sampleTexts) {
		Objects.requireNonNull(sampleTexts, "sampleTexts must not be null");
		if (sampleTexts.isEmpty() || this.permanentFailure != null) {
			return Optional.empty();
		}

		final String systemPrompt = this.promptLoader.render(
			DETECT_TEMPLATE,
			Map.of("languageCodes", Arrays.stream(Language.values())
				.map(Language::getCode)
				.collect(Collectors.joining(", ")))
		);
		final List<ChatMessage> messages = List.of(
			SystemMessage.from(systemPrompt),
			UserMessage.from(String.join("\n", sampleTexts))
		);

		try {
			return parseLanguageCode(chat(messages));
		} catch (ProviderException e) {
			// detection is best effort, the caller asks for an explicit source language instead
			return Optional.empty();
		}
	}

	/**
	 * Returns true once a non-retriable failure has disabled this client.
	 *
	 * @return true after a permanent failure
	 */
	public boolean hasPermanentFailure() {
		return this.permanentFailure != null;
	}

	@Nullable
	private String chat(@Nonnull List<ChatMessage> messages) throws ProviderException {
		try {
			final ChatResponse response = this.model.chat(messages);
			return response.aiMessage() == null ? null : response.aiMessage().text();
		} catch (NonRetriableException e) {
			this.permanentFailure = e;
			throw new ProviderException("Permanent provider failure: " + e.getMessage(), e, true);
		} catch (RuntimeException e) {
			// retriable errors arrive here only after LangChain4j exhausted its retries
			throw new ProviderException("Provider call failed: " + e.getMessage(), e);
		}
	}

	/**
	 * Extracts the first language code from a model answer.
	 *
	 * @param answer raw model answer
	 * @return the code, or empty when the answer is blank or says `unknown`
	 */
	@Nonnull
	static Optional<String> parseLanguageCode(@Nullable String answer) {
		if (answer == null || answer.isBlank()) {
			return Optional.empty();
		}
		final String trimmed = answer.strip();
		if (trimmed.toLowerCase(Locale.ROOT).startsWith("unknown")) {
			return Optional.empty();
		}
		final String bare = trimmed.replaceAll("^[\\p{Punct}\\s]+|[\\p{Punct}\\s]+$", "");
		if (LANGUAGE_CODE_PATTERN.matcher(bare).matches()) {
			return Optional.of(canonicalCode(bare));
		}
		// chatty answer, pick the first word that is a known code
		final Matcher matcher = LANGUAGE_CODE_PATTERN.matcher(trimmed);
		while (matcher.find()) {
			final Optional<Language> language = Language.fromCode(matcher.group(1));
			if (language.isPresent()) {
				return Optional.of(language.get().getCode());
			}
		}
		return Optional.empty();
	}

	@Nonnull
	private static String canonicalCode(@Nonnull String code) {
		final String normalized = code.replace('_', '-');
		return Language.fromCode(normalized).map(Language::getCode).orElse(normalized.toLowerCase(Locale.ROOT));
	}

	@Nonnull
	private static String describe(@Nonnull String languageCode) {
		return Language.fromCode(languageCode)
			.map(it -> it.getDisplayName() + " (" + it.getCode() + ")")
			.orElse(languageCode);
	}

	@Nonnull
	private static String leadingWhitespace(@Nonnull String text) {
		final Matcher matcher = LEADING_WHITESPACE.matcher(text);
		return matcher.find() ? matcher.group() : "";
	}

	@Nonnull
	private static String trailingWhitespace(@Nonnull String text) {
		if (text.isBlank()) {
			return "";
		}
		final Matcher matcher = TRAILING_WHITESPACE.matcher(text);
		return matcher.find() ? matcher.group() : "";
	}
}
