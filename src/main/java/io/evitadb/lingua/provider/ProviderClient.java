package io.evitadb.lingua.provider;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;

/**
 * One connection to a remote translation service.
 *
 * Instances are not required to be thread safe. Every concurrent worker obtains its own instance
 * from a {@link ProviderClientFactory} and never shares it.
 */
public interface ProviderClient {

	/**
	 * Translates a single text.
	 *
	 * @param text       text to translate, placeholders already replaced by markers
	 * @param sourceLang source language code
	 * @param targetLang target language code
	 * @return the translated text
	 * @throws ProviderException on network, rate-limit or service failure
	 */
	@Nonnull
	String translate(@Nonnull String text, @Nonnull String sourceLang, @Nonnull String targetLang)
		throws ProviderException;

	/**
	 * Detects the language of the given samples. Best effort: failures and inconclusive answers
	 * yield empty instead of an exception.
	 *
	 * @param sampleTexts texts from the document
	 * @return detected language code, or empty when unknown
	 */
	@Nonnull
	Optional<String> detectLanguage(@Nonnull List<String> sampleTexts);
}
