package io.evitadb.lingua.glossary;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.evitadb.lingua.model.ConfigurationException;
import io.evitadb.lingua.model.Language;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads glossary rules from a JSON file of the form:
 *
 * ```json
 * {
 *   "es": { "car": "coche", "sign in": "iniciar sesión" },
 *   "de": { "Login": "Anmeldung" }
 * }
 * ```
 *
 * Top-level keys are target language codes, member order inside each language is the rule order.
 */
public final class GlossaryLoader {

	@Nonnull
	private final ObjectMapper objectMapper;

	public GlossaryLoader(@Nonnull ObjectMapper objectMapper) {
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
	}

	/**
	 * Loads the glossary file.
	 *
	 * @param file glossary JSON file
	 * @return rules per target language, in declaration order
	 * @throws IOException            when the file cannot be read or parsed
	 * @throws ConfigurationException when the structure is invalid or a language code is unknown
	 */
	@Nonnull
	public Map<Language, List<GlossaryRule>> load(@Nonnull Path file) throws IOException, ConfigurationException {
		Objects.requireNonNull(file, "file must not be null");
		if (!Files.isRegularFile(file)) {
			throw new ConfigurationException("Glossary file does not exist: " + file);
		}
		return parse(this.objectMapper.readTree(file.toFile()), file.toString());
	}

	/**
	 * Converts an already parsed glossary document.
	 *
	 * @param root   parsed glossary
	 * @param source description of the origin used in error messages
	 * @return rules per target language, in declaration order
	 * @throws ConfigurationException when the structure is invalid or a language code is unknown
	 */
	@Nonnull
	public Map<Language, List<GlossaryRule>> parse(@Nonnull JsonNode root, @Nonnull String source)
		throws ConfigurationException {
		if (!root.isObject()) {
			throw new ConfigurationException("Glossary " + source + " must be a JSON object keyed by language code");
		}
		final Map<Language, List<GlossaryRule>> result = new EnumMap<>(Language.class);
		final Iterator<Map.Entry<String, JsonNode>> languages = root.fields();
		while (languages.hasNext()) {
			final Map.Entry<String, JsonNode> entry = languages.next();
			final Language language = Language.fromCode(entry.getKey())
				.orElseThrow(() -> new ConfigurationException(
					"Unknown language '" + entry.getKey() + "' in glossary " + source
				));
			if (!entry.getValue().isObject()) {
				throw new ConfigurationException(
					"Glossary entries for '" + entry.getKey() + "' in " + source + " must be an object of term pairs"
				);
			}
			final List<GlossaryRule> rules = new ArrayList<>();
			final Iterator<Map.Entry<String, JsonNode>> terms = entry.getValue().fields();
			while (terms.hasNext()) {
				final Map.Entry<String, JsonNode> term = terms.next();
				if (!term.getValue().isTextual() || term.getKey().isBlank()) {
					throw new ConfigurationException(
						"Invalid glossary term '" + term.getKey() + "' for '" + entry.getKey() + "' in " + source
					);
				}
				rules.add(new GlossaryRule(term.getKey(), term.getValue().textValue()));
			}
			result.put(language, Collections.unmodifiableList(rules));
		}
		return result;
	}
}
