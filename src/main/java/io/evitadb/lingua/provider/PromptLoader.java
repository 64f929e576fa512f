package io.evitadb.lingua.provider;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads prompt templates from `META-INF/prompts/` on the classpath and fills in `{{name}}` variables.
 * Loaded templates are kept in memory; one loader may be shared by all provider clients.
 */
public final class PromptLoader {

	private static final String PROMPTS_PATH = "META-INF/prompts/";
	private static final Pattern VARIABLE_PATTERN = Pattern.compile("\\{\\{(\\w+)}}");

	private final Map<String, String> templates = new ConcurrentHashMap<>();

	/**
	 * Returns the raw template text.
	 *
	 * @param templateName file name under `META-INF/prompts/`
	 * @return template content with normalized `\n` line endings
	 * @throws IllegalArgumentException if the template is missing or unreadable
	 */
	@Nonnull
	public String load(@Nonnull String templateName) {
		Objects.requireNonNull(templateName, "templateName must not be null");
		return this.templates.computeIfAbsent(templateName, this::readTemplate);
	}

	/**
	 * Loads a template and substitutes its variables. Variables without a value stay as they are.
	 *
	 * @param templateName file name under `META-INF/prompts/`
	 * @param values       variable values by name
	 * @return rendered prompt
	 */
	@Nonnull
	public String render(@Nonnull String templateName, @Nonnull Map<String, String> values) {
		Objects.requireNonNull(values, "values must not be null");
		final Matcher matcher = VARIABLE_PATTERN.matcher(load(templateName));
		final StringBuilder result = new StringBuilder();
		while (matcher.find()) {
			final String value = values.get(matcher.group(1));
			matcher.appendReplacement(result, Matcher.quoteReplacement(value != null ? value : matcher.group()));
		}
		matcher.appendTail(result);
		return result.toString();
	}

	@Nonnull
	private String readTemplate(@Nonnull String templateName) {
		final String resourcePath = PROMPTS_PATH + templateName;
		try (InputStream inputStream = PromptLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
			if (inputStream == null) {
				throw new IllegalArgumentException("Prompt template not found: " + resourcePath);
			}
			final String content = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
			return content.replace("\r\n", "\n").strip();
		} catch (IOException e) {
			throw new IllegalArgumentException("Failed to read prompt template: " + resourcePath, e);
		}
	}
}
