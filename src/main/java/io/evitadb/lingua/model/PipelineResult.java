package io.evitadb.lingua.model;

import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Translation of one input document into one target language.
 *
 * @param sourceLanguage resolved source language, configured or detected
 * @param targetLanguage target language
 * @param document       translated document, same shape as the input
 * @param sourceSnapshot the input document this translation was produced from, kept for diff mode;
 *                       leaves whose translation failed are null
 * @param summary        counters of the run
 * @param issues         per-leaf failures and warnings in document order
 */
public record PipelineResult(
	@Nonnull Language sourceLanguage,
	@Nonnull Language targetLanguage,
	@Nonnull JsonNode document,
	@Nonnull JsonNode sourceSnapshot,
	@Nonnull TranslationSummary summary,
	@Nonnull List<LeafIssue> issues
) {

	public PipelineResult {
		Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null");
		Objects.requireNonNull(targetLanguage, "targetLanguage must not be null");
		Objects.requireNonNull(document, "document must not be null");
		Objects.requireNonNull(sourceSnapshot, "sourceSnapshot must not be null");
		Objects.requireNonNull(summary, "summary must not be null");
		issues = List.copyOf(issues);
	}
}
