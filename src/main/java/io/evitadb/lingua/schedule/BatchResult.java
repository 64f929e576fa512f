package io.evitadb.lingua.schedule;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Outcomes of a scheduling run.
 *
 * @param outcomes      one outcome per input text, at the input text's index
 * @param cacheHits     leaves served without a provider call (cache or earlier identical text)
 * @param providerCalls provider calls made
 * @param failures      leaves that kept their original text
 */
public record BatchResult(
	@Nonnull List<LeafOutcome> outcomes,
	int cacheHits,
	int providerCalls,
	int failures
) {

	public BatchResult {
		outcomes = List.copyOf(outcomes);
	}

	@Nonnull
	public static BatchResult empty() {
		return new BatchResult(List.of(), 0, 0, 0);
	}
}
