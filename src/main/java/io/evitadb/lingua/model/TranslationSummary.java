package io.evitadb.lingua.model;

import javax.annotation.Nonnull;

/**
 * Immutable record containing summary statistics for the translation of one document into one
 * target language. Used to report the overall results of a translation run.
 *
 * @param leafCount     number of translatable leaves in the document
 * @param reusedCount   number of leaves copied from the previous output in diff mode
 * @param cacheHits     number of leaves served without calling the provider
 * @param providerCalls number of calls made to the translation provider
 * @param failedCount   number of leaves that kept their original text because the provider failed
 * @param warningCount  number of leaves whose placeholder markers did not survive translation intact
 */
public record TranslationSummary(
	int leafCount,
	int reusedCount,
	int cacheHits,
	int providerCalls,
	int failedCount,
	int warningCount
) {

	/**
	 * Creates an empty summary with all counts at zero.
	 *
	 * @return an empty TranslationSummary
	 */
	@Nonnull
	public static TranslationSummary empty() {
		return new TranslationSummary(0, 0, 0, 0, 0, 0);
	}

	/**
	 * Returns the number of leaves that went through the scheduler (everything not reused).
	 *
	 * @return scheduled leaf count
	 */
	public int getScheduledCount() {
		return this.leafCount - this.reusedCount;
	}

	/**
	 * Returns true if any leaf fell back to its original text.
	 *
	 * @return true if at least one failure occurred
	 */
	public boolean hasFailures() {
		return this.failedCount > 0;
	}

	/**
	 * Returns true if any placeholder warning was recorded.
	 *
	 * @return true if at least one warning occurred
	 */
	public boolean hasWarnings() {
		return this.warningCount > 0;
	}

	/**
	 * Creates a new summary by adding the counts from another summary.
	 *
	 * @param other the summary to add
	 * @return a new combined TranslationSummary
	 */
	@Nonnull
	public TranslationSummary add(@Nonnull TranslationSummary other) {
		return new TranslationSummary(
			this.leafCount + other.leafCount,
			this.reusedCount + other.reusedCount,
			this.cacheHits + other.cacheHits,
			this.providerCalls + other.providerCalls,
			this.failedCount + other.failedCount,
			this.warningCount + other.warningCount
		);
	}

	@Override
	public String toString() {
		return String.format(
			"TranslationSummary[leaves=%d, reused=%d, cacheHits=%d, providerCalls=%d, failed=%d, warnings=%d]",
			this.leafCount, this.reusedCount, this.cacheHits, this.providerCalls,
			this.failedCount, this.warningCount
		);
	}
}
