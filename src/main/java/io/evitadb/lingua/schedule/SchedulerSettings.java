package io.evitadb.lingua.schedule;

/**
 * Sizes and limits of the two-level scheduling.
 *
 * @param batchSize         leaves per inner batch
 * @param superBatchSize    leaves per super-batch
 * @param outerConcurrency  super-batches running at the same time
 * @param innerConcurrency  inner batches running at the same time within one super-batch
 * @param cacheEnabled      when false, cache lookups are skipped; results are still stored
 */
public record SchedulerSettings(
	int batchSize,
	int superBatchSize,
	int outerConcurrency,
	int innerConcurrency,
	boolean cacheEnabled
) {

	public SchedulerSettings {
		requirePositive(batchSize, "batchSize");
		requirePositive(superBatchSize, "superBatchSize");
		requirePositive(outerConcurrency, "outerConcurrency");
		requirePositive(innerConcurrency, "innerConcurrency");
	}

	/**
	 * Returns the number of super-batches for the given number of leaves.
	 *
	 * @param leafCount number of leaves
	 * @return `ceil(leafCount / superBatchSize)`
	 */
	public int superBatchCount(int leafCount) {
		return (leafCount + this.superBatchSize - 1) / this.superBatchSize;
	}

	/**
	 * Returns the upper bound of simultaneous provider calls for the given number of leaves:
	 * `min(outerConcurrency, superBatchCount) * innerConcurrency`.
	 *
	 * @param leafCount number of leaves
	 * @return maximum number of concurrently running workers
	 */
	public int effectiveConcurrency(int leafCount) {
		return Math.min(this.outerConcurrency, superBatchCount(leafCount)) * this.innerConcurrency;
	}

	private static void requirePositive(int value, String name) {
		if (value < 1) {
			throw new IllegalArgumentException(name + " must be at least 1, got " + value);
		}
	}
}
