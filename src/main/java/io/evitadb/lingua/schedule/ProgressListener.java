package io.evitadb.lingua.schedule;

/**
 * Receives progress of a scheduling run. Called from worker threads, possibly concurrently, so
 * implementations must be thread safe. Progress is informational only.
 */
@FunctionalInterface
public interface ProgressListener {

	ProgressListener NONE = (completed, total) -> {
	};

	/**
	 * Called after each finished leaf.
	 *
	 * @param completed leaves finished so far, taken from a shared atomic counter
	 * @param total     leaves in the run
	 */
	void onProgress(int completed, int total);
}
