package io.evitadb.lingua.model;

import io.evitadb.lingua.tree.LeafPath;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Non-fatal problem recorded for a single leaf during a translation run.
 * The leaf still receives a value in the output document; the issue only explains why that
 * value may be degraded.
 *
 * @param path    path of the affected leaf
 * @param kind    what went wrong
 * @param message human readable detail
 */
public record LeafIssue(
	@Nonnull LeafPath path,
	@Nonnull Kind kind,
	@Nonnull String message
) {

	public LeafIssue {
		Objects.requireNonNull(path, "path must not be null");
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(message, "message must not be null");
	}

	/**
	 * Classification of per-leaf issues.
	 */
	public enum Kind {
		/** The provider failed and the original text was kept. */
		PROVIDER_FAILURE,
		/** The number of placeholder markers changed during translation. */
		PLACEHOLDER_MISMATCH
	}

	@Override
	public String toString() {
		return "[" + this.kind + "] " + this.path + ": " + this.message;
	}
}
