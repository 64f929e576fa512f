package io.evitadb.lingua.schedule;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Result of scheduling one leaf text.
 *
 * @param text   translated text, or the original text when the provider failed
 * @param origin where the text came from
 * @param error  provider error message for {@link Origin#FALLBACK}, null otherwise
 */
public record LeafOutcome(
	@Nonnull String text,
	@Nonnull Origin origin,
	@Nullable String error
) {

	public LeafOutcome {
		Objects.requireNonNull(text, "text must not be null");
		Objects.requireNonNull(origin, "origin must not be null");
	}

	@Nonnull
	static LeafOutcome cached(@Nonnull String text) {
		return new LeafOutcome(text, Origin.CACHE, null);
	}

	@Nonnull
	static LeafOutcome translated(@Nonnull String text) {
		return new LeafOutcome(text, Origin.PROVIDER, null);
	}

	@Nonnull
	static LeafOutcome fallback(@Nonnull String originalText, @Nonnull String error) {
		return new LeafOutcome(originalText, Origin.FALLBACK, error);
	}

	/**
	 * Returns the outcome handed to a later occurrence of the same text within one run.
	 *
	 * @return outcome with {@link Origin#REUSED} in place of {@link Origin#PROVIDER}
	 */
	@Nonnull
	LeafOutcome forDuplicate() {
		return this.origin == Origin.PROVIDER ? new LeafOutcome(this.text, Origin.REUSED, null) : this;
	}

	public boolean isFailure() {
		return this.origin == Origin.FALLBACK;
	}

	/**
	 * Source of a leaf's text.
	 */
	public enum Origin {
		/** Read from the translation cache. */
		CACHE,
		/** Translated by a provider call made for this leaf. */
		PROVIDER,
		/** Taken from an identical text translated earlier in the same run. */
		REUSED,
		/** Original text kept because the provider failed. */
		FALLBACK
	}
}
