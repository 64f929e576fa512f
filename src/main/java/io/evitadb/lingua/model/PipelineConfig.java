package io.evitadb.lingua.model;

import io.evitadb.lingua.glossary.GlossaryRule;
import io.evitadb.lingua.schedule.ProgressListener;
import io.evitadb.lingua.schedule.SchedulerSettings;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable configuration of one translation run, created by {@link #builder()}.
 *
 * Language codes are kept as given and resolved by {@link #validate()}, so an unknown code is
 * reported as a {@link ConfigurationException} rather than failing while the config is built.
 */
public final class PipelineConfig {

	public static final int DEFAULT_BATCH_SIZE = 10;
	public static final int DEFAULT_SUPER_BATCH_SIZE = 100;
	public static final int DEFAULT_OUTER_CONCURRENCY = 2;
	public static final int DEFAULT_INNER_CONCURRENCY = 4;

	@Nullable
	private final String sourceLanguage;
	@Nonnull
	private final List<String> targets;
	private final int batchSize;
	private final int superBatchSize;
	private final int outerConcurrency;
	private final int innerConcurrency;
	private final boolean cacheEnabled;
	private final boolean diffMode;
	@Nonnull
	private final Map<Language, List<GlossaryRule>> glossary;
	@Nonnull
	private final ProgressListener progressListener;

	private PipelineConfig(@Nonnull Builder builder) {
		this.sourceLanguage = builder.sourceLanguage == null || builder.sourceLanguage.isBlank()
			? null : builder.sourceLanguage.strip();
		this.targets = List.copyOf(builder.targets);
		this.batchSize = builder.batchSize;
		this.superBatchSize = builder.superBatchSize;
		this.outerConcurrency = builder.outerConcurrency;
		this.innerConcurrency = builder.innerConcurrency;
		this.cacheEnabled = builder.cacheEnabled;
		this.diffMode = builder.diffMode;
		final Map<Language, List<GlossaryRule>> glossaryCopy = new EnumMap<>(Language.class);
		builder.glossary.forEach((language, rules) -> glossaryCopy.put(language, List.copyOf(rules)));
		this.glossary = Collections.unmodifiableMap(glossaryCopy);
		this.progressListener = builder.progressListener;
	}

	@Nonnull
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Checks the configuration. Called before any work is dispatched.
	 *
	 * @throws ConfigurationException when a size or concurrency is not positive, no target is given,
	 *                                or a language code is unknown
	 */
	public void validate() throws ConfigurationException {
		requirePositive(this.batchSize, "batchSize");
		requirePositive(this.superBatchSize, "superBatchSize");
		requirePositive(this.outerConcurrency, "outerConcurrency");
		requirePositive(this.innerConcurrency, "innerConcurrency");
		getSourceLanguage();
		getTargetLanguages();
	}

	/**
	 * Returns the explicitly configured source language.
	 *
	 * @return the language, or empty when it is to be detected
	 * @throws ConfigurationException when the configured code is unknown
	 */
	@Nonnull
	public Optional<Language> getSourceLanguage() throws ConfigurationException {
		if (this.sourceLanguage == null) {
			return Optional.empty();
		}
		return Optional.of(resolve(this.sourceLanguage, "source"));
	}

	/**
	 * Returns the target languages in configured order, duplicates removed.
	 *
	 * @return target languages, never empty
	 * @throws ConfigurationException when no target is configured or a code is unknown
	 */
	@Nonnull
	public List<Language> getTargetLanguages() throws ConfigurationException {
		if (this.targets.isEmpty()) {
			throw new ConfigurationException("At least one target language must be configured");
		}
		final Set<Language> languages = new LinkedHashSet<>();
		for (final String target : this.targets) {
			languages.add(resolve(target, "target"));
		}
		return new ArrayList<>(languages);
	}

	@Nonnull
	public SchedulerSettings toSchedulerSettings() {
		return new SchedulerSettings(
			this.batchSize, this.superBatchSize, this.outerConcurrency, this.innerConcurrency, this.cacheEnabled
		);
	}

	/**
	 * Returns the glossary rules for one target language.
	 *
	 * @param target target language
	 * @return rules in declaration order, empty when there are none
	 */
	@Nonnull
	public List<GlossaryRule> getGlossaryRules(@Nonnull Language target) {
		return this.glossary.getOrDefault(target, List.of());
	}

	@Nonnull
	public List<String> getTargets() {
		return this.targets;
	}

	public int getBatchSize() {
		return this.batchSize;
	}

	public int getSuperBatchSize() {
		return this.superBatchSize;
	}

	public int getOuterConcurrency() {
		return this.outerConcurrency;
	}

	public int getInnerConcurrency() {
		return this.innerConcurrency;
	}

	public boolean isCacheEnabled() {
		return this.cacheEnabled;
	}

	public boolean isDiffMode() {
		return this.diffMode;
	}

	@Nonnull
	public Map<Language, List<GlossaryRule>> getGlossary() {
		return this.glossary;
	}

	@Nonnull
	public ProgressListener getProgressListener() {
		return this.progressListener;
	}

	@Nonnull
	private static Language resolve(@Nonnull String code, @Nonnull String role) throws ConfigurationException {
		return Language.fromCode(code).orElseThrow(() -> new ConfigurationException(
			"Unknown " + role + " language '" + code + "'. Use list-languages to see the supported codes"
		));
	}

	private static void requirePositive(int value, @Nonnull String name) throws ConfigurationException {
		if (value < 1) {
			throw new ConfigurationException(name + " must be at least 1, got " + value);
		}
	}

	/**
	 * Builder of {@link PipelineConfig}. Not thread safe.
	 */
	public static final class Builder {
		@Nullable
		private String sourceLanguage;
		@Nonnull
		private List<String> targets = List.of();
		private int batchSize = DEFAULT_BATCH_SIZE;
		private int superBatchSize = DEFAULT_SUPER_BATCH_SIZE;
		private int outerConcurrency = DEFAULT_OUTER_CONCURRENCY;
		private int innerConcurrency = DEFAULT_INNER_CONCURRENCY;
		private boolean cacheEnabled = true;
		private boolean diffMode;
		@Nonnull
		private Map<Language, List<GlossaryRule>> glossary = Map.of();
		@Nonnull
		private ProgressListener progressListener = ProgressListener.NONE;

		private Builder() {
		}

		/** Source language code, null or blank to detect it from the document. */
		@Nonnull
		public Builder sourceLanguage(@Nullable String sourceLanguage) {
			this.sourceLanguage = sourceLanguage;
			return this;
		}

		@Nonnull
		public Builder targets(@Nonnull List<String> targets) {
			this.targets = Objects.requireNonNull(targets, "targets must not be null");
			return this;
		}

		@Nonnull
		public Builder targets(@Nonnull String... targets) {
			return targets(List.of(targets));
		}

		@Nonnull
		public Builder batchSize(int batchSize) {
			this.batchSize = batchSize;
			return this;
		}

		@Nonnull
		public Builder superBatchSize(int superBatchSize) {
			this.superBatchSize = superBatchSize;
			return this;
		}

		@Nonnull
		public Builder outerConcurrency(int outerConcurrency) {
			this.outerConcurrency = outerConcurrency;
			return this;
		}

		@Nonnull
		public Builder innerConcurrency(int innerConcurrency) {
			this.innerConcurrency = innerConcurrency;
			return this;
		}

		@Nonnull
		public Builder cacheEnabled(boolean cacheEnabled) {
			this.cacheEnabled = cacheEnabled;
			return this;
		}

		/** Reuse translations of unchanged leaves from previous runs. */
		@Nonnull
		public Builder diffMode(boolean diffMode) {
			this.diffMode = diffMode;
			return this;
		}

		@Nonnull
		public Builder glossary(@Nonnull Map<Language, List<GlossaryRule>> glossary) {
			this.glossary = Objects.requireNonNull(glossary, "glossary must not be null");
			return this;
		}

		@Nonnull
		public Builder progressListener(@Nonnull ProgressListener progressListener) {
			this.progressListener = Objects.requireNonNull(progressListener, "progressListener must not be null");
			return this;
		}

		@Nonnull
		public PipelineConfig build() {
			return new PipelineConfig(this);
		}
	}
}
