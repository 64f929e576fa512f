package io.evitadb.lingua;

import com.fasterxml.jackson.databind.JsonNode;
import io.evitadb.lingua.cache.TranslationCache;
import io.evitadb.lingua.diff.DiffEngine;
import io.evitadb.lingua.diff.PreviousRun;
import io.evitadb.lingua.glossary.GlossaryApplier;
import io.evitadb.lingua.glossary.GlossaryRule;
import io.evitadb.lingua.model.ConfigurationException;
import io.evitadb.lingua.model.Language;
import io.evitadb.lingua.model.LeafIssue;
import io.evitadb.lingua.model.PipelineConfig;
import io.evitadb.lingua.model.PipelineResult;
import io.evitadb.lingua.model.TranslationSummary;
import io.evitadb.lingua.placeholder.PlaceholderCodec;
import io.evitadb.lingua.placeholder.ProtectedText;
import io.evitadb.lingua.placeholder.RestoredText;
import io.evitadb.lingua.provider.ProviderClientFactory;
import io.evitadb.lingua.schedule.BatchResult;
import io.evitadb.lingua.schedule.BatchScheduler;
import io.evitadb.lingua.schedule.LeafOutcome;
import io.evitadb.lingua.schedule.ProgressListener;
import io.evitadb.lingua.tree.Leaf;
import io.evitadb.lingua.tree.LeafPath;
import io.evitadb.lingua.tree.TreeWalker;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Translates one parsed JSON document into every configured target language.
 *
 * The document is analysed once for all targets: the source language is resolved (detected when
 * not configured), leaves are extracted and their placeholders protected. Each target then goes
 * through diff selection, scheduling, placeholder restoration, glossary enforcement and
 * reassembly. Per-leaf problems end up in the result's issues, only configuration problems fail
 * the run, and they do so before any leaf is dispatched.
 */
public final class TranslationPipeline {

	/** Number of document strings collected for language detection. */
	static final int DETECTION_SAMPLES = 20;
	/** Number of collected samples actually sent to the provider. */
	static final int DETECTION_SAMPLES_SENT = 10;
	private static final int PROGRESS_LOG_INTERVAL = 10;

	@Nonnull
	private final ProviderClientFactory clientFactory;
	@Nonnull
	private final TranslationCache cache;
	@Nonnull
	private final Log log;
	@Nonnull
	private final TreeWalker treeWalker = new TreeWalker();
	@Nonnull
	private final PlaceholderCodec placeholderCodec = new PlaceholderCodec();
	@Nonnull
	private final DiffEngine diffEngine = new DiffEngine();
	@Nonnull
	private final GlossaryApplier glossaryApplier = new GlossaryApplier(this.placeholderCodec);

	/**
	 * Creates a pipeline.
	 *
	 * @param clientFactory creates provider clients, one per worker and one for detection
	 * @param cache         translation cache shared by all targets
	 * @param log           Maven log for output
	 */
	public TranslationPipeline(
		@Nonnull ProviderClientFactory clientFactory,
		@Nonnull TranslationCache cache,
		@Nonnull Log log
	) {
		this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory must not be null");
		this.cache = Objects.requireNonNull(cache, "cache must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Translates the document without diff mode.
	 *
	 * @param document parsed input document, not modified
	 * @param config   run configuration
	 * @return one result per target language, in configured order
	 * @throws ConfigurationException when the configuration is invalid or the source language cannot be resolved
	 */
	@Nonnull
	public List<PipelineResult> run(@Nonnull JsonNode document, @Nonnull PipelineConfig config)
		throws ConfigurationException {
		return run(document, config, null);
	}

	/**
	 * Translates the document into every target language.
	 *
	 * @param document     parsed input document, not modified
	 * @param config       run configuration
	 * @param previousRuns previous runs by target language; required in diff mode, a missing target
	 *                     is translated in full
	 * @return one result per target language, in configured order
	 * @throws ConfigurationException when the configuration is invalid, diff mode lacks previous runs
	 *                                or the source language cannot be resolved
	 */
	@Nonnull
	public List<PipelineResult> run(
		@Nonnull JsonNode document,
		@Nonnull PipelineConfig config,
		@Nullable Map<Language, PreviousRun> previousRuns
	) throws ConfigurationException {
		Objects.requireNonNull(document, "document must not be null");
		Objects.requireNonNull(config, "config must not be null");

		config.validate();
		if (config.isDiffMode() && previousRuns == null) {
			throw new ConfigurationException("Diff mode requires the previous output documents");
		}
		final List<Language> targets = config.getTargetLanguages();
		final Language source = resolveSourceLanguage(document, config);

		final List<Leaf> leaves = this.treeWalker.extract(document);
		final List<ProtectedText> protectedTexts = new ArrayList<>(leaves.size());
		for (final Leaf leaf : leaves) {
			protectedTexts.add(this.placeholderCodec.protect(leaf.text()));
		}
		this.log.info("Found " + leaves.size() + " translatable strings");

		final BatchScheduler scheduler = new BatchScheduler(
			this.clientFactory, this.cache, config.toSchedulerSettings(), this.log
		);
		final List<PipelineResult> results = new ArrayList<>(targets.size());
		for (final Language target : targets) {
			this.log.info("=== Translating to " + target.getDisplayName() + " (" + target.getCode() + ") ===");
			final PreviousRun previous = config.isDiffMode() ? previousRuns.get(target) : null;
			if (config.isDiffMode() && previous == null) {
				this.log.info("No previous translation for " + target.getCode() + ", translating all strings");
			}
			final PipelineResult result = translateTarget(
				document, leaves, protectedTexts, source, target, previous, scheduler, config
			);
			logSummary(result);
			results.add(result);
		}
		return results;
	}

	/**
	 * Counts per target how many leaves a run would send to the scheduler. Neither the provider nor
	 * the cache is needed, the source language is not resolved.
	 *
	 * @param document     parsed input document
	 * @param config       run configuration
	 * @param previousRuns previous runs by target language, may be null outside diff mode
	 * @return number of leaves to translate by target, in configured order
	 * @throws ConfigurationException when the configuration is invalid
	 */
	@Nonnull
	public static Map<Language, Integer> plan(
		@Nonnull JsonNode document,
		@Nonnull PipelineConfig config,
		@Nullable Map<Language, PreviousRun> previousRuns
	) throws ConfigurationException {
		Objects.requireNonNull(document, "document must not be null");
		Objects.requireNonNull(config, "config must not be null");
		config.validate();
		final List<Leaf> leaves = new TreeWalker().extract(document);
		final DiffEngine diffEngine = new DiffEngine();
		final Map<Language, Integer> plan = new LinkedHashMap<>();
		for (final Language target : config.getTargetLanguages()) {
			final PreviousRun previous = config.isDiffMode() && previousRuns != null ? previousRuns.get(target) : null;
			plan.put(target, previous == null ? leaves.size() : diffEngine.selectChanged(previous, document).size());
		}
		return plan;
	}

	@Nonnull
	private PipelineResult translateTarget(
		@Nonnull JsonNode document,
		@Nonnull List<Leaf> leaves,
		@Nonnull List<ProtectedText> protectedTexts,
		@Nonnull Language source,
		@Nonnull Language target,
		@Nullable PreviousRun previous,
		@Nonnull BatchScheduler scheduler,
		@Nonnull PipelineConfig config
	) {
		final Map<LeafPath, String> translations = new HashMap<>();
		final List<Integer> scheduled = new ArrayList<>(leaves.size());
		if (previous == null) {
			for (int i = 0; i < leaves.size(); i++) {
				scheduled.add(i);
			}
		} else {
			final Set<LeafPath> changed = this.diffEngine.selectChanged(previous, document);
			translations.putAll(this.diffEngine.previousValues(previous, leaves, changed));
			for (int i = 0; i < leaves.size(); i++) {
				if (changed.contains(leaves.get(i).path())) {
					scheduled.add(i);
				}
			}
			this.log.info("Diff mode: " + scheduled.size() + " changed, " + translations.size() + " unchanged");
		}
		final int reused = translations.size();

		final List<String> texts = scheduled.stream()
			.map(i -> protectedTexts.get(i).strippedText())
			.collect(Collectors.toList());
		final BatchResult batch = scheduler.schedule(
			texts, source.getCode(), target.getCode(), progressListener(config.getProgressListener())
		);

		final List<GlossaryRule> rules = config.getGlossaryRules(target);
		final List<LeafIssue> issues = new ArrayList<>();
		final Set<LeafPath> failed = new HashSet<>();
		int warnings = 0;
		for (int k = 0; k < scheduled.size(); k++) {
			final int index = scheduled.get(k);
			final Leaf leaf = leaves.get(index);
			final LeafOutcome outcome = batch.outcomes().get(k);
			if (outcome.isFailure()) {
				translations.put(leaf.path(), leaf.text());
				failed.add(leaf.path());
				issues.add(new LeafIssue(leaf.path(), LeafIssue.Kind.PROVIDER_FAILURE, String.valueOf(outcome.error())));
				this.log.warn("Failed to translate " + leaf.path() + ", keeping original text: " + outcome.error());
				continue;
			}
			final RestoredText restored = this.placeholderCodec.restore(outcome.text(), protectedTexts.get(index).tokens());
			if (restored.isMismatch()) {
				warnings++;
				final String message = "expected " + restored.tokensExpected() + " placeholders, found " +
					restored.markersFound();
				issues.add(new LeafIssue(leaf.path(), LeafIssue.Kind.PLACEHOLDER_MISMATCH, message));
				this.log.warn("Placeholder mismatch at " + leaf.path() + ": " + message);
			}
			translations.put(leaf.path(), rules.isEmpty() ? restored.text() : this.glossaryApplier.apply(restored.text(), rules));
		}

		final TranslationSummary summary = new TranslationSummary(
			leaves.size(), reused, batch.cacheHits(), batch.providerCalls(), batch.failures(), warnings
		);
		return new PipelineResult(
			source,
			target,
			this.treeWalker.reassemble(document, translations),
			// failed leaves carry no source text, so the next diff run selects them again
			this.treeWalker.clearLeaves(document, failed),
			summary,
			issues
		);
	}

	@Nonnull
	private Language resolveSourceLanguage(@Nonnull JsonNode document, @Nonnull PipelineConfig config)
		throws ConfigurationException {
		final Optional<Language> configured = config.getSourceLanguage();
		if (configured.isPresent()) {
			return configured.get();
		}

		final List<String> samples = this.treeWalker.collectSamples(document, DETECTION_SAMPLES);
		if (samples.isEmpty()) {
			throw new ConfigurationException(
				"Cannot detect the source language of a document without text, please specify the source language"
			);
		}
		final String joined = String.join(" ", samples.subList(0, Math.min(DETECTION_SAMPLES_SENT, samples.size())));
		final Optional<String> detected = this.clientFactory.create().detectLanguage(List.of(joined));
		if (detected.isEmpty()) {
			throw new ConfigurationException("Could not detect the source language, please specify it explicitly");
		}
		final Language language = Language.fromCode(detected.get()).orElseThrow(() -> new ConfigurationException(
			"Detected source language '" + detected.get() + "' is not supported, please specify it explicitly"
		));
		this.log.info("Detected language: " + language);
		return language;
	}

	@Nonnull
	private ProgressListener progressListener(@Nonnull ProgressListener delegate) {
		return (completed, total) -> {
			if (completed % PROGRESS_LOG_INTERVAL == 0 || completed == total) {
				this.log.info("Translated " + completed + "/" + total + " strings...");
			}
			delegate.onProgress(completed, total);
		};
	}

	private void logSummary(@Nonnull PipelineResult result) {
		final TranslationSummary summary = result.summary();
		this.log.info("--- Translation Summary (" + result.targetLanguage().getCode() + ") ---");
		this.log.info("Strings: " + summary.leafCount());
		if (summary.reusedCount() > 0) {
			this.log.info("Unchanged (reused): " + summary.reusedCount());
		}
		this.log.info("Cache hits: " + summary.cacheHits());
		this.log.info("Provider calls: " + summary.providerCalls());
		if (summary.hasFailures()) {
			this.log.warn("Failed (original text kept): " + summary.failedCount());
		}
		if (summary.hasWarnings()) {
			this.log.warn("Placeholder warnings: " + summary.warningCount());
		}
	}
}
