package io.evitadb.lingua;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.evitadb.lingua.cache.SqliteTranslationCache;
import io.evitadb.lingua.diff.PreviousRun;
import io.evitadb.lingua.glossary.GlossaryLoader;
import io.evitadb.lingua.glossary.GlossaryRule;
import io.evitadb.lingua.model.ConfigurationException;
import io.evitadb.lingua.model.Language;
import io.evitadb.lingua.model.LeafIssue;
import io.evitadb.lingua.model.PipelineConfig;
import io.evitadb.lingua.model.PipelineResult;
import io.evitadb.lingua.model.TranslationSummary;
import io.evitadb.lingua.provider.LlmProviderClientFactory;
import io.evitadb.lingua.provider.LlmSettings;
import io.evitadb.lingua.provider.PromptLoader;
import io.evitadb.lingua.provider.ProviderClientFactory;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Main Mojo for Lingua plugin providing actions:
 * - show-config: prints current configuration
 * - list-languages: prints the supported languages
 * - translate: translates the input JSON file into every target language
 */
@Mojo(name = "run", defaultPhase = LifecyclePhase.NONE, threadSafe = true)
public class LinguaMojo extends AbstractMojo {

	/** Directory below the output directory holding the source snapshots used by diff mode. */
	static final String SNAPSHOT_DIR = ".lingua";

	/** Which action to perform: "show-config", "list-languages" or "translate". */
	@Parameter(property = "lingua.action", defaultValue = "show-config")
	private String action;

	/** LLM provider: "openai" or "anthropic". */
	@Parameter(property = "lingua.llmProvider", defaultValue = "openai")
	private String llmProvider = "openai";

	/** LLM URL (no default). */
	@Parameter(property = "lingua.llmUrl")
	private String llmUrl;

	/** LLM token (no default). */
	@Parameter(property = "lingua.llmToken")
	private String llmToken;

	/** LLM model name, blank selects the provider default. */
	@Parameter(property = "lingua.llmModel")
	private String llmModel;

	/** JSON file to translate (no default). */
	@Parameter(property = "lingua.inputFile")
	private String inputFile;

	/** Directory receiving the translated files. */
	@Parameter(property = "lingua.outputDir", defaultValue = "./translations")
	private String outputDir = "./translations";

	/** Source language code, blank to detect it from the input. */
	@Parameter(property = "lingua.sourceLanguage")
	private String sourceLanguage;

	/** Target language codes (no default). */
	@Parameter(property = "lingua.targets")
	private List<String> targets;

	/** Strings per inner batch. */
	@Parameter(property = "lingua.batchSize", defaultValue = "10")
	private int batchSize = PipelineConfig.DEFAULT_BATCH_SIZE;

	/** Strings per super-batch. */
	@Parameter(property = "lingua.superBatchSize", defaultValue = "100")
	private int superBatchSize = PipelineConfig.DEFAULT_SUPER_BATCH_SIZE;

	/** Super-batches translated at the same time. */
	@Parameter(property = "lingua.outerConcurrency", defaultValue = "2")
	private int outerConcurrency = PipelineConfig.DEFAULT_OUTER_CONCURRENCY;

	/** Inner batches translated at the same time within one super-batch. */
	@Parameter(property = "lingua.innerConcurrency", defaultValue = "4")
	private int innerConcurrency = PipelineConfig.DEFAULT_INNER_CONCURRENCY;

	/** When false, cached translations are not read; new translations are still stored. */
	@Parameter(property = "lingua.useCache", defaultValue = "true")
	private boolean useCache = true;

	/** SQLite translation cache file. */
	@Parameter(property = "lingua.cacheFile", defaultValue = ".lingua/translation-cache.db")
	private String cacheFile = ".lingua/translation-cache.db";

	/** When true, only strings changed since the previous run are translated. */
	@Parameter(property = "lingua.diff", defaultValue = "false")
	private boolean diff;

	/** Optional glossary JSON file. */
	@Parameter(property = "lingua.glossaryFile")
	private String glossaryFile;

	/** When true, do not contact the provider nor write any file, only report the planned work. */
	@Parameter(property = "lingua.dryRun", defaultValue = "false")
	private boolean dryRun;

	/** Replaces the LLM backed provider, used by tests. */
	@Nullable
	private ProviderClientFactory providerClientFactory;

	@Nonnull
	private final ObjectMapper objectMapper = new ObjectMapper();

	@Override
	public void execute() throws MojoExecutionException {
		if (this.action == null || this.action.isBlank()) {
			this.action = "show-config";
		}
		switch (this.action) {
			case "show-config":
				showConfig(getLog());
				break;
			case "list-languages":
				listLanguages(getLog());
				break;
			case "translate":
				translate(getLog());
				break;
			default:
				throw new MojoExecutionException(
					"Unknown action: " + this.action + ". Supported actions: show-config, list-languages, translate"
				);
		}
	}

	private void showConfig(@Nonnull final Log log) {
		log.info("Lingua Plugin Configuration:");
		log.info(" - llmProvider: " + this.llmProvider);
		log.info(" - llmUrl: " + (isBlank(this.llmUrl) ? "<not set>" : this.llmUrl));
		if (isBlank(this.llmUrl)) {
			log.warn("LLM url is not set");
		}
		log.info(" - llmToken: " + (isBlank(this.llmToken) ? "<not set>" : mask(this.llmToken)));
		if (isBlank(this.llmToken)) {
			log.warn("LLM token is not set");
		}
		log.info(" - llmModel: " + (isBlank(this.llmModel) ? "<provider default>" : this.llmModel));
		log.info(" - inputFile: " + (isBlank(this.inputFile) ? "<not set>" : this.inputFile));
		if (isBlank(this.inputFile)) {
			log.warn("Input file is not set");
		}
		log.info(" - outputDir: " + this.outputDir);
		log.info(" - sourceLanguage: " + (isBlank(this.sourceLanguage) ? "<auto-detect>" : this.sourceLanguage));
		if (this.targets == null || this.targets.isEmpty()) {
			log.info(" - targets: <none>");
			log.warn("No target languages configured");
		} else {
			log.info(" - targets: " + String.join(", ", this.targets));
			for (final String target : this.targets) {
				if (Language.fromCode(target).isEmpty()) {
					log.warn("Unsupported target language: " + target);
				}
			}
		}
		log.info(" - batchSize: " + this.batchSize);
		log.info(" - superBatchSize: " + this.superBatchSize);
		log.info(" - outerConcurrency: " + this.outerConcurrency);
		log.info(" - innerConcurrency: " + this.innerConcurrency);
		log.info(" - useCache: " + this.useCache);
		log.info(" - cacheFile: " + this.cacheFile);
		log.info(" - diff: " + this.diff);
		log.info(" - glossaryFile: " + (isBlank(this.glossaryFile) ? "<not set>" : this.glossaryFile));
		log.info(" - dryRun: " + this.dryRun);
	}

	private static void listLanguages(@Nonnull final Log log) {
		log.info("Supported Languages:");
		for (final Language language : Language.sortedByDisplayName()) {
			log.info(String.format("  %-8s - %s", language.getCode(), language.getDisplayName()));
		}
	}

	@Nonnull
	private static String mask(@Nullable final String value) {
		if (value == null || value.length() <= 4) {
			return "****";
		}
		return "****" + value.substring(value.length() - 4);
	}

	private void translate(@Nonnull final Log log) throws MojoExecutionException {
		if (isBlank(this.inputFile)) {
			throw new MojoExecutionException("Input file must be specified for translate action");
		}
		final Path input = Path.of(this.inputFile).toAbsolutePath().normalize();
		if (!Files.isRegularFile(input)) {
			throw new MojoExecutionException("Input file not found: " + input);
		}
		if (!input.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json")) {
			log.warn("Input file does not have .json extension: " + input.getFileName());
		}
		final Path outputRoot = Path.of(this.outputDir).toAbsolutePath().normalize();
		final String stem = stem(input);
		final JsonDocumentWriter documentWriter = new JsonDocumentWriter(this.objectMapper);

		try {
			final JsonNode document = documentWriter.read(input);
			final PipelineConfig config = buildConfig(log);
			config.validate();
			final Map<Language, PreviousRun> previousRuns = this.diff
				? loadPreviousRuns(documentWriter, config.getTargetLanguages(), outputRoot, stem, log)
				: null;

			if (this.dryRun) {
				log.info("--- Dry-run Summary ---");
				final Map<Language, Integer> plan = TranslationPipeline.plan(document, config, previousRuns);
				for (final Map.Entry<Language, Integer> entry : plan.entrySet()) {
					log.info("[PLAN] " + entry.getKey() + ": " + entry.getValue() + " strings to translate -> " +
						outputFile(outputRoot, stem, entry.getKey()));
				}
				return;
			}

			final ProviderClientFactory clientFactory = resolveClientFactory();
			try (SqliteTranslationCache cache = SqliteTranslationCache.open(Path.of(this.cacheFile))) {
				final TranslationPipeline pipeline = new TranslationPipeline(clientFactory, cache, log);
				final List<PipelineResult> results = pipeline.run(document, config, previousRuns);

				TranslationSummary total = TranslationSummary.empty();
				for (final PipelineResult result : results) {
					final Path target = outputFile(outputRoot, stem, result.targetLanguage());
					documentWriter.write(result.document(), target);
					documentWriter.write(result.sourceSnapshot(), snapshotFile(outputRoot, stem, result.targetLanguage()));
					log.info("Saved to: " + target);
					for (final LeafIssue issue : result.issues()) {
						log.debug(issue.toString());
					}
					total = total.add(result.summary());
				}
				log.info("All translations completed: " + total);
			}
		} catch (ConfigurationException ex) {
			throw new MojoExecutionException(ex.getMessage(), ex);
		} catch (IOException ex) {
			throw new MojoExecutionException("Translate action failed: " + ex.getMessage(), ex);
		}
	}

	@Nonnull
	private PipelineConfig buildConfig(@Nonnull final Log log) throws IOException, ConfigurationException {
		Map<Language, List<GlossaryRule>> glossary = Map.of();
		if (!isBlank(this.glossaryFile)) {
			glossary = new GlossaryLoader(this.objectMapper).load(Path.of(this.glossaryFile));
			log.info("Loaded glossary for " + glossary.size() + " language(s) from " + this.glossaryFile);
		}
		return PipelineConfig.builder()
			.sourceLanguage(this.sourceLanguage)
			.targets(this.targets == null ? List.of() : this.targets)
			.batchSize(this.batchSize)
			.superBatchSize(this.superBatchSize)
			.outerConcurrency(this.outerConcurrency)
			.innerConcurrency(this.innerConcurrency)
			.cacheEnabled(this.useCache)
			.diffMode(this.diff)
			.glossary(glossary)
			.build();
	}

	@Nonnull
	private static Map<Language, PreviousRun> loadPreviousRuns(
		@Nonnull JsonDocumentWriter documentWriter,
		@Nonnull List<Language> targets,
		@Nonnull Path outputRoot,
		@Nonnull String stem,
		@Nonnull Log log
	) throws IOException {
		final Map<Language, PreviousRun> previousRuns = new EnumMap<>(Language.class);
		for (final Language target : targets) {
			final Path output = outputFile(outputRoot, stem, target);
			final Path snapshot = snapshotFile(outputRoot, stem, target);
			if (Files.isRegularFile(output) && Files.isRegularFile(snapshot)) {
				previousRuns.put(target, new PreviousRun(documentWriter.read(output), documentWriter.read(snapshot)));
			} else if (Files.isRegularFile(output)) {
				log.warn("Existing translation " + output.getFileName() + " has no source snapshot. Treating as new file.");
			}
		}
		return previousRuns;
	}

	@Nonnull
	private ProviderClientFactory resolveClientFactory() throws MojoExecutionException {
		if (this.providerClientFactory != null) {
			return this.providerClientFactory;
		}
		if (isBlank(this.llmUrl)) {
			throw new MojoExecutionException("LLM URL must be specified for non-dry-run translate action");
		}
		try {
			final LlmSettings settings = new LlmSettings(this.llmProvider, this.llmUrl, this.llmToken, this.llmModel);
			final LlmProviderClientFactory factory = new LlmProviderClientFactory(settings, new PromptLoader());
			// fail on an unknown provider before any work starts
			factory.create();
			return factory;
		} catch (IllegalArgumentException ex) {
			throw new MojoExecutionException(ex.getMessage(), ex);
		}
	}

	@Nonnull
	static Path outputFile(@Nonnull Path outputRoot, @Nonnull String stem, @Nonnull Language language) {
		return outputRoot.resolve(stem + "." + language.getCode() + ".json");
	}

	@Nonnull
	static Path snapshotFile(@Nonnull Path outputRoot, @Nonnull String stem, @Nonnull Language language) {
		return outputRoot.resolve(SNAPSHOT_DIR).resolve(stem + "." + language.getCode() + ".source.json");
	}

	@Nonnull
	private static String stem(@Nonnull Path file) {
		final String name = file.getFileName().toString();
		final int dot = name.lastIndexOf('.');
		return dot > 0 ? name.substring(0, dot) : name;
	}

	private static boolean isBlank(@Nullable final String value) {
		return value == null || value.isBlank();
	}

	// Setters to aid testing without Maven parameter injection
	void setAction(@Nullable final String action) { this.action = action; }
	void setLlmProvider(@Nullable final String llmProvider) { this.llmProvider = llmProvider; }
	void setLlmUrl(@Nullable final String llmUrl) { this.llmUrl = llmUrl; }
	void setLlmToken(@Nullable final String llmToken) { this.llmToken = llmToken; }
	void setLlmModel(@Nullable final String llmModel) { this.llmModel = llmModel; }
	void setInputFile(@Nullable final String inputFile) { this.inputFile = inputFile; }
	void setOutputDir(@Nonnull final String outputDir) { this.outputDir = outputDir; }
	void setSourceLanguage(@Nullable final String sourceLanguage) { this.sourceLanguage = sourceLanguage; }
	void setTargets(@Nullable final List<String> targets) { this.targets = targets; }
	void setBatchSize(final int batchSize) { this.batchSize = batchSize; }
	void setSuperBatchSize(final int superBatchSize) { this.superBatchSize = superBatchSize; }
	void setOuterConcurrency(final int outerConcurrency) { this.outerConcurrency = outerConcurrency; }
	void setInnerConcurrency(final int innerConcurrency) { this.innerConcurrency = innerConcurrency; }
	void setUseCache(final boolean useCache) { this.useCache = useCache; }
	void setCacheFile(@Nonnull final String cacheFile) { this.cacheFile = cacheFile; }
	void setDiff(final boolean diff) { this.diff = diff; }
	void setGlossaryFile(@Nullable final String glossaryFile) { this.glossaryFile = glossaryFile; }
	void setDryRun(final boolean dryRun) { this.dryRun = dryRun; }
	void setProviderClientFactory(@Nullable final ProviderClientFactory factory) { this.providerClientFactory = factory; }
}
