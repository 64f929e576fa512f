package io.evitadb.lingua.schedule;

import io.evitadb.lingua.cache.TranslationCache;
import io.evitadb.lingua.cache.TranslationCacheException;
import io.evitadb.lingua.provider.ProviderClient;
import io.evitadb.lingua.provider.ProviderClientFactory;
import io.evitadb.lingua.provider.ProviderException;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Translates a sequence of texts with two levels of bounded parallelism.
 *
 * - The texts are cut into super-batches of {@link SchedulerSettings#superBatchSize()} consecutive
 *   texts; up to {@link SchedulerSettings#outerConcurrency()} super-batches run at once.
 * - Each super-batch is cut into inner batches of {@link SchedulerSettings#batchSize()} texts and
 *   runs up to {@link SchedulerSettings#innerConcurrency()} of them at once on its own pool.
 * - Each inner batch is worked off by one worker with its own {@link ProviderClient}.
 * - For every text the cache is consulted first; on a miss the provider is called and the result
 *   stored. Identical texts within one run are translated once, later occurrences wait for the first.
 * - Results are written into a pre-sized slot array by text index, so output order always equals
 *   input order regardless of completion order.
 *
 * Provider and cache failures are contained per text and never cancel sibling batches.
 */
public final class BatchScheduler {

	private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

	@Nonnull
	private final ProviderClientFactory clientFactory;
	@Nonnull
	private final TranslationCache cache;
	@Nonnull
	private final SchedulerSettings settings;
	@Nonnull
	private final Log log;

	/**
	 * Creates a scheduler.
	 *
	 * @param clientFactory creates one provider client per worker
	 * @param cache         shared translation cache
	 * @param settings      batch sizes and concurrency limits
	 * @param log           Maven log for output
	 */
	public BatchScheduler(
		@Nonnull ProviderClientFactory clientFactory,
		@Nonnull TranslationCache cache,
		@Nonnull SchedulerSettings settings,
		@Nonnull Log log
	) {
		this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory must not be null");
		this.cache = Objects.requireNonNull(cache, "cache must not be null");
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Translates all texts and returns their outcomes in input order.
	 *
	 * @param texts      texts to translate, placeholders already protected
	 * @param sourceLang source language code
	 * @param targetLang target language code
	 * @param listener   progress callback
	 * @return outcomes and counters
	 */
	@Nonnull
	public BatchResult schedule(
		@Nonnull List<String> texts,
		@Nonnull String sourceLang,
		@Nonnull String targetLang,
		@Nonnull ProgressListener listener
	) {
		Objects.requireNonNull(texts, "texts must not be null");
		Objects.requireNonNull(sourceLang, "sourceLang must not be null");
		Objects.requireNonNull(targetLang, "targetLang must not be null");
		Objects.requireNonNull(listener, "listener must not be null");

		if (texts.isEmpty()) {
			return BatchResult.empty();
		}

		final Run run = new Run(List.copyOf(texts), sourceLang, targetLang, listener);
		final List<Range> superBatches = Range.partition(0, texts.size(), this.settings.superBatchSize());
		final ExecutorService outerPool = Executors.newFixedThreadPool(
			Math.min(this.settings.outerConcurrency(), superBatches.size())
		);

		try {
			final List<CompletableFuture<Void>> futures = new ArrayList<>(superBatches.size());
			for (final Range superBatch : superBatches) {
				futures.add(CompletableFuture.runAsync(() -> runSuperBatch(run, superBatch), outerPool));
			}
			awaitAll(futures);
		} finally {
			shutdown(outerPool);
		}

		// join() above orders all slot writes before this read
		return new BatchResult(
			Arrays.asList(run.slots),
			run.cacheHits.get(),
			run.providerCalls.get(),
			run.failures.get()
		);
	}

	private void runSuperBatch(@Nonnull Run run, @Nonnull Range superBatch) {
		final List<Range> batches = Range.partition(superBatch.from(), superBatch.to(), this.settings.batchSize());
		final ExecutorService innerPool = Executors.newFixedThreadPool(
			Math.min(this.settings.innerConcurrency(), batches.size())
		);
		try {
			final List<CompletableFuture<Void>> futures = new ArrayList<>(batches.size());
			for (final Range batch : batches) {
				futures.add(CompletableFuture.runAsync(() -> runBatch(run, batch), innerPool));
			}
			awaitAll(futures);
		} finally {
			shutdown(innerPool);
		}
	}

	private void runBatch(@Nonnull Run run, @Nonnull Range batch) {
		final ProviderClient client = this.clientFactory.create();
		for (int i = batch.from(); i < batch.to(); i++) {
			run.slots[i] = resolve(run, run.texts.get(i), client);
			run.listener.onProgress(run.completed.incrementAndGet(), run.slots.length);
		}
	}

	@Nonnull
	private LeafOutcome resolve(@Nonnull Run run, @Nonnull String text, @Nonnull ProviderClient client) {
		final CompletableFuture<LeafOutcome> own = new CompletableFuture<>();
		final CompletableFuture<LeafOutcome> first = run.inFlight.putIfAbsent(text, own);
		if (first != null) {
			return awaitDuplicate(run, text, first);
		}
		try {
			final LeafOutcome outcome = lookupOrTranslate(run, text, client);
			own.complete(outcome);
			return outcome;
		} catch (RuntimeException | Error e) {
			own.completeExceptionally(e);
			throw e;
		}
	}

	@Nonnull
	private LeafOutcome awaitDuplicate(
		@Nonnull Run run,
		@Nonnull String text,
		@Nonnull CompletableFuture<LeafOutcome> first
	) {
		try {
			final LeafOutcome outcome = first.join().forDuplicate();
			if (outcome.isFailure()) {
				run.failures.incrementAndGet();
			} else {
				run.cacheHits.incrementAndGet();
			}
			return outcome;
		} catch (CompletionException e) {
			run.failures.incrementAndGet();
			return LeafOutcome.fallback(text, String.valueOf(e.getCause()));
		}
	}

	@Nonnull
	private LeafOutcome lookupOrTranslate(@Nonnull Run run, @Nonnull String text, @Nonnull ProviderClient client) {
		if (this.settings.cacheEnabled()) {
			try {
				final var cached = this.cache.get(run.sourceLang, run.targetLang, text);
				if (cached.isPresent()) {
					run.cacheHits.incrementAndGet();
					return LeafOutcome.cached(cached.get());
				}
			} catch (TranslationCacheException e) {
				this.log.warn("Cache lookup failed, translating instead: " + e.getMessage());
			}
		}

		run.providerCalls.incrementAndGet();
		final String translated;
		try {
			translated = client.translate(text, run.sourceLang, run.targetLang);
		} catch (ProviderException | RuntimeException e) {
			run.failures.incrementAndGet();
			if (this.log.isDebugEnabled()) {
				this.log.debug("Provider failed for '" + abbreviate(text) + "': " + e.getMessage());
			}
			return LeafOutcome.fallback(text, String.valueOf(e.getMessage()));
		}

		try {
			this.cache.put(run.sourceLang, run.targetLang, text, translated);
		} catch (TranslationCacheException e) {
			this.log.warn("Failed to store translation in cache: " + e.getMessage());
		}
		return LeafOutcome.translated(translated);
	}

	private static void awaitAll(@Nonnull List<CompletableFuture<Void>> futures) {
		try {
			CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
		} catch (CompletionException e) {
			throw new IllegalStateException("Translation worker failed unexpectedly: " + e.getCause(), e.getCause());
		}
	}

	private void shutdown(@Nonnull ExecutorService pool) {
		pool.shutdown();
		try {
			if (!pool.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
				this.log.warn("Translation workers did not terminate in time, forcing shutdown");
				pool.shutdownNow();
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			pool.shutdownNow();
		}
	}

	@Nonnull
	private static String abbreviate(@Nonnull String text) {
		return text.length() <= 50 ? text : text.substring(0, 50) + "...";
	}

	/**
	 * Half-open index range `[from, to)` of the text sequence.
	 */
	record Range(int from, int to) {

		@Nonnull
		static List<Range> partition(int from, int to, int size) {
			final List<Range> ranges = new ArrayList<>((to - from + size - 1) / size);
			for (int start = from; start < to; start += size) {
				ranges.add(new Range(start, Math.min(start + size, to)));
			}
			return ranges;
		}
	}

	/**
	 * State of one {@link #schedule} call shared by its workers.
	 */
	private static final class Run {
		final List<String> texts;
		final String sourceLang;
		final String targetLang;
		final ProgressListener listener;
		final LeafOutcome[] slots;
		final ConcurrentMap<String, CompletableFuture<LeafOutcome>> inFlight = new ConcurrentHashMap<>();
		final AtomicInteger completed = new AtomicInteger();
		final AtomicInteger cacheHits = new AtomicInteger();
		final AtomicInteger providerCalls = new AtomicInteger();
		final AtomicInteger failures = new AtomicInteger();

		Run(List<String> texts, String sourceLang, String targetLang, ProgressListener listener) {
			this.texts = texts;
			this.sourceLang = sourceLang;
			this.targetLang = targetLang;
			this.listener = listener;
			this.slots = new LeafOutcome[texts.size()];
		}
	}
}
