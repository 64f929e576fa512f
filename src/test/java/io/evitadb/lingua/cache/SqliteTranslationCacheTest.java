package io.evitadb.lingua.cache;

import io.evitadb.lingua.TestLog;
import io.evitadb.lingua.provider.StubProviderClientFactory;
import io.evitadb.lingua.schedule.BatchResult;
import io.evitadb.lingua.schedule.BatchScheduler;
import io.evitadb.lingua.schedule.ProgressListener;
import io.evitadb.lingua.schedule.SchedulerSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SqliteTranslationCache should persist translations")
class SqliteTranslationCacheTest {

	@TempDir
	Path tempDir;

	@Test
	@DisplayName("returns stored translations and misses unknown keys")
	void shouldStoreAndRead() throws Exception {
		try (SqliteTranslationCache cache = SqliteTranslationCache.open(tempDir.resolve("cache.db"))) {
			cache.put("en", "es", "Hello", "Hola");

			assertEquals(Optional.of("Hola"), cache.get("en", "es", "Hello"));
			assertEquals(Optional.empty(), cache.get("en", "de", "Hello"));
			assertEquals(Optional.empty(), cache.get("en", "es", "hello"));
		}
	}

	@Test
	@DisplayName("survives reopening the database")
	void shouldPersistAcrossInstances() throws Exception {
		final Path file = tempDir.resolve("nested/dir/cache.db");
		try (SqliteTranslationCache cache = SqliteTranslationCache.open(file)) {
			cache.put("en", "fr", "Save", "Enregistrer");
		}
		assertTrue(Files.exists(file));

		try (SqliteTranslationCache cache = SqliteTranslationCache.open(file)) {
			assertEquals(Optional.of("Enregistrer"), cache.get("en", "fr", "Save"));
			assertEquals(1, cache.size());
		}
	}

	@Test
	@DisplayName("keeps the first value written for a key")
	void shouldNeverOverwrite() throws Exception {
		final Path file = tempDir.resolve("cache.db");
		try (SqliteTranslationCache cache = SqliteTranslationCache.open(file)) {
			cache.put("en", "es", "Hello", "Hola");
			cache.put("en", "es", "Hello", "Buenas");
		}
		try (SqliteTranslationCache cache = SqliteTranslationCache.open(file, 10)) {
			cache.put("en", "es", "Hello", "Saludos");
			assertEquals(Optional.of("Hola"), cache.get("en", "es", "Hello"));
			assertEquals(1, cache.size());
		}
	}

	@Test
	@DisplayName("handles concurrent readers and writers without losing writes")
	void shouldSupportConcurrentAccess() throws Exception {
		final ExecutorService pool = Executors.newFixedThreadPool(8);
		try (SqliteTranslationCache cache = SqliteTranslationCache.open(tempDir.resolve("cache.db"))) {
			final List<CompletableFuture<Void>> futures = new ArrayList<>();
			for (int t = 0; t < 8; t++) {
				final int thread = t;
				futures.add(CompletableFuture.runAsync(() -> {
					for (int i = 0; i < 50; i++) {
						// every thread writes the shared keys and some of its own
						cache.put("en", "es", "shared " + i, "compartido " + i);
						cache.put("en", "es", "own " + thread + " " + i, "propio " + thread + " " + i);
						cache.get("en", "es", "shared " + i);
					}
				}, pool));
			}
			CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

			assertEquals(50 + 8 * 50, cache.size());
			assertEquals(Optional.of("compartido 7"), cache.get("en", "es", "shared 7"));
			assertEquals(Optional.of("propio 3 9"), cache.get("en", "es", "own 3 9"));
		} finally {
			pool.shutdownNow();
		}
	}

	@Test
	@DisplayName("rejects use after close")
	void shouldRejectUseAfterClose() throws Exception {
		final SqliteTranslationCache cache = SqliteTranslationCache.open(tempDir.resolve("cache.db"));
		cache.close();
		cache.close();

		assertThrows(IllegalStateException.class, () -> cache.get("en", "es", "Hello"));
		assertThrows(IllegalStateException.class, () -> cache.put("en", "es", "Hello", "Hola"));
	}

	@Test
	@DisplayName("stores non-ASCII text exactly")
	void shouldStoreUnicode() throws Exception {
		final Path file = tempDir.resolve("cache.db");
		try (SqliteTranslationCache cache = SqliteTranslationCache.open(file)) {
			cache.put("en", "ja", "Hello ⟦0⟧", "こんにちは ⟦0⟧");
		}
		try (SqliteTranslationCache cache = SqliteTranslationCache.open(file)) {
			assertEquals(Optional.of("こんにちは ⟦0⟧"), cache.get("en", "ja", "Hello ⟦0⟧"));
		}
	}

	@Test
	@DisplayName("keeps the number of reader connections bounded across short-lived thread pools")
	void shouldBoundReaderConnections() throws Exception {
		try (SqliteTranslationCache cache = SqliteTranslationCache.open(tempDir.resolve("cache.db"))) {
			cache.put("en", "es", "Hello", "Hola");
			for (int round = 0; round < 50; round++) {
				final ExecutorService pool = Executors.newFixedThreadPool(4);
				try {
					final List<CompletableFuture<Optional<String>>> lookups = new ArrayList<>();
					for (int i = 0; i < 8; i++) {
						// misses are never held in memory, so each one queries the database
						final String text = "missing " + round + " " + i;
						lookups.add(CompletableFuture.supplyAsync(() -> cache.get("en", "es", text), pool));
					}
					CompletableFuture.allOf(lookups.toArray(new CompletableFuture[0])).join();
					for (final CompletableFuture<Optional<String>> lookup : lookups) {
						assertEquals(Optional.empty(), lookup.join());
					}
				} finally {
					pool.shutdown();
					assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
				}
			}

			assertTrue(cache.getReadConnectionCount() <= SqliteTranslationCache.MAX_READ_CONNECTIONS);
			assertEquals(Optional.of("Hola"), cache.get("en", "es", "Hello"));
			assertEquals(1, cache.size());
		}
	}

	@Test
	@DisplayName("serves a repeated run from the database after many super-batches and targets")
	void shouldStayUsableAcrossManySuperBatches() throws Exception {
		final List<String> texts = IntStream.range(0, 400).mapToObj(i -> "text " + i).collect(Collectors.toList());
		final List<String> targets = List.of("es", "de", "fr");
		final SchedulerSettings settings = new SchedulerSettings(1, 2, 2, 2, true);
		final TestLog log = new TestLog();

		try (SqliteTranslationCache cache = SqliteTranslationCache.open(tempDir.resolve("cache.db"), 1)) {
			final StubProviderClientFactory first = StubProviderClientFactory.prefixing();
			for (final String target : targets) {
				new BatchScheduler(first, cache, settings, log).schedule(texts, "en", target, ProgressListener.NONE);
			}
			final StubProviderClientFactory second = StubProviderClientFactory.prefixing();
			for (final String target : targets) {
				final BatchResult result = new BatchScheduler(second, cache, settings, log)
					.schedule(texts, "en", target, ProgressListener.NONE);
				assertEquals(texts.size(), result.cacheHits());
				assertEquals(0, result.providerCalls());
			}

			assertEquals(1200, first.callCount());
			assertEquals(0, second.callCount());
			assertTrue(cache.getReadConnectionCount() <= SqliteTranslationCache.MAX_READ_CONNECTIONS);
			assertFalse(log.hasWarn("Cache lookup failed"));
		}
	}
}
