package io.evitadb.lingua.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link TranslationCache} backed by a SQLite database file running in WAL mode, with a Caffeine
 * cache in front of it for hot entries.
 *
 * - Writes go through a single connection guarded by a lock and use `INSERT OR IGNORE`, so the
 *   first stored value of a key wins and is never replaced.
 * - Reads borrow a connection from a bounded pool of at most {@link #MAX_READ_CONNECTIONS}
 *   readers and return it when the query is done. In WAL mode readers see committed data without
 *   waiting for the writer.
 * - The in-memory layer is filled on put and on database hits; it is bounded and may evict, the
 *   database stays authoritative.
 */
public final class SqliteTranslationCache implements TranslationCache {

	private static final long DEFAULT_MEMORY_ENTRIES = 50_000;
	private static final int BUSY_TIMEOUT_MILLIS = 10_000;
	/** Upper bound of reader connections open at the same time. */
	static final int MAX_READ_CONNECTIONS = 8;

	private static final String SQL_CREATE_TABLE =
		"CREATE TABLE IF NOT EXISTS translations (" +
			"source_lang TEXT NOT NULL, " +
			"target_lang TEXT NOT NULL, " +
			"source_text TEXT NOT NULL, " +
			"translated_text TEXT NOT NULL, " +
			"created_at INTEGER NOT NULL, " +
			"PRIMARY KEY (source_lang, target_lang, source_text))";
	private static final String SQL_SELECT =
		"SELECT translated_text FROM translations WHERE source_lang = ? AND target_lang = ? AND source_text = ?";
	private static final String SQL_INSERT =
		"INSERT OR IGNORE INTO translations (source_lang, target_lang, source_text, translated_text, created_at) " +
			"VALUES (?, ?, ?, ?, ?)";
	private static final String SQL_COUNT = "SELECT COUNT(*) FROM translations";

	@Nonnull
	private final String jdbcUrl;
	@Nonnull
	private final Connection writeConnection;
	@Nonnull
	private final ReentrantLock writeLock = new ReentrantLock();
	@Nonnull
	private final BlockingQueue<Connection> idleReadConnections = new LinkedBlockingQueue<>();
	@Nonnull
	private final ConcurrentLinkedQueue<Connection> openReadConnections = new ConcurrentLinkedQueue<>();
	@Nonnull
	private final AtomicInteger readConnectionCount = new AtomicInteger();
	@Nonnull
	private final Cache<CacheKey, String> memory;
	@Nonnull
	private final AtomicBoolean closed = new AtomicBoolean(false);

	private SqliteTranslationCache(@Nonnull String jdbcUrl, @Nonnull Connection writeConnection, long memoryEntries) {
		this.jdbcUrl = jdbcUrl;
		this.writeConnection = writeConnection;
		this.memory = Caffeine.newBuilder()
			.maximumSize(memoryEntries)
			.build();
	}

	/**
	 * Opens (creating if needed) the cache database with the default in-memory size.
	 *
	 * @param databaseFile SQLite database file
	 * @return opened cache
	 * @throws IOException when the file or its schema cannot be created
	 */
	@Nonnull
	public static SqliteTranslationCache open(@Nonnull Path databaseFile) throws IOException {
		return open(databaseFile, DEFAULT_MEMORY_ENTRIES);
	}

	/**
	 * Opens (creating if needed) the cache database.
	 *
	 * @param databaseFile  SQLite database file
	 * @param memoryEntries maximum number of entries kept in memory
	 * @return opened cache
	 * @throws IOException when the file or its schema cannot be created
	 */
	@Nonnull
	public static SqliteTranslationCache open(@Nonnull Path databaseFile, long memoryEntries) throws IOException {
		Objects.requireNonNull(databaseFile, "databaseFile must not be null");
		if (memoryEntries < 1) {
			throw new IllegalArgumentException("memoryEntries must be at least 1");
		}
		final Path absolute = databaseFile.toAbsolutePath().normalize();
		final Path parent = absolute.getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}

		final String jdbcUrl = "jdbc:sqlite:" + absolute;
		try {
			final Connection connection = DriverManager.getConnection(jdbcUrl);
			try (Statement statement = connection.createStatement()) {
				statement.execute("PRAGMA journal_mode=WAL");
				statement.execute("PRAGMA synchronous=NORMAL");
				statement.execute("PRAGMA busy_timeout=" + BUSY_TIMEOUT_MILLIS);
				statement.execute(SQL_CREATE_TABLE);
			} catch (SQLException e) {
				connection.close();
				throw e;
			}
			return new SqliteTranslationCache(jdbcUrl, connection, memoryEntries);
		} catch (SQLException e) {
			throw new IOException("Failed to open translation cache " + absolute + ": " + e.getMessage(), e);
		}
	}

	@Nonnull
	@Override
	public Optional<String> get(@Nonnull String sourceLang, @Nonnull String targetLang, @Nonnull String text) {
		ensureOpen();
		final CacheKey key = new CacheKey(sourceLang, targetLang, text);
		final String cached = this.memory.getIfPresent(key);
		if (cached != null) {
			return Optional.of(cached);
		}

		try {
			final Connection reader = borrowReadConnection();
			try (PreparedStatement statement = reader.prepareStatement(SQL_SELECT)) {
				statement.setString(1, sourceLang);
				statement.setString(2, targetLang);
				statement.setString(3, text);
				try (ResultSet rs = statement.executeQuery()) {
					if (rs.next()) {
						final String stored = rs.getString(1);
						this.memory.asMap().putIfAbsent(key, stored);
						return Optional.of(stored);
					}
					return Optional.empty();
				}
			} finally {
				this.idleReadConnections.offer(reader);
			}
		} catch (SQLException e) {
			throw new TranslationCacheException("Failed to read translation cache: " + e.getMessage(), e);
		}
	}

	@Override
	public void put(
		@Nonnull String sourceLang,
		@Nonnull String targetLang,
		@Nonnull String text,
		@Nonnull String translatedText
	) {
		Objects.requireNonNull(translatedText, "translatedText must not be null");
		ensureOpen();
		final CacheKey key = new CacheKey(sourceLang, targetLang, text);
		final String previous = this.memory.asMap().putIfAbsent(key, translatedText);
		if (previous != null) {
			// already stored by this process, the database row exists or is being written
			return;
		}

		this.writeLock.lock();
		try (PreparedStatement statement = this.writeConnection.prepareStatement(SQL_INSERT)) {
			statement.setString(1, sourceLang);
			statement.setString(2, targetLang);
			statement.setString(3, text);
			statement.setString(4, translatedText);
			statement.setLong(5, System.currentTimeMillis());
			statement.executeUpdate();
		} catch (SQLException e) {
			this.memory.invalidate(key);
			throw new TranslationCacheException("Failed to write translation cache: " + e.getMessage(), e);
		} finally {
			this.writeLock.unlock();
		}
	}

	/**
	 * Returns the number of entries persisted in the database.
	 *
	 * @return persisted entry count
	 */
	public long size() {
		ensureOpen();
		try {
			final Connection reader = borrowReadConnection();
			try (Statement statement = reader.createStatement();
				 ResultSet rs = statement.executeQuery(SQL_COUNT)) {
				return rs.next() ? rs.getLong(1) : 0;
			} finally {
				this.idleReadConnections.offer(reader);
			}
		} catch (SQLException e) {
			throw new TranslationCacheException("Failed to count translation cache entries: " + e.getMessage(), e);
		}
	}

	@Override
	public void close() {
		if (!this.closed.compareAndSet(false, true)) {
			return;
		}
		final List<SQLException> failures = new ArrayList<>();
		this.idleReadConnections.clear();
		Connection connection;
		while ((connection = this.openReadConnections.poll()) != null) {
			closeCollectingFailure(connection, failures);
		}
		this.writeLock.lock();
		try {
			closeCollectingFailure(this.writeConnection, failures);
		} finally {
			this.writeLock.unlock();
		}
		this.memory.invalidateAll();
		if (!failures.isEmpty()) {
			final SQLException first = failures.get(0);
			throw new TranslationCacheException("Failed to close translation cache: " + first.getMessage(), first);
		}
	}

	/**
	 * Returns the number of reader connections opened so far, never more than
	 * {@link #MAX_READ_CONNECTIONS}.
	 */
	int getReadConnectionCount() {
		return this.readConnectionCount.get();
	}

	/**
	 * Takes an idle reader, opens a new one while below the limit, or waits for a reader to be
	 * returned. The caller must offer the connection back to the idle queue.
	 */
	@Nonnull
	private Connection borrowReadConnection() throws SQLException {
		final Connection idle = this.idleReadConnections.poll();
		if (idle != null) {
			return idle;
		}
		if (this.readConnectionCount.getAndUpdate(n -> n < MAX_READ_CONNECTIONS ? n + 1 : n) < MAX_READ_CONNECTIONS) {
			try {
				return openReadConnection();
			} catch (SQLException e) {
				this.readConnectionCount.decrementAndGet();
				throw e;
			}
		}
		try {
			final Connection returned = this.idleReadConnections.poll(BUSY_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
			if (returned == null) {
				throw new SQLException("Timed out waiting for a free translation cache reader");
			}
			return returned;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new SQLException("Interrupted while waiting for a translation cache reader", e);
		}
	}

	@Nonnull
	private Connection openReadConnection() throws SQLException {
		final Connection connection = DriverManager.getConnection(this.jdbcUrl);
		try (Statement statement = connection.createStatement()) {
			statement.execute("PRAGMA busy_timeout=" + BUSY_TIMEOUT_MILLIS);
		} catch (SQLException e) {
			connection.close();
			throw e;
		}
		this.openReadConnections.add(connection);
		return connection;
	}

	private void ensureOpen() {
		if (this.closed.get()) {
			throw new IllegalStateException("Translation cache is closed");
		}
	}

	private static void closeCollectingFailure(@Nonnull Connection connection, @Nonnull List<SQLException> failures) {
		try {
			connection.close();
		} catch (SQLException e) {
			failures.add(e);
		}
	}
}
