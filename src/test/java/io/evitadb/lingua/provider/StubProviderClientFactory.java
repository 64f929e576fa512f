package io.evitadb.lingua.provider;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

/**
 * Provider stub translating by a fixed function. Texts listed as failing raise a
 * {@link ProviderException}. Tracks created clients, calls and the peak of concurrent calls.
 */
public class StubProviderClientFactory implements ProviderClientFactory {
	private final UnaryOperator<String> translation;
	private final Set<String> failing = ConcurrentHashMap.newKeySet();
	private final AtomicInteger clients = new AtomicInteger();
	private final AtomicInteger calls = new AtomicInteger();
	private final AtomicInteger running = new AtomicInteger();
	private final AtomicInteger peak = new AtomicInteger();
	private volatile String detectedLanguage;
	private volatile long delayMillis;

	public StubProviderClientFactory(UnaryOperator<String> translation) {
		this.translation = translation;
	}

	/** Translates by prefixing the target language code, e.g. `[es] Hello`. */
	public static StubProviderClientFactory prefixing() {
		return new StubProviderClientFactory(null);
	}

	public StubProviderClientFactory failOn(String text) {
		failing.add(text);
		return this;
	}

	public StubProviderClientFactory detecting(String languageCode) {
		this.detectedLanguage = languageCode;
		return this;
	}

	public StubProviderClientFactory withDelay(long millis) {
		this.delayMillis = millis;
		return this;
	}

	@Override
	public ProviderClient create() {
		clients.incrementAndGet();
		return new ProviderClient() {
			@Override
			public String translate(String text, String sourceLang, String targetLang) throws ProviderException {
				calls.incrementAndGet();
				final int now = running.incrementAndGet();
				peak.accumulateAndGet(now, Math::max);
				try {
					if (delayMillis > 0) {
						try {
							Thread.sleep(delayMillis);
						} catch (InterruptedException e) {
							Thread.currentThread().interrupt();
						}
					}
					if (failing.contains(text)) {
						throw new ProviderException("Service unavailable", null);
					}
					return translation == null ? "[" + targetLang + "] " + text : translation.apply(text);
				} finally {
					running.decrementAndGet();
				}
			}

			@Override
			public Optional<String> detectLanguage(List<String> sampleTexts) {
				return Optional.ofNullable(detectedLanguage);
			}
		};
	}

	public int clientCount() {
		return clients.get();
	}

	public int callCount() {
		return calls.get();
	}

	public int peakConcurrency() {
		return peak.get();
	}
}
