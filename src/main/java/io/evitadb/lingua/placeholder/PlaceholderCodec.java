package io.evitadb.lingua.placeholder;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Protects interpolation placeholders from the translation provider and restores them afterwards.
 *
 * {@link #protect(String)} scans the text once, left to right, against all {@link PlaceholderGrammar}s
 * in priority order and replaces each match with a marker `⟦n⟧`, where `n` is the token's position.
 * Markers contain no character any grammar matches, so they never get protected twice.
 *
 * {@link #restore(String, List)} replaces the markers it finds in the translated text, in the order
 * they appear, with the tokens in their capture order. The number inside a marker is not trusted:
 * providers are free to move markers around, the tokens still come back in source order.
 *
 * Instances are stateless and thread safe.
 */
public final class PlaceholderCodec {

	static final String MARKER_OPEN = "⟦";
	static final String MARKER_CLOSE = "⟧";

	private static final Pattern TOKEN_PATTERN = PlaceholderGrammar.combinedPattern();
	// tolerate whitespace the provider may insert inside the brackets
	private static final Pattern MARKER_PATTERN = Pattern.compile(
		MARKER_OPEN + "\\s*\\d+\\s*" + MARKER_CLOSE
	);

	/**
	 * Finds all placeholder tokens in the text without modifying it.
	 *
	 * @param text text to scan
	 * @return tokens in left-to-right order, non-overlapping
	 */
	@Nonnull
	public List<PlaceholderToken> findTokens(@Nonnull String text) {
		Objects.requireNonNull(text, "text must not be null");
		final List<PlaceholderToken> tokens = new ArrayList<>();
		final Matcher matcher = TOKEN_PATTERN.matcher(text);
		while (matcher.find()) {
			tokens.add(new PlaceholderToken(matcher.group(), grammarOf(matcher), matcher.start(), matcher.end()));
		}
		return tokens;
	}

	/**
	 * Replaces each placeholder token with a positional marker.
	 *
	 * @param text source text
	 * @return stripped text and the extracted tokens
	 */
	@Nonnull
	public ProtectedText protect(@Nonnull String text) {
		final List<PlaceholderToken> tokens = findTokens(text);
		if (tokens.isEmpty()) {
			return new ProtectedText(text, tokens);
		}
		final StringBuilder sb = new StringBuilder(text.length() + tokens.size() * 3);
		int lastEnd = 0;
		for (int i = 0; i < tokens.size(); i++) {
			final PlaceholderToken token = tokens.get(i);
			sb.append(text, lastEnd, token.start());
			sb.append(marker(i));
			lastEnd = token.end();
		}
		sb.append(text, lastEnd, text.length());
		return new ProtectedText(sb.toString(), tokens);
	}

	/**
	 * Replaces markers in the translated text with the original tokens.
	 *
	 * When the marker count differs from the token count, tokens are substituted by position up to
	 * the shorter length; surplus markers stay in the text and surplus tokens are dropped. The caller
	 * learns about it through {@link RestoredText#isMismatch()}.
	 *
	 * @param translatedText provider output produced from a stripped text
	 * @param tokens         tokens returned by {@link #protect(String)}
	 * @return restored text and marker statistics
	 */
	@Nonnull
	public RestoredText restore(@Nonnull String translatedText, @Nonnull List<PlaceholderToken> tokens) {
		Objects.requireNonNull(translatedText, "translatedText must not be null");
		Objects.requireNonNull(tokens, "tokens must not be null");

		final Matcher matcher = MARKER_PATTERN.matcher(translatedText);
		final StringBuilder sb = new StringBuilder(translatedText.length());
		int found = 0;
		while (matcher.find()) {
			if (found < tokens.size()) {
				matcher.appendReplacement(sb, Matcher.quoteReplacement(tokens.get(found).text()));
			}
			found++;
		}
		matcher.appendTail(sb);
		return new RestoredText(sb.toString(), found, tokens.size());
	}

	/**
	 * Returns the marker inserted for the token at the given position.
	 *
	 * @param index token position
	 * @return marker text
	 */
	@Nonnull
	public static String marker(int index) {
		return MARKER_OPEN + index + MARKER_CLOSE;
	}

	@Nonnull
	private static PlaceholderGrammar grammarOf(@Nonnull Matcher matcher) {
		final PlaceholderGrammar[] grammars = PlaceholderGrammar.values();
		for (int i = 0; i < grammars.length; i++) {
			if (matcher.group(i + 1) != null) {
				return grammars[i];
			}
		}
		throw new IllegalStateException("Match without grammar group: " + matcher.group());
	}
}
