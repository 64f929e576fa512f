package io.evitadb.lingua.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Fixed table of languages the plugin is able to translate from and to.
 * Codes follow the conventions of the remote translation services (mostly ISO 639-1,
 * with a region suffix where the service requires one).
 */
public enum Language {

	ENGLISH("en", "English"),
	SPANISH("es", "Spanish"),
	FRENCH("fr", "French"),
	GERMAN("de", "German"),
	ITALIAN("it", "Italian"),
	PORTUGUESE("pt", "Portuguese"),
	JAPANESE("ja", "Japanese"),
	CHINESE_SIMPLIFIED("zh-CN", "Chinese (Simplified)"),
	RUSSIAN("ru", "Russian"),
	ARABIC("ar", "Arabic"),
	HINDI("hi", "Hindi"),
	KOREAN("ko", "Korean"),
	DUTCH("nl", "Dutch"),
	POLISH("pl", "Polish"),
	SWEDISH("sv", "Swedish"),
	TURKISH("tr", "Turkish"),
	VIETNAMESE("vi", "Vietnamese"),
	CATALAN("ca", "Catalan");

	@Nonnull
	private final String code;
	@Nonnull
	private final String displayName;

	Language(@Nonnull String code, @Nonnull String displayName) {
		this.code = code;
		this.displayName = displayName;
	}

	@Nonnull
	public String getCode() {
		return this.code;
	}

	@Nonnull
	public String getDisplayName() {
		return this.displayName;
	}

	/**
	 * Looks up a language by its code. The lookup ignores case and accepts `_` in place of `-`,
	 * so `zh_cn` resolves to {@link #CHINESE_SIMPLIFIED}.
	 *
	 * @param code language code, may be null
	 * @return the matching language or empty when the code is unknown
	 */
	@Nonnull
	public static Optional<Language> fromCode(@Nullable String code) {
		if (code == null || code.isBlank()) {
			return Optional.empty();
		}
		final String normalized = code.trim().replace('_', '-').toLowerCase(Locale.ROOT);
		return Arrays.stream(values())
			.filter(it -> it.code.toLowerCase(Locale.ROOT).equals(normalized))
			.findFirst();
	}

	/**
	 * Returns all languages sorted by their display name, as printed by the `list-languages` action.
	 *
	 * @return languages ordered by display name
	 */
	@Nonnull
	public static List<Language> sortedByDisplayName() {
		return Arrays.stream(values())
			.sorted(Comparator.comparing(Language::getDisplayName))
			.collect(Collectors.toList());
	}

	@Override
	public String toString() {
		return this.displayName + " (" + this.code + ")";
	}
}
