package com.phillippitts.captionhub.domain;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Catalogue of languages the caption service accepts as source or target.
 *
 * @param code ISO 639-1 code
 * @param name English display name
 * @param flag emoji flag shown by display clients
 */
public record Language(String code, String name, String flag) {

    private static final Map<String, Language> CATALOGUE = Stream.of(
            new Language("ar", "Arabic", "🇸🇦"),
            new Language("en", "English", "🇺🇸"),
            new Language("es", "Spanish", "🇪🇸"),
            new Language("fr", "French", "🇫🇷"),
            new Language("de", "German", "🇩🇪"),
            new Language("ja", "Japanese", "🇯🇵"),
            new Language("nl", "Dutch", "🇳🇱"),
            new Language("ur", "Urdu", "🇵🇰"),
            new Language("tr", "Turkish", "🇹🇷"),
            new Language("id", "Indonesian", "🇮🇩"),
            new Language("ms", "Malay", "🇲🇾")
    ).collect(Collectors.toMap(Language::code, Function.identity(),
            (a, b) -> a, LinkedHashMap::new));

    /**
     * Looks up a language by code, case-insensitively.
     */
    public static Optional<Language> find(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(CATALOGUE.get(code.trim().toLowerCase(Locale.ROOT)));
    }

    public static boolean isSupported(String code) {
        return find(code).isPresent();
    }

    public static Collection<Language> all() {
        return CATALOGUE.values();
    }
}
