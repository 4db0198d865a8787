package com.clinicflow.ingestion.service;

import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Guesses the language a complaint was written in, so the provider can answer in kind.
 */
@Component
public class LanguageDetector {

    public enum Language {
        LATVIAN, RUSSIAN, GERMAN, ENGLISH;

        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private static final Pattern LATVIAN_CHARS = Pattern.compile("[āēīōūģķļņšž]");
    // stems match at a word start, short words only as whole words
    private static final Pattern LATVIAN_WORDS = Pattern.compile(
            "(?<!\\p{L})(?:sāp|klepu|temperatūr|drudz|galv|kuņģ|elpošan|rīkl|krūt|vēder|mugur|degun|sird|pēd)"
                    + "|(?<!\\p{L})(?:seja|roku|kāju|acu|ausi)(?!\\p{L})");

    private static final Pattern CYRILLIC = Pattern.compile("[а-яё]");
    private static final Pattern GERMAN_WORDS = Pattern.compile(
            "(?<!\\p{L})(schmerzen|fieber|husten|kopf|bauch|brust|rücken|arm|bein|herz|augen|ohren|nase)(?!\\p{L})");

    public Language detect(@Nullable String text) {
        if (text == null || text.isBlank()) {
            return Language.ENGLISH;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (LATVIAN_CHARS.matcher(lower).find() || LATVIAN_WORDS.matcher(lower).find()) {
            return Language.LATVIAN;
        }
        if (CYRILLIC.matcher(lower).find()) {
            return Language.RUSSIAN;
        }
        if (GERMAN_WORDS.matcher(lower).find()) {
            return Language.GERMAN;
        }
        return Language.ENGLISH;
    }
}
