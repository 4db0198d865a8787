package com.clinicflow.inventory;

import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reduces a drug name to a comparison key: package sizes, trailing dosage-form words and
 * locale-specific descriptive phrases are dropped, dosage notation is unified.
 * <p>
 * The rewrite runs until nothing changes, so {@code normalize(normalize(x)).equals(normalize(x))}.
 */
@Component
public class DrugNameNormalizer {

    private static final int MAX_PASSES = 32;

    private static final String NOT_WORD = "(?![\\p{L}\\p{N}])";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DESCRIPTIVE_PHRASES = Pattern.compile(
            "(?<![\\p{L}\\p{N}])(?:orally disintegrating|film-coated|film coated|coated|mutē disperģējamās|apvalkotās)"
                    + NOT_WORD);
    private static final Pattern PACKAGE_SIZE = Pattern.compile("\\s+n\\d+(?!\\p{L}).*$");
    private static final Pattern DETACHED_UNIT = Pattern.compile("(\\d)\\s+(mg|mcg|ml|g)" + NOT_WORD);
    private static final Pattern DOSAGE_RATIO = Pattern.compile(
            "(\\d+(?:[.,]\\d+)?)(mg|mcg|ml|g)\\s*/\\s*\\d+(?:[.,]\\d+)?\\s*(?:mg|mcg|ml|g)" + NOT_WORD);
    private static final Pattern FORM_AND_UNIT_WORDS = Pattern.compile(
            "\\s+(?:tablets?|tabletes?|tablete|capsules?|kapsulas?|kapsula|ml|mg|g)$");

    public String normalize(@Nullable String raw) {
        if (raw == null) {
            return "";
        }
        String current = raw;
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            String next = rewrite(current);
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }
        return current;
    }

    /**
     * Lower-cases and collapses whitespace only; the key for exact-name comparison.
     */
    public String collapse(@Nullable String raw) {
        if (raw == null) {
            return "";
        }
        return WHITESPACE.matcher(raw.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    private String rewrite(String value) {
        String out = collapse(value);
        out = DESCRIPTIVE_PHRASES.matcher(out).replaceAll("");
        out = collapse(out);
        out = PACKAGE_SIZE.matcher(out).replaceAll("");
        out = DETACHED_UNIT.matcher(out).replaceAll("$1$2");
        out = DOSAGE_RATIO.matcher(out).replaceAll("$1$2");
        out = FORM_AND_UNIT_WORDS.matcher(out).replaceAll("");
        return collapse(out);
    }
}
