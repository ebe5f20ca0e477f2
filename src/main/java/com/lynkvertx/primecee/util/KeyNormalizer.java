package com.lynkvertx.primecee.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * String matching helpers for dynamic-parameter keys, schema field names/labels
 * and building-type labels.
 *
 * All methods return an empty string for null or blank input, which never
 * matches a real key.
 */
public final class KeyNormalizer {

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
    private static final Pattern SLUG_SEPARATORS = Pattern.compile("[-\\s]+");

    private KeyNormalizer() {
    }

    /**
     * Trim and lower-case.
     */
    public static String normalizeKey(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Label form used to compare dynamic-parameter keys with schema labels:
     * diacritics removed, lower-cased, every run of non-alphanumerics collapsed
     * into a single space.
     * <p>
     * Example: {@code "Surface isolée (m²)"} becomes {@code "surface isolee m2"}.
     */
    public static String normalizeLabel(String value) {
        if (value == null) {
            return "";
        }
        String folded = stripDiacritics(value).toLowerCase(Locale.ROOT);
        return NON_ALPHANUMERIC.matcher(folded).replaceAll(" ").trim();
    }

    /**
     * Slug form used for category keys and formula variable keys:
     * {@code "Éclairage LED"} becomes {@code "eclairage_led"}.
     */
    public static String slug(String value) {
        if (value == null) {
            return "";
        }
        String folded = stripDiacritics(value)
            .replace("œ", "oe")
            .replace("æ", "ae")
            .trim();
        return SLUG_SEPARATORS.matcher(folded).replaceAll("_").toLowerCase(Locale.ROOT);
    }

    /**
     * True when {@code candidate} equals {@code target} in label form, or starts
     * with it followed by a separator ("Surface isolée (m²)" matches "surface isolée").
     */
    public static boolean labelMatches(String candidate, String target) {
        String normalizedCandidate = normalizeLabel(candidate);
        String normalizedTarget = normalizeLabel(target);
        if (normalizedCandidate.isEmpty() || normalizedTarget.isEmpty()) {
            return false;
        }
        return normalizedCandidate.equals(normalizedTarget)
            || normalizedCandidate.startsWith(normalizedTarget + " ");
    }

    private static String stripDiacritics(String value) {
        String decomposed = Normalizer.normalize(value, Normalizer.Form.NFD);
        return DIACRITICS.matcher(decomposed).replaceAll("");
    }
}
