package com.pricecheck.common.matching;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes item display names so that source listings can be matched case- and
 * punctuation-insensitively: {@code "Shavronne's  Wrappings"} and {@code "shavronnes wrappings"}
 * normalize to the same key.
 */
public final class ItemNameNormalizer {

    private static final Pattern DIACRITICS   = Pattern.compile("\\p{M}+");
    private static final Pattern PUNCTUATION  = Pattern.compile("[^\\p{L}\\p{N}\\s]+");
    private static final Pattern WHITESPACE   = Pattern.compile("\\s+");

    private ItemNameNormalizer() {}

    /**
     * @return the normalized key; empty string for {@code null} or blank input
     */
    public static String normalize(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        String decomposed = Normalizer.normalize(name, Normalizer.Form.NFD);
        String stripped   = DIACRITICS.matcher(decomposed).replaceAll("");
        String noPunct    = PUNCTUATION.matcher(stripped).replaceAll("");
        return WHITESPACE.matcher(noPunct).replaceAll(" ").trim().toLowerCase(Locale.ROOT);
    }

    public static boolean matches(String a, String b) {
        String left = normalize(a);
        return !left.isEmpty() && left.equals(normalize(b));
    }
}
