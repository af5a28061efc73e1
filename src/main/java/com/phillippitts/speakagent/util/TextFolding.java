package com.phillippitts.speakagent.util;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Case and accent folding for matching spoken words ("Mamá" matches "mama").
 */
public final class TextFolding {

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    private TextFolding() {}

    /** Lower-cases, strips accents and trims; returns "" for null. */
    public static String fold(String s) {
        if (s == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(s, Normalizer.Form.NFD);
        return DIACRITICS.matcher(decomposed).replaceAll("").toLowerCase(Locale.ROOT).strip();
    }

    /** Folded words of {@code s}, punctuation removed. */
    public static List<String> words(String s) {
        String folded = fold(s);
        if (folded.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(NON_WORD.split(folded)).filter(w -> !w.isEmpty()).toList();
    }

    /**
     * Whether {@code phrase} occurs in {@code text} on word boundaries, ignoring case and accents.
     */
    public static boolean containsPhrase(String text, String phrase) {
        String haystack = ' ' + String.join(" ", words(text)) + ' ';
        String needle = ' ' + String.join(" ", words(phrase)) + ' ';
        return needle.length() > 2 && haystack.contains(needle);
    }
}
