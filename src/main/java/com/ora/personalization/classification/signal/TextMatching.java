package com.ora.personalization.classification.signal;

import com.ora.personalization.taxonomy.TaxonomyModels.Interest;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/** Normalization shared by the text-based signals. */
public final class TextMatching {
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final int MIN_TOKEN_LENGTH = 3;
    static final int MIN_PREFIX_LENGTH = 4;

    private TextMatching() {
    }

    /** Lowercase words longer than two characters, punctuation stripped, first-seen order. */
    public static List<String> tokens(String text) {
        if (text == null || text.isBlank()) return List.of();
        List<String> out = new ArrayList<>();
        for (String part : NON_WORD.split(text.toLowerCase(Locale.ROOT))) {
            if (part.length() >= MIN_TOKEN_LENGTH) out.add(part);
        }
        return out;
    }

    public static Set<String> tokenSet(String text) {
        return new LinkedHashSet<>(tokens(text));
    }

    /** Space-separated lowercase words, used for phrase containment. */
    public static String phrase(String text) {
        if (text == null) return "";
        return NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    /** Tag form: lowercase, no leading '#', inner whitespace and underscores become '-'. */
    public static String tag(String text) {
        if (text == null) return "";
        String t = text.trim().toLowerCase(Locale.ROOT);
        while (t.startsWith("#")) t = t.substring(1);
        return t.replaceAll("[\\s_]+", "-");
    }

    /** Name, keywords and synonyms of an interest as phrases. */
    public static List<String> terms(Interest interest) {
        List<String> out = new ArrayList<>();
        out.add(phrase(interest.name()));
        interest.keywords().forEach(k -> out.add(phrase(k)));
        interest.synonyms().forEach(s -> out.add(phrase(s)));
        out.removeIf(String::isEmpty);
        return out;
    }

    static boolean containsPhrase(String haystackPhrase, String needlePhrase) {
        if (needlePhrase.isEmpty()) return false;
        return (" " + haystackPhrase + " ").contains(" " + needlePhrase + " ");
    }

    static boolean prefixOverlap(String token, String word) {
        if (token.length() < MIN_PREFIX_LENGTH || word.length() < MIN_PREFIX_LENGTH) return false;
        return token.startsWith(word) || word.startsWith(token);
    }

    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) return 0.0;
        Set<String> union = new LinkedHashSet<>(a);
        union.addAll(b);
        long intersection = a.stream().filter(b::contains).count();
        return (double) intersection / union.size();
    }
}
