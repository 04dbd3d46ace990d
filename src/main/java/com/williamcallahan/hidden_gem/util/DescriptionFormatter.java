package com.williamcallahan.hidden_gem.util;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Cleans provider descriptions into short display text
 */
public final class DescriptionFormatter {

    private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");

    private DescriptionFormatter() {
        // Prevent instantiation
    }

    public static String stripHtml(String text) {
        if (text == null) {
            return null;
        }
        return HTML_TAG.matcher(text).replaceAll("");
    }

    /**
     * Keeps the first {@code maxSentences} sentences, HTML removed, whitespace collapsed
     *
     * @return trimmed text ending with a period, or null if nothing is left
     */
    public static String firstSentences(String raw, int maxSentences) {
        List<String> sentences = sentences(raw);
        if (sentences.isEmpty()) {
            return null;
        }
        return String.join(". ", sentences.subList(0, Math.min(maxSentences, sentences.size()))) + ".";
    }

    /**
     * Shapes an overview into one or two paragraphs
     * - At most 8 sentences are kept
     * - With 6 or more sentences the first 4 form one paragraph and the rest a second one
     *
     * @return formatted text, or null if nothing is left
     */
    public static String paragraphs(String raw) {
        List<String> sentences = sentences(raw);
        if (sentences.isEmpty()) {
            return null;
        }
        List<String> selected = sentences.subList(0, Math.min(8, sentences.size()));
        if (selected.size() >= 6) {
            return String.join(". ", selected.subList(0, 4)) + ".\n\n"
                + String.join(". ", selected.subList(4, selected.size())) + ".";
        }
        return String.join(". ", selected) + ".";
    }

    static List<String> sentences(String raw) {
        if (raw == null) {
            return List.of();
        }
        String cleaned = WHITESPACE.matcher(stripHtml(raw)).replaceAll(" ").strip();
        List<String> result = new ArrayList<>();
        for (String part : SENTENCE_END.split(cleaned)) {
            String sentence = part.strip();
            if (!sentence.isEmpty()) {
                result.add(sentence);
            }
        }
        return result;
    }
}
