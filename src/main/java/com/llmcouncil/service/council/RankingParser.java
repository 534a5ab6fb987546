package com.llmcouncil.service.council;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a ranked label list from a peer-ranking reply.
 *
 * <p>Pure and total: any input, including {@code null}, yields a list, possibly empty.
 * <ol>
 *   <li>If the text contains {@value #MARKER}, the numbered entries after it
 *       ({@code 1. Response C}) are read top to bottom. When that section has no numbered
 *       entries, any {@code Response X} mentions in the section are used instead.</li>
 *   <li>Without the marker, every {@code Response X} mention in the whole text is used in
 *       order of first appearance.</li>
 * </ol>
 * Duplicates are dropped (first occurrence wins). Returned values are bare label codes.
 */
public final class RankingParser {

    public static final String MARKER = "FINAL RANKING:";

    private static final Pattern NUMBERED = Pattern.compile("\\d+\\.\\s*Response ([A-Z]+)\\b");
    private static final Pattern MENTION = Pattern.compile("Response ([A-Z]+)\\b");

    private RankingParser() {
    }

    public static List<String> parse(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        int marker = text.indexOf(MARKER);
        if (marker >= 0) {
            String section = text.substring(marker + MARKER.length());
            List<String> numbered = collect(NUMBERED, section);
            return numbered.isEmpty() ? collect(MENTION, section) : numbered;
        }
        return collect(MENTION, text);
    }

    /**
     * Like {@link #parse(String)} but keeps only labels in {@code expectedLabels}.
     */
    public static List<String> parse(String text, Collection<String> expectedLabels) {
        List<String> parsed = parse(text);
        if (expectedLabels == null) {
            return parsed;
        }
        List<String> filtered = new ArrayList<>(parsed.size());
        for (String label : parsed) {
            if (expectedLabels.contains(label)) {
                filtered.add(label);
            }
        }
        return List.copyOf(filtered);
    }

    private static List<String> collect(Pattern pattern, String text) {
        Set<String> labels = new LinkedHashSet<>();
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            labels.add(m.group(1));
        }
        return List.copyOf(labels);
    }
}
