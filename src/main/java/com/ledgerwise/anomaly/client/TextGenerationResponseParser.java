package com.ledgerwise.anomaly.client;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls short reason and factor lists out of a free-text answer.
 *
 * Bullet ("-", "*", "•") and numbered ("1.", "2)") lines are collected. A line mentioning
 * "reason" or "factor" switches which list following items go to; items seen before any
 * such heading count as reasons.
 */
public final class TextGenerationResponseParser {

    private static final Pattern LIST_ITEM = Pattern.compile("^\\s*(?:[-*•]+|\\d+[.)])\\s+(.*)$");

    private TextGenerationResponseParser() {}

    public record Insights(List<String> reasons, List<String> factors) {}

    public static Insights parse(String text, int maxItems) {
        List<String> reasons = new ArrayList<>();
        List<String> factors = new ArrayList<>();
        if (text == null) return new Insights(reasons, factors);

        List<String> current = reasons;
        for (String line : text.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) continue;

            Matcher matcher = LIST_ITEM.matcher(trimmed);
            String item = matcher.matches() ? matcher.group(1).trim() : null;
            String lower = trimmed.toLowerCase(Locale.ROOT);

            // "1. Possible business reasons:" is a heading, not an item
            boolean heading = item == null || item.endsWith(":");
            if (heading) {
                if (lower.contains("factor")) {
                    current = factors;
                } else if (lower.contains("reason")) {
                    current = reasons;
                } else if (item != null) {
                    current = null;
                }
                continue;
            }

            if (current != null && current.size() < maxItems && !item.isEmpty()) {
                current.add(item);
            }
        }
        return new Insights(reasons, factors);
    }
}
