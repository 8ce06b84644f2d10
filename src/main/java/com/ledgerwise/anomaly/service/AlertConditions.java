package com.ledgerwise.anomaly.service;

import com.ledgerwise.anomaly.model.AffectedField;
import com.ledgerwise.anomaly.model.AlgorithmType;
import com.ledgerwise.anomaly.model.DetectedAnomaly;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Evaluates suppression and escalation conditions.
 *
 * Syntax: {@code *}, {@code all} or blank match everything. Otherwise one or more
 * {@code key:value} (or {@code key=value}) clauses joined by {@code &&}, all of which must hold.
 * A value may list alternatives separated by {@code |}. Keys: severity, field, category,
 * urgency, type, algorithm. Comparison ignores case. Unknown keys never match.
 */
public final class AlertConditions {

    public static final String SEVERITY = "severity";
    public static final String FIELD = "field";
    public static final String CATEGORY = "category";
    public static final String URGENCY = "urgency";
    public static final String TYPE = "type";
    public static final String ALGORITHM = "algorithm";

    private AlertConditions() {}

    public static boolean matchesAll(String condition) {
        if (condition == null) return true;
        String trimmed = condition.trim();
        return trimmed.isEmpty() || trimmed.equals("*") || trimmed.equalsIgnoreCase("all");
    }

    public static boolean matches(String condition, DetectedAnomaly anomaly) {
        return matches(condition, attributesOf(anomaly));
    }

    public static boolean matches(String condition, Map<String, List<String>> attributes) {
        if (matchesAll(condition)) return true;

        for (String clause : condition.split("&&")) {
            String c = clause.trim();
            int sep = separatorIndex(c);
            if (sep <= 0 || sep == c.length() - 1) return false;

            String key = c.substring(0, sep).trim().toLowerCase(Locale.ROOT);
            String expected = c.substring(sep + 1).trim();
            List<String> actual = attributes.get(key);
            if (actual == null || actual.isEmpty()) return false;

            boolean clauseMatches = false;
            for (String alternative : expected.split("\\|")) {
                String alt = alternative.trim();
                if (actual.stream().anyMatch(a -> a.equalsIgnoreCase(alt))) {
                    clauseMatches = true;
                    break;
                }
            }
            if (!clauseMatches) return false;
        }
        return true;
    }

    public static Map<String, List<String>> attributesOf(DetectedAnomaly anomaly) {
        Map<String, List<String>> attributes = new LinkedHashMap<>();
        if (anomaly.getSeverity() != null) {
            attributes.put(SEVERITY, List.of(anomaly.getSeverity().name()));
        }
        if (anomaly.getType() != null) {
            attributes.put(TYPE, List.of(anomaly.getType().name()));
        }
        List<String> fields = new ArrayList<>();
        for (AffectedField field : anomaly.getAffectedFields()) {
            fields.add(field.getFieldName());
        }
        attributes.put(FIELD, fields);
        List<String> algorithms = new ArrayList<>();
        for (AlgorithmType algorithm : anomaly.getDetectedBy()) {
            algorithms.add(algorithm.name());
        }
        attributes.put(ALGORITHM, algorithms);
        if (anomaly.getBusinessImpact() != null) {
            if (anomaly.getBusinessImpact().getCategory() != null) {
                attributes.put(CATEGORY, List.of(anomaly.getBusinessImpact().getCategory().name()));
            }
            if (anomaly.getBusinessImpact().getUrgency() != null) {
                attributes.put(URGENCY, List.of(anomaly.getBusinessImpact().getUrgency().name()));
            }
        }
        return attributes;
    }

    private static int separatorIndex(String clause) {
        int colon = clause.indexOf(':');
        int equals = clause.indexOf('=');
        if (colon < 0) return equals;
        if (equals < 0) return colon;
        return Math.min(colon, equals);
    }
}
