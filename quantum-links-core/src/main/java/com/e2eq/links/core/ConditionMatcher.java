package com.e2eq.links.core;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pure evaluation of {@link RuleCondition}s against a snapshot of the two ends of a link.
 */
public final class ConditionMatcher {

    /**
     * What the conditions can see. {@code targetStatus} is null when the target does not exist yet.
     */
    public record Snapshot(String sourceStatus, String targetStatus, Map<String, Object> sourceMetadata) {
        public Snapshot {
            sourceMetadata = sourceMetadata == null ? Map.of() : sourceMetadata;
        }
    }

    private ConditionMatcher() { }

    public static boolean matchesAll(List<RuleCondition> conditions, Snapshot snapshot) {
        if (conditions == null || conditions.isEmpty()) return true;
        for (RuleCondition c : conditions) {
            if (!matches(c, snapshot)) return false;
        }
        return true;
    }

    public static boolean matches(RuleCondition condition, Snapshot snapshot) {
        if (condition == null || condition instanceof RuleCondition.Always) {
            return true;
        }
        if (condition instanceof RuleCondition.StatusEquals se) {
            String actual = se.side() == LinkSide.SOURCE ? snapshot.sourceStatus() : snapshot.targetStatus();
            return se.status().equals(actual);
        }
        if (condition instanceof RuleCondition.MetadataSubset ms) {
            for (Map.Entry<String, Object> e : ms.expected().entrySet()) {
                if (!snapshot.sourceMetadata().containsKey(e.getKey())) return false;
                if (!valueEquals(e.getValue(), snapshot.sourceMetadata().get(e.getKey()))) return false;
            }
            return true;
        }
        throw new IllegalArgumentException("Unsupported condition " + condition);
    }

    // YAML numbers come back as Integer while entities may carry Long or Double.
    private static boolean valueEquals(Object expected, Object actual) {
        if (expected instanceof Number en && actual instanceof Number an) {
            return new BigDecimal(en.toString()).compareTo(new BigDecimal(an.toString())) == 0;
        }
        return Objects.equals(expected, actual);
    }
}
