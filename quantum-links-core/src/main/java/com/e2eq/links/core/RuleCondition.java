package com.e2eq.links.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Conditions attached to a {@link DirectionalRule}. Evaluated by {@link ConditionMatcher}.
 */
public sealed interface RuleCondition
        permits RuleCondition.StatusEquals, RuleCondition.MetadataSubset, RuleCondition.Always {

    /** Exact equality against the lifecycle status of one end of the link. */
    record StatusEquals(LinkSide side, String status) implements RuleCondition {
        public StatusEquals {
            Objects.requireNonNull(side, "side");
            Objects.requireNonNull(status, "status");
        }
    }

    /** Every listed key must be present on the source end's trigger metadata with an equal value. */
    record MetadataSubset(Map<String, Object> expected) implements RuleCondition {
        public MetadataSubset {
            expected = expected == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(expected));
        }
    }

    record Always() implements RuleCondition {
    }
}
