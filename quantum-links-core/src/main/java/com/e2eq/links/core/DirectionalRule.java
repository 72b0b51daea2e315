package com.e2eq.links.core;

import java.util.List;

/**
 * Fires {@code action} against the far end of a {@code linkType} link when {@code trigger}
 * happens on the near end and every condition holds. An empty condition list always matches.
 */
public record DirectionalRule(
        LinkType linkType,
        RuleDirection direction,
        LifecycleEvent trigger,
        RuleAction action,
        List<RuleCondition> conditions
) {

    public DirectionalRule {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }
}
