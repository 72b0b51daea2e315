package com.e2eq.links.core;

import java.util.List;

/**
 * Rules that fired, in declaration order, and matched rules that had no handler to run them.
 */
public record TriggerResult(LinkType linkType, LifecycleEvent event, List<DirectionalRule> fired, List<DirectionalRule> unhandled) {

    public TriggerResult {
        fired = fired == null ? List.of() : List.copyOf(fired);
        unhandled = unhandled == null ? List.of() : List.copyOf(unhandled);
    }

    public boolean triggered() {
        return !fired.isEmpty();
    }
}
