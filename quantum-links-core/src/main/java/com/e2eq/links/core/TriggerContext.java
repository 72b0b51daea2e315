package com.e2eq.links.core;

/**
 * The entity a lifecycle event happened to, plus whatever is known about the other end.
 * {@code previous}, {@code counterpart} and {@code link} may be null; a {@code create_target}
 * action has no counterpart yet.
 */
public record TriggerContext(LinkableEntity subject, LinkableEntity previous, LinkableEntity counterpart, Link link) {

    public static TriggerContext of(LinkableEntity subject) {
        return new TriggerContext(subject, null, null, null);
    }

    public static TriggerContext of(LinkableEntity subject, LinkableEntity previous) {
        return new TriggerContext(subject, previous, null, null);
    }
}
