package com.e2eq.links.core;

/**
 * Which end of a link must experience the lifecycle event for a directional rule to fire.
 * {@code FORWARD} means the source end, {@code BACKWARD} the target end.
 */
public enum RuleDirection {
    FORWARD,
    BACKWARD,
    BIDIRECTIONAL;

    public boolean accepts(LinkSide subjectSide) {
        return switch (this) {
            case FORWARD -> subjectSide == LinkSide.SOURCE;
            case BACKWARD -> subjectSide == LinkSide.TARGET;
            case BIDIRECTIONAL -> true;
        };
    }
}
