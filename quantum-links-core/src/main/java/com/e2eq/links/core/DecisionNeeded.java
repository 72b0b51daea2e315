package com.e2eq.links.core;

/**
 * A {@code prompt} policy hit: nothing was done to {@code counterpart}; the caller decides.
 */
public record DecisionNeeded(Kind kind, EntityRef entity, EntityRef counterpart, Link link) {

    public enum Kind { DELETE, UPDATE }

    public String message() {
        return String.format("%s of %s affects %s through %s; confirm what to do with %s",
                kind == Kind.DELETE ? "Deletion" : "Update", entity, counterpart, link.getLinkType(), counterpart);
    }
}
