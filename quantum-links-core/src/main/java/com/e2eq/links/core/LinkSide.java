package com.e2eq.links.core;

/** Which end of a link an entity occupies. */
public enum LinkSide {
    SOURCE,
    TARGET;

    public static LinkSide of(Link link, EntityRef ref) {
        if (ref.equals(link.getSource())) return SOURCE;
        if (ref.equals(link.getTarget())) return TARGET;
        throw new IllegalArgumentException(ref + " is not an end of " + link);
    }

    public EntityRef counterpart(Link link) {
        return this == SOURCE ? link.getTarget() : link.getSource();
    }
}
