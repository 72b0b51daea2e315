package com.e2eq.links.core;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Read-only view of one entity's links, grouped by the entity type of the other end.
 * Map keys are entity type keys ({@code "item"}, {@code "site"}, ...).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RelationshipGraph(
        String entityId,
        String entityType,
        Map<String, List<Link>> outgoing,
        Map<String, List<Link>> incoming,
        Map<String, List<String>> counterparts
) {

    public RelationshipGraph {
        outgoing = outgoing == null ? Map.of() : outgoing;
        incoming = incoming == null ? Map.of() : incoming;
        counterparts = counterparts == null ? Map.of() : counterparts;
    }

    public int linkCount() {
        return outgoing.values().stream().mapToInt(List::size).sum()
                + incoming.values().stream().mapToInt(List::size).sum();
    }
}
