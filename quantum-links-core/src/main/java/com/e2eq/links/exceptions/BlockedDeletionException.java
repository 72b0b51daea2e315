package com.e2eq.links.exceptions;

import com.e2eq.links.core.EntityRef;
import com.e2eq.links.core.Link;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a {@code block} delete policy prevents an entity from being removed.
 * Nothing has been mutated when this is raised.
 */
public class BlockedDeletionException extends LinkEngineException {
    private static final long serialVersionUID = 1L;

    private final EntityRef entity;
    private final transient List<Link> blockingLinks;

    public BlockedDeletionException(EntityRef entity, List<Link> blockingLinks) {
        super(buildMessage(entity, blockingLinks));
        this.entity = entity;
        this.blockingLinks = List.copyOf(blockingLinks);
    }

    private static String buildMessage(EntityRef entity, List<Link> blockingLinks) {
        String links = blockingLinks.stream()
                .map(l -> l.getLinkType() + "(" + l.getSource().key() + " -> " + l.getTarget().key() + ")")
                .collect(Collectors.joining(", "));
        return String.format("Deletion of %s is blocked by: %s", entity.key(), links);
    }

    public EntityRef getEntity() {
        return entity;
    }

    public List<Link> getBlockingLinks() {
        return blockingLinks;
    }
}
