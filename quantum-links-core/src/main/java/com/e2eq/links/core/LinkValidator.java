package com.e2eq.links.core;

import com.e2eq.links.exceptions.ValidationException;

import java.util.Map;

/**
 * Structural checks applied before a link is stored: both ends present, end types matching the
 * link type, no self reference and non-blank metadata keys. Optionally checks that both ends
 * exist.
 */
public class LinkValidator {

    private final EntityResolver existenceCheck;

    public LinkValidator() {
        this(null);
    }

    /**
     * @param existenceCheck when non-null, both ends must resolve to a stored entity
     */
    public LinkValidator(EntityResolver existenceCheck) {
        this.existenceCheck = existenceCheck;
    }

    public void validate(Link link) {
        if (link == null) {
            throw new ValidationException("Link must not be null");
        }
        if (link.getId() == null || link.getId().isBlank()) {
            throw new ValidationException("Link id must not be blank");
        }
        LinkType type = link.getLinkType();
        if (type == null) {
            throw new ValidationException("Link " + link.getId() + " has no link type");
        }
        requireEnd(link, link.getSource(), "source");
        requireEnd(link, link.getTarget(), "target");
        if (link.getSource().type() != type.sourceType() || link.getTarget().type() != type.targetType()) {
            throw new ValidationException(String.format("%s links %s to %s, got %s -> %s",
                    type, type.sourceType().key(), type.targetType().key(),
                    link.getSource().type().key(), link.getTarget().type().key()));
        }
        if (link.getSource().equals(link.getTarget())) {
            throw new ValidationException("Link " + link.getId() + " references " + link.getSource() + " on both ends");
        }
        validateMetadata(link.getMetadata());
        if (existenceCheck != null) {
            requireExists(link.getSource());
            requireExists(link.getTarget());
        }
    }

    public void validateMetadata(Map<String, Object> metadata) {
        if (metadata == null) return;
        for (String k : metadata.keySet()) {
            if (k == null || k.isBlank()) {
                throw new ValidationException("Link metadata keys must not be blank");
            }
        }
    }

    private void requireEnd(Link link, EntityRef end, String name) {
        if (end == null || end.type() == null || end.id() == null || end.id().isBlank()) {
            throw new ValidationException("Link " + link.getId() + " has an empty " + name);
        }
    }

    private void requireExists(EntityRef ref) {
        if (existenceCheck.resolve(ref).isEmpty()) {
            throw new ValidationException("Linked entity " + ref + " does not exist");
        }
    }
}
