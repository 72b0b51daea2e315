package com.e2eq.links.exceptions;

/**
 * Thrown when a repository or the link registry has no record for the requested id.
 */
public class NotFoundException extends LinkEngineException {
    private static final long serialVersionUID = 1L;

    private final String entityType;
    private final String entityId;

    public NotFoundException(String entityType, String entityId) {
        super(String.format("%s[%s] not found", entityType, entityId));
        this.entityType = entityType;
        this.entityId = entityId;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getEntityId() {
        return entityId;
    }
}
