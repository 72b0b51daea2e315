package com.e2eq.links.core;

/**
 * Delete and update policies for one link type, per side of the link.
 */
public record LinkRule(
        LinkType linkType,
        DeletePolicy onSourceDelete,
        DeletePolicy onTargetDelete,
        UpdatePolicy onSourceUpdate,
        UpdatePolicy onTargetUpdate
) {

    public LinkRule {
        onSourceDelete = onSourceDelete == null ? DeletePolicy.IGNORE : onSourceDelete;
        onTargetDelete = onTargetDelete == null ? DeletePolicy.IGNORE : onTargetDelete;
        onSourceUpdate = onSourceUpdate == null ? UpdatePolicy.IGNORE : onSourceUpdate;
        onTargetUpdate = onTargetUpdate == null ? UpdatePolicy.IGNORE : onTargetUpdate;
    }

    /** The rule used for link types that have no entry in the table. */
    public static LinkRule ignoreAll(LinkType linkType) {
        return new LinkRule(linkType, DeletePolicy.IGNORE, DeletePolicy.IGNORE, UpdatePolicy.IGNORE, UpdatePolicy.IGNORE);
    }

    public DeletePolicy onDelete(LinkSide deletedSide) {
        return deletedSide == LinkSide.SOURCE ? onSourceDelete : onTargetDelete;
    }

    public UpdatePolicy onUpdate(LinkSide updatedSide) {
        return updatedSide == LinkSide.SOURCE ? onSourceUpdate : onTargetUpdate;
    }
}
