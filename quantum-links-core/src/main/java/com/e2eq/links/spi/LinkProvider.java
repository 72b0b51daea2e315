package com.e2eq.links.spi;

import com.e2eq.links.core.EntityType;
import com.e2eq.links.core.LinkType;
import com.e2eq.links.core.LinkableEntity;
import com.e2eq.links.orchestration.DesiredLink;

import java.util.List;
import java.util.Set;

/**
 * SPI to contribute links for an entity that cannot be expressed with
 * {@link com.e2eq.links.annotations.LinkedBy}, typically links found through a secondary index
 * (the items whose {@code sourceTaskId} is this task). Implementations are CDI beans; the
 * reconciler merges their links with the annotation-derived ones.
 */
public interface LinkProvider {

    boolean supports(EntityType entityType);

    /**
     * Link types this provider owns. Existing outgoing links of these types that the provider no
     * longer returns are removed on reconciliation.
     */
    Set<LinkType> linkTypes();

    /** Outgoing links the entity should have; the entity is always the source. */
    List<DesiredLink> links(LinkableEntity entity);
}
