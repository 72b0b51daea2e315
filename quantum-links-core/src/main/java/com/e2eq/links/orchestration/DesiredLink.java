package com.e2eq.links.orchestration;

import com.e2eq.links.core.EntityRef;
import com.e2eq.links.core.LinkType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An outgoing link an entity should have after it is saved.
 */
public record DesiredLink(LinkType linkType, EntityRef target, Map<String, Object> metadata) {

    public DesiredLink {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static DesiredLink to(LinkType linkType, String targetId) {
        return new DesiredLink(linkType, EntityRef.of(linkType.targetType(), targetId), Map.of());
    }

    public static DesiredLink to(LinkType linkType, String targetId, Map<String, Object> metadata) {
        return new DesiredLink(linkType, EntityRef.of(linkType.targetType(), targetId), metadata);
    }
}
