package com.e2eq.links.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A typed, directed edge between two entities. A bidirectional relationship is stored as two
 * links with swapped ends and paired link types.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@RegisterForReflection
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Link {
    private String id;
    private LinkType linkType;
    private EntityRef source;
    private EntityRef target;
    private Instant createdAt;
    private Instant updatedAt;
    private Map<String, Object> metadata;

    /**
     * New link with a random id. {@code createdAt} is filled in by the registry when it is stored.
     */
    public static Link of(LinkType linkType, EntityRef source, EntityRef target, Map<String, Object> metadata) {
        return Link.builder()
                .id(UUID.randomUUID().toString())
                .linkType(linkType)
                .source(source)
                .target(target)
                .metadata(metadata == null || metadata.isEmpty() ? null : new LinkedHashMap<>(metadata))
                .build();
    }

    public static Link of(LinkType linkType, EntityRef source, EntityRef target) {
        return of(linkType, source, target, null);
    }

    /** True when this link has the same type and ends as {@code other}, ignoring id and timestamps. */
    public boolean sameRelationship(Link other) {
        return other != null
                && linkType == other.linkType
                && Objects.equals(source, other.source)
                && Objects.equals(target, other.target);
    }
}
