package com.e2eq.links.records.model;

import com.e2eq.links.core.EntityType;
import com.e2eq.links.core.LinkableEntity;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@RegisterForReflection
public class Player implements LinkableEntity {

    private String id;
    private String name;
    private int points;

    /** Points credited per task id; revoking a task takes back exactly its entry. */
    @Builder.Default
    private Map<String, Integer> credits = new LinkedHashMap<>();

    @Override
    public EntityType entityType() {
        return EntityType.PLAYER;
    }
}
