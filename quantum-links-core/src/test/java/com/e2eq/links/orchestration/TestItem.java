package com.e2eq.links.orchestration;

import com.e2eq.links.core.EntityType;
import com.e2eq.links.core.LinkableEntity;

public record TestItem(String id, String status) implements LinkableEntity {

    @Override public String getId() { return id; }
    @Override public EntityType entityType() { return EntityType.ITEM; }
    @Override public String lifecycleStatus() { return status; }
}
