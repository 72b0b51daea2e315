package com.e2eq.links.orchestration;

import com.e2eq.links.annotations.LinkedBy;
import com.e2eq.links.core.EntityType;
import com.e2eq.links.core.LinkType;
import com.e2eq.links.core.LinkableEntity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class TestTask implements LinkableEntity {

    private String id;
    private String status;
    @LinkedBy(LinkType.TASK_SITE)
    private String siteId;
    @LinkedBy(LinkType.TASK_ITEM)
    private List<String> itemIds = new ArrayList<>();

    public TestTask(String id, String status) {
        this.id = id;
        this.status = status;
    }

    public TestTask copy() {
        TestTask t = new TestTask(id, status);
        t.siteId = siteId;
        t.itemIds = new ArrayList<>(itemIds);
        return t;
    }

    @Override public String getId() { return id; }
    @Override public EntityType entityType() { return EntityType.TASK; }
    @Override public String lifecycleStatus() { return status; }
    @Override public Map<String, Object> triggerMetadata() { return Map.of("hasOutputItem", !itemIds.isEmpty()); }

    public String getStatus() { return status; }
    public TestTask status(String status) { this.status = status; return this; }
    public String getSiteId() { return siteId; }
    public TestTask siteId(String siteId) { this.siteId = siteId; return this; }
    public List<String> getItemIds() { return itemIds; }
    public TestTask items(String... ids) { this.itemIds = new ArrayList<>(List.of(ids)); return this; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TestTask t)) return false;
        return Objects.equals(id, t.id) && Objects.equals(status, t.status)
                && Objects.equals(siteId, t.siteId) && Objects.equals(itemIds, t.itemIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, status, siteId, itemIds);
    }
}
