package com.e2eq.links.records.model;

import com.e2eq.links.annotations.LinkedBy;
import com.e2eq.links.core.EntityType;
import com.e2eq.links.core.LinkType;
import com.e2eq.links.core.LinkableEntity;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@RegisterForReflection
public class Item implements LinkableEntity {

    private String id;
    private String name;
    private String type;
    private String status;
    private BigDecimal unitCost;
    private BigDecimal price;

    @Builder.Default
    private List<StockPoint> stock = new ArrayList<>();

    @LinkedBy(LinkType.ITEM_TASK)
    private String sourceTaskId;

    @LinkedBy(LinkType.ITEM_CHARACTER)
    private String ownerCharacterId;

    /** Id of the item a completed task produces. */
    public static String completionId(String taskId) {
        return "item-" + taskId + "-completion";
    }

    @Override
    public EntityType entityType() {
        return EntityType.ITEM;
    }

    @Override
    public String lifecycleStatus() {
        return status;
    }

    @LinkedBy(LinkType.ITEM_SITE)
    public List<String> stockSiteIds() {
        List<String> ids = new ArrayList<>();
        if (stock == null) return ids;
        for (StockPoint p : stock) {
            if (p.getSiteId() != null && !ids.contains(p.getSiteId())) ids.add(p.getSiteId());
        }
        return ids;
    }

    public int totalQuantity() {
        return stock == null ? 0 : stock.stream().mapToInt(StockPoint::getQuantity).sum();
    }
}
