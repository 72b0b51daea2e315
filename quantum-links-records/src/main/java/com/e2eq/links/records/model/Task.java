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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A unit of work. Completing it may produce an item, a financial record and reward points,
 * depending on which output fields are filled in.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@RegisterForReflection
public class Task implements LinkableEntity, CustomerLinked {

    private String id;
    private String name;
    private String status;

    // output item
    private String outputItemType;
    private String outputItemName;
    private Integer outputQuantity;
    private BigDecimal outputUnitCost;
    private BigDecimal outputItemPrice;

    @LinkedBy(LinkType.TASK_SITE)
    private String siteId;
    @LinkedBy(LinkType.TASK_SITE)
    private String targetSiteId;

    @LinkedBy(LinkType.TASK_CHARACTER)
    private String customerCharacterId;
    /** Name of a customer that has no character yet; the workflow creates one. */
    private String newCustomerName;

    @LinkedBy(LinkType.TASK_PLAYER)
    private String playerId;
    private Integer rewardPoints;

    private BigDecimal cost;
    private BigDecimal revenue;

    @Override
    public EntityType entityType() {
        return EntityType.TASK;
    }

    @Override
    public String lifecycleStatus() {
        return status;
    }

    @Override
    public Map<String, Object> triggerMetadata() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("hasOutputItem", hasOutputItem());
        m.put("hasFinancials", hasFinancials());
        m.put("hasRewards", hasRewards());
        return m;
    }

    public boolean hasOutputItem() {
        return outputItemType != null && !outputItemType.isBlank() && outputQuantity != null && outputQuantity > 0;
    }

    public boolean hasFinancials() {
        return positive(cost) || positive(revenue);
    }

    public boolean hasRewards() {
        return rewardPoints != null && rewardPoints > 0 && playerId != null && !playerId.isBlank();
    }

    /** Where produced stock lands: the target site, else the task's site, else headquarters. */
    public String stockSiteId() {
        if (targetSiteId != null && !targetSiteId.isBlank()) return targetSiteId;
        if (siteId != null && !siteId.isBlank()) return siteId;
        return Site.HEADQUARTERS;
    }

    private static boolean positive(BigDecimal v) {
        return v != null && v.signum() > 0;
    }
}
