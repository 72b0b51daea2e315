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

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@RegisterForReflection
public class FinancialRecord implements LinkableEntity, CustomerLinked {

    private String id;
    private String name;
    private String status;
    private BigDecimal cost;
    private BigDecimal revenue;

    @LinkedBy(LinkType.FINREC_TASK)
    private String sourceTaskId;

    @LinkedBy(LinkType.FINREC_SALE)
    private String sourceSaleId;

    @LinkedBy(LinkType.FINREC_SITE)
    private String siteId;

    @LinkedBy(LinkType.FINREC_CHARACTER)
    private String customerCharacterId;

    public static String forTask(String taskId) {
        return "fin-" + taskId + "-task";
    }

    public static String forSale(String saleId) {
        return "fin-" + saleId + "-sale";
    }

    @Override
    public EntityType entityType() {
        return EntityType.FINANCIAL;
    }

    @Override
    public String lifecycleStatus() {
        return status;
    }

    public BigDecimal net() {
        BigDecimal r = revenue == null ? BigDecimal.ZERO : revenue;
        return cost == null ? r : r.subtract(cost);
    }
}
