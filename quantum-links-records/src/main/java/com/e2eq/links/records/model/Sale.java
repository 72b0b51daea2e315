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
public class Sale implements LinkableEntity, CustomerLinked {

    private String id;
    private String name;
    private String status;

    @LinkedBy(LinkType.SALE_SITE)
    private String siteId;

    @LinkedBy(LinkType.SALE_CHARACTER)
    private String customerCharacterId;

    @Builder.Default
    private List<SaleLine> lines = new ArrayList<>();

    @Override
    public EntityType entityType() {
        return EntityType.SALE;
    }

    @Override
    public String lifecycleStatus() {
        return status;
    }

    public BigDecimal totalRevenue() {
        BigDecimal total = BigDecimal.ZERO;
        if (lines == null) return total;
        for (SaleLine l : lines) {
            if (l.getUnitPrice() != null) {
                total = total.add(l.getUnitPrice().multiply(BigDecimal.valueOf(l.getQuantity())));
            }
        }
        return total;
    }
}
