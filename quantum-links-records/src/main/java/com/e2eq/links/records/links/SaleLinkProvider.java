package com.e2eq.links.records.links;

import com.e2eq.links.core.EntityType;
import com.e2eq.links.core.LinkType;
import com.e2eq.links.core.LinkableEntity;
import com.e2eq.links.orchestration.DesiredLink;
import com.e2eq.links.records.model.FinancialRecord;
import com.e2eq.links.records.model.Sale;
import com.e2eq.links.records.model.SaleLine;
import com.e2eq.links.records.repo.FinancialRecordRepo;
import com.e2eq.links.spi.LinkProvider;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.util.*;

/**
 * Sale lines become {@code SALE_ITEM} links carrying the sold quantity; the sale's financial
 * record is found through its {@code sourceSaleId} index.
 */
@Singleton
public class SaleLinkProvider implements LinkProvider {

    private final FinancialRecordRepo financials;

    @Inject
    public SaleLinkProvider(FinancialRecordRepo financials) {
        this.financials = financials;
    }

    @Override
    public boolean supports(EntityType entityType) {
        return entityType == EntityType.SALE;
    }

    @Override
    public Set<LinkType> linkTypes() {
        return EnumSet.of(LinkType.SALE_ITEM, LinkType.SALE_FINREC);
    }

    @Override
    public List<DesiredLink> links(LinkableEntity entity) {
        Sale sale = (Sale) entity;
        // one link per item; repeated lines add up
        Map<String, Integer> quantities = new LinkedHashMap<>();
        for (SaleLine line : Optional.ofNullable(sale.getLines()).orElse(List.of())) {
            if (line.getItemId() == null || line.getItemId().isBlank()) continue;
            quantities.merge(line.getItemId(), line.getQuantity(), Integer::sum);
        }
        List<DesiredLink> out = new ArrayList<>();
        quantities.forEach((itemId, qty) -> out.add(DesiredLink.to(LinkType.SALE_ITEM, itemId, Map.of("quantity", qty))));
        for (FinancialRecord f : financials.findBySourceSale(sale.getId())) {
            out.add(DesiredLink.to(LinkType.SALE_FINREC, f.getId()));
        }
        return out;
    }
}
