package com.e2eq.links.records.links;

import com.e2eq.links.core.EntityType;
import com.e2eq.links.core.LinkType;
import com.e2eq.links.core.LinkableEntity;
import com.e2eq.links.orchestration.DesiredLink;
import com.e2eq.links.records.model.FinancialRecord;
import com.e2eq.links.records.model.Item;
import com.e2eq.links.records.repo.FinancialRecordRepo;
import com.e2eq.links.records.repo.ItemRepo;
import com.e2eq.links.spi.LinkProvider;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Links a task to what its completion produced, found through the {@code sourceTaskId}
 * indexes of items and financial records.
 */
@Singleton
public class TaskLinkProvider implements LinkProvider {

    private final ItemRepo items;
    private final FinancialRecordRepo financials;

    @Inject
    public TaskLinkProvider(ItemRepo items, FinancialRecordRepo financials) {
        this.items = items;
        this.financials = financials;
    }

    @Override
    public boolean supports(EntityType entityType) {
        return entityType == EntityType.TASK;
    }

    @Override
    public Set<LinkType> linkTypes() {
        return EnumSet.of(LinkType.TASK_ITEM, LinkType.TASK_FINREC);
    }

    @Override
    public List<DesiredLink> links(LinkableEntity entity) {
        List<DesiredLink> out = new ArrayList<>();
        for (Item item : items.findBySourceTask(entity.getId())) {
            out.add(DesiredLink.to(LinkType.TASK_ITEM, item.getId(), Map.of("quantity", item.totalQuantity())));
        }
        for (FinancialRecord f : financials.findBySourceTask(entity.getId())) {
            out.add(DesiredLink.to(LinkType.TASK_FINREC, f.getId()));
        }
        return out;
    }
}
