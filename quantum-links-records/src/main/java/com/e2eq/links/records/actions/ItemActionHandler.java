package com.e2eq.links.records.actions;

import com.e2eq.links.core.ActionHandler;
import com.e2eq.links.core.ActionRequest;
import com.e2eq.links.core.EntityType;
import com.e2eq.links.orchestration.EntityOrchestrator;
import com.e2eq.links.records.model.Item;
import com.e2eq.links.records.model.RecordStatus;
import com.e2eq.links.records.model.StockPoint;
import com.e2eq.links.records.model.Task;
import com.e2eq.links.records.repo.ItemRepo;
import io.quarkus.logging.Log;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the item a completed task produces and keeps it in step with the task's output fields.
 */
@Singleton
public class ItemActionHandler implements ActionHandler {

    private final ItemRepo items;
    private final EntityOrchestrator orchestrator;

    @Inject
    public ItemActionHandler(ItemRepo items, EntityOrchestrator orchestrator) {
        this.items = items;
        this.orchestrator = orchestrator;
    }

    @Override
    public EntityType entityType() {
        return EntityType.ITEM;
    }

    @Override
    public void handle(ActionRequest request) {
        if (!(request.subject() instanceof Task task)) {
            Log.warnf("Item action %s from %s ignored: only tasks produce items", request.action(), request.subject().ref());
            return;
        }
        switch (request.action()) {
            case CREATE_TARGET -> create(task);
            case UPDATE_TARGET -> update(task, request.context().counterpart());
            case DELETE_TARGET -> items.get(Item.completionId(task.getId()))
                    .ifPresent(i -> orchestrator.remove(EntityType.ITEM, i.getId()));
            default -> Log.warnf("Item action %s is not supported", request.action());
        }
    }

    void create(Task task) {
        String id = Item.completionId(task.getId());
        if (items.exists(id)) {
            Log.debugf("Item %s already exists", id);
            return;
        }
        List<StockPoint> stock = new ArrayList<>();
        stock.add(new StockPoint(task.stockSiteId(), task.getOutputQuantity()));
        Item item = Item.builder()
                .id(id)
                .name(itemName(task))
                .type(task.getOutputItemType())
                .status(RecordStatus.IN_STOCK)
                .unitCost(task.getOutputUnitCost())
                .price(task.getOutputItemPrice())
                .stock(stock)
                .sourceTaskId(task.getId())
                .build();
        orchestrator.upsert(item);
        Log.infof("Item %s created from task %s", id, task.getId());
    }

    void update(Task task, Object counterpart) {
        Item item = counterpart instanceof Item i ? items.get(i.getId()).orElse(null)
                : items.get(Item.completionId(task.getId())).orElse(null);
        if (item == null || !task.hasOutputItem()) return;

        Item changed = item.toBuilder().stock(new ArrayList<>(item.getStock())).build();
        changed.setName(itemName(task));
        changed.setType(task.getOutputItemType());
        changed.setUnitCost(task.getOutputUnitCost());
        changed.setPrice(task.getOutputItemPrice());
        setQuantityAt(changed, task.stockSiteId(), task.getOutputQuantity());
        if (Objects.equals(changed, item)) return;
        orchestrator.upsert(changed);
        Log.debugf("Item %s updated from task %s", item.getId(), task.getId());
    }

    private static void setQuantityAt(Item item, String siteId, int quantity) {
        for (StockPoint p : item.getStock()) {
            if (siteId.equals(p.getSiteId())) {
                if (p.getQuantity() != quantity) {
                    item.getStock().set(item.getStock().indexOf(p), new StockPoint(siteId, quantity));
                }
                return;
            }
        }
        item.getStock().add(new StockPoint(siteId, quantity));
    }

    private static String itemName(Task task) {
        String name = task.getOutputItemName();
        return name != null && !name.isBlank() ? name : task.getOutputItemType();
    }
}
