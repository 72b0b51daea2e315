package com.e2eq.links.records.repo;

import com.e2eq.links.core.EntityType;
import com.e2eq.links.core.JsonCodec;
import com.e2eq.links.core.KeyValueStore;
import com.e2eq.links.records.model.Item;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Singleton
public class ItemRepo extends KvRepository<Item> {

    static final String SOURCE_TASK = "sourceTaskId";

    @Inject
    public ItemRepo(KeyValueStore store, JsonCodec codec) {
        super(store, codec, EntityType.ITEM, Item.class);
    }

    public List<Item> findBySourceTask(String taskId) {
        return findBy(SOURCE_TASK, taskId);
    }

    @Override
    protected Map<String, String> indexedFields(Item item) {
        Map<String, String> fields = new LinkedHashMap<>();
        putIfPresent(fields, SOURCE_TASK, item.getSourceTaskId());
        return fields;
    }
}
