package com.e2eq.links.records.repo;

import com.e2eq.links.core.EntityType;
import com.e2eq.links.core.JsonCodec;
import com.e2eq.links.core.KeyValueStore;
import com.e2eq.links.records.model.Task;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

@Singleton
public class TaskRepo extends KvRepository<Task> {

    @Inject
    public TaskRepo(KeyValueStore store, JsonCodec codec) {
        super(store, codec, EntityType.TASK, Task.class);
    }
}
