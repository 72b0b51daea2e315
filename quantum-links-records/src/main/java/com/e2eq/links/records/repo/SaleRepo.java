package com.e2eq.links.records.repo;

import com.e2eq.links.core.EntityType;
import com.e2eq.links.core.JsonCodec;
import com.e2eq.links.core.KeyValueStore;
import com.e2eq.links.records.model.Sale;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

@Singleton
public class SaleRepo extends KvRepository<Sale> {

    @Inject
    public SaleRepo(KeyValueStore store, JsonCodec codec) {
        super(store, codec, EntityType.SALE, Sale.class);
    }
}
