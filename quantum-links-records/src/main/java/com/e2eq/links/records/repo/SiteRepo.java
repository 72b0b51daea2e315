package com.e2eq.links.records.repo;

import com.e2eq.links.core.EntityType;
import com.e2eq.links.core.JsonCodec;
import com.e2eq.links.core.KeyValueStore;
import com.e2eq.links.records.model.Site;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

@Singleton
public class SiteRepo extends KvRepository<Site> {

    @Inject
    public SiteRepo(KeyValueStore store, JsonCodec codec) {
        super(store, codec, EntityType.SITE, Site.class);
    }
}
