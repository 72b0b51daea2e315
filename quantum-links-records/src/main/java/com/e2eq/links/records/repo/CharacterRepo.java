package com.e2eq.links.records.repo;

import com.e2eq.links.core.EntityType;
import com.e2eq.links.core.JsonCodec;
import com.e2eq.links.core.KeyValueStore;
import com.e2eq.links.records.model.CharacterRecord;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

@Singleton
public class CharacterRepo extends KvRepository<CharacterRecord> {

    @Inject
    public CharacterRepo(KeyValueStore store, JsonCodec codec) {
        super(store, codec, EntityType.CHARACTER, CharacterRecord.class);
    }
}
