package com.e2eq.links.records.repo;

import com.e2eq.links.core.EntityType;
import com.e2eq.links.core.JsonCodec;
import com.e2eq.links.core.KeyValueStore;
import com.e2eq.links.records.model.Player;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

@Singleton
public class PlayerRepo extends KvRepository<Player> {

    @Inject
    public PlayerRepo(KeyValueStore store, JsonCodec codec) {
        super(store, codec, EntityType.PLAYER, Player.class);
    }
}
