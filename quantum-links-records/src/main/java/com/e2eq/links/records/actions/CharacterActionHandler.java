package com.e2eq.links.records.actions;

import com.e2eq.links.core.ActionHandler;
import com.e2eq.links.core.ActionRequest;
import com.e2eq.links.core.EntityType;
import com.e2eq.links.orchestration.EntityOrchestrator;
import com.e2eq.links.records.model.CharacterRecord;
import com.e2eq.links.records.model.CustomerLinked;
import com.e2eq.links.records.repo.CharacterRepo;
import io.quarkus.logging.Log;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.time.Clock;

/**
 * Marks the customer of a completed record as active.
 */
@Singleton
public class CharacterActionHandler implements ActionHandler {

    private final CharacterRepo characters;
    private final EntityOrchestrator orchestrator;
    private final Clock clock;

    @Inject
    public CharacterActionHandler(CharacterRepo characters, EntityOrchestrator orchestrator, Clock clock) {
        this.characters = characters;
        this.orchestrator = orchestrator;
        this.clock = clock;
    }

    @Override
    public EntityType entityType() {
        return EntityType.CHARACTER;
    }

    @Override
    public void handle(ActionRequest request) {
        if (!(request.subject() instanceof CustomerLinked linked) || linked.getCustomerCharacterId() == null) {
            return;
        }
        characters.get(linked.getCustomerCharacterId()).ifPresentOrElse(c -> touch(c),
                () -> Log.debugf("Character %s not found", linked.getCustomerCharacterId()));
    }

    private void touch(CharacterRecord character) {
        character.setLastActiveAt(clock.instant());
        orchestrator.upsert(character);
    }
}
