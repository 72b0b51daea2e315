package com.e2eq.links.records.actions;

import com.e2eq.links.core.ActionHandler;
import com.e2eq.links.core.ActionRequest;
import com.e2eq.links.core.EntityType;
import com.e2eq.links.core.RuleAction;
import com.e2eq.links.exceptions.NotFoundException;
import com.e2eq.links.orchestration.EntityOrchestrator;
import com.e2eq.links.records.model.Player;
import com.e2eq.links.records.model.Task;
import com.e2eq.links.records.repo.PlayerRepo;
import io.quarkus.logging.Log;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.util.Optional;

/**
 * Credits reward points. Each credit is recorded on the player under the task id, so a repeated
 * credit changes nothing and a revoke takes back exactly what was credited.
 */
@Singleton
public class PlayerActionHandler implements ActionHandler {

    private final PlayerRepo players;
    private final EntityOrchestrator orchestrator;

    @Inject
    public PlayerActionHandler(PlayerRepo players, EntityOrchestrator orchestrator) {
        this.players = players;
        this.orchestrator = orchestrator;
    }

    @Override
    public EntityType entityType() {
        return EntityType.PLAYER;
    }

    @Override
    public void handle(ActionRequest request) {
        if (request.action() != RuleAction.UPDATE_TARGET || !(request.subject() instanceof Task task)) {
            Log.warnf("Player action %s from %s is not supported", request.action(), request.subject().ref());
            return;
        }
        credit(task);
    }

    /**
     * Credits the task's reward points to its player.
     *
     * @return false if this task was already credited
     * @throws NotFoundException if the player does not exist, so the caller does not record the effect
     */
    public boolean credit(Task task) {
        Player player = players.get(task.getPlayerId())
                .orElseThrow(() -> new NotFoundException(EntityType.PLAYER.key(), task.getPlayerId()));
        if (player.getCredits().containsKey(task.getId())) {
            Log.debugf("Task %s already credited to player %s", task.getId(), player.getId());
            return false;
        }
        int points = task.getRewardPoints() == null ? 0 : task.getRewardPoints();
        player.getCredits().put(task.getId(), points);
        player.setPoints(player.getPoints() + points);
        orchestrator.upsert(player);
        Log.infof("Player %s credited %d point(s) for task %s, now %d", player.getId(), points, task.getId(), player.getPoints());
        return true;
    }

    /**
     * Takes back the points credited for a task.
     *
     * @return the points taken back, 0 if the task was never credited to this player
     */
    public int revokeCredit(String playerId, String taskId) {
        Optional<Player> found = players.get(playerId);
        if (found.isEmpty()) {
            Log.warnf("Player %s not found; credit for task %s not revoked", playerId, taskId);
            return 0;
        }
        Player player = found.get();
        Integer credited = player.getCredits().remove(taskId);
        if (credited == null) {
            return 0;
        }
        player.setPoints(player.getPoints() - credited);
        orchestrator.upsert(player);
        Log.infof("Player %s lost %d point(s) for task %s, now %d", playerId, credited, taskId, player.getPoints());
        return credited;
    }
}
