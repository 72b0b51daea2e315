package com.e2eq.links.orchestration;

import com.e2eq.links.core.*;
import com.e2eq.links.exceptions.CircularReferenceException;
import com.e2eq.links.exceptions.DepthExceededException;
import com.e2eq.links.exceptions.NotFoundException;
import com.e2eq.links.exceptions.SideEffectsIncompleteException;
import com.e2eq.links.exceptions.ValidationException;
import io.quarkus.logging.Log;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The upsert and delete pipelines.
 *
 * <p>Upsert: read the previous version, persist the new one, then (under the processing guard)
 * run the entity's workflow handler and update propagation, then reconcile links. Persistence
 * happens before any side effect; a later failure is reported as
 * {@link SideEffectsIncompleteException} and nothing is rolled back. Guard exceptions are
 * rethrown unwrapped.</p>
 *
 * <p>Delete: plan first (block policies abort here with nothing mutated), then delete the root
 * and each cascaded entity in plan order, each under the guard.</p>
 */
public class EntityOrchestrator {

    public static final String STATUS_DONE = "Done";
    public static final String STATUS_COLLECTED = "Collected";

    private final RepositoryRegistry repositories;
    private final WorkflowHandlerRegistry workflows;
    private final ProcessingGuard guard;
    private final RuleEngine ruleEngine;
    private final LinkRegistry linkRegistry;
    private final LinkReconciler reconciler;
    private final LifecycleLog lifecycleLog;

    public EntityOrchestrator(RepositoryRegistry repositories,
                              WorkflowHandlerRegistry workflows,
                              ProcessingGuard guard,
                              RuleEngine ruleEngine,
                              LinkRegistry linkRegistry,
                              LinkReconciler reconciler,
                              LifecycleLog lifecycleLog) {
        this.repositories = repositories;
        this.workflows = workflows;
        this.guard = guard;
        this.ruleEngine = ruleEngine;
        this.linkRegistry = linkRegistry;
        this.reconciler = reconciler;
        this.lifecycleLog = lifecycleLog;
    }

    public <T extends LinkableEntity> T upsert(T entity) {
        return upsert(entity, UpsertOptions.defaults());
    }

    public <T extends LinkableEntity> T upsert(T entity, UpsertOptions options) {
        return upsertWithOutcome(entity, options).saved();
    }

    public <T extends LinkableEntity> UpsertResult<T> upsertWithOutcome(T entity, UpsertOptions options) {
        if (entity == null) {
            throw new ValidationException("Entity must not be null");
        }
        if (entity.getId() == null || entity.getId().isBlank()) {
            throw new ValidationException("Entity of type " + entity.entityType().key() + " has no id");
        }
        UpsertOptions opts = options == null ? UpsertOptions.defaults() : options;
        EntityRepository<T> repo = repositoryFor(entity.entityType());

        T previous = repo.get(entity.getId()).orElse(null);
        T saved = repo.upsert(entity);
        EntityRef ref = saved.ref();
        logUpsert(saved, previous);

        List<DecisionNeeded> decisions = new ArrayList<>();
        ReconcileResult links = ReconcileResult.SKIPPED;
        try {
            if (!opts.skipWorkflowEffects()) {
                decisions.addAll(runWorkflow(saved, previous));
            }
            if (!opts.skipLinkEffects()) {
                // the workflow may have re-saved this entity
                links = reconciler.reconcile(repo.get(saved.getId()).orElse(saved));
            }
        } catch (CircularReferenceException | DepthExceededException e) {
            throw e;
        } catch (RuntimeException e) {
            Log.warnf(e, "%s saved, side effects incomplete", ref);
            throw new SideEffectsIncompleteException(ref, saved, e);
        }
        if (!decisions.isEmpty()) {
            Log.infof("Update of %s needs %d decision(s)", ref, decisions.size());
        }
        return new UpsertResult<>(saved, decisions, links);
    }

    private <T extends LinkableEntity> List<DecisionNeeded> runWorkflow(T saved, T previous) {
        EntityType type = saved.entityType();
        guard.startProcessing(type, saved.getId());
        try {
            Optional<WorkflowHandler<T>> handler = workflows.handlerFor(type);
            handler.ifPresent(h -> h.onUpsert(saved, previous));
            if (previous == null) {
                return List.of();
            }
            return ruleEngine.propagateUpdate(saved, previous).decisions();
        } finally {
            guard.endProcessing(type, saved.getId());
        }
    }

    /**
     * Deletes an entity and everything its cascade policies reach.
     *
     * @throws NotFoundException if the entity does not exist
     * @throws com.e2eq.links.exceptions.BlockedDeletionException if a block policy applies
     */
    public DeleteResult remove(EntityType type, String id) {
        if (type == null || id == null || id.isBlank()) {
            throw new ValidationException("Delete needs an entity type and id");
        }
        EntityRef root = EntityRef.of(type, id);
        LinkableEntity entity = repositories.resolve(root)
                .orElseThrow(() -> new NotFoundException(type.key(), id));

        DeletePlan plan = ruleEngine.planDelete(root);

        List<EntityRef> deleted = new ArrayList<>();
        int linksRemoved = 0;
        guard.startProcessing(type, id);
        try {
            linksRemoved += deleteEntity(entity);
            deleted.add(root);
            for (DeletePlan.CascadeStep step : plan.cascades()) {
                EntityRef target = step.target();
                Optional<LinkableEntity> found = repositories.resolve(target);
                if (found.isEmpty()) {
                    Log.debugf("Cascade target %s already gone", target);
                    linksRemoved += linkRegistry.removeLinksFor(target);
                    continue;
                }
                guard.startProcessing(target.type(), target.id());
                try {
                    linksRemoved += deleteEntity(found.get());
                    deleted.add(target);
                } finally {
                    guard.endProcessing(target.type(), target.id());
                }
            }
        } finally {
            guard.endProcessing(type, id);
        }
        Log.infof("Deleted %s (%d cascaded, %d link(s) removed, %d decision(s))",
                root, deleted.size() - 1, linksRemoved, plan.decisions().size());
        return new DeleteResult(root, deleted, plan.decisions(), linksRemoved);
    }

    public DeletePlan planDelete(EntityType type, String id) {
        return ruleEngine.planDelete(EntityRef.of(type, id));
    }

    @SuppressWarnings("unchecked")
    private <T extends LinkableEntity> int deleteEntity(LinkableEntity entity) {
        T typed = (T) entity;
        EntityRepository<T> repo = repositoryFor(entity.entityType());
        repo.delete(typed.getId());
        Optional<WorkflowHandler<T>> handler = workflows.handlerFor(entity.entityType());
        handler.ifPresent(h -> h.onDelete(typed));
        int removed = linkRegistry.removeLinksFor(entity.ref());
        lifecycleLog.append(entity.entityType(), entity.getId(), LifecycleLog.Event.DELETED, Map.of());
        return removed;
    }

    @SuppressWarnings("unchecked")
    private <T extends LinkableEntity> EntityRepository<T> repositoryFor(EntityType type) {
        return (EntityRepository<T>) repositories.require(type);
    }

    private void logUpsert(LinkableEntity saved, LinkableEntity previous) {
        EntityType type = saved.entityType();
        String status = saved.lifecycleStatus();
        String before = previous != null ? previous.lifecycleStatus() : null;
        lifecycleLog.append(type, saved.getId(), previous == null ? LifecycleLog.Event.CREATED : LifecycleLog.Event.UPDATED,
                status != null ? Map.of("status", status) : Map.of());
        if (Objects.equals(status, before)) return;
        if (STATUS_DONE.equals(status)) {
            lifecycleLog.append(type, saved.getId(), LifecycleLog.Event.DONE, Map.of());
        } else if (STATUS_COLLECTED.equals(status)) {
            lifecycleLog.append(type, saved.getId(), LifecycleLog.Event.COLLECTED, Map.of());
        }
    }
}
