package com.e2eq.links.records.runtime;

import com.e2eq.links.core.ActionHandler;
import com.e2eq.links.core.ActionHandlerRegistry;
import com.e2eq.links.orchestration.EntityRepository;
import com.e2eq.links.orchestration.RepositoryRegistry;
import com.e2eq.links.orchestration.WorkflowHandler;
import com.e2eq.links.orchestration.WorkflowHandlerRegistry;
import io.quarkus.logging.Log;
import io.quarkus.runtime.Startup;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

/**
 * Registers the record repositories, workflows and action handlers with the engine's
 * registries when the application starts.
 */
@Startup
@Singleton
public class RecordsRegistration {

    @Inject
    public RecordsRegistration(RepositoryRegistry repositories,
                               WorkflowHandlerRegistry workflows,
                               ActionHandlerRegistry actions,
                               Instance<EntityRepository<?>> repositoryBeans,
                               Instance<WorkflowHandler<?>> workflowBeans,
                               Instance<ActionHandler> actionBeans) {
        register(repositories, workflows, actions, repositoryBeans, workflowBeans, actionBeans);
    }

    public static void register(RepositoryRegistry repositories,
                                WorkflowHandlerRegistry workflows,
                                ActionHandlerRegistry actions,
                                Iterable<? extends EntityRepository<?>> repositoryBeans,
                                Iterable<? extends WorkflowHandler<?>> workflowBeans,
                                Iterable<? extends ActionHandler> actionBeans) {
        int r = 0, w = 0, a = 0;
        for (EntityRepository<?> repo : repositoryBeans) {
            repositories.register(repo);
            r++;
        }
        for (WorkflowHandler<?> handler : workflowBeans) {
            workflows.register(handler);
            w++;
        }
        for (ActionHandler handler : actionBeans) {
            actions.register(handler);
            a++;
        }
        Log.infof("Records registered: %d repositories, %d workflows, %d action handlers", r, w, a);
    }
}
