package com.e2eq.links.runtime;

import com.e2eq.links.core.*;
import com.e2eq.links.exceptions.LinkEngineException;
import com.e2eq.links.orchestration.*;
import com.e2eq.links.spi.LinkProvider;
import io.quarkus.arc.DefaultBean;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the link engine. Store, clock and rule table are default beans that an application
 * replaces by producing its own (the Mongo module supplies a {@link KeyValueStore}).
 */
@ApplicationScoped
public class LinksCoreProducers {

    @Produces
    @DefaultBean
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @DefaultBean
    @Singleton
    public KeyValueStore keyValueStore() {
        Log.info("LinksCoreProducers: no persistent KeyValueStore deployed, using in-memory store");
        return new InMemoryKeyValueStore();
    }

    @Produces
    @Singleton
    public JsonCodec jsonCodec() {
        return new JsonCodec();
    }

    @Produces
    @DefaultBean
    @Singleton
    public LinkRuleTable linkRuleTable(LinksConfig config) {
        String location = config.rules().location();
        YamlLinkRuleLoader loader = new YamlLinkRuleLoader();
        try {
            Path path = Path.of(location);
            LinkRuleTable table = Files.isRegularFile(path) ? loader.loadFromPath(path) : loader.loadFromClasspath(location);
            Log.infof("Loaded link rule table from %s: %d rule(s), %d directional rule(s)",
                    location, table.rules().size(), table.directionalRules().size());
            return table;
        } catch (IOException e) {
            throw new LinkEngineException("Unable to load link rules from " + location, e);
        }
    }

    @Produces
    @Singleton
    public EffectsLedger effectsLedger(KeyValueStore store) {
        return new EffectsLedger(store);
    }

    @Produces
    @Singleton
    public ProcessingGuard processingGuard(KeyValueStore store, JsonCodec codec, Clock clock, LinksConfig config) {
        return new ProcessingGuard(store, codec, clock, config.guard().maxDepth(), config.guard().timeout());
    }

    @Produces
    @Singleton
    public EventLog eventLog(KeyValueStore store, JsonCodec codec, Clock clock) {
        return new EventLog(store, codec, clock);
    }

    @Produces
    @Singleton
    public LinkLog linkLog(EventLog eventLog, Clock clock) {
        return new LinkLog(eventLog, clock);
    }

    @Produces
    @Singleton
    public LifecycleLog lifecycleLog(EventLog eventLog, Clock clock, LinksConfig config) {
        return new LifecycleLog(eventLog, clock, config.logging().lifecycleEnabled());
    }

    @Produces
    @Singleton
    public RepositoryRegistry repositoryRegistry() {
        return new RepositoryRegistry();
    }

    @Produces
    @Singleton
    public WorkflowHandlerRegistry workflowHandlerRegistry() {
        return new WorkflowHandlerRegistry();
    }

    @Produces
    @Singleton
    public ActionHandlerRegistry actionHandlerRegistry() {
        return new ActionHandlerRegistry();
    }

    @Produces
    @Singleton
    public LinkRegistry linkRegistry(KeyValueStore store, JsonCodec codec, LinkLog linkLog, Clock clock,
                                     RepositoryRegistry repositories, LinksConfig config) {
        LinkValidator validator = config.validation().checkExistence()
                ? new LinkValidator(repositories)
                : new LinkValidator();
        return new LinkRegistry(store, codec, validator, linkLog, clock);
    }

    @Produces
    @Singleton
    public TriggerEvaluator triggerEvaluator(LinkRuleTable ruleTable, ActionHandlerRegistry handlers) {
        return new TriggerEvaluator(ruleTable, handlers);
    }

    @Produces
    @Singleton
    public RuleEngine ruleEngine(LinkRuleTable ruleTable, LinkRegistry registry, TriggerEvaluator evaluator,
                                 RepositoryRegistry repositories, LinksConfig config) {
        return new RuleEngine(ruleTable, registry, evaluator, repositories, config.guard().maxDepth());
    }

    @Produces
    @Singleton
    public LinkReconciler linkReconciler(LinkRegistry registry, Instance<LinkProvider> providers) {
        return new LinkReconciler(registry, new AnnotatedLinkExtractor(), providers.stream().toList());
    }

    @Produces
    @Singleton
    public EntityOrchestrator entityOrchestrator(RepositoryRegistry repositories, WorkflowHandlerRegistry workflows,
                                                 ProcessingGuard guard, RuleEngine ruleEngine, LinkRegistry registry,
                                                 LinkReconciler reconciler, LifecycleLog lifecycleLog) {
        return new EntityOrchestrator(repositories, workflows, guard, ruleEngine, registry, reconciler, lifecycleLog);
    }
}
