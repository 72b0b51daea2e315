package com.e2eq.links.records;

import com.e2eq.links.core.*;
import com.e2eq.links.orchestration.*;
import com.e2eq.links.records.actions.CharacterActionHandler;
import com.e2eq.links.records.actions.FinancialRecordActionHandler;
import com.e2eq.links.records.actions.ItemActionHandler;
import com.e2eq.links.records.actions.PlayerActionHandler;
import com.e2eq.links.records.links.SaleLinkProvider;
import com.e2eq.links.records.links.TaskLinkProvider;
import com.e2eq.links.records.repo.*;
import com.e2eq.links.records.runtime.RecordsRegistration;
import com.e2eq.links.records.workflow.CompletionEffects;
import com.e2eq.links.records.workflow.FinancialRecordWorkflow;
import com.e2eq.links.records.workflow.SaleWorkflow;
import com.e2eq.links.records.workflow.TaskWorkflow;
import com.e2eq.links.spi.LinkProvider;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * The records module wired by hand over an in-memory store, with the bundled rule table.
 */
public class RecordsHarness {

    public static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    final InMemoryKeyValueStore store = new InMemoryKeyValueStore();
    final JsonCodec codec = new JsonCodec();
    final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    final EffectsLedger ledger = new EffectsLedger(store);
    final ProcessingGuard guard = new ProcessingGuard(store, codec, clock);
    final LinkRegistry links = new LinkRegistry(store, codec, new LinkValidator(),
            new LinkLog(new EventLog(store, codec, clock), clock), clock);
    final LifecycleLog lifecycle = new LifecycleLog(new EventLog(store, codec, clock), clock, true);

    final RepositoryRegistry repositories = new RepositoryRegistry();
    final WorkflowHandlerRegistry workflows = new WorkflowHandlerRegistry();
    final ActionHandlerRegistry actions = new ActionHandlerRegistry();

    final TaskRepo tasks = new TaskRepo(store, codec);
    final ItemRepo items = new ItemRepo(store, codec);
    final SaleRepo sales = new SaleRepo(store, codec);
    final FinancialRecordRepo financials = new FinancialRecordRepo(store, codec);
    final CharacterRepo characters = new CharacterRepo(store, codec);
    final SiteRepo sites = new SiteRepo(store, codec);
    final PlayerRepo players = new PlayerRepo(store, codec);

    final LinkRuleTable rules;
    final EntityOrchestrator orchestrator;

    public RecordsHarness() {
        try {
            rules = new YamlLinkRuleLoader().loadFromClasspath("/link-rules.yaml");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        TriggerEvaluator triggers = new TriggerEvaluator(rules, actions);
        RuleEngine ruleEngine = new RuleEngine(rules, links, triggers, repositories, 5);
        List<LinkProvider> providers = List.of(new TaskLinkProvider(items, financials), new SaleLinkProvider(financials));
        LinkReconciler reconciler = new LinkReconciler(links, new AnnotatedLinkExtractor(), providers);
        orchestrator = new EntityOrchestrator(repositories, workflows, guard, ruleEngine, links, reconciler, lifecycle);

        CompletionEffects completion = new CompletionEffects(ledger, triggers);
        PlayerActionHandler playerHandler = new PlayerActionHandler(players, orchestrator);

        List<EntityRepository<?>> repos = List.of(tasks, items, sales, financials, characters, sites, players);
        List<WorkflowHandler<?>> handlers = List.of(
                new TaskWorkflow(orchestrator, completion, items, financials, playerHandler),
                new SaleWorkflow(completion),
                new FinancialRecordWorkflow(completion));
        List<ActionHandler> actionHandlers = List.of(
                new ItemActionHandler(items, orchestrator),
                new FinancialRecordActionHandler(financials, orchestrator),
                playerHandler,
                new CharacterActionHandler(characters, orchestrator, clock));
        RecordsRegistration.register(repositories, workflows, actions, repos, handlers, actionHandlers);
    }
}
