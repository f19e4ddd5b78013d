package io.epochfork.engine;

import io.epochfork.model.EpochNode;
import io.epochfork.model.ResultEnvelope;
import io.epochfork.model.Scenario;
import io.epochfork.model.ScenarioEvent;

import java.util.List;
import java.util.Optional;

/**
 * Runs one scenario from an empty state to a {@link ResultEnvelope}.
 *
 * <p>Stateless; concurrent calls for distinct scenarios are safe.
 */
public final class EpochForkSimulator {
    public static final String DEFAULT_LANGUAGE = "java";

    private final String language;

    public EpochForkSimulator() {
        this(DEFAULT_LANGUAGE);
    }

    public EpochForkSimulator(String language) {
        this.language = language == null || language.isBlank() ? DEFAULT_LANGUAGE : language.trim();
    }

    public SimulationResult simulate(Scenario scenario) {
        EpochGraphIndex graph = EpochGraphIndex.build(scenario.scenarioId(), scenario.nodes());
        ForkDetector detector = new ForkDetector(graph);
        ChainIntegrityChecker integrity = new ChainIntegrityChecker(graph);
        SimulationContext context = new SimulationContext();

        List<ScenarioEvent> schedule = EventScheduler.schedule(scenario.events());
        for (ScenarioEvent event : schedule) {
            switch (event.type()) {
                case EPOCH_ISSUE -> {
                    Optional<EpochNode> issued = detector.observe(event, context);
                    issued.ifPresent(node -> integrity.check(node, context));
                }
                case REPLAY_ATTEMPT -> context.addDropped(event.count());
                case MERGE -> context.markMerge(event.t());
                default -> throw new IllegalStateException("Unhandled event type: " + event.type());
            }
        }

        ForkChoice winner = new ReconciliationResolver(graph).resolve(context).orElse(null);
        return new SimulationResult(
                context.detected(),
                EnvelopeBuilder.detectionMs(
                        scenario.expectations().detectionReference(),
                        context.detectionTime(),
                        context.forkCreatedTime()
                ),
                EnvelopeBuilder.reconciliationMs(context.detectionTime(), context.firstMergeTime()),
                context.forkCreatedTime(),
                context.detectionTime(),
                winner,
                context.messagesDropped(),
                context.errorNames()
        );
    }

    public ResultEnvelope evaluate(Scenario scenario) {
        SimulationResult result = simulate(scenario);
        ExpectationEvaluator.Verdict verdict = ExpectationEvaluator.evaluate(scenario.expectations(), result);
        return EnvelopeBuilder.build(scenario, result, verdict, language);
    }

    public String language() {
        return language;
    }
}
