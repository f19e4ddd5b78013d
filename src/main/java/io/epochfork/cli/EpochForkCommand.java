package io.epochfork.cli;

import io.epochfork.config.EpochForkConfig;
import io.epochfork.config.RunSettings;
import io.epochfork.corpus.CorpusException;
import io.epochfork.model.ResultEnvelope;
import io.epochfork.observability.PrometheusFormatter;
import io.epochfork.observability.RunLogger;
import io.epochfork.runtime.EpochForkRunner;
import io.epochfork.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
        name = "epochfork",
        mixinStandardHelpOptions = true,
        description = "Deterministic epoch-fork conformance oracle",
        subcommands = {
                EpochForkCommand.RunCommand.class,
                EpochForkCommand.ListCommand.class,
                EpochForkCommand.MetricsCommand.class,
                EpochForkCommand.VerifyLogCommand.class
        }
)
public final class EpochForkCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root for settings, results and logs", defaultValue = EpochForkConfig.DEFAULT_ROOT)
    String root;

    @Option(names = {"--corpus"}, description = "Scenario corpus JSON file (overrides settings)")
    String corpus;

    PrintStream out = System.out;
    PrintStream err = System.err;

    @Override
    public void run() {
        out.println("Use subcommands: run | list | metrics | verify-log");
    }

    EpochForkConfig config() {
        return EpochForkConfig.fromRoot(root);
    }

    EpochForkRunner runner(Integer parallelism, Boolean stress) {
        EpochForkConfig config = config();
        RunSettings settings = RunSettings.load(config).withOverrides(corpus, parallelism, stress);
        return new EpochForkRunner(config, settings);
    }

    @Command(name = "run", description = "Evaluate scenarios and print one JSON envelope per line")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        EpochForkCommand parent;

        @Option(names = {"--scenario"}, description = "Only run the given scenario_id")
        String scenario;

        @Option(names = {"--stress"}, description = "Include stress-tagged scenarios and emit wall_time_ms")
        boolean stress;

        @Option(names = {"--parallelism"}, description = "Worker threads for independent scenarios")
        Integer parallelism;

        @Option(names = {"--summary-out"}, description = "Summary JSON path (default <root>/results/epoch_fork_summary.json)")
        String summaryOut;

        @Option(names = {"--envelope-out"}, description = "Envelope JSONL path (default <root>/results/epoch_fork_envelopes.jsonl)")
        String envelopeOut;

        @Override
        public Integer call() {
            EpochForkRunner runner = parent.runner(parallelism, stress ? Boolean.TRUE : null);
            EpochForkRunner.RunOutcome outcome;
            try {
                outcome = runner.run(scenario);
            } catch (CorpusException e) {
                parent.err.println("Failed to load corpus: " + e.getMessage());
                return 1;
            }
            if (!outcome.matched()) {
                parent.err.println("No scenarios matched");
                return 1;
            }
            for (ResultEnvelope envelope : outcome.envelopes()) {
                parent.out.println(Jsons.toCompactJson(envelope));
                if (envelope.isCorpusError()) {
                    parent.err.println("Scenario " + envelope.scenarioId() + ": " + String.join("; ", envelope.notes()));
                }
            }
            EpochForkConfig config = runner.config();
            runner.appendEnvelopes(envelopeOut == null ? config.envelopeFile() : Path.of(envelopeOut), outcome.envelopes());
            runner.writeSummary(summaryOut == null ? config.summaryFile() : Path.of(summaryOut), outcome);
            return outcome.exitCode();
        }
    }

    @Command(name = "list", description = "List scenario ids and tags in the corpus")
    static final class ListCommand implements Callable<Integer> {
        @ParentCommand
        EpochForkCommand parent;

        @Override
        public Integer call() {
            try {
                for (EpochForkRunner.ScenarioListing listing : parent.runner(null, null).listScenarios()) {
                    parent.out.println(Jsons.toCompactJson(listing));
                }
                return 0;
            } catch (CorpusException e) {
                parent.err.println("Failed to load corpus: " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "metrics", description = "Evaluate scenarios and print Prometheus text metrics")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        EpochForkCommand parent;

        @Option(names = {"--scenario"}, description = "Only run the given scenario_id")
        String scenario;

        @Option(names = {"--stress"}, description = "Include stress-tagged scenarios")
        boolean stress;

        @Override
        public Integer call() {
            try {
                EpochForkRunner.RunOutcome outcome = parent.runner(null, stress ? Boolean.TRUE : null).run(scenario);
                parent.out.print(PrometheusFormatter.format(outcome));
                return outcome.matched() ? 0 : 1;
            } catch (CorpusException e) {
                parent.err.println("Failed to load corpus: " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "verify-log", description = "Verify the hash chain of the run log")
    static final class VerifyLogCommand implements Callable<Integer> {
        @ParentCommand
        EpochForkCommand parent;

        @Override
        public Integer call() {
            RunLogger.VerifyOutcome outcome = RunLogger.verify(parent.config().runLogFile());
            parent.out.println(Jsons.toJson(outcome));
            return outcome.ok() ? 0 : 1;
        }
    }
}
