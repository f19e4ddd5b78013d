package io.epochfork.runtime;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import io.epochfork.config.EpochForkConfig;
import io.epochfork.config.RunSettings;
import io.epochfork.corpus.CorpusException;
import io.epochfork.corpus.CorpusLoader;
import io.epochfork.engine.EpochForkSimulator;
import io.epochfork.model.ResultEnvelope;
import io.epochfork.model.Scenario;
import io.epochfork.observability.RunLogger;
import io.epochfork.util.Jsons;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

public final class EpochForkRunner {
    private final EpochForkConfig config;
    private final RunSettings settings;
    private final RunLogger runLogger;
    private final EpochForkSimulator simulator;

    public EpochForkRunner(EpochForkConfig config) {
        this(config, RunSettings.load(config));
    }

    public EpochForkRunner(EpochForkConfig config, RunSettings settings) {
        this.config = config;
        this.settings = settings;
        this.runLogger = new RunLogger(config.runLogFile(), settings.runId());
        this.simulator = new EpochForkSimulator(settings.language());
    }

    public RunSettings settings() {
        return settings;
    }

    public EpochForkConfig config() {
        return config;
    }

    public RunLogger runLogger() {
        return runLogger;
    }

    public Path resolveCorpus() {
        Path corpus = Path.of(settings.corpus());
        return corpus.isAbsolute() ? corpus : corpus.toAbsolutePath().normalize();
    }

    public List<ScenarioListing> listScenarios() {
        List<ScenarioListing> out = new ArrayList<>();
        for (JsonNode raw : CorpusLoader.readCorpus(resolveCorpus())) {
            out.add(new ScenarioListing(CorpusLoader.scenarioIdOf(raw), CorpusLoader.tagsOf(raw)));
        }
        return out;
    }

    /**
     * Evaluates every selected scenario of the configured corpus.
     *
     * @throws CorpusException when the corpus file itself cannot be loaded
     */
    public RunOutcome run(String scenarioFilter) {
        Path corpusPath = resolveCorpus();
        List<JsonNode> corpus;
        try {
            corpus = CorpusLoader.readCorpus(corpusPath);
        } catch (CorpusException e) {
            runLogger.log(RunLogger.RunEvent.of("corpus.load", null, "error",
                    Map.of("corpus", corpusPath.toString(), "message", String.valueOf(e.getMessage()))));
            throw e;
        }
        runLogger.log(RunLogger.RunEvent.of("corpus.load", null, "ok",
                Map.of("corpus", corpusPath.toString(), "scenarios", corpus.size())));

        List<JsonNode> selected = new ArrayList<>();
        for (JsonNode raw : corpus) {
            String scenarioId = CorpusLoader.scenarioIdOf(raw);
            if (scenarioFilter != null && !scenarioFilter.isBlank() && !scenarioFilter.equals(scenarioId)) {
                continue;
            }
            if (!settings.includeStress() && CorpusLoader.tagsOf(raw).contains(Scenario.STRESS_TAG)) {
                continue;
            }
            selected.add(raw);
        }

        List<ResultEnvelope> envelopes = settings.parallelism() > 1 && selected.size() > 1
                ? evaluateParallel(selected)
                : evaluateSequential(selected);
        return new RunOutcome(settings.language(), settings.runId(), envelopes);
    }

    public ResultEnvelope evaluate(JsonNode raw) {
        String scenarioId = CorpusLoader.scenarioIdOf(raw);
        List<String> tags = CorpusLoader.tagsOf(raw);
        ResultEnvelope envelope;
        try {
            Scenario scenario = CorpusLoader.parseScenario(raw);
            long startNs = System.nanoTime();
            envelope = simulator.evaluate(scenario);
            if (settings.includeStress()) {
                envelope = envelope.withWallTimeMs((System.nanoTime() - startNs) / 1_000_000L);
            }
        } catch (CorpusException e) {
            runLogger.log(RunLogger.RunEvent.of("scenario.corpus_error", scenarioId, "error",
                    Map.of("message", String.valueOf(e.getMessage()))));
            return ResultEnvelope.corpusError(scenarioId, settings.language(), e.getMessage(), tags);
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("detection", envelope.detection());
        details.put("errors", envelope.errors());
        details.put("failures", envelope.failures());
        runLogger.log(RunLogger.RunEvent.of("scenario.evaluate", scenarioId, envelope.status(), details));
        return envelope;
    }

    private List<ResultEnvelope> evaluateSequential(List<JsonNode> selected) {
        List<ResultEnvelope> out = new ArrayList<>(selected.size());
        for (JsonNode raw : selected) {
            out.add(evaluate(raw));
        }
        return out;
    }

    private List<ResultEnvelope> evaluateParallel(List<JsonNode> selected) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(settings.parallelism(), selected.size()));
        try {
            List<Future<ResultEnvelope>> futures = new ArrayList<>(selected.size());
            for (JsonNode raw : selected) {
                futures.add(pool.submit(() -> evaluate(raw)));
            }
            List<ResultEnvelope> out = new ArrayList<>(futures.size());
            for (Future<ResultEnvelope> future : futures) {
                out.add(future.get());
            }
            return out;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while evaluating scenarios", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("Scenario evaluation failed", cause);
        } finally {
            pool.shutdownNow();
        }
    }

    public void appendEnvelopes(Path file, List<ResultEnvelope> envelopes) {
        StringBuilder sb = new StringBuilder();
        for (ResultEnvelope envelope : envelopes) {
            sb.append(Jsons.toCompactJson(envelope)).append('\n');
        }
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            Files.writeString(file, sb.toString(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append envelopes: " + file, e);
        }
    }

    public void writeSummary(Path file, RunOutcome outcome) {
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            Files.writeString(file, Jsons.toJson(outcome.summary()), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write summary: " + file, e);
        }
    }

    public record ScenarioListing(
            @JsonProperty("scenario_id") String scenarioId,
            @JsonProperty("tags") List<String> tags
    ) {
    }

    public record RunOutcome(String language, String runId, List<ResultEnvelope> envelopes) {
        public RunOutcome {
            envelopes = envelopes == null ? List.of() : List.copyOf(envelopes);
        }

        public boolean matched() {
            return !envelopes.isEmpty();
        }

        public long passed() {
            return envelopes.stream().filter(ResultEnvelope::passed).count();
        }

        public long failed() {
            return envelopes.stream().filter(e -> ResultEnvelope.STATUS_FAIL.equals(e.status())).count();
        }

        public long corpusErrors() {
            return envelopes.stream().filter(ResultEnvelope::isCorpusError).count();
        }

        /**
         * 0 only when at least one scenario ran and every one of them passed.
         */
        public int exitCode() {
            return matched() && failed() == 0 && corpusErrors() == 0 ? 0 : 1;
        }

        public RunSummary summary() {
            List<ScenarioSummary> rows = new ArrayList<>(envelopes.size());
            for (ResultEnvelope env : envelopes) {
                rows.add(new ScenarioSummary(
                        env.scenarioId(),
                        env.status(),
                        env.detection(),
                        env.detectionMs(),
                        env.reconciliationMs(),
                        env.winningEpochId(),
                        env.winningHash(),
                        env.messagesDropped(),
                        env.wallTimeMs(),
                        env.notes()
                ));
            }
            return new RunSummary(language, runId, Instant.now(), rows);
        }
    }

    public record RunSummary(
            @JsonProperty("language") String language,
            @JsonProperty("run_id") String runId,
            @JsonProperty("generated_at") Instant generatedAt,
            @JsonProperty("scenarios") List<ScenarioSummary> scenarios
    ) {
    }

    public record ScenarioSummary(
            @JsonProperty("scenario_id") String scenarioId,
            @JsonProperty("status") String status,
            @JsonProperty("detection") boolean detection,
            @JsonProperty("detection_ms") Long detectionMs,
            @JsonProperty("reconciliation_ms") Long reconciliationMs,
            @JsonProperty("winning_epoch_id") Long winningEpochId,
            @JsonProperty("winning_hash") String winningHash,
            @JsonProperty("messages_dropped") long messagesDropped,
            @JsonProperty("wall_time_ms") @JsonInclude(JsonInclude.Include.NON_NULL) Long wallTimeMs,
            @JsonProperty("notes") List<String> notes
    ) {
    }
}
