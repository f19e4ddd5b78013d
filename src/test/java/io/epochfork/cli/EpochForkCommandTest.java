package io.epochfork.cli;

import io.epochfork.util.Jsons;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EpochForkCommandTest {
    @Test
    void runPrintsOneEnvelopePerLineAndPersistsResults() throws Exception {
        Path root = Files.createTempDirectory("epochfork-cli-run-");
        Captured captured = execute(root, "run", "--scenario", "same_epoch_collision");

        assertEquals(0, captured.exitCode());
        String[] lines = captured.out().strip().split("\\R");
        assertEquals(1, lines.length);
        JsonNode envelope = Jsons.mapper().readTree(lines[0]);
        assertEquals("same_epoch_collision", envelope.path("scenario_id").asText());
        assertEquals("pass", envelope.path("status").asText());
        assertEquals(150, envelope.path("detection_ms").asInt());
        assertTrue(Files.exists(root.resolve("results").resolve("epoch_fork_envelopes.jsonl")));
        assertTrue(Files.exists(root.resolve("results").resolve("epoch_fork_summary.json")));
    }

    @Test
    void runExitsNonZeroOnCorpusErrorOrNoMatch() throws Exception {
        Path root = Files.createTempDirectory("epochfork-cli-fail-");

        Captured all = execute(root, "run");
        assertEquals(1, all.exitCode());
        assertTrue(all.err().contains("unknown_node_reference"));

        Captured none = execute(root, "run", "--scenario", "missing");
        assertEquals(1, none.exitCode());
        assertTrue(none.err().contains("No scenarios matched"));
    }

    @Test
    void runReportsUnloadableCorpus() throws Exception {
        Path root = Files.createTempDirectory("epochfork-cli-missing-");
        CommandLine cli = new CommandLine(new EpochForkCommand());
        EpochForkCommand command = cli.getCommand();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        command.err = new PrintStream(err, true, StandardCharsets.UTF_8);

        int code = cli.execute("--root", root.toString(), "--corpus", root.resolve("nope.json").toString(), "run");

        assertEquals(1, code);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Failed to load corpus"));
    }

    @Test
    void metricsAndVerifyLogCommandsWork() throws Exception {
        Path root = Files.createTempDirectory("epochfork-cli-metrics-");

        Captured metrics = execute(root, "metrics", "--scenario", "linear_chain_no_fork");
        assertEquals(0, metrics.exitCode());
        assertTrue(metrics.out().contains("epochfork_scenarios_total{status=\"pass\"} 1"));

        Captured verify = execute(root, "verify-log");
        assertEquals(0, verify.exitCode());
        assertEquals(true, Jsons.mapper().readTree(verify.out()).path("ok").asBoolean());
    }

    @Test
    void listPrintsScenarioIds() throws Exception {
        Path root = Files.createTempDirectory("epochfork-cli-list-");
        Captured captured = execute(root, "list");

        assertEquals(0, captured.exitCode());
        assertTrue(captured.out().contains("\"scenario_id\":\"stress_wide_fork\""));
    }

    private static Captured execute(Path root, String... args) throws Exception {
        Path corpus = Path.of(EpochForkCommandTest.class.getResource("/corpus/epoch_forks.json").toURI());
        CommandLine cli = new CommandLine(new EpochForkCommand());
        EpochForkCommand command = cli.getCommand();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        command.out = new PrintStream(out, true, StandardCharsets.UTF_8);
        command.err = new PrintStream(err, true, StandardCharsets.UTF_8);

        String[] full = new String[args.length + 4];
        full[0] = "--root";
        full[1] = root.toString();
        full[2] = "--corpus";
        full[3] = corpus.toString();
        System.arraycopy(args, 0, full, 4, args.length);
        int code = cli.execute(full);
        return new Captured(code, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
    }

    private record Captured(int exitCode, String out, String err) {
    }
}
