package io.epochfork.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class EpochForkConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String DEFAULT_CORPUS = "tests/common/adversarial/epoch_forks.json";
    public static final String SETTINGS_FILE = "epochfork-settings.json";
    public static final String RUN_ID_ENV = "EPOCH_FORK_RUN_ID";
    public static final int DEFAULT_PARALLELISM = 1;
    public static final int MAX_PARALLELISM = 64;

    private final Path rootDir;

    public EpochForkConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static EpochForkConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new EpochForkConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path resultsRoot() {
        return rootDir.resolve("results");
    }

    public Path summaryFile() {
        return resultsRoot().resolve("epoch_fork_summary.json");
    }

    public Path envelopeFile() {
        return resultsRoot().resolve("epoch_fork_envelopes.jsonl");
    }

    public Path logsRoot() {
        return rootDir.resolve("logs");
    }

    public Path runLogFile() {
        return logsRoot().resolve("run-log.jsonl");
    }
}
