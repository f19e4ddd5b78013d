package io.epochfork.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.epochfork.engine.EpochForkSimulator;
import io.epochfork.util.Jsons;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Run defaults, optionally overridden by {@code epochfork-settings.json} in the data root.
 */
public record RunSettings(
        String corpus,
        String language,
        int parallelism,
        String runId,
        boolean includeStress
) {
    public RunSettings {
        corpus = corpus == null || corpus.isBlank() ? EpochForkConfig.DEFAULT_CORPUS : corpus.trim();
        language = language == null || language.isBlank() ? EpochForkSimulator.DEFAULT_LANGUAGE : language.trim();
        parallelism = Math.max(1, Math.min(EpochForkConfig.MAX_PARALLELISM, parallelism));
        runId = runId == null || runId.isBlank() ? null : runId.trim();
    }

    public static RunSettings defaults() {
        return new RunSettings(
                EpochForkConfig.DEFAULT_CORPUS,
                EpochForkSimulator.DEFAULT_LANGUAGE,
                EpochForkConfig.DEFAULT_PARALLELISM,
                System.getenv(EpochForkConfig.RUN_ID_ENV),
                false
        );
    }

    public static RunSettings load(EpochForkConfig config) {
        RunSettings defaults = defaults();
        Path file = config.settingsFile();
        if (!Files.isRegularFile(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read settings file: " + file, e);
        }
    }

    static RunSettings fromFile(SettingsFile file, RunSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new RunSettings(
                file.corpus() == null ? defaults.corpus() : file.corpus(),
                file.language() == null ? defaults.language() : file.language(),
                file.parallelism() == null ? defaults.parallelism() : file.parallelism(),
                file.runId() == null ? defaults.runId() : file.runId(),
                file.includeStress() == null ? defaults.includeStress() : file.includeStress()
        );
    }

    public RunSettings withOverrides(String corpusOverride, Integer parallelismOverride, Boolean stressOverride) {
        return new RunSettings(
                corpusOverride == null || corpusOverride.isBlank() ? corpus : corpusOverride,
                language,
                parallelismOverride == null ? parallelism : parallelismOverride,
                runId,
                stressOverride == null ? includeStress : stressOverride
        );
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            String corpus,
            String language,
            Integer parallelism,
            String runId,
            Boolean includeStress
    ) {
    }
}
