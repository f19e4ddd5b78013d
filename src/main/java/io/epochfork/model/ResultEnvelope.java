package io.epochfork.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-scenario result record, serialized as one JSON object per line.
 */
@JsonPropertyOrder({
        "scenario_id", "language", "status", "detection", "detection_ms", "reconciliation_ms",
        "winning_epoch_id", "winning_hash", "messages_dropped", "healing_actions", "errors",
        "false_positives", "notes", "failures", "tags", "wall_time_ms"
})
public record ResultEnvelope(
        @JsonProperty("scenario_id") String scenarioId,
        @JsonProperty("language") String language,
        @JsonProperty("status") String status,
        @JsonProperty("detection") boolean detection,
        @JsonProperty("detection_ms") Long detectionMs,
        @JsonProperty("reconciliation_ms") Long reconciliationMs,
        @JsonProperty("winning_epoch_id") Long winningEpochId,
        @JsonProperty("winning_hash") String winningHash,
        @JsonProperty("messages_dropped") long messagesDropped,
        @JsonProperty("healing_actions") List<String> healingActions,
        @JsonProperty("errors") List<String> errors,
        @JsonProperty("false_positives") Map<String, Integer> falsePositives,
        @JsonProperty("notes") List<String> notes,
        @JsonProperty("failures") List<String> failures,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("wall_time_ms") @JsonInclude(JsonInclude.Include.NON_NULL) Long wallTimeMs
) {
    public static final String STATUS_PASS = "pass";
    public static final String STATUS_FAIL = "fail";
    /** Structural corpus fault; never a detection verdict. */
    public static final String STATUS_ERROR = "error";
    public static final String CORPUS_ERROR_NOTE_PREFIX = "corpus_error: ";

    public ResultEnvelope {
        healingActions = healingActions == null ? List.of() : List.copyOf(healingActions);
        errors = errors == null ? List.of() : List.copyOf(errors);
        falsePositives = falsePositives == null ? emptyFalsePositives() : falsePositives;
        notes = notes == null ? List.of() : List.copyOf(notes);
        failures = failures == null ? List.of() : List.copyOf(failures);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static ResultEnvelope corpusError(String scenarioId, String language, String message, List<String> tags) {
        return new ResultEnvelope(
                scenarioId,
                language,
                STATUS_ERROR,
                false,
                null,
                null,
                null,
                null,
                0L,
                List.of(),
                List.of(),
                emptyFalsePositives(),
                List.of(CORPUS_ERROR_NOTE_PREFIX + message),
                List.of(),
                tags,
                null
        );
    }

    public static Map<String, Integer> emptyFalsePositives() {
        Map<String, Integer> out = new LinkedHashMap<>();
        out.put("warnings", 0);
        out.put("hard_errors", 0);
        return out;
    }

    @JsonIgnore
    public boolean passed() {
        return STATUS_PASS.equals(status);
    }

    @JsonIgnore
    public boolean isCorpusError() {
        return STATUS_ERROR.equals(status);
    }

    public ResultEnvelope withWallTimeMs(long value) {
        return new ResultEnvelope(
                scenarioId, language, status, detection, detectionMs, reconciliationMs, winningEpochId,
                winningHash, messagesDropped, healingActions, errors, falsePositives, notes, failures, tags, value
        );
    }
}
