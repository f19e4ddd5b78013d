package io.epochfork.engine;

import io.epochfork.model.Expectations;
import io.epochfork.model.ResultEnvelope;

import java.util.ArrayList;
import java.util.List;

/**
 * Diffs a simulation result against the scenario's declared expectations. Never throws on a
 * mismatch; every mismatch becomes a failure code, in the order declared below.
 */
public final class ExpectationEvaluator {
    public static final String DETECTION_MISMATCH = "detection_mismatch";
    public static final String MISSING_DETECTION_MS = "missing_detection_ms";
    public static final String DETECTION_SLA = "detection_sla";
    public static final String WINNING_HASH_MISMATCH = "winning_hash_mismatch";
    public static final String WINNING_EPOCH_MISMATCH = "winning_epoch_mismatch";
    public static final String MISSING_RECONCILIATION = "missing_reconciliation";
    public static final String RECONCILIATION_SLA = "reconciliation_sla";
    public static final String REPLAY_GAP_MESSAGES = "replay_gap_messages";
    public static final String MISSING_ERROR_CATEGORIES = "missing_error_categories";

    private ExpectationEvaluator() {
    }

    public static Verdict evaluate(Expectations expectations, SimulationResult result) {
        List<String> failures = new ArrayList<>();

        if (result.detection() != expectations.detected()) {
            failures.add(DETECTION_MISMATCH);
        }
        if (expectations.detected()) {
            if (result.detectionMs() == null) {
                failures.add(MISSING_DETECTION_MS);
            } else if (expectations.maxDetectionMs() > 0 && result.detectionMs() > expectations.maxDetectionMs()) {
                failures.add(DETECTION_SLA);
            }
        }

        Expectations.ReconciledEpoch expected = expectations.reconciledEpoch();
        if (!expected.eareHash().isEmpty() && result.winningHash() != null
                && !expected.eareHash().equals(result.winningHash())) {
            failures.add(WINNING_HASH_MISMATCH);
        }
        if (expected.epochId() != 0L && result.winningEpochId() != null
                && expected.epochId() != result.winningEpochId()) {
            failures.add(WINNING_EPOCH_MISMATCH);
        }

        if (expectations.healingRequired()) {
            if (result.reconciliationMs() == null) {
                failures.add(MISSING_RECONCILIATION);
            } else if (expectations.maxReconciliationMs() > 0
                    && result.reconciliationMs() > expectations.maxReconciliationMs()) {
                failures.add(RECONCILIATION_SLA);
            }
        }

        long maxMessages = expectations.allowReplayGap().maxMessages();
        if (maxMessages > 0 && result.messagesDropped() > maxMessages) {
            failures.add(REPLAY_GAP_MESSAGES);
        }

        for (String category : expectations.expectedErrorCategories()) {
            if (!result.errors().contains(category)) {
                failures.add(MISSING_ERROR_CATEGORIES);
                break;
            }
        }

        return new Verdict(failures.isEmpty() ? ResultEnvelope.STATUS_PASS : ResultEnvelope.STATUS_FAIL, failures);
    }

    public record Verdict(String status, List<String> failures) {
        public Verdict {
            failures = failures == null ? List.of() : List.copyOf(failures);
        }

        public boolean passed() {
            return failures.isEmpty();
        }
    }
}
