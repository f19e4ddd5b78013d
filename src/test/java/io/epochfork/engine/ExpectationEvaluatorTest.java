package io.epochfork.engine;

import io.epochfork.model.DetectionReference;
import io.epochfork.model.Expectations;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExpectationEvaluatorTest {
    private static final ForkChoice WINNER = new ForkChoice(3L, "a", "h1", 0);

    @Test
    void matchingResultPasses() {
        Expectations expectations = new Expectations(
                true, DetectionReference.FORK_CREATED, 200L, 500L,
                new Expectations.ReconciledEpoch(3L, "a", "h1"),
                new Expectations.ReplayGap(10L, 0L),
                List.of("EPOCH_FORK_DETECTED"),
                true
        );
        SimulationResult result = result(true, 150L, 245L, WINNER, 4L, List.of("EPOCH_FORK_DETECTED"));

        ExpectationEvaluator.Verdict verdict = ExpectationEvaluator.evaluate(expectations, result);

        assertTrue(verdict.passed());
        assertEquals("pass", verdict.status());
    }

    @Test
    void missedDetectionReportsMismatchAndMissingLatency() {
        Expectations expectations = new Expectations(true, null, 0L, 0L, null, null, List.of(), false);
        ExpectationEvaluator.Verdict verdict = ExpectationEvaluator.evaluate(
                expectations, result(false, null, null, WINNER, 0L, List.of()));

        assertEquals("fail", verdict.status());
        assertEquals(List.of("detection_mismatch", "missing_detection_ms"), verdict.failures());
    }

    @Test
    void unexpectedDetectionIsAMismatch() {
        Expectations expectations = new Expectations(false, null, 0L, 0L, null, null, List.of(), false);
        ExpectationEvaluator.Verdict verdict = ExpectationEvaluator.evaluate(
                expectations, result(true, 0L, null, WINNER, 0L, List.of("EPOCH_FORK_DETECTED")));

        assertEquals(List.of("detection_mismatch"), verdict.failures());
    }

    @Test
    void slaCeilingsOnlyApplyWhenPositive() {
        Expectations unbounded = new Expectations(true, null, 0L, 0L, null, null, List.of(), true);
        assertTrue(ExpectationEvaluator.evaluate(unbounded, result(true, 9_999L, 9_999L, WINNER, 0L, List.of())).passed());

        Expectations bounded = new Expectations(true, null, 100L, 100L, null, null, List.of(), true);
        assertEquals(List.of("detection_sla", "reconciliation_sla"),
                ExpectationEvaluator.evaluate(bounded, result(true, 101L, 101L, WINNER, 0L, List.of())).failures());
        assertTrue(ExpectationEvaluator.evaluate(bounded, result(true, 100L, 100L, WINNER, 0L, List.of())).passed());
    }

    @Test
    void healingRequiredWithoutMergeIsMissingReconciliation() {
        Expectations expectations = new Expectations(false, null, 0L, 0L, null, null, List.of(), true);
        assertEquals(List.of("missing_reconciliation"),
                ExpectationEvaluator.evaluate(expectations, result(false, null, null, null, 0L, List.of())).failures());
    }

    @Test
    void winnerMismatchesAreReportedSeparately() {
        Expectations expectations = new Expectations(
                false, null, 0L, 0L, new Expectations.ReconciledEpoch(4L, "", "h9"), null, List.of(), false);
        assertEquals(List.of("winning_hash_mismatch", "winning_epoch_mismatch"),
                ExpectationEvaluator.evaluate(expectations, result(false, null, null, WINNER, 0L, List.of())).failures());
    }

    @Test
    void unsetWinnerExpectationsAndMissingWinnerAreNotCompared() {
        Expectations unset = new Expectations(false, null, 0L, 0L, null, null, List.of(), false);
        assertTrue(ExpectationEvaluator.evaluate(unset, result(false, null, null, WINNER, 0L, List.of())).passed());

        Expectations asserted = new Expectations(
                false, null, 0L, 0L, new Expectations.ReconciledEpoch(4L, "", "h9"), null, List.of(), false);
        assertTrue(ExpectationEvaluator.evaluate(asserted, result(false, null, null, null, 0L, List.of())).passed());
    }

    @Test
    void replayGapAndMissingCategoriesAreReportedOnce() {
        Expectations expectations = new Expectations(
                false, null, 0L, 0L, null, new Expectations.ReplayGap(5L, 0L),
                List.of("EPOCH_FORK_DETECTED", "HASH_CHAIN_BREAK"), false);
        ExpectationEvaluator.Verdict verdict = ExpectationEvaluator.evaluate(
                expectations, result(false, null, null, null, 6L, List.of()));

        assertFalse(verdict.passed());
        assertEquals(List.of("replay_gap_messages", "missing_error_categories"), verdict.failures());
    }

    @Test
    void failuresFollowDeclaredOrder() {
        Expectations expectations = new Expectations(
                true, null, 0L, 10L,
                new Expectations.ReconciledEpoch(7L, "", "other"),
                new Expectations.ReplayGap(1L, 0L),
                List.of("HASH_CHAIN_BREAK"),
                true
        );
        ExpectationEvaluator.Verdict verdict = ExpectationEvaluator.evaluate(
                expectations, result(false, null, null, WINNER, 3L, List.of()));

        assertEquals(List.of(
                "detection_mismatch",
                "missing_detection_ms",
                "winning_hash_mismatch",
                "winning_epoch_mismatch",
                "missing_reconciliation",
                "replay_gap_messages",
                "missing_error_categories"
        ), verdict.failures());
    }

    private static SimulationResult result(
            boolean detection,
            Long detectionMs,
            Long reconciliationMs,
            ForkChoice winner,
            long dropped,
            List<String> errors
    ) {
        return new SimulationResult(detection, detectionMs, reconciliationMs, null, null, winner, dropped, errors);
    }
}
