package io.epochfork.engine;

import io.epochfork.model.DetectionReference;
import io.epochfork.model.ResultEnvelope;
import io.epochfork.model.Scenario;

import java.util.List;

/**
 * Latency metrics and the serialized per-scenario envelope.
 */
public final class EnvelopeBuilder {
    private EnvelopeBuilder() {
    }

    /**
     * {@code null} when nothing was detected. Under {@link DetectionReference#FORK_OBSERVABLE}
     * the reference is the detection time itself, so the result is 0.
     */
    public static Long detectionMs(DetectionReference reference, Long detectionTime, Long forkCreatedTime) {
        if (detectionTime == null) {
            return null;
        }
        long referenceTime;
        if (reference == DetectionReference.FORK_OBSERVABLE) {
            referenceTime = detectionTime;
        } else {
            referenceTime = forkCreatedTime != null ? forkCreatedTime : detectionTime;
        }
        return Math.max(0L, detectionTime - referenceTime);
    }

    public static Long reconciliationMs(Long detectionTime, Long firstMergeTime) {
        if (detectionTime == null || firstMergeTime == null) {
            return null;
        }
        return Math.max(0L, firstMergeTime - detectionTime);
    }

    public static ResultEnvelope build(
            Scenario scenario,
            SimulationResult result,
            ExpectationEvaluator.Verdict verdict,
            String language
    ) {
        return new ResultEnvelope(
                scenario.scenarioId(),
                language,
                verdict.status(),
                result.detection(),
                result.detectionMs(),
                result.reconciliationMs(),
                result.winningEpochId(),
                result.winningHash(),
                result.messagesDropped(),
                List.of(),
                result.errors(),
                ResultEnvelope.emptyFalsePositives(),
                List.of(),
                verdict.failures(),
                scenario.tags(),
                null
        );
    }
}
