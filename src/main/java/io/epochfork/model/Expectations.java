package io.epochfork.model;

import java.util.List;

public record Expectations(
        boolean detected,
        DetectionReference detectionReference,
        long maxDetectionMs,
        long maxReconciliationMs,
        ReconciledEpoch reconciledEpoch,
        ReplayGap allowReplayGap,
        List<String> expectedErrorCategories,
        boolean healingRequired
) {
    public Expectations {
        detectionReference = detectionReference == null ? DetectionReference.FORK_CREATED : detectionReference;
        reconciledEpoch = reconciledEpoch == null ? ReconciledEpoch.UNSET : reconciledEpoch;
        allowReplayGap = allowReplayGap == null ? ReplayGap.UNBOUNDED : allowReplayGap;
        expectedErrorCategories = expectedErrorCategories == null ? List.of() : List.copyOf(expectedErrorCategories);
    }

    /**
     * Expected fork-choice winner. Zero epoch and empty hash mean "not asserted".
     */
    public record ReconciledEpoch(long epochId, String nodeId, String eareHash) {
        public static final ReconciledEpoch UNSET = new ReconciledEpoch(0L, "", "");

        public ReconciledEpoch {
            nodeId = nodeId == null ? "" : nodeId;
            eareHash = eareHash == null ? "" : eareHash;
        }
    }

    /**
     * Tolerated collateral loss during an unresolved fork. Zero means "not asserted".
     */
    public record ReplayGap(long maxMessages, long maxMs) {
        public static final ReplayGap UNBOUNDED = new ReplayGap(0L, 0L);
    }
}
