package io.epochfork.engine;

import java.util.List;

public record SimulationResult(
        boolean detection,
        Long detectionMs,
        Long reconciliationMs,
        Long forkCreatedTime,
        Long detectionTime,
        ForkChoice winner,
        long messagesDropped,
        List<String> errors
) {
    public SimulationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public Long winningEpochId() {
        return winner == null ? null : winner.epochId();
    }

    public String winningHash() {
        return winner == null ? null : winner.eareHash();
    }

    public String winningNodeId() {
        return winner == null ? null : winner.nodeId();
    }
}
