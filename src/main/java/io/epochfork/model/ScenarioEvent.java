package io.epochfork.model;

import java.util.List;

public record ScenarioEvent(
        long t,
        EventType type,
        String nodeId,
        Long epochId,
        long count,
        List<FaultDirective> faults,
        String controller,
        List<String> participants,
        String reconcileStrategy
) {
    public ScenarioEvent {
        faults = faults == null ? List.of() : List.copyOf(faults);
        participants = participants == null ? List.of() : List.copyOf(participants);
    }

    public static ScenarioEvent issue(long t, String nodeId, FaultDirective... faults) {
        return new ScenarioEvent(t, EventType.EPOCH_ISSUE, nodeId, null, 0L, List.of(faults), null, null, null);
    }

    public static ScenarioEvent replay(long t, long count) {
        return new ScenarioEvent(t, EventType.REPLAY_ATTEMPT, null, null, count, List.of(), null, null, null);
    }

    public static ScenarioEvent merge(long t) {
        return new ScenarioEvent(t, EventType.MERGE, null, null, 0L, List.of(), null, null, null);
    }

    public boolean dropsRecord() {
        return FaultDirective.dropsRecord(faults);
    }

    public long validationDelayMs() {
        return FaultDirective.validationDelayMs(faults);
    }
}
