package io.epochfork.engine;

import io.epochfork.model.DetectionReference;
import io.epochfork.model.EpochNode;
import io.epochfork.model.Expectations;
import io.epochfork.model.Scenario;
import io.epochfork.model.ScenarioEvent;

import java.util.List;

final class Scenarios {
    private Scenarios() {
    }

    static EpochNode root(String nodeId, long epochId, String hash, long timestampMs) {
        return new EpochNode(nodeId, epochId, hash, null, null, null, "admin-" + nodeId, timestampMs);
    }

    static EpochNode child(String nodeId, long epochId, String hash, String parentId, String previousHash, long timestampMs) {
        return new EpochNode(nodeId, epochId, hash, previousHash, null, parentId, "admin-" + nodeId, timestampMs);
    }

    static Expectations expectNothing() {
        return new Expectations(false, DetectionReference.FORK_CREATED, 0L, 0L, null, null, List.of(), false);
    }

    static Expectations expectFork(DetectionReference reference) {
        return new Expectations(true, reference, 0L, 0L, null, null, List.of("EPOCH_FORK_DETECTED"), false);
    }

    static Scenario scenario(String id, List<EpochNode> nodes, List<ScenarioEvent> events, Expectations expectations) {
        return new Scenario(id, null, nodes, List.of(), events, expectations, List.of());
    }

    /**
     * Node a issues (3, h1) at t=0, node b issues (3, h2) at t=5; both claim the root.
     */
    static Scenario sameEpochCollision(ScenarioEvent second, Expectations expectations) {
        return scenario(
                "same-epoch-collision",
                List.of(root("a", 3, "h1", 0), root("b", 3, "h2", 5)),
                List.of(ScenarioEvent.issue(0, "a"), second),
                expectations
        );
    }
}
