package io.epochfork.engine;

import io.epochfork.model.EpochNode;
import io.epochfork.model.EventType;
import io.epochfork.model.ScenarioEvent;

import java.util.List;
import java.util.Optional;

/**
 * Flags the first moment two inconsistent epoch records become visible.
 *
 * <p>A record forks the chain when another hash was already observed for its epoch number,
 * or when a sibling under the same parent (or under the shared root) carries a different
 * {@code (epoch_id, hash)} pair. Dropped records never reach the indices, so a fork made
 * only of dropped records is not detectable.
 */
public final class ForkDetector {
    private final EpochGraphIndex graph;

    public ForkDetector(EpochGraphIndex graph) {
        this.graph = graph;
    }

    /**
     * Processes one {@code epoch_issue}. Returns the issued record, or empty if it was dropped.
     */
    public Optional<EpochNode> observe(ScenarioEvent event, SimulationContext context) {
        if (event.type() != EventType.EPOCH_ISSUE) {
            throw new IllegalArgumentException("Not an epoch_issue event: " + event.type().label());
        }
        if (event.dropsRecord()) {
            return Optional.empty();
        }
        EpochNode node = graph.require(event.nodeId());

        boolean forkDetected = sameEpochCollision(node, context.observedForEpoch(node.epochId()))
                || siblingDivergence(node, context.childrenOf(node.parentId()));

        context.record(node);
        if (forkDetected) {
            context.markFork(event.t(), event.validationDelayMs());
        }
        return Optional.of(node);
    }

    static boolean sameEpochCollision(EpochNode node, List<SimulationContext.ObservedRecord> entries) {
        if (entries.isEmpty()) {
            return false;
        }
        for (SimulationContext.ObservedRecord entry : entries) {
            if (entry.hash().equals(node.eareHash())) {
                return false;
            }
        }
        return true;
    }

    static boolean siblingDivergence(EpochNode node, List<SimulationContext.ChildRecord> siblings) {
        if (siblings.isEmpty()) {
            return false;
        }
        for (SimulationContext.ChildRecord sibling : siblings) {
            if (sibling.matches(node.epochId(), node.eareHash())) {
                return false;
            }
        }
        return true;
    }
}
