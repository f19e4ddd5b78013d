package io.epochfork.engine;

import io.epochfork.model.EpochNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Longest-chain fork choice over every record the network observed.
 *
 * <p>Order, most significant first: depth descending, epoch_id descending, timestamp_ms
 * ascending, eare_hash descending. The first candidate wins.
 */
public final class ReconciliationResolver {
    public static final Comparator<Candidate> FORK_CHOICE_ORDER = Comparator
            .comparingInt(Candidate::depth).reversed()
            .thenComparing(Comparator.comparingLong((Candidate c) -> c.node().epochId()).reversed())
            .thenComparingLong(c -> c.node().timestampMs())
            .thenComparing(Comparator.comparing((Candidate c) -> c.node().eareHash()).reversed());

    private final EpochGraphIndex graph;

    public ReconciliationResolver(EpochGraphIndex graph) {
        this.graph = graph;
    }

    public Optional<ForkChoice> resolve(SimulationContext context) {
        return resolve(candidates(context));
    }

    public static Optional<ForkChoice> resolve(List<Candidate> candidates) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        List<Candidate> sorted = new ArrayList<>(candidates);
        sorted.sort(FORK_CHOICE_ORDER);
        Candidate winner = sorted.get(0);
        EpochNode node = winner.node();
        return Optional.of(new ForkChoice(node.epochId(), node.nodeId(), node.eareHash(), winner.depth()));
    }

    List<Candidate> candidates(SimulationContext context) {
        Map<String, Integer> depthCache = new HashMap<>();
        List<Candidate> out = new ArrayList<>();
        for (SimulationContext.ObservedRecord entry : context.allObserved()) {
            EpochNode node = graph.require(entry.nodeId());
            int depth = depthCache.computeIfAbsent(node.nodeId(), graph::depth);
            out.add(new Candidate(node, depth));
        }
        return out;
    }

    public record Candidate(EpochNode node, int depth) {
    }
}
