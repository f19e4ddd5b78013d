package io.epochfork.engine;

import io.epochfork.corpus.CorpusException;
import io.epochfork.model.EpochNode;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable {@code node_id -> EpochNode} lookup for one scenario.
 */
public final class EpochGraphIndex {
    private final String scenarioId;
    private final Map<String, EpochNode> nodes;

    private EpochGraphIndex(String scenarioId, Map<String, EpochNode> nodes) {
        this.scenarioId = scenarioId;
        this.nodes = Collections.unmodifiableMap(nodes);
    }

    public static EpochGraphIndex build(String scenarioId, List<EpochNode> nodes) {
        Map<String, EpochNode> byId = new LinkedHashMap<>();
        for (EpochNode node : nodes) {
            if (byId.putIfAbsent(node.nodeId(), node) != null) {
                throw new CorpusException(scenarioId, "Duplicate node_id " + node.nodeId() + " in scenario " + scenarioId);
            }
        }
        return new EpochGraphIndex(scenarioId, byId);
    }

    public Optional<EpochNode> find(String nodeId) {
        return nodeId == null ? Optional.empty() : Optional.ofNullable(nodes.get(nodeId));
    }

    public EpochNode require(String nodeId) {
        EpochNode node = nodeId == null ? null : nodes.get(nodeId);
        if (node == null) {
            throw new CorpusException(scenarioId, "Unknown node_id " + nodeId + " in scenario " + scenarioId);
        }
        return node;
    }

    /**
     * Number of {@code parent_id} hops from the node to its chain root.
     *
     * <p>A revisited node or a dangling parent stops the walk and the accumulated depth is
     * returned, so malformed or cyclic graphs still yield a value.
     */
    public int depth(String nodeId) {
        int depth = 0;
        Set<String> seen = new HashSet<>();
        EpochNode cursor = nodes.get(nodeId);
        while (cursor != null && cursor.parentId() != null) {
            if (!seen.add(cursor.nodeId())) {
                break;
            }
            depth++;
            cursor = nodes.get(cursor.parentId());
        }
        return depth;
    }

    public int size() {
        return nodes.size();
    }

    public String scenarioId() {
        return scenarioId;
    }
}
