package io.epochfork.engine;

import io.epochfork.model.EpochNode;
import io.epochfork.model.ErrorCategory;

/**
 * Checks that a record's {@code previous_epoch_hash} is its parent's {@code eare_hash}.
 * Runs for every delivered record whether or not it forked the chain.
 */
public final class ChainIntegrityChecker {
    private final EpochGraphIndex graph;

    public ChainIntegrityChecker(EpochGraphIndex graph) {
        this.graph = graph;
    }

    public boolean check(EpochNode node, SimulationContext context) {
        if (node.parentId() == null || node.previousEpochHash() == null) {
            return true;
        }
        boolean linked = graph.find(node.parentId())
                .map(parent -> parent.eareHash().equals(node.previousEpochHash()))
                .orElse(true);
        if (!linked) {
            context.registerError(ErrorCategory.HASH_CHAIN_BREAK);
        }
        return linked;
    }
}
