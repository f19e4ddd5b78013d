package io.epochfork.engine;

/**
 * Canonical record selected by {@link ReconciliationResolver}.
 */
public record ForkChoice(long epochId, String nodeId, String eareHash, int depth) {
}
