package io.epochfork.model;

/**
 * Declarative graph edge. Kept for tooling; structure is derived from {@link EpochNode#parentId()} only.
 */
public record EpochEdge(
        String from,
        String to,
        String type
) {
}
