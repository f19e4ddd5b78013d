package io.epochfork.model;

/**
 * One issued epoch-authenticity record. Digests are opaque strings computed upstream.
 */
public record EpochNode(
        String nodeId,
        long epochId,
        String eareHash,
        String previousEpochHash,
        String membershipDigest,
        String parentId,
        String issuedBy,
        long timestampMs
) {
}
