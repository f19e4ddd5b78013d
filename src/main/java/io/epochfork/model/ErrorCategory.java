package io.epochfork.model;

/**
 * Protocol-detection vocabulary reported in {@link ResultEnvelope#errors()}.
 */
public enum ErrorCategory {
    EPOCH_FORK_DETECTED,
    HASH_CHAIN_BREAK
}
