package io.epochfork.model;

/**
 * Time reference that detection latency is measured against.
 */
public enum DetectionReference {
    /** True end-to-end latency from the moment the fork was created. */
    FORK_CREATED("fork_created"),
    /** Monitoring latency once the fork is observable; zero by construction. */
    FORK_OBSERVABLE("fork_observable");

    private final String label;

    DetectionReference(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static DetectionReference fromString(String raw) {
        if (raw != null && FORK_OBSERVABLE.label.equals(raw.trim())) {
            return FORK_OBSERVABLE;
        }
        return FORK_CREATED;
    }
}
