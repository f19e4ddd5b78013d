package io.epochfork.model;

public enum EventType {
    EPOCH_ISSUE("epoch_issue"),
    REPLAY_ATTEMPT("replay_attempt"),
    MERGE("merge");

    private final String label;

    EventType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static EventType fromLabel(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Event type is required");
        }
        for (EventType value : values()) {
            if (value.label.equals(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + raw);
    }
}
