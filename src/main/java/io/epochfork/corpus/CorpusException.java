package io.epochfork.corpus;

/**
 * Structural corpus or simulation fault. Scoped to one scenario unless the corpus itself is unreadable.
 */
public final class CorpusException extends RuntimeException {
    private final String scenarioId;

    public CorpusException(String message) {
        this(null, message, null);
    }

    public CorpusException(String scenarioId, String message) {
        this(scenarioId, message, null);
    }

    public CorpusException(String scenarioId, String message, Throwable cause) {
        super(message, cause);
        this.scenarioId = scenarioId;
    }

    public String scenarioId() {
        return scenarioId;
    }
}
