package io.epochfork.model;

import java.util.List;

/**
 * Parsed fault injection directive attached to an event.
 *
 * <p>Wire forms are {@code drop_next_eare} and {@code delay_validation:<ms>}.
 */
public record FaultDirective(Kind kind, long delayMs) {
    public static final String DROP_NEXT_EARE = "drop_next_eare";
    public static final String DELAY_VALIDATION_PREFIX = "delay_validation:";
    public static final FaultDirective NONE = new FaultDirective(Kind.NONE, 0L);
    public static final FaultDirective DROP = new FaultDirective(Kind.DROP_NEXT_EARE, 0L);

    public enum Kind {
        NONE,
        DROP_NEXT_EARE,
        DELAY_VALIDATION
    }

    public FaultDirective {
        if (kind == null) {
            kind = Kind.NONE;
        }
        if (kind != Kind.DELAY_VALIDATION) {
            delayMs = 0L;
        } else if (delayMs < 0L) {
            throw new IllegalArgumentException("delay_validation must not be negative: " + delayMs);
        }
    }

    public static FaultDirective delay(long delayMs) {
        return new FaultDirective(Kind.DELAY_VALIDATION, delayMs);
    }

    public static FaultDirective parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return NONE;
        }
        String value = raw.trim();
        if (DROP_NEXT_EARE.equals(value)) {
            return DROP;
        }
        if (value.startsWith(DELAY_VALIDATION_PREFIX)) {
            String amount = value.substring(DELAY_VALIDATION_PREFIX.length()).trim();
            try {
                return delay(Long.parseLong(amount));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Malformed fault directive: " + raw, e);
            }
        }
        throw new IllegalArgumentException("Unknown fault directive: " + raw);
    }

    public static boolean dropsRecord(List<FaultDirective> faults) {
        for (FaultDirective fault : faults) {
            if (fault.kind == Kind.DROP_NEXT_EARE) {
                return true;
            }
        }
        return false;
    }

    /**
     * First {@code delay_validation} amount in declaration order, or 0.
     */
    public static long validationDelayMs(List<FaultDirective> faults) {
        for (FaultDirective fault : faults) {
            if (fault.kind == Kind.DELAY_VALIDATION) {
                return fault.delayMs;
            }
        }
        return 0L;
    }
}
