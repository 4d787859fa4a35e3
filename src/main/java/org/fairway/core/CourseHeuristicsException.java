package org.fairway.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Contract failure of a course analysis request, carrying a deterministic reason code.
 *
 * <p>An unreachable cup is never reported through this exception; it is a normal result.</p>
 */
@Getter
public final class CourseHeuristicsException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded contract failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public CourseHeuristicsException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded contract failure with a cause.
     */
    public CourseHeuristicsException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
