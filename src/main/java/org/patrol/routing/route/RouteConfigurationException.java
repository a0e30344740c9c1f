package org.patrol.routing.route;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when route constraints or search parameters are rejected before a search starts.
 */
@Getter
@Accessors(fluent = true)
public final class RouteConfigurationException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded configuration failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public RouteConfigurationException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded configuration failure with a cause.
     */
    public RouteConfigurationException(String reasonCode, String message, Throwable cause) {
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
