package org.Aayush.wayfinder.routing.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Rejected route request, tagged with one of the {@code WF_*} reason codes of {@link RouteCore}.
 * <p>
 * Covers malformed requests (missing endpoints or algorithm), ids the node mapper does not know,
 * and predecessor data that cannot be turned into a path. An unreachable target is not a failure
 * and never produces this exception.
 * <p>
 * The message is rendered as {@code "[WF_CODE] detail"} so CLI output stays greppable.
 */
@Getter
public final class RouteCoreException extends RuntimeException {
    private final String reasonCode;

    /**
     * @param reasonCode one of the {@code RouteCore.REASON_*} codes.
     * @param message detail naming the offending field or node id.
     */
    public RouteCoreException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Wraps a lower-level failure, such as an unknown id or a predecessor cycle.
     */
    public RouteCoreException(String reasonCode, String message, Throwable cause) {
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
