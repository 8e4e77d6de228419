package org.wireroute.routing.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Routing contract exception with deterministic reason codes.
 *
 * <p>Raised only for caller mistakes such as missing or non-finite input. Routing
 * conditions (unreachable targets, degenerate requests, unknown obstacle ids) never
 * raise this.</p>
 */
@Getter
public final class WireRoutingException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded contract failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public WireRoutingException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
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
