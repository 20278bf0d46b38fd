package org.sfiles.notation.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Base codec failure with a deterministic reason code.
 *
 * <p>Messages are prefixed with {@code [REASON_CODE]} so batch callers can
 * bucket failures without parsing free text. A thrown codec exception always
 * means the call produced no result at all.</p>
 */
@Getter
@Accessors(fluent = true)
public class FlowsheetCodecException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded codec failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public FlowsheetCodecException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded codec failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public FlowsheetCodecException(String reasonCode, String message, Throwable cause) {
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
