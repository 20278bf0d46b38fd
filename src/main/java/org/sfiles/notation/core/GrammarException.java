package org.sfiles.notation.core;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Thrown when the lexer cannot classify a substring of the notation.
 */
@Getter
@Accessors(fluent = true)
public final class GrammarException extends FlowsheetCodecException {
    public static final String REASON_UNKNOWN_TOKEN = "SF_GRAMMAR_UNKNOWN_TOKEN";
    public static final String REASON_MISPLACED_ANNOTATION = "SF_GRAMMAR_MISPLACED_ANNOTATION";

    /** Character offset (or token position for token-list input) of the failure. */
    private final int offset;

    public GrammarException(String reasonCode, String message, int offset) {
        super(reasonCode, message + " at offset " + offset);
        this.offset = offset;
    }
}
