package org.sfiles.notation.core;

/**
 * Thrown for null or blank notation, an empty token list, or an empty graph.
 */
public final class EmptyInputException extends FlowsheetCodecException {
    public static final String REASON_EMPTY_INPUT = "SF_EMPTY_INPUT";

    public EmptyInputException(String message) {
        super(REASON_EMPTY_INPUT, message);
    }
}
