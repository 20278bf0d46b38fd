package org.sfiles.notation.core;

/**
 * Thrown when more than one tag resolves the same role category on one stream.
 */
public final class AmbiguousTagException extends FlowsheetCodecException {
    public static final String REASON_AMBIGUOUS_TAG = "SF_AMBIGUOUS_TAG";

    public AmbiguousTagException(String message) {
        super(REASON_AMBIGUOUS_TAG, message);
    }
}
