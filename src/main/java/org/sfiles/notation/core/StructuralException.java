package org.sfiles.notation.core;

/**
 * Thrown when a lexically valid notation does not describe a well-formed graph:
 * unmatched brackets, orphan cycle or incoming-branch markers, broken nesting.
 */
public final class StructuralException extends FlowsheetCodecException {
    public static final String REASON_UNMATCHED_BRANCH_OPEN = "SF_UNMATCHED_BRANCH_OPEN";
    public static final String REASON_UNMATCHED_BRANCH_CLOSE = "SF_UNMATCHED_BRANCH_CLOSE";
    public static final String REASON_UNMATCHED_CYCLE = "SF_UNMATCHED_CYCLE";
    public static final String REASON_ORPHAN_INCOMING_BRANCH = "SF_ORPHAN_INCOMING_BRANCH";
    public static final String REASON_BRANCH_WITHOUT_UNIT = "SF_BRANCH_WITHOUT_UNIT";
    public static final String REASON_DANGLING_TAG = "SF_DANGLING_TAG";
    public static final String REASON_MISSING_PREDECESSOR = "SF_MISSING_PREDECESSOR";
    public static final String REASON_DUPLICATE_STREAM = "SF_DUPLICATE_STREAM";
    public static final String REASON_DUPLICATE_UNIT = "SF_DUPLICATE_UNIT";
    public static final String REASON_SEGMENT_BREAK_IN_BRANCH = "SF_SEGMENT_BREAK_IN_BRANCH";

    public StructuralException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
