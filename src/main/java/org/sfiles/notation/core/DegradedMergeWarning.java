package org.sfiles.notation.core;

import lombok.Builder;
import lombok.Value;

/**
 * Non-fatal report that a heat-integrated unit could not be split or merged
 * and is kept as a single multi-stream unit.
 */
@Value
@Builder
public class DegradedMergeWarning {
    public static final String REASON_SPLIT_SLOT_MISSING = "SF_SPLIT_SLOT_MISSING";
    public static final String REASON_SPLIT_SLOT_DUPLICATED = "SF_SPLIT_SLOT_DUPLICATED";
    public static final String REASON_SPLIT_SELF_LOOP_UNRESOLVED = "SF_SPLIT_SELF_LOOP_UNRESOLVED";
    public static final String REASON_MERGE_SHADOW_DEGREE = "SF_MERGE_SHADOW_DEGREE";
    public static final String REASON_MERGE_STREAM_CONFLICT = "SF_MERGE_STREAM_CONFLICT";

    /** Deterministic reason code. */
    String reasonCode;
    /** Physical unit id the warning refers to. */
    String unitId;
    /** Human-readable detail. */
    String message;

    @Override
    public String toString() {
        return "[" + reasonCode + "] " + unitId + ": " + message;
    }
}
