package org.sfiles.notation.decode;

/**
 * Lexical token classes of the notation.
 */
public enum TokenType {
    /** {@code (id)} */
    UNIT,
    /** {@code {text}} directly after a unit: heat-integration group or control code. */
    ANNOTATION,
    /** {@code {text}} stream tag. */
    TAG,
    BRANCH_OPEN,
    BRANCH_CLOSE,
    /** {@code n} or {@code %nn}: stream leaves the preceding unit. */
    CYCLE_OUT,
    /** {@code <n} or {@code <%nn}: stream enters the preceding unit. */
    CYCLE_IN,
    /** {@code _n} or {@code _%nn}. */
    SIGNAL_OUT,
    /** {@code <_n} or {@code <_%nn}. */
    SIGNAL_IN,
    /** {@code <&|} */
    INCOMING_BRANCH_OPEN,
    /** {@code &}: stream from the preceding unit to the unit the incoming branch joins. */
    MIXING_POINT,
    /** {@code &|}: mixing point immediately followed by the incoming branch close. */
    MIXING_POINT_CLOSE,
    /** {@code |} */
    INCOMING_BRANCH_CLOSE,
    /** {@code n|} */
    SEGMENT_BREAK
}
