package org.sfiles.notation.rank;

/**
 * Tie-break role class of a unit. Declaration order is rank order.
 */
public enum NodeRole {
    /** No successors. */
    OUTPUT,
    /** No predecessors. */
    INPUT,
    OTHER,
    /** Control unit. */
    SIGNAL
}
