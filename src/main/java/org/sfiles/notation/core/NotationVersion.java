package org.sfiles.notation.core;

/**
 * Notation dialect.
 */
public enum NotationVersion {
    /** Topology only: units, branches, cycles, incoming branches, signal markers. */
    V1,
    /** V1 plus stream tags and unit annotations (heat-integration groups, control codes). */
    V2
}
