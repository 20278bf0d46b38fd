package org.sfiles.notation.graph;

import java.util.Optional;

/**
 * Column connectivity role of a stream: which end of a column it leaves or enters.
 */
public enum ColumnTag {
    TOP_OUT("tout"),
    BOTTOM_OUT("bout"),
    TOP_IN("tin"),
    BOTTOM_IN("bin");

    private final String notation;

    ColumnTag(String notation) {
        this.notation = notation;
    }

    public String notation() {
        return notation;
    }

    public static Optional<ColumnTag> fromNotation(String text) {
        for (ColumnTag tag : values()) {
            if (tag.notation.equals(text)) {
                return Optional.of(tag);
            }
        }
        return Optional.empty();
    }
}
