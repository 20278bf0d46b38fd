package org.sfiles.notation.graph;

import java.util.Optional;

/**
 * Control-loop role of a stream.
 *
 * <p>{@code NEXT_UNIT} signals drive the immediately following unit and are
 * traversed like material streams. {@code NOT_NEXT_UNIT} signals drive a
 * non-adjacent unit and are written with the underscore marker namespace.</p>
 */
public enum SignalTag {
    NEXT_UNIT("next_unitop"),
    NOT_NEXT_UNIT("not_next_unitop");

    private final String notation;

    SignalTag(String notation) {
        this.notation = notation;
    }

    public String notation() {
        return notation;
    }

    public static Optional<SignalTag> fromNotation(String text) {
        for (SignalTag tag : values()) {
            if (tag.notation.equals(text)) {
                return Optional.of(tag);
            }
        }
        return Optional.empty();
    }
}
