package org.sfiles.notation.encode;

import java.util.List;

/**
 * Separator before a walk segment unrelated to everything before it.
 */
final class SegmentBreak implements NotationItem {
    static final SegmentBreak INSTANCE = new SegmentBreak();

    private SegmentBreak() {
    }

    @Override
    public void render(TokenSink sink) {
        sink.emit("n|");
    }

    @Override
    public void collectUnits(List<UnitElement> units) {
        // no units
    }
}
