package org.sfiles.notation.encode;

import java.util.ArrayList;
import java.util.List;

/**
 * Bracketed side branch {@code [ ... ]}.
 */
final class Branch implements NotationItem {
    private final List<NotationItem> items = new ArrayList<>();

    List<NotationItem> items() {
        return items;
    }

    @Override
    public void render(TokenSink sink) {
        sink.emit("[");
        for (NotationItem item : items) {
            item.render(sink);
        }
        sink.emit("]");
    }

    @Override
    public void collectUnits(List<UnitElement> units) {
        for (NotationItem item : items) {
            item.collectUnits(units);
        }
    }
}
