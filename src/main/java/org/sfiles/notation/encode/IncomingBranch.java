package org.sfiles.notation.encode;

import java.util.List;

/**
 * Later walk segment joining an earlier one at a mixing point,
 * rendered {@code <&| ... |} right after the unit it flows into.
 */
final class IncomingBranch implements NotationItem {
    private final List<NotationItem> items;

    IncomingBranch(List<NotationItem> items) {
        this.items = List.copyOf(items);
    }

    @Override
    public void render(TokenSink sink) {
        sink.emit("<&|");
        for (NotationItem item : items) {
            item.render(sink);
        }
        sink.emit("|");
    }

    @Override
    public void collectUnits(List<UnitElement> units) {
        for (NotationItem item : items) {
            item.collectUnits(units);
        }
    }
}
