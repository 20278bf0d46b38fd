package org.sfiles.notation.encode;

import java.util.ArrayList;
import java.util.List;

/**
 * One unit occurrence and everything spliced at its position.
 *
 * <p>Render order: tags of the stream entering in-line, the unit, its
 * annotation, outgoing markers, then incoming markers and incoming branches
 * in insertion order.</p>
 */
final class UnitElement implements NotationItem {
    private final String unitId;
    private final List<String> leadingTags = new ArrayList<>();
    private final List<Marker> outgoing = new ArrayList<>();
    private final List<NotationItem> trailing = new ArrayList<>();
    private String annotation;

    UnitElement(String unitId) {
        this.unitId = unitId;
    }

    String unitId() {
        return unitId;
    }

    void setLeadingTags(List<String> tags) {
        leadingTags.clear();
        leadingTags.addAll(tags);
    }

    void setAnnotation(String annotation) {
        this.annotation = annotation;
    }

    void addOutgoing(Marker marker) {
        outgoing.add(marker);
    }

    void addTrailing(NotationItem item) {
        trailing.add(item);
    }

    @Override
    public void render(TokenSink sink) {
        sink.tags(leadingTags);
        sink.unit(unitId);
        if (annotation != null) {
            sink.emit("{" + annotation + "}");
        }
        for (Marker marker : outgoing) {
            marker.render(sink);
        }
        for (NotationItem item : trailing) {
            item.render(sink);
        }
    }

    @Override
    public void collectUnits(List<UnitElement> units) {
        units.add(this);
        for (NotationItem item : trailing) {
            item.collectUnits(units);
        }
    }
}
