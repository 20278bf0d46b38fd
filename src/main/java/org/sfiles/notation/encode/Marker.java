package org.sfiles.notation.encode;

import java.util.ArrayList;
import java.util.List;

/**
 * Cycle, signal or mixing-point marker with the tags of the stream it stands for.
 */
final class Marker implements NotationItem {
    static final String MIXING_POINT = "&";

    private final String text;
    private final List<String> tags = new ArrayList<>();

    private Marker(String text) {
        this.text = text;
    }

    static Marker outgoingCycle(int number) {
        return new Marker(format(number));
    }

    static Marker incomingCycle(int number) {
        return new Marker("<" + format(number));
    }

    static Marker outgoingSignal(int number) {
        return new Marker("_" + format(number));
    }

    static Marker incomingSignal(int number) {
        return new Marker("<_" + format(number));
    }

    static Marker mixingPoint() {
        return new Marker(MIXING_POINT);
    }

    /**
     * Two-digit and longer numbers carry the {@code %} escape.
     */
    private static String format(int number) {
        return number > 9 ? "%" + number : Integer.toString(number);
    }

    void setTags(List<String> streamTags) {
        tags.clear();
        tags.addAll(streamTags);
    }

    @Override
    public void render(TokenSink sink) {
        sink.tags(tags);
        sink.emit(text);
    }

    @Override
    public void collectUnits(List<UnitElement> units) {
        // markers hold no units
    }
}
