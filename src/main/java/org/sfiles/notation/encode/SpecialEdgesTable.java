package org.sfiles.notation.encode;

import java.util.HashMap;
import java.util.Map;

/**
 * Streams rendered as a marker instead of in-line adjacency, keyed by
 * source and target unit. Lives for one encode call.
 */
final class SpecialEdgesTable {
    private final Map<String, Map<String, Marker>> markers = new HashMap<>();

    void put(String source, String target, Marker marker) {
        markers.computeIfAbsent(source, s -> new HashMap<>()).put(target, marker);
    }

    /**
     * Marker of a stream, or null when the stream is rendered in-line.
     */
    Marker get(String source, String target) {
        Map<String, Marker> bySource = markers.get(source);
        return bySource == null ? null : bySource.get(target);
    }
}
