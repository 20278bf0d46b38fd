package org.sfiles.notation.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Directed flowsheet graph of units and tagged streams.
 *
 * <p>Units and streams keep insertion order so that iteration is reproducible.
 * The graph may be cyclic and disconnected; self-loops are allowed, parallel
 * streams between the same ordered pair are not.</p>
 *
 * <p><strong>Thread Safety:</strong> mutable and NOT thread-safe. Codec calls
 * never mutate their input graph.</p>
 */
public final class FlowsheetGraph {

    private final Map<String, UnitNode> units = new LinkedHashMap<>();
    private final Map<String, Map<String, Stream>> outgoing = new LinkedHashMap<>();
    private final Map<String, Map<String, Stream>> incoming = new LinkedHashMap<>();

    // ========================================================================
    // CONSTRUCTION
    // ========================================================================

    public FlowsheetGraph addUnit(String unitId) {
        return addUnit(UnitNode.of(unitId));
    }

    public FlowsheetGraph addUnit(String unitId, Map<String, String> attributes) {
        return addUnit(UnitNode.builder().id(UnitIds.requireId(unitId)).attributes(attributes).build());
    }

    /**
     * Adds a unit.
     *
     * @throws IllegalArgumentException when a unit with the same id exists.
     */
    public FlowsheetGraph addUnit(UnitNode unit) {
        Objects.requireNonNull(unit, "unit");
        UnitIds.requireId(unit.getId());
        if (units.containsKey(unit.getId())) {
            throw new IllegalArgumentException("duplicate unit id: " + unit.getId());
        }
        units.put(unit.getId(), unit);
        outgoing.put(unit.getId(), new LinkedHashMap<>());
        incoming.put(unit.getId(), new LinkedHashMap<>());
        return this;
    }

    /**
     * Replaces the attributes of an existing unit.
     */
    public FlowsheetGraph replaceUnit(UnitNode unit) {
        requireUnit(unit.getId());
        units.put(unit.getId(), unit);
        return this;
    }

    /**
     * Adds an untagged stream.
     */
    public FlowsheetGraph addStream(String source, String target) {
        return addStream(source, target, StreamTags.EMPTY);
    }

    /**
     * Adds a stream from raw tag texts.
     *
     * @throws org.sfiles.notation.core.AmbiguousTagException when two tags resolve the same category.
     */
    public FlowsheetGraph addStream(String source, String target, String... rawTags) {
        return addStream(source, target, StreamTags.of(rawTags));
    }

    /**
     * Adds a tagged stream between two existing units.
     *
     * @throws IllegalArgumentException for unknown units or a duplicate stream.
     */
    public FlowsheetGraph addStream(String source, String target, StreamTags tags) {
        requireUnit(source);
        requireUnit(target);
        Objects.requireNonNull(tags, "tags");
        if (outgoing.get(source).containsKey(target)) {
            throw new IllegalArgumentException("duplicate stream: " + source + " -> " + target);
        }
        Stream stream = new Stream(source, target, tags);
        outgoing.get(source).put(target, stream);
        incoming.get(target).put(source, stream);
        return this;
    }

    public FlowsheetGraph addStream(Stream stream) {
        return addStream(stream.getSource(), stream.getTarget(), stream.getTags());
    }

    /**
     * Replaces the tags of an existing stream.
     */
    public FlowsheetGraph retagStream(String source, String target, StreamTags tags) {
        Stream existing = stream(source, target);
        if (existing == null) {
            throw new IllegalArgumentException("unknown stream: " + source + " -> " + target);
        }
        Stream replacement = existing.withTags(tags);
        outgoing.get(source).put(target, replacement);
        incoming.get(target).put(source, replacement);
        return this;
    }

    public boolean removeStream(String source, String target) {
        Map<String, Stream> out = outgoing.get(source);
        if (out == null || out.remove(target) == null) {
            return false;
        }
        incoming.get(target).remove(source);
        return true;
    }

    /**
     * Removes a unit together with every stream touching it.
     */
    public boolean removeUnit(String unitId) {
        if (!units.containsKey(unitId)) {
            return false;
        }
        for (String target : new ArrayList<>(outgoing.get(unitId).keySet())) {
            removeStream(unitId, target);
        }
        for (String source : new ArrayList<>(incoming.get(unitId).keySet())) {
            removeStream(source, unitId);
        }
        units.remove(unitId);
        outgoing.remove(unitId);
        incoming.remove(unitId);
        return true;
    }

    // ========================================================================
    // QUERIES
    // ========================================================================

    public boolean containsUnit(String unitId) {
        return units.containsKey(unitId);
    }

    public UnitNode unit(String unitId) {
        return units.get(unitId);
    }

    public Collection<UnitNode> units() {
        return Collections.unmodifiableCollection(units.values());
    }

    public List<String> unitIds() {
        return List.copyOf(units.keySet());
    }

    public int unitCount() {
        return units.size();
    }

    public boolean isEmpty() {
        return units.isEmpty();
    }

    public Stream stream(String source, String target) {
        Map<String, Stream> out = outgoing.get(source);
        return out == null ? null : out.get(target);
    }

    public boolean hasStream(String source, String target) {
        return stream(source, target) != null;
    }

    /**
     * All streams, grouped by source in unit insertion order.
     */
    public List<Stream> streams() {
        List<Stream> all = new ArrayList<>();
        for (Map<String, Stream> out : outgoing.values()) {
            all.addAll(out.values());
        }
        return all;
    }

    public int streamCount() {
        int count = 0;
        for (Map<String, Stream> out : outgoing.values()) {
            count += out.size();
        }
        return count;
    }

    public List<Stream> outStreams(String unitId) {
        return List.copyOf(requireUnit(unitId, outgoing).values());
    }

    public List<Stream> inStreams(String unitId) {
        return List.copyOf(requireUnit(unitId, incoming).values());
    }

    public List<String> successors(String unitId) {
        return List.copyOf(requireUnit(unitId, outgoing).keySet());
    }

    public List<String> predecessors(String unitId) {
        return List.copyOf(requireUnit(unitId, incoming).keySet());
    }

    public int outDegree(String unitId) {
        return requireUnit(unitId, outgoing).size();
    }

    public int inDegree(String unitId) {
        return requireUnit(unitId, incoming).size();
    }

    /**
     * Deep copy; units and streams are immutable so only the structure is copied.
     */
    public FlowsheetGraph copy() {
        FlowsheetGraph copy = new FlowsheetGraph();
        for (UnitNode unit : units.values()) {
            copy.addUnit(unit);
        }
        for (Stream stream : streams()) {
            copy.addStream(stream);
        }
        return copy;
    }

    private void requireUnit(String unitId) {
        if (!units.containsKey(unitId)) {
            throw new IllegalArgumentException("unknown unit: " + unitId);
        }
    }

    private static Map<String, Stream> requireUnit(String unitId, Map<String, Map<String, Stream>> adjacency) {
        Map<String, Stream> streams = adjacency.get(unitId);
        if (streams == null) {
            throw new IllegalArgumentException("unknown unit: " + unitId);
        }
        return streams;
    }

    /**
     * Structural equality: same units (with attributes) and same tagged
     * streams, independent of insertion order.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FlowsheetGraph)) {
            return false;
        }
        FlowsheetGraph other = (FlowsheetGraph) o;
        return units.equals(other.units) && new HashSet<>(streams()).equals(new HashSet<>(other.streams()));
    }

    @Override
    public int hashCode() {
        Set<Stream> streamSet = new HashSet<>(streams());
        return Objects.hash(units, streamSet);
    }

    @Override
    public String toString() {
        return "FlowsheetGraph{units=" + units.keySet() + ", streams=" + streams() + "}";
    }
}
