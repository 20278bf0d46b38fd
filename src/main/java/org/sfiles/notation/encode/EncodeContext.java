package org.sfiles.notation.encode;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import org.sfiles.Utils.VisitedSet;
import org.sfiles.core.id.UnitIndex;
import org.sfiles.notation.graph.FlowsheetGraph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Scratch state of one encode call: visit tracking, marker counters, the
 * unit-to-element index and the special-edges table.
 *
 * <p><strong>Thread Safety:</strong> NOT thread-safe; one instance per call.</p>
 */
final class EncodeContext {
    final FlowsheetGraph graph;
    final SpecialEdgesTable specialEdges = new SpecialEdgesTable();
    final List<NotationItem> root = new ArrayList<>();

    private final Object2IntMap<String> ranks;
    private final UnitIndex index;
    private final VisitedSet visited;
    private final Map<String, UnitElement> elements = new HashMap<>();
    private final List<String> unitsByRank;

    private VisitedSet previousSegments;
    private String insertionUnit;
    private int cycleCounter;
    private int signalCounter;

    EncodeContext(FlowsheetGraph graph, Object2IntMap<String> ranks) {
        this.graph = graph;
        this.ranks = ranks;
        this.index = UnitIndex.of(graph.unitIds());
        this.visited = new VisitedSet(index.size());
        this.previousSegments = new VisitedSet(index.size());
        this.unitsByRank = new ArrayList<>(graph.unitIds());
        this.unitsByRank.sort(byRank());
    }

    Comparator<String> byRank() {
        return Comparator.comparingInt(ranks::getInt);
    }

    int rank(String unitId) {
        return ranks.getInt(unitId);
    }

    List<String> unitsByRank() {
        return unitsByRank;
    }

    /**
     * Lowest-ranked unit not visited yet, or null when all are visited.
     */
    String lowestRankedUnvisited() {
        for (String unitId : unitsByRank) {
            if (!isVisited(unitId)) {
                return unitId;
            }
        }
        return null;
    }

    UnitElement visit(String unitId) {
        visited.markVisited(index.indexOf(unitId));
        UnitElement element = new UnitElement(unitId);
        elements.put(unitId, element);
        return element;
    }

    boolean isVisited(String unitId) {
        return visited.isVisited(index.indexOf(unitId));
    }

    /**
     * True when the unit was visited by a segment completed before the current one.
     */
    boolean inPreviousSegment(String unitId) {
        return previousSegments.isVisited(index.indexOf(unitId));
    }

    UnitElement element(String unitId) {
        return elements.get(unitId);
    }

    /**
     * Starts a new walk segment: everything visited so far becomes "previous".
     */
    void beginSegment() {
        previousSegments = visited.snapshot();
        insertionUnit = null;
    }

    String insertionUnit() {
        return insertionUnit;
    }

    void setInsertionUnit(String unitId) {
        insertionUnit = unitId;
    }

    int nextCycleNumber() {
        return ++cycleCounter;
    }

    int nextSignalNumber() {
        return ++signalCounter;
    }
}
