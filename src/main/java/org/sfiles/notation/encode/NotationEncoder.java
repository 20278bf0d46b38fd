package org.sfiles.notation.encode;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.sfiles.notation.core.EmptyInputException;
import org.sfiles.notation.core.EncodeOptions;
import org.sfiles.notation.core.EncodeResult;
import org.sfiles.notation.core.NotationVersion;
import org.sfiles.notation.graph.FlowsheetGraph;
import org.sfiles.notation.graph.Stream;
import org.sfiles.notation.graph.UnitIds;
import org.sfiles.notation.heat.HeatIntegration;
import org.sfiles.notation.heat.SplitResult;
import org.sfiles.notation.rank.CanonicalRanker;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Depth-first linearization of a flowsheet graph into notation tokens.
 *
 * <p>Pipeline per call:</p>
 * <ol>
 *   <li>split heat-integrated units into shadow units,</li>
 *   <li>withhold signal streams that drive non-adjacent units,</li>
 *   <li>rank the remaining traversal graph,</li>
 *   <li>walk it segment by segment building the token tree,</li>
 *   <li>splice signal markers, stream tags and unit annotations,</li>
 *   <li>render the numbered and the generalized form.</li>
 * </ol>
 */
@Slf4j
@UtilityClass
public final class NotationEncoder {

    /**
     * Encodes a graph.
     *
     * @param graph graph to encode; not mutated.
     * @param options encode options.
     * @return numbered and generalized notation plus split warnings.
     * @throws EmptyInputException when the graph has no units.
     */
    public static EncodeResult encode(FlowsheetGraph graph, EncodeOptions options) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(options, "options");
        if (graph.isEmpty()) {
            throw new EmptyInputException("cannot encode a graph without units");
        }

        SplitResult split = HeatIntegration.split(graph);
        FlowsheetGraph full = split.getGraph();
        FlowsheetGraph traversal = full.copy();
        List<Stream> remoteSignals = new ArrayList<>();
        for (Stream stream : full.streams()) {
            if (stream.isRemoteSignal()) {
                remoteSignals.add(stream);
                traversal.removeStream(stream.getSource(), stream.getTarget());
            }
        }

        Object2IntMap<String> ranks = options.isCanonical()
                ? CanonicalRanker.rank(traversal, options.getRankingConfig())
                : CanonicalRanker.shuffled(traversal, options.getRandomSeed());

        EncodeContext context = new EncodeContext(traversal, ranks);
        walk(context);
        placeSignals(context, remoteSignals);
        if (options.getVersion() == NotationVersion.V2) {
            attachTags(context, full.streams(), options.isIncludeHeatTags());
            annotate(context);
        }

        TokenSink numbered = new TokenSink(false);
        TokenSink generalized = new TokenSink(true);
        for (NotationItem item : context.root) {
            item.render(numbered);
            item.render(generalized);
        }
        List<String> tokens = numbered.tokens();
        List<String> generalizedTokens = generalized.tokens();
        log.debug("encoded {} units and {} streams into {} tokens",
                graph.unitCount(), graph.streamCount(), tokens.size());

        return EncodeResult.builder()
                .tokens(tokens)
                .notation(String.join("", tokens))
                .generalizedTokens(generalizedTokens)
                .generalizedNotation(String.join("", generalizedTokens))
                .warnings(split.getWarnings())
                .build();
    }

    // ========================================================================
    // WALK
    // ========================================================================

    /**
     * First segment from the lowest-ranked unit without predecessors, then
     * the remaining units without predecessors, then whatever is still
     * unvisited (pure cycles), lowest rank first.
     */
    private static void walk(EncodeContext context) {
        List<String> sources = new ArrayList<>();
        for (String unitId : context.unitsByRank()) {
            if (context.graph.inDegree(unitId) == 0) {
                sources.add(unitId);
            }
        }

        String first = sources.isEmpty() ? context.lowestRankedUnvisited() : sources.get(0);
        segment(context, first, true);
        for (String source : sources) {
            if (!context.isVisited(source)) {
                segment(context, source, false);
            }
        }
        String next;
        while ((next = context.lowestRankedUnvisited()) != null) {
            segment(context, next, false);
        }
    }

    private static void segment(EncodeContext context, String start, boolean first) {
        context.beginSegment();
        List<NotationItem> items = new ArrayList<>();
        visit(context, items, start);
        if (first) {
            context.root.addAll(items);
            return;
        }
        String insertion = context.insertionUnit();
        if (insertion != null) {
            context.element(insertion).addTrailing(new IncomingBranch(items));
        } else {
            context.root.add(SegmentBreak.INSTANCE);
            context.root.addAll(items);
        }
    }

    /**
     * Visits an unvisited unit, appending its element to {@code out} and
     * descending into its successors.
     */
    private static void visit(EncodeContext context, List<NotationItem> out, String unitId) {
        out.add(context.visit(unitId));
        List<String> successors = context.graph.successors(unitId);
        if (successors.size() == 1) {
            follow(context, out, unitId, successors.get(0));
            return;
        }
        List<String> ordered = visitedFirst(context, successors);
        for (int i = 0; i < ordered.size(); i++) {
            String next = ordered.get(i);
            boolean last = i == ordered.size() - 1;
            if (context.isVisited(next)) {
                reference(context, unitId, next);
            } else if (last) {
                visit(context, out, next);
            } else {
                Branch branch = new Branch();
                out.add(branch);
                visit(context, branch.items(), next);
            }
        }
    }

    private static void follow(EncodeContext context, List<NotationItem> out, String from, String to) {
        if (context.isVisited(to)) {
            reference(context, from, to);
        } else {
            visit(context, out, to);
        }
    }

    /**
     * Already visited neighbors first (back edges before forward edges),
     * each group by rank.
     */
    private static List<String> visitedFirst(EncodeContext context, List<String> successors) {
        List<String> visited = new ArrayList<>();
        List<String> fresh = new ArrayList<>();
        for (String successor : successors) {
            (context.isVisited(successor) ? visited : fresh).add(successor);
        }
        Comparator<String> byRank = context.byRank();
        visited.sort(byRank);
        fresh.sort(byRank);
        visited.addAll(fresh);
        return visited;
    }

    /**
     * Stream to an already visited unit. The first reference of a segment
     * into an earlier segment becomes its mixing point; every other
     * reference becomes a numbered cycle.
     */
    private static void reference(EncodeContext context, String from, String to) {
        if (context.inPreviousSegment(to) && context.insertionUnit() == null) {
            context.setInsertionUnit(to);
            Marker marker = Marker.mixingPoint();
            context.element(from).addOutgoing(marker);
            context.specialEdges.put(from, to, marker);
            return;
        }
        int number = context.nextCycleNumber();
        Marker outgoing = Marker.outgoingCycle(number);
        context.element(to).addTrailing(Marker.incomingCycle(number));
        context.element(from).addOutgoing(outgoing);
        context.specialEdges.put(from, to, outgoing);
    }

    // ========================================================================
    // SPLICING PASSES
    // ========================================================================

    /**
     * Signal streams to non-adjacent units, by source rank then target rank,
     * numbered independently of material cycles.
     */
    private static void placeSignals(EncodeContext context, List<Stream> remoteSignals) {
        List<Stream> ordered = new ArrayList<>(remoteSignals);
        ordered.sort(Comparator
                .comparingInt((Stream s) -> context.rank(s.getSource()))
                .thenComparingInt(s -> context.rank(s.getTarget())));
        for (Stream stream : ordered) {
            int number = context.nextSignalNumber();
            Marker outgoing = Marker.outgoingSignal(number);
            context.element(stream.getSource()).addOutgoing(outgoing);
            context.element(stream.getTarget()).addTrailing(Marker.incomingSignal(number));
            context.specialEdges.put(stream.getSource(), stream.getTarget(), outgoing);
        }
    }

    /**
     * Tags go in front of the stream's marker, or in front of its target unit
     * when the stream is rendered in-line.
     */
    private static void attachTags(EncodeContext context, List<Stream> streams, boolean includeHeatTags) {
        for (Stream stream : streams) {
            List<String> tags = stream.getTags().notationTags(includeHeatTags);
            if (tags.isEmpty()) {
                continue;
            }
            Marker marker = context.specialEdges.get(stream.getSource(), stream.getTarget());
            if (marker != null) {
                marker.setTags(tags);
            } else {
                context.element(stream.getTarget()).setLeadingTags(tags);
            }
        }
    }

    /**
     * Shadow units get the group number of their physical unit, assigned in
     * order of first appearance; control units get their control code.
     */
    private static void annotate(EncodeContext context) {
        List<UnitElement> units = new ArrayList<>();
        for (NotationItem item : context.root) {
            item.collectUnits(units);
        }
        Map<String, Integer> groups = new HashMap<>();
        for (UnitElement element : units) {
            String unitId = element.unitId();
            if (UnitIds.isShadow(unitId)) {
                int group = groups.computeIfAbsent(UnitIds.baseOf(unitId), b -> groups.size() + 1);
                element.setAnnotation(Integer.toString(group));
                continue;
            }
            Optional<String> code = UnitIds.controlCodeOf(unitId);
            code.ifPresent(element::setAnnotation);
        }
    }
}
