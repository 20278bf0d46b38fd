package org.sfiles.notation.heat;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.sfiles.notation.core.DegradedMergeWarning;
import org.sfiles.notation.graph.FlowsheetGraph;
import org.sfiles.notation.graph.HeatExchangeTag;
import org.sfiles.notation.graph.Stream;
import org.sfiles.notation.graph.StreamTags;
import org.sfiles.notation.graph.UnitIds;
import org.sfiles.notation.graph.UnitNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Splits multi-stream (heat-integrated) units into per-stream shadow units
 * {@code base/k} and folds them back.
 *
 * <p>Both directions work on copies. A unit that cannot be split or a group
 * that cannot be merged stays as one multi-stream unit and is reported as a
 * {@link DegradedMergeWarning}; neither direction ever fails the call.</p>
 */
@Slf4j
@UtilityClass
public final class HeatIntegration {

    // ========================================================================
    // SPLIT
    // ========================================================================

    /**
     * Splits every heat-integrated unit of a graph.
     *
     * <p>A unit is split when more than one material stream enters it and it
     * is a heat exchanger or at least one of its material streams carries a
     * heat-exchange tag. A heat exchanger without slot tags is left whole. Each
     * in-stream is paired with the out-stream of the same slot; slot {@code i}
     * in slot order becomes shadow {@code base/i}.</p>
     *
     * @param graph input graph; not mutated.
     * @return split graph, shadow table and warnings.
     */
    public static SplitResult split(FlowsheetGraph graph) {
        Objects.requireNonNull(graph, "graph");
        SplitResult.SplitResultBuilder result = SplitResult.builder();

        Map<String, List<String>> shadowsByBase = new LinkedHashMap<>();
        Map<Stream, Stream> rewired = new HashMap<>();
        for (UnitNode unit : graph.units()) {
            if (!isSplitCandidate(graph, unit.getId())) {
                continue;
            }
            Optional<SlotPlan> plan = planSplit(graph, unit.getId(), result);
            if (plan.isEmpty()) {
                continue;
            }
            shadowsByBase.put(unit.getId(), plan.get().apply(rewired));
        }

        FlowsheetGraph split = new FlowsheetGraph();
        for (UnitNode unit : graph.units()) {
            List<String> shadows = shadowsByBase.get(unit.getId());
            if (shadows == null) {
                split.addUnit(unit);
                continue;
            }
            for (int k = 1; k <= shadows.size(); k++) {
                split.addUnit(shadowNode(unit, shadows.get(k - 1), k));
                result.shadow(shadows.get(k - 1), unit.getId());
            }
        }
        Set<Stream> added = new HashSet<>();
        for (Stream stream : graph.streams()) {
            Stream mapped = rewired.getOrDefault(stream, stream);
            if (stream.isRemoteSignal()) {
                mapped = rewireSignal(stream, shadowsByBase);
            }
            if (added.add(mapped)) {
                split.addStream(mapped);
            }
        }
        return result.graph(split).build();
    }

    private static boolean isSplitCandidate(FlowsheetGraph graph, String unitId) {
        List<Stream> in = materialStreams(graph.inStreams(unitId));
        if (in.size() <= 1) {
            return false;
        }
        if (UnitIds.isHeatExchanger(unitId)) {
            return true;
        }
        for (Stream stream : in) {
            if (stream.getTags().heatExchange().isPresent()) {
                return true;
            }
        }
        for (Stream stream : materialStreams(graph.outStreams(unitId))) {
            if (stream.getTags().heatExchange().isPresent()) {
                return true;
            }
        }
        return false;
    }

    private static Optional<SlotPlan> planSplit(FlowsheetGraph graph, String unitId, SplitResult.SplitResultBuilder result) {
        TreeMap<String, Stream> inBySlot = new TreeMap<>(HeatExchangeTag.SLOT_ORDER);
        TreeMap<String, Stream> outBySlot = new TreeMap<>(HeatExchangeTag.SLOT_ORDER);
        Stream selfLoop = null;

        for (Stream stream : materialStreams(graph.inStreams(unitId))) {
            if (stream.isSelfLoop()) {
                selfLoop = stream;
                continue;
            }
            if (!place(stream, HeatExchangeTag.Direction.IN, inBySlot, unitId, result)) {
                return Optional.empty();
            }
        }
        for (Stream stream : materialStreams(graph.outStreams(unitId))) {
            if (stream.isSelfLoop()) {
                continue;
            }
            if (!place(stream, HeatExchangeTag.Direction.OUT, outBySlot, unitId, result)) {
                return Optional.empty();
            }
        }

        if (selfLoop != null && !placeSelfLoop(selfLoop, inBySlot, outBySlot)) {
            warn(result, DegradedMergeWarning.REASON_SPLIT_SELF_LOOP_UNRESOLVED, unitId,
                    "self stream " + selfLoop.getTags() + " does not chain two adjacent slots");
            return Optional.empty();
        }

        Set<String> slots = new HashSet<>(inBySlot.keySet());
        slots.addAll(outBySlot.keySet());
        if (!inBySlot.keySet().equals(slots) || !outBySlot.keySet().equals(slots)) {
            warn(result, DegradedMergeWarning.REASON_SPLIT_SLOT_MISSING, unitId,
                    "unpaired slots, in=" + inBySlot.keySet() + " out=" + outBySlot.keySet());
            return Optional.empty();
        }
        return Optional.of(new SlotPlan(unitId, new ArrayList<>(inBySlot.keySet()), inBySlot, outBySlot));
    }

    private static boolean place(
            Stream stream,
            HeatExchangeTag.Direction direction,
            Map<String, Stream> bySlot,
            String unitId,
            SplitResult.SplitResultBuilder result
    ) {
        Optional<HeatExchangeTag> tag = stream.getTags().heatExchange();
        if (tag.isEmpty() || tag.get().direction() != direction) {
            warn(result, DegradedMergeWarning.REASON_SPLIT_SLOT_MISSING, unitId,
                    "stream " + stream + " has no " + direction.name().toLowerCase() + " slot tag");
            return false;
        }
        if (bySlot.putIfAbsent(tag.get().slot(), stream) != null) {
            warn(result, DegradedMergeWarning.REASON_SPLIT_SLOT_DUPLICATED, unitId,
                    "slot " + tag.get().notation() + " appears on more than one stream");
            return false;
        }
        return true;
    }

    /**
     * A self stream leaving slot {@code s} enters the slot after {@code s};
     * one entering slot {@code s} leaves the slot before it.
     */
    private static boolean placeSelfLoop(Stream selfLoop, TreeMap<String, Stream> inBySlot, TreeMap<String, Stream> outBySlot) {
        Optional<HeatExchangeTag> tag = selfLoop.getTags().heatExchange();
        if (tag.isEmpty()) {
            return false;
        }
        String slot = tag.get().slot();
        if (tag.get().direction() == HeatExchangeTag.Direction.OUT) {
            if (outBySlot.containsKey(slot)) {
                return false;
            }
            String next = nextSlot(slot, inBySlot, outBySlot, true);
            if (next == null || inBySlot.containsKey(next)) {
                return false;
            }
            outBySlot.put(slot, selfLoop);
            inBySlot.put(next, selfLoop);
        } else {
            if (inBySlot.containsKey(slot)) {
                return false;
            }
            String previous = nextSlot(slot, inBySlot, outBySlot, false);
            if (previous == null || outBySlot.containsKey(previous)) {
                return false;
            }
            inBySlot.put(slot, selfLoop);
            outBySlot.put(previous, selfLoop);
        }
        return true;
    }

    private static String nextSlot(String slot, TreeMap<String, Stream> inBySlot, TreeMap<String, Stream> outBySlot, boolean higher) {
        TreeMap<String, Stream> all = new TreeMap<>(HeatExchangeTag.SLOT_ORDER);
        all.putAll(inBySlot);
        all.putAll(outBySlot);
        return higher ? all.higherKey(slot) : all.lowerKey(slot);
    }

    private static Stream rewireSignal(Stream stream, Map<String, List<String>> shadowsByBase) {
        String source = stream.getSource();
        String target = stream.getTarget();
        if (shadowsByBase.containsKey(source)) {
            source = shadowsByBase.get(source).get(0);
        }
        if (shadowsByBase.containsKey(target)) {
            target = shadowsByBase.get(target).get(0);
        }
        return stream.reconnect(source, target);
    }

    private static UnitNode shadowNode(UnitNode base, String shadowId, int streamIndex) {
        UnitNode.UnitNodeBuilder builder = UnitNode.builder().id(shadowId).attributes(base.getAttributes());
        Map<String, String> perStream = base.getStreamAttributes().get(streamIndex);
        if (perStream != null) {
            builder.attributes(perStream);
        }
        return builder.build();
    }

    /**
     * Slot pairing of one split unit.
     */
    private static final class SlotPlan {
        final String unitId;
        final List<String> slots;
        final Map<String, Stream> inBySlot;
        final Map<String, Stream> outBySlot;

        SlotPlan(String unitId, List<String> slots, Map<String, Stream> inBySlot, Map<String, Stream> outBySlot) {
            this.unitId = unitId;
            this.slots = slots;
            this.inBySlot = inBySlot;
            this.outBySlot = outBySlot;
        }

        /**
         * Records the rewired stream of every paired stream and returns the
         * shadow ids in slot order.
         */
        List<String> apply(Map<Stream, Stream> rewired) {
            List<String> shadows = new ArrayList<>(slots.size());
            Map<String, String> shadowBySlot = new HashMap<>();
            for (int i = 0; i < slots.size(); i++) {
                String shadowId = UnitIds.shadow(unitId, i + 1);
                shadows.add(shadowId);
                shadowBySlot.put(slots.get(i), shadowId);
            }
            Map<Stream, String[]> endpoints = new LinkedHashMap<>();
            for (String slot : slots) {
                Stream in = inBySlot.get(slot);
                Stream out = outBySlot.get(slot);
                endpoints.computeIfAbsent(in, s -> new String[] {s.getSource(), s.getTarget()})[1] = shadowBySlot.get(slot);
                endpoints.computeIfAbsent(out, s -> new String[] {s.getSource(), s.getTarget()})[0] = shadowBySlot.get(slot);
            }
            for (Map.Entry<Stream, String[]> entry : endpoints.entrySet()) {
                rewired.put(entry.getKey(), entry.getKey().reconnect(entry.getValue()[0], entry.getValue()[1]));
            }
            return shadows;
        }
    }

    // ========================================================================
    // MERGE
    // ========================================================================

    /**
     * Folds shadow units {@code base/k} back into their physical unit.
     *
     * <p>The in-stream of {@code base/k} receives {@code k_in} and its
     * out-stream {@code k_out} unless the stream already carries a
     * heat-exchange tag. Attributes shared by all shadows become unit
     * attributes; diverging ones are kept per stream index.</p>
     *
     * @param graph input graph; not mutated.
     * @return merged graph and warnings for groups left unmerged.
     */
    public static MergeResult merge(FlowsheetGraph graph) {
        Objects.requireNonNull(graph, "graph");
        MergeResult.MergeResultBuilder result = MergeResult.builder();

        Map<String, TreeMap<Integer, String>> groups = new LinkedHashMap<>();
        for (UnitNode unit : graph.units()) {
            int k = UnitIds.shadowIndexOf(unit.getId()).orElse(-1);
            if (k > 0) {
                groups.computeIfAbsent(UnitIds.baseOf(unit.getId()), b -> new TreeMap<>()).put(k, unit.getId());
            }
        }

        FlowsheetGraph merged = graph.copy();
        for (Map.Entry<String, TreeMap<Integer, String>> group : groups.entrySet()) {
            mergeGroup(merged, group.getKey(), group.getValue(), result);
        }
        return result.graph(merged).build();
    }

    private static void mergeGroup(
            FlowsheetGraph graph,
            String baseId,
            TreeMap<Integer, String> shadows,
            MergeResult.MergeResultBuilder result
    ) {
        for (String shadowId : shadows.values()) {
            int in = materialStreams(graph.inStreams(shadowId)).size();
            int out = materialStreams(graph.outStreams(shadowId)).size();
            if (in != 1 || out != 1) {
                warn(result, DegradedMergeWarning.REASON_MERGE_SHADOW_DEGREE, baseId,
                        shadowId + " has " + in + " in-streams and " + out + " out-streams");
                return;
            }
        }

        Set<String> members = new HashSet<>(shadows.values());
        Map<String, Stream> mergedStreams = new LinkedHashMap<>();
        Set<Stream> touching = new LinkedHashSet<>();
        for (String shadowId : shadows.values()) {
            touching.addAll(graph.inStreams(shadowId));
            touching.addAll(graph.outStreams(shadowId));
        }
        for (Stream stream : touching) {
            Stream folded = fold(stream, baseId, members);
            String key = folded.getSource() + "\u0000" + folded.getTarget();
            if (graph.hasStream(folded.getSource(), folded.getTarget()) || mergedStreams.putIfAbsent(key, folded) != null) {
                warn(result, DegradedMergeWarning.REASON_MERGE_STREAM_CONFLICT, baseId,
                        "two streams fold onto " + folded.getSource() + " -> " + folded.getTarget());
                return;
            }
        }

        UnitNode mergedUnit = mergeAttributes(graph, baseId, shadows);
        for (String shadowId : shadows.values()) {
            graph.removeUnit(shadowId);
        }
        if (graph.containsUnit(baseId)) {
            graph.replaceUnit(mergedUnit);
        } else {
            graph.addUnit(mergedUnit);
        }
        for (Stream stream : mergedStreams.values()) {
            graph.addStream(stream);
        }
    }

    /**
     * Rewrites shadow endpoints to the base id and restores missing slot tags.
     */
    private static Stream fold(Stream stream, String baseId, Set<String> members) {
        boolean sourceIsShadow = members.contains(stream.getSource());
        boolean targetIsShadow = members.contains(stream.getTarget());
        String source = sourceIsShadow ? baseId : stream.getSource();
        String target = targetIsShadow ? baseId : stream.getTarget();
        StreamTags tags = stream.getTags();
        if (!stream.isRemoteSignal() && tags.heatExchange().isEmpty()) {
            if (sourceIsShadow) {
                int k = UnitIds.shadowIndexOf(stream.getSource()).getAsInt();
                tags = tags.withHeatExchange(HeatExchangeTag.numbered(k, HeatExchangeTag.Direction.OUT));
            } else {
                int k = UnitIds.shadowIndexOf(stream.getTarget()).getAsInt();
                tags = tags.withHeatExchange(HeatExchangeTag.numbered(k, HeatExchangeTag.Direction.IN));
            }
        }
        return new Stream(source, target, tags);
    }

    private static UnitNode mergeAttributes(FlowsheetGraph graph, String baseId, TreeMap<Integer, String> shadows) {
        Map<String, String> common = null;
        for (String shadowId : shadows.values()) {
            Map<String, String> attributes = graph.unit(shadowId).getAttributes();
            if (common == null) {
                common = new LinkedHashMap<>(attributes);
            } else {
                common.entrySet().removeIf(e -> !e.getValue().equals(attributes.get(e.getKey())));
            }
        }
        UnitNode.UnitNodeBuilder builder = graph.containsUnit(baseId)
                ? graph.unit(baseId).toBuilder()
                : UnitNode.builder().id(baseId);
        builder.attributes(common);
        for (Map.Entry<Integer, String> shadow : shadows.entrySet()) {
            Map<String, String> divergent = new LinkedHashMap<>(graph.unit(shadow.getValue()).getAttributes());
            divergent.keySet().removeAll(common.keySet());
            if (!divergent.isEmpty()) {
                builder.streamAttribute(shadow.getKey(), Map.copyOf(divergent));
            }
        }
        return builder.build();
    }

    // ========================================================================
    // SHARED
    // ========================================================================

    private static List<Stream> materialStreams(List<Stream> streams) {
        List<Stream> material = new ArrayList<>(streams.size());
        for (Stream stream : streams) {
            if (!stream.isRemoteSignal()) {
                material.add(stream);
            }
        }
        return material;
    }

    private static void warn(SplitResult.SplitResultBuilder result, String reasonCode, String unitId, String message) {
        DegradedMergeWarning warning = warning(reasonCode, unitId, message);
        log.warn("heat-integrated unit kept whole: {}", warning);
        result.warning(warning);
    }

    private static void warn(MergeResult.MergeResultBuilder result, String reasonCode, String unitId, String message) {
        DegradedMergeWarning warning = warning(reasonCode, unitId, message);
        log.warn("shadow group left unmerged: {}", warning);
        result.warning(warning);
    }

    private static DegradedMergeWarning warning(String reasonCode, String unitId, String message) {
        return DegradedMergeWarning.builder()
                .reasonCode(reasonCode)
                .unitId(unitId)
                .message(message)
                .build();
    }
}
