package org.sfiles.notation.decode;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.sfiles.notation.core.DecodeOptions;
import org.sfiles.notation.core.DecodeResult;
import org.sfiles.notation.core.EmptyInputException;
import org.sfiles.notation.core.StructuralException;
import org.sfiles.notation.graph.FlowsheetGraph;
import org.sfiles.notation.graph.SignalTag;
import org.sfiles.notation.graph.StreamTags;
import org.sfiles.notation.graph.UnitIds;
import org.sfiles.notation.heat.HeatIntegration;
import org.sfiles.notation.heat.MergeResult;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rebuilds a flowsheet graph from notation tokens.
 *
 * <p>Unit tokens are resolved to ids first ({@link NamingContext}); a single
 * left-to-right pass then creates the streams. Cycle and signal markers pair
 * by number in either order, and a number may be reused once its pair has
 * closed. Any structural defect aborts the call; no partial graph is ever
 * returned.</p>
 */
@Slf4j
@UtilityClass
public final class NotationDecoder {

    /**
     * Decodes lexed tokens.
     *
     * @param tokens tokens from {@link NotationLexer}.
     * @param options decode options.
     * @return decoded graph and merge warnings.
     * @throws EmptyInputException for an empty token list.
     * @throws StructuralException for unmatched or misplaced structure tokens.
     */
    public static DecodeResult decode(List<Token> tokens, DecodeOptions options) {
        Objects.requireNonNull(options, "options");
        if (tokens == null || tokens.isEmpty()) {
            throw new EmptyInputException("token list is empty");
        }
        List<String> unitIds = NamingContext.resolve(tokens);
        FlowsheetGraph graph = new StructureParser(tokens, unitIds).parse();
        log.debug("decoded {} tokens into {} units and {} streams",
                tokens.size(), graph.unitCount(), graph.streamCount());

        if (!options.isMergeHeatIntegration()) {
            return DecodeResult.builder().graph(graph).build();
        }
        MergeResult merged = HeatIntegration.merge(graph);
        return DecodeResult.builder()
                .graph(merged.getGraph())
                .warnings(merged.getWarnings())
                .build();
    }

    /**
     * Single-pass structural reader. One instance per decode call.
     */
    private static final class StructureParser {
        private final List<Token> tokens;
        private final List<String> unitIds;
        private final FlowsheetGraph graph = new FlowsheetGraph();
        private final Deque<Frame> frames = new ArrayDeque<>();
        private final Map<Integer, OpenMarker> cycles = new HashMap<>();
        private final Map<Integer, OpenMarker> signals = new HashMap<>();
        private final List<String> pendingTags = new ArrayList<>();

        private int unitCursor;
        private String current;
        private boolean expectUnit;
        private Token token;

        StructureParser(List<Token> tokens, List<String> unitIds) {
            this.tokens = tokens;
            this.unitIds = unitIds;
        }

        FlowsheetGraph parse() {
            for (Token next : tokens) {
                token = next;
                if (expectUnit && next.getType() != TokenType.UNIT && next.getType() != TokenType.TAG) {
                    throw structural(StructuralException.REASON_BRANCH_WITHOUT_UNIT, "branch must start with a unit");
                }
                switch (next.getType()) {
                    case UNIT:
                        unit(unitIds.get(unitCursor++));
                        break;
                    case ANNOTATION:
                        // consumed by NamingContext
                        break;
                    case TAG:
                        pendingTags.add(next.content());
                        break;
                    case BRANCH_OPEN:
                        requireCurrent();
                        frames.push(new Frame(false, current));
                        expectUnit = true;
                        break;
                    case BRANCH_CLOSE:
                        closeBranch();
                        break;
                    case CYCLE_OUT:
                    case SIGNAL_OUT:
                        outgoing(next);
                        break;
                    case CYCLE_IN:
                    case SIGNAL_IN:
                        incoming(next);
                        break;
                    case INCOMING_BRANCH_OPEN:
                        if (current == null) {
                            throw structural(StructuralException.REASON_ORPHAN_INCOMING_BRANCH,
                                    "incoming branch has no unit to join");
                        }
                        requireNoPendingTags();
                        frames.push(new Frame(true, current));
                        current = null;
                        break;
                    case MIXING_POINT:
                        mixingPoint();
                        break;
                    case MIXING_POINT_CLOSE:
                        mixingPoint();
                        closeIncomingBranch();
                        break;
                    case INCOMING_BRANCH_CLOSE:
                        closeIncomingBranch();
                        break;
                    case SEGMENT_BREAK:
                        if (!frames.isEmpty()) {
                            throw structural(StructuralException.REASON_SEGMENT_BREAK_IN_BRANCH,
                                    "segment break inside an open branch");
                        }
                        requireNoPendingTags();
                        current = null;
                        break;
                    default:
                        throw new IllegalStateException("unhandled token type " + next.getType());
                }
            }
            finish();
            return graph;
        }

        private void unit(String unitId) {
            graph.addUnit(unitId);
            if (current != null) {
                emit(current, unitId, takeTags(), false);
            } else {
                requireNoPendingTags();
            }
            current = unitId;
            expectUnit = false;
        }

        private void closeBranch() {
            Frame frame = frames.peek();
            if (frame == null || frame.incoming) {
                throw structural(StructuralException.REASON_UNMATCHED_BRANCH_CLOSE, "']' without matching '['");
            }
            requireNoPendingTags();
            frames.pop();
            current = frame.unitId;
        }

        private void closeIncomingBranch() {
            Frame frame = frames.peek();
            if (frame == null) {
                throw structural(StructuralException.REASON_ORPHAN_INCOMING_BRANCH, "'|' without matching '<&|'");
            }
            if (!frame.incoming) {
                throw structural(StructuralException.REASON_UNMATCHED_BRANCH_OPEN, "'[' not closed before '|'");
            }
            requireNoPendingTags();
            frames.pop();
            current = frame.unitId;
        }

        /**
         * Stream from the current unit to the unit the innermost open
         * incoming branch joins.
         */
        private void mixingPoint() {
            requireCurrent();
            for (Frame frame : frames) {
                if (frame.incoming) {
                    emit(current, frame.unitId, takeTags(), false);
                    return;
                }
            }
            throw structural(StructuralException.REASON_ORPHAN_INCOMING_BRANCH, "'&' outside an incoming branch");
        }

        private void outgoing(Token marker) {
            requireCurrent();
            boolean signal = marker.getType() == TokenType.SIGNAL_OUT;
            Map<Integer, OpenMarker> table = signal ? signals : cycles;
            int number = marker.number();
            OpenMarker open = table.get(number);
            if (open == null) {
                table.put(number, new OpenMarker(false, current, takeTags()));
            } else if (open.incoming) {
                table.remove(number);
                emit(current, open.unitId, takeTags(), signal);
            } else {
                throw structural(StructuralException.REASON_UNMATCHED_CYCLE,
                        "outgoing marker " + marker.getText() + " opened twice");
            }
        }

        private void incoming(Token marker) {
            requireCurrent();
            boolean signal = marker.getType() == TokenType.SIGNAL_IN;
            Map<Integer, OpenMarker> table = signal ? signals : cycles;
            int number = marker.number();
            OpenMarker open = table.get(number);
            if (open == null) {
                table.put(number, new OpenMarker(true, current, List.of()));
            } else if (!open.incoming) {
                table.remove(number);
                emit(open.unitId, current, open.tags, signal);
            } else {
                throw structural(StructuralException.REASON_UNMATCHED_CYCLE,
                        "incoming marker " + marker.getText() + " opened twice");
            }
        }

        private void finish() {
            token = null;
            if (expectUnit) {
                throw structural(StructuralException.REASON_BRANCH_WITHOUT_UNIT, "branch must start with a unit");
            }
            Frame frame = frames.peek();
            if (frame != null) {
                if (frame.incoming) {
                    throw structural(StructuralException.REASON_ORPHAN_INCOMING_BRANCH, "'<&|' never closed");
                }
                throw structural(StructuralException.REASON_UNMATCHED_BRANCH_OPEN, "'[' never closed");
            }
            requireNoPendingTags();
            if (!cycles.isEmpty() || !signals.isEmpty()) {
                List<Integer> open = new ArrayList<>(cycles.keySet());
                open.addAll(signals.keySet());
                throw structural(StructuralException.REASON_UNMATCHED_CYCLE, "unmatched markers " + open);
            }
        }

        private void emit(String source, String target, List<String> rawTags, boolean signalMarker) {
            StreamTags tags = StreamTags.parse(rawTags);
            if (signalMarker) {
                tags = tags.withSignal(SignalTag.NOT_NEXT_UNIT);
            } else if (UnitIds.isControlUnit(source) && tags.signal().isEmpty()) {
                tags = tags.withSignal(SignalTag.NEXT_UNIT);
            }
            if (graph.hasStream(source, target)) {
                throw structural(StructuralException.REASON_DUPLICATE_STREAM,
                        "stream " + source + " -> " + target + " written twice");
            }
            graph.addStream(source, target, tags);
        }

        private List<String> takeTags() {
            List<String> taken = List.copyOf(pendingTags);
            pendingTags.clear();
            return taken;
        }

        private void requireCurrent() {
            if (current == null) {
                throw structural(StructuralException.REASON_MISSING_PREDECESSOR,
                        "'" + token.getText() + "' has no preceding unit");
            }
        }

        private void requireNoPendingTags() {
            if (!pendingTags.isEmpty()) {
                throw structural(StructuralException.REASON_DANGLING_TAG,
                        "tags " + pendingTags + " do not belong to any stream");
            }
        }

        private StructuralException structural(String reasonCode, String message) {
            String where = token == null ? " at end of input" : " at offset " + token.getOffset();
            return new StructuralException(reasonCode, message + where);
        }
    }

    /**
     * Open bracket or incoming branch and the unit it hangs off.
     */
    private static final class Frame {
        final boolean incoming;
        final String unitId;

        Frame(boolean incoming, String unitId) {
            this.incoming = incoming;
            this.unitId = unitId;
        }
    }

    /**
     * First half of a marker pair.
     */
    private static final class OpenMarker {
        final boolean incoming;
        final String unitId;
        final List<String> tags;

        OpenMarker(boolean incoming, String unitId, List<String> tags) {
            this.incoming = incoming;
            this.unitId = unitId;
            this.tags = tags;
        }
    }
}
