package org.sfiles.notation.decode;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.sfiles.notation.core.AmbiguousTagException;
import org.sfiles.notation.core.DecodeOptions;
import org.sfiles.notation.core.DecodeResult;
import org.sfiles.notation.core.EmptyInputException;
import org.sfiles.notation.core.StructuralException;
import org.sfiles.notation.graph.ColumnTag;
import org.sfiles.notation.graph.FlowsheetGraph;
import org.sfiles.notation.graph.SignalTag;
import org.sfiles.notation.graph.StreamTags;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class NotationDecoderTest {

    private static FlowsheetGraph decode(String notation) {
        return NotationDecoder.decode(NotationLexer.tokenize(notation), DecodeOptions.defaults()).getGraph();
    }

    @Test
    @DisplayName("Chain: consecutive units are connected")
    void testChain() {
        FlowsheetGraph graph = decode("(raw)(pump)(product)");

        assertEquals(List.of("raw-1", "pump-1", "product-1"), graph.unitIds());
        assertTrue(graph.hasStream("raw-1", "pump-1"));
        assertTrue(graph.hasStream("pump-1", "product-1"));
        assertEquals(2, graph.streamCount());
    }

    @Test
    @DisplayName("Branch: units after ']' continue from the branch origin")
    void testBranch() {
        FlowsheetGraph graph = decode("(feed)(dist)[{bout}(bottom)]{tout}(top)");

        assertEquals(ColumnTag.BOTTOM_OUT, graph.stream("dist-1", "bottom-1").getTags().column().orElseThrow());
        assertEquals(ColumnTag.TOP_OUT, graph.stream("dist-1", "top-1").getTags().column().orElseThrow());
        assertFalse(graph.hasStream("bottom-1", "top-1"));
    }

    @Test
    @DisplayName("Nested branches restore the right origin")
    void testNestedBranches() {
        FlowsheetGraph graph = decode("(a)[(b)[(c)](d)](e)");

        assertTrue(graph.hasStream("a-1", "b-1"));
        assertTrue(graph.hasStream("b-1", "c-1"));
        assertTrue(graph.hasStream("b-1", "d-1"));
        assertTrue(graph.hasStream("a-1", "e-1"));
        assertEquals(4, graph.streamCount());
    }

    @Test
    @DisplayName("Cycle markers pair in either order")
    void testCycles() {
        FlowsheetGraph forward = decode("(flash)<1(pump)1");
        assertTrue(forward.hasStream("pump-1", "flash-1"));

        FlowsheetGraph backward = decode("(pump)1n|(flash)<1");
        assertTrue(backward.hasStream("pump-1", "flash-1"));

        FlowsheetGraph selfLoop = decode("(tank)1<1");
        assertTrue(selfLoop.stream("tank-1", "tank-1").isSelfLoop());
    }

    @Test
    @DisplayName("Cycle numbers can be reused once closed")
    void testCycleNumberReuse() {
        FlowsheetGraph graph = decode("(a)<1(b)1(c)<1(d)1");

        assertTrue(graph.hasStream("b-1", "a-1"));
        assertTrue(graph.hasStream("d-1", "c-1"));
    }

    @Test
    @DisplayName("Tags before an outgoing marker belong to the cycle stream")
    void testTaggedCycle() {
        FlowsheetGraph graph = decode("(dist)<1(splt){tout}1");
        assertEquals(StreamTags.of("tout"), graph.stream("splt-1", "dist-1").getTags());
    }

    @Test
    @DisplayName("Incoming branch joins its anchor at the mixing point")
    void testIncomingBranch() {
        FlowsheetGraph graph = decode("(raw)(mix)<&|(raw)&|(product)");

        assertTrue(graph.hasStream("raw-1", "mix-1"));
        assertTrue(graph.hasStream("raw-2", "mix-1"));
        assertTrue(graph.hasStream("mix-1", "product-1"));
        assertEquals(3, graph.streamCount());
    }

    @Test
    @DisplayName("Mixing point refers to the innermost open incoming branch")
    void testNestedIncomingBranch() {
        FlowsheetGraph graph = decode("(a)(m)<&|(b)(n)<&|(c)&|&|(z)");

        assertTrue(graph.hasStream("c-1", "n-1"));
        assertTrue(graph.hasStream("n-1", "m-1"));
        assertTrue(graph.hasStream("b-1", "n-1"));
        assertTrue(graph.hasStream("m-1", "z-1"));
    }

    @Test
    @DisplayName("Signal markers yield remote signal streams; control streams drive the next unit")
    void testSignals() {
        FlowsheetGraph graph = decode("(feed)(C){FC}_1(tank)(valve)<_1(product)");

        assertTrue(graph.stream("C-1/FC", "valve-1").getTags().isSignal(SignalTag.NOT_NEXT_UNIT));
        assertTrue(graph.stream("C-1/FC", "tank-1").getTags().isSignal(SignalTag.NEXT_UNIT));
        assertTrue(graph.stream("feed-1", "C-1/FC").getTags().signal().isEmpty());
    }

    @Test
    @DisplayName("Signal and material marker numbers are independent")
    void testSignalNamespace() {
        FlowsheetGraph graph = decode("(C){LC}_1(a)<1(b)1<_1");

        assertTrue(graph.stream("C-1/LC", "b-1").getTags().isSignal(SignalTag.NOT_NEXT_UNIT));
        assertTrue(graph.hasStream("b-1", "a-1"));
        assertTrue(graph.stream("C-1/LC", "a-1").getTags().isSignal(SignalTag.NEXT_UNIT));
    }

    @Test
    @DisplayName("Shadow units are merged by default and kept on request")
    void testHeatIntegrationMerge() {
        String notation = "(raw)(hex){1}(dist)n|(raw)(hex){1}(product)";

        FlowsheetGraph merged = decode(notation);
        assertTrue(merged.containsUnit("hex-1"));
        assertEquals("2_in", merged.stream("raw-2", "hex-1").getTags().heatExchange().orElseThrow().notation());

        DecodeResult unmerged = NotationDecoder.decode(NotationLexer.tokenize(notation), DecodeOptions.unmerged());
        assertTrue(unmerged.getGraph().containsUnit("hex-1/1"));
        assertTrue(unmerged.getGraph().containsUnit("hex-1/2"));
        assertFalse(unmerged.getGraph().containsUnit("hex-1"));
        assertTrue(unmerged.getWarnings().isEmpty());
    }

    static Stream<Arguments> structuralErrors() {
        return Stream.of(
                Arguments.of("(a)[(b)", StructuralException.REASON_UNMATCHED_BRANCH_OPEN),
                Arguments.of("(a)<&|(b)[(c)|", StructuralException.REASON_UNMATCHED_BRANCH_OPEN),
                Arguments.of("(a)](b)", StructuralException.REASON_UNMATCHED_BRANCH_CLOSE),
                Arguments.of("(a)<&|(b)&](c)", StructuralException.REASON_UNMATCHED_BRANCH_CLOSE),
                Arguments.of("(a)1(b)", StructuralException.REASON_UNMATCHED_CYCLE),
                Arguments.of("(a)<1(b)<1", StructuralException.REASON_UNMATCHED_CYCLE),
                Arguments.of("(a)_1(b)<1", StructuralException.REASON_UNMATCHED_CYCLE),
                Arguments.of("(a)&(b)", StructuralException.REASON_ORPHAN_INCOMING_BRANCH),
                Arguments.of("(a)|(b)", StructuralException.REASON_ORPHAN_INCOMING_BRANCH),
                Arguments.of("(a)<&|(b)&", StructuralException.REASON_ORPHAN_INCOMING_BRANCH),
                Arguments.of("(a)[](b)", StructuralException.REASON_BRANCH_WITHOUT_UNIT),
                Arguments.of("(a)[1(b)]", StructuralException.REASON_BRANCH_WITHOUT_UNIT),
                Arguments.of("(a)(b){tout}", StructuralException.REASON_DANGLING_TAG),
                Arguments.of("{tout}(a)(b)", StructuralException.REASON_DANGLING_TAG),
                Arguments.of("(a){tout}n|(b)", StructuralException.REASON_DANGLING_TAG),
                Arguments.of("[(a)]", StructuralException.REASON_MISSING_PREDECESSOR),
                Arguments.of("1(a)", StructuralException.REASON_MISSING_PREDECESSOR),
                Arguments.of("(a)(b)1(c)<1", StructuralException.REASON_DUPLICATE_STREAM),
                Arguments.of("(a-1)(b-1)n|(a-1)", StructuralException.REASON_DUPLICATE_UNIT),
                Arguments.of("(a)[(b)n|(c)]", StructuralException.REASON_SEGMENT_BREAK_IN_BRANCH)
        );
    }

    @ParameterizedTest
    @MethodSource("structuralErrors")
    @DisplayName("Structural defects are reported with their reason code")
    void testStructuralErrors(String notation, String reasonCode) {
        StructuralException ex = assertThrows(StructuralException.class, () -> decode(notation));
        assertEquals(reasonCode, ex.reasonCode());
    }

    @Test
    @DisplayName("Two tags of one category on a stream are ambiguous")
    void testAmbiguousTags() {
        assertThrows(AmbiguousTagException.class, () -> decode("(a){tout}{bout}(b)"));
    }

    @Test
    @DisplayName("Empty token list is empty input")
    void testEmptyTokens() {
        assertThrows(EmptyInputException.class, () -> NotationDecoder.decode(List.of(), DecodeOptions.defaults()));
    }
}
