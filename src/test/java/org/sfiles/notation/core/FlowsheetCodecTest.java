package org.sfiles.notation.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.sfiles.notation.graph.FlowsheetGraph;
import org.sfiles.notation.testutil.FlowsheetFixtures;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FlowsheetCodecTest {

    private static final String[] RANDOM_TYPES = {"pump", "tank", "mix", "dist"};

    private final FlowsheetCodec codec = new FlowsheetCodec();

    static Stream<Arguments> fixtures() {
        return Stream.of(
                Arguments.of("chain", FlowsheetFixtures.chain()),
                Arguments.of("recycle", FlowsheetFixtures.recycle()),
                Arguments.of("splitter", FlowsheetFixtures.splitter()),
                Arguments.of("mixer", FlowsheetFixtures.mixer()),
                Arguments.of("column", FlowsheetFixtures.column()),
                Arguments.of("disjoint", FlowsheetFixtures.disjoint()),
                Arguments.of("heatExchanger", FlowsheetFixtures.heatExchanger()),
                Arguments.of("flowControl", FlowsheetFixtures.flowControl()),
                Arguments.of("reactorLoop", FlowsheetFixtures.reactorLoop())
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("fixtures")
    @DisplayName("Round-trip: decoding the notation restores the flowsheet")
    void testRoundTrip(String name, FlowsheetGraph graph) {
        EncodeResult encoded = codec.encode(graph);

        assertEquals(graph, codec.decode(encoded.getNotation()).getGraph());
        assertEquals(graph, codec.decode(encoded.getGeneralizedNotation()).getGraph());
        assertEquals(graph, codec.decode(encoded.getTokens()).getGraph());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("fixtures")
    @DisplayName("Idempotence: re-encoding a decoded notation reproduces it")
    void testIdempotence(String name, FlowsheetGraph graph) {
        String generalized = codec.encode(graph).getGeneralizedNotation();

        FlowsheetGraph decoded = codec.decode(generalized).getGraph();
        assertEquals(generalized, codec.encode(decoded).getGeneralizedNotation());
        assertEquals(generalized, codec.canonicalize(generalized));
        assertEquals(codec.canonicalize(generalized), codec.canonicalize(codec.canonicalize(generalized)));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("fixtures")
    @DisplayName("Determinism: construction order does not matter")
    void testConstructionOrder(String name, FlowsheetGraph graph) {
        FlowsheetGraph reversed = new FlowsheetGraph();
        List<String> unitIds = graph.unitIds();
        for (int i = unitIds.size() - 1; i >= 0; i--) {
            reversed.addUnit(graph.unit(unitIds.get(i)));
        }
        List<org.sfiles.notation.graph.Stream> streams = graph.streams();
        for (int i = streams.size() - 1; i >= 0; i--) {
            reversed.addStream(streams.get(i));
        }

        assertEquals(codec.encode(graph).getNotation(), codec.encode(reversed).getNotation());
    }

    @Test
    @DisplayName("Renumbering: instance numbers do not change the generalized form")
    void testRenumbering() {
        FlowsheetGraph renumbered = new FlowsheetGraph()
                .addUnit("raw-5")
                .addUnit("raw-9")
                .addUnit("mix-3")
                .addUnit("product-8")
                .addStream("raw-5", "mix-3")
                .addStream("raw-9", "mix-3")
                .addStream("mix-3", "product-8");

        assertEquals(
                codec.encode(FlowsheetFixtures.mixer()).getGeneralizedNotation(),
                codec.encode(renumbered).getGeneralizedNotation()
        );
    }

    @Test
    @DisplayName("Renumbering: units with the same type but different neighbours")
    void testRenumberingCrossFed() {
        FlowsheetGraph first = crossFed("dist-2", "dist-1", "dist-3");
        FlowsheetGraph second = crossFed("dist-1", "dist-2", "dist-3");

        String expected = codec.encode(first).getGeneralizedNotation();
        assertEquals(expected, codec.encode(second).getGeneralizedNotation());
        assertEquals(expected, codec.canonicalize(expected));
    }

    @Test
    @DisplayName("Renumbering: random flowsheets keep one generalized form")
    void testRenumberingRandomFlowsheets() {
        SplittableRandom random = new SplittableRandom(20240611L);
        for (int round = 0; round < 150; round++) {
            int unitCount = 3 + random.nextInt(6);
            String[] types = new String[unitCount];
            for (int i = 0; i < unitCount; i++) {
                types[i] = RANDOM_TYPES[random.nextInt(RANDOM_TYPES.length)];
            }
            List<int[]> streams = randomStreams(unitCount, random);

            FlowsheetGraph graph = numbered(types, streams, identityNumbering(types), false);
            FlowsheetGraph renumbered = numbered(types, streams, shuffledNumbering(types, random), true);

            String expected = codec.encode(graph).getGeneralizedNotation();
            assertEquals(expected, codec.encode(renumbered).getGeneralizedNotation(), "round " + round);
            assertEquals(expected, codec.canonicalize(expected), "round " + round);
        }
    }

    @Test
    @DisplayName("Canonicalize: different spellings of one flowsheet converge")
    void testCanonicalize() {
        assertEquals("(tank)[(pump)](valve)", codec.canonicalize("(tank)[(valve)](pump)"));
        assertEquals("(raw)(mix)<&|(raw)&|(product)", codec.canonicalize("(raw)(mix)<1(product)n|(raw)1"));
    }

    @Test
    @DisplayName("Heat integration: V2 notation keeps slot pairing")
    void testHeatIntegrationFidelity() {
        FlowsheetGraph graph = FlowsheetFixtures.heatExchanger();
        DecodeResult decoded = codec.decode(codec.encode(graph).getNotation());

        assertEquals(graph, decoded.getGraph());
        assertTrue(decoded.getWarnings().isEmpty());
        assertEquals("1_out", decoded.getGraph().stream("hex-1", "dist-1")
                .getTags().heatExchange().orElseThrow().notation());
    }

    @Test
    @DisplayName("Augment: variants are distinct, non-canonical spellings of the same flowsheet")
    void testAugment() {
        String canonical = codec.canonicalize(codec.encode(FlowsheetFixtures.reactorLoop()).getNotation());

        List<String> variants = codec.augment(canonical, 5, 7L);

        assertFalse(variants.isEmpty());
        assertTrue(variants.size() <= 5);
        assertEquals(variants.size(), new HashSet<>(variants).size());
        for (String variant : variants) {
            assertNotEquals(canonical, variant);
            assertEquals(canonical, codec.canonicalize(variant));
        }
        assertEquals(variants, codec.augment(canonical, 5, 7L));
    }

    @Test
    @DisplayName("Augment: a flowsheet with one spelling has no variants")
    void testAugmentSingleSpelling() {
        assertTrue(codec.augment("(raw)(pump)(product)", 3, 0L).isEmpty());
        assertTrue(codec.augment("(raw)(pump)(product)", 0, 0L).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> codec.augment("(raw)", -1, 0L));
    }

    @Test
    @DisplayName("Strip control: control units are bypassed")
    void testStripControl() {
        String controlled = codec.encode(FlowsheetFixtures.flowControl()).getGeneralizedNotation();

        assertEquals("(feed)(tank)(valve)(product)", codec.stripControl(controlled));
        assertEquals("(raw)(pump)(product)", codec.stripControl("(raw)(pump)(product)"));
    }

    @Test
    @DisplayName("Strip control: stream tags of the measured stream are kept")
    void testStripControlKeepsTags() {
        String stripped = codec.stripControl("(feed)(dist){tout}(C){TC}(top)");
        assertEquals("(feed)(dist){tout}(top)", stripped);
    }

    @Test
    @DisplayName("Strip control: nothing left to encode")
    void testStripControlOnlyControl() {
        assertThrows(EmptyInputException.class, () -> codec.stripControl("(C){FC}"));
    }

    @Test
    @DisplayName("Malformed input fails with a reason-coded exception")
    void testFailures() {
        FlowsheetCodecException grammar = assertThrows(FlowsheetCodecException.class, () -> codec.decode("(a)?"));
        assertEquals(GrammarException.REASON_UNKNOWN_TOKEN, grammar.reasonCode());

        FlowsheetCodecException structural = assertThrows(FlowsheetCodecException.class, () -> codec.decode("(a)["));
        assertEquals(StructuralException.REASON_BRANCH_WITHOUT_UNIT, structural.reasonCode());

        assertThrows(EmptyInputException.class, () -> codec.decode(""));
        assertThrows(EmptyInputException.class, () -> codec.encode(new FlowsheetGraph()));
        assertThrows(NullPointerException.class, () -> codec.decode("(a)", null));
    }

    private static FlowsheetGraph crossFed(String fedByRaw, String fedBySplitter, String feedingBoth) {
        return new FlowsheetGraph()
                .addUnit("r-1")
                .addUnit("splt-1")
                .addUnit(fedByRaw)
                .addUnit(fedBySplitter)
                .addUnit(feedingBoth)
                .addStream("r-1", fedByRaw)
                .addStream("splt-1", fedBySplitter)
                .addStream(feedingBoth, fedBySplitter)
                .addStream(feedingBoth, fedByRaw);
    }

    /**
     * Connected stream list without self streams or opposite pairs: a random
     * tree plus extra streams with probability 1/5 per unit pair.
     */
    private static List<int[]> randomStreams(int unitCount, SplittableRandom random) {
        boolean[][] linked = new boolean[unitCount][unitCount];
        List<int[]> streams = new ArrayList<>();
        for (int i = 1; i < unitCount; i++) {
            int j = random.nextInt(i);
            streams.add(random.nextBoolean() ? new int[] {i, j} : new int[] {j, i});
            linked[i][j] = true;
            linked[j][i] = true;
        }
        for (int i = 0; i < unitCount; i++) {
            for (int j = i + 1; j < unitCount; j++) {
                if (!linked[i][j] && random.nextInt(5) == 0) {
                    streams.add(random.nextBoolean() ? new int[] {i, j} : new int[] {j, i});
                    linked[i][j] = true;
                    linked[j][i] = true;
                }
            }
        }
        return streams;
    }

    private static int[] identityNumbering(String[] types) {
        Map<String, Integer> counters = new HashMap<>();
        int[] instances = new int[types.length];
        for (int i = 0; i < types.length; i++) {
            instances[i] = counters.merge(types[i], 1, Integer::sum);
        }
        return instances;
    }

    // permutes the instance numbers within each type
    private static int[] shuffledNumbering(String[] types, SplittableRandom random) {
        int[] identity = identityNumbering(types);
        Map<String, List<Integer>> byType = new HashMap<>();
        for (int i = 0; i < types.length; i++) {
            byType.computeIfAbsent(types[i], t -> new ArrayList<>()).add(identity[i]);
        }
        for (List<Integer> numbers : byType.values()) {
            for (int i = numbers.size() - 1; i > 0; i--) {
                Collections.swap(numbers, i, random.nextInt(i + 1));
            }
        }
        int[] instances = new int[types.length];
        for (int i = 0; i < types.length; i++) {
            instances[i] = byType.get(types[i]).get(identity[i] - 1);
        }
        return instances;
    }

    private static FlowsheetGraph numbered(String[] types, List<int[]> streams, int[] instances, boolean reversed) {
        String[] ids = new String[types.length];
        for (int i = 0; i < types.length; i++) {
            ids[i] = types[i] + "-" + instances[i];
        }
        FlowsheetGraph graph = new FlowsheetGraph();
        for (int i = 0; i < ids.length; i++) {
            graph.addUnit(ids[reversed ? ids.length - 1 - i : i]);
        }
        for (int i = 0; i < streams.size(); i++) {
            int[] stream = streams.get(reversed ? streams.size() - 1 - i : i);
            graph.addStream(ids[stream[0]], ids[stream[1]]);
        }
        return graph;
    }
}
