package org.sfiles.notation.rank;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.sfiles.Utils.VisitedSet;
import org.sfiles.core.id.UnitIndex;
import org.sfiles.notation.graph.FlowsheetGraph;
import org.sfiles.notation.graph.Stream;
import org.sfiles.notation.graph.UnitIds;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SplittableRandom;
import java.util.TreeMap;

/**
 * Deterministic canonical ranking of flowsheet units.
 *
 * <p>Ranks only order branching decisions during encoding. Isomorphic graphs
 * receive the same ranks up to instance numbering, independent of the order in
 * which units and streams were added.</p>
 *
 * <p>Per weakly-connected component an extended-connectivity refinement over
 * the undirected adjacency yields base classes. Ties inside a class are broken
 * by role, reachable-set size, generalized reachable signature and unit label,
 * then by the typed stream neighbourhoods of an {@link OrderedPartition}. Only
 * units that stay interchangeable are ordered by instance number.</p>
 *
 * <p>Components are ordered largest first, then by their generalized
 * signature and their isomorphism certificate.</p>
 */
@Slf4j
@UtilityClass
public final class CanonicalRanker {

    /**
     * Ranks all units of a graph with the default configuration.
     */
    public static Object2IntMap<String> rank(FlowsheetGraph graph) {
        return rank(graph, RankingConfig.defaults());
    }

    /**
     * Ranks all units of a graph.
     *
     * @param graph graph to rank; not mutated.
     * @param config refinement configuration.
     * @return unit id to rank, ranks {@code 1..N} without gaps.
     */
    public static Object2IntMap<String> rank(FlowsheetGraph graph, RankingConfig config) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(config, "config");
        validateConfig(config);

        UnitIndex index = UnitIndex.of(graph.unitIds());
        int unitCount = index.size();
        int[][] undirected = buildUndirectedAdjacency(graph, index);
        int[][] forward = buildForwardAdjacency(graph, index);
        boolean[] hasPredecessor = new boolean[unitCount];
        for (Stream stream : graph.streams()) {
            hasPredecessor[index.indexOf(stream.getTarget())] = true;
        }

        OrderedPartition partition = OrderedPartition.of(graph, index);
        List<ComponentKey> keys = new ArrayList<>();
        for (int[] members : components(undirected, unitCount)) {
            BigInteger[] refined = refine(members, undirected, unitCount, config);
            int[] order = partition.order(initialCells(members, refined, index, forward, hasPredecessor));
            keys.add(ComponentKey.of(order, partition.certificate(order), graph, index));
        }
        keys.sort(ComponentKey.ORDER);

        Object2IntOpenHashMap<String> ranks = new Object2IntOpenHashMap<>(unitCount);
        ranks.defaultReturnValue(-1);
        int offset = 0;
        for (ComponentKey key : keys) {
            for (int unit : key.order) {
                ranks.put(index.unitAt(unit), ++offset);
            }
        }
        return ranks;
    }

    /**
     * Seeded random total order over all units, used for non-canonical
     * (augmentation) encodings.
     *
     * @param graph graph to rank; not mutated.
     * @param seed shuffle seed.
     * @return unit id to rank, ranks {@code 1..N}.
     */
    public static Object2IntMap<String> shuffled(FlowsheetGraph graph, long seed) {
        Objects.requireNonNull(graph, "graph");
        List<String> ids = new ArrayList<>(graph.unitIds());
        Collections.sort(ids);
        int[] order = new int[ids.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        shuffle(order, seed);

        Object2IntOpenHashMap<String> ranks = new Object2IntOpenHashMap<>(ids.size());
        ranks.defaultReturnValue(-1);
        for (int i = 0; i < order.length; i++) {
            ranks.put(ids.get(order[i]), i + 1);
        }
        return ranks;
    }

    /**
     * Units of one component grouped by every numbering-independent key,
     * in rank order: refined class, then the tie-break keys.
     */
    private static List<int[]> initialCells(
            int[] members,
            BigInteger[] refined,
            UnitIndex index,
            int[][] forward,
            boolean[] hasPredecessor
    ) {
        TreeMap<BigInteger, List<TieCandidate>> classes = new TreeMap<>();
        for (int member : members) {
            classes.computeIfAbsent(refined[member], v -> new ArrayList<>())
                    .add(TieCandidate.of(member, index, forward, hasPredecessor));
        }
        List<int[]> cells = new ArrayList<>();
        for (List<TieCandidate> tied : classes.values()) {
            tied.sort(TieCandidate.ORDER);
            IntArrayList cell = new IntArrayList();
            TieCandidate previous = null;
            for (TieCandidate candidate : tied) {
                if (previous != null && TieCandidate.ORDER.compare(previous, candidate) != 0) {
                    cells.add(cell.toIntArray());
                    cell = new IntArrayList();
                }
                cell.add(candidate.unit);
                previous = candidate;
            }
            cells.add(cell.toIntArray());
        }
        return cells;
    }

    private static void validateConfig(RankingConfig config) {
        if (config.getStableIterations() <= 0) {
            throw new IllegalArgumentException("stableIterations must be > 0");
        }
        if (config.getMaxIterations() <= 0) {
            throw new IllegalArgumentException("maxIterations must be > 0");
        }
    }

    /**
     * In-place deterministic Fisher-Yates shuffle.
     */
    private static void shuffle(int[] array, long seed) {
        SplittableRandom random = new SplittableRandom(seed);
        for (int i = array.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = array[i];
            array[i] = array[j];
            array[j] = tmp;
        }
    }

    /**
     * Undirected 0/1 adjacency as neighbor lists. A self-loop counts once.
     */
    private static int[][] buildUndirectedAdjacency(FlowsheetGraph graph, UnitIndex index) {
        int unitCount = index.size();
        IntSet[] neighbors = new IntSet[unitCount];
        for (int i = 0; i < unitCount; i++) {
            neighbors[i] = new IntOpenHashSet();
        }
        for (Stream stream : graph.streams()) {
            int source = index.indexOf(stream.getSource());
            int target = index.indexOf(stream.getTarget());
            neighbors[source].add(target);
            neighbors[target].add(source);
        }
        int[][] adjacency = new int[unitCount][];
        for (int i = 0; i < unitCount; i++) {
            adjacency[i] = neighbors[i].toIntArray();
        }
        return adjacency;
    }

    private static int[][] buildForwardAdjacency(FlowsheetGraph graph, UnitIndex index) {
        int unitCount = index.size();
        int[][] adjacency = new int[unitCount][];
        for (int i = 0; i < unitCount; i++) {
            List<String> successors = graph.successors(index.unitAt(i));
            int[] row = new int[successors.size()];
            for (int j = 0; j < row.length; j++) {
                row[j] = index.indexOf(successors.get(j));
            }
            adjacency[i] = row;
        }
        return adjacency;
    }

    private static List<int[]> components(int[][] undirected, int unitCount) {
        VisitedSet visited = new VisitedSet(unitCount);
        List<int[]> components = new ArrayList<>();
        int start;
        while ((start = visited.firstUnvisited(unitCount)) >= 0) {
            IntArrayList members = new IntArrayList();
            IntArrayList stack = new IntArrayList();
            stack.add(start);
            visited.markVisited(start);
            while (!stack.isEmpty()) {
                int unit = stack.popInt();
                members.add(unit);
                for (int neighbor : undirected[unit]) {
                    if (visited.markVisited(neighbor)) {
                        stack.add(neighbor);
                    }
                }
            }
            int[] sorted = members.toIntArray();
            Arrays.sort(sorted);
            components.add(sorted);
        }
        return components;
    }

    /**
     * Extended-connectivity refinement restricted to one component. Returns the
     * most discriminating vector seen (first one reaching the largest number
     * of distinct values).
     */
    private static BigInteger[] refine(int[] members, int[][] undirected, int unitCount, RankingConfig config) {
        BigInteger[] current = new BigInteger[unitCount];
        for (int member : members) {
            current[member] = BigInteger.valueOf(undirected[member].length);
        }
        BigInteger[] best = current;
        int bestDistinct = distinct(current, members);
        int stable = 0;
        int iterations = 0;
        while (stable < config.getStableIterations()) {
            if (iterations >= config.getMaxIterations()) {
                log.debug("connectivity refinement hit iteration cap {} for component of {} units",
                        config.getMaxIterations(), members.length);
                break;
            }
            iterations++;
            BigInteger[] next = new BigInteger[unitCount];
            for (int member : members) {
                BigInteger sum = BigInteger.ZERO;
                for (int neighbor : undirected[member]) {
                    sum = sum.add(current[neighbor]);
                }
                next[member] = sum;
            }
            int nextDistinct = distinct(next, members);
            if (nextDistinct > bestDistinct) {
                best = next;
                bestDistinct = nextDistinct;
                stable = 0;
            } else {
                stable++;
            }
            current = next;
        }
        return best;
    }

    private static int distinct(BigInteger[] values, int[] members) {
        Set<BigInteger> seen = new HashSet<>();
        for (int member : members) {
            seen.add(values[member]);
        }
        return seen.size();
    }

    private static String typeEdge(Stream stream) {
        return UnitIds.generalize(stream.getSource()) + ">" + UnitIds.generalize(stream.getTarget());
    }

    /**
     * Component in rank order with its ordering key.
     */
    private static final class ComponentKey {
        static final Comparator<ComponentKey> ORDER = Comparator
                .comparingInt((ComponentKey k) -> -k.order.length)
                .thenComparing(k -> k.signature)
                .thenComparing(k -> k.certificate)
                .thenComparing(k -> k.smallestId);

        final int[] order;
        final String signature;
        final String certificate;
        final String smallestId;

        private ComponentKey(int[] order, String signature, String certificate, String smallestId) {
            this.order = order;
            this.signature = signature;
            this.certificate = certificate;
            this.smallestId = smallestId;
        }

        static ComponentKey of(int[] order, String certificate, FlowsheetGraph graph, UnitIndex index) {
            List<String> types = new ArrayList<>();
            List<String> edges = new ArrayList<>();
            String smallest = null;
            for (int member : order) {
                String unitId = index.unitAt(member);
                types.add(UnitIds.generalize(unitId));
                if (smallest == null || unitId.compareTo(smallest) < 0) {
                    smallest = unitId;
                }
                for (Stream stream : graph.outStreams(unitId)) {
                    edges.add(typeEdge(stream));
                }
            }
            Collections.sort(types);
            Collections.sort(edges);
            return new ComponentKey(order, String.join(",", types) + "|" + String.join(",", edges), certificate, smallest);
        }
    }

    /**
     * Tie-break key of one unit inside a refined class.
     */
    private static final class TieCandidate {
        static final Comparator<TieCandidate> ORDER = Comparator
                .comparing((TieCandidate c) -> c.role)
                .thenComparingInt(TieCandidate::reachableKey)
                .thenComparing(c -> c.signature)
                .thenComparing(c -> c.label);

        final int unit;
        final NodeRole role;
        final int reachable;
        final String signature;
        final String label;

        private TieCandidate(int unit, NodeRole role, int reachable, String signature, String label) {
            this.unit = unit;
            this.role = role;
            this.reachable = reachable;
            this.signature = signature;
            this.label = label;
        }

        static TieCandidate of(int unit, UnitIndex index, int[][] forward, boolean[] hasPredecessor) {
            String unitId = index.unitAt(unit);
            NodeRole role;
            if (UnitIds.isControlUnit(unitId)) {
                role = NodeRole.SIGNAL;
            } else if (forward[unit].length == 0) {
                role = NodeRole.OUTPUT;
            } else if (!hasPredecessor[unit]) {
                role = NodeRole.INPUT;
            } else {
                role = NodeRole.OTHER;
            }

            // forward-reachable set including the unit itself
            VisitedSet reached = new VisitedSet(index.size());
            IntArrayList stack = new IntArrayList();
            stack.add(unit);
            reached.markVisited(unit);
            List<String> edges = new ArrayList<>();
            while (!stack.isEmpty()) {
                int current = stack.popInt();
                for (int next : forward[current]) {
                    edges.add(UnitIds.generalize(index.unitAt(current)) + ">" + UnitIds.generalize(index.unitAt(next)));
                    if (reached.markVisited(next)) {
                        stack.add(next);
                    }
                }
            }
            Collections.sort(edges);
            String signature = UnitIds.generalize(unitId) + "|" + String.join(",", edges);
            return new TieCandidate(unit, role, reached.count(), signature, OrderedPartition.label(unitId));
        }

        /**
         * Larger reachable sets first for terminal roles, smaller first otherwise.
         */
        int reachableKey() {
            return role == NodeRole.OUTPUT || role == NodeRole.INPUT ? -reachable : reachable;
        }
    }
}
