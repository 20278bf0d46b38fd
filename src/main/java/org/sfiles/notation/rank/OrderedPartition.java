package org.sfiles.notation.rank;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.sfiles.core.id.UnitIndex;
import org.sfiles.notation.graph.FlowsheetGraph;
import org.sfiles.notation.graph.Stream;
import org.sfiles.notation.graph.UnitIds;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Ordered partition of one component, refined by typed stream neighbourhoods
 * until every cell holds a single unit.
 *
 * <p>A split cell is replaced in place by its parts, ordered by their
 * neighbourhood text, so the order fixed by the initial cells survives. When
 * refinement stalls, each unit of the first tied cell is taken out in turn and
 * refinement resumes; the leaf with the smallest {@link #certificate(int[])}
 * wins. Two leaves with equal certificates differ by an automorphism, which
 * prunes the remaining branches it maps onto explored ones. Branches are
 * visited lowest instance number first, so among equal leaves the numbering
 * only decides which of two symmetric units ranks first.</p>
 */
final class OrderedPartition {
    private final UnitIndex index;
    private final int[][] targets;
    private final String[][] outTags;
    private final int[][] sources;
    private final String[][] inTags;
    private final int[][] siblings;
    private final int[] cellOf;

    private List<int[]> cells;
    private int[] best;
    private String bestCertificate;
    private List<int[]> automorphisms;

    private OrderedPartition(
            UnitIndex index,
            int[][] targets,
            String[][] outTags,
            int[][] sources,
            String[][] inTags,
            int[][] siblings
    ) {
        this.index = index;
        this.targets = targets;
        this.outTags = outTags;
        this.sources = sources;
        this.inTags = inTags;
        this.siblings = siblings;
        this.cellOf = new int[index.size()];
    }

    /**
     * Builds the stream tables of a graph once; {@link #order(List)} runs per
     * component.
     */
    static OrderedPartition of(FlowsheetGraph graph, UnitIndex index) {
        int unitCount = index.size();
        int[][] targets = new int[unitCount][];
        String[][] outTags = new String[unitCount][];
        int[][] sources = new int[unitCount][];
        String[][] inTags = new String[unitCount][];
        for (int unit = 0; unit < unitCount; unit++) {
            String unitId = index.unitAt(unit);
            List<Stream> out = graph.outStreams(unitId);
            targets[unit] = new int[out.size()];
            outTags[unit] = new String[out.size()];
            for (int i = 0; i < out.size(); i++) {
                targets[unit][i] = index.indexOf(out.get(i).getTarget());
                outTags[unit][i] = tagText(out.get(i));
            }
            List<Stream> in = graph.inStreams(unitId);
            sources[unit] = new int[in.size()];
            inTags[unit] = new String[in.size()];
            for (int i = 0; i < in.size(); i++) {
                sources[unit][i] = index.indexOf(in.get(i).getSource());
                inTags[unit][i] = tagText(in.get(i));
            }
        }
        return new OrderedPartition(index, targets, outTags, sources, inTags, siblings(index));
    }

    /**
     * Refines ordered initial cells of one component to a total order.
     *
     * @param initialCells cells of unit indices, in rank order.
     * @return unit indices in rank order.
     */
    int[] order(List<int[]> initialCells) {
        best = null;
        bestCertificate = null;
        automorphisms = new ArrayList<>();
        search(new ArrayList<>(initialCells), new IntArrayList());
        return best;
    }

    private void search(List<int[]> start, IntArrayList path) {
        cells = start;
        reindex();
        refine();
        int tied = firstTiedCell();
        if (tied < 0) {
            leaf();
            return;
        }
        List<int[]> node = cells;
        int[] candidates = node.get(tied).clone();
        sortByNumbering(candidates);
        IntArrayList explored = new IntArrayList();
        for (int candidate : candidates) {
            if (!explored.isEmpty() && inExploredOrbit(candidate, explored, path)) {
                continue;
            }
            explored.add(candidate);
            path.add(candidate);
            search(individualized(node, tied, candidate), path);
            path.popInt();
        }
    }

    private void leaf() {
        int[] order = new int[cells.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = cells.get(i)[0];
        }
        String certificate = certificate(order);
        if (best == null || certificate.compareTo(bestCertificate) < 0) {
            best = order;
            bestCertificate = certificate;
            return;
        }
        if (certificate.equals(bestCertificate)) {
            int[] mapping = new int[index.size()];
            for (int unit = 0; unit < mapping.length; unit++) {
                mapping[unit] = unit;
            }
            for (int i = 0; i < order.length; i++) {
                mapping[best[i]] = order[i];
            }
            automorphisms.add(mapping);
        }
    }

    // orbit under the automorphisms found so far that fix every unit on the path
    private boolean inExploredOrbit(int candidate, IntArrayList explored, IntArrayList path) {
        int[] parent = new int[index.size()];
        for (int unit = 0; unit < parent.length; unit++) {
            parent[unit] = unit;
        }
        for (int[] mapping : automorphisms) {
            if (!fixes(mapping, path)) {
                continue;
            }
            for (int unit = 0; unit < mapping.length; unit++) {
                union(parent, unit, mapping[unit]);
            }
        }
        int root = find(parent, candidate);
        for (int i = 0; i < explored.size(); i++) {
            if (find(parent, explored.getInt(i)) == root) {
                return true;
            }
        }
        return false;
    }

    private static boolean fixes(int[] mapping, IntArrayList path) {
        for (int i = 0; i < path.size(); i++) {
            int unit = path.getInt(i);
            if (mapping[unit] != unit) {
                return false;
            }
        }
        return true;
    }

    private static int find(int[] parent, int unit) {
        while (parent[unit] != unit) {
            parent[unit] = parent[parent[unit]];
            unit = parent[unit];
        }
        return unit;
    }

    private static void union(int[] parent, int a, int b) {
        int rootA = find(parent, a);
        int rootB = find(parent, b);
        if (rootA != rootB) {
            parent[Math.max(rootA, rootB)] = Math.min(rootA, rootB);
        }
    }

    /**
     * Isomorphism certificate of a component in a given order: units by
     * position with their label and outgoing streams by target position.
     */
    String certificate(int[] order) {
        int[] position = new int[index.size()];
        Arrays.fill(position, -1);
        for (int i = 0; i < order.length; i++) {
            position[order[i]] = i;
        }
        StringBuilder out = new StringBuilder();
        for (int unit : order) {
            out.append(label(index.unitAt(unit))).append('[');
            List<String> edges = new ArrayList<>(targets[unit].length);
            for (int i = 0; i < targets[unit].length; i++) {
                edges.add(position[targets[unit][i]] + ":" + outTags[unit][i]);
            }
            Collections.sort(edges);
            int[] group = new int[siblings[unit].length];
            for (int i = 0; i < group.length; i++) {
                group[i] = position[siblings[unit][i]];
            }
            Arrays.sort(group);
            out.append(String.join(",", edges)).append(']').append(Arrays.toString(group));
        }
        return out.toString();
    }

    // shadow units of the same heat-integrated unit, excluding the unit itself
    private static int[][] siblings(UnitIndex index) {
        int unitCount = index.size();
        Map<String, IntArrayList> byBase = new HashMap<>();
        for (int unit = 0; unit < unitCount; unit++) {
            String unitId = index.unitAt(unit);
            if (UnitIds.isShadow(unitId)) {
                byBase.computeIfAbsent(UnitIds.baseOf(unitId), k -> new IntArrayList()).add(unit);
            }
        }
        int[][] siblings = new int[unitCount][];
        for (int unit = 0; unit < unitCount; unit++) {
            String unitId = index.unitAt(unit);
            IntArrayList group = UnitIds.isShadow(unitId) ? byBase.get(UnitIds.baseOf(unitId)) : null;
            if (group == null) {
                siblings[unit] = new int[0];
                continue;
            }
            IntArrayList others = new IntArrayList(group);
            others.rem(unit);
            siblings[unit] = others.toIntArray();
        }
        return siblings;
    }

    private void refine() {
        boolean split = true;
        while (split) {
            split = false;
            List<int[]> next = new ArrayList<>(cells.size());
            for (int[] cell : cells) {
                if (cell.length == 1) {
                    next.add(cell);
                    continue;
                }
                TreeMap<String, IntArrayList> parts = new TreeMap<>();
                for (int unit : cell) {
                    parts.computeIfAbsent(neighbourhood(unit), k -> new IntArrayList()).add(unit);
                }
                if (parts.size() > 1) {
                    split = true;
                }
                for (IntArrayList part : parts.values()) {
                    next.add(part.toIntArray());
                }
            }
            cells = next;
            reindex();
        }
    }

    private String neighbourhood(int unit) {
        List<String> out = new ArrayList<>(targets[unit].length);
        for (int i = 0; i < targets[unit].length; i++) {
            out.add(cellOf[targets[unit][i]] + ":" + outTags[unit][i]);
        }
        List<String> in = new ArrayList<>(sources[unit].length);
        for (int i = 0; i < sources[unit].length; i++) {
            in.add(cellOf[sources[unit][i]] + ":" + inTags[unit][i]);
        }
        int[] group = new int[siblings[unit].length];
        for (int i = 0; i < group.length; i++) {
            group[i] = cellOf[siblings[unit][i]];
        }
        Collections.sort(out);
        Collections.sort(in);
        Arrays.sort(group);
        return String.join(",", out) + "|" + String.join(",", in) + "|" + Arrays.toString(group);
    }

    private int firstTiedCell() {
        for (int i = 0; i < cells.size(); i++) {
            if (cells.get(i).length > 1) {
                return i;
            }
        }
        return -1;
    }

    private static List<int[]> individualized(List<int[]> node, int position, int chosen) {
        int[] cell = node.get(position);
        int[] rest = new int[cell.length - 1];
        for (int i = 0, j = 0; i < cell.length; i++) {
            if (cell[i] != chosen) {
                rest[j++] = cell[i];
            }
        }
        List<int[]> branch = new ArrayList<>(node.size() + 1);
        branch.addAll(node);
        branch.set(position, new int[] {chosen});
        branch.add(position + 1, rest);
        return branch;
    }

    private void sortByNumbering(int[] units) {
        for (int i = 1; i < units.length; i++) {
            int unit = units[i];
            int j = i - 1;
            while (j >= 0 && numberingOrder(units[j], unit) > 0) {
                units[j + 1] = units[j];
                j--;
            }
            units[j + 1] = unit;
        }
    }

    private int numberingOrder(int a, int b) {
        String first = index.unitAt(a);
        String second = index.unitAt(b);
        int byInstance = Integer.compare(UnitIds.instanceOf(first).orElse(-1), UnitIds.instanceOf(second).orElse(-1));
        return byInstance != 0 ? byInstance : first.compareTo(second);
    }

    private void reindex() {
        Arrays.fill(cellOf, -1);
        for (int i = 0; i < cells.size(); i++) {
            for (int unit : cells.get(i)) {
                cellOf[unit] = i;
            }
        }
    }

    /**
     * Unit text as the generalized notation shows it: type, shadow marker and
     * control code.
     */
    static String label(String unitId) {
        return UnitIds.generalize(unitId)
                + (UnitIds.isShadow(unitId) ? "{}" : "")
                + UnitIds.controlCodeOf(unitId).map(code -> "{" + code + "}").orElse("");
    }

    private static String tagText(Stream stream) {
        return String.join(",", stream.getTags().allTags());
    }
}
