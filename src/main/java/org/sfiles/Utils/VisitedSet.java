package org.sfiles.Utils;

import java.util.BitSet;

/**
 * Bit-set backed set of visited unit indices for graph walks.
 * <p>
 * <strong>Thread Safety:</strong> This class is NOT thread-safe. It is intended
 * for use within a single call-scoped walk.
 * </p>
 */
public class VisitedSet {

    private final BitSet visited;

    /**
     * Constructs a new VisitedSet.
     *
     * @param initialCapacity expected number of units, used to size the bit set.
     */
    public VisitedSet(int initialCapacity) {
        this.visited = new BitSet(initialCapacity);
    }

    private VisitedSet(BitSet visited) {
        this.visited = visited;
    }

    /**
     * Marks a unit as visited if it hasn't been visited already.
     *
     * @param unitIndex dense unit index.
     * @return {@code true} if the unit was newly marked, {@code false} if it was already visited.
     */
    public boolean markVisited(int unitIndex) {
        if (visited.get(unitIndex)) {
            return false;
        }
        visited.set(unitIndex);
        return true;
    }

    /**
     * Checks if a unit has been visited.
     */
    public boolean isVisited(int unitIndex) {
        return visited.get(unitIndex);
    }

    /**
     * Number of visited units.
     */
    public int count() {
        return visited.cardinality();
    }

    /**
     * Returns an independent snapshot of the current visited state.
     */
    public VisitedSet snapshot() {
        return new VisitedSet((BitSet) visited.clone());
    }

    /**
     * Returns the lowest unvisited index below {@code limit}, or -1 when all are visited.
     */
    public int firstUnvisited(int limit) {
        int index = visited.nextClearBit(0);
        return index < limit ? index : -1;
    }
}
