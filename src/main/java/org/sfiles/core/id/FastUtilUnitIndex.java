package org.sfiles.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;

/**
 * UnitIndex backed by a fastutil open hash map for the forward lookup and a
 * plain array for the reverse lookup.
 * * This class is immutable and thread-safe for concurrent reads.
 */
public class FastUtilUnitIndex implements UnitIndex {

    // unit id -> index
    private final Object2IntOpenHashMap<String> forward;
    // index -> unit id
    private final String[] reverse;

    /**
     * Builds the index from an ordered id list.
     * Rejects null and duplicate ids.
     */
    public FastUtilUnitIndex(List<String> unitIds) {
        if (unitIds == null) {
            throw new IllegalArgumentException("Unit ids cannot be null");
        }
        int size = unitIds.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(-1); // Sentinel value
        this.reverse = new String[size];

        for (int i = 0; i < size; i++) {
            String unitId = unitIds.get(i);
            if (unitId == null) {
                throw new IllegalArgumentException("Null unit id at index " + i);
            }
            if (forward.containsKey(unitId)) {
                throw new IllegalArgumentException("Duplicate unit id detected: " + unitId);
            }
            forward.put(unitId, i);
            reverse[i] = unitId;
        }
        this.forward.trim();
    }

    @Override
    public int indexOf(String unitId) throws UnknownUnitException {
        // getInt avoids boxing
        int index = forward.getInt(unitId);
        if (index == -1) {
            throw new UnknownUnitException("Unit not found: " + unitId);
        }
        return index;
    }

    @Override
    public String unitAt(int index) {
        try {
            return reverse[index];
        } catch (ArrayIndexOutOfBoundsException e) {
            throw new IndexOutOfBoundsException("Unit index out of bounds: " + index);
        }
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
