package org.sfiles.core.id;

import lombok.experimental.StandardException;

import java.util.List;

/**
 * Bidirectional mapping contract between unit ids and dense integer indices.
 *
 * <p>Algorithms over a flowsheet graph (ranking, traversal) work on dense
 * indices so they can use primitive arrays and bit sets instead of hashing
 * unit ids on every step.</p>
 */
public interface UnitIndex {

    /**
     * Converts a unit id to its dense index.
     * @param unitId the unit id.
     * @return the dense index.
     * @throws UnknownUnitException If the id is not mapped.
     */
    int indexOf(String unitId) throws UnknownUnitException;

    /**
     * Converts a dense index back to its unit id.
     * @param index the dense index.
     * @return the unit id.
     * @throws IndexOutOfBoundsException If the index is invalid.
     */
    String unitAt(int index);

    /**
     * Returns number of mapped units.
     *
     * @return total mapping size.
     */
    int size();

    /**
     * Exception thrown when a unit id cannot be found in the mapping.
     */
    @StandardException
    class UnknownUnitException extends RuntimeException {
    }

    /**
     * Factory method to create the default immutable implementation.
     *
     * @param unitIds unit ids in index order; position {@code i} receives index {@code i}.
     * @return an immutable UnitIndex instance.
     */
    static UnitIndex of(List<String> unitIds) {
        return new FastUtilUnitIndex(unitIds);
    }
}
