package org.sfiles.notation.encode;

import java.util.List;

/**
 * Node of the notation token tree.
 */
interface NotationItem {

    /**
     * Appends this item's tokens in notation order.
     */
    void render(TokenSink sink);

    /**
     * Appends the unit elements of this item in notation order.
     */
    void collectUnits(List<UnitElement> units);
}
