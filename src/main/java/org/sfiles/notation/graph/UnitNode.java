package org.sfiles.notation.graph;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A unit-operation instance.
 *
 * <p>Units own no streams. {@code streamAttributes} holds attributes that
 * differed between the per-stream shadows of a heat-integrated unit, keyed by
 * stream index, so merging never discards them.</p>
 */
@Value
@Builder(toBuilder = true)
public class UnitNode {
    String id;
    @Singular
    Map<String, String> attributes;
    @Singular
    Map<Integer, Map<String, String>> streamAttributes;

    public static UnitNode of(String id) {
        return UnitNode.builder().id(UnitIds.requireId(id)).build();
    }

    public String type() {
        return UnitIds.typeOf(id);
    }
}
