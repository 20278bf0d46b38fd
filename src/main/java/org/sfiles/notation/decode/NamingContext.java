package org.sfiles.notation.decode;

import org.sfiles.notation.core.StructuralException;
import org.sfiles.notation.graph.UnitIds;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Resolves the unit tokens of one notation into unique unit ids.
 *
 * <p>Numbered units keep their id. A type-only unit receives the next instance
 * number not used by any numbered unit of that type. A heat-integration
 * annotation {@code {g}} turns the unit into the next shadow {@code base/k}
 * of group {@code g}; an uppercase annotation becomes a {@code /CODE} suffix.</p>
 *
 * <p><strong>Thread Safety:</strong> NOT thread-safe; one instance per decode call.</p>
 */
public final class NamingContext {
    private final Map<String, Set<Integer>> usedInstances = new HashMap<>();
    private final Map<String, Integer> nextInstance = new HashMap<>();
    private final Map<String, HeatGroup> heatGroups = new HashMap<>();
    private final Set<String> assigned = new HashSet<>();

    /**
     * Resolves every unit token in order.
     *
     * @param tokens lexed tokens.
     * @return one unit id per {@link TokenType#UNIT} token, in token order.
     * @throws StructuralException when two unit tokens resolve the same id.
     */
    public static List<String> resolve(List<Token> tokens) {
        return new NamingContext().resolveAll(tokens);
    }

    private List<String> resolveAll(List<Token> tokens) {
        for (Token token : tokens) {
            if (token.getType() == TokenType.UNIT) {
                reserve(token.content());
            }
        }
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.getType() != TokenType.UNIT) {
                continue;
            }
            String annotation = i + 1 < tokens.size() && tokens.get(i + 1).getType() == TokenType.ANNOTATION
                    ? tokens.get(i + 1).content()
                    : null;
            String unitId = resolve(token.content(), annotation);
            if (!assigned.add(unitId)) {
                throw new StructuralException(
                        StructuralException.REASON_DUPLICATE_UNIT,
                        "unit " + unitId + " appears more than once"
                );
            }
            ids.add(unitId);
        }
        return ids;
    }

    private void reserve(String text) {
        if (!UnitIds.isNumbered(text)) {
            return;
        }
        OptionalInt instance = UnitIds.instanceOf(text);
        if (instance.isPresent()) {
            usedInstances.computeIfAbsent(UnitIds.typeOf(text), t -> new HashSet<>()).add(instance.getAsInt());
        }
    }

    private String resolve(String text, String annotation) {
        if (annotation == null) {
            return UnitIds.isNumbered(text) ? text : numbered(text);
        }
        if (UnitIds.isHeatIntegrationGroup(annotation)) {
            if (UnitIds.suffixOf(text).isPresent()) {
                return text;
            }
            HeatGroup group = heatGroups.get(annotation);
            if (group == null) {
                String base = UnitIds.isNumbered(text) ? text : numbered(text);
                group = new HeatGroup(base);
                heatGroups.put(annotation, group);
            }
            return group.nextShadow();
        }
        if (UnitIds.suffixOf(text).isPresent()) {
            return text;
        }
        String base = UnitIds.isNumbered(text) ? text : numbered(text);
        return base + "/" + annotation;
    }

    /**
     * Next free instance id for a type-only unit token.
     */
    private String numbered(String type) {
        Set<Integer> used = usedInstances.computeIfAbsent(type, t -> new HashSet<>());
        int candidate = nextInstance.getOrDefault(type, 1);
        while (used.contains(candidate)) {
            candidate++;
        }
        used.add(candidate);
        nextInstance.put(type, candidate + 1);
        return UnitIds.numbered(type, candidate);
    }

    private static final class HeatGroup {
        private final String baseId;
        private int occurrences;

        HeatGroup(String baseId) {
            this.baseId = baseId;
        }

        String nextShadow() {
            return UnitIds.shadow(baseId, ++occurrences);
        }
    }
}
