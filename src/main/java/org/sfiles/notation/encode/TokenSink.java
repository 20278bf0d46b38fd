package org.sfiles.notation.encode;

import org.sfiles.notation.graph.UnitIds;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects rendered tokens, either numbered or generalized.
 *
 * <p>A mixing-point reference directly followed by an incoming-branch close is
 * emitted as the single token {@code &|}, which is how the lexer reads it.</p>
 */
final class TokenSink {
    private final boolean generalized;
    private final List<String> tokens = new ArrayList<>();

    TokenSink(boolean generalized) {
        this.generalized = generalized;
    }

    void unit(String unitId) {
        tokens.add("(" + (generalized ? UnitIds.generalize(unitId) : unitId) + ")");
    }

    void tags(List<String> tags) {
        for (String tag : tags) {
            tokens.add("{" + tag + "}");
        }
    }

    void emit(String token) {
        int last = tokens.size() - 1;
        if ("|".equals(token) && last >= 0 && "&".equals(tokens.get(last))) {
            tokens.set(last, "&|");
            return;
        }
        tokens.add(token);
    }

    List<String> tokens() {
        return List.copyOf(tokens);
    }
}
