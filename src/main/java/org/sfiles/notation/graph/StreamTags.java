package org.sfiles.notation.graph;

import lombok.EqualsAndHashCode;
import org.sfiles.notation.core.AmbiguousTagException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Immutable tag set of one stream: at most one tag per role category plus
 * free-form additional tags that are carried through the notation unchanged.
 */
@EqualsAndHashCode
public final class StreamTags {
    public static final StreamTags EMPTY = new StreamTags(null, null, null, List.of());

    private final HeatExchangeTag heatExchange;
    private final ColumnTag column;
    private final SignalTag signal;
    private final List<String> additional;

    private StreamTags(HeatExchangeTag heatExchange, ColumnTag column, SignalTag signal, List<String> additional) {
        this.heatExchange = heatExchange;
        this.column = column;
        this.signal = signal;
        this.additional = List.copyOf(additional);
    }

    /**
     * Resolves raw tag strings into categories.
     *
     * @param rawTags tag texts such as {@code hot_in}, {@code tout}, {@code not_next_unitop}.
     * @return resolved tag set.
     * @throws AmbiguousTagException when two tags resolve the same category.
     * @throws IllegalArgumentException for blank tags or tags reserved for unit annotations.
     */
    public static StreamTags parse(Collection<String> rawTags) {
        if (rawTags == null || rawTags.isEmpty()) {
            return EMPTY;
        }
        HeatExchangeTag heatExchange = null;
        ColumnTag column = null;
        SignalTag signal = null;
        List<String> additional = new ArrayList<>();
        for (String raw : rawTags) {
            if (raw == null || raw.isBlank()) {
                throw new IllegalArgumentException("stream tag must be non-blank");
            }
            Optional<HeatExchangeTag> he = HeatExchangeTag.fromNotation(raw);
            Optional<ColumnTag> col = ColumnTag.fromNotation(raw);
            Optional<SignalTag> sig = SignalTag.fromNotation(raw);
            if (he.isPresent()) {
                heatExchange = requireVacant(heatExchange, he.get(), "heat-exchange", rawTags);
            } else if (col.isPresent()) {
                column = requireVacant(column, col.get(), "column", rawTags);
            } else if (sig.isPresent()) {
                signal = requireVacant(signal, sig.get(), "signal", rawTags);
            } else {
                if (UnitIds.isAnnotationText(raw)) {
                    throw new IllegalArgumentException("tag '" + raw + "' is reserved for unit annotations");
                }
                if (!additional.contains(raw)) {
                    additional.add(raw);
                }
            }
        }
        return new StreamTags(heatExchange, column, signal, additional);
    }

    public static StreamTags of(String... rawTags) {
        return parse(Arrays.asList(rawTags));
    }

    private static <T> T requireVacant(T current, T candidate, String category, Collection<String> rawTags) {
        if (current != null && !current.equals(candidate)) {
            throw new AmbiguousTagException(
                    "more than one " + category + " tag on one stream: " + rawTags
            );
        }
        return candidate;
    }

    public Optional<HeatExchangeTag> heatExchange() {
        return Optional.ofNullable(heatExchange);
    }

    public Optional<ColumnTag> column() {
        return Optional.ofNullable(column);
    }

    public Optional<SignalTag> signal() {
        return Optional.ofNullable(signal);
    }

    public List<String> additional() {
        return additional;
    }

    public boolean isSignal(SignalTag tag) {
        return signal == tag;
    }

    public boolean isEmpty() {
        return heatExchange == null && column == null && signal == null && additional.isEmpty();
    }

    public StreamTags withHeatExchange(HeatExchangeTag tag) {
        return new StreamTags(tag, column, signal, additional);
    }

    public StreamTags withSignal(SignalTag tag) {
        return new StreamTags(heatExchange, column, tag, additional);
    }

    /**
     * Tag texts written into the notation, in notation order: heat-exchange
     * (only when requested), column, additional. Signal roles are expressed
     * by markers, never as tags.
     */
    public List<String> notationTags(boolean includeHeatTags) {
        List<String> out = new ArrayList<>(2 + additional.size());
        if (includeHeatTags && heatExchange != null) {
            out.add(heatExchange.notation());
        }
        if (column != null) {
            out.add(column.notation());
        }
        out.addAll(additional);
        return out;
    }

    /**
     * All tag texts including the signal role.
     */
    public List<String> allTags() {
        List<String> out = notationTags(true);
        if (signal != null) {
            out.add(signal.notation());
        }
        return out;
    }

    @Override
    public String toString() {
        return allTags().toString();
    }
}
