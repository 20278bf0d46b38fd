package org.sfiles.notation.graph;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heat-exchange role of a stream: the stream slot of a multi-stream unit
 * ({@code hot}, {@code cold} or a positive number) and whether the stream
 * enters or leaves it. Notation: {@code hot_in}, {@code cold_out}, {@code 2_in}.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
public final class HeatExchangeTag {
    public static final String HOT = "hot";
    public static final String COLD = "cold";

    private static final Pattern NOTATION = Pattern.compile("(hot|cold|[1-9][0-9]{0,8})_(in|out)");

    /**
     * Slot ordering: numbered slots ascending, then named slots alphabetically.
     */
    public static final Comparator<String> SLOT_ORDER = (a, b) -> {
        boolean aNumeric = Character.isDigit(a.charAt(0));
        boolean bNumeric = Character.isDigit(b.charAt(0));
        if (aNumeric && bNumeric) {
            return Integer.compare(Integer.parseInt(a), Integer.parseInt(b));
        }
        if (aNumeric != bNumeric) {
            return aNumeric ? -1 : 1;
        }
        return a.compareTo(b);
    };

    public enum Direction {
        IN,
        OUT
    }

    private final String slot;
    private final Direction direction;

    private HeatExchangeTag(String slot, Direction direction) {
        this.slot = slot;
        this.direction = direction;
    }

    public static HeatExchangeTag of(String slot, Direction direction) {
        Objects.requireNonNull(direction, "direction");
        HeatExchangeTag tag = new HeatExchangeTag(Objects.requireNonNull(slot, "slot"), direction);
        if (fromNotation(tag.notation()).isEmpty()) {
            throw new IllegalArgumentException("invalid heat-exchange slot: " + slot);
        }
        return tag;
    }

    public static HeatExchangeTag numbered(int slot, Direction direction) {
        return of(Integer.toString(slot), direction);
    }

    public static Optional<HeatExchangeTag> fromNotation(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = NOTATION.matcher(text);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        Direction direction = "in".equals(matcher.group(2)) ? Direction.IN : Direction.OUT;
        return Optional.of(new HeatExchangeTag(matcher.group(1), direction));
    }

    public String notation() {
        return slot + "_" + (direction == Direction.IN ? "in" : "out");
    }

    @Override
    public String toString() {
        return notation();
    }
}
