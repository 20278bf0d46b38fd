package org.sfiles.notation.graph;

import lombok.experimental.UtilityClass;

import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Grammar helpers for unit ids of the form {@code type-instance[/suffix]}.
 *
 * <p>The suffix is either a positive integer (the k-th stream of a
 * heat-integrated unit, a "shadow" unit) or an uppercase control code such as
 * {@code TIR}. Generalized ids carry the type only.</p>
 */
@UtilityClass
public class UnitIds {
    public static final String CONTROL_UNIT_TYPE = "C";
    public static final String HEAT_EXCHANGER_TYPE = "hex";
    public static final String HEAT_EXCHANGER_LONG_TYPE = "HeatExchanger";

    private static final Pattern DIGITS = Pattern.compile("[0-9]+");
    private static final Pattern CONTROL_CODE = Pattern.compile("[A-Z]+");

    /**
     * Returns the unit type, i.e. everything before the first {@code '-'} (or
     * before the suffix for generalized ids).
     */
    public static String typeOf(String unitId) {
        String base = baseOf(unitId);
        int dash = base.indexOf('-');
        return dash < 0 ? base : base.substring(0, dash);
    }

    /**
     * Returns the numeric instance number, empty when the id is generalized or
     * its instance part is not numeric.
     */
    public static OptionalInt instanceOf(String unitId) {
        String base = baseOf(unitId);
        int dash = base.indexOf('-');
        if (dash < 0) {
            return OptionalInt.empty();
        }
        String instance = base.substring(dash + 1);
        if (!DIGITS.matcher(instance).matches() || instance.length() > 9) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(Integer.parseInt(instance));
    }

    /**
     * True when the id carries an instance part after {@code '-'}.
     */
    public static boolean isNumbered(String unitId) {
        return baseOf(unitId).indexOf('-') >= 0;
    }

    /**
     * Returns the id without its {@code /suffix}.
     */
    public static String baseOf(String unitId) {
        int slash = requireId(unitId).indexOf('/');
        return slash < 0 ? unitId : unitId.substring(0, slash);
    }

    /**
     * Returns the suffix after {@code '/'}, empty when absent.
     */
    public static Optional<String> suffixOf(String unitId) {
        int slash = requireId(unitId).indexOf('/');
        return slash < 0 ? Optional.empty() : Optional.of(unitId.substring(slash + 1));
    }

    /**
     * Returns the shadow stream index {@code k} of a {@code base/k} id.
     */
    public static OptionalInt shadowIndexOf(String unitId) {
        Optional<String> suffix = suffixOf(unitId);
        if (suffix.isEmpty() || !DIGITS.matcher(suffix.get()).matches() || suffix.get().length() > 9) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(Integer.parseInt(suffix.get()));
    }

    public static boolean isShadow(String unitId) {
        return shadowIndexOf(unitId).isPresent();
    }

    /**
     * Returns the uppercase control code of a {@code base/CODE} id.
     */
    public static Optional<String> controlCodeOf(String unitId) {
        return suffixOf(unitId).filter(s -> CONTROL_CODE.matcher(s).matches());
    }

    /**
     * True for heat-exchanger units, in short ({@code hex}) or long
     * ({@code HeatExchanger}) naming.
     */
    public static boolean isHeatExchanger(String unitId) {
        String type = typeOf(unitId);
        return HEAT_EXCHANGER_TYPE.equals(type) || HEAT_EXCHANGER_LONG_TYPE.equals(type);
    }

    public static boolean isControlUnit(String unitId) {
        return CONTROL_UNIT_TYPE.equals(typeOf(unitId));
    }

    /**
     * Type-only form used by the generalized notation.
     */
    public static String generalize(String unitId) {
        return typeOf(unitId);
    }

    public static String numbered(String type, int instance) {
        return type + "-" + instance;
    }

    public static String shadow(String baseId, int streamIndex) {
        return baseId + "/" + streamIndex;
    }

    /**
     * True for annotation text that may follow a unit token: a heat-integration
     * group number or an uppercase control code.
     */
    public static boolean isAnnotationText(String text) {
        return DIGITS.matcher(text).matches() || CONTROL_CODE.matcher(text).matches();
    }

    public static boolean isHeatIntegrationGroup(String text) {
        return DIGITS.matcher(text).matches();
    }

    /**
     * Validates a unit id: non-blank, no structural characters.
     */
    public static String requireId(String unitId) {
        if (unitId == null || unitId.isBlank()) {
            throw new IllegalArgumentException("unit id must be non-blank");
        }
        for (int i = 0; i < unitId.length(); i++) {
            char c = unitId.charAt(i);
            if (c == '(' || c == ')' || c == '{' || c == '}' || c == '[' || c == ']' || Character.isWhitespace(c)) {
                throw new IllegalArgumentException("unit id contains reserved character '" + c + "': " + unitId);
            }
        }
        return unitId;
    }
}
