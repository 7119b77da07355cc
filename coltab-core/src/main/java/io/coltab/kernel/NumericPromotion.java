package io.coltab.kernel;

import io.coltab.core.ElementKind;

/**
 * Promotion rules for comparing or combining two numeric kinds.
 * <p>
 * Both operands are widened to the domain picked from {@link #RULES}; a single table replaces
 * one code path per pair of kinds.
 */
public final class NumericPromotion {

    /**
     * Common representation both operands are widened to.
     */
    public enum Domain {
        LONG,
        DOUBLE,
        COMPLEX
    }

    private static final Domain[][] RULES = buildRules();

    private NumericPromotion() {
    }

    /**
     * Domain for a pair of numeric kinds, or {@code null} when either kind is not numeric.
     */
    public static Domain promote(ElementKind left, ElementKind right) {
        if (left == null || right == null) {
            return null;
        }
        return RULES[left.ordinal()][right.ordinal()];
    }

    /**
     * Domain of a single numeric kind.
     */
    public static Domain domainOf(ElementKind kind) {
        return promote(kind, kind);
    }

    private static Domain[][] buildRules() {
        ElementKind[] kinds = ElementKind.values();
        Domain[][] rules = new Domain[kinds.length][kinds.length];
        for (ElementKind left : kinds) {
            for (ElementKind right : kinds) {
                rules[left.ordinal()][right.ordinal()] = rule(left, right);
            }
        }
        return rules;
    }

    private static Domain rule(ElementKind left, ElementKind right) {
        if (!left.isNumeric() || !right.isNumeric()) {
            return null;
        }
        if (left.isComplex() || right.isComplex()) {
            return Domain.COMPLEX;
        }
        if (left.isReal() || right.isReal()) {
            return Domain.DOUBLE;
        }
        return Domain.LONG;
    }
}
