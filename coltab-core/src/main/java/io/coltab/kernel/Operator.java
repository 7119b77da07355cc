package io.coltab.kernel;

/**
 * Comparison operators accepted by the selection predicates.
 */
public enum Operator {
    EQUAL_TO("="),
    NOT_EQUAL_TO("!="),
    GREATER_THAN(">"),
    NOT_GREATER_THAN("<="),
    LESS_THAN("<"),
    NOT_LESS_THAN(">=");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Whether this operator only asks for (in)equality.
     */
    public boolean isEquality() {
        return this == EQUAL_TO || this == NOT_EQUAL_TO;
    }

    /**
     * Apply the operator to the sign of a three-way comparison {@code left <=> right}.
     */
    public boolean test(int comparison) {
        return switch (this) {
            case EQUAL_TO -> comparison == 0;
            case NOT_EQUAL_TO -> comparison != 0;
            case GREATER_THAN -> comparison > 0;
            case NOT_GREATER_THAN -> comparison <= 0;
            case LESS_THAN -> comparison < 0;
            case NOT_LESS_THAN -> comparison >= 0;
        };
    }

    /**
     * Native comparison of two integral values.
     */
    public boolean test(long left, long right) {
        return switch (this) {
            case EQUAL_TO -> left == right;
            case NOT_EQUAL_TO -> left != right;
            case GREATER_THAN -> left > right;
            case NOT_GREATER_THAN -> left <= right;
            case LESS_THAN -> left < right;
            case NOT_LESS_THAN -> left >= right;
        };
    }

    /**
     * Native comparison of two real values; a NaN operand only satisfies {@link #NOT_EQUAL_TO}.
     */
    public boolean test(double left, double right) {
        return switch (this) {
            case EQUAL_TO -> left == right;
            case NOT_EQUAL_TO -> left != right;
            case GREATER_THAN -> left > right;
            case NOT_GREATER_THAN -> left <= right;
            case LESS_THAN -> left < right;
            case NOT_LESS_THAN -> left >= right;
        };
    }
}
