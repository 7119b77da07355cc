package io.coltab.storage;

import io.coltab.core.ColtabException;
import io.coltab.core.Complex;
import io.coltab.core.ElementKind;
import io.coltab.core.ErrorCode;
import io.coltab.kernel.Column;

import java.util.function.DoublePredicate;
import java.util.function.DoubleUnaryOperator;
import java.util.function.ToDoubleFunction;
import java.util.function.UnaryOperator;

/**
 * Elementwise arithmetic and math transforms on heap columns.
 * <p>
 * Invalid operands give invalid results. Real results written into integral columns are rounded
 * to the nearest integer, halves away from zero; values outside a transform's domain (log of a
 * non-positive number, zero to a negative power, negative base to a fractional power) become
 * invalid elements.
 */
final class ColumnMath {

    enum BinaryOp {
        ADD,
        SUBTRACT,
        MULTIPLY,
        DIVIDE;

        long apply(long left, long right) {
            return switch (this) {
                case ADD -> left + right;
                case SUBTRACT -> left - right;
                case MULTIPLY -> left * right;
                case DIVIDE -> left / right;
            };
        }

        double apply(double left, double right) {
            return switch (this) {
                case ADD -> left + right;
                case SUBTRACT -> left - right;
                case MULTIPLY -> left * right;
                case DIVIDE -> left / right;
            };
        }

        /**
         * Result, or {@code null} for a division by zero.
         */
        Complex apply(Complex left, Complex right) {
            return switch (this) {
                case ADD -> left.plus(right);
                case SUBTRACT -> left.minus(right);
                case MULTIPLY -> left.times(right);
                case DIVIDE -> left.dividedBy(right);
            };
        }
    }

    private ColumnMath() {
    }

    static void combine(HeapColumn target, Column operand, BinaryOp op) {
        if (operand == null) {
            throw ColtabException.nullInput("column");
        }
        requireNumericScalar(target);
        requireNumericScalar(operand);
        if (operand.length() != target.length()) {
            throw new ColtabException(ErrorCode.INCOMPATIBLE_INPUT,
                    "column lengths differ: " + target.length() + " and " + operand.length());
        }
        ElementKind kind = target.kind();
        if (operand.kind().isComplex() && !kind.isComplex()) {
            throw new ColtabException(ErrorCode.TYPE_MISMATCH,
                    "cannot store complex " + operand.name() + " into " + kind + " column " + target.name());
        }
        boolean integral = kind.isIntegral() && operand.kind().isIntegral();
        for (int row = 0; row < target.length(); row++) {
            if (!target.valid(row)) {
                continue;
            }
            if (!operand.isValid(row)) {
                target.markInvalid(row);
                continue;
            }
            if (kind.isComplex()) {
                Complex result = op.apply(target.readComplex(row), operand.getComplex(row));
                if (result == null) {
                    target.markInvalid(row);
                } else {
                    target.writeComplex(row, result);
                }
            } else if (integral) {
                long right = operand.getLong(row);
                if (op == BinaryOp.DIVIDE && right == 0L) {
                    target.markInvalid(row);
                } else {
                    target.writeLong(row, op.apply(target.readLong(row), right));
                }
            } else {
                double right = operand.getDouble(row);
                if (op == BinaryOp.DIVIDE && right == 0.0) {
                    target.markInvalid(row);
                } else {
                    storeReal(target, row, op.apply(target.readDouble(row), right), false);
                }
            }
        }
    }

    static void combineScalar(HeapColumn target, Complex value, BinaryOp op) {
        if (value == null) {
            throw ColtabException.nullInput("value");
        }
        requireNumericScalar(target);
        ElementKind kind = target.kind();
        if (value.im() != 0.0 && !kind.isComplex()) {
            throw new ColtabException(ErrorCode.TYPE_MISMATCH,
                    "complex operand for " + kind + " column " + target.name());
        }
        if (op == BinaryOp.DIVIDE && value.isZero()) {
            throw new ColtabException(ErrorCode.DIVISION_BY_ZERO, "division by zero on column " + target.name());
        }
        double re = value.re();
        boolean exactIntegral = kind.isIntegral() && re == Math.rint(re) && Math.abs(re) < 0x1p53;
        for (int row = 0; row < target.length(); row++) {
            if (!target.valid(row)) {
                continue;
            }
            if (kind.isComplex()) {
                target.writeComplex(row, op.apply(target.readComplex(row), value));
            } else if (exactIntegral) {
                target.writeLong(row, op.apply(target.readLong(row), (long) re));
            } else {
                storeReal(target, row, op.apply(target.readDouble(row), re), false);
            }
        }
    }

    static Column abs(HeapColumn column) {
        requireNumericScalar(column);
        if (column.kind().isComplex()) {
            return toReal(column, column.kind().realPart(), Complex::abs);
        }
        if (column.kind().isIntegral()) {
            for (int row = 0; row < column.length(); row++) {
                if (column.valid(row)) {
                    column.writeLong(row, Math.abs(column.readLong(row)));
                }
            }
            return column;
        }
        return mapReal(column, x -> true, Math::abs);
    }

    static Column logarithm(HeapColumn column, double base) {
        if (base <= 0.0 || base == 1.0) {
            throw ColtabException.illegal("logarithm base must be positive and not 1: " + base);
        }
        requireNumericScalar(column);
        double lnBase = Math.log(base);
        if (column.kind().isComplex()) {
            return mapComplex(column, z -> z.isZero() ? null : z.log().scale(1.0 / lnBase));
        }
        return mapReal(column, x -> x > 0.0, x -> Math.log(x) / lnBase);
    }

    static Column exponential(HeapColumn column, double base) {
        if (base <= 0.0) {
            throw ColtabException.illegal("exponential base must be positive: " + base);
        }
        requireNumericScalar(column);
        double lnBase = Math.log(base);
        if (column.kind().isComplex()) {
            return mapComplex(column, z -> z.scale(lnBase).exp());
        }
        return mapReal(column, x -> true, x -> Math.pow(base, x));
    }

    static Column power(HeapColumn column, double exponent) {
        requireNumericScalar(column);
        if (column.kind().isComplex()) {
            return mapComplex(column, z -> z.pow(exponent));
        }
        boolean integralExponent = exponent == Math.rint(exponent);
        return mapReal(column,
                x -> !(x == 0.0 && exponent < 0.0) && !(x < 0.0 && !integralExponent),
                x -> Math.pow(x, exponent));
    }

    static Column conjugate(HeapColumn column) {
        requireNumericScalar(column);
        if (column.kind().isComplex()) {
            return mapComplex(column, Complex::conjugate);
        }
        return column;
    }

    static Column arg(HeapColumn column) {
        requireNumericScalar(column);
        ElementKind kind = column.kind();
        if (kind.isComplex()) {
            return toReal(column, kind.realPart(), Complex::arg);
        }
        ElementKind resultKind = kind == ElementKind.FLOAT ? ElementKind.FLOAT : ElementKind.DOUBLE;
        return toReal(column, resultKind, z -> z.re() < 0.0 ? Math.PI : 0.0);
    }

    static Column realPart(HeapColumn column) {
        requireComplex(column);
        return toReal(column, column.kind().realPart(), Complex::re);
    }

    static Column imagPart(HeapColumn column) {
        requireComplex(column);
        return toReal(column, column.kind().realPart(), Complex::im);
    }

    /**
     * Round half away from zero.
     */
    static long roundHalfAway(double value) {
        return (long) (value < 0.0 ? Math.ceil(value - 0.5) : Math.floor(value + 0.5));
    }

    private static Column mapReal(HeapColumn column, DoublePredicate defined, DoubleUnaryOperator f) {
        for (int row = 0; row < column.length(); row++) {
            if (!column.valid(row)) {
                continue;
            }
            double x = column.readDouble(row);
            if (!defined.test(x)) {
                column.markInvalid(row);
            } else {
                storeReal(column, row, f.applyAsDouble(x), true);
            }
        }
        return column;
    }

    private static Column mapComplex(HeapColumn column, UnaryOperator<Complex> f) {
        for (int row = 0; row < column.length(); row++) {
            if (!column.valid(row)) {
                continue;
            }
            Complex result = f.apply(column.readComplex(row));
            if (result == null) {
                column.markInvalid(row);
            } else {
                column.writeComplex(row, result);
            }
        }
        return column;
    }

    private static HeapColumn toReal(HeapColumn column, ElementKind kind,
                                     ToDoubleFunction<Complex> f) {
        HeapColumn result = column.reshaped(kind, 0);
        for (int row = 0; row < column.length(); row++) {
            if (column.valid(row)) {
                result.writeDouble(row, f.applyAsDouble(column.readComplex(row)));
                result.markValid(row);
            }
        }
        return result;
    }

    private static void storeReal(HeapColumn column, int row, double value, boolean round) {
        if (!column.kind().isIntegral()) {
            column.writeDouble(row, value);
            return;
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            column.markInvalid(row);
            return;
        }
        column.writeLong(row, round ? roundHalfAway(value) : column.kind().truncate(value));
    }

    private static void requireNumericScalar(Column column) {
        if (column.isArray()) {
            throw new ColtabException(ErrorCode.UNSUPPORTED_MODE, "array column not accepted here: " + column.name());
        }
        if (!column.kind().isNumeric()) {
            throw new ColtabException(ErrorCode.INVALID_TYPE, "column is not numeric: " + column.name());
        }
    }

    private static void requireComplex(HeapColumn column) {
        requireNumericScalar(column);
        if (!column.kind().isComplex()) {
            throw new ColtabException(ErrorCode.INVALID_TYPE, "column is not complex: " + column.name());
        }
    }
}
