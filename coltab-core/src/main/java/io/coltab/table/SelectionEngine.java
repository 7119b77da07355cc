package io.coltab.table;

import io.coltab.core.ColtabException;
import io.coltab.core.Complex;
import io.coltab.core.ElementKind;
import io.coltab.core.ErrorCode;
import io.coltab.kernel.CodePointOrder;
import io.coltab.kernel.Column;
import io.coltab.kernel.NumericPromotion;
import io.coltab.kernel.Operator;
import io.coltab.kernel.selection.SelectionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.IntPredicate;
import java.util.regex.Pattern;

/**
 * Predicate evaluation over a table's selection.
 * <p>
 * AND variants only look at selected rows and drop the ones that fail; OR variants only look at
 * unselected rows and add the ones that pass. An invalid operand never satisfies a comparison,
 * so AND removes invalid rows and OR never adds them. Every operation returns the new selected
 * count.
 */
final class SelectionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SelectionEngine.class);

    private SelectionEngine() {
    }

    static int compareLong(ColumnTable table, String name, Operator operator, long value, boolean and) {
        requireOperator(operator);
        Column column = requireNumericScalar(table, name);
        IntPredicate predicate = switch (NumericPromotion.domainOf(column.kind())) {
            case LONG -> row -> operator.test(column.getLong(row), value);
            case DOUBLE -> {
                double literal = atColumnPrecision(column, value);
                yield row -> operator.test(column.getDouble(row), literal);
            }
            case COMPLEX -> complexPredicate(column, operator, Complex.ofReal(value));
        };
        return apply(table, column, predicate, and, name + " " + operator.symbol() + " " + value);
    }

    static int compareDouble(ColumnTable table, String name, Operator operator, double value, boolean and) {
        requireOperator(operator);
        Column column = requireNumericScalar(table, name);
        IntPredicate predicate = switch (NumericPromotion.domainOf(column.kind())) {
            case LONG, DOUBLE -> {
                double literal = atColumnPrecision(column, value);
                yield row -> operator.test(column.getDouble(row), literal);
            }
            case COMPLEX -> complexPredicate(column, operator, Complex.ofReal(value));
        };
        return apply(table, column, predicate, and, name + " " + operator.symbol() + " " + value);
    }

    static int compareComplex(ColumnTable table, String name, Operator operator, Complex value, boolean and) {
        requireOperator(operator);
        if (value == null) {
            throw ColtabException.nullInput("value");
        }
        Column column = requireNumericScalar(table, name);
        IntPredicate predicate = complexPredicate(column, operator, value);
        return apply(table, column, predicate, and, name + " " + operator.symbol() + " " + value);
    }

    /**
     * Equality operators test the pattern as a regular expression found anywhere in the element;
     * ordering operators compare the element with the literal by code point.
     */
    static int compareString(ColumnTable table, String name, Operator operator, String pattern, boolean and) {
        requireOperator(operator);
        if (pattern == null) {
            throw ColtabException.nullInput("pattern");
        }
        Column column = requireString(table, name);
        IntPredicate predicate;
        if (operator.isEquality()) {
            Pattern compiled = table.patterns().compile(pattern);
            boolean wanted = operator == Operator.EQUAL_TO;
            predicate = row -> compiled.matcher(column.getString(row)).find() == wanted;
        } else {
            predicate = row -> operator.test(CodePointOrder.compare(column.getString(row), pattern));
        }
        return apply(table, column, predicate, and, name + " " + operator.symbol() + " '" + pattern + "'");
    }

    /**
     * Row-wise {@code first <op> second}. Numeric operands are widened to their promoted domain;
     * complex operands only support (in)equality.
     */
    static int compareColumns(ColumnTable table, String firstName, Operator operator, String secondName,
                              boolean and) {
        requireOperator(operator);
        Column first = table.requireColumn(firstName);
        Column second = table.requireColumn(secondName);
        if (first.isArray() || second.isArray()) {
            throw new ColtabException(ErrorCode.UNSUPPORTED_MODE,
                    "array columns cannot be compared: " + firstName + ", " + secondName);
        }
        IntPredicate predicate;
        boolean firstString = first.kind() == ElementKind.STRING;
        boolean secondString = second.kind() == ElementKind.STRING;
        if (firstString && secondString) {
            predicate = row -> operator.test(CodePointOrder.compare(first.getString(row), second.getString(row)));
        } else if (firstString || secondString) {
            throw new ColtabException(ErrorCode.TYPE_MISMATCH,
                    "cannot compare " + first.kind() + " column " + firstName
                            + " with " + second.kind() + " column " + secondName);
        } else {
            predicate = switch (NumericPromotion.promote(first.kind(), second.kind())) {
                case LONG -> row -> operator.test(first.getLong(row), second.getLong(row));
                case DOUBLE -> row -> operator.test(first.getDouble(row), second.getDouble(row));
                case COMPLEX -> {
                    requireEquality(operator, firstName);
                    boolean wanted = operator == Operator.EQUAL_TO;
                    yield row -> first.getComplex(row).equalsNumerically(second.getComplex(row)) == wanted;
                }
            };
        }
        IntPredicate bothValid = row -> second.isValid(row) && predicate.test(row);
        return apply(table, first, bothValid, and, firstName + " " + operator.symbol() + " " + secondName);
    }

    static int invalid(ColumnTable table, String name, boolean and) {
        Column column = table.requireColumn(name);
        SelectionState selection = table.selection();
        IntPredicate predicate = row -> !column.isValid(row);
        int count = and ? selection.retainIf(predicate) : selection.addIf(predicate);
        log(and, "invalid(" + name + ")", count);
        return count;
    }

    /**
     * Rows in {@code [start, start + count)}, clipped at the table end.
     */
    static int window(ColumnTable table, int start, int count, boolean and) {
        int clipped = table.clipWindow(start, count);
        int end = start + clipped;
        SelectionState selection = table.selection();
        IntPredicate inWindow = row -> row >= start && row < end;
        int selected = and ? selection.retainIf(inWindow) : selection.addIf(inWindow);
        log(and, "window[" + start + ", " + end + ")", selected);
        return selected;
    }

    private static int apply(ColumnTable table, Column column, IntPredicate predicate, boolean and,
                             String description) {
        SelectionState selection = table.selection();
        IntPredicate guarded = row -> column.isValid(row) && predicate.test(row);
        int count = and ? selection.retainIf(guarded) : selection.addIf(guarded);
        log(and, description, count);
        return count;
    }

    private static IntPredicate complexPredicate(Column column, Operator operator, Complex value) {
        requireEquality(operator, column.name());
        boolean wanted = operator == Operator.EQUAL_TO;
        Complex literal = column.kind() == ElementKind.FLOAT_COMPLEX ? value.toFloatPrecision() : value;
        return row -> column.getComplex(row).equalsNumerically(literal) == wanted;
    }

    /**
     * Float columns compare against the literal rounded to float, the precision they store.
     */
    private static double atColumnPrecision(Column column, double value) {
        return column.kind() == ElementKind.FLOAT ? (float) value : value;
    }

    private static void requireEquality(Operator operator, String name) {
        if (!operator.isEquality()) {
            throw ColtabException.illegal("complex values have no ordering, " + operator.symbol()
                    + " not supported on " + name);
        }
    }

    private static void requireOperator(Operator operator) {
        if (operator == null) {
            throw ColtabException.nullInput("operator");
        }
    }

    private static Column requireNumericScalar(ColumnTable table, String name) {
        Column column = table.requireColumn(name);
        if (column.isArray()) {
            throw new ColtabException(ErrorCode.UNSUPPORTED_MODE, "array column not accepted here: " + name);
        }
        if (!column.kind().isNumeric()) {
            throw new ColtabException(ErrorCode.TYPE_MISMATCH, "column is not numeric: " + name);
        }
        return column;
    }

    private static Column requireString(ColumnTable table, String name) {
        Column column = table.requireColumn(name);
        if (column.isArray()) {
            throw new ColtabException(ErrorCode.UNSUPPORTED_MODE, "array column not accepted here: " + name);
        }
        if (column.kind() != ElementKind.STRING) {
            throw new ColtabException(ErrorCode.TYPE_MISMATCH, "column is not a string column: " + name);
        }
        return column;
    }

    private static void log(boolean and, String description, int count) {
        LOG.debug("{} {} -> {} selected", and ? "AND" : "OR", description, count);
    }
}
