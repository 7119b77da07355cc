package io.coltab.table;

import io.coltab.core.ColtabException;
import io.coltab.core.Complex;
import io.coltab.core.ErrorCode;
import io.coltab.kernel.Column;

import java.util.Arrays;

/**
 * Statistics over the valid elements of a numeric scalar column.
 */
final class ColumnStatistics {

    private ColumnStatistics() {
    }

    static double max(Column column) {
        return column.getDouble(maxPos(column));
    }

    static double min(Column column) {
        return column.getDouble(minPos(column));
    }

    /**
     * Row of the first largest valid element.
     */
    static int maxPos(Column column) {
        requireReal(column);
        int best = -1;
        for (int row = 0; row < column.length(); row++) {
            if (column.isValid(row) && (best < 0 || column.getDouble(row) > column.getDouble(best))) {
                best = row;
            }
        }
        return requireFound(column, best);
    }

    /**
     * Row of the first smallest valid element.
     */
    static int minPos(Column column) {
        requireReal(column);
        int best = -1;
        for (int row = 0; row < column.length(); row++) {
            if (column.isValid(row) && (best < 0 || column.getDouble(row) < column.getDouble(best))) {
                best = row;
            }
        }
        return requireFound(column, best);
    }

    static double mean(Column column) {
        requireReal(column);
        double sum = 0.0;
        int count = 0;
        for (int row = 0; row < column.length(); row++) {
            if (column.isValid(row)) {
                sum += column.getDouble(row);
                count++;
            }
        }
        requireFound(column, count - 1);
        return sum / count;
    }

    static Complex meanComplex(Column column) {
        requireNumeric(column);
        double re = 0.0;
        double im = 0.0;
        int count = 0;
        for (int row = 0; row < column.length(); row++) {
            if (column.isValid(row)) {
                Complex value = column.getComplex(row);
                re += value.re();
                im += value.im();
                count++;
            }
        }
        requireFound(column, count - 1);
        return new Complex(re / count, im / count);
    }

    /**
     * Middle valid value; the mean of the two middle values for an even count.
     */
    static double median(Column column) {
        requireReal(column);
        double[] values = compactValid(column);
        requireFound(column, values.length - 1);
        Arrays.sort(values);
        int middle = values.length / 2;
        if (values.length % 2 == 1) {
            return values[middle];
        }
        return (values[middle - 1] + values[middle]) / 2.0;
    }

    /**
     * Sample standard deviation (n - 1 denominator); needs two valid elements.
     */
    static double stdev(Column column) {
        requireReal(column);
        double[] values = compactValid(column);
        requireFound(column, values.length - 1);
        if (values.length < 2) {
            throw ColtabException.illegal("standard deviation needs at least two valid elements in " + column.name());
        }
        double mean = 0.0;
        for (double value : values) {
            mean += value;
        }
        mean /= values.length;
        double squares = 0.0;
        for (double value : values) {
            double delta = value - mean;
            squares += delta * delta;
        }
        return Math.sqrt(squares / (values.length - 1));
    }

    private static double[] compactValid(Column column) {
        double[] values = new double[column.length() - column.countInvalid()];
        int index = 0;
        for (int row = 0; row < column.length(); row++) {
            if (column.isValid(row)) {
                values[index++] = column.getDouble(row);
            }
        }
        return values;
    }

    private static int requireFound(Column column, int position) {
        if (position < 0) {
            throw new ColtabException(ErrorCode.DATA_NOT_FOUND, "no valid element in column " + column.name());
        }
        return position;
    }

    private static void requireNumeric(Column column) {
        if (column.isArray()) {
            throw new ColtabException(ErrorCode.UNSUPPORTED_MODE, "array column not accepted here: " + column.name());
        }
        if (!column.kind().isNumeric()) {
            throw new ColtabException(ErrorCode.INVALID_TYPE, "column is not numeric: " + column.name());
        }
    }

    private static void requireReal(Column column) {
        requireNumeric(column);
        if (column.kind().isComplex()) {
            throw new ColtabException(ErrorCode.INVALID_TYPE, "complex column not accepted here: " + column.name());
        }
    }
}
