package io.coltab.storage;

import io.coltab.core.ColtabException;
import io.coltab.core.ElementKind;
import io.coltab.core.ErrorCode;
import io.coltab.kernel.Column;

import java.lang.reflect.Array;

/**
 * Factory for heap columns.
 * <p>
 * Created columns start with every element invalid. Wrapped columns adopt the caller's array
 * without copying: numeric elements start valid, string elements are valid where non-null.
 */
public final class Columns {

    private Columns() {
    }

    public static HeapColumn create(String name, ElementKind kind, int length) {
        validate(name, kind, length);
        Object data = Buffers.allocate(kind.componentType(), kind.slotsPerElement(), length);
        return new HeapColumn(name, kind, 0, data, Validity.allInvalid(length));
    }

    public static HeapColumn createArray(String name, ElementKind kind, int depth, int length) {
        validate(name, kind, length);
        if (depth < 1) {
            throw ColtabException.illegal("depth must be positive: " + depth);
        }
        return new HeapColumn(name, kind, depth, new Column[length], Validity.allInvalid(length));
    }

    /**
     * Scalar column of the given kind, or an array column when {@code depth > 0}.
     */
    public static HeapColumn create(String name, ElementKind kind, int depth, int length) {
        return depth > 0 ? createArray(name, kind, depth, length) : create(name, kind, length);
    }

    /**
     * Column with the name, kind, depth, unit, format and dimensions of a model column,
     * every element invalid.
     */
    public static HeapColumn structureOf(Column model, int length) {
        HeapColumn column = create(model.name(), model.kind(), model.depth(), length);
        column.setUnit(model.unit());
        column.setFormat(model.format());
        if (model.isArray()) {
            column.setDimensions(model.dimensions());
        }
        return column;
    }

    /**
     * Adopt caller-owned storage. The array's component type must be the kind's
     * {@link ElementKind#componentType()}; complex kinds take interleaved re/im pairs.
     */
    public static HeapColumn wrap(String name, ElementKind kind, Object data) {
        if (data == null) {
            throw ColtabException.nullInput("data");
        }
        if (kind == null) {
            throw ColtabException.nullInput("kind");
        }
        Class<?> componentType = data.getClass().getComponentType();
        if (componentType != kind.componentType()) {
            throw new ColtabException(ErrorCode.TYPE_MISMATCH,
                    "cannot wrap " + data.getClass().getSimpleName() + " as " + kind);
        }
        int slots = kind.slotsPerElement();
        int arrayLength = Array.getLength(data);
        if (arrayLength % slots != 0) {
            throw ColtabException.illegal("interleaved complex data needs an even length: " + arrayLength);
        }
        int length = arrayLength / slots;
        validate(name, kind, length);
        Validity validity = Validity.allValid(length);
        if (kind == ElementKind.STRING) {
            String[] strings = (String[]) data;
            for (int row = 0; row < length; row++) {
                if (strings[row] == null) {
                    validity.setInvalid(row);
                }
            }
        }
        return new HeapColumn(name, kind, 0, data, validity);
    }

    public static HeapColumn wrap(String name, int[] data) {
        return wrap(name, ElementKind.INT, data);
    }

    public static HeapColumn wrap(String name, long[] data) {
        return wrap(name, ElementKind.LONG, data);
    }

    public static HeapColumn wrap(String name, float[] data) {
        return wrap(name, ElementKind.FLOAT, data);
    }

    public static HeapColumn wrap(String name, double[] data) {
        return wrap(name, ElementKind.DOUBLE, data);
    }

    public static HeapColumn wrap(String name, String[] data) {
        return wrap(name, ElementKind.STRING, data);
    }

    private static void validate(String name, ElementKind kind, int length) {
        if (name == null) {
            throw ColtabException.nullInput("name");
        }
        if (kind == null) {
            throw ColtabException.nullInput("kind");
        }
        if (length < 0) {
            throw ColtabException.illegal("length must be non-negative: " + length);
        }
    }
}
