package io.coltab.core;

/**
 * Element kinds a column can hold.
 * <p>
 * Each kind maps to one Java primitive (or reference) array that backs the column:
 * <pre>
 * BOOLEAN        boolean[]
 * BYTE           byte[]
 * UNSIGNED_BYTE  byte[]   (read back as 0..255)
 * SHORT          short[]
 * INT            int[]
 * LONG           long[]
 * FLOAT          float[]
 * DOUBLE         double[]
 * FLOAT_COMPLEX  float[]  (interleaved re, im)
 * DOUBLE_COMPLEX double[] (interleaved re, im)
 * STRING         String[]
 * </pre>
 * Array columns keep the element kind and report a depth of one or more.
 */
public enum ElementKind {
    BOOLEAN(boolean.class, 1),
    BYTE(byte.class, 1),
    UNSIGNED_BYTE(byte.class, 1),
    SHORT(short.class, 1),
    INT(int.class, 1),
    LONG(long.class, 1),
    FLOAT(float.class, 1),
    DOUBLE(double.class, 1),
    FLOAT_COMPLEX(float.class, 2),
    DOUBLE_COMPLEX(double.class, 2),
    STRING(String.class, 1);

    private final Class<?> componentType;
    private final int slotsPerElement;

    ElementKind(Class<?> componentType, int slotsPerElement) {
        this.componentType = componentType;
        this.slotsPerElement = slotsPerElement;
    }

    /**
     * Component type of the backing array.
     */
    public Class<?> componentType() {
        return componentType;
    }

    /**
     * Backing array slots used by one element (2 for complex kinds).
     */
    public int slotsPerElement() {
        return slotsPerElement;
    }

    public boolean isIntegral() {
        return switch (this) {
            case BOOLEAN, BYTE, UNSIGNED_BYTE, SHORT, INT, LONG -> true;
            default -> false;
        };
    }

    public boolean isReal() {
        return this == FLOAT || this == DOUBLE;
    }

    public boolean isComplex() {
        return this == FLOAT_COMPLEX || this == DOUBLE_COMPLEX;
    }

    /**
     * Integral, real or complex.
     */
    public boolean isNumeric() {
        return this != STRING;
    }

    /**
     * Real counterpart of a complex kind, or the kind itself.
     */
    public ElementKind realPart() {
        return switch (this) {
            case FLOAT_COMPLEX -> FLOAT;
            case DOUBLE_COMPLEX -> DOUBLE;
            default -> this;
        };
    }

    /**
     * Complex counterpart of a real kind; integral kinds map to {@link #DOUBLE_COMPLEX}.
     */
    public ElementKind complexCounterpart() {
        return switch (this) {
            case FLOAT, FLOAT_COMPLEX -> FLOAT_COMPLEX;
            case STRING -> throw new ColtabException(ErrorCode.INVALID_TYPE, "string has no complex counterpart");
            default -> DOUBLE_COMPLEX;
        };
    }

    /**
     * Narrow a widened integral value to this kind's width.
     */
    public long narrow(long value) {
        return switch (this) {
            case BOOLEAN -> value != 0 ? 1L : 0L;
            case BYTE -> (byte) value;
            case UNSIGNED_BYTE -> value & 0xFFL;
            case SHORT -> (short) value;
            case INT -> (int) value;
            case LONG -> value;
            default -> throw new IllegalStateException("not integral: " + this);
        };
    }

    /**
     * Convert a real value to this integral kind the way a C cast would (truncation toward zero).
     */
    public long truncate(double value) {
        if (this == BOOLEAN) {
            return value != 0.0 ? 1L : 0L;
        }
        return narrow((long) value);
    }
}
