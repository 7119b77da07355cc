package io.coltab.core;

/**
 * Unchecked failure of a table operation, tagged with an {@link ErrorCode}.
 */
public class ColtabException extends RuntimeException {

    private final ErrorCode code;

    public ColtabException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ColtabException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }

    public static ColtabException nullInput(String what) {
        return new ColtabException(ErrorCode.NULL_INPUT, what + " required");
    }

    public static ColtabException columnNotFound(String name) {
        return new ColtabException(ErrorCode.DATA_NOT_FOUND, "column not found: " + name);
    }

    public static ColtabException outOfRange(String what, long value) {
        return new ColtabException(ErrorCode.ACCESS_OUT_OF_RANGE, what + " out of range: " + value);
    }

    public static ColtabException illegal(String message) {
        return new ColtabException(ErrorCode.ILLEGAL_INPUT, message);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + code + "]: " + getMessage();
    }
}
