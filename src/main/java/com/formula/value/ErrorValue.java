package com.formula.value;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * In-language error such as {@code #DIV/0!}.
 * <p>
 * Errors flow through formulas like any other value: converting an error gives the error back.
 *
 * @param code Error code
 */
public record ErrorValue(ErrorCode code) implements ScalarValue {

    private static final Map<ErrorCode, ErrorValue> CACHE = new EnumMap<>(ErrorCode.class);

    static {
        for (ErrorCode code : ErrorCode.values()) {
            CACHE.put(code, new ErrorValue(code));
        }
    }

    public ErrorValue {
        Objects.requireNonNull(code, "code");
    }

    public static ErrorValue of(ErrorCode code) {
        return CACHE.get(code);
    }

    @Override
    public ValueKind kind() {
        return ValueKind.ERROR;
    }

    @Override
    public ScalarValue toNumber() {
        return this;
    }

    @Override
    public TextValue toText() {
        return new TextValue(code.getCode());
    }

    @Override
    public ScalarValue toBool() {
        return this;
    }

    @Override
    public boolean equal(ScalarValue other) {
        if (other instanceof ErrorValue e) {
            return code == e.code;
        }
        throw incompatible(other);
    }

    @Override
    public boolean less(ScalarValue other) {
        throw incompatible(other);
    }

    @Override
    public String typeName() {
        return "error";
    }

    @Override
    public String toString() {
        return code.getCode();
    }
}
