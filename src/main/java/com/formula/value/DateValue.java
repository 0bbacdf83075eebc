package com.formula.value;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Date and time, without time zone. Converted to numbers as seconds since the epoch in UTC.
 *
 * @param value Date
 */
public record DateValue(LocalDateTime value) implements ScalarValue {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final LocalDateTime EPOCH = LocalDateTime.of(1970, 1, 1, 0, 0);

    public DateValue {
        Objects.requireNonNull(value, "date");
    }

    @Override
    public ScalarValue toNumber() {
        return new NumberValue(value.toEpochSecond(ZoneOffset.UTC));
    }

    @Override
    public TextValue toText() {
        return new TextValue(FORMAT.format(value));
    }

    @Override
    public ScalarValue toBool() {
        return BooleanValue.of(!value.equals(EPOCH));
    }

    @Override
    public boolean equal(ScalarValue other) {
        if (other instanceof DateValue d) {
            return value.equals(d.value);
        }
        throw incompatible(other);
    }

    @Override
    public boolean less(ScalarValue other) {
        if (other instanceof DateValue d) {
            return value.isBefore(d.value);
        }
        throw incompatible(other);
    }

    @Override
    public String typeName() {
        return "date";
    }

    @Override
    public String toString() {
        return FORMAT.format(value);
    }
}
