package org.carball.plansampler.model;

import java.math.BigDecimal;

/**
 * Position in the statement history, taken from {@code timer_start}. The column is
 * an unsigned 64-bit counter so values are compared unsigned.
 */
public record Watermark(long value) implements Comparable<Watermark> {

    public static Watermark of(long value) {
        return new Watermark(value);
    }

    public static Watermark parse(String unsignedValue) {
        return new Watermark(Long.parseUnsignedLong(unsignedValue));
    }

    public boolean isAfter(Watermark other) {
        return compareTo(other) > 0;
    }

    public Watermark max(Watermark other) {
        return other == null || compareTo(other) >= 0 ? this : other;
    }

    public BigDecimal toBigDecimal() {
        return new BigDecimal(Long.toUnsignedString(value));
    }

    @Override
    public int compareTo(Watermark other) {
        return Long.compareUnsigned(value, other.value);
    }

    @Override
    public String toString() {
        return Long.toUnsignedString(value);
    }
}
