package io.griddedetl.era5.model;

import java.util.Comparator;

/**
 * The (year, month) a processing unit covers. Orders chronologically.
 */
public record UnitKey(int year, int month) implements Comparable<UnitKey> {
    private static final Comparator<UnitKey> ORDER =
            Comparator.comparingInt(UnitKey::year).thenComparingInt(UnitKey::month);

    public UnitKey {
        if (month < 1 || month > 12) throw new IllegalArgumentException("month out of range: " + month);
        if (year < 0 || year > 9999) throw new IllegalArgumentException("year out of range: " + year);
    }

    public static UnitKey of(int year, int month) {
        return new UnitKey(year, month);
    }

    /** {@code 2021} -> "2021". */
    public String yearString() { return String.format("%04d", year); }

    /** {@code 5} -> "05". */
    public String monthString() { return String.format("%02d", month); }

    /** "202105". */
    public String compact() { return yearString() + monthString(); }

    @Override
    public int compareTo(UnitKey o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return yearString() + "-" + monthString();
    }
}
