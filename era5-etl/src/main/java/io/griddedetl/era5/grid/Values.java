package io.griddedetl.era5.grid;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class Values {
    private Values() {}

    /** Text form of a decoded value; null for NaN. Floats render without double-widening noise. */
    public static String render(double d, boolean single) {
        if (Double.isNaN(d)) return null;
        return single ? Float.toString((float) d) : Double.toString(d);
    }

    /** Rounds half-even to {@code places} decimals; non-numeric labels pass through. */
    public static String round(String label, int places) {
        if (label == null || places < 0) return label;
        double d;
        try {
            d = Double.parseDouble(label);
        } catch (NumberFormatException e) {
            return label;
        }
        if (Double.isNaN(d) || Double.isInfinite(d)) return label;
        double r = new BigDecimal(label.trim()).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
        return plain(r);
    }

    /** Decimal text without exponent: {@code 1.0E-4} becomes {@code 0.0001}. */
    public static String plain(double d) {
        String s = Double.toString(d);
        if (s.indexOf('E') < 0) return s;
        String p = BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        return p.indexOf('.') < 0 ? p + ".0" : p;
    }
}
