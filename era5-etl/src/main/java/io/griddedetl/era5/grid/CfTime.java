package io.griddedetl.era5.grid;

import io.griddedetl.era5.model.TimeNormalizer;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * CF-convention time axis, {@code "<unit> since <reference>"}, Gregorian calendar.
 */
public record CfTime(long unitSeconds, LocalDateTime reference) {
    private static final Pattern UNITS = Pattern.compile("^\\s*(\\w+)\\s+since\\s+(.+?)\\s*$", Pattern.CASE_INSENSITIVE);

    public static Optional<CfTime> parse(String units) {
        if (units == null) return Optional.empty();
        Matcher m = UNITS.matcher(units);
        if (!m.matches()) return Optional.empty();
        long seconds = switch (m.group(1).toLowerCase(Locale.ROOT)) {
            case "second", "seconds", "sec", "secs", "s" -> 1L;
            case "minute", "minutes", "min", "mins" -> 60L;
            case "hour", "hours", "hr", "hrs", "h" -> 3600L;
            case "day", "days", "d" -> 86400L;
            default -> -1L;
        };
        if (seconds < 0) return Optional.empty();
        String ref = m.group(2).replace(" UTC", "").replace(" utc", "");
        return TimeNormalizer.parse(ref).map(r -> new CfTime(seconds, r));
    }

    public LocalDateTime decode(double value) {
        return reference.plusSeconds(Math.round(value * unitSeconds));
    }

    public String label(double value) {
        return TimeNormalizer.format(decode(value));
    }
}
