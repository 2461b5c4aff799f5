package io.griddedetl.era5.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/** Known names of the coordinate-key columns and of metadata columns that never carry a value. */
public final class KeyColumns {
    public static final List<String> TIME = List.of("time", "time1", "time2", "valid_time");
    public static final List<String> LATITUDE = List.of("latitude", "lat");
    public static final List<String> LONGITUDE = List.of("longitude", "lon");
    public static final Set<String> METADATA = Set.of("number", "step", "surface", "valid_time", "level", "time1", "time2");

    private KeyColumns() {}

    /** First column matching the known names, trying names in preference order. Case-insensitive. */
    public static Optional<String> find(List<String> columns, List<String> knownNames) {
        for (String known : knownNames) {
            for (String c : columns) {
                if (c != null && c.equalsIgnoreCase(known)) return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    public static boolean isTime(String column) { return contains(TIME, column); }
    public static boolean isLatitude(String column) { return contains(LATITUDE, column); }
    public static boolean isLongitude(String column) { return contains(LONGITUDE, column); }

    public static boolean isKey(String column) {
        return isTime(column) || isLatitude(column) || isLongitude(column);
    }

    public static boolean isMetadata(String column) {
        return column != null && METADATA.contains(column.toLowerCase(Locale.ROOT));
    }

    private static boolean contains(List<String> names, String column) {
        return column != null && names.contains(column.toLowerCase(Locale.ROOT));
    }
}
