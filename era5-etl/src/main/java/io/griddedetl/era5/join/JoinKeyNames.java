package io.griddedetl.era5.join;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Output names of the key columns: for each role, the name most variables use. Ties go to the
 * name seen first.
 */
public record JoinKeyNames(String time, String latitude, String longitude) {
    public static final JoinKeyNames DEFAULT = new JoinKeyNames("time", "latitude", "longitude");

    public static JoinKeyNames plurality(Collection<ColumnMapping> mappings) {
        if (mappings.isEmpty()) return DEFAULT;
        return new JoinKeyNames(
                mostCommon(mappings, ColumnMapping::time),
                mostCommon(mappings, ColumnMapping::latitude),
                mostCommon(mappings, ColumnMapping::longitude));
    }

    private static String mostCommon(Collection<ColumnMapping> mappings, Function<ColumnMapping, String> role) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (ColumnMapping m : mappings) counts.merge(role.apply(m), 1, Integer::sum);
        String best = null;
        int bestCount = 0;
        for (var e : counts.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }
}
