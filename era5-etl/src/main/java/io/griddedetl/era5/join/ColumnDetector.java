package io.griddedetl.era5.join;

import io.griddedetl.era5.model.KeyColumns;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Guesses the column roles of an unregistered variable table from its header. Never picks a
 * value column when more than one could qualify.
 */
public class ColumnDetector {

    public MappingResult detect(String variable, List<String> columns) {
        Optional<String> time = KeyColumns.find(columns, KeyColumns.TIME);
        Optional<String> lat = KeyColumns.find(columns, KeyColumns.LATITUDE);
        Optional<String> lon = KeyColumns.find(columns, KeyColumns.LONGITUDE);
        if (time.isEmpty()) return MappingResult.unresolved("no time column in " + columns);
        if (lat.isEmpty()) return MappingResult.unresolved("no latitude column in " + columns);
        if (lon.isEmpty()) return MappingResult.unresolved("no longitude column in " + columns);
        List<String> keys = List.of(time.get(), lat.get(), lon.get());

        for (String candidate : valueNames(variable)) {
            if (columns.contains(candidate) && !keys.contains(candidate)) {
                return MappingResult.resolved(new ColumnMapping(time.get(), lat.get(), lon.get(), candidate));
            }
        }
        List<String> remaining = new ArrayList<>();
        for (String c : columns) {
            if (keys.contains(c) || KeyColumns.isKey(c) || KeyColumns.isMetadata(c)) continue;
            remaining.add(c);
        }
        if (remaining.size() == 1) {
            return MappingResult.resolved(new ColumnMapping(time.get(), lat.get(), lon.get(), remaining.get(0)));
        }
        if (remaining.isEmpty()) return MappingResult.unresolved("no value column in " + columns);
        return MappingResult.ambiguous(remaining);
    }

    /** "value", the name, lower-cased, with an "m" suffix ({@code 2t} -> {@code 2tm}), reversed ({@code 2t} -> {@code t2}). */
    static List<String> valueNames(String variable) {
        List<String> names = new ArrayList<>();
        names.add("value");
        names.add(variable);
        names.add(variable.toLowerCase(Locale.ROOT));
        names.add(variable + "m");
        names.add(new StringBuilder(variable).reverse().toString());
        return names;
    }
}
