package io.griddedetl.era5.join;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Which column of a variable table plays each role of the join. */
public record ColumnMapping(String time, String latitude, String longitude, String value) {
    public ColumnMapping {
        Objects.requireNonNull(time, "time");
        Objects.requireNonNull(latitude, "latitude");
        Objects.requireNonNull(longitude, "longitude");
        Objects.requireNonNull(value, "value");
    }

    public List<String> columns() {
        return List.of(time, latitude, longitude, value);
    }

    /** Whether the four names are non-blank and pairwise distinct. */
    public boolean isWellFormed() {
        return columns().stream().noneMatch(String::isBlank) && Set.copyOf(columns()).size() == 4;
    }

    public boolean isSatisfiedBy(List<String> tableColumns) {
        return tableColumns.containsAll(columns());
    }
}
