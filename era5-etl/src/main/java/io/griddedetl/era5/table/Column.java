package io.griddedetl.era5.table;

import java.util.List;
import java.util.Objects;

public record Column(String name, ColumnType type) {
    public Column {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public static Column string(String name) { return new Column(name, ColumnType.STRING); }
    public static Column number(String name) { return new Column(name, ColumnType.DOUBLE); }

    public static List<String> names(List<Column> columns) {
        return columns.stream().map(Column::name).toList();
    }
}
