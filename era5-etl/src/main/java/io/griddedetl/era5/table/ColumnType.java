package io.griddedetl.era5.table;

public enum ColumnType {
    STRING,
    DOUBLE
}
