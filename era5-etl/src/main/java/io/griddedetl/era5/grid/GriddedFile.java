package io.griddedetl.era5.grid;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/** An opened raw gridded file. */
public interface GriddedFile extends Closeable {
    /** Names of the data variables, coordinate and auxiliary variables excluded, in file order. */
    List<String> variableNames();

    GriddedVariable variable(String name) throws IOException;

    @Override
    default void close() throws IOException {}
}
