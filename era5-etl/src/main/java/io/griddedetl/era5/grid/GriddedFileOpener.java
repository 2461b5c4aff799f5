package io.griddedetl.era5.grid;

import java.io.IOException;
import java.nio.file.Path;

@FunctionalInterface
public interface GriddedFileOpener {
    GriddedFile open(Path file) throws IOException;
}
