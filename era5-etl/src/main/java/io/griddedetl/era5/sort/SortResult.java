package io.griddedetl.era5.sort;

import java.nio.file.Path;

/**
 * @param temporal whether time was ordered as timestamps rather than as raw text
 */
public record SortResult(Path file, long rows, boolean temporal, Path backup, long elapsedMillis) {}
