package io.griddedetl.era5.orchestrate;

import io.griddedetl.era5.model.UnitKey;
import io.griddedetl.era5.sort.SortResult;

import java.nio.file.Path;

/** Per-file result of a sort task; exactly one of {@code result} and {@code error} is set. */
public record SortOutcome(UnitKey unit, Path file, SortResult result, String error) {
    public static SortOutcome sorted(UnitKey unit, SortResult result) {
        return new SortOutcome(unit, result.file(), result, null);
    }

    public static SortOutcome failed(UnitKey unit, Path file, String error) {
        return new SortOutcome(unit, file, null, error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
