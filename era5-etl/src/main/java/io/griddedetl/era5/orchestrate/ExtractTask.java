package io.griddedetl.era5.orchestrate;

import io.griddedetl.era5.model.UnitKey;

import java.nio.file.Path;

public record ExtractTask(UnitKey unit, Path file) implements StageTask {
    @Override
    public String id() {
        return "extract_" + unit.yearString() + "_" + unit.monthString() + "_" + file.getFileName();
    }
}
