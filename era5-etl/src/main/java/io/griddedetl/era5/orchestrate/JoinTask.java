package io.griddedetl.era5.orchestrate;

import io.griddedetl.era5.model.UnitKey;

import java.nio.file.Path;

public record JoinTask(UnitKey unit, Path output) implements StageTask {
    @Override
    public String id() {
        return "join_" + unit.yearString() + "_" + unit.monthString();
    }
}
