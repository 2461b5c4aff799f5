package io.griddedetl.era5.orchestrate;

import io.griddedetl.era5.model.UnitKey;

import java.nio.file.Path;

public record DiscoveredFile(Path path, UnitKey unit) {}
