package io.griddedetl.era5.orchestrate;

import io.griddedetl.era5.model.UnitKey;

/** Processed data of a joined unit that could not be removed. Recorded, never thrown. */
public record CleanupWarning(UnitKey unit, String message) {}
