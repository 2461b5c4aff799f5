package io.griddedetl.era5.orchestrate;

import io.griddedetl.era5.model.UnitKey;

import java.util.List;

/**
 * End-of-run counts. Stage counts are per processing unit.
 *
 * @param skippedFiles raw files with no derivable (year, month)
 * @param resumed      units whose join was taken from a previous run
 */
public record RunSummary(int rawFiles,
                         int skippedFiles,
                         int units,
                         int resumed,
                         StageCount extract,
                         StageCount join,
                         StageCount sort,
                         int cleaned,
                         List<CleanupWarning> cleanupWarnings,
                         int failedBatches,
                         List<UnitKey> failedUnits,
                         long elapsedMillis) {
    public RunSummary {
        cleanupWarnings = List.copyOf(cleanupWarnings);
        failedUnits = List.copyOf(failedUnits);
    }

    public boolean hasFailures() {
        return extract.failed() > 0 || join.failed() > 0 || sort.failed() > 0 || failedBatches > 0;
    }

    public int exitCode() {
        return hasFailures() ? 1 : 0;
    }

    public String describe() {
        return String.format(
                "files=%d (skipped %d), units=%d (resumed %d), extract %d ok/%d failed, join %d ok/%d failed, "
                        + "sort %d ok/%d failed, cleaned=%d, cleanup warnings=%d, failed batches=%d, %.1fs",
                rawFiles, skippedFiles, units, resumed, extract.succeeded(), extract.failed(),
                join.succeeded(), join.failed(), sort.succeeded(), sort.failed(), cleaned,
                cleanupWarnings.size(), failedBatches, elapsedMillis / 1000.0);
    }
}
