package io.griddedetl.era5.config;

import io.griddedetl.era5.table.TableFormat;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;

import java.nio.file.Path;
import java.util.List;

/** Environment-independent configuration for tests: CSV output, two workers, no delays. */
public final class TestConfigs {
    private TestConfigs() {}

    public static EtlConfig csv(Path input, Path output) {
        return new EtlConfig(input, output, List.of(), List.of(), 4, TableFormat.CSV, false,
                CompressionCodecName.SNAPPY, 24, false, 1000, 1000, 2, 2, 1, 2, 0, 10, 0,
                false, false, 1000, false, 1, null, null, null, false);
    }
}
