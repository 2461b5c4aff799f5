package io.griddedetl.era5.extract;

import io.griddedetl.era5.model.UnitKey;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of extracting one raw file.
 *
 * @param failed variable name to failure message
 */
public record ExtractResult(Path rawFile, UnitKey unit, List<String> extracted, Map<String, String> failed,
                            List<Path> written, long rows) {
    public ExtractResult {
        extracted = List.copyOf(extracted);
        failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
        written = List.copyOf(written);
    }
}
