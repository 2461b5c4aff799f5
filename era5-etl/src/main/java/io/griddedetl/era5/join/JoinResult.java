package io.griddedetl.era5.join;

import io.griddedetl.era5.model.UnitKey;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @param skipped variables left out of the joined table, with the reason
 */
public record JoinResult(UnitKey unit, Path output, long rows, JoinKeyNames keys, List<String> joined,
                         Map<String, String> skipped) {
    public JoinResult {
        joined = List.copyOf(joined);
        skipped = Collections.unmodifiableMap(new LinkedHashMap<>(skipped));
    }
}
