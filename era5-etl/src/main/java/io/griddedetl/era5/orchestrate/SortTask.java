package io.griddedetl.era5.orchestrate;

import io.griddedetl.era5.model.UnitKey;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tables sorted one after another by a single worker.
 *
 * @param units the unit owning each file, by position; null entries for files outside any unit
 */
public record SortTask(List<UnitKey> units, List<Path> files) implements StageTask {
    public SortTask {
        if (units.size() != files.size()) throw new IllegalArgumentException("units and files differ in length");
        files = List.copyOf(files);
        units = Collections.unmodifiableList(new ArrayList<>(units));
    }

    @Override
    public String id() {
        UnitKey first = units.isEmpty() ? null : units.get(0);
        String head = first != null
                ? "sort_" + first.yearString() + "_" + first.monthString()
                : "sort_" + (files.isEmpty() ? "none" : files.get(0).getFileName().toString());
        return files.size() > 1 ? head + "_and_" + (files.size() - 1) + "_more" : head;
    }
}
