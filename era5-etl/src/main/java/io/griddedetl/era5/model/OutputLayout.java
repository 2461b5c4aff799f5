package io.griddedetl.era5.model;

import java.nio.file.Path;
import java.util.Objects;

/** Where every stage reads and writes under the output root. */
public record OutputLayout(Path root) {
    public OutputLayout {
        Objects.requireNonNull(root, "root");
    }

    public Path processed() { return root.resolve("processed"); }
    public Path joined() { return root.resolve("joined"); }
    public Path logs() { return root.resolve("logs"); }
    public Path unitIndex() { return root.resolve("unit-index.csv"); }
    public Path deadLetters() { return logs().resolve("failed_tasks.jsonl"); }

    public Path processedUnit(UnitKey key) {
        return processed().resolve(key.yearString()).resolve(key.monthString());
    }

    /** {@code joined/2021/joined_202105.<extension>} */
    public Path joinedFile(UnitKey key, String extension) {
        return joined().resolve(key.yearString()).resolve("joined_" + key.compact() + extension);
    }
}
