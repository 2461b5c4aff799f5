package io.griddedetl.era5.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One (year, month) unit of work: its raw files, its lifecycle state and the joined output it owns.
 * Mutated only by the orchestrator thread.
 */
public final class ProcessingUnit {
    private final UnitKey key;
    private final List<Path> rawFiles = new ArrayList<>();
    private UnitState state = UnitState.DISCOVERED;
    private Path joinedFile;
    private String failure;

    public ProcessingUnit(UnitKey key) {
        this.key = Objects.requireNonNull(key, "key");
    }

    public UnitKey key() { return key; }
    public List<Path> rawFiles() { return List.copyOf(rawFiles); }
    public UnitState state() { return state; }
    public Path joinedFile() { return joinedFile; }
    public String failure() { return failure; }

    public void addRawFile(Path file) {
        rawFiles.add(Objects.requireNonNull(file));
    }

    public void moveTo(UnitState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(key + ": illegal transition " + state + " -> " + next);
        }
        state = next;
    }

    public void fail(UnitState failedState, String reason) {
        moveTo(failedState);
        this.failure = reason;
    }

    /** Re-enter a state recorded by a previous run. */
    public void restore(UnitState recorded, Path joined) {
        this.state = Objects.requireNonNull(recorded);
        this.joinedFile = joined;
    }

    public void joinedFile(Path joined) {
        this.joinedFile = joined;
    }

    @Override
    public String toString() {
        return "ProcessingUnit[" + key + ", " + state + ", files=" + rawFiles.size() + "]";
    }
}
