package io.griddedetl.era5.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a processing unit. Only the orchestrator moves a unit between states.
 */
public enum UnitState {
    DISCOVERED,
    EXTRACTING,
    EXTRACTED,
    EXTRACT_FAILED,
    JOINING,
    JOINED,
    JOIN_FAILED,
    CLEANED,
    SORTED,
    SORT_FAILED;

    /** States whose joined output exists and may be sorted. */
    public boolean hasJoinedOutput() {
        return this == JOINED || this == CLEANED || this == SORTED || this == SORT_FAILED;
    }

    public boolean isFailure() {
        return this == EXTRACT_FAILED || this == JOIN_FAILED || this == SORT_FAILED;
    }

    public boolean canTransitionTo(UnitState next) {
        return successors().contains(next);
    }

    private Set<UnitState> successors() {
        return switch (this) {
            case DISCOVERED -> EnumSet.of(EXTRACTING);
            case EXTRACTING -> EnumSet.of(EXTRACTED, EXTRACT_FAILED);
            case EXTRACTED -> EnumSet.of(JOINING);
            case JOINING -> EnumSet.of(JOINED, JOIN_FAILED);
            // sorting a cleaned unit's output is allowed; so is sorting a unit kept uncleaned
            case JOINED -> EnumSet.of(CLEANED, SORTED, SORT_FAILED);
            case CLEANED -> EnumSet.of(SORTED, SORT_FAILED);
            default -> EnumSet.noneOf(UnitState.class);
        };
    }
}
