package io.griddedetl.era5.join;

import java.util.List;

/**
 * Outcome of resolving a variable's column roles. Only {@link Status#RESOLVED} carries a mapping.
 */
public record MappingResult(Status status, ColumnMapping mapping, List<String> candidates, String reason) {
    public enum Status { RESOLVED, AMBIGUOUS, UNRESOLVED }

    public MappingResult {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static MappingResult resolved(ColumnMapping mapping) {
        return new MappingResult(Status.RESOLVED, mapping, List.of(), null);
    }

    public static MappingResult ambiguous(List<String> candidates) {
        return new MappingResult(Status.AMBIGUOUS, null, candidates, "ambiguous value column, candidates " + candidates);
    }

    public static MappingResult unresolved(String reason) {
        return new MappingResult(Status.UNRESOLVED, null, List.of(), reason);
    }

    public boolean isResolved() {
        return status == Status.RESOLVED;
    }
}
