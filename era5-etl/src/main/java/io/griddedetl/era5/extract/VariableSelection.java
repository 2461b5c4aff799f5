package io.griddedetl.era5.extract;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Which variables a stage works on. A non-empty include list wins over the exclude set.
 */
public record VariableSelection(List<String> include, Set<String> exclude) {
    public static final Set<String> DEFAULT_EXCLUDES = Set.of("10fg", "cbh", "cin", "cp", "i10fg", "lsp", "tp", "vimd");

    public VariableSelection {
        include = include == null ? List.of() : List.copyOf(include);
        exclude = exclude == null ? Set.of() : Set.copyOf(exclude);
    }

    public static VariableSelection all() {
        return new VariableSelection(List.of(), Set.of());
    }

    public static VariableSelection defaults() {
        return new VariableSelection(List.of(), DEFAULT_EXCLUDES);
    }

    public boolean accepts(String variable) {
        if (!include.isEmpty()) return include.contains(variable);
        return !exclude.contains(variable);
    }

    /** Accepted names in their discovered order. */
    public List<String> apply(List<String> discovered) {
        List<String> out = new ArrayList<>();
        for (String v : discovered) if (accepts(v)) out.add(v);
        return out;
    }

    /** Included names that were not discovered. */
    public List<String> missingFrom(List<String> discovered) {
        Set<String> missing = new LinkedHashSet<>(include);
        discovered.forEach(missing::remove);
        return List.copyOf(missing);
    }
}
