package io.griddedetl.era5.extract;

import io.griddedetl.era5.grid.GriddedFile;
import io.griddedetl.era5.grid.GriddedFileOpener;
import io.griddedetl.era5.grid.GriddedVariable;
import io.griddedetl.era5.grid.Values;
import io.griddedetl.era5.model.KeyColumns;
import io.griddedetl.era5.model.UnitKey;
import io.griddedetl.era5.table.Column;
import io.griddedetl.era5.table.TableWriter;
import io.griddedetl.era5.table.Tables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decodes every selected variable of one raw gridded file into flat
 * (time, latitude, longitude, ..., value) tables under
 * {@code processed/<year>/<month>/<variable>/}, one file per window of time steps.
 * <p>
 * A variable that fails to decode is logged, its files for this raw file are removed, and the
 * remaining variables carry on.
 */
public class VariableExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(VariableExtractor.class);
    static final String VALUE_COLUMN = "value";

    private final GriddedFileOpener opener;
    private final ExtractOptions options;

    public VariableExtractor(GriddedFileOpener opener, ExtractOptions options) {
        this.opener = Objects.requireNonNull(opener, "opener");
        this.options = Objects.requireNonNull(options, "options");
    }

    public ExtractOptions options() { return options; }

    public ExtractResult extract(Path rawFile, UnitKey unit, Path processedRoot) throws DecodeException {
        try (GriddedFile file = open(rawFile)) {
            List<String> discovered = file.variableNames();
            List<String> selected = options.selection().apply(discovered);
            LOG.info("{}: {} variable(s) in file, {} selected", rawFile.getFileName(), discovered.size(), selected.size());

            Path unitDir = processedRoot.resolve(unit.yearString()).resolve(unit.monthString());
            List<String> extracted = new ArrayList<>();
            Map<String, String> failed = new LinkedHashMap<>();
            List<Path> written = new ArrayList<>();
            String source = sourceTag(rawFile);
            long rows = 0;
            for (String missing : options.selection().missingFrom(discovered)) {
                LOG.warn("{}: requested variable {} not present", rawFile.getFileName(), missing);
                failed.put(missing, "not present in file");
            }
            for (String name : selected) {
                List<Path> files = new ArrayList<>();
                try {
                    rows += extractVariable(file.variable(name), unit, source, unitDir.resolve(safeName(name)), files);
                    extracted.add(name);
                    written.addAll(files);
                    LOG.info("{}: extracted {} into {} file(s)", rawFile.getFileName(), name, files.size());
                } catch (Exception e) {
                    LOG.error("{}: failed to extract {}: {}", rawFile.getFileName(), name, e.toString());
                    failed.put(name, String.valueOf(e.getMessage()));
                    discard(files, unitDir.resolve(safeName(name)));
                }
            }
            if (extracted.isEmpty()) {
                throw new DecodeException(rawFile + ": no variable decoded" + (failed.isEmpty() ? "" : " " + failed.keySet()));
            }
            return new ExtractResult(rawFile, unit, extracted, failed, written, rows);
        } catch (IOException e) {
            throw new DecodeException("error closing " + rawFile, e);
        }
    }

    private GriddedFile open(Path rawFile) throws DecodeException {
        try {
            return opener.open(rawFile);
        } catch (IOException | RuntimeException e) {
            throw new DecodeException("cannot open " + rawFile + ": " + e.getMessage(), e);
        }
    }

    private long extractVariable(GriddedVariable var, UnitKey unit, String source, Path varDir, List<Path> written) throws IOException {
        List<String> dims = var.dimensions();
        int[] shape = var.shape();
        int timeDim = -1;
        for (int d = 0; d < dims.size() && timeDim < 0; d++) {
            if (KeyColumns.isTime(dims.get(d))) timeDim = d;
        }
        String[][] labels = new String[dims.size()][];
        for (int d = 0; d < dims.size(); d++) {
            labels[d] = var.coordinateLabels(d);
            boolean spatial = KeyColumns.isLatitude(dims.get(d)) || KeyColumns.isLongitude(dims.get(d));
            if (spatial && options.decimalPrecision() >= 0) {
                for (int i = 0; i < labels[d].length; i++) labels[d][i] = Values.round(labels[d][i], options.decimalPrecision());
            }
        }
        Map<String, String> scalars = var.scalarCoordinates();

        // several raw files of one unit share the variable directory
        String prefix = unit.compact() + "_" + safeName(var.name()) + "_" + source;
        String ext = options.encoding().extension();
        long rows = 0;
        if (timeDim < 0) {
            Path out = varDir.resolve(prefix + ext);
            rows += writeWindow(var, dims, shape, labels, scalars, -1, 0, 0, out);
            written.add(out);
            return rows;
        }
        int steps = shape[timeDim];
        if (steps == 0) throw new IOException(var.name() + ": empty time dimension");
        for (int start = 0; start < steps; start += options.timeChunkSize()) {
            int end = Math.min(start + options.timeChunkSize(), steps);
            Path out = varDir.resolve(prefix + "_chunk_" + start + "_" + end + ext);
            rows += writeWindow(var, dims, shape, labels, scalars, timeDim, start, end, out);
            written.add(out);
        }
        return rows;
    }

    private long writeWindow(GriddedVariable var, List<String> dims, int[] fullShape, String[][] labels,
                             Map<String, String> scalars, int timeDim, int start, int end, Path out) throws IOException {
        int[] shape = fullShape.clone();
        int[] offset = new int[shape.length];
        if (timeDim >= 0) {
            shape[timeDim] = end - start;
            offset[timeDim] = start;
        }
        double[] values = var.read(timeDim, start, end);
        long expected = 1;
        for (int n : shape) expected *= n;
        if (values.length != expected) {
            throw new IOException(var.name() + ": read " + values.length + " values, expected " + expected);
        }

        List<Column> columns = new ArrayList<>();
        List<Integer> keptDims = new ArrayList<>();
        for (int d = 0; d < dims.size(); d++) {
            String dim = dims.get(d);
            if (!KeyColumns.isKey(dim) && options.pruneConstantColumns() && isConstant(labels[d], offset[d], shape[d])) continue;
            keptDims.add(d);
            columns.add(d == timeDim || !numeric(labels[d]) ? Column.string(dim) : Column.number(dim));
        }
        List<String> keptScalars = new ArrayList<>();
        if (!options.pruneConstantColumns()) {
            for (String s : scalars.keySet()) {
                if (dims.contains(s) || s.equals(VALUE_COLUMN)) continue;
                keptScalars.add(s);
                columns.add(Column.string(s));
            }
        }
        columns.add(Column.number(VALUE_COLUMN));

        Files.createDirectories(out.getParent());
        Path part = out.resolveSibling(out.getFileName() + ".part");
        int[] index = new int[shape.length];
        try (TableWriter w = Tables.create(part, columns, options.encoding())) {
            for (double v : values) {
                String[] row = new String[columns.size()];
                int c = 0;
                for (int d : keptDims) row[c++] = labels[d][offset[d] + index[d]];
                for (String s : keptScalars) row[c++] = scalars.get(s);
                row[c] = Values.render(v, var.singlePrecision());
                w.write(row);
                advance(index, shape);
            }
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(part);
            throw e;
        }
        Tables.replace(part, out);
        return values.length;
    }

    private static void advance(int[] index, int[] shape) {
        for (int d = index.length - 1; d >= 0; d--) {
            if (++index[d] < shape[d]) return;
            index[d] = 0;
        }
    }

    private static boolean isConstant(String[] labels, int from, int length) {
        for (int i = from + 1; i < from + length; i++) {
            if (!Objects.equals(labels[i], labels[from])) return false;
        }
        return true;
    }

    private static boolean numeric(String[] labels) {
        for (String l : labels) {
            if (l == null) continue;
            try {
                Double.parseDouble(l);
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return true;
    }

    /** Removes only this file's outputs; the directory may be shared with a sibling raw file. */
    private static void discard(List<Path> files, Path varDir) {
        try {
            for (Path f : files) Files.deleteIfExists(f);
        } catch (IOException e) {
            LOG.warn("could not remove partial output under {}: {}", varDir, e.toString());
        }
    }

    /** Raw file name without its extension, reduced to characters safe in a file name. */
    static String sourceTag(Path rawFile) {
        String name = rawFile.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot > 0) name = name.substring(0, dot);
        return name.replaceAll("[^A-Za-z0-9_-]", "_");
    }

    static String safeName(String variable) {
        return variable.replace('/', '_').replace('\\', '_');
    }
}
