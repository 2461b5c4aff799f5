package io.griddedetl.era5.grid;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Gridded file held in memory, for tests that should not depend on NetCDF fixtures. */
public final class InMemoryGriddedFile implements GriddedFile {
    private final Map<String, Var> variables = new LinkedHashMap<>();
    private boolean closed;

    public InMemoryGriddedFile add(Var v) {
        variables.put(v.name(), v);
        return this;
    }

    public boolean closed() { return closed; }

    @Override
    public List<String> variableNames() {
        return List.copyOf(variables.keySet());
    }

    @Override
    public GriddedVariable variable(String name) throws IOException {
        Var v = variables.get(name);
        if (v == null) throw new IOException("no variable " + name);
        return v;
    }

    @Override
    public void close() {
        closed = true;
    }

    /** (time, latitude, longitude) variable whose value is {@code f(t, lat, lon)} on indices. */
    public static Var grid(String name, String[] times, String[] lats, String[] lons, Cell f) {
        int n = times.length * lats.length * lons.length;
        double[] values = new double[n];
        int i = 0;
        for (int t = 0; t < times.length; t++) {
            for (int la = 0; la < lats.length; la++) {
                for (int lo = 0; lo < lons.length; lo++) values[i++] = f.value(t, la, lo);
            }
        }
        return new Var(name, List.of("time", "latitude", "longitude"), new String[][]{times, lats, lons}, values);
    }

    @FunctionalInterface
    public interface Cell {
        double value(int t, int lat, int lon);
    }

    public static final class Var implements GriddedVariable {
        private final String name;
        private final List<String> dims;
        private final String[][] labels;
        private final double[] values;
        private final Map<String, String> scalars = new LinkedHashMap<>();
        private boolean single;
        private String failure;

        public Var(String name, List<String> dims, String[][] labels, double[] values) {
            this.name = name;
            this.dims = List.copyOf(dims);
            this.labels = labels;
            this.values = values;
        }

        /** Every read fails with {@code message}. */
        public Var failing(String message) {
            this.failure = message;
            return this;
        }

        public Var single() {
            this.single = true;
            return this;
        }

        public Var scalar(String name, String value) {
            scalars.put(name, value);
            return this;
        }

        @Override
        public String name() { return name; }

        @Override
        public List<String> dimensions() { return dims; }

        @Override
        public int[] shape() {
            int[] s = new int[labels.length];
            for (int d = 0; d < s.length; d++) s[d] = labels[d].length;
            return s;
        }

        @Override
        public String[] coordinateLabels(int dim) {
            return labels[dim].clone();
        }

        @Override
        public Map<String, String> scalarCoordinates() {
            return new LinkedHashMap<>(scalars);
        }

        @Override
        public double[] read(int dim, int start, int end) throws IOException {
            if (failure != null) throw new IOException(failure);
            int[] shape = shape();
            int[] index = new int[shape.length];
            List<Double> out = new ArrayList<>();
            for (double v : values) {
                if (dim < 0 || (index[dim] >= start && index[dim] < end)) out.add(v);
                for (int d = shape.length - 1; d >= 0; d--) {
                    if (++index[d] < shape[d]) break;
                    index[d] = 0;
                }
            }
            return out.stream().mapToDouble(Double::doubleValue).toArray();
        }

        @Override
        public boolean singlePrecision() { return single; }
    }
}
