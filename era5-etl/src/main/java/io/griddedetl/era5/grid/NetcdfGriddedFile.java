package io.griddedetl.era5.grid;

import ucar.ma2.Array;
import ucar.ma2.DataType;
import ucar.ma2.InvalidRangeException;
import ucar.nc2.Attribute;
import ucar.nc2.Dimension;
import ucar.nc2.Variable;
import ucar.nc2.dataset.NetcdfDataset;
import ucar.nc2.dataset.VariableDS;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link GriddedFile} over NetCDF-Java. Anything NetCDF-Java can open as a dataset works,
 * GRIB included when its GRIB module is on the classpath.
 */
public class NetcdfGriddedFile implements GriddedFile {
    private final NetcdfDataset dataset;
    private final List<String> variableNames;

    NetcdfGriddedFile(NetcdfDataset dataset) {
        this.dataset = dataset;
        this.variableNames = dataVariables(dataset);
    }

    public static NetcdfGriddedFile open(Path file) throws IOException {
        return new NetcdfGriddedFile(NetcdfDataset.openDataset(file.toString()));
    }

    private static List<String> dataVariables(NetcdfDataset ds) {
        Set<String> auxiliary = new HashSet<>();
        for (Variable v : ds.getVariables()) {
            Attribute coords = v.findAttribute("coordinates");
            if (coords != null && coords.getStringValue() != null) {
                for (String c : coords.getStringValue().trim().split("\\s+")) auxiliary.add(c);
            }
        }
        List<String> names = new ArrayList<>();
        for (Variable v : ds.getVariables()) {
            if (v.isCoordinateVariable() || v.getRank() == 0) continue;
            if (!v.getDataType().isNumeric()) continue;
            if (auxiliary.contains(v.getShortName()) || ds.findDimension(v.getShortName()) != null) continue;
            names.add(v.getShortName());
        }
        return List.copyOf(names);
    }

    @Override
    public List<String> variableNames() { return variableNames; }

    @Override
    public GriddedVariable variable(String name) throws IOException {
        Variable v = dataset.findVariable(name);
        if (v == null) throw new IOException("no variable " + name);
        return new NetcdfVariable(v);
    }

    @Override
    public void close() throws IOException {
        dataset.close();
    }

    private final class NetcdfVariable implements GriddedVariable {
        private final Variable var;

        NetcdfVariable(Variable var) {
            this.var = var;
        }

        @Override
        public String name() { return var.getShortName(); }

        @Override
        public List<String> dimensions() {
            List<String> dims = new ArrayList<>();
            for (Dimension d : var.getDimensions()) dims.add(d.getShortName());
            return dims;
        }

        @Override
        public int[] shape() { return var.getShape(); }

        @Override
        public String[] coordinateLabels(int dim) throws IOException {
            String dimName = var.getDimension(dim).getShortName();
            int length = var.getShape()[dim];
            Variable axis = dataset.findVariable(dimName);
            String[] labels = new String[length];
            if (axis == null || axis.getRank() != 1 || !axis.getDataType().isNumeric()) {
                for (int i = 0; i < length; i++) labels[i] = Integer.toString(i);
                return labels;
            }
            Array values = axis.read();
            Optional<CfTime> time = timeAxis(axis);
            boolean single = axis.getDataType() == DataType.FLOAT;
            for (int i = 0; i < length; i++) {
                double d = values.getDouble(i);
                labels[i] = time.isPresent() ? time.get().label(d) : Values.render(d, single);
            }
            return labels;
        }

        @Override
        public Map<String, String> scalarCoordinates() throws IOException {
            Map<String, String> out = new LinkedHashMap<>();
            Attribute coords = var.findAttribute("coordinates");
            if (coords == null || coords.getStringValue() == null) return out;
            List<String> own = dimensions();
            for (String c : coords.getStringValue().trim().split("\\s+")) {
                if (c.isEmpty() || own.contains(c)) continue;
                Variable aux = dataset.findVariable(c);
                if (aux == null || aux.getRank() != 0) continue;
                Array a = aux.read();
                if (!aux.getDataType().isNumeric()) {
                    out.put(c, String.valueOf(a.getObject(0)));
                    continue;
                }
                double d = a.getDouble(0);
                Optional<CfTime> time = timeAxis(aux);
                out.put(c, time.isPresent() ? time.get().label(d) : Values.render(d, aux.getDataType() == DataType.FLOAT));
            }
            return out;
        }

        @Override
        public double[] read(int dim, int start, int end) throws IOException {
            Array a;
            if (dim < 0) {
                a = var.read();
            } else {
                int[] origin = new int[var.getRank()];
                int[] shape = var.getShape().clone();
                origin[dim] = start;
                shape[dim] = end - start;
                try {
                    a = var.read(origin, shape);
                } catch (InvalidRangeException e) {
                    throw new IOException(name() + ": bad range [" + start + ", " + end + ") on dimension " + dim, e);
                }
            }
            double[] out = new double[(int) a.getSize()];
            VariableDS enhanced = var instanceof VariableDS vds && vds.hasMissing() ? vds : null;
            for (int i = 0; i < out.length; i++) {
                double d = a.getDouble(i);
                out[i] = enhanced != null && enhanced.isMissing(d) ? Double.NaN : d;
            }
            return out;
        }

        @Override
        public boolean singlePrecision() {
            return var.getDataType() == DataType.FLOAT;
        }
    }

    private static Optional<CfTime> timeAxis(Variable axis) {
        return CfTime.parse(axis.getUnitsString());
    }
}
