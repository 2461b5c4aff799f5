package io.griddedetl.era5.grid;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ucar.ma2.Array;
import ucar.ma2.DataType;
import ucar.nc2.Attribute;
import ucar.nc2.NetcdfFileWriter;
import ucar.nc2.Variable;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NetcdfGriddedFileTest {
    @TempDir
    Path tmp;

    private Path file;

    @BeforeEach
    void writeFixture() throws Exception {
        file = tmp.resolve("era5_2021_05.nc");
        NetcdfFileWriter w = NetcdfFileWriter.createNew(NetcdfFileWriter.Version.netcdf3, file.toString());
        w.addDimension(null, "time", 2);
        w.addDimension(null, "latitude", 2);
        w.addDimension(null, "longitude", 2);
        Variable time = w.addVariable(null, "time", DataType.DOUBLE, "time");
        w.addVariableAttribute(time, new Attribute("units", "hours since 2021-05-01 00:00:00"));
        Variable lat = w.addVariable(null, "latitude", DataType.FLOAT, "latitude");
        w.addVariableAttribute(lat, new Attribute("units", "degrees_north"));
        Variable lon = w.addVariable(null, "longitude", DataType.FLOAT, "longitude");
        w.addVariableAttribute(lon, new Attribute("units", "degrees_east"));
        Variable t2m = w.addVariable(null, "t2m", DataType.FLOAT, "time latitude longitude");
        w.addVariableAttribute(t2m, new Attribute("_FillValue", -999f));
        w.create();
        w.write(time, Array.factory(new double[]{0, 1}));
        w.write(lat, Array.factory(new float[]{10.5f, 10.25f}));
        w.write(lon, Array.factory(new float[]{20f, 20.25f}));
        w.write(t2m, Array.factory(DataType.FLOAT, new int[]{2, 2, 2}, new float[]{1, 2, 3, 4, 5, -999, 7, 8}));
        w.close();
    }

    @Test
    void lists_only_data_variables() throws Exception {
        try (GriddedFile f = NetcdfGriddedFile.open(file)) {
            assertEquals(List.of("t2m"), f.variableNames());
        }
    }

    @Test
    void decodes_time_and_coordinate_labels() throws Exception {
        try (GriddedFile f = NetcdfGriddedFile.open(file)) {
            GriddedVariable v = f.variable("t2m");
            assertEquals(List.of("time", "latitude", "longitude"), v.dimensions());
            assertArrayEquals(new int[]{2, 2, 2}, v.shape());
            assertArrayEquals(new String[]{"2021-05-01 00:00:00", "2021-05-01 01:00:00"}, v.coordinateLabels(0));
            assertArrayEquals(new String[]{"10.5", "10.25"}, v.coordinateLabels(1));
            assertTrue(v.singlePrecision());
        }
    }

    @Test
    void reads_time_windows_with_missing_as_nan() throws Exception {
        try (GriddedFile f = NetcdfGriddedFile.open(file)) {
            double[] second = f.variable("t2m").read(0, 1, 2);
            assertEquals(4, second.length);
            assertEquals(5.0, second[0]);
            assertTrue(Double.isNaN(second[1]));
            assertEquals(8.0, second[3]);
            assertEquals(8, f.variable("t2m").read(-1, 0, 0).length);
        }
    }
}
