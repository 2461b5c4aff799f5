package io.griddedetl.era5.table;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.zip.GZIPInputStream;

/** Headered CSV, gzip when the file name ends in {@code .gz}. Empty cells read as null. */
public class CsvTableReader implements TableReader {
    private final Path file;
    private final CSVReader csv;
    private final List<Column> columns;

    public CsvTableReader(Path file) throws IOException {
        this.file = file;
        InputStream in = Files.newInputStream(file);
        if (file.getFileName().toString().endsWith(".gz")) in = new GZIPInputStream(in);
        this.csv = new CSVReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String[] header = next();
        if (header == null) {
            csv.close();
            throw new IOException("empty table, no header: " + file);
        }
        this.columns = Arrays.stream(header).map(Column::string).toList();
    }

    @Override
    public List<Column> columns() { return columns; }

    @Override
    public List<String[]> read(int maxRows) throws IOException {
        List<String[]> rows = new ArrayList<>(Math.min(maxRows, 4096));
        String[] line;
        while (rows.size() < maxRows && (line = next()) != null) {
            if (line.length == 1 && line[0].isEmpty()) continue;
            String[] row = new String[columns.size()];
            for (int i = 0; i < row.length && i < line.length; i++) {
                row[i] = line[i].isEmpty() ? null : line[i];
            }
            rows.add(row);
        }
        return rows;
    }

    private String[] next() throws IOException {
        try {
            return csv.readNext();
        } catch (CsvValidationException e) {
            throw new IOException("malformed csv " + file + " at line " + e.getLineNumber(), e);
        }
    }

    @Override
    public void close() throws IOException {
        csv.close();
    }
}
