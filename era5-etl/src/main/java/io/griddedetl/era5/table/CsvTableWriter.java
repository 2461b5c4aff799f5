package io.griddedetl.era5.table;

import com.opencsv.CSVWriter;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.zip.GZIPOutputStream;

/** Writes a header then rows, quoting only cells that need it; null cells are written empty. */
public class CsvTableWriter implements TableWriter {
    private final CSVWriter csv;

    public CsvTableWriter(Path file, List<Column> columns, boolean gzip) throws IOException {
        this(file, columns, gzip, false);
    }

    /**
     * @param append continue an existing plain CSV; the header is only written when the file is new
     */
    public CsvTableWriter(Path file, List<Column> columns, boolean gzip, boolean append) throws IOException {
        boolean fresh = !append || !Files.exists(file) || Files.size(file) == 0;
        OutputStream out = append
                ? Files.newOutputStream(file, StandardOpenOption.CREATE, StandardOpenOption.APPEND)
                : Files.newOutputStream(file);
        if (gzip) out = new GZIPOutputStream(out);
        this.csv = new CSVWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8),
                CSVWriter.DEFAULT_SEPARATOR, CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER, "\n");
        if (fresh) csv.writeNext(Column.names(columns).toArray(String[]::new), false);
    }

    @Override
    public void write(String[] row) {
        csv.writeNext(row, false);
    }

    @Override
    public void close() throws IOException {
        csv.close();
    }
}
