package io.griddedetl.era5.table;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.avro.AvroSchemaConverter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.metadata.FileMetaData;
import org.apache.parquet.hadoop.util.HadoopInputFile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Reads any Parquet file through its Avro view; the column list comes from the footer. */
public class ParquetTableReader implements TableReader {
    private static final String AVRO_SCHEMA_KEY = "parquet.avro.schema";

    private final List<Column> columns;
    private final ParquetReader<GenericRecord> reader;

    public ParquetTableReader(Path file) throws IOException {
        Configuration conf = LocalHadoop.configuration();
        HadoopInputFile input = HadoopInputFile.fromPath(LocalHadoop.path(file), conf);
        Schema schema;
        try (ParquetFileReader footer = ParquetFileReader.open(input)) {
            FileMetaData meta = footer.getFooter().getFileMetaData();
            String json = meta.getKeyValueMetaData().get(AVRO_SCHEMA_KEY);
            schema = json != null
                    ? new Schema.Parser().parse(json)
                    : new AvroSchemaConverter(conf).convert(meta.getSchema());
        }
        this.columns = columnsOf(schema);
        this.reader = AvroParquetReader.<GenericRecord>builder(input).withConf(conf).build();
    }

    private static List<Column> columnsOf(Schema schema) {
        List<Column> cols = new ArrayList<>();
        for (Schema.Field f : schema.getFields()) {
            String name = f.getProp(ParquetTableWriter.COLUMN_PROP);
            cols.add(new Column(name != null ? name : f.name(), isNumeric(f.schema()) ? ColumnType.DOUBLE : ColumnType.STRING));
        }
        return List.copyOf(cols);
    }

    private static boolean isNumeric(Schema s) {
        if (s.getType() == Schema.Type.UNION) {
            for (Schema branch : s.getTypes()) {
                if (branch.getType() != Schema.Type.NULL) return isNumeric(branch);
            }
            return false;
        }
        return switch (s.getType()) {
            case DOUBLE, FLOAT, INT, LONG -> true;
            default -> false;
        };
    }

    @Override
    public List<Column> columns() { return columns; }

    @Override
    public List<String[]> read(int maxRows) throws IOException {
        List<String[]> rows = new ArrayList<>(Math.min(maxRows, 4096));
        GenericRecord rec;
        while (rows.size() < maxRows && (rec = reader.read()) != null) {
            String[] row = new String[columns.size()];
            for (int i = 0; i < row.length; i++) {
                Object v = rec.get(i);
                row[i] = v == null ? null : v.toString();
            }
            rows.add(row);
        }
        return rows;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
