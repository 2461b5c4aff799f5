package io.griddedetl.era5.table;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.hadoop.util.HadoopOutputFile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes rows as Avro records into a Parquet file. Every column is an optional field; DOUBLE
 * columns are parsed, blanks become null. Column names that are not valid Avro names (ERA5 short
 * names such as {@code 2t}) are mangled and the original kept in the field's {@code column} property.
 */
public class ParquetTableWriter implements TableWriter {
    static final String COLUMN_PROP = "column";

    private final Schema schema;
    private final List<Column> columns;
    private final ParquetWriter<GenericRecord> writer;

    public ParquetTableWriter(Path file, List<Column> columns, CompressionCodecName codec) throws IOException {
        this.columns = List.copyOf(columns);
        this.schema = schemaFor(columns);
        Configuration conf = LocalHadoop.configuration();
        this.writer = AvroParquetWriter.<GenericRecord>builder(HadoopOutputFile.fromPath(LocalHadoop.path(file), conf))
                .withSchema(schema)
                .withConf(conf)
                .withCompressionCodec(codec)
                .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
                .build();
    }

    static Schema schemaFor(List<Column> columns) {
        List<Schema.Field> fields = new ArrayList<>();
        Set<String> used = new HashSet<>();
        for (Column c : columns) {
            Schema.Type t = c.type() == ColumnType.DOUBLE ? Schema.Type.DOUBLE : Schema.Type.STRING;
            Schema optional = Schema.createUnion(List.of(Schema.create(Schema.Type.NULL), Schema.create(t)));
            Schema.Field f = new Schema.Field(avroName(c.name(), used), optional, null, Schema.Field.NULL_DEFAULT_VALUE);
            f.addProp(COLUMN_PROP, c.name());
            fields.add(f);
        }
        return Schema.createRecord("row", null, "io.griddedetl.era5", false, fields);
    }

    static String avroName(String column, Set<String> used) {
        StringBuilder sb = new StringBuilder();
        for (char ch : column.toCharArray()) {
            sb.append(Character.isLetterOrDigit(ch) && ch < 128 || ch == '_' ? ch : '_');
        }
        if (sb.length() == 0 || Character.isDigit(sb.charAt(0))) sb.insert(0, '_');
        String base = sb.toString();
        String name = base;
        for (int i = 1; !used.add(name); i++) name = base + "_" + i;
        return name;
    }

    @Override
    public void write(String[] row) throws IOException {
        GenericRecord r = new GenericData.Record(schema);
        for (int i = 0; i < columns.size(); i++) {
            String cell = i < row.length ? row[i] : null;
            if (cell == null || cell.isBlank()) {
                r.put(i, null);
            } else if (columns.get(i).type() == ColumnType.DOUBLE) {
                try {
                    r.put(i, Double.parseDouble(cell.trim()));
                } catch (NumberFormatException e) {
                    throw new IOException("column " + columns.get(i).name() + ": not a number: " + cell, e);
                }
            } else {
                r.put(i, cell);
            }
        }
        writer.write(r);
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
