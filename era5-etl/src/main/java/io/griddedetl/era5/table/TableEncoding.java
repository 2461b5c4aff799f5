package io.griddedetl.era5.table;

import org.apache.parquet.hadoop.metadata.CompressionCodecName;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * How a table is laid out on disk: format, gzip for CSV, and the Parquet codec.
 */
public record TableEncoding(TableFormat format, boolean gzip, CompressionCodecName parquetCodec) {
    public static final TableEncoding CSV = new TableEncoding(TableFormat.CSV, false, CompressionCodecName.SNAPPY);
    public static final TableEncoding PARQUET = new TableEncoding(TableFormat.PARQUET, false, CompressionCodecName.SNAPPY);

    public TableEncoding {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(parquetCodec, "parquetCodec");
        if (format == TableFormat.PARQUET) gzip = false;
    }

    public String extension() {
        return switch (format) {
            case CSV -> gzip ? ".csv.gz" : ".csv";
            case PARQUET -> ".parquet";
        };
    }

    /** Encoding of an existing file, keeping this encoding's Parquet codec. */
    public TableEncoding forFile(Path file) {
        TableFormat f = TableFormat.of(file)
                .orElseThrow(() -> new IllegalArgumentException("not a table file: " + file));
        boolean gz = file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".gz");
        return new TableEncoding(f, gz, parquetCodec);
    }

    public static TableEncoding of(String format, String compress, String parquetCodec) {
        TableFormat f = TableFormat.parse(format);
        boolean gz = "gzip".equalsIgnoreCase(compress.trim());
        if (!gz && !"none".equalsIgnoreCase(compress.trim())) {
            throw new IllegalArgumentException("compress must be none or gzip: " + compress);
        }
        return new TableEncoding(f, gz, CompressionCodecName.valueOf(parquetCodec.trim().toUpperCase(Locale.ROOT)));
    }
}
