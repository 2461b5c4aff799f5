package io.griddedetl.era5.join;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.TreeSet;

/**
 * Declared column roles per variable, read from properties entries of the form
 * {@code <variable> = <time>,<latitude>,<longitude>,<value>}. Every entry is validated when the
 * registry is built.
 */
public final class SchemaRegistry {
    public static final String DEFAULT_RESOURCE = "/era5-schemas.properties";

    private final Map<String, ColumnMapping> schemas;

    private SchemaRegistry(Map<String, ColumnMapping> schemas) {
        this.schemas = Map.copyOf(schemas);
    }

    public static SchemaRegistry empty() {
        return new SchemaRegistry(Map.of());
    }

    public static SchemaRegistry of(Map<String, ColumnMapping> schemas) throws ColumnMappingException {
        for (var e : schemas.entrySet()) {
            if (!e.getValue().isWellFormed()) {
                throw new ColumnMappingException("schema for " + e.getKey() + " needs four distinct column names: " + e.getValue());
            }
        }
        return new SchemaRegistry(schemas);
    }

    public static SchemaRegistry fromProperties(Properties props) throws ColumnMappingException {
        Map<String, ColumnMapping> out = new LinkedHashMap<>();
        for (String variable : new TreeSet<>(props.stringPropertyNames())) {
            String[] parts = props.getProperty(variable).split(",", -1);
            if (parts.length != 4) {
                throw new ColumnMappingException("schema for " + variable + " must list time,latitude,longitude,value: "
                        + props.getProperty(variable));
            }
            out.put(variable, new ColumnMapping(parts[0].trim(), parts[1].trim(), parts[2].trim(), parts[3].trim()));
        }
        return of(out);
    }

    /** Bundled schemas, overlaid with {@code extra} when given. */
    public static SchemaRegistry load(Path extra) throws ColumnMappingException {
        Properties props = new Properties();
        try (InputStream in = SchemaRegistry.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in != null) props.load(in);
            if (extra != null) {
                try (Reader r = Files.newBufferedReader(extra, StandardCharsets.UTF_8)) {
                    props.load(r);
                }
            }
        } catch (IOException e) {
            throw new ColumnMappingException("cannot read schema registry " + (extra != null ? extra : DEFAULT_RESOURCE), e);
        }
        return fromProperties(props);
    }

    public Optional<ColumnMapping> lookup(String variable) {
        return Optional.ofNullable(schemas.get(variable));
    }

    /** Empty when the variable is not registered; otherwise resolved only if the table has every declared column. */
    public Optional<MappingResult> resolve(String variable, List<String> tableColumns) {
        ColumnMapping m = schemas.get(variable);
        if (m == null) return Optional.empty();
        for (String c : m.columns()) {
            if (!tableColumns.contains(c)) {
                return Optional.of(MappingResult.unresolved("registered column " + c + " missing from " + tableColumns));
            }
        }
        return Optional.of(MappingResult.resolved(m));
    }

    public int size() {
        return schemas.size();
    }
}
