package io.griddedetl.error;

import io.griddedetl.core.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Function;

/**
 * Appends one JSON line per failed record to a file. The payload is rendered with the supplied
 * describer so each line names the task that failed.
 */
public class FileDeadLetterSink<T> implements DeadLetterSink<T> {
    private static final Logger LOG = LoggerFactory.getLogger(FileDeadLetterSink.class);

    private final Path file;
    private final Function<T, String> describer;

    public FileDeadLetterSink(Path file) throws IOException {
        this(file, String::valueOf);
    }

    public FileDeadLetterSink(Path file, Function<T, String> describer) throws IOException {
        this.file = Objects.requireNonNull(file);
        this.describer = Objects.requireNonNull(describer);
        if (file.getParent() != null) Files.createDirectories(file.getParent());
        if (!Files.exists(file)) {
            Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.CREATE);
        }
    }

    public Path file() { return file; }

    @Override
    public synchronized void acceptFailure(String stage, Record<T> record, Exception e) {
        String task = record == null ? "" : describer.apply(record.payload());
        String json = String.format(
                "{\"ts\":\"%s\",\"stage\":\"%s\",\"seq\":%d,\"task\":\"%s\",\"error\":\"%s\"}%n",
                Instant.now(), escape(stage), record == null ? -1 : record.seq(), escape(task), escape(String.valueOf(e)));
        try {
            Files.writeString(file, json, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException io) {
            LOG.warn("Could not record failed {} task {} in {}: {}", stage, task, file, io.toString());
        }
    }

    static String escape(String s) {
        if (s == null) return "";
        StringBuilder sb = new StringBuilder(s.length());
        for (char c : s.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c < 0x20 ? ' ' : c);
            }
        }
        return sb.toString();
    }
}
