package io.griddedetl.error;

import io.griddedetl.core.Record;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileDeadLetterSinkTest {
    @TempDir
    Path tmp;

    @Test
    void appends_one_json_line_per_failure() throws Exception {
        Path file = tmp.resolve("logs").resolve("failed_tasks.jsonl");
        var dlq = new FileDeadLetterSink<String>(file, s -> "task " + s);
        dlq.acceptFailure("extract", new Record<>(3, 0, "a"), new IllegalStateException("bad \"quote\"\nline"));
        dlq.acceptFailure("join", new Record<>(4, 0, "b"), new RuntimeException("other"));

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).contains("\"stage\":\"extract\""));
        assertTrue(lines.get(0).contains("\"seq\":3"));
        assertTrue(lines.get(0).contains("\"task\":\"task a\""));
        assertTrue(lines.get(0).contains("bad \\\"quote\\\"\\nline"));
        assertTrue(lines.get(1).contains("\"stage\":\"join\""));
    }
}
