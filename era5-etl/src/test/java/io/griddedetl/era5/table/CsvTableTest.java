package io.griddedetl.era5.table;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static io.griddedetl.era5.table.TableFixtures.row;
import static io.griddedetl.era5.table.TableFixtures.rows;
import static org.junit.jupiter.api.Assertions.*;

class CsvTableTest {
    @TempDir
    Path tmp;

    @Test
    void blanks_read_back_as_null_and_quotes_only_when_needed() throws Exception {
        Path f = TableFixtures.write(tmp.resolve("t.csv"), List.of("time", "note", "value"),
                rows(row("2021-05-01 00:00:00", "a,b", "1.5"), row("2021-05-01 01:00:00", null, null)));

        List<String> lines = Files.readAllLines(f, StandardCharsets.UTF_8);
        assertEquals("time,note,value", lines.get(0));
        assertEquals("2021-05-01 00:00:00,\"a,b\",1.5", lines.get(1));
        assertEquals("2021-05-01 01:00:00,,", lines.get(2));

        List<String[]> rows = TableFixtures.read(f);
        assertEquals("a,b", rows.get(0)[1]);
        assertNull(rows.get(1)[1]);
        assertNull(rows.get(1)[2]);
    }

    @Test
    void gzip_follows_the_file_name() throws Exception {
        Path f = TableFixtures.write(tmp.resolve("t.csv.gz"), List.of("a"), rows(row("1"), row("2")));
        byte[] head = Files.readAllBytes(f);
        assertEquals((byte) 0x1f, head[0]);
        assertEquals((byte) 0x8b, head[1]);
        assertEquals(2, TableFixtures.read(f).size());
    }

    @Test
    void append_writes_the_header_once() throws Exception {
        Path f = tmp.resolve("staged.csv");
        List<Column> cols = List.of(Column.string("k"), Column.string("v"));
        try (CsvTableWriter w = new CsvTableWriter(f, cols, false, true)) {
            w.write(row("a", "1"));
        }
        try (CsvTableWriter w = new CsvTableWriter(f, cols, false, true)) {
            w.write(row("b", "2"));
        }
        assertEquals(List.of("k,v", "a,1", "b,2"), Files.readAllLines(f, StandardCharsets.UTF_8));
    }

    @Test
    void reads_in_chunks() throws Exception {
        Path f = TableFixtures.write(tmp.resolve("t.csv"), List.of("a"), rows(row("1"), row("2"), row("3")));
        try (TableReader r = Tables.open(f)) {
            assertEquals(2, r.read(2).size());
            assertEquals(1, r.read(2).size());
            assertTrue(r.read(2).isEmpty());
        }
    }

    @Test
    void empty_file_has_no_header() throws Exception {
        Path f = Files.createFile(tmp.resolve("empty.csv"));
        assertThrows(IOException.class, () -> Tables.open(f));
    }
}
