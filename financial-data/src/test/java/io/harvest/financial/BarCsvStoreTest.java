package io.harvest.financial;

import io.harvest.core.WorkItem;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BarCsvStoreTest {
    @Test
    void writesHeaderAndRowsAndMarksComplete() throws Exception {
        Path tmp = Files.createTempDirectory("bar-store-test");
        try {
            BarCsvStore store = new BarCsvStore(tmp.resolve("out"));
            WorkItem item = new WorkItem("005930.KS");
            assertFalse(store.isComplete(item));

            BarSet bars = BarSet.of(List.of(
                    new Bar(LocalDate.of(2024, 1, 2), LocalTime.of(9, 1), 70100, 70200, 70000, 70150.5, 1200),
                    new Bar(LocalDate.of(2024, 1, 2), LocalTime.of(9, 0), 70000, 70100, 69900, 70100, 3400)));
            store.write(item, bars);

            Path file = store.pathFor(item);
            assertEquals("005930.KS_1min.csv", file.getFileName().toString());
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            assertEquals(List.of(
                    "date,time,open,high,low,close,volume",
                    "2024-01-02,09:00,70000,70100,69900,70100,3400",
                    "2024-01-02,09:01,70100,70200,70000,70150.5,1200"), lines);
            assertTrue(store.isComplete(item));
            try (var s = Files.list(file.getParent())) {
                assertEquals(1, s.count());
            }
        } finally {
            try (var s = Files.walk(tmp)) { s.sorted(java.util.Comparator.reverseOrder()).forEach(p -> { try { Files.deleteIfExists(p); } catch (Exception ignore) {} }); }
        }
    }

    @Test
    void emptyFileIsNotComplete() throws Exception {
        Path tmp = Files.createTempDirectory("bar-store-test2");
        try {
            BarCsvStore store = new BarCsvStore(tmp);
            WorkItem item = new WorkItem("IT/001");
            assertEquals("IT_001_1min.csv", store.pathFor(item).getFileName().toString());
            Files.createFile(store.pathFor(item));
            assertFalse(store.isComplete(item));
        } finally {
            try (var s = Files.walk(tmp)) { s.sorted(java.util.Comparator.reverseOrder()).forEach(p -> { try { Files.deleteIfExists(p); } catch (Exception ignore) {} }); }
        }
    }
}
