package io.harvest.financial;

import io.harvest.core.AtomicFiles;
import io.harvest.core.WorkItem;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;

/**
 * One CSV file per work item. A file that exists and is non-empty marks the item as done.
 */
public class BarCsvStore {
    static final String HEADER = "date,time,open,high,low,close,volume";
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm");

    private final Path outDir;
    private final String suffix;

    public BarCsvStore(Path outDir) {
        this(outDir, "_1min.csv");
    }

    public BarCsvStore(Path outDir, String suffix) {
        this.outDir = outDir;
        this.suffix = suffix;
    }

    public Path pathFor(WorkItem item) {
        return outDir.resolve(item.id().replaceAll("[^A-Za-z0-9._-]", "_") + suffix);
    }

    public boolean isComplete(WorkItem item) {
        Path p = pathFor(item);
        try {
            return Files.isRegularFile(p) && Files.size(p) > 0;
        } catch (IOException e) {
            return false;
        }
    }

    /** Replaces the item's file with header plus one row per bar, in the set's order. */
    public void write(WorkItem item, BarSet bars) throws IOException {
        AtomicFiles.write(pathFor(item), out -> {
            BufferedWriter w = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
            w.write(HEADER);
            w.write('\n');
            for (Bar b : bars) {
                w.write(b.date().toString());
                w.write(',');
                w.write(TIME.format(b.time()));
                w.write(',');
                w.write(num(b.open()));
                w.write(',');
                w.write(num(b.high()));
                w.write(',');
                w.write(num(b.low()));
                w.write(',');
                w.write(num(b.close()));
                w.write(',');
                w.write(Long.toString(b.volume()));
                w.write('\n');
            }
            w.flush();
        });
    }

    private static String num(double d) {
        if (Double.isNaN(d)) return "";
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }
}
