package io.harvest.financial;

import io.harvest.core.WorkItem;
import io.harvest.core.WorkItemSource;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Builds the work list from the per-market listing files in a directory: every valid code of every
 * market, de-duplicated and sorted.
 */
public class MetaCsvItemSource implements WorkItemSource {
    private static final Logger log = LoggerFactory.getLogger(MetaCsvItemSource.class);
    static final List<String> CODE_COLUMNS = List.of("code", "Code", "symbol", "Symbol", "ticker", "Ticker");

    private final Path metaDir;

    public MetaCsvItemSource(Path metaDir) {
        this.metaDir = metaDir;
    }

    @Override
    public List<WorkItem> listItems() throws IOException {
        TreeSet<WorkItem> all = new TreeSet<>();
        for (Market market : Market.values()) {
            List<WorkItem> items = readMarket(metaDir.resolve(market.metaFileName()), market);
            log.info("{}: {} codes from {}", market, items.size(), market.metaFileName());
            all.addAll(items);
        }
        return List.copyOf(all);
    }

    static List<WorkItem> readMarket(Path file, Market market) throws IOException {
        if (!Files.exists(file)) return List.of();
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreEmptyLines(true)
                .setTrim(true)
                .build();
        List<WorkItem> out = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            skipByteOrderMark(reader);
            try (CSVParser parser = format.parse(reader)) {
                String column = codeColumn(parser.getHeaderNames());
                for (CSVRecord r : parser) {
                    String raw = column != null && r.isSet(column) ? r.get(column) : (r.size() > 0 ? r.get(0) : null);
                    Optional<WorkItem> item = InstrumentCodes.normalize(raw, market);
                    if (item.isPresent()) {
                        out.add(item.get());
                    } else {
                        log.debug("{}: skipping unusable code '{}'", file.getFileName(), raw);
                    }
                }
            }
        }
        return out;
    }

    private static String codeColumn(List<String> headers) {
        for (String c : CODE_COLUMNS) {
            if (headers.contains(c)) return c;
        }
        return null;
    }

    private static void skipByteOrderMark(BufferedReader reader) throws IOException {
        reader.mark(1);
        if (reader.read() != 0xFEFF) reader.reset();
    }
}
