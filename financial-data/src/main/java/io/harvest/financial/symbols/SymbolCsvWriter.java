package io.harvest.financial.symbols;

import io.harvest.core.AtomicFiles;
import io.harvest.financial.Market;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the listing CSVs (UTF-8 with BOM so spreadsheet tools pick the encoding): one per market
 * plus a combined file de-duplicated by symbol.
 */
public class SymbolCsvWriter {
    public static final String COMBINED_FILE = "naver_stock_list_yahoo_format.csv";
    static final String[] HEADER = {"code", "market", "name", "symbol"};

    private final Path outDir;

    public SymbolCsvWriter(Path outDir) {
        this.outDir = outDir;
    }

    /** Returns the combined listing that was written. */
    public List<SymbolListing> writeAll(Map<Market, List<SymbolListing>> byMarket) throws IOException {
        Map<String, SymbolListing> combined = new LinkedHashMap<>();
        for (Market market : Market.values()) {
            List<SymbolListing> listings = byMarket.getOrDefault(market, List.of());
            write(outDir.resolve(market.metaFileName()), listings);
            for (SymbolListing s : listings) combined.putIfAbsent(s.symbol(), s);
        }
        List<SymbolListing> all = new ArrayList<>(combined.values());
        write(outDir.resolve(COMBINED_FILE), all);
        return all;
    }

    public static void write(Path file, Collection<SymbolListing> listings) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(HEADER).setRecordSeparator("\n").build();
        AtomicFiles.write(file, out -> {
            Writer w = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            w.write(0xFEFF);
            CSVPrinter printer = new CSVPrinter(w, format);
            for (SymbolListing s : listings) {
                printer.printRecord(s.code(), s.market().name(), s.name(), s.symbol());
            }
            printer.flush();
        });
    }
}
