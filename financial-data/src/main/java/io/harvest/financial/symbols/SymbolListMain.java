package io.harvest.financial.symbols;

import io.harvest.core.Sleeper;
import io.harvest.financial.Market;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "symbols", mixinStandardHelpOptions = true, description = "Scrape KOSPI/KOSDAQ listings into the meta CSVs the collector reads")
public final class SymbolListMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(SymbolListMain.class);

    @CommandLine.Option(names = {"-o", "--out-dir"}, defaultValue = "split_meta_market", description = "Directory for the listing CSVs")
    Path outDir;

    @CommandLine.Option(names = "--kospi-pages", defaultValue = "200", description = "Max KOSPI pages")
    int kospiPages;

    @CommandLine.Option(names = "--kosdaq-pages", defaultValue = "240", description = "Max KOSDAQ pages")
    int kosdaqPages;

    @CommandLine.Option(names = "--empty-tolerance", defaultValue = "5", description = "Consecutive pages without new codes before stopping")
    int emptyTolerance;

    @CommandLine.Option(names = "--pace-ms", defaultValue = "150", description = "Pause between pages in milliseconds")
    long paceMillis;

    public static void main(String[] args) {
        int code = new CommandLine(new SymbolListMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        NaverSymbolCollector collector = new NaverSymbolCollector(new HttpPageFetcher(),
                Sleeper.SYSTEM, Duration.ofMillis(paceMillis), emptyTolerance);
        Map<Market, List<SymbolListing>> byMarket = new EnumMap<>(Market.class);
        try {
            byMarket.put(Market.KOSPI, collector.collectMarket(Market.KOSPI, kospiPages));
            byMarket.put(Market.KOSDAQ, collector.collectMarket(Market.KOSDAQ, kosdaqPages));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return 130;
        }
        List<SymbolListing> all = new SymbolCsvWriter(outDir).writeAll(byMarket);
        System.out.printf("saved %s: %d symbols (KOSPI=%d, KOSDAQ=%d)%n", outDir.resolve(SymbolCsvWriter.COMBINED_FILE),
                all.size(), byMarket.get(Market.KOSPI).size(), byMarket.get(Market.KOSDAQ).size());
        log.info("listing files written to {}", outDir.toAbsolutePath());
        return 0;
    }
}
