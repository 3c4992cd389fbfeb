package io.harvest.financial.symbols;

import io.harvest.core.Sleeper;
import io.harvest.financial.Market;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Walks the market-cap listing pages of one market and gathers every instrument code in page order.
 *
 * <p>Codes are taken from every {@code code=NNNNNN} occurrence in the raw page so none are missed;
 * names come from the title anchors where present. The walk ends at the page limit or after
 * {@code emptyTolerance} consecutive pages without a new code.
 */
public class NaverSymbolCollector {
    private static final Logger log = LoggerFactory.getLogger(NaverSymbolCollector.class);
    static final String PAGE_URL = "https://finance.naver.com/sise/sise_market_sum.naver?sosok=%d&page=%d";
    private static final Pattern CODE = Pattern.compile("code=(\\d{6})");

    public record Page(List<String> codes, Map<String, String> names) {}

    private final PageFetcher fetcher;
    private final Sleeper sleeper;
    private final Duration pace;
    private final int emptyTolerance;

    public NaverSymbolCollector(PageFetcher fetcher) {
        this(fetcher, Sleeper.SYSTEM, Duration.ofMillis(150), 5);
    }

    public NaverSymbolCollector(PageFetcher fetcher, Sleeper sleeper, Duration pace, int emptyTolerance) {
        this.fetcher = Objects.requireNonNull(fetcher);
        this.sleeper = Objects.requireNonNull(sleeper);
        this.pace = pace;
        if (emptyTolerance < 1) throw new IllegalArgumentException("emptyTolerance must be >= 1");
        this.emptyTolerance = emptyTolerance;
    }

    public List<SymbolListing> collectMarket(Market market, int maxPages) throws IOException, InterruptedException {
        Set<String> codes = new LinkedHashSet<>();
        Map<String, String> names = new HashMap<>();
        int emptyRun = 0;
        for (int page = 1; page <= maxPages; page++) {
            URI uri = URI.create(String.format(PAGE_URL, market.listingId(), page));
            Page parsed = parse(fetcher.fetch(uri));
            names.putAll(parsed.names());

            int before = codes.size();
            codes.addAll(parsed.codes());
            if (codes.size() == before) {
                emptyRun++;
                if (emptyRun >= emptyTolerance) {
                    log.debug("{}: {} pages without new codes, stopping at page {}", market, emptyRun, page);
                    break;
                }
            } else {
                emptyRun = 0;
            }
            sleeper.sleep(pace);
        }
        List<SymbolListing> out = new ArrayList<>(codes.size());
        for (String c : codes) out.add(new SymbolListing(c, market, names.getOrDefault(c, "")));
        log.info("{}: {} symbols", market, out.size());
        return out;
    }

    public static Page parse(String html) {
        List<String> codes = new ArrayList<>();
        Matcher m = CODE.matcher(html);
        while (m.find()) codes.add(m.group(1));

        Map<String, String> names = new HashMap<>();
        Document doc = Jsoup.parse(html);
        for (Element a : doc.select("a.tltle")) {
            Matcher hm = CODE.matcher(a.attr("href"));
            if (!hm.find()) continue;
            String name = a.text().trim();
            if (!name.isEmpty()) names.put(hm.group(1), name);
        }
        return new Page(codes, names);
    }
}
