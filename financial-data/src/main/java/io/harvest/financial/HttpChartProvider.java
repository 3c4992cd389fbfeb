package io.harvest.financial;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.harvest.budget.QuotaProbe;
import io.harvest.core.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Minute bars from a v8 chart endpoint ({@code /v8/finance/chart/{symbol}?interval=1m}). Also acts as
 * the quota probe: after an HTTP 429 the quota reads as exhausted until the server's Retry-After
 * has passed.
 */
public class HttpChartProvider implements MinuteBarProvider, QuotaProbe {
    private static final Logger log = LoggerFactory.getLogger(HttpChartProvider.class);
    private static final ObjectMapper M = new ObjectMapper();
    static final ZoneId MARKET_ZONE = ZoneId.of("Asia/Seoul");
    static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(60);
    // 1m bars reach back 30 days from now and at most 8 days per call
    static final int MAX_LOOKBACK_DAYS = 29;
    static final int MAX_RANGE_DAYS = 7;

    private final HttpClient http;
    private final URI baseUri;
    private final Duration timeout;
    private final Clock clock;
    private volatile Instant blockedUntil = Instant.MIN;

    public HttpChartProvider(URI baseUri) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), baseUri, Duration.ofSeconds(30), Clock.systemUTC());
    }

    public HttpChartProvider(HttpClient http, URI baseUri, Duration timeout, Clock clock) {
        this.http = http;
        this.baseUri = baseUri;
        this.timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public List<Bar> requestChunk(WorkItem item, LocalDate from, LocalDate to) throws ProviderException, InterruptedException {
        long p1 = from.atStartOfDay(MARKET_ZONE).toEpochSecond();
        long p2 = to.plusDays(1).atStartOfDay(MARKET_ZONE).toEpochSecond() - 1; // inclusive end
        String base = baseUri.toString().replaceAll("/+$", "");
        URI uri = URI.create(String.format("%s/v8/finance/chart/%s?interval=1m&period1=%d&period2=%d",
                base, URLEncoder.encode(item.id(), StandardCharsets.UTF_8), p1, p2));
        HttpRequest req = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", "Mozilla/5.0")
                .GET()
                .build();
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ProviderException("chart request failed for " + item + " " + from + ".." + to, e);
        }
        int status = resp.statusCode();
        if (status == 429) {
            Duration wait = retryAfter(resp);
            blockedUntil = clock.instant().plus(wait);
            log.warn("chart endpoint throttled {}, blocked for {} s", item, wait.toSeconds());
            throw new ProviderException("HTTP 429 for " + item);
        }
        if (status / 100 != 2) {
            throw new ProviderException("HTTP " + status + " for " + item + " " + from + ".." + to);
        }
        return parse(resp.body(), MARKET_ZONE);
    }

    static List<Bar> parse(String body, ZoneId zone) throws ProviderException {
        JsonNode root;
        try {
            root = M.readTree(body);
        } catch (IOException e) {
            throw new ProviderException("unparseable chart response", e);
        }
        JsonNode chart = root.path("chart");
        JsonNode error = chart.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new ProviderException("chart error: " + error.path("description").asText(error.toString()));
        }
        JsonNode result = chart.path("result").path(0);
        JsonNode timestamps = result.path("timestamp");
        JsonNode quote = result.path("indicators").path("quote").path(0);
        if (!timestamps.isArray() || quote.isMissingNode()) return List.of();

        JsonNode open = quote.path("open"), high = quote.path("high"), low = quote.path("low"),
                close = quote.path("close"), volume = quote.path("volume");
        List<Bar> out = new ArrayList<>(timestamps.size());
        for (int i = 0; i < timestamps.size(); i++) {
            if (isNull(open, i) || isNull(high, i) || isNull(low, i) || isNull(close, i)) continue;
            ZonedDateTime t = Instant.ofEpochSecond(timestamps.get(i).asLong()).atZone(zone);
            out.add(new Bar(t.toLocalDate(), t.toLocalTime().truncatedTo(ChronoUnit.MINUTES),
                    open.get(i).asDouble(), high.get(i).asDouble(), low.get(i).asDouble(), close.get(i).asDouble(),
                    isNull(volume, i) ? 0L : volume.get(i).asLong()));
        }
        return out;
    }

    private static boolean isNull(JsonNode arr, int i) {
        JsonNode n = arr.path(i);
        return n.isMissingNode() || n.isNull();
    }

    private static Duration retryAfter(HttpResponse<?> resp) {
        Optional<String> h = resp.headers().firstValue("Retry-After");
        if (h.isPresent()) {
            try {
                return Duration.ofSeconds(Math.max(0, Long.parseLong(h.get().trim())));
            } catch (NumberFormatException ignore) {
                // HTTP-date form; fall through to the default
            }
        }
        return DEFAULT_RETRY_AFTER;
    }

    @Override
    public int maxLookbackDays() {
        return MAX_LOOKBACK_DAYS;
    }

    @Override
    public int maxRangeDays() {
        return MAX_RANGE_DAYS;
    }

    @Override
    public Optional<QuotaProbe> quota() {
        return Optional.of(this);
    }

    @Override
    public int remaining() {
        return clock.instant().isBefore(blockedUntil) ? 0 : Integer.MAX_VALUE;
    }

    @Override
    public Duration resetWait() {
        Duration d = Duration.between(clock.instant(), blockedUntil);
        return d.isNegative() ? Duration.ZERO : d;
    }
}
