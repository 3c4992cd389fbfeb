package io.harvest.financial;

import com.codahale.metrics.Timer;
import io.harvest.budget.RateLimiter;
import io.harvest.core.Sleeper;
import io.harvest.core.WorkItem;
import io.harvest.metrics.Metrics;
import io.harvest.retry.FailureKind;
import io.harvest.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Fetches an item's lookback window month by month, each month cut further into pieces no wider than
 * the provider accepts. The window itself never reaches further back than the provider serves. A chunk whose answer stays empty or coarse after
 * the retries is halved, and each half fetched the same way, down to single days. A single day that
 * still fails gets one last request whose answer is final.
 */
public class ChunkedFetcher implements ItemCollector {
    private static final Logger log = LoggerFactory.getLogger(ChunkedFetcher.class);

    private final MinuteBarProvider provider;
    private final RateLimiter limiter;
    private final RetryPolicy retry;
    private final GranularityClassifier granularity;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Metrics metrics;
    private final int lookbackDays;
    private final int bufferDays;

    public ChunkedFetcher(MinuteBarProvider provider,
                          RateLimiter limiter,
                          RetryPolicy retry,
                          GranularityClassifier granularity,
                          Clock clock,
                          Sleeper sleeper,
                          Metrics metrics,
                          int lookbackDays,
                          int bufferDays) {
        this.provider = Objects.requireNonNull(provider);
        this.limiter = Objects.requireNonNull(limiter);
        this.retry = Objects.requireNonNull(retry);
        this.granularity = Objects.requireNonNull(granularity);
        this.clock = Objects.requireNonNull(clock);
        this.sleeper = Objects.requireNonNull(sleeper);
        this.metrics = Objects.requireNonNull(metrics);
        if (lookbackDays < 1 || bufferDays < 0) throw new IllegalArgumentException("lookback must be >= 1 day, buffer >= 0");
        this.lookbackDays = lookbackDays;
        this.bufferDays = bufferDays;
    }

    /**
     * From {@code lookbackDays + bufferDays} days ago up to yesterday; today is never complete. The start
     * is moved forward to the provider's {@link MinuteBarProvider#maxLookbackDays() history limit}.
     */
    public DateRange lookbackWindow() {
        LocalDate today = LocalDate.now(clock);
        long days = (long) lookbackDays + bufferDays;
        long limit = Math.max(1, provider.maxLookbackDays());
        if (days > limit) {
            log.debug("lookback of {} days cut to the provider's {}", days, limit);
            days = limit;
        }
        return DateRange.of(today.minusDays(days), today.minusDays(1));
    }

    @Override
    public BarSet collect(WorkItem item) throws InterruptedException {
        DateRange window = lookbackWindow();
        List<Bar> all = new ArrayList<>();
        int maxRange = Math.max(1, provider.maxRangeDays());
        for (DateRange month : window.monthChunks()) {
            for (DateRange chunk : month.split(maxRange)) {
                BarSet part = fetchRange(item, chunk);
                log.debug("{} {}: {} bars", item, chunk, part.size());
                all.addAll(part.bars());
            }
        }
        return BarSet.of(all);
    }

    public BarSet fetchRange(WorkItem item, DateRange range) throws InterruptedException {
        Optional<BarSet> answer = requestWithRetry(item, range);
        if (answer.isPresent()) return answer.get();
        if (range.isSingleDay()) return finalDayRequest(item, range);

        metrics.counter("fetch.bisections").inc();
        List<DateRange> halves = range.bisect();
        log.debug("{} {}: no minute data, splitting into {} and {}", item, range, halves.get(0), halves.get(1));
        BarSet left = fetchRange(item, halves.get(0));
        BarSet right = fetchRange(item, halves.get(1));
        return left.concat(right);
    }

    private Optional<BarSet> requestWithRetry(WorkItem item, DateRange range) throws InterruptedException {
        int attempt = 0;
        while (true) {
            attempt++;
            FailureKind failure;
            try {
                List<Bar> rows = request(item, range);
                Optional<FailureKind> problem = granularity.problem(rows);
                if (problem.isEmpty()) return Optional.of(BarSet.of(rows));
                failure = problem.get();
            } catch (ProviderException | RuntimeException e) {
                log.debug("{} {}: attempt {} failed: {}", item, range, attempt, e.toString());
                failure = FailureKind.TRANSIENT_ERROR;
            }
            metrics.counter("fetch.failures." + failure.name().toLowerCase(Locale.ROOT)).inc();
            if (!retry.shouldRetry(attempt, failure)) return Optional.empty();
            metrics.counter("fetch.retries").inc();
            sleeper.sleep(Duration.ofMillis(retry.backoffMillis(attempt, failure)));
        }
    }

    private BarSet finalDayRequest(WorkItem item, DateRange day) throws InterruptedException {
        List<Bar> rows;
        try {
            rows = request(item, day);
        } catch (ProviderException | RuntimeException e) {
            log.debug("{} {}: final request failed: {}", item, day, e.toString());
            return BarSet.empty();
        }
        // a daily bar standing in for the session is not minute data
        return granularity.isFineGrained(rows) ? BarSet.of(rows) : BarSet.empty();
    }

    private List<Bar> request(WorkItem item, DateRange range) throws ProviderException, InterruptedException {
        limiter.acquire();
        metrics.counter("provider.requests").inc();
        List<Bar> rows;
        try (Timer.Context ignored = metrics.timer("provider.request.time").time()) {
            rows = provider.requestChunk(item, range.start(), range.end());
        }
        return rows == null ? List.of() : rows;
    }
}
