package io.harvest.financial.symbols;

import io.harvest.core.Sleeper;
import io.harvest.retry.ExponentialBackoffRetryPolicy;
import io.harvest.retry.FailureKind;
import io.harvest.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.Charset;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Fetches listing pages with browser-like headers, decoding the body in the site's charset.
 * Throttling and gateway errors are retried with exponential backoff.
 */
public class HttpPageFetcher implements PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(HttpPageFetcher.class);
    static final Charset PAGE_CHARSET = Charset.forName("EUC-KR");
    static final Set<Integer> RETRY_STATUSES = Set.of(429, 500, 502, 503, 504);

    private final HttpClient http;
    private final RetryPolicy retry;
    private final Sleeper sleeper;
    private final Duration timeout;

    public HttpPageFetcher() {
        this(HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).connectTimeout(Duration.ofSeconds(10)).build(),
                new ExponentialBackoffRetryPolicy(6, 400, 10_000, EnumSet.of(FailureKind.TRANSIENT_ERROR)), Sleeper.SYSTEM, Duration.ofSeconds(15));
    }

    public HttpPageFetcher(HttpClient http, RetryPolicy retry, Sleeper sleeper, Duration timeout) {
        this.http = http;
        this.retry = retry;
        this.sleeper = sleeper;
        this.timeout = timeout;
    }

    @Override
    public String fetch(URI uri) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", "Mozilla/5.0")
                .header("Accept-Language", "ko-KR,ko;q=0.9,en-US;q=0.8,en;q=0.7")
                .header("Referer", "https://finance.naver.com/")
                .GET()
                .build();
        int attempt = 0;
        while (true) {
            attempt++;
            HttpResponse<byte[]> resp;
            try {
                resp = http.send(req, HttpResponse.BodyHandlers.ofByteArray());
            } catch (IOException e) {
                if (!retry.shouldRetry(attempt, FailureKind.TRANSIENT_ERROR)) throw e;
                log.debug("{}: attempt {} failed: {}", uri, attempt, e.getMessage());
                sleeper.sleep(Duration.ofMillis(retry.backoffMillis(attempt, FailureKind.TRANSIENT_ERROR)));
                continue;
            }
            int status = resp.statusCode();
            if (RETRY_STATUSES.contains(status) && retry.shouldRetry(attempt, FailureKind.TRANSIENT_ERROR)) {
                log.debug("{}: HTTP {} on attempt {}", uri, status, attempt);
                sleeper.sleep(Duration.ofMillis(retry.backoffMillis(attempt, FailureKind.TRANSIENT_ERROR)));
                continue;
            }
            // the site answers with a page even on errors; the caller judges it by the codes it holds
            if (status / 100 != 2) log.warn("{}: HTTP {} after {} attempts", uri, status, attempt);
            return new String(resp.body(), PAGE_CHARSET);
        }
    }
}
