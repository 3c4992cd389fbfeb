package io.harvest.financial;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;

public record CollectorConfig(
        Path outDir,
        Path metaDir,
        Path checkpointFile,
        int maxCalls,
        Duration window,
        int lookbackDays,
        int bufferDays,
        int retryAttempts,
        Duration pace,
        URI providerUri
) {
    public static CollectorConfig fromEnv() {
        Path out = Path.of(setting("harvest.out", "HARVEST_OUT", "out_csv"));
        Path meta = Path.of(setting("harvest.meta", "HARVEST_META", "split_meta_market"));
        Path cp = Path.of(setting("harvest.checkpoint", "HARVEST_CHECKPOINT", "checkpoint.json"));
        int calls = Integer.parseInt(setting("harvest.maxCalls", "HARVEST_MAX_CALLS", "13"));
        long windowSec = Long.parseLong(setting("harvest.windowSeconds", "HARVEST_WINDOW_SECONDS", "60"));
        int lookback = Integer.parseInt(setting("harvest.lookbackDays", "HARVEST_LOOKBACK_DAYS", "730"));
        int buffer = Integer.parseInt(setting("harvest.bufferDays", "HARVEST_BUFFER_DAYS", "7"));
        int attempts = Integer.parseInt(setting("harvest.retryAttempts", "HARVEST_RETRY_ATTEMPTS", "3"));
        long paceMs = Long.parseLong(setting("harvest.paceMillis", "HARVEST_PACE_MILLIS", "150"));
        URI provider = URI.create(setting("harvest.provider", "HARVEST_PROVIDER", "https://query1.finance.yahoo.com"));
        return new CollectorConfig(out, meta, cp, calls, Duration.ofSeconds(windowSec), lookback, buffer, attempts,
                Duration.ofMillis(paceMs), provider);
    }

    private static String setting(String property, String env, String def) {
        return System.getProperty(property, System.getenv().getOrDefault(env, def));
    }

    public CollectorConfig withOutDir(Path p) { return new CollectorConfig(p, metaDir, checkpointFile, maxCalls, window, lookbackDays, bufferDays, retryAttempts, pace, providerUri); }
    public CollectorConfig withMetaDir(Path p) { return new CollectorConfig(outDir, p, checkpointFile, maxCalls, window, lookbackDays, bufferDays, retryAttempts, pace, providerUri); }
    public CollectorConfig withCheckpointFile(Path p) { return new CollectorConfig(outDir, metaDir, p, maxCalls, window, lookbackDays, bufferDays, retryAttempts, pace, providerUri); }
    public CollectorConfig withRateLimit(int calls, Duration w) { return new CollectorConfig(outDir, metaDir, checkpointFile, calls, w, lookbackDays, bufferDays, retryAttempts, pace, providerUri); }
    public CollectorConfig withLookbackDays(int days) { return new CollectorConfig(outDir, metaDir, checkpointFile, maxCalls, window, days, bufferDays, retryAttempts, pace, providerUri); }
    public CollectorConfig withPace(Duration d) { return new CollectorConfig(outDir, metaDir, checkpointFile, maxCalls, window, lookbackDays, bufferDays, retryAttempts, d, providerUri); }
    public CollectorConfig withProviderUri(URI u) { return new CollectorConfig(outDir, metaDir, checkpointFile, maxCalls, window, lookbackDays, bufferDays, retryAttempts, pace, u); }
}
