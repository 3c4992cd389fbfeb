package io.harvest.financial;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.harvest.budget.RateLimiter;
import io.harvest.checkpoint.CheckpointStore;
import io.harvest.checkpoint.JsonCheckpointStore;
import io.harvest.core.Sleeper;
import io.harvest.core.WorkItemSource;
import io.harvest.metrics.Metrics;
import io.harvest.retry.LinearBackoffRetryPolicy;
import io.harvest.retry.RetryPolicy;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;

public class CollectorModule extends AbstractModule {
    private final CollectorConfig config;

    public CollectorModule(CollectorConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(CollectorConfig.class).toInstance(config);
        bind(Clock.class).toInstance(Clock.systemDefaultZone());
        bind(Sleeper.class).toInstance(Sleeper.SYSTEM);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton MinuteBarProvider provider() { return new HttpChartProvider(config.providerUri()); }

    @Provides @Singleton RateLimiter rateLimiter(MinuteBarProvider provider, Clock clock, Sleeper sleeper) {
        return new RateLimiter(config.maxCalls(), config.window(), provider.quota().orElse(null), clock, sleeper);
    }

    @Provides @Singleton RetryPolicy retryPolicy() { return LinearBackoffRetryPolicy.withAttempts(config.retryAttempts()); }

    @Provides @Singleton ItemCollector collector(MinuteBarProvider provider, RateLimiter limiter, RetryPolicy retry,
                                                 Clock clock, Sleeper sleeper, Metrics metrics) {
        return new ChunkedFetcher(provider, limiter, retry, new GranularityClassifier(), clock, sleeper, metrics,
                config.lookbackDays(), config.bufferDays());
    }

    @Provides @Singleton WorkItemSource workItemSource() { return new MetaCsvItemSource(config.metaDir()); }

    @Provides @Singleton CheckpointStore checkpointStore() { return new JsonCheckpointStore(config.checkpointFile()); }

    @Provides @Singleton BarCsvStore barCsvStore() { return new BarCsvStore(config.outDir()); }

    // progress lines must reach the supervisor as soon as they are printed
    @Provides @Singleton PrintStream progressOut() {
        return new PrintStream(new FileOutputStream(FileDescriptor.out), true, StandardCharsets.UTF_8);
    }

    @Provides @Singleton CollectorOrchestrator orchestrator(WorkItemSource source, CheckpointStore checkpoints, ItemCollector collector,
                                                            BarCsvStore store, PrintStream out, Sleeper sleeper, Metrics metrics) {
        return new CollectorOrchestrator(source, checkpoints, collector, store, out, sleeper, config.pace(), metrics);
    }
}
