package io.harvest.financial;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.harvest.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * CLI that collects minute bars for every listed instrument, resuming from the checkpoint.
 * Exit code 0 means the whole work list has been processed.
 */
@CommandLine.Command(name = "collect", mixinStandardHelpOptions = true, description = "Collect minute bars for all listed instruments into CSVs")
public final class CollectMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(CollectMain.class);

    @CommandLine.Option(names = {"-o", "--out"}, description = "Output directory for per-instrument CSVs")
    Path outDir;

    @CommandLine.Option(names = {"-m", "--meta-dir"}, description = "Directory holding the per-market listing CSVs")
    Path metaDir;

    @CommandLine.Option(names = {"-c", "--checkpoint"}, description = "Checkpoint file")
    Path checkpoint;

    @CommandLine.Option(names = "--max-calls", description = "Requests allowed per rate window")
    Integer maxCalls;

    @CommandLine.Option(names = "--window-seconds", description = "Rate window length in seconds")
    Long windowSeconds;

    @CommandLine.Option(names = "--lookback-days", description = "Days of history to collect (a 7-day buffer is added)")
    Integer lookbackDays;

    @CommandLine.Option(names = "--pace-ms", description = "Pause between instruments in milliseconds")
    Long paceMillis;

    @CommandLine.Option(names = "--provider", description = "Base URL of the chart endpoint")
    URI provider;

    public static void main(String[] args) {
        int code = new CommandLine(new CollectMain()).execute(args);
        System.exit(code);
    }

    CollectorConfig config() {
        CollectorConfig cfg = CollectorConfig.fromEnv();
        if (outDir != null) cfg = cfg.withOutDir(outDir);
        if (metaDir != null) cfg = cfg.withMetaDir(metaDir);
        if (checkpoint != null) cfg = cfg.withCheckpointFile(checkpoint);
        if (maxCalls != null || windowSeconds != null) {
            cfg = cfg.withRateLimit(maxCalls != null ? maxCalls : cfg.maxCalls(),
                    windowSeconds != null ? Duration.ofSeconds(windowSeconds) : cfg.window());
        }
        if (lookbackDays != null) cfg = cfg.withLookbackDays(lookbackDays);
        if (paceMillis != null) cfg = cfg.withPace(Duration.ofMillis(paceMillis));
        if (provider != null) cfg = cfg.withProviderUri(provider);
        return cfg;
    }

    @Override
    public Integer call() throws Exception {
        CollectorConfig cfg = config();
        log.info("collecting into {} (rate {} calls / {} s, lookback {}+{} days)", cfg.outDir(), cfg.maxCalls(),
                cfg.window().toSeconds(), cfg.lookbackDays(), cfg.bufferDays());
        Injector injector = Guice.createInjector(new CollectorModule(cfg));
        CollectorOrchestrator orchestrator = injector.getInstance(CollectorOrchestrator.class);
        Metrics metrics = injector.getInstance(Metrics.class);
        try {
            RunSummary summary = orchestrator.run();
            return summary.completed() ? 0 : 1;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("interrupted, stopping at the last saved checkpoint");
            return 130;
        } finally {
            metrics.report(log);
        }
    }
}
