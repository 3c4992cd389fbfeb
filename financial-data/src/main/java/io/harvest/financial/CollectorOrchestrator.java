package io.harvest.financial;

import com.codahale.metrics.Timer;
import io.harvest.checkpoint.Checkpoint;
import io.harvest.checkpoint.CheckpointStore;
import io.harvest.core.Sleeper;
import io.harvest.core.WorkItem;
import io.harvest.core.WorkItemSource;
import io.harvest.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Walks the work list from the checkpointed position, collecting and saving one item at a time.
 *
 * <p>Progress goes to {@code out} as plain lines that the supervisor watches:
 * {@code [i/total] <item> -> collecting...}, {@code [i/total] <item> -> exists, skip} and
 * {@code saved <N> rows}. The checkpoint advances by one after every item, whatever the outcome.
 */
public class CollectorOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(CollectorOrchestrator.class);

    private final WorkItemSource source;
    private final CheckpointStore checkpoints;
    private final ItemCollector collector;
    private final BarCsvStore store;
    private final PrintStream out;
    private final Sleeper sleeper;
    private final Duration pace;
    private final Metrics metrics;

    public CollectorOrchestrator(WorkItemSource source,
                                 CheckpointStore checkpoints,
                                 ItemCollector collector,
                                 BarCsvStore store,
                                 PrintStream out,
                                 Sleeper sleeper,
                                 Duration pace,
                                 Metrics metrics) {
        this.source = Objects.requireNonNull(source);
        this.checkpoints = Objects.requireNonNull(checkpoints);
        this.collector = Objects.requireNonNull(collector);
        this.store = Objects.requireNonNull(store);
        this.out = Objects.requireNonNull(out);
        this.sleeper = Objects.requireNonNull(sleeper);
        this.pace = pace == null ? Duration.ZERO : pace;
        this.metrics = Objects.requireNonNull(metrics);
    }

    public RunSummary run() throws IOException, InterruptedException {
        List<WorkItem> fresh = source.listItems();
        Checkpoint cp = checkpoints.load().reconcile(fresh);
        List<WorkItem> items = cp.items();
        int total = items.size();
        int start = Math.min(cp.nextIndex(), total);
        emit("total " + total + " items, starting at #" + (start + 1));

        int saved = 0, skipped = 0, empty = 0, failed = 0;
        long rows = 0;
        for (int i = start; i < total; i++) {
            WorkItem item = items.get(i);
            String prefix = "[" + (i + 1) + "/" + total + "] " + item;

            if (store.isComplete(item)) {
                emit(prefix + " -> exists, skip");
                metrics.counter("items.skipped").inc();
                skipped++;
                checkpoints.save(i + 1, items);
                continue;
            }

            emit(prefix + " -> collecting...");
            try (Timer.Context ignored = metrics.timer("item.collect.time").time()) {
                BarSet bars = collector.collect(item);
                if (bars.isEmpty()) {
                    emit(" empty");
                    metrics.counter("items.empty").inc();
                    empty++;
                } else {
                    store.write(item, bars);
                    emit("saved " + bars.size() + " rows");
                    metrics.counter("items.saved").inc();
                    metrics.counter("rows.saved").inc(bars.size());
                    saved++;
                    rows += bars.size();
                }
            } catch (InterruptedException ie) {
                throw ie;
            } catch (Exception e) {
                emit(" FAILED (" + e.getMessage() + ")");
                log.warn("collecting {} failed", item, e);
                metrics.counter("items.failed").inc();
                failed++;
            }

            checkpoints.save(i + 1, items);
            sleeper.sleep(pace);
        }
        RunSummary summary = new RunSummary(total, start, total - start, saved, skipped, empty, failed, rows);
        log.info("run finished: {}", summary);
        return summary;
    }

    private void emit(String line) {
        out.println(line);
        out.flush();
    }
}
