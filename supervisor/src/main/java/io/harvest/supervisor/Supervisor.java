package io.harvest.supervisor;

import io.harvest.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the collector as a child process and restarts it whenever an item stays in "collecting"
 * for longer than the timeout, or the child ends without having finished cleanly.
 *
 * <p>Child output is echoed unchanged to {@code out}; the supervisor's own messages go to the log.
 * The batch ends when the child exits with code 0 while no item is in flight, when the restart
 * limit is exceeded, or when {@link #stop()} is called.
 */
public class Supervisor {
    private static final Logger log = LoggerFactory.getLogger(Supervisor.class);

    public enum Outcome {
        COMPLETED(0), ABORTED(1), INTERRUPTED(130);

        private final int exitCode;

        Outcome(int exitCode) { this.exitCode = exitCode; }

        public int exitCode() { return exitCode; }
    }

    private enum RunEnd { FINISHED, RESTART, STOPPED }

    private final SupervisorConfig config;
    private final ChildLauncher launcher;
    private final LineClassifier classifier;
    private final PrintStream out;
    private final Clock clock;
    private final Metrics metrics;

    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final AtomicReference<Process> current = new AtomicReference<>();
    private volatile int restarts;

    public Supervisor(SupervisorConfig config, ChildLauncher launcher, LineClassifier classifier,
                      PrintStream out, Clock clock, Metrics metrics) {
        this.config = Objects.requireNonNull(config);
        this.launcher = Objects.requireNonNull(launcher);
        this.classifier = Objects.requireNonNull(classifier);
        this.out = Objects.requireNonNull(out);
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.metrics = Objects.requireNonNull(metrics);
    }

    public Outcome run() {
        while (true) {
            if (stopped.get()) return Outcome.INTERRUPTED;
            log.info("starting child (timeout {} s)", config.timeout().toSeconds());
            RunEnd end = runOnce();
            if (end == RunEnd.STOPPED) {
                log.info("stopped by user");
                return Outcome.INTERRUPTED;
            }
            if (end == RunEnd.FINISHED) {
                log.info("child finished cleanly");
                return Outcome.COMPLETED;
            }

            restarts++;
            metrics.counter("supervisor.restarts").inc();
            if (config.maxRestarts() > 0 && restarts > config.maxRestarts()) {
                log.error("restart limit ({}) exceeded, giving up", config.maxRestarts());
                return Outcome.ABORTED;
            }
            log.info("restarting in {} s (restart #{})", config.restartDelay().toSeconds(), restarts);
            try {
                if (stopSignal.await(config.restartDelay().toMillis(), TimeUnit.MILLISECONDS)) return Outcome.INTERRUPTED;
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return Outcome.INTERRUPTED;
            }
        }
    }

    /** Ends the batch: kills the running child and prevents any restart. Safe to call from any thread. */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) return;
        stopSignal.countDown();
        Process child = current.get();
        if (child != null) forceKill(child);
    }

    public int restarts() { return restarts; }

    private RunEnd runOnce() {
        Process child;
        try {
            child = launcher.launch();
        } catch (IOException e) {
            log.error("could not start child: {}", e.getMessage(), e);
            return RunEnd.RESTART;
        }
        metrics.counter("supervisor.launches").inc();
        current.set(child);
        BlockingQueue<ChildLine> lines = new LinkedBlockingQueue<>();
        Thread reader = new Thread(new OutputPump(child.getInputStream(), lines), "child-output");
        reader.setDaemon(true);
        reader.start();
        LivenessTracker tracker = new LivenessTracker(config.timeout());
        try {
            while (true) {
                if (stopped.get()) {
                    forceKill(child);
                    return RunEnd.STOPPED;
                }
                ChildLine line = lines.poll(config.pollInterval().toMillis(), TimeUnit.MILLISECONDS);
                Instant now = clock.instant();
                if (line != null && line.isEndOfStream()) {
                    return onStreamEnd(child, tracker);
                }
                if (line != null) {
                    out.println(line.text());
                    out.flush();
                    LivenessEvent event = classifier.classify(line.text());
                    if (event.kind() == LivenessEvent.Kind.SAVED) {
                        log.debug("saved detected; rows={}, elapsed={} ms", event.rows(), tracker.armedFor(now).toMillis());
                    }
                    tracker.onEvent(event, now);
                }
                if (tracker.isTimedOut(now)) {
                    metrics.counter("supervisor.timeouts").inc();
                    log.warn("no progress for {} s after collecting started, killing child", config.timeout().toSeconds());
                    tracker.terminate();
                    terminate(child);
                    return RunEnd.RESTART;
                }
                if (line == null && !child.isAlive()) {
                    // exited; give the reader a moment to deliver the rest of the output
                    reader.join(config.exitWait().toMillis());
                    if (!reader.isAlive()) continue;
                    log.warn("child exited with code {} but its output is still open", child.exitValue());
                    return child.exitValue() == 0 && tracker.state() == LivenessTracker.State.IDLE ? RunEnd.FINISHED : RunEnd.RESTART;
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            forceKill(child);
            return RunEnd.STOPPED;
        } catch (RuntimeException e) {
            log.error("supervisor error, restarting child", e);
            forceKill(child);
            return RunEnd.RESTART;
        } finally {
            current.set(null);
        }
    }

    private RunEnd onStreamEnd(Process child, LivenessTracker tracker) throws InterruptedException {
        if (!child.waitFor(config.exitWait().toMillis(), TimeUnit.MILLISECONDS)) {
            log.warn("child closed its output but is still running, killing it");
            terminate(child);
            return RunEnd.RESTART;
        }
        int code = child.exitValue();
        if (code == 0 && tracker.state() == LivenessTracker.State.IDLE) return RunEnd.FINISHED;
        if (code == 0) {
            log.warn("child exited with code 0 in the middle of an item");
        } else {
            log.warn("child exited with code {}", code);
        }
        return RunEnd.RESTART;
    }

    /** Polite stop first, then force after the grace period. */
    private void terminate(Process child) throws InterruptedException {
        child.descendants().forEach(ProcessHandle::destroy);
        child.destroy();
        if (!child.waitFor(config.grace().toMillis(), TimeUnit.MILLISECONDS)) {
            log.info("child still alive after {} ms, forcing", config.grace().toMillis());
            forceKill(child);
        }
    }

    private static void forceKill(Process child) {
        child.descendants().forEach(ProcessHandle::destroyForcibly);
        child.destroyForcibly();
    }
}
