package io.harvest.core;

import java.time.Duration;

/**
 * Blocking pause used wherever the collector waits on wall-clock time, so tests can substitute
 * a fake that advances a clock instead of sleeping.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = d -> {
        if (d.isNegative() || d.isZero()) return;
        Thread.sleep(d.toMillis(), (int) (d.toNanosPart() % 1_000_000));
    };

    void sleep(Duration duration) throws InterruptedException;
}
