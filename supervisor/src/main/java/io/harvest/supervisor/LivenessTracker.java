package io.harvest.supervisor;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Timer armed by a collecting marker and cleared by a saved or item-start marker. An item that stays
 * armed for longer than the timeout is considered stuck.
 */
public class LivenessTracker {
    public enum State { IDLE, ARMED, TERMINATING }

    private final Duration timeout;
    private State state = State.IDLE;
    private Instant armedAt;

    public LivenessTracker(Duration timeout) {
        this.timeout = Objects.requireNonNull(timeout);
        if (timeout.isNegative() || timeout.isZero()) throw new IllegalArgumentException("timeout must be positive");
    }

    public void onEvent(LivenessEvent event, Instant now) {
        if (state == State.TERMINATING) return;
        switch (event.kind()) {
            case COLLECTING -> {
                state = State.ARMED;
                armedAt = now;
            }
            case SAVED, START_ITEM -> {
                state = State.IDLE;
                armedAt = null;
            }
            default -> { }
        }
    }

    public boolean isTimedOut(Instant now) {
        return state == State.ARMED && Duration.between(armedAt, now).compareTo(timeout) > 0;
    }

    public void terminate() {
        state = State.TERMINATING;
    }

    public State state() { return state; }

    /** Time since the current item started collecting, zero when not armed. */
    public Duration armedFor(Instant now) {
        return state == State.ARMED ? Duration.between(armedAt, now) : Duration.ZERO;
    }
}
