package io.harvest.financial;

import io.harvest.budget.QuotaProbe;
import io.harvest.core.WorkItem;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Upstream source of one-minute bars. An answer may be empty, and may silently be coarser than
 * requested without any error.
 */
public interface MinuteBarProvider {
    List<Bar> requestChunk(WorkItem item, LocalDate from, LocalDate to) throws ProviderException, InterruptedException;

    /**
     * How far back minute data is served, counted in days before today. Windows reaching further back
     * are cut to this.
     */
    default int maxLookbackDays() {
        return Integer.MAX_VALUE;
    }

    /** Widest range, in days, a single {@link #requestChunk} call accepts. */
    default int maxRangeDays() {
        return Integer.MAX_VALUE;
    }

    /** The upstream's own quota signal, when it exposes one. */
    default Optional<QuotaProbe> quota() {
        return Optional.empty();
    }
}
