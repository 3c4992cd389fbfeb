package io.harvest.financial;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.harvest.budget.RateLimiter;
import io.harvest.checkpoint.CheckpointStore;
import io.harvest.checkpoint.JsonCheckpointStore;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CollectorModuleTest {
    @Test
    void sharesOneLimiterAndHonoursConfig() {
        CollectorConfig cfg = CollectorConfig.fromEnv()
                .withRateLimit(5, Duration.ofSeconds(10))
                .withCheckpointFile(Path.of("target", "cp.json"));
        Injector injector = Guice.createInjector(new CollectorModule(cfg));

        RateLimiter limiter = injector.getInstance(RateLimiter.class);
        assertSame(limiter, injector.getInstance(RateLimiter.class));
        assertEquals(5, limiter.maxCalls());
        assertEquals(Duration.ofSeconds(10), limiter.window());

        assertTrue(injector.getInstance(ItemCollector.class) instanceof ChunkedFetcher);
        CheckpointStore cp = injector.getInstance(CheckpointStore.class);
        assertEquals(Path.of("target", "cp.json"), ((JsonCheckpointStore) cp).file());
    }
}
