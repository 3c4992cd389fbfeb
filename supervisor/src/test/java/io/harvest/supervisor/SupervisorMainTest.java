package io.harvest.supervisor;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SupervisorMainTest {
    @Test
    void commandAfterDoubleDashIsSupervised() {
        SupervisorMain main = new SupervisorMain();
        new CommandLine(main).parseArgs("--timeout", "60", "--max-restarts", "3", "--", "python", "-u", "collect.py");
        SupervisorConfig cfg = main.config();
        assertEquals(List.of("python", "-u", "collect.py"), cfg.command());
        assertEquals(Duration.ofSeconds(60), cfg.timeout());
        assertEquals(3, cfg.maxRestarts());
    }

    @Test
    void defaultsRunTheCollectorOnThisClasspath() {
        SupervisorMain main = new SupervisorMain();
        new CommandLine(main).parseArgs();
        SupervisorConfig cfg = main.config();
        if (System.getenv("HARVEST_SUPERVISOR_COMMAND") == null) {
            assertEquals(SupervisorConfig.COLLECTOR_MAIN, cfg.command().get(cfg.command().size() - 1));
        }
        if (System.getenv("HARVEST_SUPERVISOR_TIMEOUT_SECONDS") == null) {
            assertEquals(Duration.ofSeconds(240), cfg.timeout());
        }
        assertEquals(Duration.ofSeconds(1), cfg.pollInterval());
        assertThrows(IllegalArgumentException.class, () -> cfg.withMaxRestarts(-1));
    }
}
