package io.harvest.supervisor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Supervisor settings. {@code maxRestarts} 0 means restart forever.
 */
public record SupervisorConfig(
        List<String> command,
        Duration timeout,
        Duration restartDelay,
        int maxRestarts,
        Duration grace,
        Duration pollInterval,
        Duration exitWait
) {
    public static final String COLLECTOR_MAIN = "io.harvest.financial.CollectMain";

    public SupervisorConfig {
        command = List.copyOf(command);
        if (command.isEmpty()) throw new IllegalArgumentException("command must not be empty");
        if (maxRestarts < 0) throw new IllegalArgumentException("maxRestarts must be >= 0");
    }

    public static SupervisorConfig fromEnv() {
        String cmd = setting("harvest.supervisor.command", "HARVEST_SUPERVISOR_COMMAND", null);
        List<String> command = cmd == null || cmd.isBlank() ? defaultCommand() : Arrays.asList(cmd.trim().split("\\s+"));
        long timeoutSec = Long.parseLong(setting("harvest.supervisor.timeoutSeconds", "HARVEST_SUPERVISOR_TIMEOUT_SECONDS", "240"));
        long delaySec = Long.parseLong(setting("harvest.supervisor.retryDelaySeconds", "HARVEST_SUPERVISOR_RETRY_DELAY_SECONDS", "15"));
        int maxRestarts = Integer.parseInt(setting("harvest.supervisor.maxRestarts", "HARVEST_SUPERVISOR_MAX_RESTARTS", "0"));
        long graceMs = Long.parseLong(setting("harvest.supervisor.graceMillis", "HARVEST_SUPERVISOR_GRACE_MILLIS", "1000"));
        return new SupervisorConfig(command, Duration.ofSeconds(timeoutSec), Duration.ofSeconds(delaySec), maxRestarts,
                Duration.ofMillis(graceMs), Duration.ofSeconds(1), Duration.ofSeconds(3));
    }

    /** The collector on this JVM's own runtime and classpath. */
    public static List<String> defaultCommand() {
        String java = ProcessHandle.current().info().command().orElse("java");
        List<String> cmd = new ArrayList<>();
        cmd.add(java);
        cmd.add("-cp");
        cmd.add(System.getProperty("java.class.path"));
        cmd.add(COLLECTOR_MAIN);
        return cmd;
    }

    private static String setting(String property, String env, String def) {
        String v = System.getProperty(property);
        if (v != null) return v;
        v = System.getenv(env);
        return v != null ? v : def;
    }

    public SupervisorConfig withCommand(List<String> c) { return new SupervisorConfig(c, timeout, restartDelay, maxRestarts, grace, pollInterval, exitWait); }
    public SupervisorConfig withTimeout(Duration d) { return new SupervisorConfig(command, d, restartDelay, maxRestarts, grace, pollInterval, exitWait); }
    public SupervisorConfig withRestartDelay(Duration d) { return new SupervisorConfig(command, timeout, d, maxRestarts, grace, pollInterval, exitWait); }
    public SupervisorConfig withMaxRestarts(int n) { return new SupervisorConfig(command, timeout, restartDelay, n, grace, pollInterval, exitWait); }
    public SupervisorConfig withGrace(Duration d) { return new SupervisorConfig(command, timeout, restartDelay, maxRestarts, d, pollInterval, exitWait); }
    public SupervisorConfig withPollInterval(Duration d) { return new SupervisorConfig(command, timeout, restartDelay, maxRestarts, grace, d, exitWait); }
    public SupervisorConfig withExitWait(Duration d) { return new SupervisorConfig(command, timeout, restartDelay, maxRestarts, grace, pollInterval, d); }
}
