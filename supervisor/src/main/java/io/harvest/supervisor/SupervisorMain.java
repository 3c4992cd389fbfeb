package io.harvest.supervisor;

import com.codahale.metrics.MetricRegistry;
import io.harvest.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Watchdog CLI. Everything after {@code --} is the command to supervise; without it the collector
 * is started on this JVM's classpath.
 */
@CommandLine.Command(name = "supervise", mixinStandardHelpOptions = true, description = "Run the collector and restart it when an item hangs")
public final class SupervisorMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(SupervisorMain.class);

    @CommandLine.Option(names = "--timeout", description = "Seconds an item may stay in collecting before the child is restarted")
    Long timeoutSeconds;

    @CommandLine.Option(names = "--retry-delay", description = "Seconds to wait before a restart")
    Long retryDelaySeconds;

    @CommandLine.Option(names = "--max-restarts", description = "Restart limit, 0 for unlimited")
    Integer maxRestarts;

    @CommandLine.Option(names = "--grace-ms", description = "Milliseconds between polite and forced kill")
    Long graceMillis;

    @CommandLine.Parameters(arity = "0..*", paramLabel = "COMMAND", description = "Command to supervise")
    List<String> command;

    public static void main(String[] args) {
        int code = new CommandLine(new SupervisorMain()).execute(args);
        System.exit(code);
    }

    SupervisorConfig config() {
        SupervisorConfig cfg = SupervisorConfig.fromEnv();
        if (command != null && !command.isEmpty()) cfg = cfg.withCommand(command);
        if (timeoutSeconds != null) cfg = cfg.withTimeout(Duration.ofSeconds(timeoutSeconds));
        if (retryDelaySeconds != null) cfg = cfg.withRestartDelay(Duration.ofSeconds(retryDelaySeconds));
        if (maxRestarts != null) cfg = cfg.withMaxRestarts(maxRestarts);
        if (graceMillis != null) cfg = cfg.withGrace(Duration.ofMillis(graceMillis));
        return cfg;
    }

    @Override
    public Integer call() {
        SupervisorConfig cfg = config();
        log.info("supervising: {}", String.join(" ", cfg.command()));
        Metrics metrics = new Metrics(new MetricRegistry());
        PrintStream out = new PrintStream(new FileOutputStream(FileDescriptor.out), true, StandardCharsets.UTF_8);
        Supervisor supervisor = new Supervisor(cfg, new ProcessBuilderLauncher(cfg.command()), new RegexLineClassifier(),
                out, Clock.systemUTC(), metrics);
        Runtime.getRuntime().addShutdownHook(new Thread(supervisor::stop, "supervisor-stop"));

        Supervisor.Outcome outcome = supervisor.run();
        log.info("outcome {} after {} restarts", outcome, supervisor.restarts());
        metrics.report(log);
        return outcome.exitCode();
    }
}
