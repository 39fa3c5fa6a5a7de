package io.agentcron4j.cli;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentcron4j.AgentInvoker;
import io.agentcron4j.config.JobConfigLoader;
import io.agentcron4j.config.SchedulerProperties;
import io.agentcron4j.core.ExecutionRecord;
import io.agentcron4j.core.JobDefinition;
import io.agentcron4j.core.JobRegistry;
import io.agentcron4j.core.JobStatus;
import io.agentcron4j.core.OutputConfig;
import io.agentcron4j.core.SchedulerException;
import io.agentcron4j.internal.CompositeAgentInvoker;
import io.agentcron4j.internal.DefaultAgentScheduler;
import io.agentcron4j.internal.ExecutionEngine;
import io.agentcron4j.internal.LoggingErrorNotifier;
import io.agentcron4j.internal.output.OutputDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.concurrent.CountDownLatch;

/**
 * Command line entry point.
 *
 * <p>Agent invokers are discovered with {@link ServiceLoader}: put a jar on the classpath that
 * lists its implementation in {@code META-INF/services/io.agentcron4j.AgentInvoker}.
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private static final String RULE = "=".repeat(60);
    private static final DateTimeFormatter NEXT_RUN = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm z");

    public static void main(String[] args) {
        // exit explicitly: invokers may leave non-daemon threads behind
        System.exit(run(args, null, System.out, System.err));
    }

    /**
     * @param invokers agent invokers to use, or null to discover them with {@link ServiceLoader}
     * @return process exit code
     */
    static int run(String[] args, List<AgentInvoker> invokers, PrintStream out, PrintStream err) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(CliOptions.USAGE);
            return 2;
        }

        if (options.verbose()) {
            enableDebugLogging();
        }
        if (options.command() == CliOptions.Command.HELP) {
            out.println(CliOptions.USAGE);
            return 0;
        }

        Path configPath = options.config() != null ? options.config() : JobConfigLoader.defaultConfigPath();
        SchedulerProperties props = new SchedulerProperties();
        List<JobDefinition> jobs;
        try {
            jobs = new JobConfigLoader().load(configPath);
        } catch (SchedulerException e) {
            log.error("Configuration error: {}", e.getMessage());
            err.println("Configuration error: " + e.getMessage());
            return 1;
        }

        AgentInvoker invoker;
        if (options.command() == CliOptions.Command.LIST) {
            invoker = new CompositeAgentInvoker(List.of());
        } else {
            List<AgentInvoker> available;
            try {
                available = invokers != null ? invokers : discoverInvokers();
            } catch (ServiceConfigurationError e) {
                log.error("Failed to load agent invokers: {}", e.getMessage(), e);
                err.println("Failed to load agent invokers: " + e.getMessage());
                return 1;
            }
            if (available.isEmpty()) {
                err.println("No AgentInvoker found on the classpath (META-INF/services/" + AgentInvoker.class.getName() + ")");
                return 1;
            }
            invoker = CompositeAgentInvoker.of(available);
        }

        DefaultAgentScheduler scheduler = newScheduler(props, invoker);
        try {
            jobs.forEach(scheduler::add);
        } catch (SchedulerException e) {
            err.println("Configuration error: " + e.getMessage());
            return 1;
        }

        return switch (options.command()) {
            case LIST -> {
                printSchedule(scheduler, props.zone(), out);
                yield 0;
            }
            case RUN -> runJobOnce(scheduler, options.jobName(), out, err);
            case DAEMON -> runForever(scheduler, out);
            case HELP -> 0;
        };
    }

    static DefaultAgentScheduler newScheduler(SchedulerProperties props, AgentInvoker invoker) {
        Clock clock = Clock.systemUTC();
        ExecutionEngine engine = new ExecutionEngine(props, invoker, new LoggingErrorNotifier(), clock);
        OutputDispatcher dispatcher = new OutputDispatcher(OutputDispatcher.defaultRenderers(new ObjectMapper()), props.zone());
        return new DefaultAgentScheduler(props, new JobRegistry(), engine, dispatcher, clock);
    }

    private static List<AgentInvoker> discoverInvokers() {
        return ServiceLoader.load(AgentInvoker.class).stream()
                .map(ServiceLoader.Provider::get)
                .toList();
    }

    private static void printSchedule(DefaultAgentScheduler scheduler, ZoneId zone, PrintStream out) {
        out.println();
        out.println("Scheduled Jobs");
        out.println(RULE);
        for (JobStatus status : scheduler.statuses()) {
            JobDefinition job = scheduler.get(status.name());
            out.println();
            out.println("Job: " + job.name());
            if (job.description() != null) {
                out.println("  Description: " + job.description());
            }
            String kind = switch (job.target().kind()) {
                case AGENT -> "Agent";
                case TEAM -> "Team";
            };
            out.println("  " + kind + ": " + job.target().name());
            out.println("  Schedule: " + job.schedule().describe());
            out.println("  Task: " + job.task());
            OutputConfig output = job.output();
            if (output != null) {
                out.println("  Output: " + output.type().value() + " -> " + output.directory());
            }
            out.println("  Next run: " + (status.nextFireTime() == null
                    ? "never (" + status.disabledReason() + ")"
                    : NEXT_RUN.format(status.nextFireTime().atZone(zone))));
        }
        out.println();
        out.println(RULE);
    }

    private static int runJobOnce(DefaultAgentScheduler scheduler, String name, PrintStream out, PrintStream err) {
        try {
            ExecutionRecord record = scheduler.runOnce(name);
            Duration took = Duration.between(record.startedAt(), record.finishedAt());
            log.info("Job '{}' completed in {} ms", name, took.toMillis());
            out.println("Job '" + name + "' completed");
            return 0;
        } catch (SchedulerException e) {
            log.error("Job failed: {}", e.getMessage());
            err.println("Job failed: " + e.getMessage());
            return 1;
        }
    }

    private static int runForever(DefaultAgentScheduler scheduler, PrintStream out) {
        CountDownLatch stopped = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            log.info("Shutdown requested");
            scheduler.stop();
            stopped.countDown();
        }, "agent-scheduler.shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        scheduler.start();
        out.println("Scheduler running with " + scheduler.list().size() + " job(s). Press Ctrl+C to stop.");
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.stop();
        }
        return 0;
    }

    private static void enableDebugLogging() {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logback) {
            logback.setLevel(Level.DEBUG);
        }
    }
}
