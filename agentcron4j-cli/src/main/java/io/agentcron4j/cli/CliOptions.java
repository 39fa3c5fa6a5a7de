package io.agentcron4j.cli;

import java.nio.file.Path;

/**
 * Parsed command line.
 *
 * @param config  job file, null to use the default location
 * @param command what to do; {@link Command#HELP} when no command was given
 * @param jobName job to run for {@link Command#RUN}
 * @param verbose debug logging
 */
public record CliOptions(Path config, Command command, String jobName, boolean verbose) {

    public enum Command {
        LIST,
        RUN,
        DAEMON,
        HELP
    }

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: agentcron4j [--config|-c FILE] (--list|-l | --run|-r JOB | --daemon|-d) [--verbose|-v]",
            "",
            "  -c, --config FILE   job configuration file (default: ./scheduler.yaml, then ~/.agentcron4j/scheduler.yaml)",
            "  -l, --list          list all scheduled jobs",
            "  -r, --run JOB       run a job once, immediately",
            "  -d, --daemon        run the scheduler until interrupted",
            "  -v, --verbose       enable debug logging",
            "  -h, --help          show this help");

    /**
     * When several commands are given, list wins over run, and run over daemon.
     *
     * @throws IllegalArgumentException on unknown options or missing option values
     */
    public static CliOptions parse(String[] args) {
        Path config = null;
        String run = null;
        boolean list = false;
        boolean daemon = false;
        boolean verbose = false;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String inlineValue = null;
            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 0) {
                inlineValue = arg.substring(eq + 1);
                arg = arg.substring(0, eq);
            }

            switch (arg) {
                case "--config", "-c" -> {
                    String value = inlineValue != null ? inlineValue : valueOf(args, ++i, arg);
                    config = Path.of(value);
                }
                case "--run", "-r" -> run = inlineValue != null ? inlineValue : valueOf(args, ++i, arg);
                case "--list", "-l" -> list = true;
                case "--daemon", "-d" -> daemon = true;
                case "--verbose", "-v" -> verbose = true;
                case "--help", "-h" -> help = true;
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        if (run != null && run.isBlank()) {
            throw new IllegalArgumentException("--run requires a job name");
        }

        Command command;
        if (help) {
            command = Command.HELP;
        } else if (list) {
            command = Command.LIST;
        } else if (run != null) {
            command = Command.RUN;
        } else if (daemon) {
            command = Command.DAEMON;
        } else {
            command = Command.HELP;
        }
        return new CliOptions(config, command, command == Command.RUN ? run.trim() : null, verbose);
    }

    private static String valueOf(String[] args, int index, String option) {
        if (index >= args.length || args[index].startsWith("-")) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        return args[index];
    }
}
