package io.agentcron4j.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.agentcron4j.core.ConfigException;
import io.agentcron4j.core.ExecutionTarget;
import io.agentcron4j.core.InvalidScheduleException;
import io.agentcron4j.core.JobDefinition;
import io.agentcron4j.core.OutputConfig;
import io.agentcron4j.core.OutputType;
import io.agentcron4j.schedule.ScheduleResolver;
import io.agentcron4j.schedule.ScheduleSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.convert.DurationStyle;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads job definitions from a YAML job file.
 *
 * <pre>
 * jobs:
 *   - name: morning-brief
 *     schedule: "0 8 * * 1-5"          # or {hour: 8, minute: 0, day_of_week: "mon-fri"}
 *     agent: investment                # or team: research
 *     task: Summarize overnight market moves
 *     instructions: ["Be concise"]
 *     timeout: 10m                     # plain numbers are seconds
 *     output:
 *       type: pdf                      # pdf, markdown, html, json, text
 *       path: output/briefs
 *       filename: brief_&lt;date_timestamp&gt;
 *       title: Morning Brief
 *     notify_on_error: true
 * </pre>
 *
 * Other top-level sections (such as {@code agents} or {@code teams}) are ignored.
 */
public class JobConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(JobConfigLoader.class);

    public static final String DEFAULT_FILE_NAME = "scheduler.yaml";
    public static final String USER_CONFIG_DIR = ".agentcron4j";

    @JsonIgnoreProperties(ignoreUnknown = true)
    record JobFile(List<JobEntry> jobs) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record JobEntry(
            String name,
            String description,
            Object schedule,
            String agent,
            String team,
            String task,
            List<String> instructions,
            String timeout,
            OutputEntry output,
            @JsonProperty("notify_on_error") @JsonAlias("notifyOnError") Boolean notifyOnError
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record OutputEntry(
            String type,
            @JsonAlias("directory") String path,
            String filename,
            String title
    ) {
    }

    private final ObjectMapper yamlMapper;

    public JobConfigLoader() {
        this(new YAMLMapper());
    }

    public JobConfigLoader(ObjectMapper yamlMapper) {
        this.yamlMapper = Objects.requireNonNull(yamlMapper, "yamlMapper must not be null");
    }

    /**
     * @throws ConfigException if the file is missing, unreadable or invalid
     */
    public List<JobDefinition> load(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        if (!Files.isRegularFile(file)) {
            throw new ConfigException("Configuration file not found: " + file);
        }
        log.info("Loading job configuration from: {}", file);
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return load(reader, file.toString());
        } catch (IOException e) {
            throw new ConfigException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    public List<JobDefinition> load(Reader reader, String source) {
        JobFile jobFile;
        try {
            JsonNode root = yamlMapper.readTree(reader);
            if (root == null || root.isMissingNode() || !root.isObject()) {
                throw new ConfigException("Configuration file must contain a YAML mapping: " + source);
            }
            jobFile = yamlMapper.treeToValue(root, JobFile.class);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Invalid YAML in " + source + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigException("Failed to read " + source + ": " + e.getMessage(), e);
        }

        if (jobFile.jobs() == null || jobFile.jobs().isEmpty()) {
            throw new ConfigException("Configuration must contain a non-empty 'jobs' section: " + source);
        }

        List<JobDefinition> jobs = new ArrayList<>(jobFile.jobs().size());
        Set<String> names = new HashSet<>();
        for (JobEntry entry : jobFile.jobs()) {
            JobDefinition job = toDefinition(entry);
            if (!names.add(job.name())) {
                throw new ConfigException("Duplicate job name: " + job.name());
            }
            jobs.add(job);
        }
        log.info("Validated {} job(s) from {}", jobs.size(), source);
        return jobs;
    }

    private JobDefinition toDefinition(JobEntry entry) {
        if (entry == null || isBlank(entry.name())) {
            throw new ConfigException("All jobs must have a 'name' field");
        }
        String name = entry.name().trim();

        if (entry.schedule() == null) {
            throw new ConfigException("Job '" + name + "' must have a 'schedule' field");
        }
        ScheduleSpec schedule = toSchedule(name, entry.schedule());

        boolean hasAgent = !isBlank(entry.agent());
        boolean hasTeam = !isBlank(entry.team());
        if (!hasAgent && !hasTeam) {
            throw new ConfigException("Job '" + name + "' must specify either 'agent' or 'team'");
        }
        if (hasAgent && hasTeam) {
            throw new ConfigException("Job '" + name + "' cannot specify both 'agent' and 'team'");
        }
        ExecutionTarget target = hasAgent ? ExecutionTarget.agent(entry.agent().trim()) : ExecutionTarget.team(entry.team().trim());

        if (isBlank(entry.task())) {
            throw new ConfigException("Job '" + name + "' must have a 'task' field describing what to do");
        }

        return new JobDefinition(
                name,
                entry.description(),
                schedule,
                target,
                entry.task().trim(),
                entry.instructions(),
                toTimeout(name, entry.timeout()),
                toOutput(name, entry.output()),
                Boolean.TRUE.equals(entry.notifyOnError())
        );
    }

    @SuppressWarnings("unchecked")
    private static ScheduleSpec toSchedule(String name, Object raw) {
        ScheduleSpec spec;
        try {
            if (raw instanceof String s) {
                spec = ScheduleSpec.cron(s);
            } else if (raw instanceof Map<?, ?> m) {
                spec = ScheduleSpec.fields((Map<String, ?>) m);
            } else {
                throw new ConfigException("Job '" + name + "' schedule must be a cron string or a mapping of time fields");
            }
            ScheduleResolver.parse(spec);
        } catch (InvalidScheduleException e) {
            throw new ConfigException("Job '" + name + "' has an invalid schedule: " + e.getMessage(), e);
        }
        return spec;
    }

    private static Duration toTimeout(String name, String raw) {
        if (isBlank(raw)) {
            return null;
        }
        Duration timeout;
        try {
            timeout = DurationStyle.detectAndParse(raw.trim(), ChronoUnit.SECONDS);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Job '" + name + "' has an invalid timeout: " + raw, e);
        }
        if (timeout.isZero() || timeout.isNegative()) {
            throw new ConfigException("Job '" + name + "' timeout must be positive: " + raw);
        }
        return timeout;
    }

    private static OutputConfig toOutput(String name, OutputEntry output) {
        if (output == null) {
            return null;
        }
        if (isBlank(output.type())) {
            throw new ConfigException("Job '" + name + "' output must have a 'type' field");
        }
        OutputType type;
        try {
            type = OutputType.fromValue(output.type());
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Job '" + name + "' output type must be one of: " + OutputType.names(), e);
        }
        return new OutputConfig(
                type,
                isBlank(output.path()) ? null : Path.of(output.path().trim()),
                output.filename(),
                output.title()
        );
    }

    /**
     * {@code ./scheduler.yaml} if present, else {@code ~/.agentcron4j/scheduler.yaml} if present,
     * else {@code ./scheduler.yaml}.
     */
    public static Path defaultConfigPath() {
        return defaultConfigPath(Path.of(""), Path.of(System.getProperty("user.home")));
    }

    static Path defaultConfigPath(Path workingDir, Path home) {
        Path local = workingDir.resolve(DEFAULT_FILE_NAME);
        if (Files.exists(local)) {
            return local;
        }
        Path user = home.resolve(USER_CONFIG_DIR).resolve(DEFAULT_FILE_NAME);
        if (Files.exists(user)) {
            return user;
        }
        return local;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
