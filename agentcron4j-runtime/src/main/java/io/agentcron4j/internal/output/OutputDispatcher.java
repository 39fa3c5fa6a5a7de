package io.agentcron4j.internal.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentcron4j.OutputRenderer;
import io.agentcron4j.core.ExecutionOutcome;
import io.agentcron4j.core.ExecutionRecord;
import io.agentcron4j.core.JobDefinition;
import io.agentcron4j.core.OutputArtifact;
import io.agentcron4j.core.OutputConfig;
import io.agentcron4j.core.OutputType;
import io.agentcron4j.core.OutputWriteException;
import io.agentcron4j.core.RenderMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Routes a successful execution's text to the renderer of the job's output type and writes the
 * bytes to {@code {directory}/{base}_{yyyyMMdd_HHmmss}.{ext}}.
 *
 * <p>The base filename is the configured filename or the job name. {@code <job_name>} and
 * {@code <date_timestamp>} placeholders are substituted; when the latter is present no timestamp
 * suffix is appended. Existing files are never overwritten, a {@code _1}, {@code _2}, ... suffix
 * is added instead.
 */
public class OutputDispatcher {
    private static final Logger log = LoggerFactory.getLogger(OutputDispatcher.class);

    public static final String DEFAULT_TITLE = "Agent Report";
    static final String JOB_NAME_PLACEHOLDER = "<job_name>";
    static final String TIMESTAMP_PLACEHOLDER = "<date_timestamp>";
    static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private static final Pattern ILLEGAL_FILENAME_CHARS = Pattern.compile("[\\\\/:*?\"<>|\\p{Cntrl}]");
    private static final int MAX_COLLISION_SUFFIX = 10_000;

    private final Map<OutputType, OutputRenderer> renderers = new EnumMap<>(OutputType.class);
    private final ZoneId zone;

    public OutputDispatcher(List<? extends OutputRenderer> renderers, ZoneId zone) {
        Objects.requireNonNull(renderers, "renderers must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        for (OutputRenderer renderer : renderers) {
            // later registrations replace the built-in renderer of the same type
            this.renderers.put(renderer.type(), renderer);
        }
    }

    /**
     * One renderer per {@link OutputType}.
     */
    public static List<OutputRenderer> defaultRenderers(ObjectMapper objectMapper) {
        return List.of(
                new PdfRenderer(),
                new TextRenderer(OutputType.MARKDOWN),
                new HtmlRenderer(),
                new JsonRenderer(objectMapper),
                new TextRenderer(OutputType.TEXT)
        );
    }

    /**
     * Writes the artifact for a successful record of a job with output configured.
     *
     * @return the written artifact, empty for failures and jobs without output
     * @throws OutputWriteException if the directory cannot be created or the artifact cannot be
     *                              rendered or written
     */
    public Optional<OutputArtifact> dispatch(JobDefinition job, ExecutionRecord record) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(record, "record must not be null");

        if (!(record.outcome() instanceof ExecutionOutcome.Success success)) {
            log.debug("agent-scheduler no output for failed execution name={}", job.name());
            return Optional.empty();
        }
        OutputConfig output = job.output();
        if (output == null) {
            log.info("agent-scheduler job result name={} chars={} (no output configured)",
                    job.name(), success.content().length());
            log.debug("agent-scheduler job result name={} content={}", job.name(), success.content());
            return Optional.empty();
        }

        OutputRenderer renderer = renderers.get(output.type());
        if (renderer == null) {
            throw new OutputWriteException("No renderer registered for output type " + output.type().value(), null);
        }

        RenderMetadata metadata = new RenderMetadata(
                output.title() != null ? output.title() : DEFAULT_TITLE,
                record.finishedAt(),
                job.name(),
                zone
        );

        byte[] bytes;
        try {
            bytes = renderer.render(success.content(), metadata);
        } catch (IOException | RuntimeException e) {
            throw new OutputWriteException(
                    "Failed to render " + output.type().value() + " output for job '" + job.name() + "'", e);
        }

        Path directory = output.directory();
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new OutputWriteException("Failed to create output directory " + directory, e);
        }

        String base = baseFilename(job.name(), output.filename(), metadata);
        Path path = write(directory, base, output.type().extension(), bytes);

        log.info("agent-scheduler output written name={} type={} path={} bytes={}",
                job.name(), output.type().value(), path, bytes.length);
        return Optional.of(new OutputArtifact(path, output.type(), bytes.length));
    }

    /**
     * Base filename without extension, placeholders substituted and illegal characters replaced.
     */
    String baseFilename(String jobName, String configured, RenderMetadata metadata) {
        String timestamp = FILE_TIMESTAMP.format(metadata.localTimestamp());
        String base;
        if (configured == null) {
            base = jobName + "_" + timestamp;
        } else if (configured.contains(TIMESTAMP_PLACEHOLDER)) {
            base = configured.replace(TIMESTAMP_PLACEHOLDER, timestamp);
        } else {
            base = configured + "_" + timestamp;
        }
        base = base.replace(JOB_NAME_PLACEHOLDER, jobName);
        base = ILLEGAL_FILENAME_CHARS.matcher(base).replaceAll("_").trim();
        return base.isEmpty() ? "output_" + timestamp : base;
    }

    private static Path write(Path directory, String base, String extension, byte[] bytes) {
        for (int attempt = 0; attempt < MAX_COLLISION_SUFFIX; attempt++) {
            String name = attempt == 0 ? base + "." + extension : base + "_" + attempt + "." + extension;
            Path path = directory.resolve(name);
            try {
                Files.write(path, bytes, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                return path;
            } catch (FileAlreadyExistsException e) {
                log.debug("agent-scheduler output file exists, trying next suffix path={}", path);
            } catch (IOException e) {
                throw new OutputWriteException("Failed to write output file " + path, e);
            }
        }
        throw new OutputWriteException(
                "Too many existing output files for " + directory.resolve(base + "." + extension), null);
    }
}
