package io.minicron.core.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.minicron.core.cron.CronExpression;
import io.minicron.core.cron.ScheduleCalculator;
import io.minicron.core.error.ConflictException;
import io.minicron.core.error.StorageException;
import io.minicron.core.error.UnschedulableException;
import io.minicron.core.error.ValidationException;
import io.minicron.core.log.RunStatus;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link JobStore} backed by a single JSON file. Writes go to {@code <file>.tmp}, are forced to disk
 * and then moved over the store file, so a crash leaves either the previous or the new version.
 */
public final class FileJobStore implements JobStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileJobStore.class);
    private static final String VERSION = "1";
    private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9._-]{1,64}");
    private static final int MAX_NAME_LENGTH = 200;
    private static final int MAX_COMMAND_LENGTH = 10_000;
    private static final int MAX_DESCRIPTION_LENGTH = 2_000;
    private static final int MAX_TIMEOUT_SECONDS = 24 * 60 * 60;

    private final Path path;
    private final Path tempPath;
    private final ScheduleCalculator calculator;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final Object writeLock = new Object();
    private volatile Map<String, JobRecord> snapshot;

    public FileJobStore(Path path, ScheduleCalculator calculator, Clock clock) {
        this.path = Objects.requireNonNull(path, "path must not be null").toAbsolutePath().normalize();
        this.tempPath = this.path.resolveSibling(this.path.getFileName() + ".tmp");
        this.calculator = Objects.requireNonNull(calculator, "calculator must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.snapshot = load();
    }

    @Override
    public JobRecord create(JobDraft draft) {
        Objects.requireNonNull(draft, "draft must not be null");
        synchronized (writeLock) {
            Instant now = clock.instant();
            String name = requireText("name", draft.name(), MAX_NAME_LENGTH);
            String command = requireText("command", draft.command(), MAX_COMMAND_LENGTH);
            String description = optionalText("description", draft.description(), MAX_DESCRIPTION_LENGTH);
            Integer timeoutSeconds = checkTimeout(draft.timeoutSeconds());
            String expression = requireText("cron_expression", draft.cronExpression(), 200);
            CronExpression cron = calculator.validate(expression, now);

            String id = draft.id() == null || draft.id().isBlank() ? generateId() : checkId(draft.id().trim());
            if (snapshot.containsKey(id)) {
                throw new ConflictException("cron job already exists: " + id);
            }

            boolean enabled = draft.enabled() == null || draft.enabled();
            JobRecord job = new JobRecord(
                id,
                name,
                expression,
                command,
                description,
                enabled,
                timeoutSeconds,
                now,
                now,
                null,
                null,
                enabled ? cron.nextAfter(now, calculator.zone()) : null,
                JobState.IDLE,
                0
            );

            Map<String, JobRecord> next = new LinkedHashMap<>(snapshot);
            next.put(id, job);
            commit(next);
            LOG.info("Created cron job {} ({}) with schedule '{}'", id, name, job.cronExpression());
            return job;
        }
    }

    @Override
    public Optional<JobRecord> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(snapshot.get(id));
    }

    @Override
    public List<JobRecord> list() {
        return List.copyOf(snapshot.values());
    }

    @Override
    public JobRecord update(String id, JobPatch patch) {
        Objects.requireNonNull(patch, "patch must not be null");
        if (patch.isEmpty()) {
            throw new ValidationException("update must change at least one field");
        }
        synchronized (writeLock) {
            JobRecord current = get(id);
            Instant now = clock.instant();

            String name = patch.name() == null ? current.name() : requireText("name", patch.name(), MAX_NAME_LENGTH);
            String command = patch.command() == null
                ? current.command()
                : requireText("command", patch.command(), MAX_COMMAND_LENGTH);
            String description = patch.description() == null
                ? current.description()
                : optionalText("description", patch.description(), MAX_DESCRIPTION_LENGTH);
            Integer timeoutSeconds = patch.timeoutSeconds() == null
                ? current.timeoutSeconds()
                : checkTimeout(patch.timeoutSeconds());
            boolean enabled = patch.enabled() == null ? current.enabled() : patch.enabled();

            String expression = current.cronExpression();
            boolean rescheduled = false;
            if (patch.cronExpression() != null) {
                expression = requireText("cron_expression", patch.cronExpression(), 200);
                CronExpression cron = calculator.validate(expression, now);
                rescheduled = !cron.expression().equals(CronExpression.parse(current.cronExpression()).expression());
            }

            Instant nextRunAt;
            if (!enabled) {
                nextRunAt = null;
            } else if (rescheduled || !current.enabled() || current.nextRunAt() == null) {
                nextRunAt = calculator.nextRunAfter(expression, now);
            } else {
                nextRunAt = current.nextRunAt();
            }

            JobRecord updated = new JobRecord(
                current.id(),
                name,
                expression,
                command,
                description,
                enabled,
                timeoutSeconds,
                current.createdAt(),
                now,
                current.lastRunAt(),
                current.lastStatus(),
                nextRunAt,
                current.state(),
                current.consecutiveFailures()
            );
            return replace(updated);
        }
    }

    @Override
    public JobRecord delete(String id) {
        synchronized (writeLock) {
            JobRecord current = get(id);
            Map<String, JobRecord> next = new LinkedHashMap<>(snapshot);
            next.remove(id);
            commit(next);
            LOG.info("Deleted cron job {}", id);
            return current;
        }
    }

    @Override
    public JobRecord markRunning(String id, Instant startedAt) {
        synchronized (writeLock) {
            JobRecord current = get(id);
            Instant next = current.enabled() ? nextOrNull(current, startedAt) : null;
            return replace(current.withRunning(startedAt, next));
        }
    }

    @Override
    public JobRecord recordCompletion(String id, RunStatus status, Instant earliestNextRun) {
        synchronized (writeLock) {
            JobRecord current = get(id);
            Instant next = current.enabled() ? nextOrNull(current, earliestNextRun) : null;
            return replace(current.withCompletion(status, next));
        }
    }

    @Override
    public JobRecord reschedule(String id, Instant from) {
        synchronized (writeLock) {
            JobRecord current = get(id);
            Instant next = current.enabled() ? nextOrNull(current, from) : null;
            if (Objects.equals(next, current.nextRunAt())) {
                return current;
            }
            return replace(current.withNextRunAt(next));
        }
    }

    private JobRecord replace(JobRecord job) {
        Map<String, JobRecord> next = new LinkedHashMap<>(snapshot);
        next.put(job.id(), job);
        commit(next);
        return job;
    }

    private Instant nextOrNull(JobRecord job, Instant after) {
        try {
            return calculator.nextRunAfter(job.cronExpression(), after);
        } catch (UnschedulableException e) {
            LOG.warn("Cron job {} has no further occurrence: {}", job.id(), e.getMessage());
            return null;
        }
    }

    private void commit(Map<String, JobRecord> jobs) {
        try {
            write(jobs);
        } catch (IOException e) {
            throw new StorageException("Failed to write job store " + path, e);
        }
        snapshot = Collections.unmodifiableMap(jobs);
    }

    private void write(Map<String, JobRecord> jobs) throws IOException {
        Files.createDirectories(path.getParent());
        byte[] json = mapper.writerWithDefaultPrettyPrinter()
            .writeValueAsBytes(new StoreFile(VERSION, clock.instant(), jobs));
        try (FileChannel channel = FileChannel.open(
            tempPath,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE
        )) {
            ByteBuffer buffer = ByteBuffer.wrap(json);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
        try {
            Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Map<String, JobRecord> load() {
        try {
            if (Files.deleteIfExists(tempPath)) {
                LOG.warn("Discarded unfinished job store write {}", tempPath);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to clean up " + tempPath, e);
        }
        Map<String, JobRecord> jobs = read(mapper, path);
        LOG.debug("Loaded {} cron job(s) from {}", jobs.size(), path);
        return jobs;
    }

    public static List<JobRecord> readCommitted(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return List.copyOf(read(mapper, path.toAbsolutePath().normalize()).values());
    }

    private static Map<String, JobRecord> read(ObjectMapper mapper, Path path) {
        if (!Files.exists(path)) {
            return Map.of();
        }
        try {
            StoreFile file = mapper.readValue(Files.readAllBytes(path), StoreFile.class);
            Map<String, JobRecord> jobs = new LinkedHashMap<>();
            if (file.jobs() != null) {
                file.jobs().forEach((id, job) -> {
                    if (job != null && id.equals(job.id())) {
                        jobs.put(id, job);
                    } else {
                        LOG.warn("Ignoring job store entry {} with mismatched id", id);
                    }
                });
            }
            return Collections.unmodifiableMap(jobs);
        } catch (IOException e) {
            throw new StorageException("Failed to read job store " + path, e);
        }
    }

    private String generateId() {
        String id;
        do {
            id = "cron-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        } while (snapshot.containsKey(id));
        return id;
    }

    private static String checkId(String id) {
        if (!ID_PATTERN.matcher(id).matches() || id.chars().allMatch(c -> c == '.')) {
            throw new ValidationException("id must match [A-Za-z0-9._-]{1,64}: " + id);
        }
        return id;
    }

    private static String requireText(String field, String value, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
        return optionalText(field, value, maxLength);
    }

    private static String optionalText(String field, String value, int maxLength) {
        if (value == null) {
            return "";
        }
        if (value.length() > maxLength) {
            throw new ValidationException(field + " must be at most " + maxLength + " characters");
        }
        return value;
    }

    private static Integer checkTimeout(Integer timeoutSeconds) {
        if (timeoutSeconds == null) {
            return null;
        }
        if (timeoutSeconds <= 0 || timeoutSeconds > MAX_TIMEOUT_SECONDS) {
            throw new ValidationException("timeout_seconds must be between 1 and " + MAX_TIMEOUT_SECONDS);
        }
        return timeoutSeconds;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StoreFile(
        String version,
        @JsonProperty("saved_at") Instant savedAt,
        Map<String, JobRecord> jobs
    ) {
    }
}
