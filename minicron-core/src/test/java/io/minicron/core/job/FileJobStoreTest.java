package io.minicron.core.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.minicron.core.MutableClock;
import io.minicron.core.cron.ScheduleCalculator;
import io.minicron.core.error.ConflictException;
import io.minicron.core.error.InvalidExpressionException;
import io.minicron.core.error.NotFoundException;
import io.minicron.core.error.StorageException;
import io.minicron.core.error.UnschedulableException;
import io.minicron.core.error.ValidationException;
import io.minicron.core.log.RunStatus;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileJobStoreTest {
    private static final Instant NOW = Instant.parse("2026-02-26T07:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private ScheduleCalculator calculator;
    private Path storePath;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        calculator = new ScheduleCalculator(ZoneOffset.UTC);
        storePath = tempDir.resolve("data/jobs.json");
    }

    @Test
    void shouldRoundTripUserFields() {
        FileJobStore store = new FileJobStore(storePath, calculator, clock);

        JobRecord created = store.create(new JobDraft(
            "backup", "Nightly backup", "0 6 * * *", "tar czf /tmp/b.tgz .", "keeps a copy", true, 120));
        JobRecord fetched = store.get("backup");

        assertThat(fetched).isEqualTo(created);
        assertThat(fetched.name()).isEqualTo("Nightly backup");
        assertThat(fetched.cronExpression()).isEqualTo("0 6 * * *");
        assertThat(fetched.command()).isEqualTo("tar czf /tmp/b.tgz .");
        assertThat(fetched.description()).isEqualTo("keeps a copy");
        assertThat(fetched.enabled()).isTrue();
        assertThat(fetched.timeoutSeconds()).isEqualTo(120);
        assertThat(fetched.createdAt()).isEqualTo(NOW);
        assertThat(fetched.nextRunAt()).isEqualTo(Instant.parse("2026-02-27T06:00:00Z"));
        assertThat(fetched.state()).isEqualTo(JobState.IDLE);
        assertThat(fetched.lastRunAt()).isNull();
    }

    @Test
    void shouldStoreTextFieldsExactlyAsGiven() {
        FileJobStore store = new FileJobStore(storePath, calculator, clock);

        store.create(new JobDraft("padded", "  Name  ", " 0  6 * * * ", "printf 'a\\n'   ", " note ", true, null));
        FileJobStore reopened = new FileJobStore(storePath, calculator, clock);
        JobRecord fetched = reopened.get("padded");

        assertThat(fetched.name()).isEqualTo("  Name  ");
        assertThat(fetched.command()).isEqualTo("printf 'a\\n'   ");
        assertThat(fetched.cronExpression()).isEqualTo(" 0  6 * * * ");
        assertThat(fetched.description()).isEqualTo(" note ");
        assertThat(fetched.nextRunAt()).isEqualTo(Instant.parse("2026-02-27T06:00:00Z"));
    }

    @Test
    void shouldKeepScheduleWhenUpdateOnlyChangesExpressionSpacing() {
        FileJobStore store = new FileJobStore(storePath, calculator, clock);
        JobRecord created = store.create(JobDraft.of("spaced", "0 6 * * *", "echo hi").withId("spaced"));
        clock.advance(Duration.ofHours(1));

        JobRecord updated = store.update("spaced", new JobPatch(null, "0  6 * * *", null, null, null, null));

        assertThat(updated.cronExpression()).isEqualTo("0  6 * * *");
        assertThat(updated.nextRunAt()).isEqualTo(created.nextRunAt());
    }

    @Test
    void shouldPersistAcrossInstancesWithoutLeavingStagingFile() throws Exception {
        FileJobStore store = new FileJobStore(storePath, calculator, clock);
        store.create(JobDraft.of("one", "*/5 * * * *", "echo 1").withId("one"));
        store.create(JobDraft.of("two", "@daily", "echo 2").withId("two"));

        FileJobStore reopened = new FileJobStore(storePath, calculator, clock);

        assertThat(reopened.list()).extracting(JobRecord::id).containsExactly("one", "two");
        assertThat(reopened.get("two").cronExpression()).isEqualTo("@daily");
        assertThat(Files.exists(storePath.resolveSibling("jobs.json.tmp"))).isFalse();
        assertThat(Files.readString(storePath)).contains("\"version\" : \"1\"").contains("\"cron_expression\"");
    }

    @Test
    void shouldGenerateIdWhenAbsent() {
        FileJobStore store = new FileJobStore(storePath, calculator, clock);

        JobRecord created = store.create(JobDraft.of("report", "0 9 * * mon", "echo report"));

        assertThat(created.id()).matches("cron-[0-9a-f]{12}");
    }

    @Test
    void shouldRejectDuplicateId() {
        FileJobStore store = new FileJobStore(storePath, calculator, clock);
        store.create(JobDraft.of("a", "* * * * *", "true").withId("dup"));

        assertThatThrownBy(() -> store.create(JobDraft.of("b", "* * * * *", "true").withId("dup")))
            .isInstanceOf(ConflictException.class);
        assertThat(store.get("dup").name()).isEqualTo("a");
    }

    @Test
    void shouldPersistNothingForInvalidExpression() {
        FileJobStore store = new FileJobStore(storePath, calculator, clock);

        assertThatThrownBy(() -> store.create(JobDraft.of("bad", "99 * * * *", "true").withId("bad")))
            .isInstanceOf(InvalidExpressionException.class);
        assertThatThrownBy(() -> store.create(JobDraft.of("never", "0 0 30 2 *", "true").withId("never")))
            .isInstanceOf(UnschedulableException.class);

        assertThat(store.list()).isEmpty();
        assertThat(Files.exists(storePath)).isFalse();
    }

    @Test
    void shouldValidateRequiredFields() {
        FileJobStore store = new FileJobStore(storePath, calculator, clock);

        assertThatThrownBy(() -> store.create(JobDraft.of(" ", "* * * * *", "true")))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("name");
        assertThatThrownBy(() -> store.create(JobDraft.of("x", "* * * * *", "")))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("command");
        assertThatThrownBy(() -> store.create(JobDraft.of("x", "* * * * *", "true").withId("../etc")))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> store.create(new JobDraft(null, "x", "* * * * *", "true", "", true, 0)))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("timeout_seconds");
    }

    @Test
    void deletingTwiceShouldReturnNotFoundTheSecondTime() {
        FileJobStore store = new FileJobStore(storePath, calculator, clock);
        store.create(JobDraft.of("gone", "* * * * *", "true").withId("gone"));
        store.create(JobDraft.of("kept", "* * * * *", "true").withId("kept"));

        store.delete("gone");

        assertThatThrownBy(() -> store.delete("gone")).isInstanceOf(NotFoundException.class);
        assertThat(store.list()).extracting(JobRecord::id).containsExactly("kept");
    }

    @Test
    void shouldRevalidateChangedExpressionOnUpdate() {
        FileJobStore store = new FileJobStore(storePath, calculator, clock);
        store.create(JobDraft.of("job", "0 6 * * *", "true").withId("job"));

        assertThatThrownBy(() -> store.update("job", JobPatch.expression("61 * * * *")))
            .isInstanceOf(InvalidExpressionException.class);
        assertThat(store.get("job").cronExpression()).isEqualTo("0 6 * * *");

        clock.advance(Duration.ofMinutes(5));
        JobRecord updated = store.update("job", JobPatch.expression("30 7 * * *"));
        assertThat(updated.nextRunAt()).isEqualTo(Instant.parse("2026-02-26T07:30:00Z"));
        assertThat(updated.updatedAt()).isEqualTo(NOW.plus(Duration.ofMinutes(5)));
        assertThat(updated.createdAt()).isEqualTo(NOW);
    }

    @Test
    void shouldRejectEmptyUpdateAndUnknownJob() {
        FileJobStore store = new FileJobStore(storePath, calculator, clock);
        store.create(JobDraft.of("job", "0 6 * * *", "true").withId("job"));

        assertThatThrownBy(() -> store.update("job", new JobPatch(null, null, null, null, null, null)))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> store.update("missing", JobPatch.enabled(false)))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void reEnablingShouldNotBackfillMissedOccurrences() {
        FileJobStore store = new FileJobStore(storePath, calculator, clock);
        store.create(JobDraft.of("hourly", "0 * * * *", "true").withId("hourly"));

        JobRecord disabled = store.update("hourly", JobPatch.enabled(false));
        assertThat(disabled.nextRunAt()).isNull();

        clock.advance(Duration.ofHours(10).plusMinutes(20));
        JobRecord enabled = store.update("hourly", JobPatch.enabled(true));

        assertThat(enabled.nextRunAt()).isAfter(clock.instant());
        assertThat(enabled.nextRunAt()).isEqualTo(Instant.parse("2026-02-26T18:00:00Z"));
    }

    @Test
    void completionShouldScheduleFromCompletionTimeAndTrackFailures() {
        FileJobStore store = new FileJobStore(storePath, calculator, clock);
        store.create(JobDraft.of("job", "*/10 * * * *", "true").withId("job"));

        Instant started = Instant.parse("2026-02-26T07:10:00Z");
        JobRecord running = store.markRunning("job", started);
        assertThat(running.state()).isEqualTo(JobState.RUNNING);
        assertThat(running.lastRunAt()).isEqualTo(started);
        assertThat(running.nextRunAt()).isEqualTo(Instant.parse("2026-02-26T07:20:00Z"));

        JobRecord failed = store.recordCompletion("job", RunStatus.FAILED, Instant.parse("2026-02-26T07:34:00Z"));
        assertThat(failed.state()).isEqualTo(JobState.IDLE);
        assertThat(failed.lastStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(failed.consecutiveFailures()).isEqualTo(1);
        assertThat(failed.nextRunAt()).isEqualTo(Instant.parse("2026-02-26T07:40:00Z"));
        assertThat(failed.enabled()).isTrue();
        assertThat(failed.updatedAt()).isEqualTo(NOW);

        JobRecord succeeded = store.recordCompletion("job", RunStatus.SUCCEEDED, Instant.parse("2026-02-26T07:40:00Z"));
        assertThat(succeeded.consecutiveFailures()).isZero();
        assertThat(succeeded.nextRunAt()).isEqualTo(Instant.parse("2026-02-26T07:50:00Z"));
    }

    @Test
    void shouldFailLoudlyOnCorruptStoreFile() throws Exception {
        Files.createDirectories(storePath.getParent());
        Files.writeString(storePath, "{ not json");

        assertThatThrownBy(() -> new FileJobStore(storePath, calculator, clock))
            .isInstanceOf(StorageException.class);
        assertThat(Files.readString(storePath)).isEqualTo("{ not json");
    }

    @Test
    void shouldDiscardLeftoverStagingFile() throws Exception {
        FileJobStore store = new FileJobStore(storePath, calculator, clock);
        store.create(JobDraft.of("job", "* * * * *", "true").withId("job"));
        Path staging = storePath.resolveSibling("jobs.json.tmp");
        Files.writeString(staging, "{ torn");

        FileJobStore reopened = new FileJobStore(storePath, calculator, clock);

        assertThat(reopened.list()).extracting(JobRecord::id).containsExactly("job");
        assertThat(Files.exists(staging)).isFalse();
    }

    @Test
    void concurrentCreatesShouldAllBeDurable() throws Exception {
        FileJobStore store = new FileJobStore(storePath, calculator, clock);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<JobRecord>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                String id = "job-" + i;
                futures.add(pool.submit(() -> store.create(JobDraft.of(id, "* * * * *", "true").withId(id))));
            }
            for (Future<JobRecord> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.list()).hasSize(40);
        assertThat(new FileJobStore(storePath, calculator, clock).list()).hasSize(40);
    }

    @Test
    void readCommittedShouldNotTouchStagingFile() throws Exception {
        FileJobStore store = new FileJobStore(storePath, calculator, clock);
        store.create(JobDraft.of("job", "* * * * *", "true").withId("job"));
        Path staging = storePath.resolveSibling("jobs.json.tmp");
        Files.writeString(staging, "in flight");

        List<JobRecord> jobs = FileJobStore.readCommitted(storePath);

        assertThat(jobs).extracting(JobRecord::id).containsExactly("job");
        assertThat(Files.exists(staging)).isTrue();
    }
}
