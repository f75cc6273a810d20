package io.minicron.core.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.minicron.core.MutableClock;
import io.minicron.core.cron.ScheduleCalculator;
import io.minicron.core.exec.ExecutionResult;
import io.minicron.core.job.FileJobStore;
import io.minicron.core.job.JobDraft;
import io.minicron.core.log.FileExecutionLogStore;
import io.minicron.core.scheduler.JobScheduler;
import io.minicron.core.scheduler.SchedulerSettings;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GatewayServerTest {
    private static final Instant NOW = Instant.parse("2026-02-26T07:00:00Z");

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    private FileJobStore store;
    private FileExecutionLogStore logStore;
    private JobScheduler scheduler;
    private GatewayServer server;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW);
        store = new FileJobStore(tempDir.resolve("jobs.json"), new ScheduleCalculator(ZoneOffset.UTC), clock);
        logStore = new FileExecutionLogStore(tempDir.resolve("logs"), 100);
        scheduler = new JobScheduler(
            store,
            logStore,
            (command, timeout) -> ExecutionResult.exited(0, "ran: " + command, "", Duration.ofMillis(4)),
            SchedulerSettings.defaults(),
            clock
        );
        server = new GatewayServer("127.0.0.1", 0, List.of("http://localhost"), store, logStore, scheduler);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
        scheduler.stop();
    }

    @Test
    void createShouldReturnStoredJobWithNextRun() throws Exception {
        HttpResponse<String> response = send("POST", "/api/cronjobs", """
            {"id": "backup", "name": "Nightly backup", "cron_expression": "0 6 * * *", "command": "echo backup"}
            """);

        assertThat(response.statusCode()).isEqualTo(201);
        assertThat(response.headers().firstValue("Location")).contains("/api/cronjobs/backup");
        JsonNode body = mapper.readTree(response.body());
        assertThat(body.path("id").asText()).isEqualTo("backup");
        assertThat(body.path("enabled").asBoolean()).isTrue();
        assertThat(body.path("next_run_at").asText()).isEqualTo("2026-02-27T06:00:00Z");
        assertThat(body.path("schedule_description").asText()).isEqualTo("at 06:00 every day");
        assertThat(body.path("state").asText()).isEqualTo("idle");
        assertThat(store.find("backup")).isPresent();
    }

    @Test
    void createShouldAcceptExpressionAliasAndGenerateId() throws Exception {
        HttpResponse<String> response = send("POST", "/api/cronjobs", """
            {"name": "ping", "expression": "*/5 * * * *", "command": "true"}
            """);

        assertThat(response.statusCode()).isEqualTo(201);
        JsonNode body = mapper.readTree(response.body());
        assertThat(body.path("id").asText()).startsWith("cron-");
        assertThat(body.path("cron_expression").asText()).isEqualTo("*/5 * * * *");
    }

    @Test
    void invalidInputShouldBeRejectedWithErrorKind() throws Exception {
        HttpResponse<String> badField = send("POST", "/api/cronjobs", """
            {"name": "bad", "cron_expression": "99 * * * *", "command": "true"}
            """);
        HttpResponse<String> impossible = send("POST", "/api/cronjobs", """
            {"name": "never", "cron_expression": "0 0 30 2 *", "command": "true"}
            """);
        HttpResponse<String> malformed = send("POST", "/api/cronjobs", "{\"name\": ");
        HttpResponse<String> wrongType = send("POST", "/api/cronjobs", """
            {"name": "typed", "cron_expression": "0 6 * * *", "command": "true", "enabled": "yes"}
            """);

        assertError(badField, 400, "validation_error");
        assertError(impossible, 400, "unschedulable");
        assertError(malformed, 400, "validation_error");
        assertError(wrongType, 400, "validation_error");
        assertThat(store.list()).isEmpty();
    }

    @Test
    void duplicateIdShouldConflict() throws Exception {
        store.create(JobDraft.of("first", "0 6 * * *", "true").withId("dup"));

        HttpResponse<String> response = send("POST", "/api/cronjobs", """
            {"id": "dup", "name": "second", "cron_expression": "0 7 * * *", "command": "true"}
            """);

        assertError(response, 409, "conflict");
        assertThat(store.get("dup").name()).isEqualTo("first");
    }

    @Test
    void listShouldHonourEnabledFilter() throws Exception {
        store.create(JobDraft.of("on", "0 6 * * *", "true").withId("on"));
        store.create(new JobDraft("off", "off", "0 6 * * *", "true", "", false, null));

        JsonNode all = mapper.readTree(send("GET", "/api/cronjobs", null).body());
        JsonNode disabled = mapper.readTree(send("GET", "/api/cronjobs?enabled=false", null).body());

        assertThat(all).hasSize(2);
        assertThat(disabled).hasSize(1);
        assertThat(disabled.get(0).path("id").asText()).isEqualTo("off");
        assertThat(disabled.get(0).path("next_run_at").isNull()).isTrue();
    }

    @Test
    void updateShouldApplyPartialChanges() throws Exception {
        store.create(JobDraft.of("report", "0 6 * * *", "true").withId("report"));

        HttpResponse<String> disabled = send("PUT", "/api/cronjobs/report", "{\"enabled\": false}");
        HttpResponse<String> rescheduled = send("PUT", "/api/cronjobs/report", """
            {"enabled": true, "cron_expression": "30 9 * * 1-5"}
            """);
        HttpResponse<String> renamedId = send("PUT", "/api/cronjobs/report", "{\"id\": \"other\"}");
        HttpResponse<String> missing = send("PUT", "/api/cronjobs/ghost", "{\"enabled\": false}");

        assertThat(disabled.statusCode()).isEqualTo(200);
        assertThat(mapper.readTree(disabled.body()).path("next_run_at").isNull()).isTrue();
        assertThat(rescheduled.statusCode()).isEqualTo(200);
        assertThat(mapper.readTree(rescheduled.body()).path("next_run_at").asText()).isEqualTo("2026-02-26T09:30:00Z");
        assertError(renamedId, 400, "validation_error");
        assertError(missing, 404, "not_found");
    }

    @Test
    void deleteShouldRemoveJobAndOptionallyPurgeLogs() throws Exception {
        store.create(JobDraft.of("keep-logs", "0 6 * * *", "true").withId("keep-logs"));
        store.create(JobDraft.of("purge-logs", "0 6 * * *", "true").withId("purge-logs"));
        scheduler.runNow("keep-logs").get();
        scheduler.runNow("purge-logs").get();

        HttpResponse<String> kept = send("DELETE", "/api/cronjobs/keep-logs", null);
        HttpResponse<String> purged = send("DELETE", "/api/cronjobs/purge-logs?purge_logs=true", null);

        assertThat(kept.statusCode()).isEqualTo(204);
        assertThat(purged.statusCode()).isEqualTo(204);
        assertError(send("GET", "/api/cronjobs/keep-logs", null), 404, "not_found");
        assertError(send("DELETE", "/api/cronjobs/keep-logs", null), 404, "not_found");
        assertThat(send("GET", "/api/cronjobs/keep-logs/logs", null).statusCode()).isEqualTo(200);
        assertError(send("GET", "/api/cronjobs/purge-logs/logs", null), 404, "not_found");
    }

    @Test
    void purgeShouldClearLogsOfJobDeletedEarlier() throws Exception {
        store.create(JobDraft.of("late-purge", "0 6 * * *", "true").withId("late-purge"));
        scheduler.runNow("late-purge").get();
        assertThat(send("DELETE", "/api/cronjobs/late-purge", null).statusCode()).isEqualTo(204);

        HttpResponse<String> purged = send("DELETE", "/api/cronjobs/late-purge?purge_logs=true", null);

        assertThat(purged.statusCode()).isEqualTo(204);
        assertError(send("GET", "/api/cronjobs/late-purge/logs", null), 404, "not_found");
        assertError(send("DELETE", "/api/cronjobs/late-purge?purge_logs=true", null), 404, "not_found");
    }

    @Test
    void runWithWaitShouldReturnExecutionEntry() throws Exception {
        store.create(JobDraft.of("now", "0 6 * * *", "echo now").withId("now"));

        HttpResponse<String> response = send("POST", "/api/cronjobs/now/run?wait_seconds=10", null);

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode entry = mapper.readTree(response.body());
        assertThat(entry.path("exit_status").asText()).isEqualTo("succeeded");
        assertThat(entry.path("exit_code").asInt()).isZero();
        assertThat(entry.path("triggered_by").asText()).isEqualTo("manual");
        assertThat(entry.path("stdout_excerpt").asText()).isEqualTo("ran: echo now");

        JsonNode job = mapper.readTree(send("GET", "/api/cronjobs/now", null).body());
        assertThat(job.path("last_status").asText()).isEqualTo("succeeded");
        assertThat(job.path("running").asBoolean()).isFalse();
    }

    @Test
    void runWithoutWaitShouldBeAccepted() throws Exception {
        store.create(JobDraft.of("async", "0 6 * * *", "true").withId("async"));

        HttpResponse<String> response = send("POST", "/api/cronjobs/async/run", null);

        assertThat(response.statusCode()).isEqualTo(202);
        JsonNode body = mapper.readTree(response.body());
        assertThat(body.path("job_id").asText()).isEqualTo("async");
        assertThat(body.path("status").asText()).isEqualTo("accepted");
        assertThat(scheduler.awaitIdle(Duration.ofSeconds(10))).isTrue();
        assertThat(logStore.count("async")).isEqualTo(1);
    }

    @Test
    void runOfUnknownJobShouldBeNotFound() throws Exception {
        assertError(send("POST", "/api/cronjobs/ghost/run", null), 404, "not_found");
        assertError(send("GET", "/api/cronjobs/ghost/run", null), 405, "method_not_allowed");
    }

    @Test
    void logsShouldBePagedNewestFirst() throws Exception {
        store.create(JobDraft.of("paged", "0 6 * * *", "true").withId("paged"));
        for (int i = 0; i < 3; i++) {
            scheduler.runNow("paged").get();
        }

        HttpResponse<String> response = send("GET", "/api/cronjobs/paged/logs?offset=1&limit=1", null);
        HttpResponse<String> clamped = send("GET", "/api/cronjobs/paged/logs?limit=1000", null);

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode page = mapper.readTree(response.body());
        assertThat(page.path("job_id").asText()).isEqualTo("paged");
        assertThat(page.path("total").asInt()).isEqualTo(3);
        assertThat(page.path("offset").asInt()).isEqualTo(1);
        assertThat(page.path("limit").asInt()).isEqualTo(1);
        assertThat(page.path("entries")).hasSize(1);
        assertThat(mapper.readTree(clamped.body()).path("limit").asInt()).isEqualTo(200);
        assertError(send("GET", "/api/cronjobs/paged/logs?limit=lots", null), 400, "validation_error");
    }

    @Test
    void schedulerStatusAndHealthShouldBeServed() throws Exception {
        store.create(JobDraft.of("one", "0 6 * * *", "true").withId("one"));

        HttpResponse<String> health = send("GET", "/healthz", null);
        JsonNode status = mapper.readTree(send("GET", "/api/scheduler", null).body());

        assertThat(health.statusCode()).isEqualTo(200);
        assertThat(mapper.readTree(health.body()).path("status").asText()).isEqualTo("ok");
        assertThat(status.path("running").asBoolean()).isFalse();
        assertThat(status.path("total_jobs").asInt()).isEqualTo(1);
        assertThat(status.path("max_concurrent_runs").asInt()).isEqualTo(4);
    }

    @Test
    void unsupportedMethodsAndRoutesShouldBeRejected() throws Exception {
        assertError(send("DELETE", "/api/cronjobs", null), 405, "method_not_allowed");
        assertError(send("GET", "/api/cronjobs/a/b/c", null), 404, "not_found");
        assertError(send("GET", "/api/cronjobs/a/history", null), 404, "not_found");
    }

    @Test
    void corsPreflightShouldEchoAllowedOrigin() throws Exception {
        HttpResponse<String> allowed = client.send(
            HttpRequest.newBuilder(uri("/api/cronjobs"))
                .method("OPTIONS", HttpRequest.BodyPublishers.noBody())
                .header("Origin", "http://localhost:5173")
                .build(),
            HttpResponse.BodyHandlers.ofString()
        );
        HttpResponse<String> foreign = client.send(
            HttpRequest.newBuilder(uri("/api/cronjobs"))
                .GET()
                .header("Origin", "https://evil.example")
                .build(),
            HttpResponse.BodyHandlers.ofString()
        );

        assertThat(allowed.statusCode()).isEqualTo(204);
        assertThat(allowed.headers().firstValue("Access-Control-Allow-Origin")).contains("http://localhost:5173");
        assertThat(foreign.statusCode()).isEqualTo(200);
        assertThat(foreign.headers().firstValue("Access-Control-Allow-Origin")).isEmpty();
    }

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri(path)).timeout(Duration.ofSeconds(20));
        if (body == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            builder.header("Content-Type", "application/json").method(method, HttpRequest.BodyPublishers.ofString(body));
        }
        return client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.port() + path);
    }

    private void assertError(HttpResponse<String> response, int status, String kind) throws Exception {
        assertThat(response.statusCode()).as(response.body()).isEqualTo(status);
        assertThat(mapper.readTree(response.body()).path("error_kind").asText()).isEqualTo(kind);
    }
}
