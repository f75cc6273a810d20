package io.minicron.app;

import io.minicron.cli.CliContext;
import io.minicron.cli.MinicronCliCommand;
import io.minicron.cli.NextCommand;
import io.minicron.cli.OnboardCommand;
import io.minicron.cli.ServeCommand;
import io.minicron.cli.StatusCommand;
import io.minicron.core.api.GatewayServer;
import io.minicron.core.config.ConfigPaths;
import io.minicron.core.config.ConfigService;
import io.minicron.core.config.model.MinicronConfig;
import io.minicron.core.config.model.SchedulerConfig;
import io.minicron.core.config.model.StorageConfig;
import io.minicron.core.cron.ScheduleCalculator;
import io.minicron.core.exec.ShellCommandExecutor;
import io.minicron.core.job.FileJobStore;
import io.minicron.core.log.ExecutionLogStore;
import io.minicron.core.log.FileExecutionLogStore;
import io.minicron.core.log.SqliteExecutionLogStore;
import io.minicron.core.scheduler.JobScheduler;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class MinicronApplication {
    private static final Logger LOG = LoggerFactory.getLogger(MinicronApplication.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

    private MinicronApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();

        CliContext context = new CliContext(
            configService,
            configPath,
            (host, port) -> runServer(configService, configPath, host, port)
        );

        CommandLine commandLine = new CommandLine(new MinicronCliCommand());
        commandLine.addSubcommand("serve", new ServeCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("next", new NextCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static int runServer(ConfigService configService, Path configPath, String hostOverride, Integer portOverride)
        throws Exception {
        MinicronConfig config = configService.load(configPath);
        SchedulerConfig schedulerConfig = config.scheduler();
        Path dataDir = ConfigPaths.resolveDataDir(config.storage().dataDir());
        Files.createDirectories(dataDir);
        Clock clock = Clock.systemUTC();

        ScheduleCalculator calculator = new ScheduleCalculator(schedulerConfig.zone());
        FileJobStore jobStore = new FileJobStore(ConfigPaths.jobsFile(dataDir), calculator, clock);
        ExecutionLogStore logStore = buildLogStore(config.storage(), dataDir);
        Path workingDirectory = ConfigPaths.resolveWorkingDirectory(schedulerConfig.workingDirectory(), dataDir);
        Files.createDirectories(workingDirectory);
        ShellCommandExecutor executor = new ShellCommandExecutor(workingDirectory, schedulerConfig.maxOutputBytes());

        String host = hostOverride == null || hostOverride.isBlank() ? config.gateway().host() : hostOverride;
        int port = portOverride == null ? config.gateway().port() : portOverride;

        CountDownLatch shutdown = new CountDownLatch(1);
        CountDownLatch stopped = new CountDownLatch(1);
        try (JobScheduler scheduler = new JobScheduler(
            jobStore,
            logStore,
            executor,
            schedulerConfig.toSettings(),
            clock
        );
             GatewayServer server = new GatewayServer(
                 host,
                 port,
                 config.gateway().allowedOrigins(),
                 jobStore,
                 logStore,
                 scheduler
             )) {
            scheduler.addListener((job, entry) -> LOG.info(
                "Cron job {} ({}) finished: {}",
                job.id(),
                job.name(),
                entry.exitStatus().name().toLowerCase()
            ));
            Runtime.getRuntime().addShutdownHook(new Thread(() -> awaitShutdown(shutdown, stopped), "minicron-shutdown"));
            scheduler.start();
            server.start();
            System.out.println("Minicron started on http://" + host + ":" + server.port());
            System.out.println("Data dir: " + dataDir + " (time zone " + calculator.zone() + ")");
            System.out.println("Endpoints: /api/cronjobs, /api/cronjobs/{id}/run, /api/cronjobs/{id}/logs, /api/scheduler, /healthz");
            shutdown.await();
        } finally {
            stopped.countDown();
        }
        return 0;
    }

    /**
     * Keeps the JVM alive until the scheduler has drained its executions.
     */
    private static void awaitShutdown(CountDownLatch shutdown, CountDownLatch stopped) {
        shutdown.countDown();
        try {
            if (!stopped.await(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Shutdown did not complete within {}s", SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ExecutionLogStore buildLogStore(StorageConfig storage, Path dataDir) {
        if (storage.usesSqlite()) {
            Path sqlitePath = ConfigPaths.logsDatabase(dataDir);
            try {
                return new SqliteExecutionLogStore(sqlitePath, storage.maxLogEntriesPerJob());
            } catch (IOException e) {
                throw new IllegalStateException("Failed to initialize SQLite execution log at " + sqlitePath, e);
            }
        }
        return new FileExecutionLogStore(ConfigPaths.logsDir(dataDir), storage.maxLogEntriesPerJob());
    }
}
