package io.minicron.cli;

import io.minicron.core.config.ConfigPaths;
import io.minicron.core.config.model.MinicronConfig;
import io.minicron.core.job.FileJobStore;
import io.minicron.core.job.JobRecord;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "status", description = "Show configuration and job store status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--show-config", description = "Also print the effective configuration")
    boolean showConfig;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MinicronConfig config = context.configService().load(context.configPath());
            Path dataDir = ConfigPaths.resolveDataDir(config.storage().dataDir());
            Path jobsFile = ConfigPaths.jobsFile(dataDir);
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Data dir: " + dataDir);
            System.out.println("Log backend: " + config.storage().logBackend());
            System.out.println("Time zone: " + config.scheduler().zone());
            System.out.println("Gateway: http://" + config.gateway().host() + ":" + config.gateway().port());

            List<JobRecord> jobs = FileJobStore.readCommitted(jobsFile);
            long enabled = jobs.stream().filter(JobRecord::enabled).count();
            System.out.println("Jobs: " + jobs.size() + " (" + enabled + " enabled)");
            if (showConfig) {
                System.out.println(context.configService().toPrettyJson(config));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
