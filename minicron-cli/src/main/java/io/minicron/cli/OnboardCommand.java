package io.minicron.cli;

import io.minicron.core.config.OnboardResult;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "onboard", description = "Write config.json and create the data directory for jobs and logs")
public final class OnboardCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Reset an existing config to the defaults")
    boolean overwrite;

    @Option(names = "--data-dir", paramLabel = "<dir>", description = "Where jobs.json and the execution logs live")
    String dataDir;

    public OnboardCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            OnboardResult result = context.configService().onboard(context.configPath(), overwrite, dataDir);
            System.out.println(outcome(result) + ": " + result.configPath());
            System.out.println("Data dir ready: " + result.dataDir());
            System.out.println("Start the scheduler with: minicron serve");
            return 0;
        } catch (Exception e) {
            System.err.println("Onboard failed: " + e.getMessage());
            return 1;
        }
    }

    private static String outcome(OnboardResult result) {
        if (result.createdConfig()) {
            return "Created config";
        }
        return result.overwrittenConfig() ? "Reset config to defaults" : "Updated config with current settings";
    }
}
