package io.minicron.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(
    name = "minicron",
    mixinStandardHelpOptions = true,
    version = "minicron 0.1.0",
    description = "Cron job scheduler with an HTTP API"
)
public final class MinicronCliCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }
}
