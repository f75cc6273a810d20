package io.minicron.core.exec;

import java.io.IOException;
import java.time.Duration;

@FunctionalInterface
public interface CommandExecutor {

    ExecutionResult run(String command, Duration timeout) throws IOException;
}
