package io.minicron.cli;

/**
 * Runs the scheduler and gateway until the process is asked to stop. Null arguments keep the
 * configured values.
 */
@FunctionalInterface
public interface ServerRunner {
    int run(String host, Integer port) throws Exception;
}
