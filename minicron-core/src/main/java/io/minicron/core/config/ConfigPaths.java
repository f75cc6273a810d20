package io.minicron.core.config;

import java.nio.file.Path;
import java.util.Map;

public final class ConfigPaths {
    public static final String CONFIG_ENV = "MINICRON_CONFIG";

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return defaultConfigPath(System.getenv());
    }

    static Path defaultConfigPath(Map<String, String> env) {
        String override = env.get(CONFIG_ENV);
        if (override != null && !override.isBlank()) {
            return expandHome(override.trim());
        }
        return Path.of(System.getProperty("user.home"), ".minicron", "config.json");
    }

    public static Path resolveDataDir(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Path.of(System.getProperty("user.home"), ".minicron", "data");
        }
        return expandHome(rawPath.trim());
    }

    public static Path resolveWorkingDirectory(String rawPath, Path dataDir) {
        if (rawPath == null || rawPath.isBlank()) {
            return dataDir;
        }
        return expandHome(rawPath.trim());
    }

    public static Path jobsFile(Path dataDir) {
        return dataDir.resolve("jobs.json");
    }

    public static Path logsDir(Path dataDir) {
        return dataDir.resolve("logs");
    }

    public static Path logsDatabase(Path dataDir) {
        return dataDir.resolve("execution-log.db");
    }

    private static Path expandHome(String rawPath) {
        if (rawPath.equals("~")) {
            return Path.of(System.getProperty("user.home"));
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
