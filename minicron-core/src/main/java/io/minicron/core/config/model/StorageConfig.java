package io.minicron.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(
    String dataDir,
    String logBackend,
    int maxLogEntriesPerJob
) {
    public static final String FILE_BACKEND = "file";
    public static final String SQLITE_BACKEND = "sqlite";

    public static StorageConfig defaults() {
        return new StorageConfig("~/.minicron/data", FILE_BACKEND, 500);
    }

    public boolean usesSqlite() {
        return SQLITE_BACKEND.equalsIgnoreCase(logBackend == null ? "" : logBackend.trim());
    }
}
