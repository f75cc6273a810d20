package io.minicron.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.minicron.core.config.model.MinicronConfig;
import io.minicron.core.config.model.StorageConfig;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.DateTimeException;
import java.util.Objects;

public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public MinicronConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        ObjectNode tree = mapper.valueToTree(MinicronConfig.defaults());
        if (Files.exists(configPath)) {
            JsonNode fileTree = mapper.readTree(Files.readString(configPath, StandardCharsets.UTF_8));
            if (fileTree != null && !fileTree.isMissingNode()) {
                if (!(fileTree instanceof ObjectNode fileObject)) {
                    throw new IOException("Config root must be a JSON object: " + configPath);
                }
                overlay(tree, fileObject);
            }
        }
        MinicronConfig config = mapper.treeToValue(tree, MinicronConfig.class);
        check(config, configPath);
        return config;
    }

    public void save(Path configPath, MinicronConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path target = configPath.toAbsolutePath();
        Files.createDirectories(target.getParent());
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.writeString(temp, toPrettyJson(config) + System.lineSeparator(), StandardCharsets.UTF_8);
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public OnboardResult onboard(Path configPath, boolean overwrite, String dataDir) throws IOException {
        boolean existed = Files.exists(configPath);
        MinicronConfig config = existed && !overwrite ? load(configPath) : MinicronConfig.defaults();
        if (dataDir != null && !dataDir.isBlank()) {
            StorageConfig storage = config.storage();
            config = new MinicronConfig(
                config.scheduler(),
                config.gateway(),
                new StorageConfig(dataDir.trim(), storage.logBackend(), storage.maxLogEntriesPerJob())
            );
        }
        save(configPath, config);

        Path resolvedDataDir = ConfigPaths.resolveDataDir(config.storage().dataDir());
        Files.createDirectories(resolvedDataDir);
        return new OnboardResult(configPath, resolvedDataDir, !existed, existed && overwrite);
    }

    public String toPrettyJson(MinicronConfig config) {
        try {
            return mapper.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private static void overlay(ObjectNode target, ObjectNode source) {
        source.fields().forEachRemaining(field -> {
            JsonNode current = target.get(field.getKey());
            if (current instanceof ObjectNode currentObject && field.getValue() instanceof ObjectNode sourceObject) {
                overlay(currentObject, sourceObject);
            } else {
                target.set(field.getKey(), field.getValue());
            }
        });
    }

    private static void check(MinicronConfig config, Path configPath) throws IOException {
        try {
            config.scheduler().zone();
        } catch (DateTimeException e) {
            throw new IOException("Unknown scheduler.timezone '" + config.scheduler().timezone() + "' in " + configPath, e);
        }
        String backend = config.storage().logBackend();
        if (!StorageConfig.FILE_BACKEND.equalsIgnoreCase(backend) && !config.storage().usesSqlite()) {
            throw new IOException("storage.logBackend must be 'file' or 'sqlite' in " + configPath + ", got '" + backend + "'");
        }
        if (config.storage().maxLogEntriesPerJob() < 1) {
            throw new IOException("storage.maxLogEntriesPerJob must be positive in " + configPath);
        }
        if (config.gateway().port() < 0 || config.gateway().port() > 65_535) {
            throw new IOException("gateway.port out of range in " + configPath + ": " + config.gateway().port());
        }
    }
}
