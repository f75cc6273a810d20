package io.minicron.core.log;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.minicron.core.error.StorageException;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class FileExecutionLogStore implements ExecutionLogStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileExecutionLogStore.class);
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");
    private static final String SUFFIX = ".jsonl";

    private final Path directory;
    private final int maxEntriesPerJob;
    private final int compactThreshold;
    private final ObjectMapper mapper;
    private final Map<String, Integer> lineCounts = new HashMap<>();

    public FileExecutionLogStore(Path directory, int maxEntriesPerJob) {
        if (maxEntriesPerJob < 1) {
            throw new IllegalArgumentException("maxEntriesPerJob must be positive");
        }
        this.directory = Objects.requireNonNull(directory, "directory must not be null").toAbsolutePath().normalize();
        this.maxEntriesPerJob = maxEntriesPerJob;
        this.compactThreshold = maxEntriesPerJob + Math.max(1, maxEntriesPerJob / 10);
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized void append(ExecutionLogEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        Path file = fileFor(entry.jobId());
        if (file == null) {
            throw new IllegalArgumentException("job id is not usable as a log name: " + entry.jobId());
        }
        try {
            Files.createDirectories(directory);
            byte[] line = (mapper.writeValueAsString(entry) + "\n").getBytes(StandardCharsets.UTF_8);
            try (FileChannel channel = FileChannel.open(
                file,
                StandardOpenOption.CREATE,
                StandardOpenOption.WRITE,
                StandardOpenOption.APPEND
            )) {
                if (channel.size() > 0 && !endsWithNewline(file)) {
                    writeFully(channel, "\n".getBytes(StandardCharsets.UTF_8));
                }
                writeFully(channel, line);
                channel.force(true);
            }
            int count = lineCounts.containsKey(entry.jobId()) ? lineCounts.get(entry.jobId()) + 1 : readLines(file).size();
            lineCounts.put(entry.jobId(), count);
            if (count > compactThreshold) {
                compact(entry.jobId(), file);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to append execution log for " + entry.jobId(), e);
        }
    }

    @Override
    public synchronized List<ExecutionLogEntry> list(String jobId, int offset, int limit) {
        List<ExecutionLogEntry> newestFirst = readNewestFirst(jobId);
        int from = Math.min(Math.max(0, offset), newestFirst.size());
        int to = Math.min(newestFirst.size(), from + Math.max(0, limit));
        return List.copyOf(newestFirst.subList(from, to));
    }

    @Override
    public synchronized int count(String jobId) {
        return readNewestFirst(jobId).size();
    }

    @Override
    public synchronized int purge(String jobId) {
        Path file = fileFor(jobId);
        if (file == null) {
            return 0;
        }
        int removed = readNewestFirst(jobId).size();
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new StorageException("Failed to purge execution log for " + jobId, e);
        }
        lineCounts.remove(jobId);
        if (removed > 0) {
            LOG.info("Purged {} execution log entr(ies) of {}", removed, jobId);
        }
        return removed;
    }

    private List<ExecutionLogEntry> readNewestFirst(String jobId) {
        Path file = fileFor(jobId);
        if (file == null || !Files.exists(file)) {
            return List.of();
        }
        List<ExecutionLogEntry> entries = new ArrayList<>();
        try {
            for (String line : readLines(file)) {
                try {
                    entries.add(mapper.readValue(line, ExecutionLogEntry.class));
                } catch (IOException e) {
                    LOG.warn("Skipping unreadable execution log line in {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new StorageException("Failed to read execution log for " + jobId, e);
        }
        if (entries.size() > maxEntriesPerJob) {
            entries = new ArrayList<>(entries.subList(entries.size() - maxEntriesPerJob, entries.size()));
        }
        Collections.reverse(entries);
        return entries;
    }

    private void compact(String jobId, Path file) throws IOException {
        List<String> lines = readLines(file);
        List<String> kept = lines.subList(Math.max(0, lines.size() - maxEntriesPerJob), lines.size());
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try (FileChannel channel = FileChannel.open(
            tmp,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE
        )) {
            writeFully(channel, (String.join("\n", kept) + "\n").getBytes(StandardCharsets.UTF_8));
            channel.force(true);
        }
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
        lineCounts.put(jobId, kept.size());
        LOG.debug("Compacted execution log of {} from {} to {} entries", jobId, lines.size(), kept.size());
    }

    private Path fileFor(String jobId) {
        if (jobId == null || !SAFE_ID.matcher(jobId).matches() || jobId.chars().allMatch(c -> c == '.')) {
            return null;
        }
        return directory.resolve(jobId + SUFFIX);
    }

    private static List<String> readLines(Path file) throws IOException {
        List<String> lines = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            if (!line.isBlank()) {
                lines.add(line);
            }
        }
        return lines;
    }

    private static boolean endsWithNewline(Path file) throws IOException {
        try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "r")) {
            if (raf.length() == 0) {
                return true;
            }
            raf.seek(raf.length() - 1);
            return raf.read() == '\n';
        }
    }

    private static void writeFully(FileChannel channel, byte[] bytes) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }
}
