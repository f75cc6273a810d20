package io.minicron.core.log;

import java.util.List;
import java.util.Optional;

public interface ExecutionLogStore {
    void append(ExecutionLogEntry entry);

    List<ExecutionLogEntry> list(String jobId, int offset, int limit);

    int count(String jobId);

    default Optional<ExecutionLogEntry> latest(String jobId) {
        return list(jobId, 0, 1).stream().findFirst();
    }

    int purge(String jobId);
}
