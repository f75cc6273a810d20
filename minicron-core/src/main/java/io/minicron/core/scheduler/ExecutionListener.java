package io.minicron.core.scheduler;

import io.minicron.core.job.JobRecord;
import io.minicron.core.log.ExecutionLogEntry;

// Called on the worker thread after the log entry is written. Exceptions are logged and ignored.
@FunctionalInterface
public interface ExecutionListener {
    void onExecutionFinished(JobRecord job, ExecutionLogEntry entry);
}
