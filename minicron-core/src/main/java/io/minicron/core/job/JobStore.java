package io.minicron.core.job;

import io.minicron.core.error.NotFoundException;
import io.minicron.core.log.RunStatus;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface JobStore {

    JobRecord create(JobDraft draft);

    Optional<JobRecord> find(String id);

    default JobRecord get(String id) {
        return find(id).orElseThrow(() -> NotFoundException.job(id));
    }

    List<JobRecord> list();

    JobRecord update(String id, JobPatch patch);

    JobRecord delete(String id);

    JobRecord markRunning(String id, Instant startedAt);

    JobRecord recordCompletion(String id, RunStatus status, Instant earliestNextRun);

    JobRecord reschedule(String id, Instant from);
}
