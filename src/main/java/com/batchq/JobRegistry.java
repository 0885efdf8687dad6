package com.batchq;

import com.batchq.Models.Job;
import com.batchq.Models.JobState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * In-memory view of every known job, mirrored to a {@link JobStore}. Each mutation is written to
 * the store first and applied here only once the store accepted it, so a failed write leaves the
 * registry in its last persisted state. Callers always get copies.
 *
 * <p>Not thread-safe; owned by the scheduling thread.
 */
public class JobRegistry {
    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    private final JobStore store;
    private final TreeMap<Long, Job> jobs = new TreeMap<>();

    public JobRegistry(JobStore store) {
        this.store = store;
        for (Job j : store.all()) jobs.put(j.id, j);
        log.info("Loaded {} job(s) from store", jobs.size());
    }

    public int size() {
        return jobs.size();
    }

    public Job create(Job draft) {
        Job j = draft.copy();
        j.submitted_at = Models.now();
        j.started_at = null;
        j.finished_at = null;
        j.exit_code = null;
        j.pid = null;
        Job stored = store.insert(j);
        jobs.put(stored.id, stored);
        return stored.copy();
    }

    public Optional<Job> find(long id) {
        return Optional.ofNullable(jobs.get(id)).map(Job::copy);
    }

    public Job get(long id) {
        return find(id).orElseThrow(() -> BatchException.notFound(id));
    }

    /** Snapshot of jobs in {@code state}, in the store's ordering for that state. */
    public List<Job> list(JobState state, int limit) {
        return jobs.values().stream()
                .filter(j -> j.state() == state)
                .sorted(InMemoryJobStore.order(state))
                .limit(limit > 0 ? limit : Long.MAX_VALUE)
                .map(Job::copy)
                .collect(Collectors.toList());
    }

    public void delete(long id) {
        Job j = jobs.get(id);
        if (j == null) throw BatchException.notFound(id);
        if (j.state() == JobState.RUNNING) {
            throw BatchException.conflict("Job " + id + " is running; terminate it before deleting");
        }
        store.delete(id);
        jobs.remove(id);
    }

    public Job markStarted(long id, String node, long pid, Instant startedAt) {
        Job current = jobs.get(id);
        if (current == null) throw BatchException.notFound(id);
        if (current.state() != JobState.WAITING) {
            throw BatchException.conflict("Job " + id + " is " + current.state() + ", not WAITING");
        }
        Job next = current.copy();
        next.node = node;
        next.pid = pid;
        next.started_at = Models.after(current.submitted_at, startedAt.truncatedTo(ChronoUnit.MICROS));
        return apply(next);
    }

    public Job markFinished(long id, int exitCode, Instant finishedAt) {
        Job current = jobs.get(id);
        if (current == null) throw BatchException.notFound(id);
        if (current.state() != JobState.RUNNING) {
            throw BatchException.conflict("Job " + id + " is " + current.state() + ", not RUNNING");
        }
        Job next = current.copy();
        next.exit_code = exitCode;
        next.finished_at = Models.after(current.started_at, finishedAt.truncatedTo(ChronoUnit.MICROS));
        next.pid = null;
        return apply(next);
    }

    private Job apply(Job next) {
        store.update(next);
        jobs.put(next.id, next);
        return next.copy();
    }
}
