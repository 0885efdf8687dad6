package com.batchq;

import com.batchq.Models.Job;
import com.batchq.Models.JobState;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/** Non-durable JobStore, for tests and throwaway daemons. */
public class InMemoryJobStore implements JobStore {
    private final Map<Long, Job> map = new TreeMap<>();
    private long lastId = 0;

    @Override
    public synchronized Job insert(Job job) {
        Job stored = job.copy();
        stored.id = ++lastId;
        map.put(stored.id, stored);
        return stored.copy();
    }

    @Override
    public synchronized void update(Job job) {
        if (!map.containsKey(job.id)) throw BatchException.storage("No stored job with id " + job.id, null);
        map.put(job.id, job.copy());
    }

    @Override
    public synchronized void delete(long id) {
        map.remove(id);
    }

    @Override
    public synchronized List<Job> query(JobState state, int limit) {
        return map.values().stream()
                .filter(j -> state == null || j.state() == state)
                .sorted(order(state))
                .limit(limit > 0 ? limit : Long.MAX_VALUE)
                .map(Job::copy)
                .collect(Collectors.toList());
    }

    static Comparator<Job> order(JobState state) {
        Comparator<Job> byId = Comparator.comparingLong(j -> j.id);
        if (state == null) return byId;
        return switch (state) {
            case WAITING -> Comparator.comparing((Job j) -> j.submitted_at).thenComparing(byId);
            case RUNNING -> Comparator.comparing((Job j) -> j.started_at).thenComparing(byId);
            case DONE -> Comparator.comparing((Job j) -> j.finished_at).reversed().thenComparing(byId);
        };
    }
}
