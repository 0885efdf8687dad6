package com.batchq;

import com.batchq.Models.Job;
import com.batchq.Models.JobState;

import java.util.List;

/**
 * Durable CRUD over job records. Implementations report every failure as a
 * {@link BatchException} with {@link ErrorCode#STORAGE}.
 */
public interface JobStore extends AutoCloseable {
    /** Stores a new job and returns a copy carrying its assigned id. Ids are never reused. */
    Job insert(Job job);

    void update(Job job);

    void delete(long id);

    /**
     * Jobs in the given state, waiting ordered by submission, running by start time and done by
     * most recently finished first. A {@code null} state returns every job ordered by id.
     * A limit of zero or less means no limit.
     */
    List<Job> query(JobState state, int limit);

    default List<Job> all() {
        return query(null, 0);
    }

    @Override
    default void close() {}
}
