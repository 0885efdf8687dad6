package com.batchq;

import com.batchq.Models.Job;

import java.time.Instant;

/** Starts job scripts as child processes and reports each one's termination exactly once. */
public interface ProcessSupervisor {

    @FunctionalInterface
    interface ExitListener {
        void exited(long pid, int exitCode, Instant finishedAt);
    }

    /**
     * Starts the job's script and returns its pid. The listener fires once when the process ends.
     *
     * @throws BatchException with {@link ErrorCode#LAUNCH} if the process could not be started
     */
    long launch(Job job, ExitListener listener);

    /** Forcibly kills the process and everything it spawned. Returns false if no such process is alive. */
    boolean terminate(long pid);

    /**
     * Watches a process this supervisor did not start, such as one left behind by an earlier
     * daemon. Its exit code cannot be observed and is reported as {@code -1}. Returns false if
     * the process is not alive.
     */
    boolean watch(long pid, ExitListener listener);
}
