package com.batchq;

import com.batchq.Models.Job;

/**
 * Hook called on job transitions. Best effort: implementations must not block the caller for
 * long and must not throw.
 */
public interface Notifier {
    enum Event { STARTED, FINISHED, FAILED }

    void send(Job job, Event event);
}
