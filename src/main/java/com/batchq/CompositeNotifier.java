package com.batchq;

import com.batchq.Models.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** Fans an event out to several notifiers; a failing one never stops the others or the caller. */
public class CompositeNotifier implements Notifier {
    private static final Logger log = LoggerFactory.getLogger(CompositeNotifier.class);

    private final List<Notifier> notifiers;

    public CompositeNotifier(List<Notifier> notifiers) {
        this.notifiers = List.copyOf(notifiers);
    }

    @Override
    public void send(Job job, Event event) {
        for (Notifier n : notifiers) {
            try {
                n.send(job, event);
            } catch (RuntimeException e) {
                log.warn("Notifier {} failed for job {}: {}", n.getClass().getSimpleName(), job.id, e.toString());
            }
        }
    }
}
