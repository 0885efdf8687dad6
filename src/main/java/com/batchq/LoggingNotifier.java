package com.batchq;

import com.batchq.Models.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingNotifier implements Notifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void send(Job job, Event event) {
        switch (event) {
            case STARTED -> log.info("Job {} ({}) started on {} as pid {}", job.id, job.displayName(), job.node, job.pid);
            case FINISHED -> log.info("Job {} ({}) finished on {}", job.id, job.displayName(), job.node);
            case FAILED -> log.info("Job {} ({}) failed on {} with exit code {}", job.id, job.displayName(), job.node, job.exit_code);
        }
    }
}
