package com.batchq;

import com.batchq.Models.Job;
import com.batchq.Models.JobState;
import com.batchq.Models.Submission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Drives jobs from waiting to running. All state (registry, ledger, config, bookkeeping below)
 * is owned by one scheduling thread; the public methods hand their work to that thread and
 * block until it is done, so every client sees one linear order of transitions.
 */
public class Scheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    public static final int LOST_EXIT_CODE = -1;
    public static final int DEFAULT_FINISHED_LIMIT = 5;

    private final Config config;
    private final JobRegistry registry;
    private final ResourceLedger ledger;
    private final ProcessSupervisor supervisor;
    private final Notifier notifier;
    private final ScheduledExecutorService executor;

    // pid -> job id, for every process whose exit has not been recorded yet
    private final Map<Long, Long> running = new HashMap<>();
    // running jobs whose record is deleted once their exit is recorded
    private final Set<Long> pendingRemoval = new HashSet<>();
    // jobs asked to run now, considered ahead of all others until they start
    private final LinkedHashSet<Long> forced = new LinkedHashSet<>();
    private final Set<Long> warnedUnschedulable = new HashSet<>();
    // exits seen while the store was failing, retried on each tick
    private final List<Exit> unrecorded = new ArrayList<>();
    private ScheduledFuture<?> tick;
    private int tickSeconds;

    public Scheduler(Config config, JobRegistry registry, ResourceLedger ledger, ProcessSupervisor supervisor, Notifier notifier) {
        this.config = config;
        this.registry = registry;
        this.ledger = ledger;
        this.supervisor = supervisor;
        this.notifier = notifier;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "batchq-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    /** Adopts jobs a previous daemon left running, starts the timer and runs a first pass. */
    public void start() {
        call(() -> {
            adoptRunning();
            scheduleTick(config.scheduler_interval_seconds);
            pass();
            return null;
        });
    }

    public long submit(Submission submission) {
        return call(() -> {
            Job draft = validate(submission);
            Job job = registry.create(draft);
            log.info("Submitted job {} ({}) from {}, {} cpu(s), priority {}", job.id, job.displayName(), job.filename, job.requested_cpus, job.priority);
            pass();
            return job.id;
        });
    }

    /**
     * Deletes a waiting or finished job. A running job is killed first and its record goes away
     * once the exit has been recorded, so its cpus stay committed until then.
     */
    public void remove(long id) {
        call(() -> {
            Job job = registry.get(id);
            switch (job.state()) {
                case WAITING, DONE -> {
                    registry.delete(id);
                    forced.remove(id);
                    warnedUnschedulable.remove(id);
                    log.info("Deleted job {}", id);
                    pass();
                }
                case RUNNING -> {
                    pendingRemoval.add(id);
                    log.info("Killing running process {} for job {}", job.pid, id);
                    if (job.pid == null || !supervisor.terminate(job.pid)) {
                        log.info("Process for job {} already gone, waiting for its exit to be recorded", id);
                    }
                }
            }
            return null;
        });
    }

    /**
     * Moves a waiting job to the front of the queue. It still only starts once its cpus fit;
     * no running job is preempted for it.
     */
    public void run(long id) {
        call(() -> {
            Job job = registry.get(id);
            if (job.state() != JobState.WAITING) throw BatchException.conflict("Job " + id + " is " + job.state() + ", not WAITING");
            forced.add(id);
            pass();
            return null;
        });
    }

    public Job get(long id) {
        return call(() -> registry.get(id));
    }

    public List<Job> listWaiting() {
        return call(() -> {
            List<Job> jobs = registry.list(JobState.WAITING, 0);
            jobs.sort(Job.DISPATCH_ORDER);
            return jobs;
        });
    }

    public List<Job> listRunning() {
        return call(() -> registry.list(JobState.RUNNING, 0));
    }

    public List<Job> listFinished(int limit) {
        if (limit < 1) throw BatchException.validation("limit must be at least 1, got " + limit);
        return call(() -> registry.list(JobState.DONE, limit));
    }

    /** Committed and total cpus of this node. */
    public int[] cpus() {
        return call(() -> new int[]{ledger.committed(config.nodename), ledger.capacity(config.nodename)});
    }

    public Map<String, Object> getConfig() {
        return call(config::toMap);
    }

    public Map<String, Object> setConfig(String key, String value) {
        return call(() -> {
            if (key.equals("ncpus")) {
                int committed = ledger.committed(config.nodename);
                int cpus = Config.parseInt(key, value);
                if (cpus < committed) {
                    throw BatchException.config("ncpus cannot drop below the " + committed + " cpu(s) held by running jobs");
                }
            }
            Map<String, Object> result = config.set(key, value);
            switch (key) {
                case "ncpus" -> {
                    ledger.setCapacity(config.nodename, config.ncpus);
                    pass();
                }
                case "scheduler_interval_seconds" -> scheduleTick(config.scheduler_interval_seconds);
                default -> { }
            }
            return result;
        });
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) executor.shutdownNow();
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (!running.isEmpty()) log.info("Scheduler stopped with {} job(s) still running", running.size());
    }

    private <T> T call(Callable<T> task) {
        Future<T> future;
        try {
            future = executor.submit(task);
        } catch (RejectedExecutionException e) {
            throw new BatchException(ErrorCode.INTERNAL, "Scheduler is shut down", e);
        }
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BatchException be) throw be;
            log.error("Scheduler task failed", cause);
            throw new BatchException(ErrorCode.INTERNAL, String.valueOf(cause), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BatchException(ErrorCode.INTERNAL, "Interrupted while waiting for scheduler", e);
        }
    }

    private Job validate(Submission s) {
        if (s == null) throw BatchException.validation("Missing submission");
        if (s.requested_cpus == null) throw BatchException.validation("requested_cpus is required");
        if (s.requested_cpus < 1) throw BatchException.validation("requested_cpus must be at least 1, got " + s.requested_cpus);
        if (s.filename == null || s.filename.isBlank()) throw BatchException.validation("filename is required");

        Path script = Paths.get(s.filename);
        if (!script.isAbsolute()) script = Paths.get(config.root).resolve(script);
        script = script.normalize();
        if (!Files.isRegularFile(script)) throw BatchException.validation("File does not exist: " + script);
        if (!Files.isExecutable(script)) throw BatchException.validation("File is not executable: " + script);
        Path dir = script.getParent();

        Job job = new Job();
        job.filename = script.toString();
        job.name = s.name == null || s.name.isBlank() ? script.getFileName().toString() : s.name.trim();
        job.username = s.username;
        job.owner_uid = s.owner_uid;
        job.requested_cpus = s.requested_cpus;
        job.priority = s.priority != null ? s.priority : config.default_priority;
        job.stdout_path = resolve(dir, s.stdout_path);
        job.stderr_path = resolve(dir, s.stderr_path);
        if (s.allowed_nodes != null) {
            Set<String> nodes = new LinkedHashSet<>();
            for (String n : s.allowed_nodes) {
                if (n == null || n.isBlank()) continue;
                if (n.contains(",")) throw BatchException.validation("Node name must not contain a comma: " + n);
                nodes.add(n.trim());
            }
            job.allowed_nodes = new ArrayList<>(nodes);
        }
        return job;
    }

    private static String resolve(Path dir, String path) {
        if (path == null || path.isBlank()) return null;
        return dir.resolve(path).normalize().toString();
    }

    /** One scheduling pass: forced jobs first, then by priority and age, skipping what does not fit. */
    private void pass() {
        forced.removeIf(id -> registry.find(id).map(j -> j.state() != JobState.WAITING).orElse(true));
        List<Job> candidates = new ArrayList<>();
        for (Long id : forced) candidates.add(registry.get(id));
        List<Job> waiting = registry.list(JobState.WAITING, 0);
        waiting.removeIf(j -> forced.contains(j.id));
        waiting.sort(Job.DISPATCH_ORDER);
        candidates.addAll(waiting);

        for (Job job : candidates) {
            if (totalFree() == 0) break;
            for (String node : candidateNodes(job)) {
                if (!ledger.tryReserve(node, job.requested_cpus)) continue;
                if (dispatch(job, node)) break;
            }
        }
    }

    private int totalFree() {
        int free = 0;
        for (String node : ledger.nodes()) free += ledger.free(node);
        return free;
    }

    private List<String> candidateNodes(Job job) {
        if (job.allowed_nodes == null || job.allowed_nodes.isEmpty()) return List.of(config.nodename);
        List<String> nodes = new ArrayList<>();
        for (String n : job.allowed_nodes) {
            if (ledger.hasNode(n)) nodes.add(n);
        }
        if (nodes.isEmpty() && warnedUnschedulable.add(job.id)) {
            log.warn("Job {} only runs on {}, none of which is served by this daemon ({}); it will stay waiting",
                    job.id, job.allowed_nodes, config.nodename);
        }
        return nodes;
    }

    /** Launches a job whose cpus are already reserved on {@code node}; gives them back on failure. */
    private boolean dispatch(Job job, String node) {
        Job launching = job.copy();
        launching.node = node;
        long pid;
        try {
            pid = supervisor.launch(launching, this::onExit);
        } catch (BatchException e) {
            ledger.release(node, job.requested_cpus);
            log.warn("Could not launch job {}, will retry: {}", job.id, e.getMessage());
            return false;
        }
        Job started;
        try {
            started = registry.markStarted(job.id, node, pid, Models.now());
        } catch (BatchException e) {
            log.error("Could not record start of job {}, killing pid {}: {}", job.id, pid, e.getMessage());
            supervisor.terminate(pid);
            ledger.release(node, job.requested_cpus);
            return false;
        }
        running.put(pid, job.id);
        forced.remove(job.id);
        warnedUnschedulable.remove(job.id);
        notifier.send(started, Notifier.Event.STARTED);
        return true;
    }

    private void onExit(long pid, int exitCode, Instant finishedAt) {
        try {
            executor.execute(() -> {
                if (handleExit(new Exit(pid, exitCode, finishedAt))) pass();
            });
        } catch (RejectedExecutionException e) {
            log.debug("Exit of pid {} arrived after shutdown", pid);
        }
    }

    /** Records an exit once: finish the job, then release its cpus, then notify. */
    private boolean handleExit(Exit exit) {
        Long jobId = running.get(exit.pid);
        if (jobId == null) {
            log.debug("Ignoring repeated exit notification for pid {}", exit.pid);
            return false;
        }
        Job done;
        try {
            done = registry.markFinished(jobId, exit.exitCode, exit.finishedAt);
        } catch (BatchException e) {
            if (e.getCode() != ErrorCode.STORAGE) throw e;
            log.error("Could not record exit of job {}, will retry: {}", jobId, e.getMessage());
            if (!unrecorded.contains(exit)) unrecorded.add(exit);
            return false;
        }
        running.remove(exit.pid);
        unrecorded.remove(exit);
        ledger.release(done.node, done.requested_cpus);
        notifier.send(done, exit.exitCode == 0 ? Notifier.Event.FINISHED : Notifier.Event.FAILED);

        if (pendingRemoval.remove(jobId)) {
            try {
                registry.delete(jobId);
                log.info("Deleted job {}", jobId);
            } catch (BatchException e) {
                log.error("Could not delete finished job {}: {}", jobId, e.getMessage());
            }
        }
        return true;
    }

    private void adoptRunning() {
        for (Job job : registry.list(JobState.RUNNING, 0)) {
            boolean ours = config.nodename.equals(job.node);
            if (ours && job.pid != null && supervisor.watch(job.pid, this::onExit)) {
                if (!ledger.tryReserve(job.node, job.requested_cpus)) {
                    log.warn("Adopted job {} overcommits {} ({} cpus)", job.id, job.node, job.requested_cpus);
                    ledger.commit(job.node, job.requested_cpus);
                }
                running.put(job.pid, job.id);
                log.info("Adopted running job {} (pid {})", job.id, job.pid);
            } else if (ours || job.node == null) {
                log.warn("Job {} was running when the daemon stopped and its process is gone", job.id);
                try {
                    registry.markFinished(job.id, LOST_EXIT_CODE, Models.now());
                } catch (BatchException e) {
                    log.error("Could not mark lost job {} finished: {}", job.id, e.getMessage());
                }
            }
        }
    }

    private void scheduleTick(int seconds) {
        if (tick != null && seconds == tickSeconds) return;
        if (tick != null) tick.cancel(false);
        tickSeconds = seconds;
        tick = executor.scheduleWithFixedDelay(this::onTick, seconds, seconds, TimeUnit.SECONDS);
    }

    private void onTick() {
        try {
            for (Exit exit : new ArrayList<>(unrecorded)) handleExit(exit);
            pass();
        } catch (RuntimeException e) {
            log.error("Scheduling pass failed", e);
        }
    }

    private record Exit(long pid, int exitCode, Instant finishedAt) {}
}
