package com.batchq;

import com.batchq.Models.Job;
import com.batchq.Models.JobState;
import com.batchq.Models.Submission;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class SchedulerTest {
    @TempDir
    Path dir;

    private Config config;
    private InMemoryJobStore store;
    private FakeSupervisor supervisor;
    private RecordingNotifier notifier;
    private Scheduler scheduler;

    static class RecordingNotifier implements Notifier {
        final List<String> events = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void send(Job job, Event event) {
            events.add(job.id + ":" + event);
        }
    }

    @BeforeEach
    public void setUp() throws IOException {
        config = new Config();
        config.nodename = "node1";
        config.ncpus = 4;
        config.root = dir.toString();
        store = new InMemoryJobStore();
        supervisor = new FakeSupervisor();
        notifier = new RecordingNotifier();
        scheduler = startScheduler();
    }

    @AfterEach
    public void tearDown() {
        scheduler.close();
    }

    private Scheduler startScheduler() {
        Scheduler s = new Scheduler(config, new JobRegistry(store), new ResourceLedger(config.nodename, config.ncpus), supervisor, notifier);
        s.start();
        return s;
    }

    private Path script(String name) throws IOException {
        Path p = dir.resolve(name);
        Files.writeString(p, "#!/bin/sh\nexit 0\n");
        assertTrue(p.toFile().setExecutable(true));
        return p;
    }

    private long submit(int cpus) throws IOException {
        return submit(cpus, null);
    }

    private long submit(int cpus, Integer priority) throws IOException {
        Submission s = new Submission(script("job-" + System.nanoTime() + ".sh").toString(), cpus);
        s.priority = priority;
        return scheduler.submit(s);
    }

    private List<Long> ids(List<Job> jobs) {
        return jobs.stream().map(j -> j.id).collect(Collectors.toList());
    }

    private void assertCpus(int used, int total) {
        assertArrayEquals(new int[]{used, total}, scheduler.cpus());
    }

    @Test
    public void largeJobRunsAndSmallerOneWaitsUntilItFinishes() throws IOException {
        long x = submit(4);
        long y = submit(2);

        assertEquals(List.of(x), ids(scheduler.listRunning()));
        assertEquals(List.of(y), ids(scheduler.listWaiting()));
        assertCpus(4, 4);

        supervisor.exit(x, 0);

        assertEquals(List.of(y), ids(scheduler.listRunning()));
        assertEquals(List.of(x), ids(scheduler.listFinished(5)));
        assertCpus(2, 4);
        assertEquals(0, scheduler.get(x).exit_code);
    }

    @Test
    public void submissionWithoutPositiveCpusIsRejected() throws IOException {
        Submission zero = new Submission(script("zero.sh").toString(), 0);
        BatchException e = assertThrows(BatchException.class, () -> scheduler.submit(zero));
        assertEquals(ErrorCode.VALIDATION, e.getCode());

        Submission missing = new Submission();
        missing.filename = script("missing.sh").toString();
        assertEquals(ErrorCode.VALIDATION, assertThrows(BatchException.class, () -> scheduler.submit(missing)).getCode());

        assertTrue(scheduler.listWaiting().isEmpty());
        assertTrue(scheduler.listRunning().isEmpty());
        assertTrue(store.all().isEmpty());
    }

    @Test
    public void submissionOfMissingOrNonExecutableScriptIsRejected() throws IOException {
        Submission missing = new Submission(dir.resolve("nope.sh").toString(), 1);
        assertEquals(ErrorCode.VALIDATION, assertThrows(BatchException.class, () -> scheduler.submit(missing)).getCode());

        Path plain = dir.resolve("plain.sh");
        Files.writeString(plain, "echo hi\n");
        assertTrue(plain.toFile().setExecutable(false));
        Submission notExecutable = new Submission(plain.toString(), 1);
        assertEquals(ErrorCode.VALIDATION, assertThrows(BatchException.class, () -> scheduler.submit(notExecutable)).getCode());
        assertTrue(store.all().isEmpty());
    }

    @Test
    public void relativeScriptAndOutputPathsAreResolved() throws IOException {
        script("rel.sh");
        Submission s = new Submission("rel.sh", 1);
        s.stdout_path = "out/rel.log";
        long id = scheduler.submit(s);

        Job job = scheduler.get(id);
        assertEquals(dir.resolve("rel.sh").toString(), job.filename);
        assertEquals(dir.resolve("out/rel.log").toString(), job.stdout_path);
        assertNull(job.stderr_path);
        assertEquals("rel.sh", job.name);
        assertEquals(config.default_priority, job.priority);
    }

    @Test
    public void equalPriorityJobsStartInSubmissionOrder() throws IOException {
        long blocker = submit(4);
        long a = submit(3);
        long b = submit(3);
        assertEquals(List.of(a, b), ids(scheduler.listWaiting()));

        supervisor.exit(blocker, 0);
        assertEquals(List.of(a), ids(scheduler.listRunning()));

        supervisor.exit(a, 0);
        assertEquals(List.of(b), ids(scheduler.listRunning()));
        assertEquals(List.of(blocker, a, b), supervisor.launched());
    }

    @Test
    public void higherPriorityJobOvertakesEarlierLowerPriorityJob() throws IOException {
        long blocker = submit(4);
        long low = submit(3, 0);
        long high = submit(3, 10);
        assertEquals(List.of(high, low), ids(scheduler.listWaiting()));

        supervisor.exit(blocker, 0);

        assertEquals(List.of(high), ids(scheduler.listRunning()));
        assertEquals(List.of(low), ids(scheduler.listWaiting()));
    }

    @Test
    public void smallerJobBackfillsPastOneThatDoesNotFit() throws IOException {
        long first = submit(2);
        long big = submit(4, 5);
        long small = submit(2, 0);

        assertEquals(List.of(first, small), ids(scheduler.listRunning()));
        assertEquals(List.of(big), ids(scheduler.listWaiting()));
        assertCpus(4, 4);
    }

    @Test
    public void runRequestDoesNotExceedCapacity() throws IOException {
        long blocker = submit(4);
        long job = submit(2);

        scheduler.run(job);

        assertEquals(JobState.WAITING, scheduler.get(job).state());
        assertCpus(4, 4);
        assertEquals(ErrorCode.CONFLICT, assertThrows(BatchException.class, () -> scheduler.run(blocker)).getCode());
        assertEquals(ErrorCode.NOT_FOUND, assertThrows(BatchException.class, () -> scheduler.run(999)).getCode());
    }

    @Test
    public void runRequestPutsJobAheadOfHigherPriorityOnes() throws IOException {
        long blocker = submit(4);
        long high = submit(4, 10);
        long low = submit(4, 0);

        scheduler.run(low);
        supervisor.exit(blocker, 0);

        assertEquals(List.of(low), ids(scheduler.listRunning()));
        assertEquals(List.of(high), ids(scheduler.listWaiting()));
    }

    @Test
    public void removingWaitingJobDropsItEverywhere() throws IOException {
        long blocker = submit(4);
        long waiting = submit(1);

        scheduler.remove(waiting);
        assertTrue(scheduler.listWaiting().isEmpty());

        supervisor.exit(blocker, 0);
        assertFalse(ids(scheduler.listRunning()).contains(waiting));
        assertFalse(ids(scheduler.listFinished(10)).contains(waiting));
        assertFalse(supervisor.launched().contains(waiting));
        assertEquals(ErrorCode.NOT_FOUND, assertThrows(BatchException.class, () -> scheduler.get(waiting)).getCode());
        assertEquals(ErrorCode.NOT_FOUND, assertThrows(BatchException.class, () -> scheduler.remove(waiting)).getCode());
    }

    @Test
    public void removingRunningJobKeepsCpusUntilExitIsSeen() throws IOException {
        long job = submit(3);
        long pid = supervisor.pidByJob.get(job);

        scheduler.remove(job);

        assertTrue(supervisor.terminated.contains(pid));
        assertCpus(3, 4);
        assertEquals(JobState.RUNNING, scheduler.get(job).state());

        supervisor.exit(job, 137);

        assertCpus(0, 4);
        assertEquals(ErrorCode.NOT_FOUND, assertThrows(BatchException.class, () -> scheduler.get(job)).getCode());
        assertTrue(scheduler.listFinished(10).isEmpty());
        assertTrue(notifier.events.contains(job + ":FAILED"));
    }

    @Test
    public void finishedJobCanBeRemoved() throws IOException {
        long job = submit(1);
        supervisor.exit(job, 0);

        scheduler.remove(job);

        assertTrue(scheduler.listFinished(10).isEmpty());
        assertTrue(store.all().isEmpty());
    }

    @Test
    public void duplicateExitIsRecordedOnce() throws IOException {
        long a = submit(2);
        long b = submit(2);
        assertCpus(4, 4);

        supervisor.exit(a, 3);
        supervisor.exit(a, 0);

        Job done = scheduler.get(a);
        assertEquals(3, done.exit_code);
        assertEquals(JobState.DONE, done.state());
        assertCpus(2, 4);
        assertEquals(JobState.RUNNING, scheduler.get(b).state());
        assertEquals(1, notifier.events.stream().filter(e -> e.startsWith(a + ":F")).count());
    }

    @Test
    public void jobMovesStrictlyForwardThroughItsStates() throws IOException {
        long blocker = submit(4);
        long job = submit(1);
        Job waiting = scheduler.get(job);
        assertEquals(JobState.WAITING, waiting.state());
        assertNull(waiting.node);
        assertNull(waiting.pid);

        supervisor.exit(blocker, 0);
        Job running = scheduler.get(job);
        assertEquals(JobState.RUNNING, running.state());
        assertEquals("node1", running.node);
        assertNotNull(running.pid);
        assertTrue(running.started_at.isAfter(running.submitted_at));

        supervisor.exit(job, 0);
        Job done = scheduler.get(job);
        assertEquals(JobState.DONE, done.state());
        assertTrue(done.finished_at.isAfter(done.started_at));
        assertNull(done.pid);
        assertEquals(List.of(job + ":STARTED", job + ":FINISHED"),
                notifier.events.stream().filter(e -> e.startsWith(job + ":")).collect(Collectors.toList()));
    }

    @Test
    public void raisingCpusAdmitsWaitingJobsImmediately() throws IOException {
        submit(4);
        long second = submit(4);
        assertEquals(JobState.WAITING, scheduler.get(second).state());

        scheduler.setConfig("ncpus", "8");

        assertEquals(8, ((Number) scheduler.getConfig().get("ncpus")).intValue());
        assertEquals(JobState.RUNNING, scheduler.get(second).state());
        assertCpus(8, 8);
    }

    @Test
    public void cpusCannotDropBelowWhatRunningJobsHold() throws IOException {
        long running = submit(4);

        BatchException e = assertThrows(BatchException.class, () -> scheduler.setConfig("ncpus", "2"));
        assertEquals(ErrorCode.CONFIG, e.getCode());
        assertEquals(4, ((Number) scheduler.getConfig().get("ncpus")).intValue());
        assertCpus(4, 4);

        supervisor.exit(running, 0);
        scheduler.setConfig("ncpus", "2");
        assertCpus(0, 2);

        long next = submit(2);
        long blocked = submit(1);
        assertEquals(JobState.RUNNING, scheduler.get(next).state());
        assertEquals(JobState.WAITING, scheduler.get(blocked).state());
        assertCpus(2, 2);
    }

    @Test
    public void lowestPossiblePriorityGoesLast() throws IOException {
        long blocker = submit(4);
        long lowest = submit(4, Integer.MIN_VALUE);
        long normal = submit(4, 0);
        long highest = submit(4, Integer.MAX_VALUE);

        assertEquals(List.of(highest, normal, lowest), ids(scheduler.listWaiting()));

        supervisor.exit(blocker, 0);
        assertEquals(List.of(highest), ids(scheduler.listRunning()));
        supervisor.exit(highest, 0);
        assertEquals(List.of(normal), ids(scheduler.listRunning()));
    }

    @Test
    public void nodeNamesWithCommasAreRejected() throws IOException {
        Submission s = new Submission(script("comma.sh").toString(), 1);
        s.allowed_nodes = List.of("node1,node2");
        BatchException e = assertThrows(BatchException.class, () -> scheduler.submit(s));
        assertEquals(ErrorCode.VALIDATION, e.getCode());
        assertTrue(store.all().isEmpty());
    }

    @Test
    public void invalidConfigChangesAreRejected() {
        assertEquals(ErrorCode.CONFIG, assertThrows(BatchException.class, () -> scheduler.setConfig("colour", "blue")).getCode());
        assertEquals(ErrorCode.CONFIG, assertThrows(BatchException.class, () -> scheduler.setConfig("port", "1")).getCode());
        assertEquals(ErrorCode.CONFIG, assertThrows(BatchException.class, () -> scheduler.setConfig("ncpus", "0")).getCode());
        assertEquals(ErrorCode.CONFIG, assertThrows(BatchException.class, () -> scheduler.setConfig("ncpus", "many")).getCode());
        assertEquals(4, ((Number) scheduler.getConfig().get("ncpus")).intValue());
        assertCpus(0, 4);
    }

    @Test
    public void failedLaunchIsRetriedWithoutBlockingOthers() throws IOException {
        Submission s = new Submission(script("flaky.sh").toString(), 2);
        s.priority = 10;
        supervisor.failingJobs.add(1L);
        long flaky = scheduler.submit(s);
        assertEquals(1L, flaky);
        long other = submit(2);

        assertEquals(JobState.WAITING, scheduler.get(flaky).state());
        assertEquals(JobState.RUNNING, scheduler.get(other).state());
        assertCpus(2, 4);

        supervisor.failingJobs.clear();
        scheduler.run(flaky);
        assertEquals(JobState.RUNNING, scheduler.get(flaky).state());
        assertCpus(4, 4);
    }

    @Test
    public void jobsBoundToUnknownNodesStayWaiting() throws IOException {
        Submission elsewhere = new Submission(script("elsewhere.sh").toString(), 1);
        elsewhere.allowed_nodes = List.of("node7", " ");
        long away = scheduler.submit(elsewhere);

        Submission here = new Submission(script("here.sh").toString(), 1);
        here.allowed_nodes = List.of("node7", "node1");
        long home = scheduler.submit(here);

        assertEquals(List.of("node7"), scheduler.get(away).allowed_nodes);
        assertEquals(JobState.WAITING, scheduler.get(away).state());
        assertEquals(JobState.RUNNING, scheduler.get(home).state());
        assertEquals("node1", scheduler.get(home).node);
    }

    @Test
    public void finishedJobsAreListedMostRecentFirstUpToLimit() throws IOException {
        long a = submit(1);
        long b = submit(1);
        long c = submit(1);
        supervisor.exit(b, 0);
        sleep(5);
        supervisor.exit(a, 0);
        sleep(5);
        supervisor.exit(c, 0);

        assertEquals(List.of(c, a), ids(scheduler.listFinished(2)));
        assertEquals(List.of(c, a, b), ids(scheduler.listFinished(5)));
        assertEquals(ErrorCode.VALIDATION, assertThrows(BatchException.class, () -> scheduler.listFinished(0)).getCode());
    }

    @Test
    public void committedCpusNeverExceedCapacity() throws IOException {
        int[] sizes = {3, 1, 4, 2, 2, 1, 3, 4, 1, 2};
        List<Long> ids = new ArrayList<>();
        for (int cpus : sizes) {
            ids.add(submit(cpus, cpus % 3));
            checkCommitted();
        }
        for (int round = 0; round < sizes.length; round++) {
            List<Job> running = scheduler.listRunning();
            if (running.isEmpty()) break;
            supervisor.exit(running.get(running.size() - 1).id, 0);
            checkCommitted();
        }
        assertEquals(sizes.length, scheduler.listFinished(100).size());
        assertCpus(0, 4);
    }

    private void checkCommitted() {
        int[] cpus = scheduler.cpus();
        int sum = scheduler.listRunning().stream().mapToInt(j -> j.requested_cpus).sum();
        assertEquals(sum, cpus[0]);
        assertTrue(cpus[0] <= cpus[1], "committed " + cpus[0] + " exceeds capacity " + cpus[1]);
    }

    @Test
    public void storageFailureOnSubmitLeavesNothingBehind() throws IOException {
        scheduler.close();
        FailingStore failing = new FailingStore();
        store = failing;
        scheduler = startScheduler();
        failing.failing = true;

        BatchException e = assertThrows(BatchException.class, () -> submit(1));
        assertEquals(ErrorCode.STORAGE, e.getCode());
        assertTrue(scheduler.listWaiting().isEmpty());
        assertTrue(supervisor.launched().isEmpty());
    }

    @Test
    public void exitIsRecordedOnceStorageRecovers() throws IOException {
        scheduler.close();
        FailingStore failing = new FailingStore();
        store = failing;
        scheduler = startScheduler();
        long job = submit(2);

        failing.failing = true;
        supervisor.exit(job, 0);
        assertEquals(JobState.RUNNING, scheduler.get(job).state());
        assertCpus(2, 4);

        failing.failing = false;
        scheduler.setConfig("scheduler_interval_seconds", "1");
        long deadline = System.currentTimeMillis() + 5000;
        while (scheduler.get(job).state() != JobState.DONE && System.currentTimeMillis() < deadline) {
            sleep(50);
        }
        assertEquals(JobState.DONE, scheduler.get(job).state());
        assertCpus(0, 4);
    }

    @Test
    public void jobsLeftRunningByEarlierDaemonAreAdoptedOrClosed() throws IOException {
        scheduler.close();
        Job alive = storedRunning(2, 4242L);
        Job lost = storedRunning(1, 4343L);
        supervisor.alive.add(4242L);
        supervisor.pidByJob.put(alive.id, 4242L);

        scheduler = startScheduler();

        assertEquals(JobState.RUNNING, scheduler.get(alive.id).state());
        assertEquals(JobState.DONE, scheduler.get(lost.id).state());
        assertEquals(Scheduler.LOST_EXIT_CODE, scheduler.get(lost.id).exit_code);
        assertCpus(2, 4);

        supervisor.exit(alive.id, LocalProcessSupervisor.UNKNOWN_EXIT_CODE);
        assertEquals(JobState.DONE, scheduler.get(alive.id).state());
        assertCpus(0, 4);
    }

    @Test
    public void adoptedJobsAboveCapacityBlockAdmissionsUntilTheyExit() throws IOException {
        scheduler.close();
        Job first = storedRunning(3, 5151L);
        Job second = storedRunning(3, 5252L);
        supervisor.alive.add(5151L);
        supervisor.alive.add(5252L);
        supervisor.pidByJob.put(first.id, 5151L);
        supervisor.pidByJob.put(second.id, 5252L);

        scheduler = startScheduler();
        assertCpus(6, 4);
        long waiting = submit(2);
        assertEquals(JobState.WAITING, scheduler.get(waiting).state());

        supervisor.exit(first.id, LocalProcessSupervisor.UNKNOWN_EXIT_CODE);
        assertCpus(3, 4);
        assertEquals(JobState.WAITING, scheduler.get(waiting).state());

        supervisor.exit(second.id, LocalProcessSupervisor.UNKNOWN_EXIT_CODE);
        assertEquals(JobState.RUNNING, scheduler.get(waiting).state());
        assertCpus(2, 4);
    }

    private Job storedRunning(int cpus, long pid) throws IOException {
        Job j = new Job();
        j.name = "left-" + pid;
        j.filename = script("left-" + pid + ".sh").toString();
        j.requested_cpus = cpus;
        j.submitted_at = Models.now();
        j.started_at = Models.after(j.submitted_at, Models.now());
        j.node = "node1";
        j.pid = pid;
        return store.insert(j);
    }

    private static void sleep(long ms) {
        try { Thread.sleep(ms); } catch (InterruptedException e) { Thread.currentThread().interrupt(); }
    }

    static class FailingStore extends InMemoryJobStore {
        volatile boolean failing;

        @Override
        public synchronized Job insert(Job job) {
            if (failing) throw BatchException.storage("disk on fire", null);
            return super.insert(job);
        }

        @Override
        public synchronized void update(Job job) {
            if (failing) throw BatchException.storage("disk on fire", null);
            super.update(job);
        }
    }

    @Test
    public void configIsReturnedAsKeyValueMap() {
        Map<String, Object> cfg = scheduler.getConfig();
        assertEquals("node1", cfg.get("nodename"));
        assertTrue(cfg.keySet().containsAll(Config.KEYS));
    }
}
