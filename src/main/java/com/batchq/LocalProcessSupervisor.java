package com.batchq;

import com.batchq.Models.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class LocalProcessSupervisor implements ProcessSupervisor {
    private static final Logger log = LoggerFactory.getLogger(LocalProcessSupervisor.class);

    public static final int UNKNOWN_EXIT_CODE = -1;

    private final Map<String, String> extraEnv;
    private final Map<Long, Process> processes = new ConcurrentHashMap<>();
    private final Set<Long> watched = ConcurrentHashMap.newKeySet();

    public LocalProcessSupervisor() {
        this(Map.of());
    }

    public LocalProcessSupervisor(Map<String, String> extraEnv) {
        this.extraEnv = new LinkedHashMap<>(extraEnv);
    }

    @Override
    public long launch(Job job, ExitListener listener) {
        File script = new File(job.filename);
        File cwd = script.getAbsoluteFile().getParentFile();
        if (cwd == null || !cwd.isDirectory()) throw BatchException.launch("Working directory missing for " + script, null);
        if (!script.isFile()) throw BatchException.launch("Script not found: " + script, null);
        if (!script.canExecute()) throw BatchException.launch("Script not executable: " + script, null);

        ProcessBuilder pb = new ProcessBuilder(script.getAbsolutePath());
        pb.directory(cwd);
        pb.redirectInput(ProcessBuilder.Redirect.from(new File("/dev/null")));
        pb.redirectOutput(redirect(cwd, job.stdout_path));
        pb.redirectError(redirect(cwd, job.stderr_path));
        Map<String, String> env = pb.environment();
        env.putAll(extraEnv);
        env.put("BATCHQ_JOB_ID", Long.toString(job.id));
        env.put("BATCHQ_JOB_NAME", job.displayName());
        env.put("BATCHQ_NCPUS", Integer.toString(job.requested_cpus));
        if (job.node != null) env.put("BATCHQ_NODE", job.node);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw BatchException.launch("Could not start " + script + ": " + e.getMessage(), e);
        }
        long pid = process.pid();
        processes.put(pid, process);
        process.onExit().thenAccept(p -> report(pid, p.exitValue(), listener));
        log.debug("Started {} as pid {}", script, pid);
        return pid;
    }

    private void report(long pid, int exitCode, ExitListener listener) {
        if (processes.remove(pid) == null) return;
        try {
            listener.exited(pid, exitCode, Models.now());
        } catch (RuntimeException e) {
            log.error("Exit listener for pid {} failed", pid, e);
        }
    }

    @Override
    public boolean terminate(long pid) {
        Process process = processes.get(pid);
        Optional<ProcessHandle> handle = process != null ? Optional.of(process.toHandle()) : ProcessHandle.of(pid);
        if (handle.isEmpty() || !handle.get().isAlive()) return false;
        ProcessHandle h = handle.get();
        h.descendants().forEach(ProcessHandle::destroyForcibly);
        boolean sent = h.destroyForcibly();
        log.info("Sent kill to pid {}", pid);
        return sent;
    }

    @Override
    public boolean watch(long pid, ExitListener listener) {
        Optional<ProcessHandle> handle = ProcessHandle.of(pid).filter(ProcessHandle::isAlive);
        if (handle.isEmpty() || !watched.add(pid)) return false;
        handle.get().onExit().thenAccept(h -> {
            if (!watched.remove(pid)) return;
            try {
                listener.exited(pid, UNKNOWN_EXIT_CODE, Models.now());
            } catch (RuntimeException e) {
                log.error("Exit listener for pid {} failed", pid, e);
            }
        });
        return true;
    }

    private static ProcessBuilder.Redirect redirect(File cwd, String path) {
        if (path == null || path.isBlank()) return ProcessBuilder.Redirect.DISCARD;
        File f = new File(path);
        return ProcessBuilder.Redirect.to(f.isAbsolute() ? f : new File(cwd, path));
    }
}
