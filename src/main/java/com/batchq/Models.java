package com.batchq;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public class Models {
    public static final ObjectMapper JSON = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    /** Timestamps are kept at microsecond precision, the resolution the job store persists. */
    public static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    /** Returns {@code t}, or the first instant strictly after {@code floor} if {@code t} is not. */
    public static Instant after(Instant floor, Instant t) {
        if (floor == null || t.isAfter(floor)) return t;
        return floor.plus(1, ChronoUnit.MICROS);
    }

    public enum JobState {
        WAITING, RUNNING, DONE;

        public static JobState of(Instant startedAt, Instant finishedAt) {
            if (finishedAt != null) return DONE;
            if (startedAt != null) return RUNNING;
            return WAITING;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public static class Job {
        /** Order in which waiting jobs are considered for dispatch. */
        public static final Comparator<Job> DISPATCH_ORDER = Comparator
                .comparingInt((Job j) -> j.priority).reversed()
                .thenComparing(j -> j.submitted_at)
                .thenComparingLong(j -> j.id);

        public long id;
        public String name;
        public String filename;
        public String username;
        public Integer owner_uid;
        public int requested_cpus = 1;
        public int priority = 0;
        public List<String> allowed_nodes = new ArrayList<>();
        public String stdout_path;
        public String stderr_path;
        public Instant submitted_at;
        public Instant started_at;
        public Instant finished_at;
        public Integer exit_code;
        public String node;
        public Long pid;

        public Job() {}

        @JsonProperty(value = "state", access = JsonProperty.Access.READ_ONLY)
        public JobState state() {
            return JobState.of(started_at, finished_at);
        }

        /** Name shown to users; the script path stands in when no name was given. */
        public String displayName() {
            return name != null && !name.isBlank() ? name : filename;
        }

        public Job copy() {
            Job j = new Job();
            j.id = id;
            j.name = name;
            j.filename = filename;
            j.username = username;
            j.owner_uid = owner_uid;
            j.requested_cpus = requested_cpus;
            j.priority = priority;
            j.allowed_nodes = allowed_nodes == null ? new ArrayList<>() : new ArrayList<>(allowed_nodes);
            j.stdout_path = stdout_path;
            j.stderr_path = stderr_path;
            j.submitted_at = submitted_at;
            j.started_at = started_at;
            j.finished_at = finished_at;
            j.exit_code = exit_code;
            j.node = node;
            j.pid = pid;
            return j;
        }

        @Override
        public String toString() {
            return "Job#" + id + "(" + displayName() + ", " + state() + ")";
        }
    }

    /** A parsed and not yet validated request to queue a script. */
    @JsonIgnoreProperties(ignoreUnknown = false)
    public static class Submission {
        public String filename;
        public String name;
        public Integer requested_cpus;
        public Integer priority;
        public String stdout_path;
        public String stderr_path;
        public List<String> allowed_nodes;
        public String username;
        public Integer owner_uid;

        public Submission() {}

        public Submission(String filename, int requestedCpus) {
            this.filename = filename;
            this.requested_cpus = requestedCpus;
        }
    }
}
