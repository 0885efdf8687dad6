package com.batchq;

import com.batchq.Models.Job;
import com.batchq.Models.JobState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

public class SqliteJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(SqliteJobStore.class);

    private static final String COLUMNS = "name, filename, username, owner_uid, requested_cpus, priority, allowed_nodes, " +
            "stdout_path, stderr_path, submitted_at, started_at, finished_at, exit_code, node, pid";

    private final String dbUrl;

    public SqliteJobStore(String path) {
        this.dbUrl = "jdbc:sqlite:" + path + "?busy_timeout=5000";
        init();
        log.info("Opened job store {}", path);
    }

    private Connection getConn() throws SQLException {
        Connection c = DriverManager.getConnection(dbUrl);
        try (Statement s = c.createStatement()) {
            s.execute("PRAGMA journal_mode=WAL;");
            s.execute("PRAGMA busy_timeout=5000;");
        }
        return c;
    }

    private void init() {
        try (Connection c = getConn(); Statement s = c.createStatement()) {
            // AUTOINCREMENT keeps ids of deleted jobs from being handed out again
            s.executeUpdate(
                "CREATE TABLE IF NOT EXISTS jobs (" +
                    "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                    "name TEXT NOT NULL, " +
                    "filename TEXT NOT NULL, " +
                    "username TEXT, " +
                    "owner_uid INTEGER, " +
                    "requested_cpus INTEGER NOT NULL, " +
                    "priority INTEGER NOT NULL DEFAULT 0, " +
                    "allowed_nodes TEXT, " +
                    "stdout_path TEXT, " +
                    "stderr_path TEXT, " +
                    "submitted_at INTEGER NOT NULL, " +
                    "started_at INTEGER, " +
                    "finished_at INTEGER, " +
                    "exit_code INTEGER, " +
                    "node TEXT, " +
                    "pid INTEGER)"
            );
            s.executeUpdate("CREATE INDEX IF NOT EXISTS jobs_state ON jobs (started_at, finished_at)");
        } catch (SQLException e) {
            throw BatchException.storage("Could not initialise job store: " + e.getMessage(), e);
        }
    }

    @Override
    public Job insert(Job job) {
        try (Connection c = getConn()) {
            try (PreparedStatement ps = c.prepareStatement("INSERT INTO jobs (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)")) {
                bind(ps, job);
                ps.executeUpdate();
            }
            Job stored = job.copy();
            try (Statement s = c.createStatement(); ResultSet rs = s.executeQuery("SELECT last_insert_rowid()")) {
                rs.next();
                stored.id = rs.getLong(1);
            }
            return stored;
        } catch (SQLException e) {
            throw BatchException.storage("Could not insert job: " + e.getMessage(), e);
        }
    }

    @Override
    public void update(Job job) {
        String assignments = Arrays.stream(COLUMNS.split(", ")).map(col -> col + "=?").collect(Collectors.joining(", "));
        try (Connection c = getConn(); PreparedStatement ps = c.prepareStatement("UPDATE jobs SET " + assignments + " WHERE id=?")) {
            bind(ps, job);
            ps.setLong(16, job.id);
            if (ps.executeUpdate() != 1) throw BatchException.storage("No stored job with id " + job.id, null);
        } catch (SQLException e) {
            throw BatchException.storage("Could not update job " + job.id + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(long id) {
        try (Connection c = getConn(); PreparedStatement ps = c.prepareStatement("DELETE FROM jobs WHERE id=?")) {
            ps.setLong(1, id);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw BatchException.storage("Could not delete job " + id + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<Job> query(JobState state, int limit) {
        String sql = "SELECT * FROM jobs";
        if (state != null) {
            sql += switch (state) {
                case WAITING -> " WHERE started_at IS NULL AND finished_at IS NULL ORDER BY submitted_at ASC, id ASC";
                case RUNNING -> " WHERE started_at IS NOT NULL AND finished_at IS NULL ORDER BY started_at ASC, id ASC";
                case DONE -> " WHERE finished_at IS NOT NULL ORDER BY finished_at DESC, id ASC";
            };
        } else {
            sql += " ORDER BY id ASC";
        }
        if (limit > 0) sql += " LIMIT " + limit;
        try (Connection c = getConn(); PreparedStatement ps = c.prepareStatement(sql); ResultSet rs = ps.executeQuery()) {
            List<Job> out = new ArrayList<>();
            while (rs.next()) out.add(map(rs));
            return out;
        } catch (SQLException e) {
            throw BatchException.storage("Could not query jobs: " + e.getMessage(), e);
        }
    }

    private static void bind(PreparedStatement ps, Job j) throws SQLException {
        ps.setString(1, j.name);
        ps.setString(2, j.filename);
        ps.setString(3, j.username);
        ps.setObject(4, j.owner_uid);
        ps.setInt(5, j.requested_cpus);
        ps.setInt(6, j.priority);
        ps.setString(7, j.allowed_nodes == null || j.allowed_nodes.isEmpty() ? null : String.join(",", j.allowed_nodes));
        ps.setString(8, j.stdout_path);
        ps.setString(9, j.stderr_path);
        ps.setObject(10, toMicros(j.submitted_at));
        ps.setObject(11, toMicros(j.started_at));
        ps.setObject(12, toMicros(j.finished_at));
        ps.setObject(13, j.exit_code);
        ps.setString(14, j.node);
        ps.setObject(15, j.pid);
    }

    private static Job map(ResultSet r) throws SQLException {
        Job j = new Job();
        j.id = r.getLong("id");
        j.name = r.getString("name");
        j.filename = r.getString("filename");
        j.username = r.getString("username");
        j.owner_uid = intOrNull(r, "owner_uid");
        j.requested_cpus = r.getInt("requested_cpus");
        j.priority = r.getInt("priority");
        String nodes = r.getString("allowed_nodes");
        j.allowed_nodes = nodes == null || nodes.isEmpty() ? new ArrayList<>() : new ArrayList<>(Arrays.asList(nodes.split(",")));
        j.stdout_path = r.getString("stdout_path");
        j.stderr_path = r.getString("stderr_path");
        j.submitted_at = fromMicros(longOrNull(r, "submitted_at"));
        j.started_at = fromMicros(longOrNull(r, "started_at"));
        j.finished_at = fromMicros(longOrNull(r, "finished_at"));
        j.exit_code = intOrNull(r, "exit_code");
        j.node = r.getString("node");
        j.pid = longOrNull(r, "pid");
        return j;
    }

    private static Integer intOrNull(ResultSet r, String column) throws SQLException {
        int v = r.getInt(column);
        return r.wasNull() ? null : v;
    }

    private static Long longOrNull(ResultSet r, String column) throws SQLException {
        long v = r.getLong(column);
        return r.wasNull() ? null : v;
    }

    private static Long toMicros(Instant t) {
        return t == null ? null : ChronoUnit.MICROS.between(Instant.EPOCH, t);
    }

    private static Instant fromMicros(Long micros) {
        return micros == null ? null : Instant.EPOCH.plus(micros, ChronoUnit.MICROS);
    }
}
