package com.batchq;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Daemon settings. Loaded from a JSON file at startup; a whitelisted subset can be changed while
 * the daemon runs, and such changes are written back to the file.
 */
@JsonIgnoreProperties(ignoreUnknown = false)
public class Config {
    private static final Logger log = LoggerFactory.getLogger(Config.class);

    public static final int DEFAULT_PORT = 16219;
    public static final List<String> KEYS = List.of("ncpus", "nodename", "root", "default_priority",
            "scheduler_interval_seconds", "slack_token", "slack_channel", "port", "database");
    public static final Set<String> RUNTIME_KEYS = Set.of("ncpus", "root", "default_priority",
            "scheduler_interval_seconds", "slack_token", "slack_channel");

    public int ncpus = Runtime.getRuntime().availableProcessors();
    public String nodename = localHostName();
    public String root = "/";
    public int default_priority = 0;
    public int scheduler_interval_seconds = 10;
    public String slack_token;
    public String slack_channel;
    public int port = DEFAULT_PORT;
    public String database = "batchq.db";

    @JsonIgnore
    private File file;

    public static Config load(File file) {
        Config cfg = new Config();
        if (file == null) return cfg;
        if (!file.exists()) {
            cfg.file = file;
            cfg.save();
            log.info("Wrote default config to {}", file);
            return cfg;
        }
        try {
            Models.JSON.readerForUpdating(cfg).readValue(file);
        } catch (UnrecognizedPropertyException e) {
            throw BatchException.config("Unknown config key in " + file + ": " + e.getPropertyName());
        } catch (IOException e) {
            throw BatchException.config("Could not read config " + file + ": " + e.getMessage());
        }
        cfg.validate();
        cfg.file = file;
        return cfg;
    }

    public void save() {
        if (file == null) return;
        try {
            Models.JSON.writerWithDefaultPrettyPrinter().writeValue(file, this);
        } catch (IOException e) {
            throw BatchException.config("Could not write config " + file + ": " + e.getMessage());
        }
    }

    /** Key/value view for clients; the chat token is masked. */
    public Map<String, Object> toMap() {
        Map<String, Object> map = Models.JSON.convertValue(this, new TypeReference<LinkedHashMap<String, Object>>() {});
        if (slack_token != null) map.put("slack_token", "***");
        return map;
    }

    /**
     * Changes one runtime-settable key. The value is validated and persisted before it is applied,
     * so a rejected change leaves this config untouched.
     */
    public Map<String, Object> set(String key, String value) {
        if (!KEYS.contains(key)) throw BatchException.config("Unknown config key: " + key);
        if (!RUNTIME_KEYS.contains(key)) throw BatchException.config("Config key " + key + " can only be changed before startup");
        Config next = Models.JSON.convertValue(this, Config.class);
        next.file = file;
        next.assign(key, value);
        next.validate();
        next.save();
        copyFrom(next);
        log.info("Config {} set to {}", key, key.equals("slack_token") ? "***" : value);
        return toMap();
    }

    private void assign(String key, String value) {
        switch (key) {
            case "ncpus" -> ncpus = parseInt(key, value);
            case "root" -> root = value;
            case "default_priority" -> default_priority = parseInt(key, value);
            case "scheduler_interval_seconds" -> scheduler_interval_seconds = parseInt(key, value);
            case "slack_token" -> slack_token = emptyToNull(value);
            case "slack_channel" -> slack_channel = emptyToNull(value);
            default -> throw BatchException.config("Config key " + key + " can only be changed before startup");
        }
    }

    private void validate() {
        if (ncpus < 1) throw BatchException.config("ncpus must be at least 1, got " + ncpus);
        if (nodename == null || nodename.isBlank()) throw BatchException.config("nodename must not be empty");
        if (root == null || !new File(root).isDirectory()) throw BatchException.config("root is not a directory: " + root);
        if (scheduler_interval_seconds < 1) throw BatchException.config("scheduler_interval_seconds must be at least 1");
        if (port < 0 || port > 65535) throw BatchException.config("port out of range: " + port);
        if (database == null || database.isBlank()) throw BatchException.config("database must not be empty");
    }

    private void copyFrom(Config other) {
        ncpus = other.ncpus;
        nodename = other.nodename;
        root = other.root;
        default_priority = other.default_priority;
        scheduler_interval_seconds = other.scheduler_interval_seconds;
        slack_token = other.slack_token;
        slack_channel = other.slack_channel;
        port = other.port;
        database = other.database;
    }

    static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException | NullPointerException e) {
            throw BatchException.config("Config key " + key + " needs an integer, got " + value);
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "localhost";
        }
    }
}
