package com.batchq;

import com.batchq.Models.Job;
import com.batchq.Models.Submission;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client side of the daemon protocol over one persistent connection. Errors returned by the
 * daemon are rethrown as {@link BatchException}s carrying the daemon's error kind.
 */
public class RpcClient implements AutoCloseable {
    private final Socket socket;
    private final BufferedReader in;
    private final BufferedWriter out;
    private long nextId = 1;

    public RpcClient(String host, int port) throws IOException {
        this.socket = new Socket(host, port);
        this.in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        this.out = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
    }

    public synchronized JsonNode call(String method, Object params) {
        long id = nextId++;
        ObjectNode request = Models.JSON.createObjectNode();
        request.put("jsonrpc", "2.0");
        request.put("method", method);
        request.set("params", params == null ? Models.JSON.createObjectNode() : Models.JSON.valueToTree(params));
        request.put("id", id);
        JsonNode response;
        try {
            out.write(Models.JSON.writeValueAsString(request));
            out.write('\n');
            out.flush();
            String line = in.readLine();
            if (line == null) throw new IOException("Connection closed by daemon");
            response = Models.JSON.readTree(line);
        } catch (IOException e) {
            throw new UncheckedIOException("RPC " + method + " failed: " + e.getMessage(), e);
        }
        JsonNode error = response.get("error");
        if (error != null && !error.isNull()) {
            ErrorCode code = ErrorCode.fromName(error.path("data").path("kind").asText(null));
            throw new BatchException(code, error.path("message").asText("Unknown error"));
        }
        return response.get("result");
    }

    public long submit(Submission submission) {
        return call("submit", Map.of("submission", submission)).get("id").asLong();
    }

    public void remove(long jobId) {
        call("remove", Map.of("job_id", jobId));
    }

    public void run(long jobId) {
        call("run", Map.of("job_id", jobId));
    }

    public Job getJob(long jobId) {
        return Models.JSON.convertValue(call("get_job", Map.of("job_id", jobId)), Job.class);
    }

    public List<Job> listWaiting() {
        return jobs(call("list_waiting", null));
    }

    public List<Job> listRunning() {
        return jobs(call("list_running", null));
    }

    public List<Job> listFinished(int limit) {
        return jobs(call("list_finished", Map.of("limit", limit)));
    }

    /** {@code [used, total]} cpus of the daemon's node. */
    public int[] cpus() {
        JsonNode r = call("get_cpus", null);
        return new int[]{r.get(0).asInt(), r.get(1).asInt()};
    }

    public Map<String, Object> getConfig() {
        return Models.JSON.convertValue(call("get_config", null), new TypeReference<LinkedHashMap<String, Object>>() {});
    }

    public Map<String, Object> setConfig(String key, String value) {
        return Models.JSON.convertValue(call("set_config", Map.of("key", key, "value", value)),
                new TypeReference<LinkedHashMap<String, Object>>() {});
    }

    private static List<Job> jobs(JsonNode result) {
        return Models.JSON.convertValue(result, new TypeReference<List<Job>>() {});
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }
}
