package com.batchq;

import com.batchq.Models.Submission;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON-RPC 2.0 method table over a {@link Scheduler}. Parameters may be passed by name or by
 * position; each method declares its parameter names in positional order.
 */
public class RpcDispatcher {
    private static final Logger log = LoggerFactory.getLogger(RpcDispatcher.class);

    @FunctionalInterface
    interface Method {
        Object call(Params params);
    }

    private record Entry(List<String> paramNames, Method method) {}

    private final Map<String, Entry> methods = new LinkedHashMap<>();

    public RpcDispatcher(Scheduler scheduler) {
        register("submit", List.of("submission"), p -> Map.of("id", scheduler.submit(p.submission())));
        register("remove", List.of("job_id"), p -> {
            scheduler.remove(p.requireLong("job_id"));
            return Map.of("success", true);
        });
        register("run", List.of("job_id"), p -> {
            scheduler.run(p.requireLong("job_id"));
            return Map.of("success", true);
        });
        register("get_job", List.of("job_id"), p -> scheduler.get(p.requireLong("job_id")));
        register("list_running", List.of(), p -> scheduler.listRunning());
        register("list_waiting", List.of(), p -> scheduler.listWaiting());
        register("list_finished", List.of("limit"), p -> scheduler.listFinished(p.optionalInt("limit", Scheduler.DEFAULT_FINISHED_LIMIT)));
        register("get_cpus", List.of(), p -> scheduler.cpus());
        register("get_config", List.of(), p -> scheduler.getConfig());
        register("set_config", List.of("key", "value"), p -> scheduler.setConfig(p.requireString("key"), p.requireString("value")));
    }

    private void register(String name, List<String> paramNames, Method method) {
        methods.put(name, new Entry(paramNames, method));
    }

    /** Handles one request line. Returns the response line, or null for a notification. */
    public String handle(String line) {
        JsonNode request;
        try {
            request = Models.JSON.readTree(line);
        } catch (JsonProcessingException e) {
            return write(error(NullNode.getInstance(), new BatchException(ErrorCode.PARSE_ERROR, "Parse error")));
        }
        if (request == null || !request.isObject()) {
            return write(error(NullNode.getInstance(), new BatchException(ErrorCode.INVALID_REQUEST, "Invalid request")));
        }
        JsonNode id = request.has("id") ? request.get("id") : null;
        ObjectNode response = dispatch(request, id == null ? NullNode.getInstance() : id);
        return id == null ? null : write(response);
    }

    private ObjectNode dispatch(JsonNode request, JsonNode id) {
        JsonNode method = request.get("method");
        if (method == null || !method.isTextual()) {
            return error(id, new BatchException(ErrorCode.INVALID_REQUEST, "Invalid request: missing method"));
        }
        Entry entry = methods.get(method.asText());
        if (entry == null) {
            return error(id, new BatchException(ErrorCode.METHOD_NOT_FOUND, "Method not found: " + method.asText()));
        }
        JsonNode params = request.get("params");
        if (params != null && !params.isNull() && !params.isObject() && !params.isArray()) {
            return error(id, new BatchException(ErrorCode.INVALID_PARAMS, "params must be an object or an array"));
        }
        try {
            Object result = entry.method.call(new Params(params, entry.paramNames));
            ObjectNode response = envelope(id);
            response.set("result", Models.JSON.valueToTree(result));
            return response;
        } catch (BatchException e) {
            log.debug("{} failed: {}", method.asText(), e.getMessage());
            return error(id, e);
        } catch (RuntimeException e) {
            log.error("{} failed", method.asText(), e);
            return error(id, new BatchException(ErrorCode.INTERNAL, "Internal error: " + e.getMessage(), e));
        }
    }

    private static ObjectNode envelope(JsonNode id) {
        ObjectNode n = JsonNodeFactory.instance.objectNode();
        n.put("jsonrpc", "2.0");
        n.set("id", id);
        return n;
    }

    static ObjectNode error(JsonNode id, BatchException e) {
        ObjectNode response = envelope(id);
        ObjectNode err = response.putObject("error");
        err.put("code", e.getCode().rpcCode());
        err.put("message", e.getMessage());
        err.putObject("data").put("kind", e.getCode().name());
        return response;
    }

    /** Error response line for a request that could not be read, so it has no id. */
    static String errorLine(BatchException e) {
        return write(error(NullNode.getInstance(), e));
    }

    private static String write(ObjectNode response) {
        try {
            return Models.JSON.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise response", e);
        }
    }

    /** Request parameters, addressed by name whether they came as an object or an array. */
    static final class Params {
        private final JsonNode params;
        private final List<String> names;

        Params(JsonNode params, List<String> names) {
            this.params = params;
            this.names = names;
        }

        JsonNode get(String name) {
            if (params == null || params.isNull()) return null;
            if (params.isObject()) return params.get(name);
            int idx = names.indexOf(name);
            ArrayNode array = (ArrayNode) params;
            return idx >= 0 && idx < array.size() ? array.get(idx) : null;
        }

        long requireLong(String name) {
            JsonNode v = get(name);
            if (v == null || !v.canConvertToLong() || !v.isIntegralNumber()) throw invalid(name + " must be an integer");
            return v.asLong();
        }

        int optionalInt(String name, int fallback) {
            JsonNode v = get(name);
            if (v == null || v.isNull()) return fallback;
            if (!v.isIntegralNumber() || !v.canConvertToInt()) throw invalid(name + " must be an integer");
            return v.asInt();
        }

        String requireString(String name) {
            JsonNode v = get(name);
            if (v == null || v.isNull()) throw invalid(name + " is required");
            if (v.isValueNode()) return v.asText();
            throw invalid(name + " must be a string");
        }

        /** Accepts {"submission": {...}}, [{...}] or the submission fields directly as params. */
        Submission submission() {
            JsonNode v = get("submission");
            if (v == null && params != null && params.isObject()) v = params;
            if (v == null || !v.isObject()) throw invalid("submission must be an object");
            try {
                return Models.JSON.treeToValue(v, Submission.class);
            } catch (JsonProcessingException e) {
                throw invalid("Invalid submission: " + e.getOriginalMessage());
            } catch (IllegalArgumentException e) {
                throw invalid("Invalid submission: " + e.getMessage());
            }
        }

        private static BatchException invalid(String message) {
            return new BatchException(ErrorCode.INVALID_PARAMS, message);
        }
    }
}
