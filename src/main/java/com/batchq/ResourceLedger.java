package com.batchq;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * CPU capacity and commitments per node. Not thread-safe: only the scheduling thread touches it,
 * which keeps every reserve and release ordered with the admission decisions around it.
 */
public class ResourceLedger {
    private static final Logger log = LoggerFactory.getLogger(ResourceLedger.class);

    private final Map<String, Integer> capacity = new LinkedHashMap<>();
    private final Map<String, Integer> committed = new LinkedHashMap<>();

    public ResourceLedger(String node, int cpus) {
        setCapacity(node, cpus);
    }

    public Set<String> nodes() {
        return capacity.keySet();
    }

    public boolean hasNode(String node) {
        return capacity.containsKey(node);
    }

    public int capacity(String node) {
        return capacity.getOrDefault(node, 0);
    }

    public int committed(String node) {
        return committed.getOrDefault(node, 0);
    }

    public int free(String node) {
        return Math.max(0, capacity(node) - committed(node));
    }

    /** Capacity may not drop below what running jobs already hold. */
    public void setCapacity(String node, int cpus) {
        if (cpus < 0) throw new IllegalArgumentException("Negative capacity for node " + node);
        if (cpus < committed(node)) {
            throw new IllegalArgumentException("Capacity " + cpus + " of node " + node + " is below the " + committed(node) + " committed");
        }
        capacity.put(node, cpus);
        committed.putIfAbsent(node, 0);
    }

    /** Commits {@code cpus} on {@code node} iff they fit into its free capacity. */
    public boolean tryReserve(String node, int cpus) {
        if (!capacity.containsKey(node) || cpus < 1) return false;
        int used = committed(node);
        if (used + cpus > capacity(node)) return false;
        committed.put(node, used + cpus);
        return true;
    }

    /**
     * Commits regardless of capacity. Only for adopting a process that is already running; this is
     * the one way committed can exceed capacity, until that process exits.
     */
    public void commit(String node, int cpus) {
        committed.merge(node, cpus, Integer::sum);
        capacity.putIfAbsent(node, 0);
    }

    /** Floors at zero so a duplicated release cannot drive the count negative. */
    public void release(String node, int cpus) {
        int used = committed(node);
        if (cpus > used) log.warn("Releasing {} cpus on {} with only {} committed", cpus, node, used);
        committed.put(node, Math.max(0, used - cpus));
    }
}
