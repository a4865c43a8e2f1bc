package com.pie.scheduler.store;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only mapping from node id to its completed output; the only way a node observes the work
 * of its upstream nodes.
 * <p>
 * Not thread-safe: written and read only by the scheduler loop thread.
 */
public final class ResultStore {

    private final Map<String, ResultEntry> entries = new LinkedHashMap<>();

    /**
     * Records the output of a completed node.
     *
     * @throws DuplicateWriteException if the node already has an entry
     */
    public void put(String nodeId, String content) {
        if (entries.containsKey(nodeId)) {
            throw new DuplicateWriteException(nodeId);
        }
        entries.put(nodeId, new ResultEntry(nodeId, content, Instant.now()));
    }

    /**
     * Outputs of the given dependencies, keyed by id in the given order.
     *
     * @throws MissingDependencyException if any dependency has no entry yet
     */
    public Map<String, String> getUpstream(List<String> dependencyIds) {
        Map<String, String> upstream = new LinkedHashMap<>();
        for (String dep : dependencyIds) {
            ResultEntry entry = entries.get(dep);
            if (entry == null) {
                throw new MissingDependencyException(dep);
            }
            upstream.put(dep, entry.content());
        }
        return Collections.unmodifiableMap(upstream);
    }

    public Optional<String> get(String nodeId) {
        ResultEntry entry = entries.get(nodeId);
        return entry != null ? Optional.of(entry.content()) : Optional.empty();
    }

    public Optional<ResultEntry> getEntry(String nodeId) {
        return Optional.ofNullable(entries.get(nodeId));
    }

    public boolean contains(String nodeId) {
        return entries.containsKey(nodeId);
    }

    public int size() {
        return entries.size();
    }

    /** Node id to content, in completion order. Unmodifiable copy. */
    public Map<String, String> snapshot() {
        Map<String, String> copy = new LinkedHashMap<>();
        entries.forEach((id, entry) -> copy.put(id, entry.content()));
        return Collections.unmodifiableMap(copy);
    }
}
