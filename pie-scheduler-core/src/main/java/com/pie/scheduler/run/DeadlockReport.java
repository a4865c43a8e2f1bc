package com.pie.scheduler.run;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Why a run could not make progress: each stuck node with the dependencies it still waits for, plus
 * the dependency ids that do not name any node of the workflow.
 */
public final class DeadlockReport {

    private final Map<String, List<String>> unmetDependencies;
    private final Set<String> missingDependencies;

    public DeadlockReport(Map<String, List<String>> unmetDependencies, Set<String> missingDependencies) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (unmetDependencies != null) unmetDependencies.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        this.unmetDependencies = Collections.unmodifiableMap(copy);
        this.missingDependencies = missingDependencies != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(missingDependencies))
                : Set.of();
    }

    /** Pending node id to its unmet dependency ids, in declaration order. */
    public Map<String, List<String>> getUnmetDependencies() {
        return unmetDependencies;
    }

    public Set<String> getStuckNodes() {
        return unmetDependencies.keySet();
    }

    public Set<String> getMissingDependencies() {
        return missingDependencies;
    }

    public String describe() {
        String stuck = unmetDependencies.entrySet().stream()
                .map(e -> e.getKey() + " waits for " + e.getValue())
                .collect(Collectors.joining("; "));
        StringBuilder sb = new StringBuilder("Deadlock: no node is ready and none is running. ").append(stuck);
        if (!missingDependencies.isEmpty()) {
            sb.append(". Dependencies not in workflow: ").append(missingDependencies);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return describe();
    }
}
