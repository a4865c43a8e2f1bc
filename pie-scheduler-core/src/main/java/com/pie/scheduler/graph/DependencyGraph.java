package com.pie.scheduler.graph;

import com.pie.workflow.model.NodeDefinition;
import com.pie.workflow.model.WorkflowDefinition;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only dependency graph over a workflow's nodes. Built once per run; every query is a pure
 * function of its arguments so the scheduler can call it after each completion event.
 * <p>
 * Dangling dependency ids are kept as-is: such a node is simply never ready.
 */
public final class DependencyGraph {

    private final Map<String, NodeDefinition> nodesById;

    public DependencyGraph(WorkflowDefinition workflow) {
        this.nodesById = Objects.requireNonNull(workflow, "workflow").getNodesById();
    }

    /** All node ids in declaration order. */
    public Set<String> nodeIds() {
        return nodesById.keySet();
    }

    /** Node by id, or null if the id is not part of the workflow. */
    public NodeDefinition node(String nodeId) {
        return nodesById.get(nodeId);
    }

    public int size() {
        return nodesById.size();
    }

    /**
     * Ids from {@code pending} whose dependencies are all in {@code completed}, in declaration order.
     */
    public Set<String> ready(Set<String> pending, Set<String> completed) {
        Set<String> ready = new LinkedHashSet<>();
        for (Map.Entry<String, NodeDefinition> e : nodesById.entrySet()) {
            if (pending.contains(e.getKey()) && completed.containsAll(e.getValue().getDependencies())) {
                ready.add(e.getKey());
            }
        }
        return ready;
    }

    /** True when nothing is pending and nothing is running: the run is drained. */
    public static boolean isEmpty(Set<String> pending, Set<String> running) {
        return pending.isEmpty() && running.isEmpty();
    }

    /** Dependencies of the node that are not (yet) completed, in declaration order. */
    public List<String> unmetDependencies(String nodeId, Set<String> completed) {
        NodeDefinition node = nodesById.get(nodeId);
        if (node == null) return List.of();
        List<String> unmet = new ArrayList<>();
        for (String dep : node.getDependencies()) {
            if (!completed.contains(dep)) unmet.add(dep);
        }
        return unmet;
    }

    /** Dependency ids referenced by some node but not present in the workflow. */
    public Set<String> missingDependencies() {
        Set<String> missing = new LinkedHashSet<>();
        for (NodeDefinition node : nodesById.values()) {
            for (String dep : node.getDependencies()) {
                if (!nodesById.containsKey(dep)) missing.add(dep);
            }
        }
        return missing;
    }
}
