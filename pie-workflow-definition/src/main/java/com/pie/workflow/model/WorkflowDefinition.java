package com.pie.workflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pie.workflow.load.InvalidWorkflowException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named, ordered collection of nodes. Read-only for the lifetime of a run; the scheduler derives
 * all mutable run state from it.
 * <p>
 * Node ids must be non-blank and unique. Dependency ids are not checked here: a dangling dependency
 * is reported as deadlock by the scheduler unless the loader validates eagerly.
 */
public final class WorkflowDefinition {

    private final String name;
    private final List<NodeDefinition> nodes;
    private final Map<String, NodeDefinition> nodesById;
    private final Path baseDirectory;

    @JsonCreator
    public WorkflowDefinition(
            @JsonProperty("name") String name,
            @JsonProperty("nodes") List<NodeDefinition> nodes) {
        this(name, nodes, null);
    }

    private WorkflowDefinition(String name, List<NodeDefinition> nodes, Path baseDirectory) {
        this.name = name != null && !name.isBlank() ? name : "Untitled";
        this.nodes = nodes != null ? List.copyOf(nodes) : List.of();
        this.nodesById = indexById(this.nodes);
        this.baseDirectory = baseDirectory;
    }

    private static Map<String, NodeDefinition> indexById(List<NodeDefinition> nodes) {
        Map<String, NodeDefinition> byId = new LinkedHashMap<>();
        List<String> duplicates = new ArrayList<>();
        for (NodeDefinition node : nodes) {
            String id = node.getId();
            if (id == null || id.isBlank()) {
                throw new InvalidWorkflowException("Workflow node without id: " + node);
            }
            if (byId.putIfAbsent(id, node) != null) {
                duplicates.add(id);
            }
        }
        if (!duplicates.isEmpty()) {
            throw new InvalidWorkflowException("Duplicate node ids in workflow: " + duplicates);
        }
        return Collections.unmodifiableMap(byId);
    }

    /**
     * Returns a copy whose artifact paths resolve against the given directory (normally the directory
     * of the workflow file).
     */
    public WorkflowDefinition withBaseDirectory(Path baseDirectory) {
        return new WorkflowDefinition(name, nodes, baseDirectory);
    }

    public String getName() {
        return name;
    }

    /** Nodes in declaration order. */
    public List<NodeDefinition> getNodes() {
        return nodes;
    }

    public Optional<NodeDefinition> findNode(String nodeId) {
        return Optional.ofNullable(nodeId != null ? nodesById.get(nodeId) : null);
    }

    @JsonIgnore
    public Map<String, NodeDefinition> getNodesById() {
        return nodesById;
    }

    /** Directory artifact paths are relative to; current working directory when not set. */
    @JsonIgnore
    public Path getBaseDirectory() {
        return baseDirectory != null ? baseDirectory : Path.of("").toAbsolutePath();
    }
}
