package com.pie.workflow.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One schedulable unit of a workflow. Immutable.
 * <p>
 * {@code image} is the engine artifact (e.g. a wasm inferlet) relative to the workflow file's directory.
 * The payload is either a free-text {@code instruction} or a structured {@code config} map; both may be
 * present and the payload strategy decides which one the engine receives.
 */
public final class NodeDefinition {

    private final String id;
    private final List<String> dependencies;
    private final String image;
    private final String instruction;
    private final Map<String, Object> config;

    @JsonCreator
    public NodeDefinition(
            @JsonProperty("id") String id,
            @JsonProperty("dependencies") List<String> dependencies,
            @JsonProperty("image") @JsonAlias("artifact") String image,
            @JsonProperty("instruction") @JsonAlias("prompt") String instruction,
            @JsonProperty("config") Map<String, Object> config) {
        this.id = id;
        this.dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        this.image = image;
        this.instruction = instruction;
        this.config = config != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(config))
                : Map.of();
    }

    /** Convenience for code-built workflows: instruction payload only. */
    public static NodeDefinition of(String id, String image, String instruction, String... dependencies) {
        return new NodeDefinition(id, List.of(dependencies), image, instruction, null);
    }

    public String getId() {
        return id;
    }

    /** Upstream node ids in declaration order. Never null. */
    public List<String> getDependencies() {
        return dependencies;
    }

    public String getImage() {
        return image;
    }

    public String getInstruction() {
        return instruction;
    }

    /** Structured payload; empty when the node only carries an instruction. */
    public Map<String, Object> getConfig() {
        return config;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeDefinition)) return false;
        NodeDefinition that = (NodeDefinition) o;
        return Objects.equals(id, that.id)
                && dependencies.equals(that.dependencies)
                && Objects.equals(image, that.image)
                && Objects.equals(instruction, that.instruction)
                && config.equals(that.config);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, dependencies, image, instruction, config);
    }

    @Override
    public String toString() {
        return "NodeDefinition{id='" + id + "', dependencies=" + dependencies + ", image='" + image + "'}";
    }
}
