package com.pie.scheduler;

import com.pie.workflow.model.NodeDefinition;
import com.pie.workflow.model.WorkflowDefinition;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds code-defined workflows whose artifacts ({@code <id>.wasm}) exist under a directory.
 */
public final class TestWorkflows {

    private final String name;
    private final Path directory;
    private final List<NodeDefinition> nodes = new ArrayList<>();

    private TestWorkflows(String name, Path directory) {
        this.name = name;
        this.directory = directory;
    }

    public static TestWorkflows in(Path directory) {
        return new TestWorkflows("test-workflow", directory);
    }

    public TestWorkflows node(String id, String... dependencies) {
        nodes.add(NodeDefinition.of(id, id + ".wasm", "Task " + id, dependencies));
        try {
            Path artifact = directory.resolve(id + ".wasm");
            if (!Files.exists(artifact)) Files.write(artifact, new byte[]{0, 'a', 's', 'm'});
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public WorkflowDefinition build() {
        return new WorkflowDefinition(name, nodes).withBaseDirectory(directory);
    }
}
