package com.pie.workflow.load;

import com.pie.workflow.WorkflowConfig;
import com.pie.workflow.model.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads a workflow document from disk. The returned definition carries the document's directory as
 * base directory so node artifacts ({@code image}) resolve relative to the workflow file.
 * When eager validation is enabled, dangling dependency ids are rejected at load instead of
 * surfacing as deadlock during the run.
 */
public final class WorkflowLoader {

    private static final Logger log = LoggerFactory.getLogger(WorkflowLoader.class);

    private final boolean validateDependencies;

    /**
     * @param validateDependencies true to reject workflows whose nodes depend on unknown ids
     */
    public WorkflowLoader(boolean validateDependencies) {
        this.validateDependencies = validateDependencies;
    }

    /** Loader with lazy dependency checking (dangling ids become deadlock at run time). */
    public WorkflowLoader() {
        this(false);
    }

    /**
     * Reads, parses and (optionally) validates the workflow at the given path.
     *
     * @param workflowPath path to the JSON workflow document
     * @return workflow with base directory set to the document's parent directory
     * @throws InvalidWorkflowException when the file is missing, unreadable or invalid
     */
    public WorkflowDefinition load(Path workflowPath) {
        Path file = workflowPath.toAbsolutePath().normalize();
        if (!Files.isRegularFile(file)) {
            throw new InvalidWorkflowException("Workflow file not found: " + file);
        }
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            throw new InvalidWorkflowException("Failed to read workflow file " + file + ": " + e.getMessage(), e);
        }
        WorkflowDefinition workflow = WorkflowConfig.fromJson(json).withBaseDirectory(file.getParent());
        if (validateDependencies) {
            WorkflowValidator.requireKnownDependencies(workflow);
        }
        log.info("Workflow loaded from file: {} | name={} | nodes={} | dependencyValidation={}",
                file, workflow.getName(), workflow.getNodes().size(), validateDependencies ? "eager" : "lazy");
        return workflow;
    }

    public boolean isValidateDependencies() {
        return validateDependencies;
    }
}
