package com.pie.workflow.load;

import com.pie.workflow.model.NodeDefinition;
import com.pie.workflow.model.WorkflowDefinition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Eager structural checks on a workflow. Cycles are deliberately not checked: they are reported
 * as deadlock by the scheduler.
 */
public final class WorkflowValidator {

    private WorkflowValidator() {
    }

    /**
     * Node id to the dependency ids it references that are not nodes of the workflow.
     * Only nodes with at least one dangling dependency are present; declaration order is kept.
     */
    public static Map<String, List<String>> danglingDependencies(WorkflowDefinition workflow) {
        Map<String, List<String>> dangling = new LinkedHashMap<>();
        Map<String, NodeDefinition> byId = workflow.getNodesById();
        for (NodeDefinition node : workflow.getNodes()) {
            List<String> unknown = new ArrayList<>();
            for (String dep : node.getDependencies()) {
                if (!byId.containsKey(dep)) unknown.add(dep);
            }
            if (!unknown.isEmpty()) dangling.put(node.getId(), List.copyOf(unknown));
        }
        return dangling;
    }

    /**
     * @throws InvalidWorkflowException naming every node with a dangling dependency
     */
    public static void requireKnownDependencies(WorkflowDefinition workflow) {
        Map<String, List<String>> dangling = danglingDependencies(workflow);
        if (!dangling.isEmpty()) {
            throw new InvalidWorkflowException(
                    "Workflow '" + workflow.getName() + "' references unknown dependencies: " + dangling);
        }
    }
}
