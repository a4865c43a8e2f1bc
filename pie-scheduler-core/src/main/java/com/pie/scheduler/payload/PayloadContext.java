package com.pie.scheduler.payload;

import com.pie.workflow.model.NodeDefinition;

import java.util.List;
import java.util.Map;

/**
 * Everything a {@link PayloadStrategy} may draw on for one node dispatch.
 *
 * @param runId           run identifier
 * @param node            node being dispatched
 * @param taskId          this node's task id
 * @param parentTaskIds   task ids of the node's dependencies, declaration order
 * @param upstreamOutputs resolved outputs of exactly the node's dependencies
 */
public record PayloadContext(
        String runId,
        NodeDefinition node,
        String taskId,
        List<String> parentTaskIds,
        Map<String, String> upstreamOutputs
) {
    public PayloadContext {
        parentTaskIds = parentTaskIds != null ? List.copyOf(parentTaskIds) : List.of();
        upstreamOutputs = upstreamOutputs != null ? upstreamOutputs : Map.of();
    }
}
