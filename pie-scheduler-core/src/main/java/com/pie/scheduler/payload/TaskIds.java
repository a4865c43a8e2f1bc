package com.pie.scheduler.payload;

import java.util.List;

/**
 * Task identifiers handed to the engine: {@code runId + "_" + nodeId}. Deterministic, so the engine can
 * look up the outputs of a node's parents from their task ids alone.
 */
public final class TaskIds {

    private static final String SEPARATOR = "_";

    private TaskIds() {
    }

    public static String taskId(String runId, String nodeId) {
        return runId + SEPARATOR + nodeId;
    }

    /** Parent task ids in dependency declaration order. */
    public static List<String> parentTaskIds(String runId, List<String> dependencyIds) {
        return dependencyIds.stream().map(dep -> taskId(runId, dep)).toList();
    }
}
