package com.pie.scheduler.payload;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lineage payload: {@code {task_id, parent_task_ids, prompt}}. Upstream content is not sent; the
 * inferlet reads its parents' outputs from the engine store under their task ids.
 */
public final class LineagePayloadStrategy implements PayloadStrategy {

    @Override
    public Map<String, Object> buildPayload(PayloadContext context) {
        String instruction = context.node().getInstruction();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("task_id", context.taskId());
        payload.put("parent_task_ids", context.parentTaskIds());
        payload.put("prompt", instruction != null ? instruction : "");
        return payload;
    }
}
