package com.pie.scheduler.payload;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Content-passing payload: {@code {run_id, node_id, input_context, upstream_results}} where
 * {@code upstream_results} maps each dependency id to its normalized output. A node instruction, when
 * present, is added as {@code prompt}.
 */
public final class ContentPassingPayloadStrategy implements PayloadStrategy {

    @Override
    public Map<String, Object> buildPayload(PayloadContext context) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("run_id", context.runId());
        payload.put("node_id", context.node().getId());
        payload.put("input_context", context.node().getConfig());
        payload.put("upstream_results", context.upstreamOutputs());
        if (context.node().getInstruction() != null) {
            payload.put("prompt", context.node().getInstruction());
        }
        return payload;
    }
}
