package com.pie.scheduler.payload;

import java.util.Map;

/**
 * Builds the engine-facing input object for one node. The returned map is serialized to JSON in
 * iteration order and passed to the artifact as {@code --input}.
 */
@FunctionalInterface
public interface PayloadStrategy {

    Map<String, Object> buildPayload(PayloadContext context);
}
