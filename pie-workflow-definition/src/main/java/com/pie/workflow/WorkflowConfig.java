package com.pie.workflow;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pie.workflow.load.InvalidWorkflowException;
import com.pie.workflow.model.WorkflowDefinition;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Serialization and deserialization of workflow definitions.
 * Unknown properties are ignored on read; JSON excludes null values when serializing.
 */
public final class WorkflowConfig {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private WorkflowConfig() {
    }

    /**
     * Deserializes a workflow from a JSON string.
     *
     * @param json the JSON document ({@code name}, {@code nodes})
     * @return the parsed {@link WorkflowDefinition}; base directory not set
     * @throws InvalidWorkflowException on parse failure or invalid node ids
     */
    public static WorkflowDefinition fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidWorkflowException("Workflow document is empty");
        }
        try {
            return MAPPER.readValue(json, WorkflowDefinition.class);
        } catch (JsonProcessingException e) {
            // Jackson wraps exceptions thrown from @JsonCreator constructors
            if (e.getCause() instanceof InvalidWorkflowException iwe) throw iwe;
            throw new InvalidWorkflowException("Failed to parse workflow: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Serializes the workflow to a JSON string (nulls excluded).
     */
    public static String toJson(WorkflowDefinition workflow) {
        try {
            return MAPPER.writeValueAsString(workflow);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
