/**
 * Workflow definition: model and JSON serialization.
 *
 * <ul>
 *   <li>{@link com.pie.workflow.model} – {@link com.pie.workflow.model.WorkflowDefinition} and
 *       {@link com.pie.workflow.model.NodeDefinition}</li>
 *   <li>{@link com.pie.workflow.load} – {@link com.pie.workflow.load.WorkflowLoader#load} (file → definition with base directory),
 *       {@link com.pie.workflow.load.WorkflowValidator} (optional eager dependency check)</li>
 *   <li>{@link com.pie.workflow.WorkflowConfig} – {@code fromJson}/{@code toJson}</li>
 * </ul>
 */
package com.pie.workflow;
