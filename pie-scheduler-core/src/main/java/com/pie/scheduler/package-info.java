/**
 * Workflow scheduling core: {@link com.pie.scheduler.graph.DependencyGraph} answers readiness,
 * {@link com.pie.scheduler.run.WorkflowScheduler} drives the run over a bounded pool,
 * {@link com.pie.scheduler.dispatch.NodeDispatcher} talks to the engine, and
 * {@link com.pie.scheduler.store.ResultStore} carries outputs downstream.
 */
package com.pie.scheduler;
