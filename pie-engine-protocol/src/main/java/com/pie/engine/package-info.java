/**
 * Engine protocol: the single seam between the scheduler and the external inference engine.
 * {@link com.pie.engine.EngineClient#submit} takes an {@link com.pie.engine.EngineRequest} and returns an
 * {@link com.pie.engine.EngineResponse}; timeouts surface as {@link com.pie.engine.EngineTimeoutException}.
 */
package com.pie.engine;
