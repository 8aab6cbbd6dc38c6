/**
 * Workflow orchestration: stage execution, result compilation and optimization.
 *
 * <p>{@link com.phillippitts.coordsim.service.orchestration.SimulationOrchestrator} is the entry
 * point; {@link com.phillippitts.coordsim.service.orchestration.StageExecutor} runs one stage
 * against its collaborator with a timeout.
 */
package com.phillippitts.coordsim.service.orchestration;
