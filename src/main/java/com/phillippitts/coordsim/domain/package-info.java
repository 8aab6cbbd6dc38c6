/**
 * Domain models for coordinate simulations.
 *
 * <p>All types here are immutable value objects that validate themselves on construction:
 * <ul>
 *   <li>{@link com.phillippitts.coordsim.domain.Coordinate} - multi-axis point under analysis</li>
 *   <li>{@link com.phillippitts.coordsim.domain.SimulationRequest} - what the caller wants analyzed</li>
 *   <li>{@link com.phillippitts.coordsim.domain.AnalysisArtifact} - output of one collaborator call</li>
 *   <li>{@link com.phillippitts.coordsim.domain.SimulationResult} - compiled outcome of a workflow run</li>
 *   <li>{@link com.phillippitts.coordsim.domain.WorkflowStage} and
 *       {@link com.phillippitts.coordsim.domain.SessionStatus} - closed enumerations</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.coordsim.domain;
