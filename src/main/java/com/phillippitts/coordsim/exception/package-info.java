/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.phillippitts.coordsim.exception.CoordSimException} so the REST boundary can map
 * them in one place:
 * <ul>
 *   <li>{@link com.phillippitts.coordsim.exception.SessionNotFoundException} - unknown session id
 *       (404); {@link com.phillippitts.coordsim.exception.SessionCancelledException} when the
 *       session was reaped mid-run</li>
 *   <li>{@link com.phillippitts.coordsim.exception.SessionBusyException} - session already
 *       processing (409)</li>
 *   <li>{@link com.phillippitts.coordsim.exception.CollaboratorFailureException} - a collaborator
 *       failed or timed out during a stage (502)</li>
 *   <li>{@link com.phillippitts.coordsim.exception.PlanningFailureException} - invalid workflow
 *       plan (500)</li>
 * </ul>
 *
 * @see com.phillippitts.coordsim.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.coordsim.exception;
