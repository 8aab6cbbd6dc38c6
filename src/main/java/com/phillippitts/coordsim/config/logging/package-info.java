/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) support.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - per HTTP request, set by
 *       {@link com.phillippitts.coordsim.config.logging.MdcFilter}</li>
 *   <li>{@code sessionId} - set while a simulation workflow runs</li>
 * </ul>
 *
 * <p>The stage executor copies the MDC to its worker threads, so collaborator logs carry
 * both keys.
 */
package com.phillippitts.coordsim.config.logging;
