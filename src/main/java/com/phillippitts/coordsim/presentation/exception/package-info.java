/**
 * Maps domain exceptions to HTTP responses.
 */
package com.phillippitts.coordsim.presentation.exception;
