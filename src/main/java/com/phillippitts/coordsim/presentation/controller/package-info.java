/**
 * REST controllers. Request and response bodies use snake_case field names.
 */
package com.phillippitts.coordsim.presentation.controller;
