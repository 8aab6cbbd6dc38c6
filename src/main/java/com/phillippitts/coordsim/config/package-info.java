/**
 * Spring configuration: thread pools, pool metrics, typed properties and orchestration wiring.
 */
package com.phillippitts.coordsim.config;
