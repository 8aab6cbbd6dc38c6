/**
 * Session state, registry and expiry.
 */
package com.phillippitts.coordsim.service.session;
