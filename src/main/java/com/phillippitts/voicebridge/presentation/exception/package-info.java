/**
 * Maps domain exceptions to HTTP responses at the REST boundary.
 */
package com.phillippitts.voicebridge.presentation.exception;
