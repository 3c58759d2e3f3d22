/**
 * Presentation layer (WebSocket streaming endpoint, REST controllers and exception handling).
 *
 * <p>Presentation depends on service but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.websocket} - audio streaming endpoint and handshake checks</li>
 *   <li>{@code presentation.controller} - REST endpoints for status and sessions</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * @see com.phillippitts.voicebridge.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.voicebridge.presentation;
