/**
 * Logging infrastructure: MDC population for HTTP requests and WebSocket handshakes.
 *
 * <p>Keys used across the application: {@code requestId}, {@code client} (masked), {@code sessionId}.
 * The pattern in {@code log4j2-spring.xml} prints them on every line.
 */
package com.phillippitts.voicebridge.config.logging;
