package com.phillippitts.voicebridge.presentation.websocket;

import org.springframework.http.server.ServerHttpRequest;

/**
 * Decides whether a WebSocket handshake may proceed.
 */
@FunctionalInterface
public interface ConnectionAuthorizer {

    boolean authorize(ServerHttpRequest request);
}
