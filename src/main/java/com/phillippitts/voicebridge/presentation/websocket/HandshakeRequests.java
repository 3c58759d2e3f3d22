package com.phillippitts.voicebridge.presentation.websocket;

import org.springframework.http.server.ServerHttpRequest;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.InetSocketAddress;

/**
 * Helpers for reading the handshake request.
 */
final class HandshakeRequests {

    static final String FORWARDED_FOR = "X-Forwarded-For";

    private HandshakeRequests() {}

    static String queryParam(ServerHttpRequest request, String name) {
        String value = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams().getFirst(name);
        return value == null || value.isBlank() ? null : value;
    }

    /**
     * Client key for admission limits: {@code user_id} query parameter, else the first
     * {@code X-Forwarded-For} address, else the remote address.
     */
    static String clientKey(ServerHttpRequest request) {
        String userId = queryParam(request, "user_id");
        if (userId != null) {
            return "user:" + userId;
        }
        String forwarded = request.getHeaders().getFirst(FORWARDED_FOR);
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        InetSocketAddress remote = request.getRemoteAddress();
        if (remote != null && remote.getAddress() != null) {
            return remote.getAddress().getHostAddress();
        }
        return "unknown";
    }
}
