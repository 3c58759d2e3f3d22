package com.phillippitts.voicebridge.presentation.websocket;

import com.phillippitts.voicebridge.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.util.Map;

/**
 * Rejects unauthorized handshakes and records the client key and announced audio format as
 * session attributes.
 */
@Component
public class AuthHandshakeInterceptor implements HandshakeInterceptor {

    private static final Logger LOG = LogManager.getLogger(AuthHandshakeInterceptor.class);

    static final String CLIENT_KEY_ATTR = "voicebridge.clientKey";
    static final String FORMAT_ATTR = "voicebridge.format";

    private final ConnectionAuthorizer authorizer;

    public AuthHandshakeInterceptor(ConnectionAuthorizer authorizer) {
        this.authorizer = authorizer;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        String clientKey = HandshakeRequests.clientKey(request);
        if (!authorizer.authorize(request)) {
            LOG.warn("Rejected unauthorized handshake from {}", LogSanitizer.maskKey(clientKey));
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
        attributes.put(CLIENT_KEY_ATTR, clientKey);
        String format = HandshakeRequests.queryParam(request, "format");
        if (format != null) {
            attributes.put(FORMAT_ATTR, format);
        }
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        // nothing to do
    }
}
