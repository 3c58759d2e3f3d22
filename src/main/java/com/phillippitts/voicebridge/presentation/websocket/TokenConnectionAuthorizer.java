package com.phillippitts.voicebridge.presentation.websocket;

import com.phillippitts.voicebridge.config.properties.AuthProperties;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Static shared-token authorizer. Permits every connection when {@code voicebridge.auth.token}
 * is blank; otherwise the token must arrive as {@code token} query parameter or
 * {@code Authorization: Bearer} header.
 */
@Component
public class TokenConnectionAuthorizer implements ConnectionAuthorizer {

    private static final String BEARER_PREFIX = "Bearer ";

    private final AuthProperties props;

    public TokenConnectionAuthorizer(AuthProperties props) {
        this.props = props;
    }

    @Override
    public boolean authorize(ServerHttpRequest request) {
        if (!props.tokenRequired()) {
            return true;
        }
        String presented = HandshakeRequests.queryParam(request, "token");
        if (presented == null) {
            String header = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
            if (header != null && header.startsWith(BEARER_PREFIX)) {
                presented = header.substring(BEARER_PREFIX.length()).trim();
            }
        }
        return presented != null && MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8),
                props.token().getBytes(StandardCharsets.UTF_8));
    }
}
