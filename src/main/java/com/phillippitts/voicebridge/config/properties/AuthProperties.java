package com.phillippitts.voicebridge.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection authorization. With a blank token every handshake is accepted.
 *
 * @param token shared token expected in the {@code token} query parameter or a bearer header
 * @param allowedOrigins origins accepted by the WebSocket endpoint
 */
@ConfigurationProperties(prefix = "voicebridge.auth")
public record AuthProperties(String token, String[] allowedOrigins) {

    public AuthProperties {
        if (token == null) {
            token = "";
        }
        if (allowedOrigins == null || allowedOrigins.length == 0) {
            allowedOrigins = new String[] {"*"};
        }
    }

    public boolean tokenRequired() {
        return !token.isBlank();
    }
}
