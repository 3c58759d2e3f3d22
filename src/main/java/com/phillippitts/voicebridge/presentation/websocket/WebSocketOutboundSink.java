package com.phillippitts.voicebridge.presentation.websocket;

import com.phillippitts.voicebridge.service.broadcast.OutboundMessage;
import com.phillippitts.voicebridge.service.broadcast.OutboundSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * Writes outbound messages as JSON text frames.
 *
 * <p>The session is wrapped in a {@link ConcurrentWebSocketSessionDecorator}, so a slow client
 * cannot block the outbound pool past the send time limit.
 */
class WebSocketOutboundSink implements OutboundSink {

    private static final Logger LOG = LogManager.getLogger(WebSocketOutboundSink.class);

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final WebSocketSession session;

    WebSocketOutboundSink(WebSocketSession session) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
    }

    @Override
    public void send(OutboundMessage message) throws IOException {
        session.sendMessage(new TextMessage(message.toJson()));
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void close() {
        close(CloseStatus.NORMAL);
    }

    void close(CloseStatus status) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(status);
        } catch (IOException e) {
            LOG.debug("Error closing WebSocket {}: {}", session.getId(), e.toString());
        }
    }
}
