package com.phillippitts.voicebridge.presentation.websocket;

import com.phillippitts.voicebridge.exception.CapacityExceededException;
import com.phillippitts.voicebridge.exception.ErrorCode;
import com.phillippitts.voicebridge.exception.UnknownSessionException;
import com.phillippitts.voicebridge.service.broadcast.OutboundMessage;
import com.phillippitts.voicebridge.service.broadcast.ResultBroadcaster;
import com.phillippitts.voicebridge.service.session.SessionManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Clock;
import java.util.Base64;

/**
 * WebSocket endpoint for audio streaming ({@code /ws/transcribe}).
 *
 * <p>Protocol:
 * <ul>
 *   <li>On connect a session is opened and {@code connection_established} is sent. Admission
 *       failures send an {@code error} message and close the connection.</li>
 *   <li>Binary frames carry raw audio in the announced format.</li>
 *   <li>Text frames carry JSON control messages: {@code ping}, {@code get_status} and
 *       {@code end_of_stream}. Clients that cannot send binary frames may send
 *       {@code {"type":"audio_chunk","data":"<base64>"}}, which is ingested like a binary frame.</li>
 *   <li>Disconnect closes the session.</li>
 * </ul>
 */
@Component
public class AudioStreamWebSocketHandler extends AbstractWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(AudioStreamWebSocketHandler.class);

    static final String SESSION_ID_ATTR = "voicebridge.sessionId";

    private final SessionManager sessionManager;
    private final ResultBroadcaster broadcaster;
    private final Clock clock;

    public AudioStreamWebSocketHandler(SessionManager sessionManager, ResultBroadcaster broadcaster, Clock clock) {
        this.sessionManager = sessionManager;
        this.broadcaster = broadcaster;
        this.clock = clock;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession ws) throws IOException {
        String clientKey = (String) ws.getAttributes().getOrDefault(AuthHandshakeInterceptor.CLIENT_KEY_ATTR, "unknown");
        String format = (String) ws.getAttributes().get(AuthHandshakeInterceptor.FORMAT_ATTR);
        WebSocketOutboundSink sink = new WebSocketOutboundSink(ws);

        String sessionId;
        try {
            sessionId = sessionManager.openSession(clientKey, format, sink);
        } catch (CapacityExceededException e) {
            LOG.warn("Rejected connection {}: {} ({})", ws.getId(), e.getReason(), e.getLimit());
            sink.send(OutboundMessage.error(ErrorCode.CAPACITY_EXCEEDED, e.getReason(), clock.instant()));
            sink.close(e.getLimit() == CapacityExceededException.Limit.RATE
                    ? CloseStatus.POLICY_VIOLATION
                    : CloseStatus.SERVICE_OVERLOAD);
            return;
        }

        ws.getAttributes().put(SESSION_ID_ATTR, sessionId);
        withSession(sessionId, () -> {
            LOG.info("WebSocket {} connected as session {}", ws.getId(), sessionId);
            broadcaster.send(sessionId, OutboundMessage.connectionEstablished(sessionId, clock.instant()));
        });
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession ws, BinaryMessage message) {
        String sessionId = sessionId(ws);
        if (sessionId == null) {
            return;
        }
        ByteBuffer payload = message.getPayload();
        byte[] bytes = new byte[payload.remaining()];
        payload.get(bytes);

        withSession(sessionId, () -> ingest(sessionId, bytes));
    }

    @Override
    protected void handleTextMessage(WebSocketSession ws, TextMessage message) {
        String sessionId = sessionId(ws);
        if (sessionId == null) {
            return;
        }
        JSONObject json;
        try {
            json = new JSONObject(message.getPayload());
        } catch (JSONException e) {
            LOG.debug("Ignoring malformed control message on session {}", sessionId);
            return;
        }
        String type = json.optString("type", "");

        withSession(sessionId, () -> {
            switch (type) {
                case "audio_chunk" -> ingestEncoded(sessionId, json.optString("data", ""));
                case "ping" -> broadcaster.send(sessionId, OutboundMessage.pong(clock.instant()));
                case "get_status" -> sessionManager.snapshot(sessionId).ifPresent(snapshot ->
                        broadcaster.send(sessionId, OutboundMessage.status(snapshot.toStatusFields())));
                case "end_of_stream" -> {
                    LOG.info("End of stream received for session {}", sessionId);
                    sessionManager.closeSessionAsync(sessionId);
                }
                default -> LOG.debug("Ignoring control message of type '{}'", type);
            }
        });
    }

    @Override
    public void handleTransportError(WebSocketSession ws, Throwable exception) {
        String sessionId = sessionId(ws);
        LOG.warn("Transport error on WebSocket {} (session {}): {}", ws.getId(), sessionId, exception.toString());
        if (sessionId != null) {
            sessionManager.closeSessionAsync(sessionId);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession ws, CloseStatus status) {
        String sessionId = sessionId(ws);
        if (sessionId != null) {
            LOG.info("WebSocket {} closed ({}); closing session {}", ws.getId(), status, sessionId);
            sessionManager.closeSessionAsync(sessionId);
        }
    }

    private void ingest(String sessionId, byte[] bytes) {
        try {
            sessionManager.ingest(sessionId, bytes);
        } catch (CapacityExceededException e) {
            broadcaster.send(sessionId, OutboundMessage.error(ErrorCode.CAPACITY_EXCEEDED,
                    e.getReason(), clock.instant()));
        } catch (UnknownSessionException e) {
            LOG.debug("Audio for inactive session {} ignored", sessionId);
        }
    }

    private void ingestEncoded(String sessionId, String data) {
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(data);
        } catch (IllegalArgumentException e) {
            LOG.debug("Undecodable audio_chunk on session {}: {}", sessionId, e.getMessage());
            broadcaster.send(sessionId, OutboundMessage.error(ErrorCode.INVALID_AUDIO,
                    "audio_chunk data is not valid base64", clock.instant()));
            return;
        }
        if (bytes.length == 0) {
            LOG.debug("Empty audio_chunk on session {} ignored", sessionId);
            return;
        }
        ingest(sessionId, bytes);
    }

    private static String sessionId(WebSocketSession ws) {
        return (String) ws.getAttributes().get(SESSION_ID_ATTR);
    }

    private static void withSession(String sessionId, Runnable action) {
        ThreadContext.put("sessionId", sessionId);
        try {
            action.run();
        } finally {
            ThreadContext.remove("sessionId");
        }
    }
}
