package com.phillippitts.voicebridge.testutil;

import com.phillippitts.voicebridge.service.broadcast.OutboundMessage;
import com.phillippitts.voicebridge.service.broadcast.OutboundSink;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * OutboundSink that records every message it is asked to write.
 *
 * <p>Writes after {@link #close()} are counted separately so tests can assert that a closed
 * connection is never written to.
 */
public class CapturingSink implements OutboundSink {

    private final List<OutboundMessage> messages = new CopyOnWriteArrayList<>();
    private final AtomicInteger writesAfterClose = new AtomicInteger();
    private final AtomicInteger closeCount = new AtomicInteger();
    private volatile boolean open = true;
    public volatile boolean failSends = false;

    @Override
    public void send(OutboundMessage message) throws IOException {
        if (!open) {
            writesAfterClose.incrementAndGet();
        }
        if (failSends) {
            throw new IOException("broken pipe");
        }
        messages.add(message);
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
        closeCount.incrementAndGet();
    }

    public List<OutboundMessage> messages() {
        return List.copyOf(messages);
    }

    /** Messages of the given wire type, in write order. */
    public List<OutboundMessage> messagesOfType(String type) {
        return messages.stream().filter(m -> m.type().equals(type)).toList();
    }

    /** Sequence numbers of written transcription messages, in write order. */
    public List<Long> transcriptionSequences() {
        return messagesOfType(OutboundMessage.TYPE_TRANSCRIPTION).stream()
                .map(m -> ((Number) m.get("sequence")).longValue())
                .toList();
    }

    public int writesAfterClose() {
        return writesAfterClose.get();
    }

    public int closeCount() {
        return closeCount.get();
    }
}
