/**
 * Ordered result delivery: per-session reorder buffers and bounded outboxes drained serially
 * onto the client connection.
 *
 * <p>Connection types plug in through {@link com.phillippitts.voicebridge.service.broadcast.OutboundSink};
 * the WebSocket layer provides the production implementation.
 */
package com.phillippitts.voicebridge.service.broadcast;
