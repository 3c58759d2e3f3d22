/**
 * Optional Kafka hand-off between ingestion and dispatch.
 *
 * <pre>
 * SessionManager -> SegmentRouter -> KafkaQueueBridge -> [audio.segments] -> SegmentWorkerListener
 *                                                                               |
 * ResultBroadcaster <- SessionManager <- ResultsListener <- [transcription.results]
 * </pre>
 *
 * <p>Enabled with {@code voicebridge.queue.enabled=true}. When disabled or degraded,
 * {@link com.phillippitts.voicebridge.service.queue.SegmentRouter} dispatches in-process.
 */
package com.phillippitts.voicebridge.service.queue;
