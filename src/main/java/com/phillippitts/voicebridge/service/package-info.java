/**
 * Service layer of the streaming engine.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code service.session} - session lifecycle, admission and audio ingestion</li>
 *   <li>{@code service.audio} - chunk assembly and audio format helpers</li>
 *   <li>{@code service.provider} - transcription provider adapters and registry</li>
 *   <li>{@code service.dispatch} - fallback chain, timeouts and retries per segment</li>
 *   <li>{@code service.queue} - optional Kafka hand-off between ingest and transcription nodes</li>
 *   <li>{@code service.broadcast} - per-session ordering and outbound delivery</li>
 *   <li>{@code service.ratelimit} - token buckets keyed by client</li>
 * </ul>
 *
 * <p>Services throw domain exceptions (not HTTP exceptions), are thread-safe, and use
 * constructor injection.
 *
 * @see com.phillippitts.voicebridge.service.session.SessionManager
 * @see com.phillippitts.voicebridge.service.dispatch.ProviderDispatcher
 */
package com.phillippitts.voicebridge.service;
