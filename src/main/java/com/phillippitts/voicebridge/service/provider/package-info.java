/**
 * Transcription provider abstractions and implementations.
 *
 * <ul>
 *   <li>{@link com.phillippitts.voicebridge.service.provider.HttpTranscriptionProvider} - Whisper-style
 *       multipart HTTP API</li>
 *   <li>{@link com.phillippitts.voicebridge.service.provider.MockTranscriptionProvider} - offline
 *       provider for development and the end of the default chain</li>
 * </ul>
 *
 * <p>All implementations are thread-safe for concurrent transcription, report health via
 * {@code isHealthy()}, and release resources in {@code close()}. Chain order comes from
 * {@link com.phillippitts.voicebridge.service.provider.ProviderRegistry}.
 */
package com.phillippitts.voicebridge.service.provider;
