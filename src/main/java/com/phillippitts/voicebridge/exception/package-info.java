/**
 * Application-specific exception hierarchy.
 *
 * <p>Every exception extends {@link com.phillippitts.voicebridge.exception.VoiceBridgeException}
 * and carries an {@link com.phillippitts.voicebridge.exception.ErrorCode}:
 * <ul>
 *   <li>{@link com.phillippitts.voicebridge.exception.CapacityExceededException} - admission
 *       refused; surfaced immediately at the connection boundary</li>
 *   <li>{@link com.phillippitts.voicebridge.exception.UnknownSessionException} - operation on a
 *       missing, draining or closed session; surfaced immediately</li>
 *   <li>{@link com.phillippitts.voicebridge.exception.ProviderException} and
 *       {@link com.phillippitts.voicebridge.exception.ProviderTimeoutException} - handled by
 *       retry and fallback inside the dispatcher, never surfaced on their own</li>
 *   <li>{@link com.phillippitts.voicebridge.exception.QueueUnavailableException} - triggers
 *       degrade-to-direct dispatch</li>
 * </ul>
 *
 * <p>{@code ALL_PROVIDERS_EXHAUSTED} and {@code REORDER_TIMEOUT} are not thrown: the first travels
 * as a failure marker on a result, the second as an application event.
 *
 * @see com.phillippitts.voicebridge.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.voicebridge.exception;
