package com.phillippitts.voicebridge.service.dispatch;

import com.phillippitts.voicebridge.domain.AudioSegment;
import com.phillippitts.voicebridge.domain.ProviderAttempt;
import com.phillippitts.voicebridge.domain.TranscriptionResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Sends audio segments through the ordered provider chain with timeout, retry and fallback.
 *
 * <p>Every dispatched segment yields exactly one final {@link TranscriptionResult}: either the
 * first successful provider answer or a failure marker once all providers are exhausted.
 */
public interface ProviderDispatcher {

    /**
     * Transcribes the segment, blocking the caller until the chain completes.
     *
     * @param segment segment to transcribe
     * @return final result or failure marker, never null
     */
    TranscriptionResult dispatch(AudioSegment segment);

    /**
     * Transcribes the segment asynchronously. The returned future is cancelled if the segment's
     * session is cancelled before the chain completes.
     *
     * @param segment segment to transcribe
     * @return future completing with the final result or failure marker
     */
    CompletableFuture<TranscriptionResult> dispatchAsync(AudioSegment segment);

    /**
     * Drops queued segments of the session and cancels running attempts best-effort.
     *
     * @param sessionId session being closed
     */
    void cancelSession(String sessionId);

    /**
     * Attempts recorded for a segment, oldest first. Bounded history.
     *
     * @param segmentKey {@code sessionId:sequence}
     */
    List<ProviderAttempt> attemptsFor(String segmentKey);
}
