package com.phillippitts.voicebridge.service.dispatch;

import com.phillippitts.voicebridge.domain.AudioSegment;
import com.phillippitts.voicebridge.domain.TranscriptionResult;

import java.util.concurrent.CompletableFuture;

/**
 * A segment waiting for, or holding, a dispatch permit together with the future of its result.
 */
record PendingDispatch(AudioSegment segment, CompletableFuture<TranscriptionResult> future) {}
