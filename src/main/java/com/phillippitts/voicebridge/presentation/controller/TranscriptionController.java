package com.phillippitts.voicebridge.presentation.controller;

import com.phillippitts.voicebridge.config.properties.UploadProperties;
import com.phillippitts.voicebridge.domain.AudioSegment;
import com.phillippitts.voicebridge.domain.TranscriptionResult;
import com.phillippitts.voicebridge.exception.CapacityExceededException;
import com.phillippitts.voicebridge.exception.InvalidAudioException;
import com.phillippitts.voicebridge.service.audio.AudioFormat;
import com.phillippitts.voicebridge.service.dispatch.ProviderDispatcher;
import com.phillippitts.voicebridge.service.ratelimit.RateLimiter;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One-shot transcription of an uploaded audio file.
 *
 * <p>The upload is rate limited per client and checked for format and size, then sent through
 * the provider chain as a single final segment. It gets the same timeout, retry and fallback as a
 * streamed segment. When every provider fails the response is 502 with the failure marker.
 */
@RestController
class TranscriptionController {

    private static final Logger LOG = LogManager.getLogger(TranscriptionController.class);

    static final String UPLOAD_ID_PREFIX = "upload-";
    static final String FORWARDED_FOR = "X-Forwarded-For";

    private final ProviderDispatcher dispatcher;
    private final RateLimiter rateLimiter;
    private final UploadProperties props;
    private final Clock clock;

    TranscriptionController(ProviderDispatcher dispatcher, RateLimiter rateLimiter, UploadProperties props,
                            Clock clock) {
        this.dispatcher = dispatcher;
        this.rateLimiter = rateLimiter;
        this.props = props;
        this.clock = clock;
    }

    @PostMapping(value = "/api/transcribe", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<Map<String, Object>> transcribe(@RequestParam("file") MultipartFile file,
                                                   @RequestParam(value = "user_id", required = false) String userId,
                                                   HttpServletRequest request) throws IOException {
        String clientKey = clientKey(userId, request);
        if (!rateLimiter.allow(clientKey)) {
            throw new CapacityExceededException(clientKey, CapacityExceededException.Limit.RATE,
                    "Too many transcription requests");
        }
        String format = AudioFormat.extensionOf(file.getOriginalFilename());
        if (!props.getSupportedFormats().contains(format)) {
            throw new InvalidAudioException("Unsupported audio format. Supported formats: "
                    + String.join(",", props.getSupportedFormats()));
        }
        if (file.isEmpty()) {
            throw new InvalidAudioException("Uploaded file is empty");
        }
        if (file.getSize() > props.getMaxBytes()) {
            throw new InvalidAudioException("File too large. Maximum size: " + props.getMaxBytes() + " bytes");
        }

        String uploadId = UPLOAD_ID_PREFIX + UUID.randomUUID();
        ThreadContext.put("sessionId", uploadId);
        try {
            LOG.info("Transcribing upload {} ({} bytes, format={})", uploadId, file.getSize(), format);
            AudioSegment segment = new AudioSegment(uploadId, 0, file.getBytes(), clock.instant(), format, true);
            TranscriptionResult result = dispatcher.dispatch(segment);
            if (result.isFailure()) {
                LOG.warn("Upload {} failed: {}", uploadId, result.error());
                return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(failureBody(uploadId, result));
            }
            return ResponseEntity.ok(resultBody(uploadId, result));
        } finally {
            dispatcher.cancelSession(uploadId);
            ThreadContext.remove("sessionId");
        }
    }

    private static Map<String, Object> resultBody(String uploadId, TranscriptionResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("upload_id", uploadId);
        body.put("transcription", result.text());
        body.put("confidence", result.confidence());
        body.put("provider", result.provider());
        body.put("processing_time", result.latencyMs() / 1000.0);
        body.put("timestamp", result.timestamp().toString());
        return body;
    }

    private static Map<String, Object> failureBody(String uploadId, TranscriptionResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("upload_id", uploadId);
        body.put("errorCode", result.error().wireName());
        body.put("message", "No provider could transcribe the file");
        body.put("timestamp", result.timestamp().toString());
        return body;
    }

    /**
     * Same precedence as the WebSocket handshake: {@code user_id}, then the first
     * {@code X-Forwarded-For} address, then the remote address.
     */
    static String clientKey(String userId, HttpServletRequest request) {
        if (userId != null && !userId.isBlank()) {
            return "user:" + userId;
        }
        String forwarded = request.getHeader(FORWARDED_FOR);
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        String remote = request.getRemoteAddr();
        return remote == null ? "unknown" : remote;
    }
}
