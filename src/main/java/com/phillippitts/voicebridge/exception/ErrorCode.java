package com.phillippitts.voicebridge.exception;

import java.util.Locale;

/**
 * Error taxonomy of the streaming engine.
 *
 * <p>Codes are sent to clients inside {@code error} messages and appear in logs and metrics tags,
 * so their names are part of the wire contract.
 */
public enum ErrorCode {

    /** Admission refused: session caps reached or rate limit exhausted. */
    CAPACITY_EXCEEDED(false),

    /** Operation on a session that does not exist or no longer accepts audio. */
    UNKNOWN_SESSION(false),

    /** A provider did not answer within the attempt timeout. */
    PROVIDER_TIMEOUT(true),

    /** A provider answered with an explicit error. */
    PROVIDER_ERROR(true),

    /** Every configured provider failed for a segment. */
    ALL_PROVIDERS_EXHAUSTED(false),

    /** The message broker is unreachable; dispatch degrades to in-process. */
    QUEUE_UNAVAILABLE(true),

    /** A sequence gap outlived the reorder window; buffered results were flushed out of order. */
    REORDER_TIMEOUT(true),

    /** Audio sent by the client could not be accepted: bad encoding, unsupported format or size. */
    INVALID_AUDIO(false);

    private final boolean transientFailure;

    ErrorCode(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    /**
     * Returns true when the condition is handled internally (retry, fallback, degrade) and is not
     * surfaced to the client on its own.
     */
    public boolean isTransient() {
        return transientFailure;
    }

    /** Lower-case form used on the wire, e.g. {@code all_providers_exhausted}. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
