package com.phillippitts.voicebridge.domain;

/** Outcome of a single provider attempt. */
public enum AttemptOutcome {
    SUCCESS,
    TIMEOUT,
    ERROR
}
