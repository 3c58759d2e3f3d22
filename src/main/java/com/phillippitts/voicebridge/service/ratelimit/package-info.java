/**
 * Per-key token buckets for connection admission and optional ingest throttling.
 */
package com.phillippitts.voicebridge.service.ratelimit;
