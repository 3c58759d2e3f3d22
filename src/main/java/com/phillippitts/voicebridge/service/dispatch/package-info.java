/**
 * Provider fallback chain: per-attempt timeouts, bounded retries, per-session in-flight limits
 * and the bounded attempt log.
 *
 * <p>Exactly one final result is produced per dispatched segment. Late answers from abandoned
 * attempts are counted and discarded.
 */
package com.phillippitts.voicebridge.service.dispatch;
