/**
 * Provider health tracking: sliding-window error rates, cooldown-based disabling and bounded
 * restarts.
 *
 * <h2>Event flow</h2>
 * <pre>
 * ProviderDispatcher --(failed attempt)--> ProviderFailureEvent --> ProviderHealthMonitor
 * ProviderDispatcher --(success)---------> recordSuccess() -----> ProviderRecoveredEvent
 * </pre>
 *
 * <h2>States</h2>
 * <ul>
 *   <li><b>HEALTHY</b> - routed normally</li>
 *   <li><b>DEGRADED</b> - recent failures below the budget; still routed</li>
 *   <li><b>DISABLED</b> - budget exhausted; skipped until the cooldown ends, then tried again</li>
 * </ul>
 *
 * <p>When every provider is disabled the dispatcher still walks the whole chain, so a segment
 * is never failed without at least one attempt.
 *
 * <p>Configuration lives under {@code voicebridge.provider-health.*}.
 */
package com.phillippitts.voicebridge.service.provider.health;
