/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration classes:
 * <ul>
 *   <li>{@link com.phillippitts.voicebridge.config.ThreadPoolConfig} - dispatch, provider and
 *       outbound executors with MDC propagation</li>
 *   <li>{@link com.phillippitts.voicebridge.config.ThreadPoolMetricsConfig} - pool gauges</li>
 *   <li>{@link com.phillippitts.voicebridge.config.TimeConfig} - shared {@link java.time.Clock}</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code voicebridge.*} and {@code threadpool.*} properties</li>
 *   <li>{@code config.logging} - MDC filter</li>
 *   <li>{@code config.queue} - Kafka topics and wiring for the scale-out path</li>
 * </ul>
 */
package com.phillippitts.voicebridge.config;
