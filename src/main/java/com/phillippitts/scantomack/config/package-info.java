/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.scantomack.config.ThreadPoolConfig} - ensemble and event executors</li>
 *   <li>{@link com.phillippitts.scantomack.config.ThreadPoolMetricsConfig} - executor gauges</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.ocr} - engine beans and the engine registry</li>
 *   <li>{@code config.orchestration} - pipeline wiring</li>
 *   <li>{@code config.properties} - {@code @ConfigurationProperties} types</li>
 *   <li>{@code config.logging} - MDC filter</li>
 * </ul>
 */
package com.phillippitts.scantomack.config;
