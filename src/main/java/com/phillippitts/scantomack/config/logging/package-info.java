/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - per HTTP request, from {@code X-Request-ID} or a random UUID</li>
 *   <li>{@code clientId} - from {@code X-Client-ID} when present</li>
 *   <li>{@code correlationId} - per processing request, set by the integration facade</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2026-03-02 15:42:32.529 [thread-name] [requestId] [correlationId] LEVEL logger.name - message
 * </pre>
 *
 * @see com.phillippitts.scantomack.config.logging.MdcFilter
 */
package com.phillippitts.scantomack.config.logging;
