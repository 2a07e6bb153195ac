/**
 * Per-request processing pipeline.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.scantomack.service.orchestration.ProcessingOrchestrator} - cache lookup,
 *       in-flight deduplication, preprocessing, dispatch, post-processing and quality assessment</li>
 *   <li>{@link com.phillippitts.scantomack.service.orchestration.RetryingDispatcher} - one engine with
 *       exponential backoff, then the fallback chain</li>
 *   <li>{@link com.phillippitts.scantomack.service.orchestration.EnsembleDispatcher} - every requested
 *       engine in parallel, combined by the configured selector</li>
 * </ul>
 *
 * <p>Progress events are delivered in order per request through
 * {@link com.phillippitts.scantomack.service.orchestration.event.SerialEventChannel}.
 *
 * @see com.phillippitts.scantomack.service.combine
 */
package com.phillippitts.scantomack.service.orchestration;
