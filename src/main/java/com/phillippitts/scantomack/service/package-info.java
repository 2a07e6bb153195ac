/**
 * Service layer: engines, orchestration and result post-processing.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.ocr} - Recognition engine abstraction, native Tesseract pool, stdio bridges
 *       and the engine registry</li>
 *   <li>{@code service.orchestration} - Request pipeline: retries, fallback, ensemble runs,
 *       deduplication and progress events</li>
 *   <li>{@code service.combine} - Ensemble result selection and text agreement</li>
 *   <li>{@code service.quality} - Page metrics and overall quality assessment</li>
 *   <li>{@code service.preprocess}, {@code service.postprocess} - Optional pipeline stages</li>
 *   <li>{@code service.cache} - Result cache keyed by document and options</li>
 *   <li>{@code service.integration} - Single entry point used by the presentation layer</li>
 *   <li>{@code service.metrics}, {@code service.health} - Micrometer counters and actuator health</li>
 * </ul>
 *
 * <p>Services throw domain exceptions (never HTTP exceptions), use constructor injection and are
 * safe for concurrent requests.
 */
package com.phillippitts.scantomack.service;
