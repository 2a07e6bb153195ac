/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>This package is the HTTP boundary of the service. Presentation depends on
 * {@code service.integration} but never the other way round.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - OCR endpoints (upload, engine listing, health)</li>
 *   <li>{@code presentation.exception} - Mapping of domain exceptions to HTTP responses</li>
 * </ul>
 *
 * <p>Controllers stay thin: they turn request parameters into
 * {@link com.phillippitts.scantomack.domain.ProcessingOptions} and delegate to
 * {@link com.phillippitts.scantomack.service.integration.DocumentProcessingFacade}.
 *
 * @see com.phillippitts.scantomack.presentation.controller
 * @see com.phillippitts.scantomack.presentation.exception
 */
package com.phillippitts.scantomack.presentation;
