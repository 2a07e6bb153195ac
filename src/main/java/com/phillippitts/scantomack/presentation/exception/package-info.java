/**
 * Global exception handling for HTTP responses.
 *
 * <p>Status mapping:
 * <ul>
 *   <li>{@code InvalidDocumentException}, bad multipart upload - 400</li>
 *   <li>{@code AllEnginesFailedException}, {@code RecognitionException} - 503</li>
 *   <li>anything else - 500</li>
 * </ul>
 */
package com.phillippitts.scantomack.presentation.exception;
