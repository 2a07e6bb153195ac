/**
 * Immutable domain models.
 *
 * <p>All types are records or enums that validate in their constructors. Key concepts:
 * <ul>
 *   <li>{@link com.phillippitts.scantomack.domain.DocumentImage} - input image with content hash id</li>
 *   <li>{@link com.phillippitts.scantomack.domain.ProcessingOptions} - per-request settings</li>
 *   <li>{@link com.phillippitts.scantomack.domain.RecognitionResult} - one engine's result or an
 *       ensemble combination</li>
 *   <li>{@link com.phillippitts.scantomack.domain.CompleteResult} - what a caller gets back</li>
 * </ul>
 */
package com.phillippitts.scantomack.domain;
