/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.scantomack.exception.ScanToMackException} - Base exception</li>
 *   <li>{@link com.phillippitts.scantomack.exception.InvalidDocumentException} - Bad input document
 *       or options; aborts the request (HTTP 400)</li>
 *   <li>{@link com.phillippitts.scantomack.exception.TessdataNotFoundException} - Native engine
 *       data directory missing at startup</li>
 *   <li>{@link com.phillippitts.scantomack.exception.RecognitionException} - One engine failed;
 *       subclasses for timeout, engine-reported failure, bridge protocol error and unavailability</li>
 *   <li>{@link com.phillippitts.scantomack.exception.AllEnginesFailedException} - Every candidate
 *       engine failed; aborts the request (HTTP 503)</li>
 * </ul>
 *
 * @see com.phillippitts.scantomack.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.scantomack.exception;
