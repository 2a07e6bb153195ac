/**
 * Recognition engines and their lifecycle.
 *
 * <p>Every engine implements {@link com.phillippitts.scantomack.service.ocr.RecognitionEngine}:
 * <ul>
 *   <li>{@code service.ocr.tesseract} - in-process Tesseract behind a fixed worker pool, one native
 *       handle per worker</li>
 *   <li>{@code service.ocr.bridge} - EasyOCR and PaddleOCR in long-lived Python processes speaking
 *       newline-delimited JSON</li>
 *   <li>{@code service.ocr.registry} - start-up probing, availability and health</li>
 * </ul>
 *
 * <p>Raw engine output (words with boxes) is turned into pages, lines and metrics by
 * {@link com.phillippitts.scantomack.service.ocr.EngineResultAssembler}.
 */
package com.phillippitts.scantomack.service.ocr;
