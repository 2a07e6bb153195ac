/**
 * REST controllers for the OCR API under {@code /api/v1/ocr}.
 */
package com.phillippitts.scantomack.presentation.controller;
