package com.phillippitts.scantomack.service.ocr.tesseract;

import com.phillippitts.scantomack.domain.DocumentImage;
import com.phillippitts.scantomack.service.ocr.RawRecognition;

import java.util.concurrent.CompletableFuture;

/**
 * A queued native recognition. The future completes on the worker thread that ran it.
 */
record NativeJob(DocumentImage document, String language, CompletableFuture<RawRecognition> result) {

    static NativeJob of(DocumentImage document, String language) {
        return new NativeJob(document, language, new CompletableFuture<>());
    }
}
