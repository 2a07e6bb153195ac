package com.phillippitts.scantomack.service.ocr.bridge;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class StderrCollectorTest {

    @Test
    void keepsEveryLineWhenUnderTheLimit() {
        StderrCollector collector = collector("Downloading detection model\nDone\n", 100);

        collector.run();

        assertThat(collector.snippet()).isEqualTo("Downloading detection model\nDone");
    }

    @Test
    void keepsOnlyTheMostRecentCharacters() {
        StderrCollector collector = collector("first line\nsecond line\nCUDA out of memory\n", 18);

        collector.run();

        assertThat(collector.snippet()).isEqualTo("CUDA out of memory");
    }

    @Test
    void emptyStreamLeavesAnEmptySnippet() {
        StderrCollector collector = collector("", 10);

        collector.run();

        assertThat(collector.snippet()).isEmpty();
    }

    private static StderrCollector collector(String text, int maxChars) {
        return new StderrCollector(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)),
                "easyocr-stderr", maxChars);
    }
}
