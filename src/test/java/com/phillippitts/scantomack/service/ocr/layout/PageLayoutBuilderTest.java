package com.phillippitts.scantomack.service.ocr.layout;

import com.phillippitts.scantomack.domain.BoundingBox;
import com.phillippitts.scantomack.domain.RecognizedLine;
import com.phillippitts.scantomack.domain.RecognizedPage;
import com.phillippitts.scantomack.domain.RecognizedWord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PageLayoutBuilderTest {

    @Test
    void ordersWordsIntoLinesTopToBottomLeftToRight() {
        RecognizedPage page = PageLayoutBuilder.buildPage(1, List.of(
                RecognizedWord.of("world", 0.9, new BoundingBox(60, 12, 110, 30)),
                RecognizedWord.of("second", 0.8, new BoundingBox(10, 40, 70, 58)),
                RecognizedWord.of("hello", 0.7, new BoundingBox(10, 10, 50, 30))));

        assertThat(page.lines()).extracting(RecognizedLine::text).containsExactly("hello world", "second");
        assertThat(page.text()).isEqualTo("hello world\nsecond");
        assertThat(page.paragraphs()).hasSize(1);
    }

    @Test
    void splitsParagraphsOnLargeVerticalGaps() {
        RecognizedPage page = PageLayoutBuilder.buildPage(1, List.of(
                RecognizedWord.of("Header", 0.9, new BoundingBox(10, 10, 80, 30)),
                RecognizedWord.of("Body", 0.9, new BoundingBox(10, 100, 60, 120))));

        assertThat(page.paragraphs()).hasSize(2);
        assertThat(page.text()).isEqualTo("Header\nBody");
    }

    @Test
    void assignsLayoutIndicesToWords() {
        RecognizedPage page = PageLayoutBuilder.buildPage(1, List.of(
                RecognizedWord.of("a", 0.9, new BoundingBox(10, 10, 20, 20)),
                RecognizedWord.of("b", 0.9, new BoundingBox(10, 100, 20, 110))));

        List<RecognizedWord> words = page.words();
        assertThat(words.get(0).lineIndex()).isZero();
        assertThat(words.get(0).paragraphIndex()).isZero();
        assertThat(words.get(1).lineIndex()).isEqualTo(1);
        assertThat(words.get(1).paragraphIndex()).isEqualTo(1);
    }

    @Test
    void confidencesAreMeansOfChildren() {
        RecognizedPage page = PageLayoutBuilder.buildPage(1, List.of(
                RecognizedWord.of("a", 0.6, new BoundingBox(10, 10, 20, 20)),
                RecognizedWord.of("b", 1.0, new BoundingBox(30, 10, 40, 20))));

        assertThat(page.lines().get(0).confidence()).isCloseTo(0.8, within(1e-9));
        assertThat(page.confidence()).isCloseTo(0.8, within(1e-9));
        assertThat(page.bbox()).isEqualTo(new BoundingBox(10, 10, 40, 20));
    }

    @Test
    void blankWordsAreDropped() {
        RecognizedPage page = PageLayoutBuilder.buildPage(1, List.of(
                RecognizedWord.of("  ", 0.9, new BoundingBox(10, 10, 20, 20))));

        assertThat(page.paragraphs()).isEmpty();
        assertThat(page.text()).isEmpty();
        assertThat(page.confidence()).isZero();
        assertThat(page.bbox()).isEqualTo(BoundingBox.EMPTY);
    }
}
