package com.phillippitts.scantomack.service.ocr.layout;

import com.phillippitts.scantomack.domain.BoundingBox;
import com.phillippitts.scantomack.domain.RecognizedLine;
import com.phillippitts.scantomack.domain.RecognizedPage;
import com.phillippitts.scantomack.domain.RecognizedParagraph;
import com.phillippitts.scantomack.domain.RecognizedWord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Groups a flat word list into the Page → Paragraph → Line → Word tree.
 *
 * <p>Grouping rules:
 * <ul>
 *   <li>Words share a line when their top edges round to the same 10px row</li>
 *   <li>Lines are ordered top to bottom, words within a line left to right</li>
 *   <li>A vertical gap of more than 20px between consecutive lines starts a new paragraph</li>
 * </ul>
 *
 * <p>Every aggregate confidence is the unweighted mean of its immediate children, and every
 * aggregate box is the union of its children's boxes. Words with blank text are dropped.
 */
public final class PageLayoutBuilder {

    static final int ROW_BUCKET_PX = 10;
    static final int PARAGRAPH_GAP_PX = 20;

    private PageLayoutBuilder() {
    }

    /**
     * Builds a single page from engine words.
     *
     * @param pageNumber 1-based page number
     * @param words      words in any order
     * @return page tree; an empty page (no paragraphs, confidence 0) when there are no words
     */
    public static RecognizedPage buildPage(int pageNumber, List<RecognizedWord> words) {
        List<List<RecognizedWord>> rows = groupIntoRows(words);

        List<List<RecognizedLine>> paragraphGroups = new ArrayList<>();
        List<RecognizedLine> current = new ArrayList<>();
        RecognizedLine previous = null;
        int lineIndex = 0;
        for (List<RecognizedWord> row : rows) {
            RecognizedLine probe = line(row);
            if (previous != null && probe.bbox().y0() - previous.bbox().y1() > PARAGRAPH_GAP_PX) {
                paragraphGroups.add(current);
                current = new ArrayList<>();
            }
            int paragraphIndex = paragraphGroups.size();
            List<RecognizedWord> indexed = new ArrayList<>(row.size());
            for (RecognizedWord w : row) {
                indexed.add(w.withLayout(lineIndex, paragraphIndex));
            }
            RecognizedLine line = line(indexed);
            current.add(line);
            previous = line;
            lineIndex++;
        }
        if (!current.isEmpty()) {
            paragraphGroups.add(current);
        }

        List<RecognizedParagraph> paragraphs = paragraphGroups.stream()
                .map(PageLayoutBuilder::paragraph)
                .toList();

        String text = paragraphs.stream().map(RecognizedParagraph::text).collect(Collectors.joining("\n"));
        return new RecognizedPage(pageNumber, text,
                mean(paragraphs, RecognizedParagraph::confidence),
                BoundingBox.enclosing(paragraphs.stream().map(RecognizedParagraph::bbox).toList()),
                paragraphs);
    }

    private static List<List<RecognizedWord>> groupIntoRows(List<RecognizedWord> words) {
        Map<Integer, List<RecognizedWord>> rows = new TreeMap<>();
        for (RecognizedWord word : words) {
            if (word == null || word.text().isBlank()) {
                continue;
            }
            int rowKey = (int) Math.round(word.bbox().y0() / (double) ROW_BUCKET_PX) * ROW_BUCKET_PX;
            rows.computeIfAbsent(rowKey, k -> new ArrayList<>()).add(word);
        }
        List<List<RecognizedWord>> ordered = new ArrayList<>(rows.size());
        for (List<RecognizedWord> row : rows.values()) {
            row.sort(Comparator.comparingInt(w -> w.bbox().x0()));
            ordered.add(row);
        }
        return ordered;
    }

    private static RecognizedLine line(List<RecognizedWord> words) {
        String text = words.stream().map(w -> w.text().trim()).collect(Collectors.joining(" "));
        return new RecognizedLine(text,
                mean(words, RecognizedWord::confidence),
                BoundingBox.enclosing(words.stream().map(RecognizedWord::bbox).toList()),
                words);
    }

    private static RecognizedParagraph paragraph(List<RecognizedLine> lines) {
        String text = lines.stream().map(RecognizedLine::text).collect(Collectors.joining("\n"));
        return new RecognizedParagraph(text,
                mean(lines, RecognizedLine::confidence),
                BoundingBox.enclosing(lines.stream().map(RecognizedLine::bbox).toList()),
                lines);
    }

    private static <T> double mean(List<T> items, ToDoubleFunction<T> f) {
        return items.stream().mapToDouble(f).average().orElse(0.0);
    }
}
