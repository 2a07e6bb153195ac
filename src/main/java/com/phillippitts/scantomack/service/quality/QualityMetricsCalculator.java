package com.phillippitts.scantomack.service.quality;

import com.phillippitts.scantomack.domain.ImageQuality;
import com.phillippitts.scantomack.domain.QualityMetrics;
import com.phillippitts.scantomack.domain.RecognizedLine;
import com.phillippitts.scantomack.domain.RecognizedPage;
import com.phillippitts.scantomack.domain.RecognizedParagraph;
import com.phillippitts.scantomack.domain.RecognizedWord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Derives {@link QualityMetrics} from a recognized page tree and the source image geometry.
 *
 * <p>Pure and total: any internal failure is logged and answered with {@link QualityMetrics#defaults()}.
 * Thread-safe (stateless).
 */
public final class QualityMetricsCalculator {

    private static final Logger LOG = LogManager.getLogger(QualityMetricsCalculator.class);

    static final int REGION_CELL_PX = 100;
    static final double LAYOUT_VARIANCE_SCALE = 10_000.0;
    static final int MIN_LINES_FOR_SKEW = 3;
    static final double HANDWRITING_MAX_MEAN = 0.6;
    static final double HANDWRITING_MIN_VARIANCE = 0.1;

    private static final Set<String> COMMON_WORDS = Set.of(
            "the", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by");

    // Characters that commonly show up in garbled OCR output
    private static final String SUSPICIOUS_CHARS = "~`!@#$%^&*()_+={}[]|\\:\";'<>?,./§±¶•†‡°¢£¤¥¦©®™´¨≠Æ";

    private static final Pattern PIPE_CELL = Pattern.compile("\\|\\s*\\w+\\s*\\|");
    private static final Pattern TAB = Pattern.compile("\\t+");
    private static final Pattern WIDE_GAP = Pattern.compile("\\s{3,}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Computes metrics for all pages of one recognition.
     *
     * @param pages       recognized pages (may be empty)
     * @param imageWidth  source width in pixels, 0 when unknown
     * @param imageHeight source height in pixels, 0 when unknown
     * @return metrics; never null
     */
    public QualityMetrics calculate(List<RecognizedPage> pages, int imageWidth, int imageHeight) {
        try {
            return doCalculate(pages == null ? List.of() : pages, imageWidth, imageHeight);
        } catch (RuntimeException e) {
            LOG.warn("Quality metrics calculation failed, using defaults: {}", e.toString());
            return QualityMetrics.defaults();
        }
    }

    private QualityMetrics doCalculate(List<RecognizedPage> pages, int width, int height) {
        List<RecognizedParagraph> paragraphs = new ArrayList<>();
        List<RecognizedLine> lines = new ArrayList<>();
        List<RecognizedWord> words = new ArrayList<>();
        for (RecognizedPage page : pages) {
            paragraphs.addAll(page.paragraphs());
            lines.addAll(page.lines());
            words.addAll(page.words());
        }
        String text = pages.stream().map(RecognizedPage::text).collect(Collectors.joining("\n"));

        long area = (long) width * height;
        double textDensity = width > 0 && height > 0 ? text.length() / (double) area : 0.0;

        return new QualityMetrics(
                mean(words.stream().mapToDouble(RecognizedWord::confidence).toArray()),
                mean(lines.stream().mapToDouble(RecognizedLine::confidence).toArray()),
                mean(paragraphs.stream().mapToDouble(RecognizedParagraph::confidence).toArray()),
                textDensity,
                regionCount(words),
                layoutComplexity(pages),
                skewAngle(lines),
                languageConfidence(text),
                suspiciousCharRatio(text),
                whitespaceRatio(text),
                digitRatio(text),
                uppercaseRatio(text),
                hasTableStructure(pages, text),
                hasHandwriting(words),
                ImageQuality.fromDimensions(width, height));
    }

    static int regionCount(List<RecognizedWord> words) {
        Set<Long> cells = new HashSet<>();
        for (RecognizedWord w : words) {
            long cx = Math.floorDiv(w.bbox().x0(), REGION_CELL_PX);
            long cy = Math.floorDiv(w.bbox().y0(), REGION_CELL_PX);
            cells.add((cx << 32) ^ (cy & 0xffffffffL));
        }
        return cells.size();
    }

    static double layoutComplexity(List<RecognizedPage> pages) {
        if (pages.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        for (RecognizedPage page : pages) {
            List<RecognizedLine> lines = page.lines();
            if (lines.isEmpty()) {
                continue;
            }
            double[] left = new double[lines.size()];
            double[] right = new double[lines.size()];
            double[] spacing = new double[Math.max(0, lines.size() - 1)];
            for (int i = 0; i < lines.size(); i++) {
                left[i] = lines.get(i).bbox().x0();
                right[i] = lines.get(i).bbox().x1();
                if (i > 0) {
                    spacing[i - 1] = lines.get(i).bbox().y0() - lines.get(i - 1).bbox().y1();
                }
            }
            double sum = variance(left) + variance(right) + variance(spacing);
            total += Math.min(1.0, sum / LAYOUT_VARIANCE_SCALE);
        }
        return total / pages.size();
    }

    /**
     * Median line angle in degrees, measured between the top-left corners of the first and last word.
     */
    static Double skewAngle(List<RecognizedLine> lines) {
        if (lines.size() < MIN_LINES_FOR_SKEW) {
            return null;
        }
        List<Double> angles = new ArrayList<>();
        for (RecognizedLine line : lines) {
            List<RecognizedWord> lineWords = line.words();
            if (lineWords.size() < 2) {
                continue;
            }
            RecognizedWord first = lineWords.get(0);
            RecognizedWord last = lineWords.get(lineWords.size() - 1);
            double dx = last.bbox().x0() - first.bbox().x0();
            double dy = last.bbox().y0() - first.bbox().y0();
            angles.add(Math.toDegrees(Math.atan2(dy, dx)));
        }
        if (angles.isEmpty()) {
            return null;
        }
        angles.sort(Double::compare);
        int mid = angles.size() / 2;
        return angles.size() % 2 == 0
                ? (angles.get(mid - 1) + angles.get(mid)) / 2.0
                : angles.get(mid);
    }

    static double languageConfidence(String text) {
        int nonWhitespace = countNonWhitespace(text);
        if (nonWhitespace == 0) {
            return 0.0;
        }
        double alphaRatio = countAsciiLetters(text) / (double) nonWhitespace;

        String[] tokens = WHITESPACE.split(text.toLowerCase(Locale.ROOT).trim());
        int common = 0;
        for (String token : tokens) {
            if (COMMON_WORDS.contains(token)) {
                common++;
            }
        }
        double commonRatio = tokens.length > 0 ? common / (double) tokens.length : 0.0;
        return 0.7 * alphaRatio + 0.3 * commonRatio;
    }

    static double suspiciousCharRatio(String text) {
        int nonWhitespace = countNonWhitespace(text);
        if (nonWhitespace == 0) {
            return 0.0;
        }
        int suspicious = 0;
        for (int i = 0; i < text.length(); i++) {
            if (SUSPICIOUS_CHARS.indexOf(text.charAt(i)) >= 0) {
                suspicious++;
            }
        }
        return suspicious / (double) nonWhitespace;
    }

    static double whitespaceRatio(String text) {
        if (text.isEmpty()) {
            return 0.0;
        }
        return (text.length() - countNonWhitespace(text)) / (double) text.length();
    }

    static double digitRatio(String text) {
        int nonWhitespace = countNonWhitespace(text);
        if (nonWhitespace == 0) {
            return 0.0;
        }
        long digits = text.chars().filter(Character::isDigit).count();
        return digits / (double) nonWhitespace;
    }

    static double uppercaseRatio(String text) {
        int letters = countAsciiLetters(text);
        if (letters == 0) {
            return 0.0;
        }
        long upper = text.chars().filter(c -> c >= 'A' && c <= 'Z').count();
        return upper / (double) letters;
    }

    static boolean hasTableStructure(List<RecognizedPage> pages, String text) {
        for (RecognizedPage page : pages) {
            List<RecognizedLine> lines = page.lines();
            if (lines.size() < 3) {
                continue;
            }
            Set<Integer> starts = lines.stream().map(l -> l.bbox().x0()).collect(Collectors.toSet());
            if (starts.size() >= 2 && starts.size() <= lines.size() / 2.0) {
                return true;
            }
        }
        return PIPE_CELL.matcher(text).find() || TAB.matcher(text).find() || WIDE_GAP.matcher(text).find();
    }

    static boolean hasHandwriting(List<RecognizedWord> words) {
        if (words.isEmpty()) {
            return false;
        }
        double[] confidences = words.stream().mapToDouble(RecognizedWord::confidence).toArray();
        return mean(confidences) < HANDWRITING_MAX_MEAN && variance(confidences) > HANDWRITING_MIN_VARIANCE;
    }

    static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    // Population variance
    static double variance(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double m = mean(values);
        double sum = 0.0;
        for (double v : values) {
            sum += (v - m) * (v - m);
        }
        return sum / values.length;
    }

    private static int countNonWhitespace(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isWhitespace(text.charAt(i))) {
                count++;
            }
        }
        return count;
    }

    private static int countAsciiLetters(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')) {
                count++;
            }
        }
        return count;
    }
}
