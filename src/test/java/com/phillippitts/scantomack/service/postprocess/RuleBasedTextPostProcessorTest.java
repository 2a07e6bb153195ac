package com.phillippitts.scantomack.service.postprocess;

import com.phillippitts.scantomack.domain.ProcessingOptions;
import com.phillippitts.scantomack.domain.TextCorrection;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RuleBasedTextPostProcessorTest {

    private final RuleBasedTextPostProcessor processor = new RuleBasedTextPostProcessor();
    private final ProcessingOptions options = ProcessingOptions.builder().build();

    @Test
    void fixesReceiptTotalLine() {
        PostProcessingResult result = processor.process("Total : $ 12.5O", options);

        assertThat(result.correctedText()).isEqualTo("Total: $12.50");
        assertThat(result.corrections())
                .extracting(TextCorrection::rule)
                .containsExactly(
                        "Letter O to digit 0 after digits",
                        "Total label formatting",
                        "Currency symbol spacing");
    }

    @Test
    void recordsPositionAndSpanOfCorrection() {
        PostProcessingResult result = processor.process("Qty 5O", options);

        TextCorrection correction = result.corrections().get(0);
        assertThat(correction.position()).isEqualTo(5);
        assertThat(correction.original()).isEqualTo("O");
        assertThat(correction.corrected()).isEqualTo("0");
        assertThat(correction.confidence()).isEqualTo(0.8);
    }

    @Test
    void replacesLowercaseLBeforeDigits() {
        assertThat(processor.process("l00 items", options).correctedText()).isEqualTo("100 items");
    }

    @Test
    void collapsesRepeatedSpacesAndTrimsLines() {
        PostProcessingResult result = processor.process("hello    world  \n   next line", options);

        assertThat(result.correctedText()).isEqualTo("hello world\nnext line");
    }

    @Test
    void leavesCleanTextUntouched() {
        PostProcessingResult result = processor.process("Invoice number 1001", options);

        assertThat(result.correctedText()).isEqualTo("Invoice number 1001");
        assertThat(result.corrections()).isEmpty();
    }

    @Test
    void doesNotTouchWordsThatMerelyContainTheLetters() {
        PostProcessingResult result = processor.process("Order Blue Sold", options);

        assertThat(result.correctedText()).isEqualTo("Order Blue Sold");
        assertThat(result.corrections()).isEmpty();
    }

    @Test
    void semanticConfidenceIsShareOfKnownWords() {
        assertThat(RuleBasedTextPostProcessor.semanticConfidence("the invoice xyzzy"))
                .isCloseTo(2.0 / 3.0, within(1e-9));
        assertThat(RuleBasedTextPostProcessor.semanticConfidence("Subtotal: $12.50 TAX"))
                .isCloseTo(1.0, within(1e-9));
    }

    @Test
    void semanticConfidenceIsZeroWithoutWords() {
        assertThat(RuleBasedTextPostProcessor.semanticConfidence("")).isZero();
        assertThat(RuleBasedTextPostProcessor.semanticConfidence("123 456 !!")).isZero();
    }

    @Test
    void resultCarriesSemanticConfidence() {
        PostProcessingResult result = processor.process("thank you for your payment", options);

        assertThat(result.semanticConfidence()).isEqualTo(1.0);
    }
}
