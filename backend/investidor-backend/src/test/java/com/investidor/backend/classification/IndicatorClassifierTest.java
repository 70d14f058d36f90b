package com.investidor.backend.classification;

import static org.assertj.core.api.Assertions.assertThat;

import com.investidor.backend.normalization.TextNumberNormalizer;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

class IndicatorClassifierTest {

    private final IndicatorClassifier classifier = new IndicatorClassifier(new TextNumberNormalizer());

    @Test
    void shouldClassifyPriceToBook() {
        assertThat(classifier.classify("price/book", 0.8)).isEqualTo(Verdict.FAVORABLE);
        assertThat(classifier.classify("price/book", 2.0)).isEqualTo(Verdict.UNFAVORABLE);
        assertThat(classifier.classify("price/book", 1.2)).isEqualTo(Verdict.NEUTRAL);
        assertThat(classifier.classify("price/book", null)).isEqualTo(Verdict.NEUTRAL);
    }

    @Test
    void shouldResolveIndicatorsByFieldNameIgnoringCase() {
        assertThat(classifier.classify("pvp", 0.8)).isEqualTo(Verdict.FAVORABLE);
        assertThat(classifier.classify(" PVP ", 0.8)).isEqualTo(Verdict.FAVORABLE);
        assertThat(classifier.classify("Price/Book", 0.8)).isEqualTo(Verdict.FAVORABLE);
    }

    @Test
    void shouldReturnNeutralForUnknownIndicator() {
        assertThat(classifier.classify("ev/ebit", 0.5)).isEqualTo(Verdict.NEUTRAL);
        assertThat(classifier.classify(null, 0.5)).isEqualTo(Verdict.NEUTRAL);
        assertThat(classifier.classify("", 0.5)).isEqualTo(Verdict.NEUTRAL);
    }

    @Test
    void shouldTreatNegativeEarningsMultipleAsNeutral() {
        assertThat(classifier.classify("pl", -4.0)).isEqualTo(Verdict.NEUTRAL);
        assertThat(classifier.classify("pl", 0.0)).isEqualTo(Verdict.NEUTRAL);
    }

    @ParameterizedTest
    @MethodSource("thresholds")
    void shouldApplyRuleTable(String indicator, double value, Verdict expected) {
        assertThat(classifier.classify(indicator, value)).isEqualTo(expected);
    }

    static Stream<Arguments> thresholds() {
        return Stream.of(
                Arguments.of("price/earnings", 9.99, Verdict.FAVORABLE),
                Arguments.of("price/earnings", 10.0, Verdict.NEUTRAL),
                Arguments.of("price/earnings", 20.5, Verdict.UNFAVORABLE),
                Arguments.of("dividend yield", 6.0, Verdict.FAVORABLE),
                Arguments.of("dividend yield", 5.0, Verdict.NEUTRAL),
                Arguments.of("dividend yield", 3.9, Verdict.UNFAVORABLE),
                Arguments.of("return on equity", 15.0, Verdict.FAVORABLE),
                Arguments.of("return on equity", 7.9, Verdict.UNFAVORABLE),
                Arguments.of("return on invested capital", 10.0, Verdict.FAVORABLE),
                Arguments.of("return on invested capital", 4.0, Verdict.UNFAVORABLE),
                Arguments.of("net margin", 15.0, Verdict.FAVORABLE),
                Arguments.of("net margin", 4.99, Verdict.UNFAVORABLE),
                Arguments.of("EBITDA margin", 20.0, Verdict.FAVORABLE),
                Arguments.of("EBITDA margin", 9.0, Verdict.UNFAVORABLE),
                Arguments.of("net debt/EBIT", 1.0, Verdict.FAVORABLE),
                Arguments.of("net debt/EBIT", 3.01, Verdict.UNFAVORABLE),
                Arguments.of("net debt/EBITDA", 2.0, Verdict.FAVORABLE),
                Arguments.of("net debt/EBITDA", 4.0, Verdict.NEUTRAL),
                Arguments.of("net debt/EBITDA", 4.5, Verdict.UNFAVORABLE),
                Arguments.of("current liquidity", 1.5, Verdict.FAVORABLE),
                Arguments.of("current liquidity", 0.9, Verdict.UNFAVORABLE),
                Arguments.of("payout ratio", 25.0, Verdict.FAVORABLE),
                Arguments.of("payout ratio", 75.0, Verdict.FAVORABLE),
                Arguments.of("payout ratio", 90.0, Verdict.NEUTRAL),
                Arguments.of("payout ratio", 120.0, Verdict.UNFAVORABLE),
                Arguments.of("upside potential", 15.1, Verdict.FAVORABLE),
                Arguments.of("upside potential", 15.0, Verdict.NEUTRAL),
                Arguments.of("upside potential", -1.0, Verdict.UNFAVORABLE),
                Arguments.of("risk score", 25.0, Verdict.FAVORABLE),
                Arguments.of("risk score", 51.0, Verdict.UNFAVORABLE),
                Arguments.of("earnings growth (CAGR)", 10.0, Verdict.FAVORABLE),
                Arguments.of("earnings growth (CAGR)", 4.0, Verdict.UNFAVORABLE));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "-", "   ", "n/a", ".,", "R$"})
    void shouldBeNeutralForEveryIndicatorWhenTextDoesNotParse(String raw) {
        for (Indicator indicator : Indicator.values()) {
            ClassifiedField field = classifier.classifyText(indicator.getFieldName(), raw);
            assertThat(field.value()).isNull();
            assertThat(field.verdict()).isEqualTo(Verdict.NEUTRAL);
        }
    }

    @Test
    void shouldClassifyRawText() {
        ClassifiedField field = classifier.classifyText("dy", "8,25%");

        assertThat(field.rawText()).isEqualTo("8,25%");
        assertThat(field.value()).isEqualTo(8.25);
        assertThat(field.verdict()).isEqualTo(Verdict.FAVORABLE);
    }
}
