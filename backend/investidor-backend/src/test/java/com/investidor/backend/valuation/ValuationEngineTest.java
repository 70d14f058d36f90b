package com.investidor.backend.valuation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.investidor.backend.classification.Verdict;
import com.investidor.backend.provider.InstrumentType;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ValuationEngineTest {

    private static final MacroParameters MACRO = new MacroParameters(11.0, 4.4, 8.5, 5.0, 0.06);

    private final ValuationEngine engine = new ValuationEngine(properties(Set.of("Bancos", "Intermediarios Financeiros")));

    @Test
    void shouldComputeGrahamFairValue() {
        assertThat(engine.grahamFairValue(1.6, 9.0)).isCloseTo(18.0, within(1e-9));
        assertThat(engine.grahamFairValue(2.0, 8.0)).isCloseTo(Math.sqrt(360.0), within(1e-9));
    }

    @Test
    void shouldReturnNullGrahamWhenInputsAreNotPositive() {
        assertThat(engine.grahamFairValue(0.0, 8.0)).isNull();
        assertThat(engine.grahamFairValue(-1.2, 8.0)).isNull();
        assertThat(engine.grahamFairValue(2.0, 0.0)).isNull();
        assertThat(engine.grahamFairValue(2.0, -3.0)).isNull();
        assertThat(engine.grahamFairValue(null, 8.0)).isNull();
        assertThat(engine.grahamFairValue(2.0, null)).isNull();
    }

    @Test
    void shouldComputeBazinCeilingPrice() {
        assertThat(engine.bazinCeilingPrice(10.0, 6.0, 0.06)).isCloseTo(10.0, within(1e-9));
        assertThat(engine.bazinCeilingPrice(10.0, 6.0, 0.08)).isCloseTo(7.5, within(1e-9));
    }

    @Test
    void shouldIncreaseBazinWithPriceAndYield() {
        double base = engine.bazinCeilingPrice(10.0, 6.0, 0.06);

        assertThat(engine.bazinCeilingPrice(12.0, 6.0, 0.06)).isGreaterThan(base);
        assertThat(engine.bazinCeilingPrice(10.0, 7.5, 0.06)).isGreaterThan(base);
    }

    @Test
    void shouldReturnNullBazinWhenYieldOrDivisorIsNotPositive() {
        assertThat(engine.bazinCeilingPrice(10.0, 0.0, 0.06)).isNull();
        assertThat(engine.bazinCeilingPrice(10.0, -2.0, 0.06)).isNull();
        assertThat(engine.bazinCeilingPrice(10.0, null, 0.06)).isNull();
        assertThat(engine.bazinCeilingPrice(10.0, 6.0, 0.0)).isNull();
        assertThat(engine.bazinCeilingPrice(null, 6.0, 0.06)).isNull();
    }

    @Test
    void shouldComputeRevisedGrahamWithTrailingGrowth() {
        assertThat(engine.revisedGrahamValue(2.0, 10.0, MACRO)).isCloseTo(2.0 * 28.5 * 0.4, within(1e-9));
    }

    @Test
    void shouldFallBackToDefaultGrowthWhenGrowthIsMissingOrNotPositive() {
        double expected = 2.0 * (8.5 + 2 * 5.0) * (4.4 / 11.0);

        assertThat(engine.revisedGrahamValue(2.0, null, MACRO)).isCloseTo(expected, within(1e-9));
        assertThat(engine.revisedGrahamValue(2.0, -3.0, MACRO)).isCloseTo(expected, within(1e-9));
        assertThat(engine.revisedGrahamValue(2.0, 0.0, MACRO)).isCloseTo(expected, within(1e-9));
    }

    @Test
    void shouldReturnNullRevisedGrahamWhenDivisorOrEarningsAreNotPositive() {
        assertThat(engine.revisedGrahamValue(2.0, 10.0, new MacroParameters(0.0, 4.4, 8.5, 5.0, 0.06))).isNull();
        assertThat(engine.revisedGrahamValue(-2.0, 10.0, MACRO)).isNull();
        assertThat(engine.revisedGrahamValue(null, 10.0, MACRO)).isNull();
    }

    @Test
    void shouldComputeStockEstimatesInFormulaOrder() {
        Fundamentals fundamentals = stock(15.0, 1.6, 9.0, 8.0, 7.0, 12.0, "Petróleo", null);

        List<ValuationEstimate> estimates = engine.computeEstimates(fundamentals, MACRO);

        assertThat(estimates)
                .extracting(ValuationEstimate::formula)
                .containsExactly(
                        ValuationFormula.GRAHAM,
                        ValuationFormula.BAZIN,
                        ValuationFormula.BAZIN_FIVE_YEAR_AVERAGE,
                        ValuationFormula.REVISED_GRAHAM);
        assertThat(estimates.get(0).value()).isCloseTo(18.0, within(1e-9));
        assertThat(estimates.get(0).verdict()).isEqualTo(Verdict.FAVORABLE);
        assertThat(estimates.get(1).value()).isCloseTo(20.0, within(1e-9));
        assertThat(estimates.get(2).value()).isCloseTo(17.5, within(1e-9));
        assertThat(estimates.get(3).value()).isCloseTo(1.6 * 32.5 * 0.4, within(1e-9));
        assertThat(estimates.get(3).verdict()).isEqualTo(Verdict.FAVORABLE);
    }

    @Test
    void shouldKeepNullEstimatesNeutral() {
        Fundamentals fundamentals = stock(15.0, -0.5, 9.0, null, null, null, null, null);

        List<ValuationEstimate> estimates = engine.computeEstimates(fundamentals, MACRO);

        assertThat(estimates).allSatisfy(estimate -> {
            assertThat(estimate.value()).isNull();
            assertThat(estimate.verdict()).isEqualTo(Verdict.NEUTRAL);
        });
    }

    @Test
    void shouldOnlyApplyDividendFormulasToFunds() {
        Fundamentals fund = new Fundamentals(
                InstrumentType.REAL_ESTATE_FUND, 10.0, null, null, 12.0, 11.0, null, 0.1, null, "Papel");

        List<ValuationEstimate> estimates = engine.computeEstimates(fund, MACRO);

        assertThat(estimates)
                .extracting(ValuationEstimate::formula)
                .containsExactly(ValuationFormula.BAZIN, ValuationFormula.BAZIN_FIVE_YEAR_AVERAGE);
        assertThat(estimates.get(0).value()).isCloseTo(20.0, within(1e-9));
    }

    @Test
    void shouldCompareEstimateAgainstPrice() {
        assertThat(engine.verdictFor(10.0, 18.0)).isEqualTo(Verdict.FAVORABLE);
        assertThat(engine.verdictFor(20.0, 18.0)).isEqualTo(Verdict.UNFAVORABLE);
        assertThat(engine.verdictFor(18.0, 18.0)).isEqualTo(Verdict.UNFAVORABLE);
        assertThat(engine.verdictFor(10.0, null)).isEqualTo(Verdict.NEUTRAL);
        assertThat(engine.verdictFor(10.0, -1.0)).isEqualTo(Verdict.NEUTRAL);
        assertThat(engine.verdictFor(null, 18.0)).isEqualTo(Verdict.NEUTRAL);
    }

    @Test
    void shouldWarnWhenSectorOrSegmentIsFlagged() {
        assertThat(engine.warningsFor(stock(30.0, 4.0, 30.0, 8.0, null, null, "Financeiro", "Bancos")))
                .singleElement()
                .asString()
                .contains("Bancos");
        assertThat(engine.warningsFor(stock(30.0, 4.0, 30.0, 8.0, null, null, "  bancos ", null))).hasSize(1);
        assertThat(engine.warningsFor(stock(30.0, 4.0, 30.0, 8.0, null, null, "Intermediários Financeiros", null)))
                .hasSize(1);
    }

    @Test
    void shouldNotWarnForRegularSectors() {
        assertThat(engine.warningsFor(stock(30.0, 4.0, 30.0, 8.0, null, null, "Energia Elétrica", "Geração"))).isEmpty();
        assertThat(engine.warningsFor(stock(30.0, 4.0, 30.0, 8.0, null, null, null, null))).isEmpty();
    }

    @Test
    void shouldComputeMagicNumber() {
        MagicNumber exact = engine.magicNumber(100.0, 1.0);
        assertThat(exact.quotas()).isEqualTo(100L);
        assertThat(exact.capital()).isCloseTo(10000.0, within(1e-9));

        MagicNumber rounded = engine.magicNumber(9.87, 0.08);
        assertThat(rounded.quotas()).isEqualTo(124L);
        assertThat(rounded.capital()).isCloseTo(124 * 9.87, within(1e-9));
    }

    @Test
    void shouldReturnNullMagicNumberWithoutDividend() {
        assertThat(engine.magicNumber(10.0, 0.0)).isNull();
        assertThat(engine.magicNumber(10.0, null)).isNull();
        assertThat(engine.magicNumber(null, 0.1)).isNull();
    }

    private static Fundamentals stock(
            Double price,
            Double eps,
            Double bvps,
            Double dy,
            Double fiveYearDy,
            Double growth,
            String sector,
            String segment) {
        return new Fundamentals(InstrumentType.STOCK, price, eps, bvps, dy, fiveYearDy, growth, null, sector, segment);
    }

    private static ValuationProperties properties(Set<String> unreliableSectors) {
        ValuationProperties properties = new ValuationProperties();
        properties.setUnreliableSectors(unreliableSectors);
        return properties;
    }
}
