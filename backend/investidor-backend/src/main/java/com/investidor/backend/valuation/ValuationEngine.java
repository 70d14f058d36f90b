package com.investidor.backend.valuation;

import com.investidor.backend.classification.Verdict;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ValuationEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(ValuationEngine.class);

    private static final double GRAHAM_CONSTANT = 22.5;

    private final Set<String> unreliableSectors;

    public ValuationEngine(ValuationProperties properties) {
        this.unreliableSectors = properties.getUnreliableSectors().stream()
                .map(ValuationEngine::canonical)
                .filter(value -> !value.isEmpty())
                .collect(Collectors.toSet());
    }

    public List<ValuationEstimate> computeEstimates(Fundamentals fundamentals, MacroParameters macro) {
        List<ValuationEstimate> estimates = new ArrayList<>();
        for (ValuationFormula formula : ValuationFormula.values()) {
            if (!formula.appliesTo(fundamentals.type())) {
                continue;
            }
            Double value = compute(formula, fundamentals, macro);
            estimates.add(new ValuationEstimate(formula, value, verdictFor(fundamentals.price(), value)));
        }
        return estimates;
    }

    public Double grahamFairValue(Double earningsPerShare, Double bookValuePerShare) {
        if (!isPositive(earningsPerShare) || !isPositive(bookValuePerShare)) {
            return null;
        }
        return Math.sqrt(GRAHAM_CONSTANT * earningsPerShare * bookValuePerShare);
    }

    public Double bazinCeilingPrice(Double price, Double dividendYield, double targetYield) {
        if (!isPositive(price) || !isPositive(dividendYield) || !(targetYield > 0)) {
            return null;
        }
        return price * (dividendYield / 100) / targetYield;
    }

    public Double revisedGrahamValue(Double earningsPerShare, Double earningsGrowth, MacroParameters macro) {
        if (!isPositive(earningsPerShare)
                || !(macro.basePeMultiple() > 0)
                || !(macro.historicalAverageRate() > 0)
                || !(macro.currentBenchmarkRate() > 0)) {
            return null;
        }
        double growth = isPositive(earningsGrowth) ? earningsGrowth : macro.fallbackGrowthRate();
        return earningsPerShare
                * (macro.basePeMultiple() + 2 * growth)
                * (macro.historicalAverageRate() / macro.currentBenchmarkRate());
    }

    public MagicNumber magicNumber(Double price, Double lastDividend) {
        if (!isPositive(price) || !isPositive(lastDividend)) {
            return null;
        }
        long quotas = (long) Math.ceil(price / lastDividend);
        return new MagicNumber(quotas, quotas * price);
    }

    public Verdict verdictFor(Double price, Double estimate) {
        if (!isPositive(estimate) || !isPositive(price)) {
            return Verdict.NEUTRAL;
        }
        return price < estimate ? Verdict.FAVORABLE : Verdict.UNFAVORABLE;
    }

    public List<String> warningsFor(Fundamentals fundamentals) {
        List<String> warnings = new ArrayList<>();
        String flagged = firstUnreliable(fundamentals.sector(), fundamentals.segment());
        if (flagged != null) {
            LOGGER.debug("Valuation formulas flagged as unreliable for '{}'", flagged);
            warnings.add("As fórmulas de Graham e Bazin não são confiáveis para o setor/segmento '"
                    + flagged.trim() + "'.");
        }
        return warnings;
    }

    private Double compute(ValuationFormula formula, Fundamentals fundamentals, MacroParameters macro) {
        switch (formula) {
            case GRAHAM:
                return grahamFairValue(fundamentals.earningsPerShare(), fundamentals.bookValuePerShare());
            case BAZIN:
                return bazinCeilingPrice(fundamentals.price(), fundamentals.dividendYield(), macro.bazinTargetYield());
            case BAZIN_FIVE_YEAR_AVERAGE:
                return bazinCeilingPrice(
                        fundamentals.price(), fundamentals.fiveYearAverageYield(), macro.bazinTargetYield());
            case REVISED_GRAHAM:
                return revisedGrahamValue(fundamentals.earningsPerShare(), fundamentals.earningsGrowth(), macro);
            default:
                throw new IllegalArgumentException("Unsupported valuation formula " + formula);
        }
    }

    private String firstUnreliable(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && unreliableSectors.contains(canonical(candidate))) {
                return candidate;
            }
        }
        return null;
    }

    private static boolean isPositive(Double value) {
        return value != null && value > 0 && !value.isInfinite();
    }

    private static String canonical(String value) {
        if (value == null) {
            return "";
        }
        String stripped = Normalizer.normalize(value.trim(), Normalizer.Form.NFD).replaceAll("\\p{M}", "");
        return stripped.toLowerCase(Locale.ROOT);
    }
}
