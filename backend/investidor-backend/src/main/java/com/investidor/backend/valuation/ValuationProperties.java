package com.investidor.backend.valuation;

import java.util.LinkedHashSet;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "investidor.valuation")
public class ValuationProperties {

    /**
     * Current yield of the reference corporate bond rate (Y in the revised Graham formula).
     */
    private double currentBenchmarkRate = 11.25;

    /**
     * Historical average of the same rate (4.4 in Graham's original formula).
     */
    private double historicalAverageRate = 4.4;

    /**
     * P/E multiple of a company with no growth.
     */
    private double basePeMultiple = 8.5;

    /**
     * Growth rate used when the earnings CAGR is missing or non-positive.
     */
    private double fallbackGrowthRate = 5.0;

    /**
     * Dividend yield an investor demands in the Bazin formula, as a fraction. 0.06 is active;
     * 0.08 is the stricter variant.
     */
    private double bazinTargetYield = 0.06;

    /**
     * Sectors or segments where the formulas are not meaningful (banks, insurers, holdings...).
     */
    private Set<String> unreliableSectors = new LinkedHashSet<>(Set.of(
            "Bancos", "Intermediários Financeiros", "Seguradoras", "Previdência e Seguros", "Holdings Diversificadas"));

    public double getCurrentBenchmarkRate() {
        return currentBenchmarkRate;
    }

    public void setCurrentBenchmarkRate(double currentBenchmarkRate) {
        this.currentBenchmarkRate = currentBenchmarkRate;
    }

    public double getHistoricalAverageRate() {
        return historicalAverageRate;
    }

    public void setHistoricalAverageRate(double historicalAverageRate) {
        this.historicalAverageRate = historicalAverageRate;
    }

    public double getBasePeMultiple() {
        return basePeMultiple;
    }

    public void setBasePeMultiple(double basePeMultiple) {
        this.basePeMultiple = basePeMultiple;
    }

    public double getFallbackGrowthRate() {
        return fallbackGrowthRate;
    }

    public void setFallbackGrowthRate(double fallbackGrowthRate) {
        this.fallbackGrowthRate = fallbackGrowthRate;
    }

    public double getBazinTargetYield() {
        return bazinTargetYield;
    }

    public void setBazinTargetYield(double bazinTargetYield) {
        this.bazinTargetYield = bazinTargetYield;
    }

    public Set<String> getUnreliableSectors() {
        return unreliableSectors;
    }

    public void setUnreliableSectors(Set<String> unreliableSectors) {
        this.unreliableSectors = unreliableSectors == null ? new LinkedHashSet<>() : unreliableSectors;
    }

    public MacroParameters toMacroParameters() {
        return new MacroParameters(
                currentBenchmarkRate, historicalAverageRate, basePeMultiple, fallbackGrowthRate, bazinTargetYield);
    }
}
