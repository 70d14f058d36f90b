package com.investidor.backend.valuation;

public record MacroParameters(
        double currentBenchmarkRate,
        double historicalAverageRate,
        double basePeMultiple,
        double fallbackGrowthRate,
        double bazinTargetYield) {}
