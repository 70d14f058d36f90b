package com.investidor.backend.valuation;

import com.investidor.backend.classification.Verdict;

public record ValuationEstimate(ValuationFormula formula, Double value, Verdict verdict) {}
