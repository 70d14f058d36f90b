package com.investidor.backend.valuation;

public record MagicNumber(long quotas, double capital) {}
