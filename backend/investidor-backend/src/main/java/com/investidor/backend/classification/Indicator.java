package com.investidor.backend.classification;

import java.util.Locale;
import java.util.Optional;
import java.util.function.DoublePredicate;

public enum Indicator {
    PRICE_TO_BOOK("pvp", "price/book", v -> v < 1.0, v -> v > 1.5),
    PRICE_TO_EARNINGS("pl", "price/earnings", v -> v > 0 && v < 10, v -> v > 20),
    DIVIDEND_YIELD("dy", "dividend yield", v -> v >= 6, v -> v < 4),
    RETURN_ON_EQUITY("roe", "return on equity", v -> v >= 15, v -> v < 8),
    RETURN_ON_INVESTED_CAPITAL("roic", "return on invested capital", v -> v >= 10, v -> v < 5),
    NET_MARGIN("margem_liquida", "net margin", v -> v >= 15, v -> v < 5),
    EBITDA_MARGIN("margem_ebitda", "EBITDA margin", v -> v >= 20, v -> v < 10),
    NET_DEBT_TO_EBIT("divida_liquida_ebit", "net debt/EBIT", v -> v <= 1.0, v -> v > 3.0),
    NET_DEBT_TO_EBITDA("divida_liquida_ebitda", "net debt/EBITDA", v -> v <= 2.0, v -> v > 4.0),
    CURRENT_LIQUIDITY("liquidez_corrente", "current liquidity", v -> v >= 1.5, v -> v < 1.0),
    PAYOUT_RATIO("payout", "payout ratio", v -> v >= 25 && v <= 75, v -> v > 100),
    UPSIDE_POTENTIAL("potencial_valorizacao", "upside potential", v -> v > 15, v -> v < 0),
    RISK_SCORE("risco", "risk score", v -> v <= 25, v -> v > 50),
    EARNINGS_GROWTH("cagr_lucros", "earnings growth (CAGR)", v -> v >= 10, v -> v < 5);

    private final String fieldName;
    private final String label;
    private final DoublePredicate favorable;
    private final DoublePredicate unfavorable;

    Indicator(String fieldName, String label, DoublePredicate favorable, DoublePredicate unfavorable) {
        this.fieldName = fieldName;
        this.label = label;
        this.favorable = favorable;
        this.unfavorable = unfavorable;
    }

    public String getFieldName() {
        return fieldName;
    }

    public Verdict evaluate(double value) {
        if (Double.isNaN(value)) {
            return Verdict.NEUTRAL;
        }
        if (favorable.test(value)) {
            return Verdict.FAVORABLE;
        }
        if (unfavorable.test(value)) {
            return Verdict.UNFAVORABLE;
        }
        return Verdict.NEUTRAL;
    }

    public static Optional<Indicator> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (Indicator indicator : values()) {
            if (indicator.fieldName.equals(normalized)
                    || indicator.label.toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(indicator);
            }
        }
        return Optional.empty();
    }
}
