package com.investidor.backend.report;

import com.investidor.backend.provider.FieldNames;
import com.investidor.backend.provider.InstrumentType;
import java.util.List;
import java.util.Set;

public final class ReportLayout {

    public static final String MAGIC_NUMBER = "numeroMagico";
    public static final String MAGIC_NUMBER_CAPITAL = "capitalNumeroMagico";

    static final List<String> STOCK_FIELDS = List.of(
            FieldNames.PRICE,
            FieldNames.PRICE_TO_EARNINGS,
            FieldNames.PRICE_TO_BOOK,
            FieldNames.DIVIDEND_YIELD,
            FieldNames.BOOK_VALUE_PER_SHARE,
            FieldNames.EARNINGS_PER_SHARE,
            FieldNames.RETURN_ON_EQUITY,
            FieldNames.RETURN_ON_INVESTED_CAPITAL,
            FieldNames.NET_MARGIN,
            FieldNames.EBITDA_MARGIN,
            FieldNames.NET_DEBT_TO_EBIT,
            FieldNames.NET_DEBT_TO_EBITDA,
            FieldNames.CURRENT_LIQUIDITY,
            FieldNames.PAYOUT,
            FieldNames.EARNINGS_GROWTH);

    static final List<String> FUND_FIELDS = List.of(
            FieldNames.PRICE,
            FieldNames.DIVIDEND_YIELD,
            FieldNames.PRICE_TO_BOOK,
            FieldNames.LAST_DIVIDEND,
            FieldNames.ONE_MONTH_YIELD,
            MAGIC_NUMBER,
            MAGIC_NUMBER_CAPITAL);

    static final List<String> RECOMMENDATION_FIELDS = List.of(
            FieldNames.RECOMMENDATION,
            FieldNames.TARGET_PRICE,
            FieldNames.UPSIDE_POTENTIAL,
            FieldNames.RISK_SCORE);

    static final Set<String> TEXT_FIELDS = Set.of(FieldNames.RECOMMENDATION);

    private ReportLayout() {}

    public static List<String> primaryFields(InstrumentType type) {
        return type == InstrumentType.REAL_ESTATE_FUND ? FUND_FIELDS : STOCK_FIELDS;
    }

    public static List<String> recommendationFields() {
        return RECOMMENDATION_FIELDS;
    }

    public static boolean isTextField(String fieldName) {
        return TEXT_FIELDS.contains(fieldName);
    }
}
