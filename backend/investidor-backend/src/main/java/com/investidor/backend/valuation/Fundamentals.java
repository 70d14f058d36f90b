package com.investidor.backend.valuation;

import com.investidor.backend.normalization.TextNumberNormalizer;
import com.investidor.backend.provider.FieldNames;
import com.investidor.backend.provider.InstrumentType;
import com.investidor.backend.provider.RawFieldSet;

public record Fundamentals(
        InstrumentType type,
        Double price,
        Double earningsPerShare,
        Double bookValuePerShare,
        Double dividendYield,
        Double fiveYearAverageYield,
        Double earningsGrowth,
        Double lastDividend,
        String sector,
        String segment) {

    public static Fundamentals from(InstrumentType type, RawFieldSet fields, TextNumberNormalizer normalizer) {
        return new Fundamentals(
                type,
                normalizer.normalize(fields.get(FieldNames.PRICE)),
                normalizer.normalize(fields.get(FieldNames.EARNINGS_PER_SHARE)),
                normalizer.normalize(fields.get(FieldNames.BOOK_VALUE_PER_SHARE)),
                normalizer.normalize(fields.get(FieldNames.DIVIDEND_YIELD)),
                normalizer.normalize(fields.get(FieldNames.FIVE_YEAR_AVERAGE_YIELD)),
                normalizer.normalize(fields.get(FieldNames.EARNINGS_GROWTH)),
                normalizer.normalize(fields.get(FieldNames.LAST_DIVIDEND)),
                fields.get(FieldNames.SECTOR),
                fields.get(FieldNames.SEGMENT));
    }
}
