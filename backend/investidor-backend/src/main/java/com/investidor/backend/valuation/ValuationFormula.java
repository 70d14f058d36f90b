package com.investidor.backend.valuation;

import com.investidor.backend.provider.InstrumentType;
import java.util.EnumSet;
import java.util.Set;

public enum ValuationFormula {
    GRAHAM("valorJusto", EnumSet.of(InstrumentType.STOCK)),
    BAZIN("precoTeto", EnumSet.of(InstrumentType.STOCK, InstrumentType.REAL_ESTATE_FUND)),
    BAZIN_FIVE_YEAR_AVERAGE("precoTetoMedia5Anos", EnumSet.of(InstrumentType.STOCK, InstrumentType.REAL_ESTATE_FUND)),
    REVISED_GRAHAM("grahamRevisado", EnumSet.of(InstrumentType.STOCK));

    private final String key;
    private final Set<InstrumentType> instrumentTypes;

    ValuationFormula(String key, Set<InstrumentType> instrumentTypes) {
        this.key = key;
        this.instrumentTypes = instrumentTypes;
    }

    public String getKey() {
        return key;
    }

    public boolean appliesTo(InstrumentType type) {
        return instrumentTypes.contains(type);
    }
}
