package com.investidor.backend.classification;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Verdict {
    FAVORABLE,
    UNFAVORABLE,
    NEUTRAL;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
