package com.investidor.backend.report;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.investidor.backend.provider.InstrumentType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({"ticker", "tipo"})
public final class AggregatedReport {

    private final String ticker;
    private final InstrumentType type;
    private final Map<String, FieldView> indicators;
    private final Map<String, FieldView> valuations;
    private final Map<String, Map<String, FieldView>> recommendations;
    private final List<String> unavailableProviders;
    private final List<String> warnings;

    public AggregatedReport(
            String ticker,
            InstrumentType type,
            Map<String, FieldView> indicators,
            Map<String, FieldView> valuations,
            Map<String, Map<String, FieldView>> recommendations,
            List<String> unavailableProviders,
            List<String> warnings) {
        this.ticker = ticker;
        this.type = type;
        this.indicators = Collections.unmodifiableMap(new LinkedHashMap<>(indicators));
        this.valuations = Collections.unmodifiableMap(new LinkedHashMap<>(valuations));
        this.recommendations = Collections.unmodifiableMap(new LinkedHashMap<>(recommendations));
        this.unavailableProviders = List.copyOf(unavailableProviders);
        this.warnings = List.copyOf(warnings);
    }

    public String getTicker() {
        return ticker;
    }

    @JsonProperty("tipo")
    public InstrumentType getType() {
        return type;
    }

    @JsonAnyGetter
    public Map<String, FieldView> getIndicators() {
        return indicators;
    }

    public Map<String, FieldView> getValuations() {
        return valuations;
    }

    public Map<String, Map<String, FieldView>> getRecommendations() {
        return recommendations;
    }

    public List<String> getUnavailableProviders() {
        return unavailableProviders;
    }

    public List<String> getWarnings() {
        return warnings;
    }
}
