package com.investidor.backend.report;

import com.investidor.backend.classification.ClassifiedField;
import com.investidor.backend.classification.ClassifiedFieldSet;
import com.investidor.backend.classification.Verdict;
import com.investidor.backend.provider.InstrumentType;
import com.investidor.backend.provider.ProviderId;
import com.investidor.backend.valuation.ValuationEstimate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class ReportAssembler {

    static final String ABSENT = "-";

    public AggregatedReport assemble(
            String ticker,
            InstrumentType type,
            ClassifiedFieldSet primaryFields,
            Map<ProviderId, ClassifiedFieldSet> secondaryFieldsByProvider,
            List<ValuationEstimate> estimates,
            List<String> warnings) {
        Map<String, FieldView> indicators = new LinkedHashMap<>();
        for (String fieldName : ReportLayout.primaryFields(type)) {
            indicators.put(fieldName, toView(fieldName, primaryFields.get(fieldName)));
        }

        Map<String, FieldView> valuations = new LinkedHashMap<>();
        for (ValuationEstimate estimate : estimates) {
            valuations.put(estimate.formula().getKey(), toView(estimate));
        }

        Map<String, Map<String, FieldView>> recommendations = new LinkedHashMap<>();
        List<String> unavailableProviders = new ArrayList<>();
        secondaryFieldsByProvider.forEach((providerId, fields) -> {
            Map<String, FieldView> views = new LinkedHashMap<>();
            for (String fieldName : ReportLayout.recommendationFields()) {
                views.put(fieldName, toView(fieldName, fields.get(fieldName)));
            }
            recommendations.put(providerId.value(), views);
            if (!fields.isAvailable()) {
                unavailableProviders.add(providerId.value());
            }
        });

        return new AggregatedReport(
                ticker.trim().toUpperCase(Locale.ROOT),
                type,
                indicators,
                valuations,
                recommendations,
                unavailableProviders,
                warnings);
    }

    private FieldView toView(String fieldName, ClassifiedField field) {
        if (field == null || !field.hasText()) {
            return new FieldView(ABSENT, Verdict.NEUTRAL);
        }
        if (field.value() == null && !ReportLayout.isTextField(fieldName)) {
            return new FieldView(ABSENT, Verdict.NEUTRAL);
        }
        return new FieldView(field.rawText().trim(), field.verdict());
    }

    private FieldView toView(ValuationEstimate estimate) {
        if (estimate.value() == null) {
            return new FieldView(ABSENT, Verdict.NEUTRAL);
        }
        return new FieldView(CurrencyFormat.format(estimate.value()), estimate.verdict());
    }
}
