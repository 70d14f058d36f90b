package com.investidor.backend.classification;

import com.investidor.backend.normalization.TextNumberNormalizer;
import org.springframework.stereotype.Component;

@Component
public class IndicatorClassifier {

    private final TextNumberNormalizer normalizer;

    public IndicatorClassifier(TextNumberNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public Verdict classify(String indicatorName, Double value) {
        if (value == null) {
            return Verdict.NEUTRAL;
        }
        return Indicator.fromName(indicatorName)
                .map(indicator -> indicator.evaluate(value))
                .orElse(Verdict.NEUTRAL);
    }

    public ClassifiedField classifyText(String indicatorName, String rawText) {
        Double value = normalizer.normalize(rawText);
        return new ClassifiedField(rawText, value, classify(indicatorName, value));
    }
}
