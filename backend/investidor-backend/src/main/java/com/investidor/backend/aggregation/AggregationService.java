package com.investidor.backend.aggregation;

import com.investidor.backend.classification.ClassifiedField;
import com.investidor.backend.classification.ClassifiedFieldSet;
import com.investidor.backend.classification.IndicatorClassifier;
import com.investidor.backend.classification.Verdict;
import com.investidor.backend.normalization.TextNumberNormalizer;
import com.investidor.backend.provider.InstrumentType;
import com.investidor.backend.provider.ProviderFetchResult;
import com.investidor.backend.provider.ProviderId;
import com.investidor.backend.provider.ProviderOrchestrator;
import com.investidor.backend.provider.ProviderOutcome;
import com.investidor.backend.provider.RawFieldSet;
import com.investidor.backend.report.AggregatedReport;
import com.investidor.backend.report.CurrencyFormat;
import com.investidor.backend.report.ReportAssembler;
import com.investidor.backend.report.ReportLayout;
import com.investidor.backend.valuation.Fundamentals;
import com.investidor.backend.valuation.MagicNumber;
import com.investidor.backend.valuation.ValuationEngine;
import com.investidor.backend.valuation.ValuationEstimate;
import com.investidor.backend.valuation.ValuationProperties;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AggregationService {

    private static final Logger LOGGER = LoggerFactory.getLogger(AggregationService.class);
    static final String EMPTY_TICKER_MESSAGE = "Ticker vazio";
    private static final Pattern TICKER_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9.-]{0,15}");

    private final ProviderOrchestrator orchestrator;
    private final TextNumberNormalizer normalizer;
    private final IndicatorClassifier classifier;
    private final ValuationEngine valuationEngine;
    private final ValuationProperties valuationProperties;
    private final ReportAssembler assembler;

    public AggregationService(
            ProviderOrchestrator orchestrator,
            TextNumberNormalizer normalizer,
            IndicatorClassifier classifier,
            ValuationEngine valuationEngine,
            ValuationProperties valuationProperties,
            ReportAssembler assembler) {
        this.orchestrator = orchestrator;
        this.normalizer = normalizer;
        this.classifier = classifier;
        this.valuationEngine = valuationEngine;
        this.valuationProperties = valuationProperties;
        this.assembler = assembler;
    }

    public AggregatedReport aggregate(AggregationRequest request, InstrumentType type) {
        String ticker = validateTicker(request == null ? null : request.ticker());
        LOGGER.info("Aggregating {} ({})", ticker, type);

        ProviderFetchResult result = orchestrator.fetchAll(ticker, type);
        if (!result.isSuccessful()) {
            ProviderOutcome primary = result.primaryOutcome();
            LOGGER.warn(
                    "Primary provider {} failed for {}: {}",
                    primary.providerId(),
                    ticker,
                    primary.failure().message());
            throw new EssentialDataMissingException(ticker, primary.failure());
        }

        RawFieldSet primaryFields = result.primaryOutcome().fields();
        ClassifiedFieldSet primary = classify(primaryFields);
        Map<ProviderId, ClassifiedFieldSet> secondary = new LinkedHashMap<>();
        result.secondaryOutcomes().forEach((providerId, outcome) -> secondary.put(
                providerId, outcome.isSuccess() ? classify(outcome.fields()) : ClassifiedFieldSet.unavailable()));

        Fundamentals fundamentals = Fundamentals.from(type, primaryFields, normalizer);
        List<ValuationEstimate> estimates =
                valuationEngine.computeEstimates(fundamentals, valuationProperties.toMacroParameters());
        List<String> warnings = valuationEngine.warningsFor(fundamentals);
        if (type == InstrumentType.REAL_ESTATE_FUND) {
            MagicNumber magicNumber = valuationEngine.magicNumber(fundamentals.price(), fundamentals.lastDividend());
            primary = withMagicNumber(primary, magicNumber);
        }

        return assembler.assemble(ticker, type, primary, secondary, estimates, warnings);
    }

    String validateTicker(String rawTicker) {
        if (rawTicker == null || rawTicker.isBlank()) {
            throw new AggregationValidationException(EMPTY_TICKER_MESSAGE);
        }
        String ticker = rawTicker.trim();
        if (!TICKER_PATTERN.matcher(ticker).matches()) {
            throw new AggregationValidationException("Ticker inválido: " + ticker + " (ex.: PETR4).");
        }
        return ticker.toUpperCase(Locale.ROOT);
    }

    private ClassifiedFieldSet classify(RawFieldSet fields) {
        Map<String, ClassifiedField> classified = new LinkedHashMap<>();
        for (String fieldName : fields.fieldNames()) {
            classified.put(fieldName, classifier.classifyText(fieldName, fields.get(fieldName)));
        }
        return ClassifiedFieldSet.of(classified);
    }

    private ClassifiedFieldSet withMagicNumber(ClassifiedFieldSet fields, MagicNumber magicNumber) {
        if (magicNumber == null) {
            return fields;
        }
        return fields
                .with(ReportLayout.MAGIC_NUMBER, new ClassifiedField(
                        Long.toString(magicNumber.quotas()), (double) magicNumber.quotas(), Verdict.NEUTRAL))
                .with(ReportLayout.MAGIC_NUMBER_CAPITAL, new ClassifiedField(
                        CurrencyFormat.format(magicNumber.capital()), magicNumber.capital(), Verdict.NEUTRAL));
    }
}
