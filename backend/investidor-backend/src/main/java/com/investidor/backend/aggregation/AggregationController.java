package com.investidor.backend.aggregation;

import com.investidor.backend.provider.InstrumentType;
import com.investidor.backend.report.AggregatedReport;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AggregationController {

    private final AggregationService service;

    public AggregationController(AggregationService service) {
        this.service = service;
    }

    @PostMapping("/buscar")
    public AggregatedReport searchStock(@RequestBody(required = false) AggregationRequest request) {
        return service.aggregate(request, InstrumentType.STOCK);
    }

    @GetMapping("/acoes/{ticker}")
    public AggregatedReport getStock(@PathVariable("ticker") String ticker) {
        return service.aggregate(new AggregationRequest(ticker), InstrumentType.STOCK);
    }

    @PostMapping("/buscar-fii")
    public AggregatedReport searchFund(@RequestBody(required = false) AggregationRequest request) {
        return service.aggregate(request, InstrumentType.REAL_ESTATE_FUND);
    }

    @GetMapping("/fiis/{ticker}")
    public AggregatedReport getFund(@PathVariable("ticker") String ticker) {
        return service.aggregate(new AggregationRequest(ticker), InstrumentType.REAL_ESTATE_FUND);
    }
}
