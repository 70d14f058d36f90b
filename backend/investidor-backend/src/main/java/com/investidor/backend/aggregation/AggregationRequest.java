package com.investidor.backend.aggregation;

public record AggregationRequest(String ticker) {}
