package com.investidor.backend.aggregation;

public class AggregationValidationException extends RuntimeException {

    public AggregationValidationException(String message) {
        super(message);
    }
}
