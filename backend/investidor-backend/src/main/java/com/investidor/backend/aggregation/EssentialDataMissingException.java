package com.investidor.backend.aggregation;

import com.investidor.backend.provider.FailureReason;

public class EssentialDataMissingException extends RuntimeException {

    private final String ticker;
    private final FailureReason reason;

    public EssentialDataMissingException(String ticker, FailureReason reason) {
        super("Essential data missing for " + ticker + ": " + reason.message());
        this.ticker = ticker;
        this.reason = reason;
    }

    public String getTicker() {
        return ticker;
    }

    public FailureReason getReason() {
        return reason;
    }
}
