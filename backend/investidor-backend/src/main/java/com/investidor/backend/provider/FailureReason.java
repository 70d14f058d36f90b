package com.investidor.backend.provider;

public record FailureReason(Kind kind, String message) {

    public enum Kind {
        TIMEOUT,
        UNAVAILABLE,
        ESSENTIAL_DATA_MISSING
    }

    public static FailureReason timeout(String message) {
        return new FailureReason(Kind.TIMEOUT, message);
    }

    public static FailureReason unavailable(String message) {
        return new FailureReason(Kind.UNAVAILABLE, message);
    }

    public static FailureReason essentialDataMissing(String message) {
        return new FailureReason(Kind.ESSENTIAL_DATA_MISSING, message);
    }
}
