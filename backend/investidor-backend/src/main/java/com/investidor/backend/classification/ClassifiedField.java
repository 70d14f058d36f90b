package com.investidor.backend.classification;

public record ClassifiedField(String rawText, Double value, Verdict verdict) {

    private static final ClassifiedField ABSENT = new ClassifiedField(null, null, Verdict.NEUTRAL);

    public static ClassifiedField absent() {
        return ABSENT;
    }

    public boolean hasText() {
        return rawText != null && !rawText.isBlank();
    }
}
