package com.investidor.backend.report;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

public final class CurrencyFormat {

    private static final Locale PT_BR = new Locale("pt", "BR");
    private static final String PATTERN = "#,##0.00";

    private CurrencyFormat() {}

    public static String format(double value) {
        // DecimalFormat is not thread safe
        DecimalFormat format = new DecimalFormat(PATTERN, DecimalFormatSymbols.getInstance(PT_BR));
        return "R$ " + format.format(value);
    }
}
