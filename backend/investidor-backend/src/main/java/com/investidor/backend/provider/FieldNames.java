package com.investidor.backend.provider;

public final class FieldNames {

    public static final String PRICE = "cotacao";
    public static final String PRICE_TO_EARNINGS = "pl";
    public static final String PRICE_TO_BOOK = "pvp";
    public static final String DIVIDEND_YIELD = "dy";
    public static final String FIVE_YEAR_AVERAGE_YIELD = "dy_medio_5_anos";
    public static final String BOOK_VALUE_PER_SHARE = "vpa";
    public static final String EARNINGS_PER_SHARE = "lpa";
    public static final String RETURN_ON_EQUITY = "roe";
    public static final String RETURN_ON_INVESTED_CAPITAL = "roic";
    public static final String NET_MARGIN = "margem_liquida";
    public static final String EBITDA_MARGIN = "margem_ebitda";
    public static final String NET_DEBT_TO_EBIT = "divida_liquida_ebit";
    public static final String NET_DEBT_TO_EBITDA = "divida_liquida_ebitda";
    public static final String CURRENT_LIQUIDITY = "liquidez_corrente";
    public static final String PAYOUT = "payout";
    public static final String EARNINGS_GROWTH = "cagr_lucros";
    public static final String SECTOR = "setor";
    public static final String SEGMENT = "segmento";

    public static final String LAST_DIVIDEND = "ultimo_rendimento";
    public static final String ONE_MONTH_YIELD = "yield_1m";

    public static final String RECOMMENDATION = "recomendacao";
    public static final String TARGET_PRICE = "preco_alvo";
    public static final String UPSIDE_POTENTIAL = "potencial_valorizacao";
    public static final String RISK_SCORE = "risco";

    private FieldNames() {}
}
