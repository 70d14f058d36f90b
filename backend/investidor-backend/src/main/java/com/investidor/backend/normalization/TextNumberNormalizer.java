package com.investidor.backend.normalization;

import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class TextNumberNormalizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(TextNumberNormalizer.class);

    private static final String ABSENT_MARKER = "-";
    private static final String CURRENCY_MARKER = "R$";
    private static final char NON_BREAKING_SPACE = (char) 0x00A0;
    private static final Pattern PLAIN_DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)");

    public Double normalize(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = stripSpaces(raw);
        if (cleaned.isEmpty() || ABSENT_MARKER.equals(cleaned)) {
            return null;
        }

        String sign = "";
        if (cleaned.startsWith("-") || cleaned.startsWith("+")) {
            String unsigned = stripSpaces(cleaned.substring(1));
            if (unsigned.startsWith(CURRENCY_MARKER)) {
                // "-R$ 1,50" carries its sign before the marker
                sign = cleaned.substring(0, 1);
                cleaned = unsigned;
            }
        }
        if (cleaned.startsWith(CURRENCY_MARKER)) {
            cleaned = sign + stripSpaces(cleaned.substring(CURRENCY_MARKER.length()));
        }
        if (cleaned.endsWith("%")) {
            cleaned = stripSpaces(cleaned.substring(0, cleaned.length() - 1));
        }
        cleaned = cleaned.replace(".", "").replace(',', '.');

        if (!PLAIN_DECIMAL.matcher(cleaned).matches()) {
            LOGGER.debug("Discarding unparseable numeric text '{}'", raw);
            return null;
        }
        try {
            return Double.parseDouble(cleaned);
        } catch (NumberFormatException ex) {
            LOGGER.debug("Discarding unparseable numeric text '{}'", raw, ex);
            return null;
        }
    }

    private String stripSpaces(String value) {
        return value.replace(NON_BREAKING_SPACE, ' ').strip();
    }
}
