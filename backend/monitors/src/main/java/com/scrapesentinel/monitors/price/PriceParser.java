package com.scrapesentinel.monitors.price;

import com.scrapesentinel.core.error.PriceParseException;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns scraped price text such as {@code "$1,234.56"}, {@code "1.234,56 €"} or {@code "CHF 1'299.-"}
 * into a fixed-point decimal.
 */
public final class PriceParser {
    private static final Pattern NUMBER = Pattern.compile("\\d[\\d.,'\\u00A0\\u202F ]*");
    private static final Pattern GROUPING = Pattern.compile("['\\u00A0\\u202F ]");

    private PriceParser() {
    }

    public static BigDecimal parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new PriceParseException(raw, "Price is empty");
        }
        Matcher matcher = NUMBER.matcher(raw);
        if (!matcher.find()) {
            throw new PriceParseException(raw, "No digits in price '" + raw + "'");
        }
        if (matcher.start() > 0 && raw.charAt(matcher.start() - 1) == '-') {
            throw new PriceParseException(raw, "Negative price '" + raw + "'");
        }

        String token = GROUPING.matcher(matcher.group()).replaceAll("");
        while (!token.isEmpty() && !Character.isDigit(token.charAt(token.length() - 1))) {
            token = token.substring(0, token.length() - 1);
        }

        try {
            return new BigDecimal(normalizeSeparators(token));
        } catch (NumberFormatException e) {
            throw new PriceParseException(raw, "Unparsable price '" + raw + "'");
        }
    }

    static String normalizeSeparators(String token) {
        int lastComma = token.lastIndexOf(',');
        int lastDot = token.lastIndexOf('.');
        if (lastComma >= 0 && lastDot >= 0) {
            if (lastComma > lastDot) {
                return token.replace(".", "").replace(',', '.');
            }
            return token.replace(",", "");
        }
        if (lastComma >= 0) {
            boolean singleComma = token.indexOf(',') == lastComma;
            int decimals = token.length() - lastComma - 1;
            if (singleComma && decimals > 0 && decimals <= 2) {
                return token.replace(',', '.');
            }
            return token.replace(",", "");
        }
        if (lastDot >= 0 && token.indexOf('.') != lastDot) {
            return token.replace(".", "");
        }
        return token;
    }
}
