package com.flagship.budget_reconciliation.polog;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Quantity, rate and overtime read from the log's free-text factors column,
 * e.g. {@code "12 hrs x 50 + 100 OT"}.
 */
@Value
public class Factors {

    private static final Pattern QUANTITY_TIMES_RATE = Pattern.compile(
        "(-?\\d+(?:\\.\\d+)?)\\s*\\w*\\s*x\\s*(-?\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE);

    private static final Pattern ADDITIVE = Pattern.compile(
        "\\+\\s*\\$?(-?\\d+(?:\\.\\d+)?)\\s*(?:OT|Misc)?", Pattern.CASE_INSENSITIVE);

    BigDecimal quantity;
    BigDecimal rate;
    BigDecimal ot;

    /**
     * Reads factors; a missing {@code quantity x rate} part yields quantity 1 and
     * rate = subtotal, a missing additive part yields OT 0.
     */
    public static Factors parse(String text, BigDecimal subtotal) {
        String cleaned = text == null ? "" : text.replace(",", "").replaceAll("\\s+", " ").trim();

        BigDecimal quantity = BigDecimal.ONE;
        BigDecimal rate = subtotal;
        Matcher main = QUANTITY_TIMES_RATE.matcher(cleaned);
        if (main.find()) {
            quantity = new BigDecimal(main.group(1));
            rate = new BigDecimal(main.group(2));
        }

        BigDecimal ot = BigDecimal.ZERO;
        Matcher additive = ADDITIVE.matcher(cleaned);
        if (additive.find()) {
            ot = new BigDecimal(additive.group(1));
        }
        return new Factors(quantity, rate, ot);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s x %s + %s", quantity, rate, ot);
    }
}
