package io.regtruth.pipeline.conflict;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form of extracted rule values so that "25%", "25 %" and "25,0" compare equal.
 */
@Component
public class ValueNormalizer {

    private static final Pattern NUMERIC = Pattern.compile("-?\\d+(\\.\\d+)?");
    private static final Pattern DECIMAL_COMMA = Pattern.compile("^-?\\d+,\\d+$");
    private static final Pattern THOUSANDS_DOT = Pattern.compile("^-?[1-9]\\d{0,2}(\\.\\d{3})+(,\\d+)?$");

    public String normalize(String value) {
        if (value == null) {
            return "";
        }
        String compact = value.trim().toLowerCase(Locale.ROOT)
                .replace("%", "")
                .replace("eur", "")
                .replace("€", "")
                .replaceAll("\\s+", "");

        if (THOUSANDS_DOT.matcher(compact).matches()) {
            compact = compact.replace(".", "").replace(',', '.');
        } else if (DECIMAL_COMMA.matcher(compact).matches()) {
            compact = compact.replace(',', '.');
        }

        if (NUMERIC.matcher(compact).matches()) {
            BigDecimal number = new BigDecimal(compact).stripTrailingZeros();
            return number.scale() < 0 ? number.setScale(0).toPlainString() : number.toPlainString();
        }
        return value.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    public boolean differ(String a, String b) {
        return !normalize(a).equals(normalize(b));
    }
}
