package com.eyelevel.invoiceprocessor.service.analysis.parsing;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient parsing of the text values OCR reads off an invoice.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ExtractedValueParser {

    /**
     * Which kind of amount is being parsed. Unit prices keep up to four decimals, every other
     * amount is limited to two and rounded to cents.
     */
    public enum MoneyKind {
        UNIT_PRICE(4),
        LINE_TOTAL(2),
        TAX(2),
        OTHER(2);

        private final int maxDecimals;

        MoneyKind(int maxDecimals) {
            this.maxDecimals = maxDecimals;
        }
    }

    private static final Pattern US_GROUPED = Pattern.compile("^-?\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?$");
    private static final Pattern EU_GROUPED = Pattern.compile("^-?\\d{1,3}(?:\\.\\d{3})+(?:,\\d+)?$");
    private static final Pattern COMMA_GROUPED_INTEGER = Pattern.compile("^-?\\d{1,3}(?:,\\d{3})+$");
    private static final Pattern DOT_GROUPED_INTEGER = Pattern.compile("^-?\\d{1,3}(?:\\.\\d{3})+$");
    private static final Pattern NUMERIC = Pattern.compile("^-?[0-9.,]+$");
    private static final Pattern UNIT_TOKEN = Pattern.compile("^\\s*\\d+(?:\\.\\d+)?\\s*([A-Za-z]{1,10})\\s*$");

    private static final Set<String> KNOWN_UNITS = Set.of(
            "KG", "KILO", "KILOS", "KILOGRAM", "KILOGRAMS", "G", "GM", "GRAM", "GRAMS", "GR",
            "L", "LT", "LITRE", "LITRES", "LITER", "LITERS", "ML", "MILLILITRE", "MILLILITRES",
            "MILLILITER", "MILLILITERS",
            "UNIT", "UNITS", "EA", "EACH", "BOX", "CARTON", "CRTN", "CTN", "PACK", "PK", "BAG", "TRAY",
            "TUB", "ROLL", "BOTTLE");

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            formatter("yyyy-MM-dd"),
            formatter("d/M/yyyy"),
            formatter("d/M/yy"),
            formatter("d-M-yyyy"),
            formatter("d.M.yyyy"),
            formatter("d MMM yyyy"),
            formatter("d MMMM yyyy"),
            formatter("d-MMM-yyyy"),
            formatter("d-MMM-yy"),
            formatter("MMM d, yyyy"),
            formatter("MMMM d, yyyy"));

    /**
     * Parses an amount such as {@code "$1,234.50"}, {@code "1.234,50 EUR"} or {@code "(12.00)"}.
     * Parentheses denote a negative amount. Returns {@code null} when the text is not a number
     * or when the decimal separator is ambiguous.
     */
    public static BigDecimal parseMoney(final String text, final MoneyKind kind) {
        if (!StringUtils.hasText(text)) {
            return null;
        }
        String raw = text.replace('\u00A0', ' ').trim();
        boolean negative = false;
        if (raw.startsWith("(") && raw.endsWith(")") && raw.chars().anyMatch(Character::isDigit)) {
            raw = raw.substring(1, raw.length() - 1);
            negative = true;
        }

        String cleaned = raw.replaceAll("[A-Za-z]", "")
                            .replaceAll("[$€£¥]", "")
                            .replaceAll("\\s+", "");
        if (cleaned.startsWith("-")) {
            negative = true;
            cleaned = cleaned.substring(1);
        }
        cleaned = cleaned.replace("-", "");

        if (!NUMERIC.matcher(cleaned).matches() || cleaned.chars().noneMatch(Character::isDigit)) {
            return null;
        }

        final String normalized = normalizeSeparators(cleaned);
        if (normalized == null) {
            return null;
        }
        final int dot = normalized.indexOf('.');
        final int fractionDigits = dot < 0 ? 0 : normalized.length() - dot - 1;
        if (fractionDigits > kind.maxDecimals) {
            return null;
        }

        try {
            BigDecimal value = new BigDecimal(normalized);
            if (negative) {
                value = value.negate();
            }
            return kind == MoneyKind.UNIT_PRICE ? value : value.setScale(2, RoundingMode.HALF_UP);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Reads the leading number of a quantity such as {@code "8.42 KILO"} or {@code "2 UNIT"}.
     */
    public static BigDecimal parseQuantity(final String text) {
        if (!StringUtils.hasText(text)) {
            return null;
        }
        final String cleaned = text.replaceAll("[^0-9.-]", "");
        if (!StringUtils.hasText(cleaned)) {
            return null;
        }
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Extracts a known unit token from text like {@code "2 KG"}; {@code null} if there is none.
     */
    public static String extractUnitLabel(final String text) {
        if (!StringUtils.hasText(text)) {
            return null;
        }
        final Matcher matcher = UNIT_TOKEN.matcher(text);
        if (!matcher.matches()) {
            return null;
        }
        final String token = matcher.group(1).toUpperCase(Locale.ROOT);
        return KNOWN_UNITS.contains(token) ? token : null;
    }

    /**
     * Parses an invoice date. Numeric dates are read day-first.
     */
    public static LocalDate parseDate(final String text) {
        if (!StringUtils.hasText(text)) {
            return null;
        }
        final String trimmed = text.trim();
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(trimmed, format);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return null;
    }

    private static String normalizeSeparators(final String cleaned) {
        final boolean hasDot = cleaned.indexOf('.') >= 0;
        final boolean hasComma = cleaned.indexOf(',') >= 0;

        if (hasDot && hasComma) {
            final boolean decimalIsDot = cleaned.lastIndexOf('.') > cleaned.lastIndexOf(',');
            if (decimalIsDot) {
                return US_GROUPED.matcher(cleaned).matches() ? cleaned.replace(",", "") : null;
            }
            return EU_GROUPED.matcher(cleaned).matches() ? cleaned.replace(".", "").replace(',', '.') : null;
        }

        if (hasComma) {
            final String[] parts = cleaned.split(",", -1);
            if (parts.length > 2) {
                return COMMA_GROUPED_INTEGER.matcher(cleaned).matches() ? cleaned.replace(",", "") : null;
            }
            if (parts[1].length() == 2) {
                return parts[0] + "." + parts[1];
            }
            if (parts[1].length() == 3 && parts[0].length() >= 1 && parts[0].length() <= 3) {
                return parts[0] + parts[1];
            }
            return null;
        }

        if (hasDot && cleaned.indexOf('.') != cleaned.lastIndexOf('.')) {
            return DOT_GROUPED_INTEGER.matcher(cleaned).matches() ? cleaned.replace(".", "") : null;
        }
        return cleaned;
    }

    private static DateTimeFormatter formatter(final String pattern) {
        return new DateTimeFormatterBuilder().parseCaseInsensitive()
                                             .appendPattern(pattern)
                                             .toFormatter(Locale.ENGLISH);
    }
}
