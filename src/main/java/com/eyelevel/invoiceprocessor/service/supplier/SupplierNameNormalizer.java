package com.eyelevel.invoiceprocessor.service.supplier;

import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;

/**
 * Reduces supplier names to a comparison key: lower case, no punctuation, no leading "the" and no
 * trailing legal suffix. Only one suffix is removed.
 */
public final class SupplierNameNormalizer {

    private static final List<String> LEGAL_SUFFIXES = List.of(
            " pty ltd", " limited", " ltd", " co", " company", " inc", " incorporated", " proprietary",
            " group", " holdings", " enterprises");

    private SupplierNameNormalizer() {
    }

    public static String normalize(final String name) {
        if (!StringUtils.hasText(name)) {
            return "";
        }
        String normalized = name.toLowerCase(Locale.ROOT)
                                .replaceAll("[.,']", "")
                                .replaceAll("\\s+", " ")
                                .trim();
        if (normalized.startsWith("the ")) {
            normalized = normalized.substring(4).trim();
        }
        for (String suffix : LEGAL_SUFFIXES) {
            if (normalized.endsWith(suffix)) {
                normalized = normalized.substring(0, normalized.length() - suffix.length()).trim();
                break;
            }
        }
        return normalized;
    }
}
