package com.farearound.search.util;

import com.farearound.search.constants.SearchConstants;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Location-code helpers shared by validation and request normalization.
 * For general string operations, prefer org.springframework.util.StringUtils
 */
public final class StringUtils {

    private static final Pattern IATA_CODE = Pattern.compile(SearchConstants.IATA_CODE_PATTERN);

    private StringUtils() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Trims and upper-cases an IATA code; blank input yields {@code null}.
     */
    public static String normalizeLocationCode(String code) {
        if (!org.springframework.util.StringUtils.hasText(code)) {
            return null;
        }
        return code.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * True for three ASCII letters in either case, ignoring surrounding whitespace.
     */
    public static boolean isIataCode(String code) {
        return code != null && IATA_CODE.matcher(code.trim()).matches();
    }
}
