package com.di.qualityguard.util;

import java.util.regex.Pattern;

/**
 * Converts raw cell text to typed values. Numbers are locale-invariant: a dot is the only
 * decimal separator, no grouping characters, no {@code NaN}/{@code Infinity} spellings.
 */
public final class TypeConverter {

    private TypeConverter() {}

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    public static boolean isNumeric(String text) {
        return text != null && DECIMAL.matcher(text).matches() && Double.isFinite(Double.parseDouble(text));
    }

    /**
     * @throws NumberFormatException when the text is not a finite locale-invariant decimal
     */
    public static double toDouble(String text) {
        if (text == null || !DECIMAL.matcher(text).matches()) {
            throw new NumberFormatException("Not a decimal number: " + text);
        }
        double value = Double.parseDouble(text);
        if (!Double.isFinite(value)) {
            throw new NumberFormatException("Out of range: " + text);
        }
        return value;
    }

    /** True only for the literals {@code true} and {@code false}, ignoring case. */
    public static boolean isBooleanLiteral(String text) {
        return "true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text);
    }
}
