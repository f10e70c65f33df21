/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.tablebackup.util;

import java.util.Iterator;
import java.util.function.Function;

import io.tablebackup.annotation.Immutable;

/**
 * String-related utility methods.
 */
@Immutable
public final class Strings {

    /**
     * Returns a new String composed of the supplied values joined together with a copy of the specified {@code delimiter}.
     *
     * @param delimiter the delimiter that separates each element
     * @param values the values to join together.
     * @return a new {@code String} that is composed of the {@code elements} separated by the {@code delimiter}
     */
    public static <T> String join(CharSequence delimiter, Iterable<T> values) {
        return join(delimiter, values, v -> v != null ? v.toString() : null);
    }

    /**
     * Returns a new String composed of the supplied values joined together with a copy of the specified {@code delimiter}.
     * Null values and values converted to null are skipped.
     *
     * @param delimiter the delimiter that separates each element
     * @param values the values to join together.
     * @param conversion the function that converts the supplied values into strings
     * @return a new {@code String} that is composed of the {@code elements} separated by the {@code delimiter}
     */
    public static <T> String join(CharSequence delimiter, Iterable<T> values, Function<T, String> conversion) {
        StringBuilder sb = new StringBuilder();
        Iterator<T> iter = values.iterator();
        while (iter.hasNext()) {
            String value = conversion.apply(iter.next());
            if (value == null) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(delimiter);
            }
            sb.append(value);
        }
        return sb.toString();
    }

    /**
     * Check if the string is empty or null.
     *
     * @param str the string to check
     * @return {@code true} if the string is empty or null
     */
    public static boolean isNullOrEmpty(String str) {
        return str == null || str.isEmpty();
    }

    /**
     * Check if the string is blank (i.e. it's blank or only contains whitespace characters) or null.
     *
     * @param str the string to check
     * @return {@code true} if the string is blank or null
     */
    public static boolean isNullOrBlank(String str) {
        return str == null || str.trim().isEmpty();
    }

    /**
     * Check whether the string consists only of ASCII hexadecimal digits, in either case. Other Unicode digits, such as
     * fullwidth or Arabic-Indic ones, are not accepted.
     *
     * @param str the string to check
     * @return {@code true} if the string is non-empty and every character is one of {@code 0-9}, {@code a-f} or {@code A-F}
     */
    public static boolean isHexadecimal(String str) {
        if (isNullOrEmpty(str)) {
            return false;
        }
        for (int i = 0; i != str.length(); ++i) {
            if (!isHexDigit(str.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isHexDigit(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    /**
     * Removes the surrounding quote characters of an identifier part, if present, and collapses doubled
     * quote characters inside it.
     *
     * @param identifierPart the identifier part, possibly quoted
     * @param quotingChar the quoting character
     * @return the unquoted identifier part; null only if the input is null
     */
    public static String unquoteIdentifierPart(String identifierPart, char quotingChar) {
        if (identifierPart == null || identifierPart.length() < 2) {
            return identifierPart;
        }
        if (identifierPart.charAt(0) == quotingChar && identifierPart.charAt(identifierPart.length() - 1) == quotingChar) {
            String doubled = String.valueOf(quotingChar) + quotingChar;
            return identifierPart.substring(1, identifierPart.length() - 1).replace(doubled, String.valueOf(quotingChar));
        }
        return identifierPart;
    }

    private Strings() {
    }
}
