/*
 * StyleLiterals.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of hotview, a live-reloading UI markup engine.
 *
 * hotview is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * hotview is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with hotview.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.hotview.style;

import java.text.MessageFormat;
import java.util.ResourceBundle;

/**
 * Parsing of the literal values embedded in attributes and parameterized
 * class tokens.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class StyleLiterals {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.hotview.style.L10N");

    private StyleLiterals() {
    }

    /**
     * Parses a hex color of the form {@code #RRGGBB}. Only the ASCII
     * digits and letters {@code a-f}/{@code A-F} are accepted.
     *
     * @param literal the literal
     * @param token the token the literal was taken from, for diagnostics
     * @return the color packed as {@code 0xRRGGBB}
     * @throws InvalidColorLiteralException if the literal is malformed
     */
    public static int parseColor(String literal, String token) throws InvalidColorLiteralException {
        String value = literal.trim();
        if (!value.startsWith("#") || value.length() != 7) {
            String message = MessageFormat.format(L10N.getString("err.color_format"), literal);
            throw new InvalidColorLiteralException(message, token, literal);
        }
        int rgb = 0;
        for (int i = 1; i < 7; i++) {
            int digit = hexDigit(value.charAt(i));
            if (digit < 0) {
                String message = MessageFormat.format(L10N.getString("err.color_digit"),
                        literal, String.valueOf(value.charAt(i)));
                throw new InvalidColorLiteralException(message, token, literal);
            }
            rgb = (rgb << 4) | digit;
        }
        return rgb;
    }

    private static int hexDigit(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        } else if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        } else if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        return -1;
    }

    /**
     * Parses a length literal such as {@code 12px} or {@code 0.5rem}.
     * The number is the longest leading run of digits and decimal points,
     * the unit is the remainder. A bare {@code 0} is zero pixels.
     *
     * @param literal the literal
     * @param token the token the literal was taken from, for diagnostics
     * @return the length
     * @throws InvalidLengthLiteralException if the number or unit is invalid
     */
    public static Length parseLength(String literal, String token)
            throws InvalidLengthLiteralException {
        String value = literal.trim();
        int end = 0;
        while (end < value.length()) {
            char c = value.charAt(end);
            if ((c < '0' || c > '9') && c != '.') {
                break;
            }
            end++;
        }
        if (end == 0) {
            String message = MessageFormat.format(L10N.getString("err.length_number"), literal);
            throw new InvalidLengthLiteralException(message, token, literal);
        }
        float number;
        try {
            number = Float.parseFloat(value.substring(0, end));
        } catch (NumberFormatException e) {
            String message = MessageFormat.format(L10N.getString("err.length_number"), literal);
            InvalidLengthLiteralException ile =
                new InvalidLengthLiteralException(message, token, literal);
            ile.initCause(e);
            throw ile;
        }
        String suffix = value.substring(end);
        if (suffix.isEmpty() && number == 0f) {
            return Length.ZERO;
        }
        Unit unit = Unit.forSuffix(suffix);
        if (unit == null) {
            String message = MessageFormat.format(L10N.getString("err.length_unit"),
                    literal, suffix);
            throw new InvalidLengthLiteralException(message, token, literal);
        }
        return new Length(number, unit);
    }

}
