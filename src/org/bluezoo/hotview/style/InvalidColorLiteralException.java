/*
 * InvalidColorLiteralException.java
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

/**
 * Thrown when a color literal is not {@code #} followed by exactly six
 * hexadecimal digits. The token produces no operation.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class InvalidColorLiteralException extends StyleException {

    private static final long serialVersionUID = 1L;

    private final String literal;

    public InvalidColorLiteralException(String message, String token, String literal) {
        super(message, token);
        this.literal = literal;
    }

    public String getLiteral() {
        return literal;
    }

}
