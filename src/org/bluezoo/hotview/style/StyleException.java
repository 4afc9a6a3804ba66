/*
 * StyleException.java
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
 * A problem met while resolving a single attribute value or class token.
 * Style exceptions are scoped to the offending token: they are collected
 * in the {@link StyleResolution} and never abort the resolution of the
 * other tokens of an element.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class StyleException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String token;

    public StyleException(String message, String token) {
        super(token != null ? token + ": " + message : message);
        this.token = token;
    }

    /**
     * Returns the attribute value or class token that failed to resolve.
     */
    public String getToken() {
        return token;
    }

}
