/*
 * MalformedMarkupException.java
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

package org.bluezoo.hotview.markup;

/**
 * Thrown by the {@link TreeBuilder} when the tag stream is structurally
 * invalid: an end tag that does not match the innermost open element, a
 * start tag left open at end of stream, or a second root element.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class MalformedMarkupException extends MarkupException {

    private static final long serialVersionUID = 1L;

    public MalformedMarkupException(String message, String systemId, int lineNumber,
                                    int columnNumber) {
        super(message, systemId, lineNumber, columnNumber);
    }

}
