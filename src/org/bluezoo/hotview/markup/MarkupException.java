/*
 * MarkupException.java
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
 * Exception thrown when a markup document cannot be turned into an
 * element tree. It carries the location of the problem where known.
 *
 * <p>A markup exception is fatal to the current parse attempt only.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class MarkupException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String systemId;
    private final int lineNumber;
    private final int columnNumber;

    public MarkupException(String message) {
        this(message, null, -1, -1);
    }

    /**
     * Creates a new markup exception with location information.
     *
     * @param message the error message
     * @param systemId the file or URI of the document, or {@code null}
     * @param lineNumber the 1-based line number, or -1 if unknown
     * @param columnNumber the 1-based column number, or -1 if unknown
     */
    public MarkupException(String message, String systemId, int lineNumber, int columnNumber) {
        super(formatMessage(message, systemId, lineNumber, columnNumber));
        this.systemId = systemId;
        this.lineNumber = lineNumber;
        this.columnNumber = columnNumber;
    }

    public MarkupException(String message, String systemId, int lineNumber, int columnNumber,
                           Throwable cause) {
        super(formatMessage(message, systemId, lineNumber, columnNumber), cause);
        this.systemId = systemId;
        this.lineNumber = lineNumber;
        this.columnNumber = columnNumber;
    }

    /**
     * Gets the system ID of the document where the error occurred.
     *
     * @return the system ID, or {@code null} if not available
     */
    public String getSystemId() {
        return systemId;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public int getColumnNumber() {
        return columnNumber;
    }

    private static String formatMessage(String message, String systemId, int lineNumber,
                                        int columnNumber) {
        StringBuilder sb = new StringBuilder();
        if (systemId != null) {
            sb.append(systemId);
        }
        if (lineNumber >= 0) {
            sb.append(':').append(lineNumber);
            if (columnNumber >= 0) {
                sb.append(':').append(columnNumber);
            }
        }
        if (sb.length() > 0) {
            sb.append(": ");
        }
        sb.append(message);
        return sb.toString();
    }

}
