/*
 * MarkupEvent.java
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One event of the flat tag stream produced by {@link MarkupEventReader}
 * and consumed by {@link TreeBuilder}.
 *
 * <p>START and EMPTY events carry an element name and its attributes,
 * END events carry the element name only, and TEXT events carry the
 * (already unescaped and trimmed) character content.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class MarkupEvent {

    /**
     * Enumeration of tag stream event types.
     */
    public enum Type {
        /** An opening tag whose content follows. */
        START,
        /** A closing tag. */
        END,
        /** A self-closing tag with no content. */
        EMPTY,
        /** A run of character data. */
        TEXT
    }

    private final Type type;
    private final String name;
    private final List<Attribute> attributes;
    private final String text;
    private final int lineNumber;
    private final int columnNumber;

    private MarkupEvent(Type type, String name, List<Attribute> attributes, String text,
                        int lineNumber, int columnNumber) {
        this.type = type;
        this.name = name;
        this.attributes = attributes;
        this.text = text;
        this.lineNumber = lineNumber;
        this.columnNumber = columnNumber;
    }

    public static MarkupEvent start(String name, List<Attribute> attributes) {
        return start(name, attributes, -1, -1);
    }

    public static MarkupEvent start(String name, List<Attribute> attributes,
                                    int lineNumber, int columnNumber) {
        return new MarkupEvent(Type.START, name, copy(attributes), null, lineNumber, columnNumber);
    }

    public static MarkupEvent end(String name) {
        return end(name, -1, -1);
    }

    public static MarkupEvent end(String name, int lineNumber, int columnNumber) {
        return new MarkupEvent(Type.END, name, Collections.<Attribute>emptyList(), null,
                lineNumber, columnNumber);
    }

    public static MarkupEvent empty(String name, List<Attribute> attributes) {
        return empty(name, attributes, -1, -1);
    }

    public static MarkupEvent empty(String name, List<Attribute> attributes,
                                    int lineNumber, int columnNumber) {
        return new MarkupEvent(Type.EMPTY, name, copy(attributes), null, lineNumber, columnNumber);
    }

    public static MarkupEvent text(String text) {
        return text(text, -1, -1);
    }

    public static MarkupEvent text(String text, int lineNumber, int columnNumber) {
        return new MarkupEvent(Type.TEXT, null, Collections.<Attribute>emptyList(),
                text != null ? text : "", lineNumber, columnNumber);
    }

    private static List<Attribute> copy(List<Attribute> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<Attribute>(attributes));
    }

    public Type getType() {
        return type;
    }

    /**
     * Returns the element name for START, END and EMPTY events.
     *
     * @return the element name, or {@code null} for TEXT events
     */
    public String getName() {
        return name;
    }

    /**
     * Returns the attributes of a START or EMPTY event in document order.
     *
     * @return an unmodifiable list, empty for END and TEXT events
     */
    public List<Attribute> getAttributes() {
        return attributes;
    }

    /**
     * Returns the character content of a TEXT event.
     *
     * @return the text, or {@code null} for other event types
     */
    public String getText() {
        return text;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public int getColumnNumber() {
        return columnNumber;
    }

    @Override
    public String toString() {
        switch (type) {
            case START:
                return "<" + name + attributes + ">";
            case END:
                return "</" + name + ">";
            case EMPTY:
                return "<" + name + attributes + "/>";
            default:
                return "TEXT{" + text + "}";
        }
    }

}
