/*
 * ElementNode.java
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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * One element of a parsed markup tree.
 *
 * <p>An element node has a tag name, at most one text payload, an
 * ordered list of attributes (duplicate keys are allowed, lookups return
 * the last occurrence) and an ordered list of child elements in document
 * order. Nodes are immutable once built: all lists returned are
 * unmodifiable, and the tree is assembled bottom-up by
 * {@link TreeBuilder} through {@link Builder}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ElementNode {

    /** Tag name of the placeholder node returned for an empty document. */
    public static final String ERROR_TAG = "error";

    private final String tag;
    private final String text;
    private final List<Attribute> attributes;
    private final List<ElementNode> children;
    private final int lineNumber;
    private final int columnNumber;

    private ElementNode(Builder builder) {
        this.tag = builder.tag;
        this.text = builder.text;
        this.attributes = Collections.unmodifiableList(new ArrayList<Attribute>(builder.attributes));
        this.children = Collections.unmodifiableList(new ArrayList<ElementNode>(builder.children));
        this.lineNumber = builder.lineNumber;
        this.columnNumber = builder.columnNumber;
    }

    /**
     * Returns the placeholder node used when a document has no root
     * element: tag {@code error}, text {@code error}.
     *
     * @return a new placeholder node
     */
    public static ElementNode errorPlaceholder() {
        Builder builder = new Builder(ERROR_TAG, Collections.<Attribute>emptyList(), -1, -1);
        builder.setText(ERROR_TAG);
        return builder.build();
    }

    public String getTag() {
        return tag;
    }

    /**
     * Returns the text directly contained in this element.
     *
     * @return the text, or {@code null} if the element has none
     */
    public String getText() {
        return text;
    }

    public boolean hasText() {
        return text != null;
    }

    public List<Attribute> getAttributes() {
        return attributes;
    }

    /**
     * Returns the value of the last attribute with the given key.
     *
     * @param key the attribute name
     * @return the value, or {@code null} if absent
     */
    public String getAttribute(String key) {
        for (int i = attributes.size() - 1; i >= 0; i--) {
            Attribute attribute = attributes.get(i);
            if (attribute.getKey().equals(key)) {
                return attribute.getValue();
            }
        }
        return null;
    }

    public List<ElementNode> getChildren() {
        return children;
    }

    public boolean isErrorPlaceholder() {
        return ERROR_TAG.equals(tag) && children.isEmpty() && ERROR_TAG.equals(text);
    }

    /**
     * Counts this node and all of its descendants.
     *
     * @return the number of nodes in this subtree
     */
    public int countNodes() {
        int count = 0;
        Deque<ElementNode> pending = new ArrayDeque<ElementNode>();
        pending.push(this);
        while (!pending.isEmpty()) {
            ElementNode node = pending.pop();
            count++;
            for (ElementNode child : node.children) {
                pending.push(child);
            }
        }
        return count;
    }

    /**
     * Line of the start tag this node was built from.
     *
     * @return the 1-based line number, or -1 if not known
     */
    public int getLineNumber() {
        return lineNumber;
    }

    public int getColumnNumber() {
        return columnNumber;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        buf.append('<').append(tag);
        for (Attribute attribute : attributes) {
            buf.append(' ').append(attribute);
        }
        buf.append('>');
        if (text != null) {
            buf.append(text);
        }
        buf.append(" (").append(children.size()).append(" children)");
        return buf.toString();
    }

    /**
     * Mutable, in-progress form of an element used while the tree is
     * being assembled. Children are added already built, so building a
     * node never walks its subtree. Never exposed through a built tree.
     */
    public static final class Builder {

        private final String tag;
        private final List<Attribute> attributes;
        private final List<ElementNode> children = new ArrayList<ElementNode>();
        private final int lineNumber;
        private final int columnNumber;
        private String text;

        public Builder(String tag, List<Attribute> attributes, int lineNumber, int columnNumber) {
            this.tag = tag;
            this.attributes = attributes != null ? attributes : Collections.<Attribute>emptyList();
            this.lineNumber = lineNumber;
            this.columnNumber = columnNumber;
        }

        public String getTag() {
            return tag;
        }

        /**
         * Sets the text payload, replacing any text set earlier.
         */
        public void setText(String text) {
            this.text = text;
        }

        public void addChild(ElementNode child) {
            children.add(child);
        }

        public ElementNode build() {
            return new ElementNode(this);
        }

    }

}
