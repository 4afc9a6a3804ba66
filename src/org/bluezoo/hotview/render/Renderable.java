/*
 * Renderable.java
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

package org.bluezoo.hotview.render;

import org.bluezoo.hotview.style.StyleOperation;

import java.util.Collections;
import java.util.List;

/**
 * A render request for one element: what to draw and the style operations
 * to apply to it. The set of kinds is closed; hosts dispatch on it through
 * a {@link RenderableVisitor}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class Renderable {

    /**
     * Enumeration of renderable kinds.
     */
    public enum Kind {
        /** A box holding children and optional text. */
        CONTAINER,
        /** A raster image loaded from a source. */
        IMAGE,
        /** A vector graphic loaded from a path. */
        VECTOR
    }

    private final String tag;
    private final List<StyleOperation> operations;
    private final int lineNumber;
    private final int columnNumber;

    protected Renderable(String tag, List<StyleOperation> operations,
                         int lineNumber, int columnNumber) {
        this.tag = tag;
        this.operations = Collections.unmodifiableList(operations);
        this.lineNumber = lineNumber;
        this.columnNumber = columnNumber;
    }

    public abstract Kind getKind();

    /**
     * Returns the tag of the element this request was created from.
     */
    public String getTag() {
        return tag;
    }

    /**
     * Returns the style operations in the order they are to be applied.
     */
    public List<StyleOperation> getOperations() {
        return operations;
    }

    /**
     * Returns the line of the source element, or -1 if not available.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * Returns the column of the source element, or -1 if not available.
     */
    public int getColumnNumber() {
        return columnNumber;
    }

    /**
     * Accepts a visitor for processing this renderable.
     *
     * @param visitor the visitor to accept
     * @throws Exception if the visitor encounters an error
     */
    public abstract void accept(RenderableVisitor visitor) throws Exception;

}
