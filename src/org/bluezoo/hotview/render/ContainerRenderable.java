/*
 * ContainerRenderable.java
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
 * A container: a styled box with children and optional text. When both are
 * present the text is laid out after the children.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ContainerRenderable extends Renderable {

    private final List<Renderable> children;
    private final String text;

    public ContainerRenderable(String tag, List<StyleOperation> operations,
                               List<Renderable> children, String text,
                               int lineNumber, int columnNumber) {
        super(tag, operations, lineNumber, columnNumber);
        this.children = Collections.unmodifiableList(children);
        this.text = text;
    }

    @Override
    public Kind getKind() {
        return Kind.CONTAINER;
    }

    public List<Renderable> getChildren() {
        return children;
    }

    /**
     * Returns the text content, or {@code null} if the container has none.
     */
    public String getText() {
        return text;
    }

    @Override
    public void accept(RenderableVisitor visitor) throws Exception {
        visitor.visitContainer(this);
    }

    @Override
    public String toString() {
        return "ContainerRenderable{tag=" + getTag() +
                ", operations=" + getOperations() +
                ", children=" + children.size() +
                (text != null ? ", text='" + text + '\'' : "") +
                '}';
    }

}
