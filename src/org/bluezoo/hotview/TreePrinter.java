/*
 * TreePrinter.java
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

package org.bluezoo.hotview;

import org.bluezoo.hotview.render.ContainerRenderable;
import org.bluezoo.hotview.render.ImageRenderable;
import org.bluezoo.hotview.render.Renderable;
import org.bluezoo.hotview.render.RenderableVisitor;
import org.bluezoo.hotview.render.VectorRenderable;
import org.bluezoo.hotview.style.StyleOperation;

import java.io.PrintWriter;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Prints a renderable tree as indented text, one renderable per line.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class TreePrinter implements RenderableVisitor {

    private static final String INDENT = "  ";

    private final PrintWriter out;
    private int depth;

    public TreePrinter(PrintWriter out) {
        this.out = out;
    }

    /**
     * Prints a container and all of its descendants. Descendants are
     * printed from an explicit stack rather than by visiting them, so
     * deep trees do not exhaust the thread stack.
     */
    @Override
    public void visitContainer(ContainerRenderable container) {
        int base = depth;
        Deque<Renderable> pending = new ArrayDeque<Renderable>();
        Deque<Integer> levels = new ArrayDeque<Integer>();
        pending.push(container);
        levels.push(depth);
        try {
            while (!pending.isEmpty()) {
                Renderable renderable = pending.pop();
                depth = levels.pop();
                out.println(describe(renderable));
                if (renderable.getKind() == Renderable.Kind.CONTAINER) {
                    List<Renderable> children = ((ContainerRenderable) renderable).getChildren();
                    for (int i = children.size() - 1; i >= 0; i--) {
                        pending.push(children.get(i));
                        levels.push(depth + 1);
                    }
                }
            }
        } finally {
            depth = base;
        }
    }

    @Override
    public void visitImage(ImageRenderable image) {
        out.println(describe(image));
    }

    @Override
    public void visitVector(VectorRenderable vector) {
        out.println(describe(vector));
    }

    private StringBuilder describe(Renderable renderable) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < depth; i++) {
            line.append(INDENT);
        }
        line.append(renderable.getTag());
        List<StyleOperation> operations = renderable.getOperations();
        if (!operations.isEmpty()) {
            line.append(' ').append(operations);
        }
        switch (renderable.getKind()) {
            case CONTAINER:
                String text = ((ContainerRenderable) renderable).getText();
                if (text != null) {
                    line.append(" \"").append(text).append('"');
                }
                break;
            case IMAGE:
                line.append(" src=").append(((ImageRenderable) renderable).getSource());
                break;
            case VECTOR:
                line.append(" path=").append(((VectorRenderable) renderable).getPath());
                break;
            default:
                break;
        }
        return line;
    }

}
