/*
 * RenderableFactory.java
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

import org.bluezoo.hotview.markup.ElementNode;
import org.bluezoo.hotview.style.AttributeResolver;
import org.bluezoo.hotview.style.StyleOperation;
import org.bluezoo.hotview.style.StyleResolution;

import java.text.MessageFormat;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Converts element trees into renderable trees.
 *
 * <p>{@code img} elements become {@link ImageRenderable}s and require a
 * {@code src} attribute; {@code svg} elements become
 * {@link VectorRenderable}s and require a {@code path} attribute; every
 * other tag becomes a {@link ContainerRenderable}. An element whose
 * required attribute is missing is rendered as a container carrying an
 * error text, leaving the rest of the tree intact.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class RenderableFactory {

    private static final Logger LOGGER = Logger.getLogger(RenderableFactory.class.getName());
    private static final ResourceBundle L10N =
        ResourceBundle.getBundle("org.bluezoo.hotview.render.L10N");

    public static final String IMAGE_TAG = "img";
    public static final String VECTOR_TAG = "svg";

    private final AttributeResolver resolver;

    public RenderableFactory() {
        this(new AttributeResolver());
    }

    public RenderableFactory(AttributeResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Creates the renderable tree for a document root. The root must
     * render as a container; anything else is replaced by a container
     * holding an error text.
     *
     * @param root the root element
     * @return the root renderable, always a container
     */
    public ContainerRenderable createRoot(ElementNode root) {
        Renderable renderable = create(root);
        if (renderable.getKind() == Renderable.Kind.CONTAINER) {
            return (ContainerRenderable) renderable;
        }
        if (LOGGER.isLoggable(Level.WARNING)) {
            String message = L10N.getString("warn.root_not_container");
            LOGGER.warning(MessageFormat.format(message, root.getTag()));
        }
        return errorContainer(root, renderable.getOperations(),
                L10N.getString("error.root_not_container"));
    }

    /**
     * Creates the renderable for an element and, for containers, its
     * descendants. The tree is walked with an explicit stack, so
     * arbitrarily deep documents can be converted.
     *
     * @param node the element
     * @return the renderable
     */
    public Renderable create(ElementNode node) {
        Deque<PendingContainer> stack = new ArrayDeque<PendingContainer>();
        Renderable result = open(node, stack);
        while (!stack.isEmpty()) {
            PendingContainer pending = stack.peek();
            List<ElementNode> children = pending.node.getChildren();
            if (pending.next < children.size()) {
                Renderable leaf = open(children.get(pending.next++), stack);
                if (leaf != null) {
                    pending.children.add(leaf);
                }
            } else {
                stack.pop();
                ElementNode done = pending.node;
                ContainerRenderable container = new ContainerRenderable(done.getTag(),
                        pending.operations, pending.children, done.getText(),
                        done.getLineNumber(), done.getColumnNumber());
                if (stack.isEmpty()) {
                    result = container;
                } else {
                    stack.peek().children.add(container);
                }
            }
        }
        return result;
    }

    /**
     * Resolves an element's style and either returns its finished
     * renderable or, for a container, pushes it so that its children are
     * converted first.
     *
     * @return the renderable, or null if the element was pushed
     */
    private Renderable open(ElementNode node, Deque<PendingContainer> stack) {
        StyleResolution style = resolver.resolve(node);
        if (style.hasProblems() && LOGGER.isLoggable(Level.FINE)) {
            String message = L10N.getString("fine.style_problems");
            LOGGER.fine(MessageFormat.format(message, node.getTag(), style.getProblems().size()));
        }
        List<StyleOperation> operations = style.getOperations();
        String tag = node.getTag();
        try {
            if (IMAGE_TAG.equals(tag)) {
                String source = requireAttribute(node, AttributeResolver.SOURCE);
                ignoreChildren(node);
                return new ImageRenderable(tag, operations, source,
                        node.getLineNumber(), node.getColumnNumber());
            } else if (VECTOR_TAG.equals(tag)) {
                String path = requireAttribute(node, AttributeResolver.PATH);
                ignoreChildren(node);
                return new VectorRenderable(tag, operations, path,
                        node.getLineNumber(), node.getColumnNumber());
            }
        } catch (MissingRequiredAttributeException e) {
            if (LOGGER.isLoggable(Level.WARNING)) {
                String message = L10N.getString("warn.degraded");
                LOGGER.warning(MessageFormat.format(message, tag,
                        node.getLineNumber(), e.getMessage()));
            }
            return errorContainer(node, operations, e.getMessage());
        }
        stack.push(new PendingContainer(node, operations));
        return null;
    }

    private static String requireAttribute(ElementNode node, String key)
            throws MissingRequiredAttributeException {
        String value = node.getAttribute(key);
        if (value == null) {
            String message = MessageFormat.format(L10N.getString("error.missing_attribute"),
                    node.getTag(), key);
            throw new MissingRequiredAttributeException(message, node.getTag(), key);
        }
        return value;
    }

    private static void ignoreChildren(ElementNode node) {
        int count = node.getChildren().size();
        if (count > 0 && LOGGER.isLoggable(Level.FINE)) {
            String message = L10N.getString("fine.children_ignored");
            LOGGER.fine(MessageFormat.format(message, count, node.getTag()));
        }
    }

    private static ContainerRenderable errorContainer(ElementNode node,
                                                      List<StyleOperation> operations,
                                                      String text) {
        return new ContainerRenderable(node.getTag(), operations,
                Collections.<Renderable>emptyList(), text,
                node.getLineNumber(), node.getColumnNumber());
    }

    // A container whose children are still being converted
    private static final class PendingContainer {

        final ElementNode node;
        final List<StyleOperation> operations;
        final List<Renderable> children;
        int next;

        PendingContainer(ElementNode node, List<StyleOperation> operations) {
            this.node = node;
            this.operations = operations;
            this.children = new ArrayList<Renderable>(node.getChildren().size());
        }

    }

}
