/*
 * TreeBuilder.java
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

import java.text.MessageFormat;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds an {@link ElementNode} tree from a tag stream.
 *
 * <p>The builder keeps a stack of in-progress elements:
 * <ul>
 * <li>START pushes a new element;</li>
 * <li>EMPTY builds an element and appends it to the element on top of
 *     the stack without pushing it;</li>
 * <li>END pops the top element and appends it to its parent, except for
 *     the root, which stays on the stack since it has no parent;</li>
 * <li>TEXT sets the text of the element on top of the stack, replacing
 *     any text set by an earlier run.</li>
 * </ul>
 * Once the root element has closed, a further START or EMPTY is a second
 * root and fails the build, while trailing TEXT is ignored.
 * When the stream is exhausted the remaining element is the root. A
 * stream without any element yields {@link ElementNode#errorPlaceholder()}
 * so that a transiently empty document does not fail the whole pipeline.
 *
 * <p>A builder holds no state between calls and may be shared.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class TreeBuilder {

    private static final Logger LOGGER = Logger.getLogger(TreeBuilder.class.getName());
    private static final ResourceBundle L10N = MarkupEventReader.L10N;

    /**
     * Builds a tree from the given events.
     *
     * @param events the tag stream
     * @return the root element
     * @throws MalformedMarkupException if the stream is structurally invalid
     */
    public ElementNode build(Iterable<MarkupEvent> events) throws MalformedMarkupException {
        return build(events, null);
    }

    /**
     * Builds a tree from the given events.
     *
     * @param events the tag stream
     * @param systemId the document system ID used in error messages
     * @return the root element
     * @throws MalformedMarkupException if the stream is structurally invalid
     */
    public ElementNode build(Iterable<MarkupEvent> events, String systemId)
            throws MalformedMarkupException {
        Deque<ElementNode.Builder> stack = new ArrayDeque<ElementNode.Builder>();
        boolean rootClosed = false;
        for (MarkupEvent event : events) {
            switch (event.getType()) {
                case START:
                    if (rootClosed) {
                        throw malformed("builder.multiple_roots", event, systemId, event.getName());
                    }
                    stack.push(new ElementNode.Builder(event.getName(), event.getAttributes(),
                            event.getLineNumber(), event.getColumnNumber()));
                    break;
                case EMPTY:
                    if (rootClosed) {
                        throw malformed("builder.multiple_roots", event, systemId, event.getName());
                    }
                    ElementNode.Builder empty = new ElementNode.Builder(event.getName(),
                            event.getAttributes(), event.getLineNumber(), event.getColumnNumber());
                    if (stack.isEmpty()) {
                        if (LOGGER.isLoggable(Level.FINE)) {
                            String message = L10N.getString("builder.orphan_empty");
                            LOGGER.fine(MessageFormat.format(message, event.getName()));
                        }
                    } else {
                        stack.peek().addChild(empty.build());
                    }
                    break;
                case END:
                    if (stack.isEmpty() || rootClosed) {
                        throw malformed("builder.unexpected_end", event, systemId, event.getName());
                    }
                    ElementNode.Builder current = stack.peek();
                    if (!current.getTag().equals(event.getName())) {
                        throw malformed("builder.mismatched_end", event, systemId,
                                event.getName(), current.getTag());
                    }
                    if (stack.size() == 1) {
                        rootClosed = true;
                    } else {
                        stack.pop();
                        stack.peek().addChild(current.build());
                    }
                    break;
                case TEXT:
                    if (rootClosed) {
                        if (LOGGER.isLoggable(Level.FINE)) {
                            String message = L10N.getString("builder.trailing_text");
                            LOGGER.fine(MessageFormat.format(message, systemId));
                        }
                    } else if (!stack.isEmpty()) {
                        stack.peek().setText(event.getText());
                    }
                    break;
                default:
                    break;
            }
        }
        if (stack.isEmpty()) {
            if (LOGGER.isLoggable(Level.FINE)) {
                String message = L10N.getString("builder.no_root");
                LOGGER.fine(MessageFormat.format(message, systemId));
            }
            return ElementNode.errorPlaceholder();
        }
        if (stack.size() > 1 || !rootClosed) {
            ElementNode.Builder unclosed = stack.peek();
            String message = MessageFormat.format(L10N.getString("builder.unclosed"),
                    unclosed.getTag());
            throw new MalformedMarkupException(message, systemId, -1, -1);
        }
        return stack.peek().build();
    }

    private static MalformedMarkupException malformed(String key, MarkupEvent event,
                                                      String systemId, Object... args) {
        String message = MessageFormat.format(L10N.getString(key), args);
        return new MalformedMarkupException(message, systemId,
                event.getLineNumber(), event.getColumnNumber());
    }

}
