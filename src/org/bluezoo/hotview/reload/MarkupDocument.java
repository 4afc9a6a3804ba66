/*
 * MarkupDocument.java
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

package org.bluezoo.hotview.reload;

import org.bluezoo.hotview.markup.ElementNode;

import java.nio.file.Path;

/**
 * An immutable snapshot of a successfully parsed markup file.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class MarkupDocument {

    private final ElementNode root;
    private final Path source;
    private final long timestamp;
    private final long generation;

    public MarkupDocument(ElementNode root, Path source, long timestamp, long generation) {
        this.root = root;
        this.source = source;
        this.timestamp = timestamp;
        this.generation = generation;
    }

    public ElementNode getRoot() {
        return root;
    }

    public Path getSource() {
        return source;
    }

    /**
     * Returns the time the parse completed, in milliseconds since the epoch.
     */
    public long getTimestamp() {
        return timestamp;
    }

    /**
     * Returns the sequence number of this document: 1 for the initial
     * parse, incremented for each published reparse.
     */
    public long getGeneration() {
        return generation;
    }

    @Override
    public String toString() {
        return "MarkupDocument{source=" + source +
                ", generation=" + generation +
                ", timestamp=" + timestamp +
                '}';
    }

}
