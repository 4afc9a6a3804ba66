/*
 * ImageRenderable.java
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

import java.util.List;

/**
 * A raster image.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ImageRenderable extends Renderable {

    private final String source;

    public ImageRenderable(String tag, List<StyleOperation> operations, String source,
                           int lineNumber, int columnNumber) {
        super(tag, operations, lineNumber, columnNumber);
        if (source == null) {
            throw new NullPointerException("source");
        }
        this.source = source;
    }

    @Override
    public Kind getKind() {
        return Kind.IMAGE;
    }

    /**
     * Returns the image source as written in the markup.
     */
    public String getSource() {
        return source;
    }

    @Override
    public void accept(RenderableVisitor visitor) throws Exception {
        visitor.visitImage(this);
    }

    @Override
    public String toString() {
        return "ImageRenderable{source=" + source + ", operations=" + getOperations() + '}';
    }

}
