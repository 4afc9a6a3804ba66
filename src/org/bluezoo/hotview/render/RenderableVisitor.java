/*
 * RenderableVisitor.java
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

/**
 * Visitor interface for processing renderable trees.
 * The host rendering layer implements this to draw each kind of request.
 *
 * <p>Traversal is left to the visitor: {@link #visitContainer} is
 * responsible for visiting the container's children if it needs them.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface RenderableVisitor {

    /**
     * Visits a container.
     *
     * @param container the container
     * @throws Exception if processing fails
     */
    void visitContainer(ContainerRenderable container) throws Exception;

    /**
     * Visits an image.
     *
     * @param image the image
     * @throws Exception if processing fails
     */
    void visitImage(ImageRenderable image) throws Exception;

    /**
     * Visits a vector graphic.
     *
     * @param vector the vector graphic
     * @throws Exception if processing fails
     */
    void visitVector(VectorRenderable vector) throws Exception;

}
