/*
 * package-info.java
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

/**
 * Render requests built from element trees.
 *
 * <p>{@link org.bluezoo.hotview.render.RenderableFactory} turns an
 * {@link org.bluezoo.hotview.markup.ElementNode} tree into
 * {@link org.bluezoo.hotview.render.Renderable}s carrying their resolved
 * style operations. A host rendering layer consumes them by implementing
 * {@link org.bluezoo.hotview.render.RenderableVisitor}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.hotview.render;
