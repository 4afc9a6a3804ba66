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
 * A live-reloading UI markup engine.
 *
 * <p>hotview reads a UI description written in an XML-like markup,
 * resolves utility-class style tokens into typed style operations, and
 * hands a tree of render requests to a host rendering layer. The source
 * file is watched: every saved edit is reparsed and, if valid, published
 * as a new document.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link org.bluezoo.hotview.markup.MarkupParser} - Parses markup
 *       into element trees</li>
 *   <li>{@link org.bluezoo.hotview.style.AttributeResolver} - Resolves
 *       attributes and class tokens into style operations</li>
 *   <li>{@link org.bluezoo.hotview.render.RenderableFactory} - Builds
 *       render requests from element trees</li>
 *   <li>{@link org.bluezoo.hotview.reload.ReloadCoordinator} - Watches,
 *       reparses and publishes documents</li>
 * </ul>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see org.bluezoo.hotview.Hotview
 */
package org.bluezoo.hotview;
