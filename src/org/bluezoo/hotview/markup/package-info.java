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
 * Markup parsing.
 *
 * <p>Markup is read in two steps. {@link org.bluezoo.hotview.markup.MarkupEventReader}
 * tokenizes the source with a SAX parser into a flat stream of
 * {@link org.bluezoo.hotview.markup.MarkupEvent}s, and
 * {@link org.bluezoo.hotview.markup.TreeBuilder} assembles the stream into
 * an immutable {@link org.bluezoo.hotview.markup.ElementNode} tree.
 * {@link org.bluezoo.hotview.markup.MarkupParser} runs both.
 *
 * <h2>Markup</h2>
 *
 * <pre>{@code
 * <div class="flex flex-col p-4 gap-2" bg="#1e1e2e">
 *   <div class="text-lg font-bold" color="#cdd6f4">Hello</div>
 *   <img src="logo.png" class="w-16 h-16"/>
 * </div>
 * }</pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.hotview.markup;
