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
 * Live reloading of markup documents.
 *
 * <p>A {@link org.bluezoo.hotview.reload.ReloadCoordinator} owns the
 * published {@link org.bluezoo.hotview.reload.MarkupDocument} for one
 * source file. A {@link org.bluezoo.hotview.reload.FileWatcher} reports
 * content changes in the file's directory tree; the coordinator debounces
 * them, reparses, swaps in the new document and notifies its
 * {@link org.bluezoo.hotview.reload.DocumentListener}s. A reparse that
 * fails leaves the previous document in place.
 *
 * <h2>Configuration</h2>
 *
 * <p>See {@link org.bluezoo.hotview.reload.ReloadConfiguration} for the
 * system properties controlling debounce, polling and watching.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.hotview.reload;
