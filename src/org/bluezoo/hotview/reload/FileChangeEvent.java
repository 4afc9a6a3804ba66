/*
 * FileChangeEvent.java
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

import java.nio.file.Path;

/**
 * A classified filesystem change.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class FileChangeEvent {

    /**
     * Enumeration of change kinds.
     */
    public enum Kind {
        /** The content of a file changed. */
        DATA,
        /** A file was touched without changing its content. */
        METADATA,
        /** A directory was created. */
        CREATE,
        /** A file or directory was deleted. */
        DELETE,
        /** Events were lost. */
        OVERFLOW
    }

    private final Kind kind;
    private final Path path;

    public FileChangeEvent(Kind kind, Path path) {
        this.kind = kind;
        this.path = path;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Returns the affected path. For an overflow this is the watched
     * directory.
     */
    public Path getPath() {
        return path;
    }

    /**
     * Indicates whether this event reports a content write.
     */
    public boolean isDataChange() {
        return kind == Kind.DATA;
    }

    @Override
    public String toString() {
        return kind + " " + path;
    }

}
