/*
 * Attribute.java
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

/**
 * A single key/value attribute of a markup element.
 * Values are stored already unescaped.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Attribute {

    private final String key;
    private final String value;

    /**
     * Creates a new attribute.
     *
     * @param key the attribute name
     * @param value the attribute value, never null
     */
    public Attribute(String key, String value) {
        if (key == null) {
            throw new NullPointerException("key");
        }
        this.key = key;
        this.value = value != null ? value : "";
    }

    public String getKey() {
        return key;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        Attribute other = (Attribute) obj;
        return key.equals(other.key) && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return 31 * key.hashCode() + value.hashCode();
    }

    @Override
    public String toString() {
        return key + "=\"" + value + '"';
    }

}
