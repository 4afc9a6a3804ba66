/*
 * ScalarOperation.java
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

package org.bluezoo.hotview.style;

/**
 * Sets a slot to a length, e.g. {@code height=2rem}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ScalarOperation extends StyleOperation {

    private final Length length;

    public ScalarOperation(String slot, Length length, String token, Origin origin) {
        super(slot, token, origin);
        this.length = length;
    }

    @Override
    public Kind getKind() {
        return Kind.SCALAR;
    }

    public Length getLength() {
        return length;
    }

    @Override
    public StyleOperation withSource(String token, Origin origin) {
        return new ScalarOperation(getSlot(), length, token, origin);
    }

    @Override
    protected String payloadString() {
        return length.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof ScalarOperation)) {
            return false;
        }
        ScalarOperation other = (ScalarOperation) obj;
        return getSlot().equals(other.getSlot()) && length.equals(other.length)
            && getOrigin() == other.getOrigin();
    }

    @Override
    public int hashCode() {
        return 31 * getSlot().hashCode() + length.hashCode();
    }

}
