/*
 * FlagOperation.java
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
 * Sets a slot to a keyword value, e.g. {@code display=flex}.
 * Applying the same flag twice has the same effect as applying it once.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class FlagOperation extends StyleOperation {

    private final String value;

    public FlagOperation(String slot, String value, String token, Origin origin) {
        super(slot, token, origin);
        this.value = value;
    }

    @Override
    public Kind getKind() {
        return Kind.FLAG;
    }

    /**
     * Returns the keyword value, e.g. {@code flex} or {@code auto}.
     */
    public String getValue() {
        return value;
    }

    @Override
    public StyleOperation withSource(String token, Origin origin) {
        return new FlagOperation(getSlot(), value, token, origin);
    }

    @Override
    protected String payloadString() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof FlagOperation)) {
            return false;
        }
        FlagOperation other = (FlagOperation) obj;
        return getSlot().equals(other.getSlot()) && value.equals(other.value)
            && getOrigin() == other.getOrigin();
    }

    @Override
    public int hashCode() {
        return 31 * getSlot().hashCode() + value.hashCode();
    }

}
