/*
 * Unit.java
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
 * Units of a scalar {@link Length}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum Unit {

    /** Device-independent pixels. */
    PX("px"),
    /** Multiples of the root text size. */
    REM("rem");

    private final String suffix;

    Unit(String suffix) {
        this.suffix = suffix;
    }

    /**
     * Returns the literal suffix of this unit, e.g. {@code px}.
     */
    public String getSuffix() {
        return suffix;
    }

    /**
     * Returns the unit with the given literal suffix.
     *
     * @param suffix the suffix, compared case-sensitively
     * @return the unit, or {@code null} if no unit has that suffix
     */
    public static Unit forSuffix(String suffix) {
        for (Unit unit : values()) {
            if (unit.suffix.equals(suffix)) {
                return unit;
            }
        }
        return null;
    }

}
