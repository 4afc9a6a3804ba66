/*
 * Length.java
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
 * A numeric length with a unit, the payload of a {@link ScalarOperation}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Length {

    /** Zero pixels, the fallback for unparseable length literals. */
    public static final Length ZERO = new Length(0f, Unit.PX);

    private final float value;
    private final Unit unit;

    public Length(float value, Unit unit) {
        if (unit == null) {
            throw new NullPointerException("unit");
        }
        this.value = value;
        this.unit = unit;
    }

    public static Length px(float value) {
        return new Length(value, Unit.PX);
    }

    public static Length rem(float value) {
        return new Length(value, Unit.REM);
    }

    public float getValue() {
        return value;
    }

    public Unit getUnit() {
        return unit;
    }

    public boolean isZero() {
        return value == 0f;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Length)) {
            return false;
        }
        Length other = (Length) obj;
        return Float.compare(value, other.value) == 0 && unit == other.unit;
    }

    @Override
    public int hashCode() {
        return 31 * Float.floatToIntBits(value) + unit.hashCode();
    }

    @Override
    public String toString() {
        if (value == (int) value) {
            return Integer.toString((int) value) + unit.getSuffix();
        }
        return Float.toString(value) + unit.getSuffix();
    }

}
