/*
 * ColorOperation.java
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
 * Sets a slot to an RGB color.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ColorOperation extends StyleOperation {

    private final int rgb;

    /**
     * Creates a color operation.
     *
     * @param slot the slot written
     * @param rgb the color as {@code 0xRRGGBB}
     * @param token the source token
     * @param origin the source origin
     */
    public ColorOperation(String slot, int rgb, String token, Origin origin) {
        super(slot, token, origin);
        this.rgb = rgb & 0xffffff;
    }

    @Override
    public Kind getKind() {
        return Kind.COLOR;
    }

    /**
     * Returns the color packed as {@code 0xRRGGBB}.
     */
    public int getRgb() {
        return rgb;
    }

    public int getRed() {
        return (rgb >> 16) & 0xff;
    }

    public int getGreen() {
        return (rgb >> 8) & 0xff;
    }

    public int getBlue() {
        return rgb & 0xff;
    }

    @Override
    public StyleOperation withSource(String token, Origin origin) {
        return new ColorOperation(getSlot(), rgb, token, origin);
    }

    @Override
    protected String payloadString() {
        return String.format("#%06x", rgb);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof ColorOperation)) {
            return false;
        }
        ColorOperation other = (ColorOperation) obj;
        return getSlot().equals(other.getSlot()) && rgb == other.rgb
            && getOrigin() == other.getOrigin();
    }

    @Override
    public int hashCode() {
        return 31 * getSlot().hashCode() + rgb;
    }

}
