/*
 * FractionOperation.java
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
 * Sets a slot to a fraction of the containing extent, e.g.
 * {@code width=2/3}. The keyword {@code full} resolves to 1/1.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class FractionOperation extends StyleOperation {

    private final int numerator;
    private final int denominator;

    public FractionOperation(String slot, int numerator, int denominator, String token,
                             Origin origin) {
        super(slot, token, origin);
        if (denominator <= 0) {
            throw new IllegalArgumentException("denominator: " + denominator);
        }
        this.numerator = numerator;
        this.denominator = denominator;
    }

    @Override
    public Kind getKind() {
        return Kind.FRACTION;
    }

    public int getNumerator() {
        return numerator;
    }

    public int getDenominator() {
        return denominator;
    }

    public float floatValue() {
        return (float) numerator / denominator;
    }

    @Override
    public StyleOperation withSource(String token, Origin origin) {
        return new FractionOperation(getSlot(), numerator, denominator, token, origin);
    }

    @Override
    protected String payloadString() {
        return numerator + "/" + denominator;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof FractionOperation)) {
            return false;
        }
        FractionOperation other = (FractionOperation) obj;
        return getSlot().equals(other.getSlot()) && numerator == other.numerator
            && denominator == other.denominator && getOrigin() == other.getOrigin();
    }

    @Override
    public int hashCode() {
        return 31 * (31 * getSlot().hashCode() + numerator) + denominator;
    }

}
