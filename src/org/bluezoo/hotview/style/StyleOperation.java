/*
 * StyleOperation.java
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
 * A typed style operation request resolved from one attribute or class
 * token. Operations are applied by the host rendering layer in
 * resolution order.
 *
 * <p>Each operation writes one semantic <em>slot</em> (for example
 * {@code height} or {@code padding-left}). When two operations of the
 * same {@link Origin} write the same slot, the later one replaces the
 * earlier one.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class StyleOperation {

    /**
     * Enumeration of operation payload kinds.
     */
    public enum Kind {
        /** Keyword value without numeric payload, e.g. display=flex. */
        FLAG,
        /** A single length, e.g. height=2rem. */
        SCALAR,
        /** An RGB color. */
        COLOR,
        /** A numerator/denominator pair, e.g. width=2/3. */
        FRACTION
    }

    /**
     * Where an operation came from. Operations of different origins never
     * replace each other.
     */
    public enum Origin {
        /** A reserved attribute such as {@code bg}. */
        ATTRIBUTE,
        /** A token of the {@code class} attribute. */
        CLASS
    }

    private final String slot;
    private final String token;
    private final Origin origin;

    protected StyleOperation(String slot, String token, Origin origin) {
        this.slot = slot;
        this.token = token;
        this.origin = origin;
    }

    public abstract Kind getKind();

    /**
     * Returns a copy of this operation attributed to another token.
     *
     * @param token the source token
     * @param origin the origin of the token
     * @return an equivalent operation
     */
    public abstract StyleOperation withSource(String token, Origin origin);

    /**
     * Returns the semantic slot written by this operation.
     */
    public String getSlot() {
        return slot;
    }

    /**
     * Returns the attribute value or class token this operation was
     * resolved from.
     */
    public String getToken() {
        return token;
    }

    public Origin getOrigin() {
        return origin;
    }

    /**
     * Returns the key under which this operation competes with others
     * for last-token-wins replacement.
     */
    String getReplacementKey() {
        return origin.name() + ':' + slot;
    }

    /**
     * Returns a printable form of the payload.
     */
    protected abstract String payloadString();

    @Override
    public String toString() {
        return slot + '=' + payloadString();
    }

}
