/*
 * StyleResolution.java
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

import java.util.Collections;
import java.util.List;

/**
 * The result of resolving an element's attributes: the operations to apply,
 * in order, and the problems met along the way.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class StyleResolution {

    private final List<StyleOperation> operations;
    private final List<StyleException> problems;

    StyleResolution(List<StyleOperation> operations, List<StyleException> problems) {
        this.operations = Collections.unmodifiableList(operations);
        this.problems = Collections.unmodifiableList(problems);
    }

    public List<StyleOperation> getOperations() {
        return operations;
    }

    /**
     * Returns the token-scoped problems. Each problem affected only the
     * token it names.
     */
    public List<StyleException> getProblems() {
        return problems;
    }

    public boolean hasProblems() {
        return !problems.isEmpty();
    }

    /**
     * Returns the last operation writing the given slot, regardless of origin.
     *
     * @param slot the slot name
     * @return the operation, or {@code null} if none writes the slot
     */
    public StyleOperation getOperation(String slot) {
        for (int i = operations.size() - 1; i >= 0; i--) {
            StyleOperation op = operations.get(i);
            if (op.getSlot().equals(slot)) {
                return op;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return operations.toString();
    }

}
