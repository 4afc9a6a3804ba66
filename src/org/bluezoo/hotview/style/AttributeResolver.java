/*
 * AttributeResolver.java
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

import org.bluezoo.hotview.markup.Attribute;
import org.bluezoo.hotview.markup.ElementNode;

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves element attributes into style operations.
 *
 * <p>Two paths are applied, direct attributes first:
 * <ol>
 * <li>the reserved color attributes {@code bg} and {@code color}, whose
 *     values are hex colors;</li>
 * <li>the whitespace-separated tokens of the {@code class} attribute,
 *     each looked up in the {@link StyleTable} or, failing that, parsed
 *     as a parameterized token {@code prefix-[literal]}.</li>
 * </ol>
 * Unknown tokens are ignored. Within one origin a later operation on a
 * slot replaces an earlier one and moves to the later position.
 *
 * <p>Malformed literals never fail the resolution: they are recorded as
 * problems in the returned {@link StyleResolution}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class AttributeResolver {

    private static final Logger LOGGER = Logger.getLogger(AttributeResolver.class.getName());
    private static final ResourceBundle L10N = StyleLiterals.L10N;

    public static final String CLASS = "class";
    public static final String BACKGROUND = "bg";
    public static final String COLOR = "color";
    public static final String SOURCE = "src";
    public static final String PATH = "path";

    private final StyleTable table;

    public AttributeResolver() {
        this(StyleTable.getDefault());
    }

    public AttributeResolver(StyleTable table) {
        this.table = table;
    }

    /**
     * Resolves the attributes of an element.
     *
     * @param node the element
     * @return the resolution
     */
    public StyleResolution resolve(ElementNode node) {
        return resolve(node.getAttributes());
    }

    /**
     * Resolves a list of attributes.
     *
     * @param attributes the attributes in document order
     * @return the resolution
     */
    public StyleResolution resolve(List<Attribute> attributes) {
        Map<String, StyleOperation> ops = new LinkedHashMap<String, StyleOperation>();
        List<StyleException> problems = new ArrayList<StyleException>();
        String classValue = null;
        for (Attribute attribute : attributes) {
            String key = attribute.getKey();
            if (BACKGROUND.equals(key)) {
                resolveColorAttribute(attribute, "background-color", ops, problems);
            } else if (COLOR.equals(key)) {
                resolveColorAttribute(attribute, "text-color", ops, problems);
            } else if (CLASS.equals(key)) {
                classValue = attribute.getValue();
            }
        }
        if (classValue != null) {
            for (String token : classValue.trim().split("\\s+")) {
                if (!token.isEmpty()) {
                    resolveToken(token, ops, problems);
                }
            }
        }
        if (!problems.isEmpty() && LOGGER.isLoggable(Level.FINE)) {
            String message = L10N.getString("fine.problem");
            for (StyleException problem : problems) {
                LOGGER.fine(MessageFormat.format(message, problem.getMessage()));
            }
        }
        return new StyleResolution(new ArrayList<StyleOperation>(ops.values()), problems);
    }

    private void resolveColorAttribute(Attribute attribute, String slot,
                                       Map<String, StyleOperation> ops,
                                       List<StyleException> problems) {
        String value = attribute.getValue();
        try {
            int rgb = StyleLiterals.parseColor(value, value);
            apply(ops, new ColorOperation(slot, rgb, value, StyleOperation.Origin.ATTRIBUTE));
        } catch (InvalidColorLiteralException e) {
            problems.add(e);
        }
    }

    private void resolveToken(String token, Map<String, StyleOperation> ops,
                              List<StyleException> problems) {
        List<StyleOperation> enumerated = table.lookup(token);
        if (enumerated != null) {
            for (StyleOperation op : enumerated) {
                apply(ops, op);
            }
            return;
        }
        int bracket = token.indexOf("-[");
        if (bracket <= 0 || !token.endsWith("]")) {
            return;
        }
        String prefix = token.substring(0, bracket);
        String literal = token.substring(bracket + 2, token.length() - 1);
        String colorSlot = table.getColorSlot(prefix);
        String[] lengthSlots = table.getLengthSlots(prefix);
        if (colorSlot != null && (literal.startsWith("#") || lengthSlots == null)) {
            try {
                int rgb = StyleLiterals.parseColor(literal, token);
                apply(ops, new ColorOperation(colorSlot, rgb, token, StyleOperation.Origin.CLASS));
            } catch (InvalidColorLiteralException e) {
                problems.add(e);
            }
        } else if (lengthSlots != null) {
            Length length;
            try {
                length = StyleLiterals.parseLength(literal, token);
            } catch (InvalidLengthLiteralException e) {
                problems.add(e);
                length = Length.ZERO;
            }
            for (String slot : lengthSlots) {
                apply(ops, new ScalarOperation(slot, length, token, StyleOperation.Origin.CLASS));
            }
        }
    }

    private static void apply(Map<String, StyleOperation> ops, StyleOperation op) {
        String key = op.getReplacementKey();
        ops.remove(key);
        ops.put(key, op);
    }

}
