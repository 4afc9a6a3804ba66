/*
 * StyleTable.java
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

import java.io.IOException;
import java.io.InputStream;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The class token vocabulary.
 *
 * <p>The table is data: the enumerated tokens are generated once from a
 * small set of length families (a prefix, the slots it writes and the
 * steps it accepts) crossed with the shared spacing scale and fraction
 * list, plus the keyword flags listed in the {@code flags.properties}
 * resource. Parameterized tokens of the form {@code prefix-[literal]}
 * are matched against the same families by {@link AttributeResolver}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class StyleTable {

    private static final Logger LOGGER = Logger.getLogger(StyleTable.class.getName());
    private static final ResourceBundle L10N = StyleLiterals.L10N;

    static final String FLAGS_RESOURCE = "flags.properties";

    /** Spacing scale steps; step n is n/4 rem. */
    static final int[] SCALE = {
        0, 1, 2, 3, 4, 5, 6, 8, 10, 12, 16, 20, 24, 32, 40, 48, 56, 64, 72, 80, 96
    };

    static final int[][] FRACTIONS = {
        {1, 2}, {1, 3}, {2, 3}, {1, 4}, {2, 4}, {3, 4},
        {1, 5}, {2, 5}, {3, 5}, {4, 5}, {1, 6}, {5, 6}, {1, 12}
    };

    // Step sets accepted by a length family
    private static final int STEP_SCALE = 1;
    private static final int STEP_PX = 2;
    private static final int STEP_FRACTIONS = 4;
    private static final int STEP_FULL = 8;
    private static final int STEP_AUTO = 16;

    private static final int SIZING = STEP_SCALE | STEP_PX | STEP_FRACTIONS | STEP_FULL | STEP_AUTO;
    private static final int EXTENT = STEP_SCALE | STEP_PX | STEP_FRACTIONS | STEP_FULL;
    private static final int PADDING = STEP_SCALE | STEP_PX | STEP_FRACTIONS;
    private static final int GAP = STEP_SCALE | STEP_PX;

    private static final String[] SIDES = {"top", "right", "bottom", "left"};

    private final Map<String, List<StyleOperation>> enumerated =
        new HashMap<String, List<StyleOperation>>();
    private final Map<String, String[]> lengthFamilies = new HashMap<String, String[]>();
    private final Map<String, String> colorFamilies = new HashMap<String, String>();

    private static class Holder {
        static final StyleTable DEFAULT = new StyleTable(loadFlags());
    }

    /**
     * Returns the shared table, loaded on first use.
     */
    public static StyleTable getDefault() {
        return Holder.DEFAULT;
    }

    StyleTable(Properties flags) {
        addSpacingFamilies();
        addBorderFamilies();
        addRadiusFamilies();
        addFontSizes();
        colorFamilies.put("bg", "background-color");
        colorFamilies.put("text", "text-color");
        colorFamilies.put("border", "border-color");
        addFlags(flags);
        if (LOGGER.isLoggable(Level.FINE)) {
            String message = L10N.getString("info.table_loaded");
            LOGGER.fine(MessageFormat.format(message, enumerated.size(), lengthFamilies.size()));
        }
    }

    /**
     * Looks up an enumerated token.
     *
     * @param token the exact class token
     * @return the operations the token resolves to, or {@code null} if the
     *         token is not enumerated
     */
    public List<StyleOperation> lookup(String token) {
        return enumerated.get(token);
    }

    /**
     * Returns the slots written by a length family.
     *
     * @param prefix the family prefix, e.g. {@code rounded-t}
     * @return the slots, or {@code null} if no length family has that prefix
     */
    public String[] getLengthSlots(String prefix) {
        String[] slots = lengthFamilies.get(prefix);
        return slots != null ? slots.clone() : null;
    }

    /**
     * Returns the slot written by a color family.
     *
     * @param prefix the family prefix, e.g. {@code bg}
     * @return the slot, or {@code null} if no color family has that prefix
     */
    public String getColorSlot(String prefix) {
        return colorFamilies.get(prefix);
    }

    /**
     * Returns the number of enumerated tokens.
     */
    public int size() {
        return enumerated.size();
    }

    // -- Table construction --

    private void addSpacingFamilies() {
        lengthFamily("w", SIZING, "width");
        lengthFamily("h", SIZING, "height");
        lengthFamily("size", SIZING, "width", "height");
        lengthFamily("min-w", EXTENT, "min-width");
        lengthFamily("min-h", EXTENT, "min-height");
        lengthFamily("max-w", EXTENT, "max-width");
        lengthFamily("max-h", EXTENT, "max-height");

        lengthFamily("p", PADDING, prefixed("padding-", SIDES));
        lengthFamily("px", PADDING, "padding-left", "padding-right");
        lengthFamily("py", PADDING, "padding-top", "padding-bottom");
        lengthFamily("pt", PADDING, "padding-top");
        lengthFamily("pr", PADDING, "padding-right");
        lengthFamily("pb", PADDING, "padding-bottom");
        lengthFamily("pl", PADDING, "padding-left");

        lengthFamily("m", SIZING, prefixed("margin-", SIDES));
        lengthFamily("mx", SIZING, "margin-left", "margin-right");
        lengthFamily("my", SIZING, "margin-top", "margin-bottom");
        lengthFamily("mt", SIZING, "margin-top");
        lengthFamily("mr", SIZING, "margin-right");
        lengthFamily("mb", SIZING, "margin-bottom");
        lengthFamily("ml", SIZING, "margin-left");

        lengthFamily("gap", GAP, "column-gap", "row-gap");
        lengthFamily("gap-x", GAP, "column-gap");
        lengthFamily("gap-y", GAP, "row-gap");

        lengthFamily("inset", SIZING, SIDES);
        for (String side : SIDES) {
            lengthFamily(side, SIZING, side);
        }
    }

    private void addBorderFamilies() {
        borderFamily("border", prefixed("border-", SIDES, "-width"));
        borderFamily("border-t", "border-top-width");
        borderFamily("border-r", "border-right-width");
        borderFamily("border-b", "border-bottom-width");
        borderFamily("border-l", "border-left-width");
        borderFamily("border-x", "border-left-width", "border-right-width");
        borderFamily("border-y", "border-top-width", "border-bottom-width");
    }

    private void borderFamily(String prefix, String... slots) {
        lengthFamilies.put(prefix, slots);
        put(prefix, scalars(prefix, Length.px(1), slots));
        int[] widths = {0, 2, 4, 8};
        for (int width : widths) {
            String token = prefix + '-' + width;
            put(token, scalars(token, width == 0 ? Length.ZERO : Length.px(width), slots));
        }
    }

    private void addRadiusFamilies() {
        String tl = "corner-radius-top-left";
        String tr = "corner-radius-top-right";
        String bl = "corner-radius-bottom-left";
        String br = "corner-radius-bottom-right";
        radiusFamily("rounded", tl, tr, bl, br);
        radiusFamily("rounded-t", tl, tr);
        radiusFamily("rounded-r", tr, br);
        radiusFamily("rounded-b", bl, br);
        radiusFamily("rounded-l", tl, bl);
        radiusFamily("rounded-tl", tl);
        radiusFamily("rounded-tr", tr);
        radiusFamily("rounded-bl", bl);
        radiusFamily("rounded-br", br);
    }

    private void radiusFamily(String prefix, String... slots) {
        lengthFamilies.put(prefix, slots);
        put(prefix, scalars(prefix, Length.rem(0.25f), slots));
        put(prefix + "-none", scalars(prefix + "-none", Length.ZERO, slots));
        put(prefix + "-sm", scalars(prefix + "-sm", Length.rem(0.125f), slots));
        put(prefix + "-md", scalars(prefix + "-md", Length.rem(0.375f), slots));
        put(prefix + "-lg", scalars(prefix + "-lg", Length.rem(0.5f), slots));
        put(prefix + "-xl", scalars(prefix + "-xl", Length.rem(0.75f), slots));
        put(prefix + "-2xl", scalars(prefix + "-2xl", Length.rem(1f), slots));
        put(prefix + "-3xl", scalars(prefix + "-3xl", Length.rem(1.5f), slots));
        put(prefix + "-full", scalars(prefix + "-full", Length.px(9999), slots));
    }

    private void addFontSizes() {
        String[] slots = {"font-size"};
        lengthFamilies.put("text", slots);
        put("text-xs", scalars("text-xs", Length.rem(0.75f), slots));
        put("text-sm", scalars("text-sm", Length.rem(0.875f), slots));
        put("text-base", scalars("text-base", Length.rem(1f), slots));
        put("text-lg", scalars("text-lg", Length.rem(1.125f), slots));
        put("text-xl", scalars("text-xl", Length.rem(1.25f), slots));
        put("text-2xl", scalars("text-2xl", Length.rem(1.5f), slots));
        put("text-3xl", scalars("text-3xl", Length.rem(1.875f), slots));
    }

    private void lengthFamily(String prefix, int steps, String... slots) {
        lengthFamilies.put(prefix, slots);
        if ((steps & STEP_SCALE) != 0) {
            for (int step : SCALE) {
                String token = prefix + '-' + step;
                Length length = step == 0 ? Length.ZERO : Length.rem(step / 4f);
                put(token, scalars(token, length, slots));
            }
        }
        if ((steps & STEP_PX) != 0) {
            String token = prefix + "-px";
            put(token, scalars(token, Length.px(1), slots));
        }
        if ((steps & STEP_FRACTIONS) != 0) {
            for (int[] fraction : FRACTIONS) {
                String token = prefix + '-' + fraction[0] + '/' + fraction[1];
                put(token, fractions(token, fraction[0], fraction[1], slots));
            }
        }
        if ((steps & STEP_FULL) != 0) {
            String token = prefix + "-full";
            put(token, fractions(token, 1, 1, slots));
        }
        if ((steps & STEP_AUTO) != 0) {
            String token = prefix + "-auto";
            List<StyleOperation> ops = new ArrayList<StyleOperation>(slots.length);
            for (String slot : slots) {
                ops.add(new FlagOperation(slot, "auto", token, StyleOperation.Origin.CLASS));
            }
            put(token, ops);
        }
    }

    private void addFlags(Properties flags) {
        for (String token : flags.stringPropertyNames()) {
            String definition = flags.getProperty(token).trim();
            List<StyleOperation> ops = new ArrayList<StyleOperation>();
            for (String assignment : definition.split(",")) {
                int colon = assignment.indexOf(':');
                if (colon <= 0 || colon == assignment.length() - 1) {
                    ops = null;
                    break;
                }
                String slot = assignment.substring(0, colon).trim();
                String value = assignment.substring(colon + 1).trim();
                ops.add(new FlagOperation(slot, value, token, StyleOperation.Origin.CLASS));
            }
            if (ops == null || ops.isEmpty()) {
                String message = L10N.getString("err.flag_entry");
                LOGGER.warning(MessageFormat.format(message, token, definition));
                continue;
            }
            put(token, ops);
        }
    }

    private void put(String token, List<StyleOperation> ops) {
        enumerated.put(token, Collections.unmodifiableList(ops));
    }

    private static List<StyleOperation> scalars(String token, Length length, String[] slots) {
        List<StyleOperation> ops = new ArrayList<StyleOperation>(slots.length);
        for (String slot : slots) {
            ops.add(new ScalarOperation(slot, length, token, StyleOperation.Origin.CLASS));
        }
        return ops;
    }

    private static List<StyleOperation> fractions(String token, int numerator, int denominator,
                                                  String[] slots) {
        List<StyleOperation> ops = new ArrayList<StyleOperation>(slots.length);
        for (String slot : slots) {
            ops.add(new FractionOperation(slot, numerator, denominator, token,
                    StyleOperation.Origin.CLASS));
        }
        return ops;
    }

    private static String[] prefixed(String prefix, String[] names) {
        return prefixed(prefix, names, "");
    }

    private static String[] prefixed(String prefix, String[] names, String suffix) {
        String[] result = new String[names.length];
        for (int i = 0; i < names.length; i++) {
            result[i] = prefix + names[i] + suffix;
        }
        return result;
    }

    static Properties loadFlags() {
        Properties flags = new Properties();
        try (InputStream in = StyleTable.class.getResourceAsStream(FLAGS_RESOURCE)) {
            if (in == null) {
                throw new IOException(FLAGS_RESOURCE);
            }
            flags.load(in);
        } catch (IOException e) {
            String message = L10N.getString("err.flag_table");
            LOGGER.log(Level.SEVERE, MessageFormat.format(message, FLAGS_RESOURCE), e);
        }
        return flags;
    }

}
