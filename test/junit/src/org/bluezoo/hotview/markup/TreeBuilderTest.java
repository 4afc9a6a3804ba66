/*
 * TreeBuilderTest.java
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

package org.bluezoo.hotview.markup;

import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Unit tests for TreeBuilder.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class TreeBuilderTest {

    private TreeBuilder builder;

    @Before
    public void setUp() {
        builder = new TreeBuilder();
    }

    private static List<Attribute> attrs(String... keyValues) {
        List<Attribute> list = new ArrayList<Attribute>();
        for (int i = 0; i < keyValues.length; i += 2) {
            list.add(new Attribute(keyValues[i], keyValues[i + 1]));
        }
        return list;
    }

    private static MarkupEvent start(String name) {
        return MarkupEvent.start(name, Collections.<Attribute>emptyList());
    }

    @Test
    public void testSingleElement() throws Exception {
        ElementNode root = builder.build(Arrays.asList(
            MarkupEvent.start("div", attrs("class", "flex")),
            MarkupEvent.end("div")));

        assertEquals("div", root.getTag());
        assertNull(root.getText());
        assertFalse(root.hasText());
        assertTrue(root.getChildren().isEmpty());
        assertEquals("flex", root.getAttribute("class"));
    }

    @Test
    public void testChildrenInDocumentOrder() throws Exception {
        ElementNode root = builder.build(Arrays.asList(
            start("div"),
            start("a"), MarkupEvent.end("a"),
            start("b"),
            start("c"), MarkupEvent.end("c"),
            MarkupEvent.end("b"),
            MarkupEvent.empty("img", attrs("src", "x.png")),
            MarkupEvent.end("div")));

        assertEquals(5, root.countNodes());
        List<ElementNode> children = root.getChildren();
        assertEquals(3, children.size());
        assertEquals("a", children.get(0).getTag());
        assertEquals("b", children.get(1).getTag());
        assertEquals("img", children.get(2).getTag());
        assertEquals("c", children.get(1).getChildren().get(0).getTag());
        assertEquals("x.png", children.get(2).getAttribute("src"));
    }

    @Test
    public void testTextAndChildrenBothKept() throws Exception {
        ElementNode root = builder.build(Arrays.asList(
            start("div"),
            start("span"), MarkupEvent.end("span"),
            MarkupEvent.text("Hello"),
            MarkupEvent.end("div")));

        assertEquals("Hello", root.getText());
        assertEquals(1, root.getChildren().size());
    }

    @Test
    public void testLastTextRunWins() throws Exception {
        ElementNode root = builder.build(Arrays.asList(
            start("div"),
            MarkupEvent.text("first"),
            start("br"), MarkupEvent.end("br"),
            MarkupEvent.text("second"),
            MarkupEvent.end("div")));

        assertEquals("second", root.getText());
    }

    @Test
    public void testEmptyStreamYieldsPlaceholder() throws Exception {
        ElementNode root = builder.build(Collections.<MarkupEvent>emptyList());

        assertEquals(ElementNode.ERROR_TAG, root.getTag());
        assertEquals("error", root.getText());
        assertTrue(root.isErrorPlaceholder());
    }

    @Test
    public void testTextOnlyStreamYieldsPlaceholder() throws Exception {
        ElementNode root = builder.build(Arrays.asList(MarkupEvent.text("stray")));
        assertTrue(root.isErrorPlaceholder());
    }

    @Test
    public void testOrphanEmptyIsDropped() throws Exception {
        ElementNode root = builder.build(Arrays.asList(
            MarkupEvent.empty("img", attrs("src", "x.png"))));
        assertTrue(root.isErrorPlaceholder());
    }

    @Test(expected = MalformedMarkupException.class)
    public void testMismatchedEnd() throws Exception {
        builder.build(Arrays.asList(
            start("a"),
            start("b"),
            MarkupEvent.end("a")));
    }

    @Test(expected = MalformedMarkupException.class)
    public void testUnclosedElement() throws Exception {
        builder.build(Arrays.asList(
            start("a"),
            start("b"),
            MarkupEvent.end("b")));
    }

    @Test(expected = MalformedMarkupException.class)
    public void testEndWithoutStart() throws Exception {
        builder.build(Arrays.asList(MarkupEvent.end("a")));
    }

    @Test
    public void testMultipleRoots() throws Exception {
        try {
            builder.build(Arrays.asList(
                start("a"), MarkupEvent.end("a"),
                MarkupEvent.start("b", Collections.<Attribute>emptyList(), 3, 1),
                MarkupEvent.end("b")), "test.xml");
            fail("Expected MalformedMarkupException");
        } catch (MalformedMarkupException e) {
            assertEquals("test.xml", e.getSystemId());
            assertEquals(3, e.getLineNumber());
            assertTrue(e.getMessage().contains("<b>"));
        }
    }

    @Test
    public void testEmptyAfterRootClosed() throws Exception {
        try {
            builder.build(Arrays.asList(
                start("a"), MarkupEvent.end("a"),
                MarkupEvent.empty("b", Collections.<Attribute>emptyList())), "test.xml");
            fail("Expected MalformedMarkupException");
        } catch (MalformedMarkupException e) {
            assertTrue(e.getMessage().contains("<b>"));
        }
    }

    @Test
    public void testTextAfterRootClosedIsIgnored() throws Exception {
        ElementNode root = builder.build(Arrays.asList(
            start("a"), MarkupEvent.end("a"),
            MarkupEvent.text("trailing")));

        assertEquals("a", root.getTag());
        assertNull(root.getText());
    }

    @Test
    public void testTextAfterRootClosedKeepsRootText() throws Exception {
        ElementNode root = builder.build(Arrays.asList(
            start("a"), MarkupEvent.text("inside"), MarkupEvent.end("a"),
            MarkupEvent.text("trailing")));

        assertEquals("inside", root.getText());
    }

    @Test
    public void testDeeplyNestedElements() throws Exception {
        int depth = 50000;
        List<MarkupEvent> events = new ArrayList<MarkupEvent>(depth * 2);
        for (int i = 0; i < depth; i++) {
            events.add(start("div"));
        }
        events.add(MarkupEvent.text("leaf"));
        for (int i = 0; i < depth; i++) {
            events.add(MarkupEvent.end("div"));
        }

        ElementNode root = builder.build(events);

        assertEquals(depth, root.countNodes());
        ElementNode node = root;
        while (!node.getChildren().isEmpty()) {
            assertEquals(1, node.getChildren().size());
            node = node.getChildren().get(0);
        }
        assertEquals("leaf", node.getText());
    }

    @Test
    public void testDuplicateAttributeLookupReturnsLast() throws Exception {
        ElementNode root = builder.build(Arrays.asList(
            MarkupEvent.start("div", attrs("class", "p-1", "class", "p-2")),
            MarkupEvent.end("div")));

        assertEquals(2, root.getAttributes().size());
        assertEquals("p-2", root.getAttribute("class"));
        assertNull(root.getAttribute("bg"));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testChildrenAreUnmodifiable() throws Exception {
        ElementNode root = builder.build(Arrays.asList(start("div"), MarkupEvent.end("div")));
        root.getChildren().add(ElementNode.errorPlaceholder());
    }

}
