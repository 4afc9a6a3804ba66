/*
 * MarkupParserTest.java
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
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

/**
 * Unit tests for MarkupParser and MarkupEventReader.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class MarkupParserTest {

    @Rule
    public TemporaryFolder tempFolder = new TemporaryFolder();

    private MarkupParser parser;

    @Before
    public void setUp() {
        parser = new MarkupParser();
    }

    @Test
    public void testParseNestedDocument() throws Exception {
        String markup = "<div class=\"flex flex-col\" bg=\"#1e1e2e\">\n" +
            "  <div class=\"text-lg\">Hello</div>\n" +
            "  <img src=\"logo.png\"/>\n" +
            "  <svg path=\"icons/star.svg\"></svg>\n" +
            "</div>";

        ElementNode root = parser.parse(markup, "test.xml");

        assertEquals("div", root.getTag());
        assertEquals(4, root.countNodes());
        assertEquals("flex flex-col", root.getAttribute("class"));
        assertEquals("#1e1e2e", root.getAttribute("bg"));
        assertNull(root.getText());

        List<ElementNode> children = root.getChildren();
        assertEquals(3, children.size());
        assertEquals("Hello", children.get(0).getText());
        assertEquals("img", children.get(1).getTag());
        assertEquals("logo.png", children.get(1).getAttribute("src"));
        assertEquals("svg", children.get(2).getTag());
        assertEquals(2, children.get(0).getLineNumber());
    }

    @Test
    public void testTextIsTrimmed() throws Exception {
        ElementNode root = parser.parse("<div>\n   spaced out  \n</div>", null);
        assertEquals("spaced out", root.getText());
    }

    @Test
    public void testEntitiesAreUnescaped() throws Exception {
        ElementNode root = parser.parse("<div title=\"a &amp; b\">x &lt; y</div>", null);
        assertEquals("a & b", root.getAttribute("title"));
        assertEquals("x < y", root.getText());
    }

    @Test
    public void testNamespacePrefixStripped() throws Exception {
        ElementNode root = parser.parse(
            "<ui:div xmlns:ui=\"urn:example:ui\"><ui:img src=\"a.png\"/></ui:div>", null);
        assertEquals("div", root.getTag());
        assertEquals("img", root.getChildren().get(0).getTag());
    }

    @Test
    public void testSelfClosingReadAsStartAndEnd() throws Exception {
        List<MarkupEvent> events = new MarkupEventReader().read("<img src=\"a.png\"/>", null);
        assertEquals(2, events.size());
        assertEquals(MarkupEvent.Type.START, events.get(0).getType());
        assertEquals("a.png", events.get(0).getAttributes().get(0).getValue());
        assertEquals(MarkupEvent.Type.END, events.get(1).getType());
    }

    @Test
    public void testBlankInputYieldsPlaceholder() throws Exception {
        assertTrue(new MarkupEventReader().read("  \n\t ", null).isEmpty());
        assertTrue(parser.parse("", null).isErrorPlaceholder());
        assertTrue(parser.parse("\n\n", null).isErrorPlaceholder());
    }

    @Test
    public void testByteOrderMarkIgnored() throws Exception {
        ElementNode root = parser.parse("\uFEFF<div>ok</div>", null);
        assertEquals("ok", root.getText());
    }

    @Test
    public void testMismatchedTagsFailWithLocation() throws Exception {
        try {
            parser.parse("<div>\n<a><b></a>\n</div>", "broken.xml");
            fail("Expected MarkupException");
        } catch (StreamReadException e) {
            assertEquals("broken.xml", e.getSystemId());
            assertEquals(2, e.getLineNumber());
            assertTrue(e.getMessage().startsWith("broken.xml:2:"));
        }
    }

    @Test(expected = MarkupException.class)
    public void testUnterminatedDocument() throws Exception {
        parser.parse("<div><span>", null);
    }

    @Test
    public void testParseStream() throws Exception {
        byte[] bytes = "<div>caf\u00e9</div>".getBytes(StandardCharsets.UTF_8);
        ElementNode root = parser.parse(new ByteArrayInputStream(bytes), "stream");
        assertEquals("caf\u00e9", root.getText());
    }

    @Test
    public void testParseFile() throws Exception {
        File file = tempFolder.newFile("main.xml");
        Files.write(file.toPath(), "<div><div>a</div><div>b</div></div>"
                .getBytes(StandardCharsets.UTF_8));

        ElementNode root = parser.parse(file.toPath());

        assertEquals(3, root.countNodes());
        assertEquals("b", root.getChildren().get(1).getText());
    }

    @Test
    public void testDeeplyNestedFile() throws Exception {
        int depth = 50000;
        StringBuilder buf = new StringBuilder();
        for (int i = 0; i < depth; i++) {
            buf.append("<div>");
        }
        buf.append("leaf");
        for (int i = 0; i < depth; i++) {
            buf.append("</div>");
        }
        File file = tempFolder.newFile("deep.xml");
        Files.write(file.toPath(), buf.toString().getBytes(StandardCharsets.UTF_8));

        ElementNode root = parser.parse(file.toPath());

        assertEquals(depth, root.countNodes());
    }

    @Test
    public void testInvalidUtf8StreamRejected() throws Exception {
        try {
            parser.parse(new ByteArrayInputStream(invalidUtf8()), "stream");
            fail("Expected StreamReadException");
        } catch (StreamReadException e) {
            assertEquals("stream", e.getSystemId());
            assertEquals(1, e.getLineNumber());
            assertEquals(6, e.getColumnNumber());
        }
    }

    @Test
    public void testInvalidUtf8FileRejected() throws Exception {
        File file = tempFolder.newFile("broken.xml");
        Files.write(file.toPath(), invalidUtf8());
        try {
            parser.parse(file.toPath());
            fail("Expected StreamReadException");
        } catch (StreamReadException e) {
            assertEquals(file.toPath().toString(), e.getSystemId());
        }
    }

    @Test
    public void testInvalidUtf8OnLaterLine() throws Exception {
        byte[] bytes = {
            '<', 'd', 'i', 'v', '>', '\n',
            'a', 'b', (byte) 0xFF,
            '<', '/', 'd', 'i', 'v', '>'
        };
        try {
            parser.parse(new ByteArrayInputStream(bytes), "stream");
            fail("Expected StreamReadException");
        } catch (StreamReadException e) {
            assertEquals(2, e.getLineNumber());
            assertEquals(3, e.getColumnNumber());
        }
    }

    // A lone 0xC3 lead byte followed by '(' and a 0xFF, which never occurs in UTF-8
    private static byte[] invalidUtf8() {
        return new byte[] {
            '<', 'd', 'i', 'v', '>',
            (byte) 0xC3, '(', (byte) 0xFF,
            '<', '/', 'd', 'i', 'v', '>'
        };
    }

}
