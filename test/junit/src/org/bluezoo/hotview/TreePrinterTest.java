/*
 * TreePrinterTest.java
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

package org.bluezoo.hotview;

import org.bluezoo.hotview.markup.MarkupParser;
import org.bluezoo.hotview.render.ContainerRenderable;
import org.bluezoo.hotview.render.RenderableFactory;
import org.junit.Test;
import static org.junit.Assert.*;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Unit tests for TreePrinter.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class TreePrinterTest {

    @Test
    public void testPrintTree() throws Exception {
        String markup = "<div class=\"flex\"><img src=\"a.png\"/><div>Hi</div></div>";
        ContainerRenderable root = new RenderableFactory()
            .createRoot(new MarkupParser().parse(markup, null));
        StringWriter sink = new StringWriter();
        PrintWriter out = new PrintWriter(sink);

        root.accept(new TreePrinter(out));
        out.flush();

        String[] lines = sink.toString().split("\\r?\\n");
        assertEquals(3, lines.length);
        assertEquals("div [display=flex]", lines[0]);
        assertEquals("  img src=a.png", lines[1]);
        assertEquals("  div \"Hi\"", lines[2]);
    }

    @Test
    public void testNestedOrderAndIndent() throws Exception {
        String markup = "<div><div><img src=\"a.png\"/>Inner</div><svg path=\"p.svg\"/></div>";
        ContainerRenderable root = new RenderableFactory()
            .createRoot(new MarkupParser().parse(markup, null));
        StringWriter sink = new StringWriter();
        PrintWriter out = new PrintWriter(sink);

        root.accept(new TreePrinter(out));
        out.flush();

        String[] lines = sink.toString().split("\\r?\\n");
        assertEquals(4, lines.length);
        assertEquals("div", lines[0]);
        assertEquals("  div \"Inner\"", lines[1]);
        assertEquals("    img src=a.png", lines[2]);
        assertEquals("  svg path=p.svg", lines[3]);
    }

}
