/*
 * RenderableFactoryTest.java
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

package org.bluezoo.hotview.render;

import org.bluezoo.hotview.markup.ElementNode;
import org.bluezoo.hotview.markup.MarkupParser;
import org.bluezoo.hotview.style.ColorOperation;
import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Unit tests for RenderableFactory.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class RenderableFactoryTest {

    private MarkupParser parser;
    private RenderableFactory factory;

    @Before
    public void setUp() {
        parser = new MarkupParser();
        factory = new RenderableFactory();
    }

    private ContainerRenderable render(String markup) throws Exception {
        ElementNode root = parser.parse(markup, "test.xml");
        return factory.createRoot(root);
    }

    @Test
    public void testKinds() throws Exception {
        ContainerRenderable root = render("<div class=\"flex\">" +
            "<img src=\"logo.png\" class=\"w-8\"/>" +
            "<svg path=\"icons/star.svg\"/>" +
            "<section>Text</section>" +
            "</div>");

        assertEquals(Renderable.Kind.CONTAINER, root.getKind());
        assertEquals(1, root.getOperations().size());
        List<Renderable> children = root.getChildren();
        assertEquals(3, children.size());

        ImageRenderable image = (ImageRenderable) children.get(0);
        assertEquals(Renderable.Kind.IMAGE, image.getKind());
        assertEquals("logo.png", image.getSource());
        assertEquals("width", image.getOperations().get(0).getSlot());

        VectorRenderable vector = (VectorRenderable) children.get(1);
        assertEquals("icons/star.svg", vector.getPath());

        ContainerRenderable section = (ContainerRenderable) children.get(2);
        assertEquals("section", section.getTag());
        assertEquals("Text", section.getText());
    }

    @Test
    public void testImageWithoutSourceDegrades() throws Exception {
        ContainerRenderable root = render("<div><img class=\"w-8\"/><div>sibling</div></div>");

        assertEquals(2, root.getChildren().size());
        Renderable degraded = root.getChildren().get(0);
        assertEquals(Renderable.Kind.CONTAINER, degraded.getKind());
        assertEquals("Error: <img> requires a src attribute",
                ((ContainerRenderable) degraded).getText());
        assertEquals("sibling", ((ContainerRenderable) root.getChildren().get(1)).getText());
    }

    @Test
    public void testVectorWithoutPathDegrades() throws Exception {
        ContainerRenderable root = render("<div><svg src=\"x.svg\"/></div>");
        ContainerRenderable degraded = (ContainerRenderable) root.getChildren().get(0);
        assertEquals("Error: <svg> requires a path attribute", degraded.getText());
    }

    @Test
    public void testImageChildrenIgnored() throws Exception {
        ContainerRenderable root = render("<div><img src=\"a.png\"><div/><div/></img></div>");
        assertTrue(root.getChildren().get(0) instanceof ImageRenderable);
    }

    @Test
    public void testRootMustBeContainer() throws Exception {
        ContainerRenderable root = render("<img src=\"a.png\" bg=\"#ff0000\"/>");
        assertEquals("Error: root element must be a div", root.getText());
        assertTrue(root.getChildren().isEmpty());
        assertTrue(root.getOperations().get(0) instanceof ColorOperation);
    }

    @Test
    public void testErrorPlaceholderRoot() throws Exception {
        ContainerRenderable root = render("");
        assertEquals("error", root.getTag());
        assertEquals("error", root.getText());
    }

    @Test
    public void testStyleProblemsStayWithElement() throws Exception {
        ContainerRenderable root = render("<div class=\"bg-[nope] p-2\"><div class=\"h-4\"/></div>");
        assertEquals(4, root.getOperations().size());
        assertEquals(1, ((ContainerRenderable) root.getChildren().get(0)).getOperations().size());
    }

    @Test
    public void testChildOrderPreserved() throws Exception {
        ContainerRenderable root = render("<div><a><b/><c/></a><img src=\"x.png\"/><d/></div>");

        List<Renderable> children = root.getChildren();
        assertEquals(3, children.size());
        assertEquals("a", children.get(0).getTag());
        assertEquals("img", children.get(1).getTag());
        assertEquals("d", children.get(2).getTag());
        List<Renderable> grandchildren = ((ContainerRenderable) children.get(0)).getChildren();
        assertEquals("b", grandchildren.get(0).getTag());
        assertEquals("c", grandchildren.get(1).getTag());
    }

    @Test
    public void testDeeplyNestedTree() throws Exception {
        int depth = 50000;
        StringBuilder buf = new StringBuilder();
        for (int i = 0; i < depth; i++) {
            buf.append("<div>");
        }
        buf.append("<img src=\"leaf.png\"/>");
        for (int i = 0; i < depth; i++) {
            buf.append("</div>");
        }

        Renderable renderable = render(buf.toString());

        int containers = 0;
        while (renderable.getKind() == Renderable.Kind.CONTAINER) {
            containers++;
            List<Renderable> children = ((ContainerRenderable) renderable).getChildren();
            assertEquals(1, children.size());
            renderable = children.get(0);
        }
        assertEquals(depth, containers);
        assertEquals("leaf.png", ((ImageRenderable) renderable).getSource());
    }

    @Test
    public void testVisitor() throws Exception {
        ContainerRenderable root = render("<div><img src=\"a.png\"/><div><svg path=\"b.svg\"/></div></div>");
        final List<String> visited = new ArrayList<String>();
        root.accept(new RenderableVisitor() {
            @Override
            public void visitContainer(ContainerRenderable container) throws Exception {
                visited.add("container");
                for (Renderable child : container.getChildren()) {
                    child.accept(this);
                }
            }

            @Override
            public void visitImage(ImageRenderable image) {
                visited.add("image:" + image.getSource());
            }

            @Override
            public void visitVector(VectorRenderable vector) {
                visited.add("vector:" + vector.getPath());
            }
        });

        assertEquals(4, visited.size());
        assertEquals("container", visited.get(0));
        assertEquals("image:a.png", visited.get(1));
        assertEquals("container", visited.get(2));
        assertEquals("vector:b.svg", visited.get(3));
    }

}
