/*
 * HotviewTest.java
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
import org.bluezoo.hotview.reload.ReloadConfiguration;
import org.bluezoo.hotview.reload.ReloadCoordinator;
import org.bluezoo.hotview.render.RenderableFactory;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import static org.junit.Assert.*;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Unit tests for Hotview.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class HotviewTest {

    @Rule
    public TemporaryFolder tempFolder = new TemporaryFolder();

    @Test
    public void testPrintsEachGeneration() throws Exception {
        Path source = tempFolder.newFile("main.xml").toPath();
        Files.write(source, "<div>one</div>".getBytes(StandardCharsets.UTF_8));
        ReloadConfiguration configuration = new ReloadConfiguration();
        configuration.setWatchEnabled(false);
        ReloadCoordinator coordinator =
            new ReloadCoordinator(source, new MarkupParser(), configuration);
        StringWriter sink = new StringWriter();
        Hotview hotview = new Hotview(coordinator, new RenderableFactory(), new PrintWriter(sink));
        coordinator.addDocumentListener(hotview);

        try {
            hotview.documentChanged();
            assertEquals("", sink.toString());

            coordinator.start();
            hotview.documentChanged();
            Files.write(source, "<div>two</div>".getBytes(StandardCharsets.UTF_8));
            assertTrue(coordinator.reload());
        } finally {
            coordinator.close();
        }

        String output = sink.toString();
        assertTrue(output.contains("(generation 1)"));
        assertTrue(output.contains("div \"one\""));
        assertTrue(output.contains("(generation 2)"));
        assertTrue(output.contains("div \"two\""));
    }

}
