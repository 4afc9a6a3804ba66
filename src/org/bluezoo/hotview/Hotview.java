/*
 * Hotview.java
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

import org.bluezoo.hotview.markup.MarkupException;
import org.bluezoo.hotview.reload.DocumentListener;
import org.bluezoo.hotview.reload.MarkupDocument;
import org.bluezoo.hotview.reload.ReloadCoordinator;
import org.bluezoo.hotview.render.ContainerRenderable;
import org.bluezoo.hotview.render.RenderableFactory;
import org.bluezoo.hotview.util.LaconicFormatter;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.text.MessageFormat;
import java.util.ResourceBundle;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point. Loads a markup file, prints its renderable
 * tree and prints it again each time the file changes.
 *
 * <pre>
 * java org.bluezoo.hotview.Hotview [file]
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Hotview implements DocumentListener {

    private static final Logger LOGGER = Logger.getLogger(Hotview.class.getName());
    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.hotview.L10N");

    static final String DEFAULT_SOURCE = "ui/main.xml";

    private final ReloadCoordinator coordinator;
    private final RenderableFactory factory;
    private final PrintWriter out;

    public Hotview(ReloadCoordinator coordinator, RenderableFactory factory, PrintWriter out) {
        this.coordinator = coordinator;
        this.factory = factory;
        this.out = out;
    }

    @Override
    public void documentChanged() {
        MarkupDocument document = coordinator.getDocument();
        if (document != null) {
            print(document);
        }
    }

    /**
     * Prints the renderable tree of a document.
     *
     * @param document the document
     */
    void print(MarkupDocument document) {
        ContainerRenderable root = factory.createRoot(document.getRoot());
        String header = MessageFormat.format(L10N.getString("banner.generation"),
                document.getSource(), document.getGeneration());
        synchronized (out) {
            out.println(header);
            try {
                root.accept(new TreePrinter(out));
            } catch (Exception e) {
                LOGGER.log(Level.WARNING, L10N.getString("err.print"), e);
            }
            out.flush();
        }
    }

    /**
     * Task run at shutdown to stop reloading.
     */
    static class ShutdownTask implements Runnable {

        private final ReloadCoordinator coordinator;
        private final CountDownLatch done;

        ShutdownTask(ReloadCoordinator coordinator, CountDownLatch done) {
            this.coordinator = coordinator;
            this.done = done;
        }

        @Override
        public void run() {
            coordinator.close();
            done.countDown();
        }
    }

    // -- Main entry point --

    public static void main(String[] args) {
        LaconicFormatter.install(Level.INFO);

        Path source = Paths.get(args.length > 0 ? args[0] : DEFAULT_SOURCE);
        if (!Files.isRegularFile(source)) {
            String message = L10N.getString("err.no_source");
            System.err.println(MessageFormat.format(message, source));
            System.exit(1);
        }

        ReloadCoordinator coordinator = new ReloadCoordinator(source);
        Hotview hotview = new Hotview(coordinator, new RenderableFactory(),
                new PrintWriter(System.out, true));
        coordinator.addDocumentListener(hotview);
        try {
            coordinator.start();
        } catch (IOException | MarkupException e) {
            String message = MessageFormat.format(L10N.getString("err.initial_parse"), source);
            LOGGER.log(Level.SEVERE, message, e);
            System.exit(2);
            return;
        }
        hotview.documentChanged();

        CountDownLatch done = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(new ShutdownTask(coordinator, done)));

        // Wait for shutdown
        try {
            done.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

}
