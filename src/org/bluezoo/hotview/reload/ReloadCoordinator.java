/*
 * ReloadCoordinator.java
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

package org.bluezoo.hotview.reload;

import org.bluezoo.hotview.markup.ElementNode;
import org.bluezoo.hotview.markup.MarkupException;
import org.bluezoo.hotview.markup.MarkupParser;

import java.io.IOException;
import java.nio.file.Path;
import java.text.MessageFormat;
import java.util.List;
import java.util.ResourceBundle;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps a parsed markup document in step with its source file.
 *
 * <p>{@link #start()} parses the file once and publishes the result as
 * generation 1. From then on, content changes reported by the
 * {@link FileWatcher} (or passed to {@link #fileChanged}) are handed
 * through a single-slot queue to a reload thread, which waits for the
 * debounce interval, coalesces whatever else arrived meanwhile, and
 * reparses. A successful reparse replaces the published document and
 * notifies every {@link DocumentListener}; a failed one is logged and
 * the previous document stays published.
 *
 * <p>Readers call {@link #getDocument()} from any thread and always see
 * a complete snapshot.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ReloadCoordinator implements FileWatcher.ChangeCallback {

    private static final Logger LOGGER = Logger.getLogger(ReloadCoordinator.class.getName());
    private static final ResourceBundle L10N = FileWatcher.L10N;

    private final Path source;
    private final MarkupParser parser;
    private final ReloadConfiguration configuration;

    private final AtomicReference<MarkupDocument> document = new AtomicReference<MarkupDocument>();
    private final List<DocumentListener> listeners = new CopyOnWriteArrayList<DocumentListener>();
    private final BlockingQueue<FileChangeEvent> pending = new ArrayBlockingQueue<FileChangeEvent>(1);
    private final Object reloadLock = new Object();
    private final AtomicInteger reloadCount = new AtomicInteger();
    private final AtomicInteger failureCount = new AtomicInteger();

    private volatile ReloadState state = ReloadState.IDLE;
    private long generation;
    private FileWatcher watcher;
    private ReloadThread reloadThread;

    public ReloadCoordinator(Path source) {
        this(source, new MarkupParser(), new ReloadConfiguration());
    }

    public ReloadCoordinator(Path source, MarkupParser parser, ReloadConfiguration configuration) {
        this.source = source.toAbsolutePath();
        this.parser = parser;
        this.configuration = configuration;
    }

    /**
     * Parses the source file, publishes the first document and begins
     * watching for changes.
     *
     * @throws IOException if the file cannot be read or watched
     * @throws MarkupException if the file is not valid markup
     * @throws IllegalStateException if already started
     */
    public void start() throws IOException, MarkupException {
        synchronized (reloadLock) {
            if (state != ReloadState.IDLE) {
                String message = L10N.getString("coordinator.already_started");
                throw new IllegalStateException(MessageFormat.format(message, source));
            }
            ElementNode root = parser.parse(source);
            FileWatcher fileWatcher = null;
            if (configuration.isWatchEnabled()) {
                fileWatcher = new FileWatcher(source.getParent(), this,
                        configuration.getPollMillis());
                fileWatcher.startWatching();
            }
            watcher = fileWatcher;
            MarkupDocument initial = publish(root);
            pending.clear();
            reloadThread = new ReloadThread();
            reloadThread.start();
            state = ReloadState.WATCHING;

            if (LOGGER.isLoggable(Level.INFO)) {
                String message = L10N.getString("coordinator.started");
                LOGGER.info(MessageFormat.format(message, source, initial.getGeneration()));
            }
        }
    }

    /**
     * Returns the current document.
     *
     * @return the most recently published document, or {@code null} if
     *         the coordinator has never been started
     */
    public MarkupDocument getDocument() {
        return document.get();
    }

    public Path getSource() {
        return source;
    }

    public ReloadState getState() {
        return state;
    }

    /**
     * Returns the number of reparses that published a new document.
     */
    public int getReloadCount() {
        return reloadCount.get();
    }

    /**
     * Returns the number of reparses that failed.
     */
    public int getFailureCount() {
        return failureCount.get();
    }

    public void addDocumentListener(DocumentListener listener) {
        listeners.add(listener);
    }

    public void removeDocumentListener(DocumentListener listener) {
        listeners.remove(listener);
    }

    /**
     * Accepts a change event. Content changes and overflows are queued
     * for the reload thread, blocking while a previous change is still
     * waiting to be taken; all other events are dropped. An overflow
     * means events were lost, so it may hide a content change.
     *
     * @param event the change
     * @throws InterruptedException if interrupted while waiting for the
     *         queue slot
     */
    @Override
    public void fileChanged(FileChangeEvent event) throws InterruptedException {
        boolean relevant = event.isDataChange()
                || event.getKind() == FileChangeEvent.Kind.OVERFLOW;
        if (!relevant || state == ReloadState.IDLE) {
            if (LOGGER.isLoggable(Level.FINE)) {
                String message = L10N.getString("coordinator.event_dropped");
                LOGGER.fine(MessageFormat.format(message, event));
            }
            return;
        }
        pending.put(event);
    }

    /**
     * Reparses the source file now, on the calling thread. Any failure
     * of the reparse, checked or not, leaves the previous document
     * published and is counted as a failed reload.
     *
     * @return true if a new document was published
     */
    public boolean reload() {
        MarkupDocument published;
        synchronized (reloadLock) {
            if (state == ReloadState.IDLE) {
                if (LOGGER.isLoggable(Level.FINE)) {
                    String message = L10N.getString("coordinator.not_started");
                    LOGGER.fine(MessageFormat.format(message, source));
                }
                return false;
            }
            state = ReloadState.REPARSING;
            long t1 = System.currentTimeMillis();
            try {
                published = publish(parser.parse(source));
            } catch (IOException | MarkupException | RuntimeException e) {
                state = ReloadState.FAILED;
                failureCount.incrementAndGet();
                String message = L10N.getString("coordinator.reload_failed");
                message = MessageFormat.format(message, source, generation);
                LOGGER.log(Level.WARNING, message, e);
                state = ReloadState.WATCHING;
                return false;
            }
            reloadCount.incrementAndGet();
            state = ReloadState.WATCHING;
            if (LOGGER.isLoggable(Level.FINE)) {
                long t2 = System.currentTimeMillis();
                String message = L10N.getString("coordinator.reloaded");
                LOGGER.fine(MessageFormat.format(message, source,
                        published.getGeneration(), (t2 - t1)));
            }
        }
        notifyListeners();
        return true;
    }

    /**
     * Stops watching and reloading. The last published document remains
     * available.
     */
    public void close() {
        ReloadThread thread;
        synchronized (reloadLock) {
            if (state == ReloadState.IDLE) {
                return;
            }
            state = ReloadState.IDLE;
            if (watcher != null) {
                watcher.stopWatching();
                watcher = null;
            }
            thread = reloadThread;
            reloadThread = null;
        }
        if (thread != null) {
            thread.interrupt();
            try {
                thread.join(1000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        pending.clear();

        if (LOGGER.isLoggable(Level.INFO)) {
            String message = L10N.getString("coordinator.stopped");
            LOGGER.info(MessageFormat.format(message, source));
        }
    }

    // Called with reloadLock held
    private MarkupDocument publish(ElementNode root) {
        generation++;
        MarkupDocument doc = new MarkupDocument(root, source,
                System.currentTimeMillis(), generation);
        document.set(doc);
        return doc;
    }

    private void notifyListeners() {
        for (DocumentListener listener : listeners) {
            try {
                listener.documentChanged();
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, L10N.getString("coordinator.listener_failed"), e);
            }
        }
    }

    /**
     * Takes queued changes, debounces them and runs one reparse per batch.
     */
    private class ReloadThread extends Thread {

        ReloadThread() {
            super("hotview-reload-" + source.getFileName());
            setDaemon(true);
        }

        @Override
        public void run() {
            while (!isInterrupted()) {
                try {
                    pending.take();
                    long debounce = configuration.getDebounceMillis();
                    if (debounce > 0L) {
                        Thread.sleep(debounce);
                    }
                    // Coalesce changes that arrived while waiting
                    pending.clear();
                    reload();
                } catch (InterruptedException e) {
                    break;
                } catch (RuntimeException e) {
                    LOGGER.log(Level.WARNING, L10N.getString("coordinator.cycle_failed"), e);
                }
            }
        }

    }

}
