/*
 * FileWatcher.java
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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.text.MessageFormat;
import java.util.HashMap;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.zip.CRC32;

/**
 * Watches a directory tree and reports classified changes.
 *
 * <p>The JDK {@link WatchService} reports any touch of a file as a
 * modification. To tell content writes apart from metadata changes the
 * watcher keeps a fingerprint (size and CRC-32) of every regular file it
 * has seen: a modification that leaves the fingerprint unchanged is
 * reported as {@link FileChangeEvent.Kind#METADATA}.
 *
 * <p>Events are handed to the callback synchronously on the watcher
 * thread, so a slow consumer holds back further events.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FileWatcher extends Thread {

    private static final Logger LOGGER = Logger.getLogger(FileWatcher.class.getName());
    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.hotview.reload.L10N");

    /**
     * Receives classified change events.
     */
    public interface ChangeCallback {

        /**
         * Called on the watcher thread for each change.
         *
         * @param event the change
         * @throws InterruptedException if interrupted while handing off
         */
        void fileChanged(FileChangeEvent event) throws InterruptedException;

    }

    private final Path root;
    private final ChangeCallback callback;
    private final long pollMillis;
    private final WatchService watchService;
    private final Map<WatchKey, Path> watchKeys;
    private final Map<Path, Fingerprint> fingerprints;

    private volatile boolean running = true;

    /**
     * Creates a new watcher.
     *
     * @param root the root of the directory tree to watch
     * @param callback the receiver of change events
     * @param pollMillis the watch service poll interval
     * @throws IOException if the watch service cannot be created
     */
    public FileWatcher(Path root, ChangeCallback callback, long pollMillis) throws IOException {
        super("hotview-watch-" + root.getFileName());
        this.root = root;
        this.callback = callback;
        this.pollMillis = pollMillis;
        this.watchService = FileSystems.getDefault().newWatchService();
        this.watchKeys = new HashMap<WatchKey, Path>();
        this.fingerprints = new HashMap<Path, Fingerprint>();

        setDaemon(true);
        setPriority(Thread.MIN_PRIORITY);
    }

    /**
     * Registers the directory tree and starts the watcher thread.
     *
     * @throws IOException if the tree cannot be registered
     */
    public void startWatching() throws IOException {
        registerAll(root);
        start();

        if (LOGGER.isLoggable(Level.INFO)) {
            String message = MessageFormat.format(L10N.getString("watcher.started"),
                    root, watchKeys.size());
            LOGGER.info(message);
        }
    }

    /**
     * Stops the watcher thread and releases the watch service.
     */
    public void stopWatching() {
        running = false;
        interrupt();

        try {
            watchService.close();
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, L10N.getString("watcher.close_error"), e);
        }
    }

    @Override
    public void run() {
        while (running && !isInterrupted()) {
            try {
                WatchKey key = watchService.poll(pollMillis, TimeUnit.MILLISECONDS);
                if (key == null) {
                    continue;
                }

                Path dir = watchKeys.get(key);
                if (dir == null) {
                    key.reset();
                    continue;
                }

                for (WatchEvent<?> event : key.pollEvents()) {
                    FileChangeEvent change = classify(dir, event);
                    if (change == null) {
                        continue;
                    }
                    if (LOGGER.isLoggable(Level.FINE)) {
                        String message = L10N.getString("watcher.change_detected");
                        LOGGER.fine(MessageFormat.format(message, change));
                    }
                    callback.fileChanged(change);
                }

                if (!key.reset()) {
                    watchKeys.remove(key);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ClosedWatchServiceException e) {
                break;
            }
        }
    }

    /**
     * Turns a raw watch event into a change event, or returns null if the
     * event should not be reported.
     */
    FileChangeEvent classify(Path dir, WatchEvent<?> event) {
        WatchEvent.Kind<?> kind = event.kind();
        if (kind == StandardWatchEventKinds.OVERFLOW) {
            return new FileChangeEvent(FileChangeEvent.Kind.OVERFLOW, dir);
        }
        Path changedPath = dir.resolve((Path) event.context());
        if (kind == StandardWatchEventKinds.ENTRY_DELETE) {
            fingerprints.remove(changedPath);
            return new FileChangeEvent(FileChangeEvent.Kind.DELETE, changedPath);
        }
        if (Files.isDirectory(changedPath)) {
            if (kind != StandardWatchEventKinds.ENTRY_CREATE) {
                return null;
            }
            try {
                registerAll(changedPath);
            } catch (IOException e) {
                String message = MessageFormat.format(
                    L10N.getString("watcher.watch_failed"), changedPath);
                LOGGER.log(Level.WARNING, message, e);
            }
            return new FileChangeEvent(FileChangeEvent.Kind.CREATE, changedPath);
        }
        if (!Files.isRegularFile(changedPath)) {
            return null;
        }
        Fingerprint current;
        try {
            current = Fingerprint.of(changedPath);
        } catch (IOException e) {
            // Removed or locked while being written; a later event follows
            if (LOGGER.isLoggable(Level.FINE)) {
                String message = L10N.getString("watcher.fingerprint_failed");
                LOGGER.log(Level.FINE, MessageFormat.format(message, changedPath), e);
            }
            return null;
        }
        Fingerprint previous = fingerprints.put(changedPath, current);
        FileChangeEvent.Kind changeKind = current.equals(previous)
            ? FileChangeEvent.Kind.METADATA
            : FileChangeEvent.Kind.DATA;
        return new FileChangeEvent(changeKind, changedPath);
    }

    /**
     * Registers a directory and all its subdirectories, recording the
     * fingerprints of the files found.
     */
    private void registerAll(Path start) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs)
                    throws IOException {
                registerDirectory(dir);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
                    throws IOException {
                if (attrs.isRegularFile()) {
                    fingerprints.put(file, Fingerprint.of(file));
                }
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void registerDirectory(Path dir) throws IOException {
        WatchKey key = dir.register(watchService,
            StandardWatchEventKinds.ENTRY_CREATE,
            StandardWatchEventKinds.ENTRY_DELETE,
            StandardWatchEventKinds.ENTRY_MODIFY);
        watchKeys.put(key, dir);

        if (LOGGER.isLoggable(Level.FINE)) {
            String message = MessageFormat.format(
                L10N.getString("watcher.watching"), dir);
            LOGGER.fine(message);
        }
    }

    /**
     * Size and checksum of a file's content.
     */
    static final class Fingerprint {

        final long size;
        final long checksum;

        Fingerprint(long size, long checksum) {
            this.size = size;
            this.checksum = checksum;
        }

        static Fingerprint of(Path file) throws IOException {
            CRC32 crc = new CRC32();
            long size = 0L;
            try (InputStream in = Files.newInputStream(file)) {
                byte[] buf = new byte[8192];
                for (int len = in.read(buf); len != -1; len = in.read(buf)) {
                    crc.update(buf, 0, len);
                    size += len;
                }
            }
            return new Fingerprint(size, crc.getValue());
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (!(obj instanceof Fingerprint)) {
                return false;
            }
            Fingerprint other = (Fingerprint) obj;
            return size == other.size && checksum == other.checksum;
        }

        @Override
        public int hashCode() {
            return (int) (size ^ checksum);
        }

    }

}
