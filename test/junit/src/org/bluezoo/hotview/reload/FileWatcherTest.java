/*
 * FileWatcherTest.java
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

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import static org.junit.Assert.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Unit tests for FileWatcher.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FileWatcherTest {

    @Rule
    public TemporaryFolder tempFolder = new TemporaryFolder();

    private Path root;
    private BlockingQueue<FileChangeEvent> events;
    private FileWatcher watcher;

    @Before
    public void setUp() throws Exception {
        root = tempFolder.getRoot().toPath();
        events = new LinkedBlockingQueue<FileChangeEvent>();
        watcher = new FileWatcher(root, new FileWatcher.ChangeCallback() {
            @Override
            public void fileChanged(FileChangeEvent event) {
                events.add(event);
            }
        }, 50L);
    }

    @After
    public void tearDown() {
        watcher.stopWatching();
    }

    /**
     * Watch event with a fixed kind and context.
     */
    private static class TestEvent<T> implements WatchEvent<T> {

        private final WatchEvent.Kind<T> kind;
        private final T context;

        TestEvent(WatchEvent.Kind<T> kind, T context) {
            this.kind = kind;
            this.context = context;
        }

        @Override
        public WatchEvent.Kind<T> kind() {
            return kind;
        }

        @Override
        public int count() {
            return 1;
        }

        @Override
        public T context() {
            return context;
        }
    }

    private static void write(Path file, String content) throws Exception {
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    }

    private FileChangeEvent modify(Path name) {
        return watcher.classify(root, new TestEvent<Path>(StandardWatchEventKinds.ENTRY_MODIFY, name));
    }

    @Test
    public void testContentChangeIsData() throws Exception {
        Path file = root.resolve("main.xml");
        write(file, "<div/>");

        FileChangeEvent first = modify(file.getFileName());
        assertEquals(FileChangeEvent.Kind.DATA, first.getKind());
        assertTrue(first.isDataChange());
        assertEquals(file, first.getPath());

        write(file, "<div>changed</div>");
        assertEquals(FileChangeEvent.Kind.DATA, modify(file.getFileName()).getKind());
    }

    @Test
    public void testTouchIsMetadata() throws Exception {
        Path file = root.resolve("main.xml");
        write(file, "<div/>");
        modify(file.getFileName());

        write(file, "<div/>");
        FileChangeEvent touched = modify(file.getFileName());
        assertEquals(FileChangeEvent.Kind.METADATA, touched.getKind());
        assertFalse(touched.isDataChange());
    }

    @Test
    public void testSameSizeDifferentContentIsData() throws Exception {
        Path file = root.resolve("main.xml");
        write(file, "<div>a</div>");
        modify(file.getFileName());

        write(file, "<div>b</div>");
        assertEquals(FileChangeEvent.Kind.DATA, modify(file.getFileName()).getKind());
    }

    @Test
    public void testDeleteAndOverflow() throws Exception {
        Path name = root.relativize(root.resolve("gone.xml"));
        FileChangeEvent deleted = watcher.classify(root,
                new TestEvent<Path>(StandardWatchEventKinds.ENTRY_DELETE, name));
        assertEquals(FileChangeEvent.Kind.DELETE, deleted.getKind());

        FileChangeEvent overflow = watcher.classify(root,
                new TestEvent<Object>(StandardWatchEventKinds.OVERFLOW, null));
        assertEquals(FileChangeEvent.Kind.OVERFLOW, overflow.getKind());
        assertEquals(root, overflow.getPath());
    }

    @Test
    public void testNewDirectoryIsCreate() throws Exception {
        Path dir = Files.createDirectory(root.resolve("components"));
        FileChangeEvent created = watcher.classify(root,
                new TestEvent<Path>(StandardWatchEventKinds.ENTRY_CREATE, dir.getFileName()));
        assertEquals(FileChangeEvent.Kind.CREATE, created.getKind());
    }

    @Test
    public void testVanishedFileIgnored() {
        assertNull(modify(root.relativize(root.resolve("missing.xml"))));
    }

    @Test
    public void testWatchReportsContentChange() throws Exception {
        Path file = root.resolve("main.xml");
        write(file, "<div>T0</div>");
        watcher.startWatching();

        write(file, "<div>T1</div>");

        long deadline = System.currentTimeMillis() + 30000L;
        boolean seen = false;
        while (!seen && System.currentTimeMillis() < deadline) {
            FileChangeEvent event = events.poll(500L, TimeUnit.MILLISECONDS);
            seen = event != null && event.isDataChange() && file.equals(event.getPath());
        }
        assertTrue(seen);
    }

}
