/*
 * MarkupParser.java
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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.MessageFormat;
import java.util.List;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Parses markup documents into element trees by running a
 * {@link MarkupEventReader} followed by a {@link TreeBuilder}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class MarkupParser {

    private static final Logger LOGGER = Logger.getLogger(MarkupParser.class.getName());
    private static final ResourceBundle L10N = MarkupEventReader.L10N;

    private final MarkupEventReader reader;
    private final TreeBuilder builder;

    public MarkupParser() {
        this(new MarkupEventReader(), new TreeBuilder());
    }

    public MarkupParser(MarkupEventReader reader, TreeBuilder builder) {
        this.reader = reader;
        this.builder = builder;
    }

    /**
     * Parses a UTF-8 markup file. Content that is not valid UTF-8 fails
     * with a {@link StreamReadException}.
     *
     * @param file the file to parse
     * @return the root element
     * @throws IOException if the file cannot be read
     * @throws MarkupException if the file is not valid markup
     */
    public ElementNode parse(Path file) throws IOException, MarkupException {
        long t1 = System.currentTimeMillis();
        byte[] content = Files.readAllBytes(file);
        String systemId = file.toString();
        ElementNode root = parse(MarkupEventReader.decode(content, systemId), systemId);
        if (LOGGER.isLoggable(Level.FINE)) {
            long t2 = System.currentTimeMillis();
            String message = L10N.getString("parser.parsed");
            LOGGER.fine(MessageFormat.format(message, systemId, root.countNodes(), (t2 - t1)));
        }
        return root;
    }

    /**
     * Parses UTF-8 markup from a stream.
     *
     * @param in the stream, read to the end but not closed
     * @param systemId the document system ID used in error messages
     * @return the root element
     * @throws IOException if the stream cannot be read
     * @throws MarkupException if the content is not valid markup
     */
    public ElementNode parse(InputStream in, String systemId) throws IOException, MarkupException {
        List<MarkupEvent> events = reader.read(in, systemId);
        return builder.build(events, systemId);
    }

    /**
     * Parses markup held in a string.
     *
     * @param markup the markup text
     * @param systemId the document system ID used in error messages
     * @return the root element
     * @throws MarkupException if the text is not valid markup
     */
    public ElementNode parse(String markup, String systemId) throws MarkupException {
        List<MarkupEvent> events = reader.read(markup, systemId);
        return builder.build(events, systemId);
    }

}
