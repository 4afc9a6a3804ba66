/*
 * MarkupEventReader.java
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

import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.Locator;
import org.xml.sax.SAXException;
import org.xml.sax.SAXNotRecognizedException;
import org.xml.sax.SAXNotSupportedException;
import org.xml.sax.SAXParseException;
import org.xml.sax.XMLReader;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * SAX-based tag stream reader.
 *
 * <p>The reader delegates all XML tokenization to a JAXP SAX parser and
 * adapts its callbacks into a flat list of {@link MarkupEvent}s:
 * <ul>
 * <li>each {@code startElement} becomes a START event carrying the local
 *     name and the attributes in SAX order;</li>
 * <li>each {@code endElement} becomes an END event;</li>
 * <li>character data between two tags is accumulated, trimmed, and
 *     emitted as a single TEXT event if anything remains.</li>
 * </ul>
 * Self-closing elements are reported by SAX as a start followed by an
 * end, so this reader never produces EMPTY events.
 *
 * <p>A blank document yields an empty event list rather than an error:
 * editors frequently truncate a file before writing its new content.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class MarkupEventReader {

    static final Logger LOGGER = Logger.getLogger(MarkupEventReader.class.getName());
    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.hotview.markup.L10N");

    private static final String LOAD_EXTERNAL_DTD =
        "http://apache.org/xml/features/nonvalidating/load-external-dtd";

    private final SAXParserFactory saxParserFactory;

    /**
     * Creates a reader using the platform default SAX parser factory.
     */
    public MarkupEventReader() {
        this(SAXParserFactory.newInstance());
    }

    /**
     * Creates a reader using the given SAX parser factory.
     *
     * @param saxParserFactory the factory to obtain parsers from
     */
    public MarkupEventReader(SAXParserFactory saxParserFactory) {
        this.saxParserFactory = saxParserFactory;
        saxParserFactory.setNamespaceAware(true);
        saxParserFactory.setValidating(false);
        setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        setFeature(LOAD_EXTERNAL_DTD, false);
    }

    private void setFeature(String feature, boolean value) {
        try {
            saxParserFactory.setFeature(feature, value);
        } catch (ParserConfigurationException | SAXNotRecognizedException
                | SAXNotSupportedException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                String message = L10N.getString("reader.feature_unsupported");
                LOGGER.log(Level.FINE, MessageFormat.format(message, feature), e);
            }
        }
    }

    /**
     * Reads UTF-8 encoded markup from a stream. Bytes that are not valid
     * UTF-8 fail the read.
     *
     * @param in the input stream, read to the end but not closed
     * @param systemId the document system ID used in error messages
     * @return the tag stream
     * @throws IOException if the stream cannot be read
     * @throws StreamReadException if the markup cannot be tokenized
     */
    public List<MarkupEvent> read(InputStream in, String systemId)
            throws IOException, StreamReadException {
        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        byte[] buf = new byte[4096];
        for (int len = in.read(buf); len != -1; len = in.read(buf)) {
            sink.write(buf, 0, len);
        }
        return read(decode(sink.toByteArray(), systemId), systemId);
    }

    /**
     * Decodes UTF-8 bytes strictly: malformed or unmappable sequences are
     * reported rather than replaced.
     *
     * @param bytes the encoded markup
     * @param systemId the document system ID used in error messages
     * @return the decoded text
     * @throws StreamReadException if the bytes are not valid UTF-8
     */
    static String decode(byte[] bytes, String systemId) throws StreamReadException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer in = ByteBuffer.wrap(bytes);
        CharBuffer out = CharBuffer.allocate(bytes.length + 1);
        CoderResult result = decoder.decode(in, out, true);
        if (!result.isError()) {
            result = decoder.flush(out);
        }
        if (result.isError()) {
            // Locate the offending sequence in the text decoded so far
            int line = 1;
            int column = 1;
            out.flip();
            while (out.hasRemaining()) {
                if (out.get() == '\n') {
                    line++;
                    column = 1;
                } else {
                    column++;
                }
            }
            String message = MessageFormat.format(L10N.getString("reader.bad_encoding"),
                    in.position(), result.length());
            throw new StreamReadException(message, systemId, line, column, null);
        }
        out.flip();
        return out.toString();
    }

    /**
     * Reads markup from a string.
     *
     * @param markup the markup text
     * @param systemId the document system ID used in error messages
     * @return the tag stream, empty if the markup is blank
     * @throws StreamReadException if the markup cannot be tokenized
     */
    public List<MarkupEvent> read(String markup, String systemId) throws StreamReadException {
        if (markup.length() > 0 && markup.charAt(0) == '\uFEFF') {
            markup = markup.substring(1);
        }
        if (markup.trim().isEmpty()) {
            return Collections.emptyList();
        }
        EventCollector collector = new EventCollector();
        try {
            SAXParser parser;
            synchronized (saxParserFactory) {
                parser = saxParserFactory.newSAXParser();
            }
            XMLReader reader = parser.getXMLReader();
            reader.setContentHandler(collector);
            reader.setErrorHandler(collector);
            InputSource source = new InputSource(new StringReader(markup));
            source.setSystemId(systemId);
            reader.parse(source);
        } catch (SAXParseException e) {
            throw new StreamReadException(e.getMessage(), systemId,
                    e.getLineNumber(), e.getColumnNumber(), e);
        } catch (SAXException e) {
            throw new StreamReadException(e.getMessage(), systemId, -1, -1, e);
        } catch (ParserConfigurationException e) {
            throw new StreamReadException(L10N.getString("reader.no_parser"), systemId, -1, -1, e);
        } catch (IOException e) {
            // StringReader does not perform I/O
            throw new StreamReadException(e.getMessage(), systemId, -1, -1, e);
        }
        return collector.events;
    }

    /**
     * SAX handler that records the tag stream.
     */
    private static class EventCollector extends DefaultHandler {

        final List<MarkupEvent> events = new ArrayList<MarkupEvent>();
        private final StringBuilder textBuffer = new StringBuilder();
        private Locator locator;

        @Override
        public void setDocumentLocator(Locator locator) {
            this.locator = locator;
        }

        @Override
        public void startElement(String uri, String localName, String qName, Attributes atts)
                throws SAXException {
            flushText();
            List<Attribute> attributes = new ArrayList<Attribute>(atts.getLength());
            for (int i = 0; i < atts.getLength(); i++) {
                String key = atts.getLocalName(i);
                if (key == null || key.isEmpty()) {
                    key = atts.getQName(i);
                }
                attributes.add(new Attribute(key, atts.getValue(i)));
            }
            events.add(MarkupEvent.start(name(localName, qName), attributes, line(), column()));
        }

        @Override
        public void endElement(String uri, String localName, String qName) throws SAXException {
            flushText();
            events.add(MarkupEvent.end(name(localName, qName), line(), column()));
        }

        @Override
        public void characters(char[] ch, int start, int length) throws SAXException {
            textBuffer.append(ch, start, length);
        }

        @Override
        public void endDocument() throws SAXException {
            flushText();
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        private void flushText() {
            if (textBuffer.length() > 0) {
                String text = textBuffer.toString().trim();
                textBuffer.setLength(0);
                if (!text.isEmpty()) {
                    events.add(MarkupEvent.text(text, line(), column()));
                }
            }
        }

        private String name(String localName, String qName) {
            return localName != null && !localName.isEmpty() ? localName : qName;
        }

        private int line() {
            return locator != null ? locator.getLineNumber() : -1;
        }

        private int column() {
            return locator != null ? locator.getColumnNumber() : -1;
        }

    }

}
