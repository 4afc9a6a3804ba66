/*
 * LaconicFormatter.java
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

package org.bluezoo.hotview.util;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * A logging formatter that prints the minimum of information: the level,
 * the simple name of the logging class and the message, followed by the
 * stack trace of any attached exception.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class LaconicFormatter extends Formatter {

    /**
     * Installs this formatter on the console handlers of the root logger,
     * adding a console handler if there is none, and sets the root level.
     *
     * @param level the level to log at
     */
    public static void install(Level level) {
        Logger rootLogger = Logger.getLogger("");
        Handler console = null;
        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                console = handler;
                break;
            }
        }
        if (console == null) {
            console = new ConsoleHandler();
            rootLogger.addHandler(console);
        }
        console.setFormatter(new LaconicFormatter());
        console.setLevel(level);
        rootLogger.setLevel(level);
    }

    @Override
    public String format(LogRecord record) {
        StringBuilder buf = new StringBuilder();
        buf.append(record.getLevel().getLocalizedName());
        String source = record.getLoggerName();
        if (source != null) {
            buf.append(" [");
            buf.append(source.substring(source.lastIndexOf('.') + 1));
            buf.append(']');
        }
        buf.append(": ");
        String message = formatMessage(record);
        if (message != null) {
            buf.append(message);
        }
        buf.append(System.getProperty("line.separator"));
        Throwable t = record.getThrown();
        if (t != null) {
            StringWriter sink = new StringWriter();
            PrintWriter filter = new PrintWriter(sink);
            t.printStackTrace(filter);
            filter.flush();
            buf.append(sink.toString());
        }
        return buf.toString();
    }

}
