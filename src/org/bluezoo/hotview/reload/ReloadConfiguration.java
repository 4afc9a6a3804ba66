/*
 * ReloadConfiguration.java
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

/**
 * Reload tuning. Defaults are read from system properties:
 * <dl>
 * <dt>{@code hotview.reload.debounce}</dt>
 * <dd>milliseconds to wait after a change before reparsing, default 50</dd>
 * <dt>{@code hotview.reload.poll}</dt>
 * <dd>watch service poll interval in milliseconds, default 500</dd>
 * <dt>{@code hotview.reload.watch}</dt>
 * <dd>whether to watch the filesystem at all, default true</dd>
 * </dl>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ReloadConfiguration {

    static final long DEFAULT_DEBOUNCE = 50L;
    static final long DEFAULT_POLL = 500L;

    private long debounceMillis;
    private long pollMillis;
    private boolean watchEnabled;

    public ReloadConfiguration() {
        debounceMillis = Long.getLong("hotview.reload.debounce", DEFAULT_DEBOUNCE);
        pollMillis = Long.getLong("hotview.reload.poll", DEFAULT_POLL);
        watchEnabled = Boolean.parseBoolean(System.getProperty("hotview.reload.watch", "true"));
    }

    public long getDebounceMillis() {
        return debounceMillis;
    }

    public void setDebounceMillis(long debounceMillis) {
        if (debounceMillis < 0L) {
            throw new IllegalArgumentException("debounce: " + debounceMillis);
        }
        this.debounceMillis = debounceMillis;
    }

    public long getPollMillis() {
        return pollMillis;
    }

    public void setPollMillis(long pollMillis) {
        if (pollMillis <= 0L) {
            throw new IllegalArgumentException("poll: " + pollMillis);
        }
        this.pollMillis = pollMillis;
    }

    public boolean isWatchEnabled() {
        return watchEnabled;
    }

    public void setWatchEnabled(boolean watchEnabled) {
        this.watchEnabled = watchEnabled;
    }

}
