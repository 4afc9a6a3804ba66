/*
 * ReloadConfigurationTest.java
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
import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Unit tests for ReloadConfiguration.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ReloadConfigurationTest {

    @After
    public void tearDown() {
        System.clearProperty("hotview.reload.debounce");
        System.clearProperty("hotview.reload.poll");
        System.clearProperty("hotview.reload.watch");
    }

    @Test
    public void testDefaults() {
        ReloadConfiguration configuration = new ReloadConfiguration();
        assertEquals(50L, configuration.getDebounceMillis());
        assertEquals(500L, configuration.getPollMillis());
        assertTrue(configuration.isWatchEnabled());
    }

    @Test
    public void testSystemProperties() {
        System.setProperty("hotview.reload.debounce", "200");
        System.setProperty("hotview.reload.poll", "1000");
        System.setProperty("hotview.reload.watch", "false");

        ReloadConfiguration configuration = new ReloadConfiguration();

        assertEquals(200L, configuration.getDebounceMillis());
        assertEquals(1000L, configuration.getPollMillis());
        assertFalse(configuration.isWatchEnabled());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeDebounce() {
        new ReloadConfiguration().setDebounceMillis(-1L);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroPoll() {
        new ReloadConfiguration().setPollMillis(0L);
    }

}
