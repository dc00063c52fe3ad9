/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Quarry.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.quarry.engine;

import com.hellblazer.quarry.engine.EngineException.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class EngineConfigurationLoaderTest {

    private final EngineConfigurationLoader loader = new EngineConfigurationLoader();

    @Test
    void testLoadResource() {
        var config = loader.loadResource("/quarry-engine-test.json");
        assertEquals(3, config.workerCount());
        assertEquals(25, config.chunkSize());
        assertEquals(10, config.recycleThreshold());
        assertTrue(config.throttled());
        assertEquals(5, config.inFlightBound());
        assertEquals(2, config.outputDim());
        assertEquals("acquisition", config.label());
        assertTrue(config.verbose());
    }

    @Test
    void testMissingKeysFallBackToDefaults() {
        var config = loader.loadResource("/quarry-engine-partial.json");
        var defaults = EngineConfiguration.defaultConfig();
        assertEquals(64, config.chunkSize());
        assertEquals("partial", config.label());
        assertEquals(defaults.workerCount(), config.workerCount());
        assertEquals(defaults.recycleThreshold(), config.recycleThreshold());
        assertEquals(defaults.throttled(), config.throttled());
    }

    @Test
    void testDefaultResourceAbsent() {
        assertEquals(EngineConfiguration.defaultConfig(), loader.load());
    }

    @Test
    void testMissingResource() {
        assertThrows(ConfigurationException.class, () -> loader.loadResource("/no-such-config.json"));
    }

    @Test
    void testLoadFile(@TempDir Path dir) throws IOException {
        var file = dir.resolve("engine.json");
        Files.writeString(file, "{\"workerCount\": 2, \"throttled\": true}");
        var config = loader.load(file);
        assertEquals(2, config.workerCount());
        assertTrue(config.throttled());
        assertEquals(3, config.effectiveInFlightBound(config.workerCount()));
    }

    @Test
    void testWrongTypes(@TempDir Path dir) throws IOException {
        var file = dir.resolve("bad.json");
        Files.writeString(file, "{\"chunkSize\": \"large\"}");
        assertThrows(ConfigurationException.class, () -> loader.load(file));

        Files.writeString(file, "{\"throttled\": 1}");
        assertThrows(ConfigurationException.class, () -> loader.load(file));
    }

    @Test
    void testLabelMustBeText(@TempDir Path dir) throws IOException {
        var file = dir.resolve("label.json");
        Files.writeString(file, "{\"label\": 5}");
        var e = assertThrows(ConfigurationException.class, () -> loader.load(file));
        assertTrue(e.getMessage().contains("label"), e.getMessage());

        Files.writeString(file, "{\"label\": {\"name\": \"scoring\"}}");
        assertThrows(ConfigurationException.class, () -> loader.load(file));

        Files.writeString(file, "{\"label\": [\"scoring\"]}");
        assertThrows(ConfigurationException.class, () -> loader.load(file));

        Files.writeString(file, "{\"label\": null}");
        assertEquals("", loader.load(file).label());

        Files.writeString(file, "{\"label\": \"scoring\"}");
        assertEquals("scoring", loader.load(file).label());
    }

    @Test
    void testInvalidValues(@TempDir Path dir) throws IOException {
        var file = dir.resolve("invalid.json");
        Files.writeString(file, "{\"chunkSize\": 0}");
        assertThrows(ConfigurationException.class, () -> loader.load(file));
    }

    @Test
    void testNotAnObject(@TempDir Path dir) throws IOException {
        var file = dir.resolve("array.json");
        Files.writeString(file, "[1, 2, 3]");
        assertThrows(ConfigurationException.class, () -> loader.load(file));
    }

    @Test
    void testMalformedJson(@TempDir Path dir) throws IOException {
        var file = dir.resolve("broken.json");
        Files.writeString(file, "{\"chunkSize\": ");
        var e = assertThrows(ConfigurationException.class, () -> loader.load(file));
        assertNotNull(e.getCause());
    }

    @Test
    void testMissingFile(@TempDir Path dir) {
        assertThrows(ConfigurationException.class, () -> loader.load(dir.resolve("absent.json")));
    }
}
