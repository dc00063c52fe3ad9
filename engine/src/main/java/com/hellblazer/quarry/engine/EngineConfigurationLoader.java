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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.quarry.engine.EngineException.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link EngineConfiguration} from JSON.
 *
 * <p>Recognized keys: {@code workerCount}, {@code chunkSize}, {@code recycleThreshold}, {@code throttled},
 * {@code inFlightBound}, {@code outputDim}, {@code label}, {@code verbose}. Missing keys keep the value of
 * {@link EngineConfiguration#defaultConfig()}.
 *
 * @author hal.hildebrand
 */
public class EngineConfigurationLoader {
    private static final Logger log = LoggerFactory.getLogger(EngineConfigurationLoader.class);

    /** Classpath resource consulted by {@link #load()} */
    public static final String DEFAULT_RESOURCE = "/quarry-engine.json";

    private final ObjectMapper objectMapper;

    public EngineConfigurationLoader() {
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Load the default classpath resource, falling back to defaults when it is absent.
     *
     * @return the loaded configuration
     */
    public EngineConfiguration load() {
        try (InputStream is = getClass().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                log.debug("No {} on the classpath, using defaults", DEFAULT_RESOURCE);
                return EngineConfiguration.defaultConfig();
            }
            return parse(objectMapper.readTree(is), DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Load a configuration from a classpath resource.
     *
     * @param resource absolute resource name, e.g. {@code /engine.json}
     * @return the loaded configuration
     * @throws ConfigurationException if the resource is missing or malformed
     */
    public EngineConfiguration loadResource(String resource) {
        try (InputStream is = getClass().getResourceAsStream(resource)) {
            if (is == null) {
                throw new ConfigurationException("Configuration resource not found: " + resource);
            }
            return parse(objectMapper.readTree(is), resource);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + resource, e);
        }
    }

    /**
     * Load a configuration from a file.
     *
     * @param file the JSON file
     * @return the loaded configuration
     * @throws ConfigurationException if the file cannot be read or is malformed
     */
    public EngineConfiguration load(Path file) {
        try (InputStream is = Files.newInputStream(file)) {
            return parse(objectMapper.readTree(is), file.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + file, e);
        }
    }

    private EngineConfiguration parse(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Configuration in " + source + " must be a JSON object");
        }
        var defaults = EngineConfiguration.defaultConfig();
        var config = new EngineConfiguration(intValue(root, "workerCount", defaults.workerCount(), source),
                                             intValue(root, "chunkSize", defaults.chunkSize(), source),
                                             intValue(root, "recycleThreshold", defaults.recycleThreshold(), source),
                                             booleanValue(root, "throttled", defaults.throttled(), source),
                                             intValue(root, "inFlightBound", defaults.inFlightBound(), source),
                                             intValue(root, "outputDim", defaults.outputDim(), source),
                                             textValue(root, "label", defaults.label(), source),
                                             booleanValue(root, "verbose", defaults.verbose(), source));
        log.info("Loaded engine configuration from {}: {}", source, config);
        return config;
    }

    private static int intValue(JsonNode root, String key, int defaultValue, String source) {
        var node = root.get(key);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new ConfigurationException(String.format("%s in %s must be an integer: %s", key, source, node));
        }
        return node.intValue();
    }

    private static boolean booleanValue(JsonNode root, String key, boolean defaultValue, String source) {
        var node = root.get(key);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (!node.isBoolean()) {
            throw new ConfigurationException(String.format("%s in %s must be a boolean: %s", key, source, node));
        }
        return node.booleanValue();
    }

    private static String textValue(JsonNode root, String key, String defaultValue, String source) {
        var node = root.get(key);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (!node.isTextual()) {
            throw new ConfigurationException(String.format("%s in %s must be a string: %s", key, source, node));
        }
        return node.textValue();
    }
}
