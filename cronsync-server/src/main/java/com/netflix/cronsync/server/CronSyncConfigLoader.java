/*
 * Copyright 2026 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netflix.cronsync.server;

import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import com.netflix.archaius.api.Config;
import com.netflix.archaius.config.MapConfig;

/**
 * Builds the process configuration. Sources, in decreasing priority order: system properties with the
 * {@value #PROPERTY_PREFIX} prefix, the properties file given on the command line, the {@value #DEFAULT_PROPERTIES}
 * resource on the classpath.
 */
public final class CronSyncConfigLoader {

    static final String PROPERTY_PREFIX = "cronsync.";

    static final String DEFAULT_PROPERTIES = "cronsync.properties";

    private CronSyncConfigLoader() {
    }

    public static Config load(String propertiesFile) {
        return load(propertiesFile, System.getProperties());
    }

    static Config load(String propertiesFile, Properties systemProperties) {
        Map<String, String> merged = new HashMap<>();
        putAll(merged, loadClasspathProperties());
        if (propertiesFile != null) {
            putAll(merged, loadPropertiesFile(propertiesFile));
        }
        for (String name : systemProperties.stringPropertyNames()) {
            if (name.startsWith(PROPERTY_PREFIX)) {
                merged.put(name, systemProperties.getProperty(name));
            }
        }
        return MapConfig.from(merged);
    }

    private static Properties loadClasspathProperties() {
        Properties properties = new Properties();
        try (InputStream input = CronSyncConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_PROPERTIES)) {
            if (input != null) {
                properties.load(input);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load classpath resource: " + DEFAULT_PROPERTIES, e);
        }
        return properties;
    }

    private static Properties loadPropertiesFile(String propertiesFile) {
        Properties properties = new Properties();
        try (FileReader fr = new FileReader(propertiesFile)) {
            properties.load(fr);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot load file: " + propertiesFile, e);
        }
        return properties;
    }

    private static void putAll(Map<String, String> target, Properties properties) {
        for (String name : properties.stringPropertyNames()) {
            target.put(name, properties.getProperty(name));
        }
    }
}
