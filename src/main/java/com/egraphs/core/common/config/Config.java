/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.egraphs.core.common.config;

import com.egraphs.core.common.exception.EGException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

import static com.egraphs.core.common.exception.ErrorMessage.Config.CONFIG_FILE_NOT_READABLE;
import static com.egraphs.core.common.exception.ErrorMessage.Config.CONFIG_KEY_MISSING;

/**
 * Settings of the translators and the transformation engine.
 *
 * The defaults ship as {@code egraphs.properties} on the classpath. Setting the system property
 * {@code egraphs.conf} to a file path layers that file on top of the defaults.
 */
public class Config {

    private static final Logger LOG = LoggerFactory.getLogger(Config.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "egraphs.properties";
    private static Config defaultConfig = null;

    private final Properties prop;

    private Config(Properties prop) {
        this.prop = prop;
    }

    /**
     * @return the shared configuration. The override file is read on the first call only; use
     * {@link #load()} to pick up a later change of {@code egraphs.conf}.
     */
    public static synchronized Config create() {
        if (defaultConfig == null) defaultConfig = load();
        return defaultConfig;
    }

    /**
     * @return a fresh configuration: the classpath defaults, overridden by the file that
     * {@code egraphs.conf} currently names, if any
     */
    public static Config load() {
        Properties properties = readDefaults();
        String override = SystemProperty.CONFIGURATION_FILE.value();
        if (override != null) properties.putAll(read(Paths.get(override)).properties());
        return new Config(properties);
    }

    private static Properties readDefaults() {
        try (InputStream inputStream = Config.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (inputStream == null) throw EGException.of(CONFIG_FILE_NOT_READABLE, DEFAULT_CONFIG_RESOURCE);
            return read(inputStream).properties();
        } catch (IOException e) {
            throw EGException.of(CONFIG_FILE_NOT_READABLE, DEFAULT_CONFIG_RESOURCE);
        }
    }

    public static Config read(Path path) {
        try (InputStream inputStream = Files.newInputStream(path)) {
            LOG.debug("Reading configuration from {}", path);
            return read(inputStream);
        } catch (IOException e) {
            throw EGException.of(CONFIG_FILE_NOT_READABLE, path);
        }
    }

    public static Config read(InputStream inputStream) {
        Properties prop = new Properties();
        try {
            prop.load(inputStream);
        } catch (IOException e) {
            throw EGException.of(CONFIG_FILE_NOT_READABLE, "<input stream>");
        }
        return Config.of(prop);
    }

    public static Config of(Properties properties) {
        Properties localProps = new Properties();
        properties.forEach((key, value) -> localProps.setProperty((String) key, (String) value));
        return new Config(localProps);
    }

    /**
     * @return a copy of this configuration with one property replaced
     */
    public <T> Config with(ConfigKey<T> key, T value) {
        Properties copy = new Properties();
        copy.putAll(prop);
        copy.setProperty(key.name(), key.valueToString(value));
        return new Config(copy);
    }

    public Properties properties() {
        return prop;
    }

    public <T> T getProperty(ConfigKey<T> key) {
        String value = prop.getProperty(key.name());
        if (value == null) throw EGException.of(CONFIG_KEY_MISSING, key.name());
        return key.parser().read(value);
    }
}
