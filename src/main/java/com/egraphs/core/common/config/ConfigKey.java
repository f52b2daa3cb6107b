/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.egraphs.core.common.config;

import com.egraphs.core.common.exception.EGException;

import static com.egraphs.core.common.exception.ErrorMessage.Config.CONFIG_VALUE_UNEXPECTED;

/**
 * Keys of the properties in {@code egraphs.properties}.
 *
 * @param <T> the type of the values of the key
 */
public class ConfigKey<T> {

    /**
     * Describes how to read and write the value of a property.
     *
     * @param <T> The type of the property value
     */
    public interface KeyParser<T> {

        T read(String string);

        default String write(T value) {
            return value.toString();
        }
    }

    public static final KeyParser<String> STRING = string -> string;
    public static final KeyParser<Integer> INT = Integer::parseInt;
    public static final KeyParser<Boolean> BOOL = string -> {
        String trimmed = string.trim();
        if (trimmed.equalsIgnoreCase("true")) return true;
        else if (trimmed.equalsIgnoreCase("false")) return false;
        else throw EGException.of(CONFIG_VALUE_UNEXPECTED, "boolean", string);
    };

    public static final ConfigKey<Boolean> SHARE_CONSTANTS = key("translator.share-constants", BOOL);
    public static final ConfigKey<String> FRESH_NAME_PREFIX = key("renderer.fresh-name-prefix");
    public static final ConfigKey<Boolean> STRICT_CONSTRUCTS = key("renderer.strict-constructs", BOOL);
    public static final ConfigKey<Boolean> VERIFY_INTEGRITY = key("transformation.verify-integrity", BOOL);

    private final String name;
    private final KeyParser<T> parser;

    public ConfigKey(String name, KeyParser<T> parser) {
        this.name = name;
        this.parser = parser;
    }

    public String name() {
        return name;
    }

    public KeyParser<T> parser() {
        return parser;
    }

    public final String valueToString(T value) {
        return parser.write(value);
    }

    public static ConfigKey<String> key(String name) {
        return key(name, STRING);
    }

    public static <T> ConfigKey<T> key(String name, KeyParser<T> parser) {
        return new ConfigKey<>(name, parser);
    }

    @Override
    public String toString() {
        return name;
    }
}
