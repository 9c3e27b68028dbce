////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.phpls.config;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@link IndexOptions} from the {@code initializationOptions} object a
 * client sends with {@code initialize}. Missing or mistyped values fall back
 * to the defaults.
 */
public final class IndexOptionsParser {

    private static final Logger logger = LoggerFactory.getLogger(IndexOptionsParser.class);

    static final String CASE_SENSITIVE_SEARCH_OPTION = "caseSensitiveSearch";
    static final String EXTERNAL_ONLY_OPTION = "externalOnly";
    static final String DEBOUNCE_DELAY_OPTION = "debounceDelayMs";
    static final String LOG_LEVEL_OPTION = "logLevel";
    static final String BUILT_IN_TYPES_OPTION = "builtInTypes";

    private IndexOptionsParser() {
    }

    /**
     * Parses the options and applies the log level, if one is given.
     *
     * @return the parsed options, or {@link IndexOptions#DEFAULTS} if the
     *         input is not a {@link JsonObject}
     */
    public static IndexOptions parse(Object initOptions) {
        if (!(initOptions instanceof JsonObject)) {
            return IndexOptions.DEFAULTS;
        }
        JsonObject opts = (JsonObject) initOptions;
        IndexOptions defaults = IndexOptions.DEFAULTS;

        String logLevel = stringOption(opts, LOG_LEVEL_OPTION);
        if (logLevel != null) {
            applyLogLevel(logLevel);
        }

        boolean caseSensitive = booleanOption(opts, CASE_SENSITIVE_SEARCH_OPTION, defaults.isCaseSensitiveSearch());
        boolean externalOnly = booleanOption(opts, EXTERNAL_ONLY_OPTION, defaults.isExternalOnly());
        long debounceDelay = parseDebounceDelayOption(opts, defaults.getDebounceDelayMs());
        Set<String> builtInTypes = parseBuiltInTypesOption(opts, defaults.getBuiltInTypes());

        IndexOptions options = new IndexOptions(caseSensitive, externalOnly, debounceDelay, builtInTypes);
        logger.info("Index options: {}", options);
        return options;
    }

    /**
     * Dynamically set the Logback root logger level from a string value.
     * Accepted values (case-insensitive): ERROR, WARN, INFO, DEBUG, TRACE.
     * Invalid values are ignored and a warning is logged.
     */
    static void applyLogLevel(String levelName) {
        try {
            ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
            if (level == null) {
                logger.warn("Unknown log level '{}', keeping current level", levelName);
                return;
            }
            ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
                    LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            ch.qos.logback.classic.Level previous = root.getLevel();
            root.setLevel(level);
            logger.info("Log level changed from {} to {}", previous, level);
        } catch (ClassCastException e) {
            logger.warn("Failed to set log level to '{}': {}", levelName, e.getMessage());
        }
    }

    private static boolean booleanOption(JsonObject opts, String name, boolean defaultValue) {
        JsonElement element = opts.get(name);
        if (element == null || element.isJsonNull()) {
            return defaultValue;
        }
        if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isBoolean()) {
            return element.getAsBoolean();
        }
        logger.warn("Ignoring {}: expected a boolean but got {}", name, element);
        return defaultValue;
    }

    private static String stringOption(JsonObject opts, String name) {
        JsonElement element = opts.get(name);
        if (element != null && element.isJsonPrimitive() && element.getAsJsonPrimitive().isString()) {
            return element.getAsString();
        }
        return null;
    }

    private static long parseDebounceDelayOption(JsonObject opts, long defaultValue) {
        JsonElement element = opts.get(DEBOUNCE_DELAY_OPTION);
        if (element == null || element.isJsonNull()) {
            return defaultValue;
        }
        if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isNumber()) {
            long value = element.getAsLong();
            if (value >= 0) {
                return value;
            }
        }
        logger.warn("Ignoring {}: expected a non-negative number but got {}", DEBOUNCE_DELAY_OPTION, element);
        return defaultValue;
    }

    /**
     * Extra built-in type names are added to the defaults, never replace them.
     */
    private static Set<String> parseBuiltInTypesOption(JsonObject opts, Set<String> defaults) {
        JsonElement element = opts.get(BUILT_IN_TYPES_OPTION);
        if (element == null || element.isJsonNull()) {
            return defaults;
        }
        if (!element.isJsonArray()) {
            logger.warn("Ignoring {}: expected an array but got {}", BUILT_IN_TYPES_OPTION, element);
            return defaults;
        }
        Set<String> types = new HashSet<>(defaults);
        for (JsonElement entry : element.getAsJsonArray()) {
            if (entry.isJsonPrimitive() && entry.getAsJsonPrimitive().isString()) {
                String name = entry.getAsString().trim();
                if (!name.isEmpty()) {
                    types.add(name.toLowerCase(Locale.ROOT));
                }
            } else {
                logger.warn("Ignoring non-string entry in {}: {}", BUILT_IN_TYPES_OPTION, entry);
            }
        }
        return types;
    }
}
