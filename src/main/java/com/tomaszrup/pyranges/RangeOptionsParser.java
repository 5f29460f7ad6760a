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
package com.tomaszrup.pyranges;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.tomaszrup.pyranges.text.SourceDecodingException;
import com.tomaszrup.pyranges.tokens.EncodingDetector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses {@link RangeOptions} from a JSON object such as
 * <pre>{@code {"defaultEncoding": "latin-1", "warnOnDegenerateRanges": true, "logLevel": "DEBUG"}}</pre>
 * Unknown keys are ignored; invalid values are logged and replaced by the
 * defaults.
 */
public final class RangeOptionsParser {

    private static final Logger logger = LoggerFactory.getLogger(RangeOptionsParser.class);

    static final String DEFAULT_ENCODING_OPTION = "defaultEncoding";
    static final String PARSER_ENCODING_OPTION = "parserEncoding";
    static final String WARN_ON_DEGENERATE_OPTION = "warnOnDegenerateRanges";
    static final String LOG_LEVEL_OPTION = "logLevel";

    private RangeOptionsParser() {
        // utility class
    }

    /**
     * Parse options from JSON text. Malformed JSON yields the defaults.
     */
    public static RangeOptions parse(String json) {
        if (json == null || json.trim().isEmpty()) {
            return RangeOptions.DEFAULT;
        }
        try {
            return parse(JsonParser.parseString(json));
        } catch (JsonParseException e) {
            logger.warn("Ignoring malformed range options: {}", e.getMessage());
            return RangeOptions.DEFAULT;
        }
    }

    /**
     * Parse options and apply the log level, if one is given.
     *
     * @return the parsed options, or {@link RangeOptions#DEFAULT} if the
     *         input is not a {@link JsonObject}
     */
    public static RangeOptions parse(JsonElement options) {
        if (options == null || !options.isJsonObject()) {
            return RangeOptions.DEFAULT;
        }
        JsonObject opts = options.getAsJsonObject();

        String defaultEncoding = parseEncodingOption(opts, DEFAULT_ENCODING_OPTION);
        String parserEncoding = parseEncodingOption(opts, PARSER_ENCODING_OPTION);

        boolean warnOnDegenerate = false;
        if (opts.has(WARN_ON_DEGENERATE_OPTION) && opts.get(WARN_ON_DEGENERATE_OPTION).isJsonPrimitive()) {
            warnOnDegenerate = opts.get(WARN_ON_DEGENERATE_OPTION).getAsBoolean();
        }

        String logLevel = null;
        if (opts.has(LOG_LEVEL_OPTION) && opts.get(LOG_LEVEL_OPTION).isJsonPrimitive()) {
            logLevel = opts.get(LOG_LEVEL_OPTION).getAsString();
            applyLogLevel(logLevel);
        }

        RangeOptions parsed = new RangeOptions(defaultEncoding, parserEncoding, warnOnDegenerate, logLevel);
        logger.debug("Parsed {}", parsed);
        return parsed;
    }

    private static String parseEncodingOption(JsonObject opts, String option) {
        if (!opts.has(option) || !opts.get(option).isJsonPrimitive()) {
            return RangeOptions.DEFAULT_ENCODING;
        }
        String name = opts.get(option).getAsString();
        try {
            EncodingDetector.charsetFor(name);
            return name;
        } catch (SourceDecodingException e) {
            logger.warn("Unknown encoding '{}' for {}, using {}", name, option, RangeOptions.DEFAULT_ENCODING);
            return RangeOptions.DEFAULT_ENCODING;
        }
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
        } catch (Exception e) {
            logger.warn("Failed to set log level to '{}': {}", levelName, e.getMessage());
        }
    }
}
