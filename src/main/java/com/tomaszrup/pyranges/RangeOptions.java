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

/**
 * Settings for {@link TextRangeService}. Immutable.
 */
public final class RangeOptions {
    public static final String DEFAULT_ENCODING = "utf-8";

    public static final RangeOptions DEFAULT = new RangeOptions(DEFAULT_ENCODING, DEFAULT_ENCODING, false, null);

    private final String defaultEncoding;
    private final String parserEncoding;
    private final boolean warnOnDegenerateRanges;
    private final String logLevel;

    /**
     * @param defaultEncoding        encoding of sources without a coding
     *                               declaration
     * @param parserEncoding         encoding in which the parser measures
     *                               columns
     * @param warnOnDegenerateRanges log degenerate ranges at WARN instead of
     *                               DEBUG
     * @param logLevel               root log level requested by the caller,
     *                               or null
     */
    public RangeOptions(String defaultEncoding, String parserEncoding, boolean warnOnDegenerateRanges,
                        String logLevel) {
        this.defaultEncoding = defaultEncoding;
        this.parserEncoding = parserEncoding;
        this.warnOnDegenerateRanges = warnOnDegenerateRanges;
        this.logLevel = logLevel;
    }

    public String getDefaultEncoding() {
        return defaultEncoding;
    }

    public String getParserEncoding() {
        return parserEncoding;
    }

    public boolean isWarnOnDegenerateRanges() {
        return warnOnDegenerateRanges;
    }

    public String getLogLevel() {
        return logLevel;
    }

    @Override
    public String toString() {
        return "RangeOptions[defaultEncoding=" + defaultEncoding + ", parserEncoding=" + parserEncoding
                + ", warnOnDegenerateRanges=" + warnOnDegenerateRanges + ", logLevel=" + logLevel + "]";
    }
}
