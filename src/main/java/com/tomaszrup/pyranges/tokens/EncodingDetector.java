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
package com.tomaszrup.pyranges.tokens;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.tomaszrup.pyranges.text.SourceDecodingException;
import com.tomaszrup.pyranges.text.SourceLines;

/**
 * Finds the encoding a Python source declares: a byte order mark, or a
 * {@code coding} comment on one of the first two lines.
 */
public final class EncodingDetector {
	public static final String UTF_8_SIG = "utf-8-sig";

	private static final Pattern CODING_COOKIE = Pattern.compile("^[ \\t\\f]*#.*?coding[:=][ \\t]*([-\\w.]+)");
	private static final Pattern BLANK_OR_COMMENT = Pattern.compile("^[ \\t\\f]*(?:[#\\r\\n]|$)");

	private EncodingDetector() {
	}

	/**
	 * Returns the declared encoding's normalized name, or
	 * {@code defaultEncoding} when the source declares none.
	 */
	public static String detect(String source, String defaultEncoding) {
		if (source.startsWith("\uFEFF")) {
			return UTF_8_SIG;
		}
		SourceLines lines = SourceLines.of(source);
		String cookie = findCookie(lines.getLine(1));
		if (cookie == null && BLANK_OR_COMMENT.matcher(lines.getLine(1)).find()) {
			cookie = findCookie(lines.getLine(2));
		}
		if (cookie == null) {
			return normalName(defaultEncoding);
		}
		String name = normalName(cookie);
		charsetFor(name);
		return name;
	}

	/**
	 * Maps an encoding name as Python spells it to a JVM charset.
	 *
	 * @throws SourceDecodingException for encodings the JVM does not support
	 */
	public static Charset charsetFor(String encoding) {
		String name = normalName(encoding);
		if (UTF_8_SIG.equals(name) || "utf-8".equals(name)) {
			return StandardCharsets.UTF_8;
		}
		try {
			return Charset.forName(name);
		} catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
			throw new SourceDecodingException("unknown encoding: " + encoding);
		}
	}

	static String normalName(String encoding) {
		String name = encoding.toLowerCase(Locale.ROOT).replace('_', '-');
		if (name.equals("utf-8") || name.equals("utf8") || name.startsWith("utf-8-") && !name.equals(UTF_8_SIG)) {
			return "utf-8";
		}
		if (name.equals("latin-1") || name.equals("iso-8859-1") || name.equals("iso-latin-1")
				|| name.startsWith("latin-1-") || name.startsWith("iso-8859-1-") || name.startsWith("iso-latin-1-")) {
			return "iso-8859-1";
		}
		return name;
	}

	private static String findCookie(String line) {
		Matcher matcher = CODING_COOKIE.matcher(line);
		if (matcher.find()) {
			return matcher.group(1);
		}
		return null;
	}
}
