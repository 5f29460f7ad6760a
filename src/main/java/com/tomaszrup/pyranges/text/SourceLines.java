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
package com.tomaszrup.pyranges.text;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Source text split into lines, each line keeping its terminator
 * ({@code \n}, {@code \r\n} or {@code \r}). Line numbers are 1-based.
 *
 * <p>Also converts columns between the units different tools report:
 * encoded bytes (parser and tokenizer), code points (this library) and
 * UTF-16 code units (LSP clients). Instances cache encoded lines and are
 * not meant to be shared between threads.</p>
 */
public final class SourceLines {
	private final List<String> lines;
	private final Map<Charset, byte[][]> encodedLines = new HashMap<>();

	private SourceLines(List<String> lines) {
		this.lines = lines;
	}

	public static SourceLines of(String source) {
		List<String> result = new ArrayList<>();
		int lineStart = 0;
		int i = 0;
		while (i < source.length()) {
			char c = source.charAt(i);
			if (c == '\n') {
				result.add(source.substring(lineStart, i + 1));
				lineStart = i + 1;
			} else if (c == '\r') {
				int end = (i + 1 < source.length() && source.charAt(i + 1) == '\n') ? i + 2 : i + 1;
				result.add(source.substring(lineStart, end));
				lineStart = end;
				i = end - 1;
			}
			i++;
		}
		if (lineStart < source.length()) {
			result.add(source.substring(lineStart));
		}
		return new SourceLines(Collections.unmodifiableList(result));
	}

	public List<String> getLines() {
		return lines;
	}

	public int getLineCount() {
		return lines.size();
	}

	/**
	 * Returns the line with its terminator, or an empty string for line
	 * numbers past the end of the source.
	 */
	public String getLine(int lineno) {
		if (lineno < 1 || lineno > lines.size()) {
			return "";
		}
		return lines.get(lineno - 1);
	}

	/**
	 * Position just past the last character of the source.
	 */
	public TextPosition getEndPosition() {
		if (lines.isEmpty()) {
			return new TextPosition(1, 0);
		}
		String last = lines.get(lines.size() - 1);
		return new TextPosition(lines.size(), last.codePointCount(0, last.length()));
	}

	/**
	 * Converts a column measured in bytes of {@code charset} into a column
	 * measured in code points. Columns past the end of the encoded line are
	 * extended one character per byte.
	 *
	 * @throws SourceDecodingException if the byte prefix is not decodable
	 */
	public int toCharColumn(int lineno, int byteColumn, Charset charset) {
		if (byteColumn <= 0) {
			return byteColumn;
		}
		byte[] bytes = encodedLine(lineno, charset);
		int prefixLength = Math.min(byteColumn, bytes.length);
		CharBuffer decoded;
		try {
			decoded = charset.newDecoder()
					.onMalformedInput(CodingErrorAction.REPORT)
					.onUnmappableCharacter(CodingErrorAction.REPORT)
					.decode(ByteBuffer.wrap(bytes, 0, prefixLength));
		} catch (CharacterCodingException e) {
			throw new SourceDecodingException(lineno, byteColumn, charset, e);
		}
		return Character.codePointCount(decoded, 0, decoded.length()) + (byteColumn - prefixLength);
	}

	/**
	 * Converts a code point column into a UTF-16 code unit column.
	 */
	public int toUtf16Column(int lineno, int charColumn) {
		String line = getLine(lineno);
		int codePoints = line.codePointCount(0, line.length());
		if (charColumn <= codePoints) {
			return line.offsetByCodePoints(0, Math.max(charColumn, 0));
		}
		return line.length() + (charColumn - codePoints);
	}

	/**
	 * Converts a UTF-16 code unit column into a code point column.
	 */
	public int toCharColumnFromUtf16(int lineno, int utf16Column) {
		String line = getLine(lineno);
		if (utf16Column <= line.length()) {
			return line.codePointCount(0, Math.max(utf16Column, 0));
		}
		return line.codePointCount(0, line.length()) + (utf16Column - line.length());
	}

	private byte[] encodedLine(int lineno, Charset charset) {
		byte[][] encoded = encodedLines.computeIfAbsent(charset, cs -> new byte[lines.size()][]);
		if (lineno < 1 || lineno > lines.size()) {
			return new byte[0];
		}
		if (encoded[lineno - 1] == null) {
			encoded[lineno - 1] = lines.get(lineno - 1).getBytes(charset);
		}
		return encoded[lineno - 1];
	}
}
