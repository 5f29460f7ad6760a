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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.pyranges.text;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SourceLinesTests {

	@Test
	void testSplitKeepsAllKindsOfTerminators() {
		SourceLines lines = SourceLines.of("a\nb\r\nc\rd");
		Assertions.assertEquals(Arrays.asList("a\n", "b\r\n", "c\r", "d"), lines.getLines());
		Assertions.assertEquals(4, lines.getLineCount());
	}

	@Test
	void testGetLineOutOfRangeIsEmpty() {
		SourceLines lines = SourceLines.of("a\n");
		Assertions.assertEquals("", lines.getLine(0));
		Assertions.assertEquals("", lines.getLine(2));
	}

	@Test
	void testEndPosition() {
		Assertions.assertEquals(new TextPosition(1, 0), SourceLines.of("").getEndPosition());
		Assertions.assertEquals(new TextPosition(2, 3), SourceLines.of("x\nyñz").getEndPosition());
	}

	@Test
	void testToCharColumnForMultiByteCharacters() {
		SourceLines lines = SourceLines.of("a = ñ + 1\n");
		Assertions.assertEquals(4, lines.toCharColumn(1, 4, StandardCharsets.UTF_8));
		Assertions.assertEquals(5, lines.toCharColumn(1, 6, StandardCharsets.UTF_8));
		Assertions.assertEquals(8, lines.toCharColumn(1, 9, StandardCharsets.UTF_8));
	}

	@Test
	void testToCharColumnLeavesNegativeColumnsAlone() {
		SourceLines lines = SourceLines.of("\"\"\"a\nb\"\"\"\n");
		Assertions.assertEquals(-1, lines.toCharColumn(2, -1, StandardCharsets.UTF_8));
	}

	@Test
	void testToCharColumnPastEndOfLine() {
		SourceLines lines = SourceLines.of("é");
		Assertions.assertEquals(3, lines.toCharColumn(1, 4, StandardCharsets.UTF_8));
	}

	@Test
	void testToCharColumnInsideCharacterFails() {
		SourceLines lines = SourceLines.of("é = 1\n");
		Assertions.assertThrows(SourceDecodingException.class,
				() -> lines.toCharColumn(1, 1, StandardCharsets.UTF_8));
	}

	@Test
	void testToCharColumnWithSingleByteEncoding() {
		SourceLines lines = SourceLines.of("é = 1\n");
		Assertions.assertEquals(4, lines.toCharColumn(1, 4, Charset.forName("ISO-8859-1")));
	}

	@Test
	void testUtf16ColumnsOfAstralCharacters() {
		SourceLines lines = SourceLines.of("s = '😀' + t\n");
		// the emoji is one code point but two UTF-16 units
		Assertions.assertEquals(7, lines.toUtf16Column(1, 6));
		Assertions.assertEquals(9, lines.toUtf16Column(1, 8));
		Assertions.assertEquals(8, lines.toCharColumnFromUtf16(1, 9));
		Assertions.assertEquals(5, lines.toCharColumnFromUtf16(1, 5));
	}
}
