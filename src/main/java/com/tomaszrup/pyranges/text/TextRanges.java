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

import java.util.ArrayList;
import java.util.List;

public class TextRanges {
	private TextRanges() {
	}

	/**
	 * Returns the part of {@code source} covered by {@code range}: the first
	 * line is cut at the start column, the last line at the end column and
	 * the lines between are kept whole, terminators included.
	 */
	public static String extract(String source, TextRange range) {
		List<String> allLines = SourceLines.of(source).getLines();
		int from = Math.max(range.getLineno() - 1, 0);
		int to = Math.min(range.getEndLineno(), allLines.size());
		if (from >= to) {
			return "";
		}
		List<String> lines = new ArrayList<>(allLines.subList(from, to));
		int last = lines.size() - 1;
		lines.set(last, prefix(lines.get(last), range.getEndColOffset()));
		lines.set(0, suffix(lines.get(0), range.getColOffset()));
		return String.join("", lines);
	}

	private static String prefix(String line, int codePoints) {
		return line.substring(0, offset(line, codePoints));
	}

	private static String suffix(String line, int codePoints) {
		return line.substring(offset(line, codePoints));
	}

	private static int offset(String line, int codePoints) {
		int available = line.codePointCount(0, line.length());
		return line.offsetByCodePoints(0, Math.max(0, Math.min(codePoints, available)));
	}
}
