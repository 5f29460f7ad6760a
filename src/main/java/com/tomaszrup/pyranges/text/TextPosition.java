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

/**
 * A position in source text: 1-based line, 0-based column counted in
 * characters (Unicode code points).
 */
public final class TextPosition implements Comparable<TextPosition> {
	private final int line;
	private final int column;

	public TextPosition(int line, int column) {
		this.line = line;
		this.column = column;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	public boolean isAfter(TextPosition other) {
		return compareTo(other) > 0;
	}

	public boolean isBefore(TextPosition other) {
		return compareTo(other) < 0;
	}

	@Override
	public int compareTo(TextPosition other) {
		if (line != other.line) {
			return Integer.compare(line, other.line);
		}
		return Integer.compare(column, other.column);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof TextPosition)) return false;
		TextPosition other = (TextPosition) o;
		return line == other.line && column == other.column;
	}

	@Override
	public int hashCode() {
		return 31 * line + column;
	}

	@Override
	public String toString() {
		return line + ":" + column;
	}
}
