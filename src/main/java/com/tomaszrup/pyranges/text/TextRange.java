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
 * A span of source text between two {@link TextPosition}s. The end column
 * is exclusive when slicing text and inclusive when comparing ranges.
 */
public final class TextRange {
	private final int lineno;
	private final int colOffset;
	private final int endLineno;
	private final int endColOffset;

	public TextRange(int lineno, int colOffset, int endLineno, int endColOffset) {
		this.lineno = lineno;
		this.colOffset = colOffset;
		this.endLineno = endLineno;
		this.endColOffset = endColOffset;
	}

	public TextRange(TextPosition start, TextPosition end) {
		this(start.getLine(), start.getColumn(), end.getLine(), end.getColumn());
	}

	public int getLineno() {
		return lineno;
	}

	public int getColOffset() {
		return colOffset;
	}

	public int getEndLineno() {
		return endLineno;
	}

	public int getEndColOffset() {
		return endColOffset;
	}

	public TextPosition getStart() {
		return new TextPosition(lineno, colOffset);
	}

	public TextPosition getEnd() {
		return new TextPosition(endLineno, endColOffset);
	}

	/**
	 * True when {@code other} lies inside this range; equal ranges contain
	 * each other.
	 */
	public boolean containsSmallerEq(TextRange other) {
		return getStart().compareTo(other.getStart()) <= 0
				&& other.getEnd().compareTo(getEnd()) <= 0;
	}

	public boolean containsSmaller(TextRange other) {
		return containsSmallerEq(other) && !equals(other);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof TextRange)) return false;
		TextRange other = (TextRange) o;
		return lineno == other.lineno
				&& colOffset == other.colOffset
				&& endLineno == other.endLineno
				&& endColOffset == other.endColOffset;
	}

	@Override
	public int hashCode() {
		int result = lineno;
		result = 31 * result + colOffset;
		result = 31 * result + endLineno;
		result = 31 * result + endColOffset;
		return result;
	}

	@Override
	public String toString() {
		return lineno + "." + colOffset + "-" + endLineno + "." + endColOffset;
	}
}
