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

import com.tomaszrup.pyranges.text.TextPosition;

/**
 * One lexical unit. Whether columns are bytes or characters depends on who
 * produced the token: a {@link TokenSource} reports bytes,
 * {@link CharOffsetTokenizer} reports characters.
 */
public final class Token {
	private final TokenType type;
	private final String string;
	private final TextPosition start;
	private final TextPosition end;

	public Token(TokenType type, String string, TextPosition start, TextPosition end) {
		this.type = type;
		this.string = string;
		this.start = start;
		this.end = end;
	}

	public Token(TokenType type, String string, int lineno, int colOffset, int endLineno, int endColOffset) {
		this(type, string, new TextPosition(lineno, colOffset), new TextPosition(endLineno, endColOffset));
	}

	public TokenType getType() {
		return type;
	}

	public String getString() {
		return string;
	}

	public TextPosition getStart() {
		return start;
	}

	public TextPosition getEnd() {
		return end;
	}

	public boolean isEmpty() {
		return string.isEmpty();
	}

	public boolean is(String text) {
		return string.equals(text);
	}

	@Override
	public String toString() {
		return type + " '" + string.replace("\n", "\\n").replace("\r", "\\r") + "' " + start + "-" + end;
	}
}
