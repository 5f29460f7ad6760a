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
package com.tomaszrup.lsp.utils;

import java.util.Comparator;

import org.eclipse.lsp4j.Position;

import com.tomaszrup.pyranges.text.SourceLines;
import com.tomaszrup.pyranges.text.TextPosition;

/**
 * Conversions between {@link TextPosition} (1-based lines, code point
 * columns) and lsp4j {@link Position} (0-based lines, UTF-16 columns).
 */
public class Positions {
	private Positions() {
	}

	public static final Comparator<Position> COMPARATOR = (Position p1, Position p2) -> {
		if (p1.getLine() != p2.getLine()) {
			return p1.getLine() - p2.getLine();
		}
		return p1.getCharacter() - p2.getCharacter();
	};

	public static boolean valid(Position p) {
		return p.getLine() >= 0 && p.getCharacter() >= 0;
	}

	public static Position toPosition(TextPosition position, SourceLines lines) {
		int line = position.getLine();
		return new Position(line - 1, lines.toUtf16Column(line, position.getColumn()));
	}

	/**
	 * @return the text position, or {@code null} for an invalid position
	 */
	public static TextPosition toTextPosition(Position position, SourceLines lines) {
		if (position == null || !valid(position)) {
			return null;
		}
		int line = position.getLine() + 1;
		return new TextPosition(line, lines.toCharColumnFromUtf16(line, position.getCharacter()));
	}
}
