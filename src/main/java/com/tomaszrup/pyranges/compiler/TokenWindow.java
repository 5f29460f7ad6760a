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
package com.tomaszrup.pyranges.compiler;

import java.util.List;

import com.tomaszrup.pyranges.text.TextPosition;
import com.tomaszrup.pyranges.tokens.Token;

/**
 * A contiguous, shrinkable slice {@code [from, to)} of a shared token list.
 * Only the end moves; trimming never copies tokens.
 */
final class TokenWindow {
	private final List<Token> tokens;
	private final int from;
	private int to;

	private TokenWindow(List<Token> tokens, int from, int to) {
		this.tokens = tokens;
		this.from = from;
		this.to = to;
	}

	static TokenWindow of(List<Token> tokens) {
		return new TokenWindow(tokens, 0, tokens.size());
	}

	/**
	 * The tokens of this window that start at or after {@code start} and
	 * end at or before {@code horizon}.
	 */
	TokenWindow slice(TextPosition start, TextPosition horizon) {
		int first = from;
		while (first < to && tokens.get(first).getStart().isBefore(start)) {
			first++;
		}
		int last = first;
		while (last < to && !tokens.get(last).getEnd().isAfter(horizon)) {
			last++;
		}
		return new TokenWindow(tokens, first, last);
	}

	int size() {
		return to - from;
	}

	boolean isEmpty() {
		return to <= from;
	}

	Token get(int index) {
		return tokens.get(from + index);
	}

	Token last() throws InconsistentTokensException {
		if (isEmpty()) {
			throw new InconsistentTokensException("no tokens left in window");
		}
		return tokens.get(to - 1);
	}

	void dropLast() {
		if (!isEmpty()) {
			to--;
		}
	}

	/**
	 * Keeps the first {@code size} tokens.
	 */
	void truncate(int size) {
		to = from + Math.max(0, Math.min(size, size()));
	}

	@Override
	public String toString() {
		return tokens.subList(from, Math.max(from, to)).toString();
	}
}
