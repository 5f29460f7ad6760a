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

import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;

import com.tomaszrup.pyranges.tokens.Token;
import com.tomaszrup.pyranges.tokens.TokenType;

/**
 * Cuts a node's token window down to the tokens that belong to the node.
 */
final class TokenTrimmer {
	private static final String OPENERS = "([{";
	private static final String CLOSERS = ")]}";

	private static final Set<TokenType> STATEMENT_JUNK_TYPES = EnumSet.of(TokenType.NL, TokenType.COMMENT,
			TokenType.NEWLINE, TokenType.INDENT, TokenType.DEDENT);
	private static final Set<String> STATEMENT_JUNK_WORDS = new HashSet<>(
			Arrays.asList(":", ";", "else", "elif", "finally", "except"));

	// keywords that can never be the last token of an expression
	private static final Set<String> NON_TERMINAL_KEYWORDS = new HashSet<>(Arrays.asList(
			"and", "as", "assert", "async", "await", "break", "class", "continue", "def", "del", "elif", "else",
			"except", "finally", "for", "from", "global", "if", "import", "in", "is", "lambda", "nonlocal", "not",
			"or", "pass", "raise", "return", "try", "while", "with", "yield"));

	private static final Set<String> BARE_EXPRESSION_KEYWORDS = new HashSet<>(Arrays.asList("yield", "await"));

	private TokenTrimmer() {
	}

	static void stripStatementJunk(TokenWindow tokens) throws InconsistentTokensException {
		while (!tokens.isEmpty()) {
			Token last = tokens.last();
			if (!STATEMENT_JUNK_TYPES.contains(last.getType()) && !STATEMENT_JUNK_WORDS.contains(last.getString())) {
				return;
			}
			tokens.dropLast();
		}
	}

	/**
	 * Cuts the window at the end of the logical line, at the first closing
	 * bracket it did not open, and optionally at the first comma outside
	 * brackets.
	 */
	static void stripExtraClosers(TokenWindow tokens, boolean removeNakedComma) {
		int level = 0;
		for (int i = 0; i < tokens.size(); i++) {
			if (tokens.get(i).getType() == TokenType.NEWLINE) {
				tokens.truncate(i);
				return;
			}
			String text = tokens.get(i).getString();
			if (isOpener(text)) {
				level++;
			} else if (isCloser(text)) {
				level--;
			}
			if ((level == 0 && removeNakedComma && ",".equals(text)) || level < 0) {
				tokens.truncate(i);
				return;
			}
		}
	}

	/**
	 * Drops trailing tokens that cannot end an expression. A leading
	 * {@code yield} or {@code await} is kept, as it is the whole of a bare
	 * yield or await expression.
	 */
	static void stripTrailingJunk(TokenWindow tokens) throws InconsistentTokensException {
		while (!tokens.isEmpty() && isTrailingJunk(tokens.last())) {
			if (tokens.size() == 1 && BARE_EXPRESSION_KEYWORDS.contains(tokens.last().getString())) {
				return;
			}
			tokens.dropLast();
		}
	}

	/**
	 * Cuts the window at every opening bracket that is not closed inside it.
	 *
	 * @return whether anything was cut
	 */
	static boolean stripUnclosedBrackets(TokenWindow tokens) {
		boolean truncated = false;
		int level = 0;
		for (int i = tokens.size() - 1; i >= 0; i--) {
			String text = tokens.get(i).getString();
			if (isOpener(text)) {
				level--;
			} else if (isCloser(text)) {
				level++;
			}
			if (level < 0) {
				tokens.truncate(i);
				level = 0;
				truncated = true;
			}
		}
		return truncated;
	}

	private static boolean isTrailingJunk(Token token) {
		TokenType type = token.getType();
		boolean terminal = type == TokenType.NAME || type == TokenType.NUMBER || type == TokenType.STRING
				|| isCloser(token.getString()) || token.is("...");
		return !terminal || NON_TERMINAL_KEYWORDS.contains(token.getString());
	}

	private static boolean isOpener(String text) {
		return text.length() == 1 && OPENERS.contains(text);
	}

	private static boolean isCloser(String text) {
		return text.length() == 1 && CLOSERS.contains(text);
	}
}
