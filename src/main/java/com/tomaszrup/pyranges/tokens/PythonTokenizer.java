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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.pyranges.text.SourceLines;

/**
 * Tokenizer for Python 3 source that produces the same token stream as
 * CPython's {@code tokenize} module, with columns measured in bytes of the
 * declared source encoding.
 *
 * <p>Only well-formed source is supported. Characters that cannot start a
 * token come out as {@link TokenType#ERRORTOKEN}; an unterminated
 * triple-quoted string raises {@link IllegalArgumentException}.</p>
 */
public class PythonTokenizer implements TokenSource {
	private static final Logger logger = LoggerFactory.getLogger(PythonTokenizer.class);

	private static final int TAB_SIZE = 8;

	private static final String DIGITS = "[0-9](?:_?[0-9])*";
	private static final String EXPONENT = "[eE][-+]?" + DIGITS;
	private static final String POINT_FLOAT = "(?:" + DIGITS + "\\.(?:" + DIGITS + ")?|\\." + DIGITS + ")(?:"
			+ EXPONENT + ")?";
	private static final Pattern NUMBER = Pattern.compile(
			"0[xX](?:_?[0-9a-fA-F])+|0[bB](?:_?[01])+|0[oO](?:_?[0-7])+"
					+ "|(?:" + POINT_FLOAT + "|" + DIGITS + EXPONENT + ")[jJ]?"
					+ "|" + DIGITS + "[jJ]?");
	private static final Pattern STRING_START = Pattern.compile(
			"(?:[rR][bBfF]?|[bBfF][rR]?|[uU])?('''|\"\"\"|'|\")");

	private static final String[] OPERATORS = {
			"**=", "//=", ">>=", "<<=", "...",
			"->", "**", "//", ">>", "<<", "<=", ">=", "==", "!=", ":=",
			"+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
			"+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">",
			"(", ")", "[", "]", "{", "}", ",", ":", ";", ".", "=" };

	private final String defaultEncoding;

	public PythonTokenizer() {
		this("utf-8");
	}

	public PythonTokenizer(String defaultEncoding) {
		this.defaultEncoding = defaultEncoding;
	}

	@Override
	public List<Token> generateTokens(String source) {
		String encoding = EncodingDetector.detect(source, defaultEncoding);
		List<Token> tokens = new Scanner(source, encoding).scan();
		logger.debug("Tokenized {} lines into {} tokens ({})",
				SourceLines.of(source).getLineCount(), tokens.size(), encoding);
		return tokens;
	}

	private static final class Scanner {
		private final SourceLines lines;
		private final String encoding;
		private final Charset charset;
		private final List<Token> tokens = new ArrayList<>();
		private final Deque<Integer> indents = new ArrayDeque<>();

		private String line = "";
		private int lineStart;
		private int parenLevel;
		private boolean continued;

		// multi-line string in progress
		private String contQuote;
		private StringBuilder contText;
		private int contStartLine;
		private int contStartColumn;

		Scanner(String source, String encoding) {
			this.lines = SourceLines.of(source);
			this.encoding = encoding;
			this.charset = EncodingDetector.charsetFor(encoding);
			indents.push(0);
		}

		List<Token> scan() {
			add(TokenType.ENCODING, encoding, 0, 0, 0, 0);
			for (int lnum = 1; lnum <= lines.getLineCount(); lnum++) {
				line = lines.getLine(lnum);
				lineStart = (lnum == 1 && line.startsWith("\uFEFF")) ? 1 : 0;
				scanLine(lnum);
			}
			finish();
			return tokens;
		}

		private void scanLine(int lnum) {
			int pos = lineStart;
			int max = line.length();
			if (contQuote != null) {
				int end = findStringEnd(0, contQuote);
				if (end < 0) {
					contText.append(line);
					return;
				}
				contText.append(line, 0, end);
				add(TokenType.STRING, contText.toString(), contStartLine, contStartColumn, lnum, col(end));
				contQuote = null;
				contText = null;
				pos = end;
			} else if (parenLevel == 0 && !continued) {
				int column = 0;
				while (pos < max) {
					char c = line.charAt(pos);
					if (c == ' ') {
						column++;
					} else if (c == '\t') {
						column = (column / TAB_SIZE + 1) * TAB_SIZE;
					} else if (c == '\f') {
						column = 0;
					} else {
						break;
					}
					pos++;
				}
				if (pos == max) {
					return;
				}
				char c = line.charAt(pos);
				if (c == '#' || c == '\r' || c == '\n') {
					if (c == '#') {
						String comment = stripLineBreak(line.substring(pos));
						add(TokenType.COMMENT, comment, lnum, col(pos), lnum, col(pos + comment.length()));
						pos += comment.length();
					}
					add(TokenType.NL, line.substring(pos), lnum, col(pos), lnum, col(max));
					return;
				}
				if (column > indents.peek()) {
					indents.push(column);
					add(TokenType.INDENT, line.substring(lineStart, pos), lnum, 0, lnum, col(pos));
				}
				while (column < indents.peek()) {
					indents.pop();
					add(TokenType.DEDENT, "", lnum, col(pos), lnum, col(pos));
				}
				if (column != indents.peek()) {
					throw new IllegalArgumentException(
							"unindent does not match any outer indentation level (line " + lnum + ")");
				}
			} else {
				continued = false;
			}
			while (pos < max) {
				pos = scanToken(lnum, pos, max);
			}
		}

		private int scanToken(int lnum, int pos, int max) {
			char c = line.charAt(pos);
			if (c == ' ' || c == '\t' || c == '\f') {
				return pos + 1;
			}
			if (c == '\r' || c == '\n') {
				add(parenLevel > 0 ? TokenType.NL : TokenType.NEWLINE, line.substring(pos), lnum, col(pos), lnum,
						col(max));
				return max;
			}
			if (c == '#') {
				String comment = stripLineBreak(line.substring(pos));
				add(TokenType.COMMENT, comment, lnum, col(pos), lnum, col(pos + comment.length()));
				return pos + comment.length();
			}
			if (c == '\\' && isLineBreak(pos + 1)) {
				continued = true;
				return max;
			}
			Matcher string = STRING_START.matcher(line).region(pos, max);
			if (string.lookingAt()) {
				return scanString(lnum, pos, string.group(1), string.end());
			}
			if (isDigit(c) || (c == '.' && pos + 1 < max && isDigit(line.charAt(pos + 1)))) {
				Matcher number = NUMBER.matcher(line).region(pos, max);
				if (number.lookingAt()) {
					add(TokenType.NUMBER, number.group(), lnum, col(pos), lnum, col(number.end()));
					return number.end();
				}
			}
			int codePoint = line.codePointAt(pos);
			if (codePoint == '_' || Character.isUnicodeIdentifierStart(codePoint)) {
				int end = pos + Character.charCount(codePoint);
				while (end < max && Character.isUnicodeIdentifierPart(line.codePointAt(end))
						&& !Character.isIdentifierIgnorable(line.codePointAt(end))) {
					end += Character.charCount(line.codePointAt(end));
				}
				add(TokenType.NAME, line.substring(pos, end), lnum, col(pos), lnum, col(end));
				return end;
			}
			for (String operator : OPERATORS) {
				if (line.startsWith(operator, pos)) {
					trackBrackets(operator);
					int end = pos + operator.length();
					add(TokenType.OP, operator, lnum, col(pos), lnum, col(end));
					return end;
				}
			}
			int end = pos + Character.charCount(codePoint);
			add(TokenType.ERRORTOKEN, line.substring(pos, end), lnum, col(pos), lnum, col(end));
			return end;
		}

		private int scanString(int lnum, int pos, String quote, int bodyStart) {
			int end = findStringEnd(bodyStart, quote);
			if (end >= 0) {
				add(TokenType.STRING, line.substring(pos, end), lnum, col(pos), lnum, col(end));
				return end;
			}
			if (quote.length() == 3 || endsWithContinuation()) {
				contQuote = quote;
				contText = new StringBuilder(line.substring(pos));
				contStartLine = lnum;
				contStartColumn = col(pos);
				return line.length();
			}
			int quoteEnd = bodyStart;
			add(TokenType.ERRORTOKEN, line.substring(pos, quoteEnd), lnum, col(pos), lnum, col(quoteEnd));
			return quoteEnd;
		}

		/**
		 * Index just past the closing quote, or -1 if the string does not
		 * close on the current line.
		 */
		private int findStringEnd(int from, String quote) {
			int i = from;
			while (i < line.length()) {
				char c = line.charAt(i);
				if (c == '\\') {
					i += 2;
					continue;
				}
				if (line.startsWith(quote, i)) {
					return i + quote.length();
				}
				if (quote.length() == 1 && (c == '\r' || c == '\n')) {
					return -1;
				}
				i++;
			}
			return -1;
		}

		private void finish() {
			if (contQuote != null) {
				throw new IllegalArgumentException("EOF in multi-line string starting at line " + contStartLine);
			}
			int lastLine = lines.getLineCount();
			TokenType lastType = tokens.get(tokens.size() - 1).getType();
			if (lastType != TokenType.NEWLINE && lastType != TokenType.NL && lastType != TokenType.ENCODING) {
				int end = col(line.length());
				add(TokenType.NEWLINE, "", lastLine, end, lastLine, end + 1);
			}
			while (indents.peek() > 0) {
				indents.pop();
				add(TokenType.DEDENT, "", lastLine + 1, 0, lastLine + 1, 0);
			}
			add(TokenType.ENDMARKER, "", lastLine + 1, 0, lastLine + 1, 0);
		}

		private void trackBrackets(String operator) {
			if (operator.equals("(") || operator.equals("[") || operator.equals("{")) {
				parenLevel++;
			} else if ((operator.equals(")") || operator.equals("]") || operator.equals("}")) && parenLevel > 0) {
				parenLevel--;
			}
		}

		private boolean isLineBreak(int pos) {
			return pos < line.length() && (line.charAt(pos) == '\n' || line.charAt(pos) == '\r');
		}

		private boolean endsWithContinuation() {
			String content = stripLineBreak(line);
			return content.length() < line.length() && content.endsWith("\\");
		}

		private int col(int index) {
			return line.substring(lineStart, Math.max(index, lineStart)).getBytes(charset).length;
		}

		private void add(TokenType type, String string, int lineno, int colOffset, int endLineno, int endColOffset) {
			tokens.add(new Token(type, string, lineno, colOffset, endLineno, endColOffset));
		}

		private static boolean isDigit(char c) {
			return c >= '0' && c <= '9';
		}

		private static String stripLineBreak(String text) {
			int end = text.length();
			while (end > 0 && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
				end--;
			}
			return text.substring(0, end);
		}
	}
}
