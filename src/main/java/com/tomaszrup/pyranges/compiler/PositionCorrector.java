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

import java.nio.charset.Charset;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.pyranges.ast.Node;
import com.tomaszrup.pyranges.ast.NodeKind;
import com.tomaszrup.pyranges.text.SourceLines;
import com.tomaszrup.pyranges.text.TextPosition;
import com.tomaszrup.pyranges.tokens.Token;
import com.tomaszrup.pyranges.tokens.TokenType;

/**
 * Rewrites the start positions a parser reported into character columns
 * and repairs the kinds whose reported start is known to be wrong.
 *
 * <p>Children are corrected before their parent, so a parent can take
 * its start from an already corrected child:</p>
 * <ul>
 * <li>string literals take the start of their token, because multi-line
 * literals are reported at their last line;</li>
 * <li>an expression statement or attribute access on a string literal
 * takes the literal's start;</li>
 * <li>expression statements, binary operations, calls, attribute accesses
 * and subscripts that start after their leftmost operand take the
 * operand's start;</li>
 * <li>decorated definitions that start after their first decorator take
 * the start of the {@code @} in front of it;</li>
 * <li>any other positioned node has its byte column converted.</li>
 * </ul>
 */
public class PositionCorrector {
	private static final Logger logger = LoggerFactory.getLogger(PositionCorrector.class);

	private final Charset nodeCharset;

	/**
	 * @param nodeCharset the encoding in which the parser measures columns
	 */
	public PositionCorrector(Charset nodeCharset) {
		this.nodeCharset = nodeCharset;
	}

	/**
	 * @param tokens the source's tokens with character columns
	 * @throws AstTokenMismatchException if the tree has more string
	 *                                   literals than the token stream
	 */
	public void correct(Node tree, SourceLines lines, List<Token> tokens) {
		StringTokens strings = new StringTokens(tokens);
		fixNode(tree, lines, tokens, strings);
		if (strings.hasRemaining()) {
			logger.debug("String tokens left over after position correction (first at {})",
					strings.peekStart());
		}
	}

	private void fixNode(Node node, SourceLines lines, List<Token> tokens, StringTokens strings) {
		if (node.getKind() == NodeKind.JOINED_STR && node.hasPosition()) {
			fixFormattedString(node, strings);
			return;
		}
		for (Node child : ChildOrdering.orderedChildren(node)) {
			fixNode(child, lines, tokens, strings);
		}

		switch (node.getKind()) {
			case STR:
			case BYTES:
				if (node.hasPosition()) {
					node.setStart(strings.next(node).getStart());
				}
				break;
			case EXPR:
			case ATTRIBUTE:
				if (isStringLiteral(node.getChild("value"))) {
					node.setStart(node.getChild("value").getStart());
				} else {
					adoptIfAfter(node, node.getChild("value"), lines);
				}
				break;
			case BIN_OP:
				adoptIfAfter(node, node.getChild("left"), lines);
				break;
			case CALL:
				adoptIfAfter(node, node.getChild("func"), lines);
				break;
			case SUBSCRIPT:
				adoptIfAfter(node, node.getChild("value"), lines);
				break;
			case FUNCTION_DEF:
			case ASYNC_FUNCTION_DEF:
			case CLASS_DEF:
				adoptDecoratorStart(node, tokens, lines);
				break;
			default:
				convertColumn(node, lines);
				break;
		}
	}

	/**
	 * Positions inside an f-string are not usable; everything in it is
	 * placed at the literal's start.
	 */
	private void fixFormattedString(Node node, StringTokens strings) {
		node.setStart(strings.next(node).getStart());
		for (Node child : node.iterChildNodes()) {
			adoptStartRecursively(child, node);
		}
	}

	private void adoptStartRecursively(Node node, Node literal) {
		if (node.hasPosition()) {
			node.setStart(literal.getStart());
		}
		for (Node child : node.iterChildNodes()) {
			adoptStartRecursively(child, literal);
		}
	}

	private void adoptIfAfter(Node node, Node child, SourceLines lines) {
		convertColumn(node, lines);
		if (child != null && child.hasPosition() && node.hasPosition()
				&& node.getStart().isAfter(child.getStart())) {
			node.setStart(child.getStart());
		}
	}

	private void adoptDecoratorStart(Node node, List<Token> tokens, SourceLines lines) {
		Node decorator = firstDecorator(node);
		adoptIfAfter(node, decorator, lines);
		if (decorator == null || !decorator.hasPosition() || !node.hasPosition()
				|| !node.getStart().equals(decorator.getStart())) {
			return;
		}
		Token at = lastAtSignBefore(tokens, decorator.getStart());
		if (at != null) {
			node.setStart(at.getStart());
		}
	}

	private static Token lastAtSignBefore(List<Token> tokens, TextPosition position) {
		Token result = null;
		for (Token token : tokens) {
			if (!token.getStart().isBefore(position)) {
				break;
			}
			if (token.getType() == TokenType.OP && token.is("@")) {
				result = token;
			}
		}
		return result;
	}

	private void convertColumn(Node node, SourceLines lines) {
		if (node.hasPosition()) {
			node.setColOffset(lines.toCharColumn(node.getLineno(), node.getColOffset(), nodeCharset));
		}
	}

	private static Node firstDecorator(Node node) {
		for (Node decorator : node.getChildren("decorator_list")) {
			if (decorator != null) {
				return decorator;
			}
		}
		return null;
	}

	private static boolean isStringLiteral(Node node) {
		return node != null && node.hasPosition() && (node.getKind() == NodeKind.STR
				|| node.getKind() == NodeKind.BYTES || node.getKind() == NodeKind.JOINED_STR);
	}

	/**
	 * Hands out {@link TokenType#STRING} tokens left to right. Adjacent
	 * string tokens form one literal and are consumed together.
	 */
	private static final class StringTokens {
		private final List<Token> tokens;
		private int cursor;

		StringTokens(List<Token> tokens) {
			this.tokens = tokens;
		}

		Token next(Node node) {
			while (cursor < tokens.size() && tokens.get(cursor).getType() != TokenType.STRING) {
				cursor++;
			}
			if (cursor >= tokens.size()) {
				throw new AstTokenMismatchException("No string token left for " + node);
			}
			Token first = tokens.get(cursor++);
			int i = cursor;
			while (i < tokens.size()) {
				TokenType type = tokens.get(i).getType();
				if (type == TokenType.STRING) {
					cursor = i + 1;
				} else if (type != TokenType.NL && type != TokenType.COMMENT) {
					break;
				}
				i++;
			}
			return first;
		}

		boolean hasRemaining() {
			for (int i = cursor; i < tokens.size(); i++) {
				if (tokens.get(i).getType() == TokenType.STRING) {
					return true;
				}
			}
			return false;
		}

		Object peekStart() {
			for (int i = cursor; i < tokens.size(); i++) {
				if (tokens.get(i).getType() == TokenType.STRING) {
					return tokens.get(i).getStart();
				}
			}
			return null;
		}
	}
}
