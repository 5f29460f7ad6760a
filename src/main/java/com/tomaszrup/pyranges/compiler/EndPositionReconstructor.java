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

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.pyranges.ast.Node;
import com.tomaszrup.pyranges.ast.NodeKind;
import com.tomaszrup.pyranges.text.TextPosition;
import com.tomaszrup.pyranges.tokens.Token;
import com.tomaszrup.pyranges.tokens.TokenType;

/**
 * Assigns end positions to every positioned node of a tree whose start
 * positions have already been corrected.
 *
 * <p>Children are visited right to left. Each child is bounded by the start
 * of its right sibling (the horizon) and by its parent's trimmed token
 * window, so ranges nest and siblings never overlap.</p>
 */
public class EndPositionReconstructor {
	private static final Logger logger = LoggerFactory.getLogger(EndPositionReconstructor.class);

	private final boolean warnOnDegenerateRanges;

	public EndPositionReconstructor() {
		this(false);
	}

	public EndPositionReconstructor(boolean warnOnDegenerateRanges) {
		this.warnOnDegenerateRanges = warnOnDegenerateRanges;
	}

	/**
	 * @param tokens    the source's tokens with character columns
	 * @param sourceEnd the position just past the last character of the
	 *                  source
	 */
	public ReconstructionReport reconstruct(Node tree, List<Token> tokens, TextPosition sourceEnd) {
		List<Token> significant = new ArrayList<>(tokens.size());
		for (Token token : tokens) {
			if (!token.isEmpty()) {
				significant.add(token);
			}
		}
		ReconstructionReport report = new ReconstructionReport();
		markTextRanges(tree, TokenWindow.of(significant), sourceEnd, report);
		logger.debug("Reconstructed ranges for {} nodes ({} degenerate)", report.getNodeCount(),
				report.getDegenerateCount());
		return report;
	}

	/**
	 * @return the position the node's left sibling must end before
	 */
	private TextPosition markTextRanges(Node node, TokenWindow tokens, TextPosition horizon,
			ReconstructionReport report) {
		TokenWindow window = tokens;
		if (node.hasPosition()) {
			window = tokens.slice(node.getStart(), horizon);
			try {
				setRealEnd(node, window);
				report.addReconstructed(node);
			} catch (InconsistentTokensException e) {
				node.setEnd(new TextPosition(node.getLineno(), node.getColOffset() + 1));
				report.addDegenerate(node, e.getMessage());
				if (warnOnDegenerateRanges) {
					logger.warn("Degenerate range for {}: {}", node, e.getMessage());
				} else {
					logger.debug("Degenerate range for {}: {}", node, e.getMessage());
				}
			}
		}

		List<Node> children = ChildOrdering.orderedChildren(node);
		TextPosition childHorizon = horizon;
		for (int i = children.size() - 1; i >= 0; i--) {
			childHorizon = markTextRanges(children.get(i), window, childHorizon, report);
		}

		return node.hasPosition() ? node.getStart() : childHorizon;
	}

	/**
	 * Sets the node's end and leaves in the window only the tokens its
	 * children may claim.
	 */
	private void setRealEnd(Node node, TokenWindow tokens) throws InconsistentTokensException {
		if (node.getKind().isStatement() || node.getKind() == NodeKind.EXCEPT_HANDLER) {
			TokenTrimmer.stripStatementJunk(tokens);
		} else {
			TokenTrimmer.stripExtraClosers(tokens, node.getKind() != NodeKind.TUPLE);
			TokenTrimmer.stripTrailingJunk(tokens);
			if (TokenTrimmer.stripUnclosedBrackets(tokens)) {
				TokenTrimmer.stripTrailingJunk(tokens);
			}
		}

		node.setEnd(tokens.last().getEnd());

		if (node.getKind() == NodeKind.CALL && hasNoArguments(node)) {
			if (!tokens.last().is(")")) {
				throw new InconsistentTokensException("call without arguments does not end with ')'");
			}
			tokens.dropLast();
			TokenTrimmer.stripTrailingJunk(tokens);
		} else if (node.getKind() == NodeKind.ATTRIBUTE) {
			if (tokens.last().getType() != TokenType.NAME) {
				throw new InconsistentTokensException("attribute does not end with a name");
			}
			tokens.dropLast();
			TokenTrimmer.stripTrailingJunk(tokens);
		}
	}

	private static boolean hasNoArguments(Node call) {
		return call.getChildren("args").isEmpty() && call.getChildren("keywords").isEmpty()
				&& call.getChild("starargs") == null && call.getChild("kwargs") == null;
	}
}
