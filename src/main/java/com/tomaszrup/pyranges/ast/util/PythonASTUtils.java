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
package com.tomaszrup.pyranges.ast.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.tomaszrup.pyranges.ast.Node;
import com.tomaszrup.pyranges.ast.NodeKind;
import com.tomaszrup.pyranges.text.TextRange;

public class PythonASTUtils {
	private PythonASTUtils() {
	}

	/**
	 * The innermost ranged node whose range contains or equals
	 * {@code range}, or {@code null}. The search only descends through
	 * nodes that contain the range; ties go to the first child in field
	 * order.
	 */
	public static Node findClosestContainingNode(Node tree, TextRange range) {
		for (Node child : tree.iterChildNodes()) {
			Node result = findClosestContainingNode(child, range);
			if (result != null) {
				return result;
			}
		}
		TextRange treeRange = tree.getRange();
		if (treeRange != null && treeRange.containsSmallerEq(range)) {
			return tree;
		}
		return null;
	}

	/**
	 * The first expression, in pre-order, whose range equals
	 * {@code range}, or {@code null}.
	 */
	public static Node findExpression(Node node, TextRange range) {
		if (node.getKind().isExpression() && range.equals(node.getRange())) {
			return node;
		}
		for (Node child : node.iterChildNodes()) {
			Node result = findExpression(child, range);
			if (result != null) {
				return result;
			}
		}
		return null;
	}

	/**
	 * Whether {@code target} is a proper descendant of {@code parent}.
	 */
	public static boolean containsNode(Node parent, Node target) {
		for (Node child : parent.iterChildNodes()) {
			if (child == target || containsNode(child, target)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Whether some ancestor of {@code target} in {@code tree} is of
	 * {@code kind}.
	 */
	public static boolean hasParentWithKind(Node target, NodeKind kind, Node tree) {
		for (Node node : walk(tree)) {
			if (node.getKind() == kind && containsNode(node, target)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * All nodes of the tree, breadth first, starting with the root.
	 */
	public static List<Node> walk(Node tree) {
		List<Node> result = new ArrayList<>();
		Deque<Node> queue = new ArrayDeque<>();
		queue.add(tree);
		while (!queue.isEmpty()) {
			Node node = queue.poll();
			result.add(node);
			queue.addAll(node.iterChildNodes());
		}
		return result;
	}

	/**
	 * An unpositioned literal for {@code None}, a boolean or a string.
	 *
	 * @throws UnsupportedOperationException for any other value
	 */
	public static Node valueToLiteral(Object value) {
		if (value == null) {
			return new Node(NodeKind.NAME_CONSTANT).withValue("None");
		}
		if (value instanceof Boolean) {
			return new Node(NodeKind.NAME_CONSTANT).withValue((Boolean) value ? "True" : "False");
		}
		if (value instanceof String) {
			return new Node(NodeKind.STR).withValue((String) value);
		}
		throw new UnsupportedOperationException(
				"Only None, bool and str supported at the moment, not " + value.getClass().getName());
	}
}
