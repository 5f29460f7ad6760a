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
import java.util.Comparator;
import java.util.List;

import com.tomaszrup.pyranges.ast.Node;
import com.tomaszrup.pyranges.text.TextPosition;

/**
 * Children of a node in source order. Most kinds declare their fields in
 * source order already; the ones handled here do not.
 */
final class ChildOrdering {
	private static final TextPosition ORIGIN = new TextPosition(0, 0);

	private ChildOrdering() {
	}

	static List<Node> orderedChildren(Node node) {
		switch (node.getKind()) {
			case DICT:
				return sortByStart(interleave(node.getChildren("keys"), node.getChildren("values")));
			case CALL:
			case IF_EXP:
			case ARGUMENTS:
			case FUNCTION_DEF:
			case ASYNC_FUNCTION_DEF:
			case CLASS_DEF:
				return sortByStart(node.iterChildNodes());
			default:
				return node.iterChildNodes();
		}
	}

	/**
	 * Keys and values of a dict literal, pairwise. Keys of {@code **}
	 * entries are empty and skipped.
	 */
	private static List<Node> interleave(List<Node> keys, List<Node> values) {
		List<Node> result = new ArrayList<>();
		for (int i = 0; i < Math.max(keys.size(), values.size()); i++) {
			if (i < keys.size() && keys.get(i) != null) {
				result.add(keys.get(i));
			}
			if (i < values.size() && values.get(i) != null) {
				result.add(values.get(i));
			}
		}
		return result;
	}

	/**
	 * Stable sort by effective start. A child without any positioned node
	 * in its subtree stays right after its left neighbour.
	 */
	private static List<Node> sortByStart(List<Node> children) {
		List<TextPosition> keys = new ArrayList<>(children.size());
		TextPosition previous = ORIGIN;
		for (Node child : children) {
			TextPosition start = effectiveStart(child);
			if (start == null) {
				start = previous;
			}
			keys.add(start);
			previous = start;
		}
		List<Integer> indices = new ArrayList<>(children.size());
		for (int i = 0; i < children.size(); i++) {
			indices.add(i);
		}
		indices.sort(Comparator.comparing(keys::get));
		List<Node> result = new ArrayList<>(children.size());
		for (int index : indices) {
			result.add(children.get(index));
		}
		return result;
	}

	/**
	 * The node's own start, or else the earliest start among its
	 * descendants; {@code null} when nothing in the subtree is positioned.
	 */
	static TextPosition effectiveStart(Node node) {
		if (node.hasPosition()) {
			return node.getStart();
		}
		TextPosition earliest = null;
		for (Node child : node.iterChildNodes()) {
			TextPosition start = effectiveStart(child);
			if (start != null && (earliest == null || start.isBefore(earliest))) {
				earliest = start;
			}
		}
		return earliest;
	}
}
