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
package com.tomaszrup.pyranges.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.tomaszrup.pyranges.text.TextPosition;
import com.tomaszrup.pyranges.text.TextRange;

/**
 * A mutable syntax tree node as produced by a {@code PythonParser}.
 *
 * <p>Children live in named fields, in declaration order; a field holds a
 * single node, a list of nodes or nothing. A node owns its children
 * exclusively. Equality is identity.</p>
 *
 * <p>Parsers fill in the start position; the end position stays unset
 * ({@code -1}) until ranges are reconstructed.</p>
 */
public class Node {
	private static final int UNSET = -1;

	private final NodeKind kind;
	private final Map<String, Object> fields = new LinkedHashMap<>();
	private String value;

	private int lineno = UNSET;
	private int colOffset = UNSET;
	private int endLineno = UNSET;
	private int endColOffset = UNSET;

	public Node(NodeKind kind) {
		this.kind = kind;
	}

	public Node(NodeKind kind, int lineno, int colOffset) {
		this.kind = kind;
		this.lineno = lineno;
		this.colOffset = colOffset;
	}

	public NodeKind getKind() {
		return kind;
	}

	public String getValue() {
		return value;
	}

	public Node withValue(String value) {
		this.value = value;
		return this;
	}

	// ── Fields ───────────────────────────────────────────────────────────────

	public Node put(String field, Node child) {
		fields.put(field, child);
		return this;
	}

	public Node putAll(String field, List<Node> children) {
		fields.put(field, new ArrayList<>(children));
		return this;
	}

	public List<String> getFieldNames() {
		return new ArrayList<>(fields.keySet());
	}

	/**
	 * Returns the node stored in a single-node field, or {@code null}.
	 */
	public Node getChild(String field) {
		Object content = fields.get(field);
		if (content instanceof Node) {
			return (Node) content;
		}
		return null;
	}

	/**
	 * Returns the nodes stored in a field. List fields may contain
	 * {@code null} entries (a dict's {@code **} unpacking has no key).
	 */
	@SuppressWarnings("unchecked")
	public List<Node> getChildren(String field) {
		Object content = fields.get(field);
		if (content instanceof List) {
			return Collections.unmodifiableList((List<Node>) content);
		}
		if (content instanceof Node) {
			return Collections.singletonList((Node) content);
		}
		return Collections.emptyList();
	}

	/**
	 * Direct children in field declaration order, skipping empty slots.
	 */
	public List<Node> iterChildNodes() {
		List<Node> children = new ArrayList<>();
		for (String field : fields.keySet()) {
			for (Node child : getChildren(field)) {
				if (child != null) {
					children.add(child);
				}
			}
		}
		return children;
	}

	// ── Positions ────────────────────────────────────────────────────────────

	public boolean hasPosition() {
		return lineno >= 1;
	}

	public boolean hasRange() {
		return hasPosition() && endLineno >= 1;
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

	public void setStart(TextPosition start) {
		this.lineno = start.getLine();
		this.colOffset = start.getColumn();
	}

	public void setColOffset(int colOffset) {
		this.colOffset = colOffset;
	}

	public TextPosition getEnd() {
		if (endLineno < 1) {
			return null;
		}
		return new TextPosition(endLineno, endColOffset);
	}

	public void setEnd(TextPosition end) {
		this.endLineno = end.getLine();
		this.endColOffset = end.getColumn();
	}

	/**
	 * Returns the reconstructed range, or {@code null} before reconstruction
	 * and for nodes without a position.
	 */
	public TextRange getRange() {
		if (!hasRange()) {
			return null;
		}
		return new TextRange(lineno, colOffset, endLineno, endColOffset);
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder(kind.name());
		if (value != null) {
			builder.append('(').append(value).append(')');
		}
		if (hasPosition()) {
			builder.append(" @ ").append(lineno).append('.').append(colOffset);
			if (endLineno >= 1) {
				builder.append(" - ").append(endLineno).append('.').append(endColOffset);
			}
		}
		return builder.toString();
	}
}
