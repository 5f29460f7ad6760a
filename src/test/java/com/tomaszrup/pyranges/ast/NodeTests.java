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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.pyranges.ast;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.pyranges.text.TextPosition;
import com.tomaszrup.pyranges.text.TextRange;

class NodeTests {

	@Test
	void testIterChildNodesFollowsFieldOrderAndSkipsEmptySlots() {
		Node key = new Node(NodeKind.STR, 1, 1);
		Node first = new Node(NodeKind.NUM, 1, 6);
		Node second = new Node(NodeKind.NAME, 1, 11);
		Node dict = new Node(NodeKind.DICT, 1, 0)
				.putAll("keys", Arrays.asList(key, null))
				.putAll("values", Arrays.asList(first, second));
		Assertions.assertEquals(Arrays.asList(key, first, second), dict.iterChildNodes());
		Assertions.assertEquals(Arrays.asList("keys", "values"), dict.getFieldNames());
		Assertions.assertEquals(2, dict.getChildren("keys").size());
		Assertions.assertNull(dict.getChildren("keys").get(1));
	}

	@Test
	void testSingleChildField() {
		Node value = new Node(NodeKind.NAME, 1, 0);
		Node expr = new Node(NodeKind.EXPR, 1, 0).put("value", value);
		Assertions.assertSame(value, expr.getChild("value"));
		Assertions.assertEquals(Collections.singletonList(value), expr.getChildren("value"));
		Assertions.assertNull(expr.getChild("missing"));
		Assertions.assertTrue(expr.getChildren("missing").isEmpty());
	}

	@Test
	void testPositionsAndRange() {
		Node node = new Node(NodeKind.NAME, 2, 4).withValue("x");
		Assertions.assertTrue(node.hasPosition());
		Assertions.assertFalse(node.hasRange());
		Assertions.assertNull(node.getEnd());
		Assertions.assertNull(node.getRange());

		node.setEnd(new TextPosition(2, 5));
		Assertions.assertTrue(node.hasRange());
		Assertions.assertEquals(new TextRange(2, 4, 2, 5), node.getRange());

		node.setStart(new TextPosition(1, 0));
		Assertions.assertEquals(1, node.getLineno());
		Assertions.assertEquals(0, node.getColOffset());
	}

	@Test
	void testUnpositionedNode() {
		Node module = new Node(NodeKind.MODULE);
		Assertions.assertFalse(module.hasPosition());
		Assertions.assertFalse(module.hasRange());
		Assertions.assertTrue(module.iterChildNodes().isEmpty());
	}

	@Test
	void testCategories() {
		Assertions.assertTrue(NodeKind.ASSIGN.isStatement());
		Assertions.assertTrue(NodeKind.EXPR.isStatement());
		Assertions.assertFalse(NodeKind.EXPR.isExpression());
		Assertions.assertTrue(NodeKind.TUPLE.isExpression());
		Assertions.assertEquals(NodeKind.Category.MOD, NodeKind.MODULE.getCategory());
		Assertions.assertEquals(NodeKind.Category.OTHER, NodeKind.ARG.getCategory());
	}

	@Test
	void testIdentityEquality() {
		Assertions.assertNotEquals(new Node(NodeKind.NAME, 1, 0), new Node(NodeKind.NAME, 1, 0));
	}
}
