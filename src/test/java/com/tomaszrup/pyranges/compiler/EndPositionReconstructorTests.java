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
package com.tomaszrup.pyranges.compiler;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.pyranges.ast.Node;
import com.tomaszrup.pyranges.ast.NodeKind;
import com.tomaszrup.pyranges.text.SourceLines;
import com.tomaszrup.pyranges.text.TextRange;
import com.tomaszrup.pyranges.tokens.CharOffsetTokenizer;
import com.tomaszrup.pyranges.tokens.PythonTokenizer;
import com.tomaszrup.pyranges.tokens.Token;

/**
 * Trees here carry start positions that are already in character columns.
 */
class EndPositionReconstructorTests {
	private final EndPositionReconstructor reconstructor = new EndPositionReconstructor();

	private ReconstructionReport reconstruct(Node tree, String source) {
		List<Token> tokens = new CharOffsetTokenizer(new PythonTokenizer(), StandardCharsets.UTF_8).tokenize(source);
		return reconstructor.reconstruct(tree, tokens, SourceLines.of(source).getEndPosition());
	}

	private static Node module(Node... body) {
		return new Node(NodeKind.MODULE).putAll("body", Arrays.asList(body));
	}

	private static Node expr(Node value) {
		return new Node(NodeKind.EXPR, value.getLineno(), value.getColOffset()).put("value", value);
	}

	private static Node assign(Node target, Node value) {
		return new Node(NodeKind.ASSIGN, target.getLineno(), target.getColOffset())
				.putAll("targets", Collections.singletonList(target))
				.put("value", value);
	}

	@Test
	void testBinaryOperation() {
		Node target = new Node(NodeKind.NAME, 1, 0);
		Node left = new Node(NodeKind.NUM, 1, 4);
		Node right = new Node(NodeKind.NUM, 1, 8);
		Node binOp = new Node(NodeKind.BIN_OP, 1, 4).put("left", left).put("right", right);
		Node assign = assign(target, binOp);

		ReconstructionReport report = reconstruct(module(assign), "x = 1 + 2\n");

		Assertions.assertEquals(new TextRange(1, 0, 1, 9), assign.getRange());
		Assertions.assertEquals(new TextRange(1, 0, 1, 1), target.getRange());
		Assertions.assertEquals(new TextRange(1, 4, 1, 9), binOp.getRange());
		Assertions.assertEquals(new TextRange(1, 4, 1, 5), left.getRange());
		Assertions.assertEquals(new TextRange(1, 8, 1, 9), right.getRange());
		Assertions.assertTrue(report.isComplete());
		Assertions.assertEquals(5, report.getNodeCount());
	}

	@Test
	void testCallWithoutArguments() {
		Node func = new Node(NodeKind.NAME, 1, 0);
		Node call = new Node(NodeKind.CALL, 1, 0).put("func", func);
		Node statement = expr(call);

		reconstruct(module(statement), "f()\n");

		Assertions.assertEquals(new TextRange(1, 0, 1, 3), statement.getRange());
		Assertions.assertEquals(new TextRange(1, 0, 1, 3), call.getRange());
		Assertions.assertEquals(new TextRange(1, 0, 1, 1), func.getRange());
	}

	@Test
	void testAttributeChain() {
		Node name = new Node(NodeKind.NAME, 1, 0);
		Node inner = new Node(NodeKind.ATTRIBUTE, 1, 0).put("value", name).withValue("b");
		Node outer = new Node(NodeKind.ATTRIBUTE, 1, 0).put("value", inner).withValue("c");

		reconstruct(module(expr(outer)), "a.b.c  # tail\n");

		Assertions.assertEquals(new TextRange(1, 0, 1, 5), outer.getRange());
		Assertions.assertEquals(new TextRange(1, 0, 1, 3), inner.getRange());
		Assertions.assertEquals(new TextRange(1, 0, 1, 1), name.getRange());
	}

	@Test
	void testCallArgumentsAndSubscript() {
		// f(a, b[1])
		Node a = new Node(NodeKind.NAME, 1, 2);
		Node index = new Node(NodeKind.NUM, 1, 7);
		Node subscript = new Node(NodeKind.SUBSCRIPT, 1, 5)
				.put("value", new Node(NodeKind.NAME, 1, 5))
				.put("slice", new Node(NodeKind.INDEX).put("value", index));
		Node call = new Node(NodeKind.CALL, 1, 0)
				.put("func", new Node(NodeKind.NAME, 1, 0))
				.putAll("args", Arrays.asList(a, subscript));

		reconstruct(module(expr(call)), "f(a, b[1])\n");

		Assertions.assertEquals(new TextRange(1, 0, 1, 10), call.getRange());
		Assertions.assertEquals(new TextRange(1, 2, 1, 3), a.getRange());
		Assertions.assertEquals(new TextRange(1, 5, 1, 9), subscript.getRange());
		Assertions.assertEquals(new TextRange(1, 7, 1, 8), index.getRange());
	}

	@Test
	void testTupleKeepsItsCommas() {
		Node first = new Node(NodeKind.NUM, 1, 4);
		Node second = new Node(NodeKind.NUM, 1, 7);
		Node tuple = new Node(NodeKind.TUPLE, 1, 4).putAll("elts", Arrays.asList(first, second));

		reconstruct(module(assign(new Node(NodeKind.NAME, 1, 0), tuple)), "x = 1, 2\n");

		Assertions.assertEquals(new TextRange(1, 4, 1, 8), tuple.getRange());
		Assertions.assertEquals(new TextRange(1, 4, 1, 5), first.getRange());
	}

	@Test
	void testDictWithUnpacking() {
		Node key = new Node(NodeKind.NUM, 1, 5);
		Node value = new Node(NodeKind.STR, 1, 8);
		Node unpacked = new Node(NodeKind.NAME, 1, 15);
		Node dict = new Node(NodeKind.DICT, 1, 4)
				.putAll("keys", Arrays.asList(key, null))
				.putAll("values", Arrays.asList(value, unpacked));

		reconstruct(module(assign(new Node(NodeKind.NAME, 1, 0), dict)), "d = {1: 'a', **e}\n");

		Assertions.assertEquals(new TextRange(1, 4, 1, 17), dict.getRange());
		Assertions.assertEquals(new TextRange(1, 5, 1, 6), key.getRange());
		Assertions.assertEquals(new TextRange(1, 8, 1, 11), value.getRange());
		Assertions.assertEquals(new TextRange(1, 15, 1, 16), unpacked.getRange());
	}

	@Test
	void testMultiLineString() {
		Node string = new Node(NodeKind.STR, 1, 4);
		Node assign = assign(new Node(NodeKind.NAME, 1, 0), string);

		reconstruct(module(assign), "x = \"\"\"a\nb\"\"\"\n");

		Assertions.assertEquals(new TextRange(1, 4, 2, 4), string.getRange());
		Assertions.assertEquals(new TextRange(1, 0, 2, 4), assign.getRange());
	}

	@Test
	void testCompoundStatementBodies() {
		Node test = new Node(NodeKind.NAME, 1, 3);
		Node body = expr(new Node(NodeKind.NAME, 2, 4));
		Node orElse = expr(new Node(NodeKind.NAME, 4, 4));
		Node ifStatement = new Node(NodeKind.IF, 1, 0)
				.put("test", test)
				.putAll("body", Collections.singletonList(body))
				.putAll("orelse", Collections.singletonList(orElse));

		reconstruct(module(ifStatement), "if x:\n    y\nelse:\n    z\n");

		Assertions.assertEquals(new TextRange(1, 0, 4, 5), ifStatement.getRange());
		Assertions.assertEquals(new TextRange(1, 3, 1, 4), test.getRange());
		Assertions.assertEquals(new TextRange(2, 4, 2, 5), body.getRange());
		Assertions.assertEquals(new TextRange(4, 4, 4, 5), orElse.getRange());
	}

	@Test
	void testExceptionHandlerCoversItsBody() {
		Node type = new Node(NodeKind.NAME, 3, 7);
		Node handlerBody = expr(new Node(NodeKind.NAME, 4, 4));
		Node handler = new Node(NodeKind.EXCEPT_HANDLER, 3, 0)
				.put("type", type)
				.putAll("body", Collections.singletonList(handlerBody));
		Node tryBody = expr(new Node(NodeKind.NAME, 2, 4));
		Node tryStatement = new Node(NodeKind.TRY, 1, 0)
				.putAll("body", Collections.singletonList(tryBody))
				.putAll("handlers", Collections.singletonList(handler));

		ReconstructionReport report = reconstruct(module(tryStatement), "try:\n    a\nexcept E:\n    b\n");

		Assertions.assertTrue(report.isComplete());
		Assertions.assertEquals(new TextRange(1, 0, 4, 5), tryStatement.getRange());
		Assertions.assertEquals(new TextRange(2, 4, 2, 5), tryBody.getRange());
		Assertions.assertEquals(new TextRange(3, 0, 4, 5), handler.getRange());
		Assertions.assertEquals(new TextRange(3, 7, 3, 8), type.getRange());
		Assertions.assertEquals(new TextRange(4, 4, 4, 5), handlerBody.getRange());
	}

	@Test
	void testStatementsSeparatedBySemicolon() {
		Node first = assign(new Node(NodeKind.NAME, 1, 0), new Node(NodeKind.NUM, 1, 4));
		Node second = assign(new Node(NodeKind.NAME, 1, 7), new Node(NodeKind.NUM, 1, 11));

		reconstruct(module(first, second), "a = 1; b = 2\n");

		Assertions.assertEquals(new TextRange(1, 0, 1, 5), first.getRange());
		Assertions.assertEquals(new TextRange(1, 7, 1, 12), second.getRange());
	}

	@Test
	void testBareYield() {
		Node bareYield = new Node(NodeKind.YIELD, 1, 4);
		Node parenthesized = new Node(NodeKind.YIELD, 2, 5);
		Node first = assign(new Node(NodeKind.NAME, 1, 0), bareYield);
		Node second = assign(new Node(NodeKind.NAME, 2, 0), parenthesized);

		ReconstructionReport report = reconstruct(module(first, second), "x = yield\ny = (yield)\n");

		Assertions.assertTrue(report.isComplete(), report.getDegenerateOutcomes().toString());
		Assertions.assertEquals(new TextRange(1, 4, 1, 9), bareYield.getRange());
		Assertions.assertEquals(new TextRange(2, 5, 2, 10), parenthesized.getRange());
		Assertions.assertEquals(new TextRange(1, 0, 1, 9), first.getRange());
	}

	@Test
	void testDecoratedFunctionWithDefaults() {
		Node decorator = new Node(NodeKind.NAME, 1, 1);
		Node a = new Node(NodeKind.ARG, 2, 6).withValue("a");
		Node b = new Node(NodeKind.ARG, 2, 9).withValue("b");
		Node bDefault = new Node(NodeKind.NUM, 2, 11);
		Node arguments = new Node(NodeKind.ARGUMENTS)
				.putAll("args", Arrays.asList(a, b))
				.putAll("defaults", Collections.singletonList(bDefault));
		Node pass = new Node(NodeKind.PASS, 3, 4);
		Node def = new Node(NodeKind.FUNCTION_DEF, 1, 0).withValue("f")
				.put("args", arguments)
				.putAll("body", Collections.singletonList(pass))
				.putAll("decorator_list", Collections.singletonList(decorator));

		ReconstructionReport report = reconstruct(module(def), "@dec\ndef f(a, b=1):\n    pass\n");

		Assertions.assertEquals(new TextRange(1, 0, 3, 8), def.getRange());
		Assertions.assertEquals(new TextRange(1, 1, 1, 4), decorator.getRange());
		Assertions.assertEquals(new TextRange(2, 6, 2, 7), a.getRange());
		Assertions.assertEquals(new TextRange(2, 9, 2, 10), b.getRange());
		Assertions.assertEquals(new TextRange(2, 11, 2, 12), bDefault.getRange());
		Assertions.assertEquals(new TextRange(3, 4, 3, 8), pass.getRange());
		Assertions.assertFalse(arguments.hasRange());
		Assertions.assertNull(report.getOutcome(arguments));
	}

	@Test
	void testDegenerateRangeIsReportedNotThrown() {
		// a call with no arguments whose tokens do not end with ')'
		Node func = new Node(NodeKind.NAME, 1, 0);
		Node call = new Node(NodeKind.CALL, 1, 0).put("func", func);

		ReconstructionReport report = reconstruct(module(expr(call)), "x\n");

		Assertions.assertEquals(new TextRange(1, 0, 1, 1), call.getRange());
		Assertions.assertEquals(new TextRange(1, 0, 1, 1), func.getRange());
		Assertions.assertFalse(report.isComplete());
		Assertions.assertEquals(1, report.getDegenerateCount());
		RangeOutcome outcome = report.getOutcome(call);
		Assertions.assertTrue(outcome.isDegenerate());
		Assertions.assertSame(call, outcome.getNode());
		Assertions.assertTrue(((RangeOutcome.Degenerate) outcome).getReason().contains(")"));
		Assertions.assertFalse(report.getOutcome(func).isDegenerate());
	}

	@Test
	void testNodeWithoutTokensGetsDegenerateRange() {
		Node misplaced = new Node(NodeKind.NAME, 1, 5);

		Node statement = new Node(NodeKind.EXPR, 1, 0).put("value", misplaced);

		ReconstructionReport report = reconstruct(module(statement), "x\n");

		Assertions.assertEquals(new TextRange(1, 5, 1, 6), misplaced.getRange());
		Assertions.assertEquals(Collections.singletonList(report.getOutcome(misplaced)),
				report.getDegenerateOutcomes());
		Assertions.assertEquals(new TextRange(1, 0, 1, 1), statement.getRange());
	}

	@Test
	void testReconstructionIsIdempotent() {
		Node binOp = new Node(NodeKind.BIN_OP, 1, 0)
				.put("left", new Node(NodeKind.NAME, 1, 0))
				.put("right", new Node(NodeKind.CALL, 1, 4).put("func", new Node(NodeKind.NAME, 1, 4)));
		Node tree = module(expr(binOp));
		String source = "a + g()\n";

		reconstruct(tree, source);
		TextRange first = binOp.getRange();
		TextRange firstRight = binOp.getChild("right").getRange();
		reconstruct(tree, source);

		Assertions.assertEquals(first, binOp.getRange());
		Assertions.assertEquals(firstRight, binOp.getChild("right").getRange());
		Assertions.assertEquals(new TextRange(1, 0, 1, 7), first);
	}
}
