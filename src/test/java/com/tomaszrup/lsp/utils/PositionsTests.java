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
package com.tomaszrup.lsp.utils;

import org.eclipse.lsp4j.Position;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.pyranges.text.SourceLines;
import com.tomaszrup.pyranges.text.TextPosition;

/**
 * Unit tests for {@link Positions}: comparator ordering, validity checks,
 * and conversion between text positions and LSP positions.
 */
class PositionsTests {

	// ------------------------------------------------------------------
	// COMPARATOR
	// ------------------------------------------------------------------

	@Test
	void testComparatorSamePosition() {
		Assertions.assertEquals(0, Positions.COMPARATOR.compare(new Position(5, 10), new Position(5, 10)));
	}

	@Test
	void testComparatorDifferentLines() {
		Position earlier = new Position(1, 0);
		Position later = new Position(5, 0);
		Assertions.assertTrue(Positions.COMPARATOR.compare(earlier, later) < 0);
		Assertions.assertTrue(Positions.COMPARATOR.compare(later, earlier) > 0);
	}

	@Test
	void testComparatorSameLineDifferentColumns() {
		Position left = new Position(3, 2);
		Position right = new Position(3, 10);
		Assertions.assertTrue(Positions.COMPARATOR.compare(left, right) < 0);
		Assertions.assertTrue(Positions.COMPARATOR.compare(right, left) > 0);
	}

	// ------------------------------------------------------------------
	// valid()
	// ------------------------------------------------------------------

	@Test
	void testValidZeroLineAndColumn() {
		Assertions.assertTrue(Positions.valid(new Position(0, 0)));
	}

	@Test
	void testValidNegativeColumn() {
		Assertions.assertFalse(Positions.valid(new Position(1, -1)));
	}

	@Test
	void testValidNegativeLine() {
		Assertions.assertFalse(Positions.valid(new Position(-1, 1)));
	}

	// ------------------------------------------------------------------
	// toPosition() / toTextPosition()
	// ------------------------------------------------------------------

	@Test
	void testToPositionIsZeroBased() {
		SourceLines lines = SourceLines.of("x = 1\ny = 2\n");
		Position position = Positions.toPosition(new TextPosition(2, 4), lines);
		Assertions.assertEquals(1, position.getLine());
		Assertions.assertEquals(4, position.getCharacter());
	}

	@Test
	void testToPositionCountsUtf16Units() {
		SourceLines lines = SourceLines.of("s = '😀' + t\n");
		Position position = Positions.toPosition(new TextPosition(1, 8), lines);
		Assertions.assertEquals(9, position.getCharacter());
	}

	@Test
	void testToTextPosition() {
		SourceLines lines = SourceLines.of("s = '😀' + t\n");
		Assertions.assertEquals(new TextPosition(1, 8), Positions.toTextPosition(new Position(0, 9), lines));
	}

	@Test
	void testToTextPositionOfInvalidPosition() {
		SourceLines lines = SourceLines.of("x\n");
		Assertions.assertNull(Positions.toTextPosition(new Position(0, -1), lines));
		Assertions.assertNull(Positions.toTextPosition(null, lines));
	}
}
