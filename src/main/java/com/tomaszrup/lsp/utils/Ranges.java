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
package com.tomaszrup.lsp.utils;

import org.eclipse.lsp4j.Range;

import com.tomaszrup.pyranges.ast.Node;
import com.tomaszrup.pyranges.ast.util.PythonASTUtils;
import com.tomaszrup.pyranges.text.SourceLines;
import com.tomaszrup.pyranges.text.TextRange;

public class Ranges {
	private Ranges() {
	}

	public static Range toRange(TextRange range, SourceLines lines) {
		return new Range(Positions.toPosition(range.getStart(), lines), Positions.toPosition(range.getEnd(), lines));
	}

	/**
	 * @return the text range, or {@code null} if either end is invalid or
	 *         the range ends before it starts
	 */
	public static TextRange toTextRange(Range range, SourceLines lines) {
		if (range == null || !valid(range)) {
			return null;
		}
		return new TextRange(Positions.toTextPosition(range.getStart(), lines),
				Positions.toTextPosition(range.getEnd(), lines));
	}

	/**
	 * The innermost node of a ranged tree that covers an editor selection,
	 * or {@code null}.
	 */
	public static Node findClosestContainingNode(Node tree, Range selection, SourceLines lines) {
		TextRange range = toTextRange(selection, lines);
		return range == null ? null : PythonASTUtils.findClosestContainingNode(tree, range);
	}

	private static boolean valid(Range range) {
		return range.getStart() != null && range.getEnd() != null && Positions.valid(range.getStart())
				&& Positions.valid(range.getEnd())
				&& Positions.COMPARATOR.compare(range.getStart(), range.getEnd()) <= 0;
	}
}
