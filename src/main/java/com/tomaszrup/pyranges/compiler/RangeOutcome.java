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

import com.tomaszrup.pyranges.ast.Node;
import com.tomaszrup.pyranges.text.TextRange;

/**
 * What the reconstruction did for one positioned node.
 */
public abstract class RangeOutcome {
	private final Node node;
	private final TextRange range;

	RangeOutcome(Node node) {
		this.node = node;
		this.range = node.getRange();
	}

	public Node getNode() {
		return node;
	}

	/**
	 * The range assigned to the node by the pass that produced this outcome.
	 */
	public TextRange getRange() {
		return range;
	}

	public abstract boolean isDegenerate();

	/**
	 * The node's end was derived from its tokens.
	 */
	public static final class Reconstructed extends RangeOutcome {
		Reconstructed(Node node) {
			super(node);
		}

		@Override
		public boolean isDegenerate() {
			return false;
		}

		@Override
		public String toString() {
			return "Reconstructed[" + getNode() + "]";
		}
	}

	/**
	 * The node's tokens did not fit its kind; it got a one-column range at
	 * its start.
	 */
	public static final class Degenerate extends RangeOutcome {
		private final String reason;

		Degenerate(Node node, String reason) {
			super(node);
			this.reason = reason;
		}

		public String getReason() {
			return reason;
		}

		@Override
		public boolean isDegenerate() {
			return true;
		}

		@Override
		public String toString() {
			return "Degenerate[" + getNode() + ": " + reason + "]";
		}
	}
}
