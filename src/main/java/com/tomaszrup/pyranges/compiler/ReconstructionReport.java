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
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.tomaszrup.pyranges.ast.Node;

/**
 * Outcomes of one reconstruction pass, keyed by node identity.
 */
public class ReconstructionReport {
	private final Map<Node, RangeOutcome> outcomes = new IdentityHashMap<>();
	private final List<RangeOutcome.Degenerate> degenerate = new ArrayList<>();

	void addReconstructed(Node node) {
		outcomes.put(node, new RangeOutcome.Reconstructed(node));
	}

	void addDegenerate(Node node, String reason) {
		RangeOutcome.Degenerate outcome = new RangeOutcome.Degenerate(node, reason);
		outcomes.put(node, outcome);
		degenerate.add(outcome);
	}

	/**
	 * @return the outcome for the node, or {@code null} if the pass did not
	 *         visit it as a positioned node
	 */
	public RangeOutcome getOutcome(Node node) {
		return outcomes.get(node);
	}

	public List<RangeOutcome.Degenerate> getDegenerateOutcomes() {
		return Collections.unmodifiableList(degenerate);
	}

	public int getNodeCount() {
		return outcomes.size();
	}

	public int getDegenerateCount() {
		return degenerate.size();
	}

	public boolean isComplete() {
		return degenerate.isEmpty();
	}

	@Override
	public String toString() {
		return "ReconstructionReport[nodes=" + getNodeCount() + ", degenerate=" + getDegenerateCount() + "]";
	}
}
