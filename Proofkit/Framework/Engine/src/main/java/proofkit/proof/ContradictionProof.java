/* ###
 * IP: GHIDRA
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package proofkit.proof;

import java.util.List;

/**
 * A proof by contradiction: assumptions are added, steps derived from them, and a
 * contradiction between two earlier steps is recorded.
 */
public class ContradictionProof extends Proof {

	public ContradictionProof() {
		super(ProofStrategy.CONTRADICTION);
	}

	/**
	 * Records that two earlier steps contradict each other. This is bookkeeping only:
	 * the indices are not range checked here and nothing relates them to the named
	 * statements.
	 *
	 * @param statement1 the first conflicting statement
	 * @param statement2 the second conflicting statement
	 * @param step1 zero-based ledger index of the first statement
	 * @param step2 zero-based ledger index of the second statement
	 * @return the ledger index of the new step
	 */
	public int addContradiction(String statement1, String statement2, int step1, int step2) {
		String text = "Contradiction: " + statement1 + " contradicts " + statement2;
		return append(text, StepKind.CONTRADICTION, List.of(step1, step2));
	}
}
