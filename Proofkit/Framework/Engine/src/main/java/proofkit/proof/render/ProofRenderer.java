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
package proofkit.proof.render;

import java.util.*;

import proofkit.proof.Proof;
import proofkit.proof.ProofStep;

/**
 * Renders a proof as human-readable lines. Steps are numbered from 1; ledger indices
 * and references are zero-based internally and shifted by one for display only.
 */
public final class ProofRenderer {

	static final String NONE = "(none)";
	static final String NOT_SET = "(not set)";

	private ProofRenderer() {
	}

	/**
	 * Renders a proof.
	 * @param proof the proof
	 * @return the lines, in display order
	 */
	public static List<String> render(Proof proof) {
		List<String> lines = new ArrayList<>();
		lines.add("Proof (" + proof.getStrategy() + ")");
		lines.add("Premises: " + joinOrNone(proof.getPremises()));
		lines.add("Assumptions: " + joinOrNone(proof.getAssumptions()));
		lines.add("Steps:");
		List<ProofStep> steps = proof.getSteps();
		for (int i = 0; i < steps.size(); i++) {
			lines.add(formatStep(i, steps.get(i)));
		}
		lines.add("Conclusion: " + (proof.hasConclusion() ? proof.getConclusion() : NOT_SET));
		return lines;
	}

	/**
	 * Formats one ledger entry as {@code "  <index+1>. <step>"}.
	 * @param index zero-based ledger index
	 * @param step the step
	 * @return the formatted line
	 */
	public static String formatStep(int index, ProofStep step) {
		return "  " + (index + 1) + ". " + step;
	}

	private static String joinOrNone(Collection<String> items) {
		return items.isEmpty() ? NONE : String.join(", ", items);
	}
}
