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
package proofkit.proof.verify;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import proofkit.proof.Proof;
import proofkit.proof.ProofStep;

/**
 * Checks the structural soundness of a proof against the rules of its declared
 * strategy. The engine never modifies the proof and never throws for an ill-formed
 * proof; problems are returned as {@link VerificationIssue}s.
 *
 * <p>The shared pre-checks run for every strategy before the strategy rule:
 * <ol>
 *   <li>the ledger is not empty</li>
 *   <li>a conclusion is set</li>
 *   <li>every reference names an index in {@code [0, ledger size)}</li>
 * </ol>
 */
public final class VerificationEngine {

	private static final Logger log = LogManager.getLogger();

	private static final VerificationEngine INSTANCE = new VerificationEngine();

	private VerificationEngine() {
	}

	public static VerificationEngine getInstance() {
		return INSTANCE;
	}

	/**
	 * Verifies a proof.
	 * @param proof the proof to verify
	 * @return the result listing every unmet condition
	 */
	public VerificationResult verify(Proof proof) {
		List<VerificationIssue> issues = new ArrayList<>(checkShared(proof));
		issues.addAll(StructuralRules.forStrategy(proof.getStrategy()).evaluate(proof));

		VerificationResult result = new VerificationResult(proof.getStrategy(), issues);
		log.debug("Verified proof {}: {}", proof.getId(), result);
		return result;
	}

	private List<VerificationIssue> checkShared(Proof proof) {
		List<VerificationIssue> issues = new ArrayList<>();
		List<ProofStep> steps = proof.getSteps();
		if (steps.isEmpty()) {
			issues.add(VerificationIssue.of(VerificationIssue.Type.EMPTY_LEDGER));
		}
		if (!proof.hasConclusion()) {
			issues.add(VerificationIssue.of(VerificationIssue.Type.MISSING_CONCLUSION));
		}
		int size = steps.size();
		for (int i = 0; i < size; i++) {
			for (int ref : steps.get(i).getReferences()) {
				if (ref < 0 || ref >= size) {
					issues.add(VerificationIssue.referenceOutOfRange(i, ref, size));
				}
			}
		}
		return issues;
	}
}
