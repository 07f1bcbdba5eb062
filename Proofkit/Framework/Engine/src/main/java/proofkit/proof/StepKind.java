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

/**
 * Classifies how a {@link ProofStep} entered the ledger. The premise and assumption
 * views of a {@link Proof} are projections over the ledger by kind.
 */
public enum StepKind {

	/** Recorded by {@link Proof#addPremise(String)} */
	PREMISE("Given premise"),

	/** Recorded by {@link Proof#addAssumption(String)} */
	ASSUMPTION("Assumption"),

	/** Recorded by {@link Proof#addStep(String, String, java.util.List)} */
	DERIVED(null),

	/** Recorded by {@link InductionProof#addBaseCase} */
	BASE_CASE("Base case verification"),

	/** Recorded by {@link InductionProof#addInductiveHypothesis(String)} */
	INDUCTIVE_HYPOTHESIS("Inductive hypothesis"),

	/** Recorded by {@link InductionProof#addInductiveStep} */
	INDUCTIVE_STEP("Inductive step verification"),

	/** Recorded by {@link ContradictionProof#addContradiction} */
	CONTRADICTION("Logical contradiction");

	private final String defaultReason;

	StepKind(String defaultReason) {
		this.defaultReason = defaultReason;
	}

	/**
	 * Returns the reason text the engine writes for steps of this kind.
	 * @return the fixed reason, or null for {@link #DERIVED} steps whose reason
	 * is chosen by the caller
	 */
	public String getDefaultReason() {
		return defaultReason;
	}
}
