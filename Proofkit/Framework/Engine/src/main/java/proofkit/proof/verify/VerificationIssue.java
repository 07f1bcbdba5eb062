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

import java.util.Objects;

/**
 * One unmet structural condition found while verifying a proof.
 */
public final class VerificationIssue {

	/**
	 * Kinds of structural problems.
	 */
	public enum Type {
		/** The ledger has no steps */
		EMPTY_LEDGER("Proof has no steps"),

		/** No conclusion has been set */
		MISSING_CONCLUSION("Proof has no conclusion"),

		/** A step references an index outside the ledger */
		REFERENCE_OUT_OF_RANGE("Step references a step that does not exist"),

		/** A contradiction proof has no assumption */
		MISSING_ASSUMPTION("Proof by contradiction has no assumption"),

		/** A contradiction proof never states a contradiction */
		MISSING_CONTRADICTION("Proof by contradiction never reaches a contradiction"),

		/** An induction proof has no base case step */
		MISSING_BASE_CASE("Proof by induction has no base case"),

		/** An induction proof has no inductive step */
		MISSING_INDUCTIVE_STEP("Proof by induction has no inductive step");

		private final String description;

		Type(String description) {
			this.description = description;
		}

		public String getDescription() {
			return description;
		}
	}

	private final Type type;
	private final int stepIndex;
	private final String message;

	private VerificationIssue(Type type, int stepIndex, String message) {
		this.type = Objects.requireNonNull(type, "type is required");
		this.stepIndex = stepIndex;
		this.message = message;
	}

	/**
	 * Creates an issue that concerns the proof as a whole.
	 * @param type the issue type
	 * @return the issue
	 */
	public static VerificationIssue of(Type type) {
		return new VerificationIssue(type, -1, type.getDescription());
	}

	/**
	 * Creates an issue for a reference that does not name a ledger step.
	 * @param stepIndex zero-based index of the step holding the reference
	 * @param reference the offending reference
	 * @param ledgerSize the ledger size at verification time
	 * @return the issue
	 */
	public static VerificationIssue referenceOutOfRange(int stepIndex, int reference,
			int ledgerSize) {
		return new VerificationIssue(Type.REFERENCE_OUT_OF_RANGE, stepIndex,
			String.format("Step %d references index %d, ledger has %d steps", stepIndex + 1,
				reference, ledgerSize));
	}

	public Type getType() {
		return type;
	}

	/**
	 * Returns the zero-based ledger index of the step the issue was found in.
	 * @return the step index, or -1 if the issue concerns the whole proof
	 */
	public int getStepIndex() {
		return stepIndex;
	}

	public String getMessage() {
		return message;
	}

	@Override
	public String toString() {
		return type + ": " + message;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof VerificationIssue)) {
			return false;
		}
		VerificationIssue other = (VerificationIssue) obj;
		return type == other.type && stepIndex == other.stepIndex &&
			message.equals(other.message);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, stepIndex, message);
	}
}
