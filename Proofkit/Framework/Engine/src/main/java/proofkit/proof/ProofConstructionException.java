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
 * Exception thrown when a computable check attached to a construction call fails,
 * such as an induction base case or an inductive step whose predicate rejects a
 * sample value. The proof being built should be treated as invalid.
 *
 * <p>Structural problems are never reported this way; they surface as a
 * {@code false} result from {@link Proof#verify()}.
 */
public class ProofConstructionException extends Exception {

	private static final long serialVersionUID = 1L;

	/**
	 * The construction call whose check failed.
	 */
	public enum Phase {
		/** {@link InductionProof#addBaseCase} */
		BASE_CASE("base case verification failed"),

		/** {@link InductionProof#addInductiveStep} */
		INDUCTIVE_STEP("inductive step verification failed");

		private final String description;

		Phase(String description) {
			this.description = description;
		}

		public String getDescription() {
			return description;
		}
	}

	private final Phase phase;
	private final String statement;
	private final int failingValue;

	/**
	 * Creates a new construction exception.
	 *
	 * @param phase the construction call that failed
	 * @param statement the statement being added
	 * @param failingValue the sample value the predicate rejected
	 */
	public ProofConstructionException(Phase phase, String statement, int failingValue) {
		super(formatMessage(phase, statement, failingValue));
		this.phase = phase;
		this.statement = statement;
		this.failingValue = failingValue;
	}

	private static String formatMessage(Phase phase, String statement, int failingValue) {
		return String.format("%s for n=%d: %s", phase.getDescription(), failingValue,
			statement);
	}

	public Phase getPhase() {
		return phase;
	}

	public String getStatement() {
		return statement;
	}

	/**
	 * Returns the sample value the predicate rejected. For a base case failure this is
	 * the proof's base case.
	 * @return the failing value of n
	 */
	public int getFailingValue() {
		return failingValue;
	}
}
