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

import java.util.*;
import java.util.function.IntPredicate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A proof by induction over the variable {@value #VARIABLE}, starting at a fixed base case.
 *
 * <p>The base case and inductive step builders run a caller-supplied predicate before
 * committing their step. The inductive step is checked only at a few sample values
 * ({@code base, base+1, base+2} unless the caller picks others). Passing those checks is
 * evidence for the inductive step, not a proof of it for every n.
 *
 * <p>Predicates are invoked synchronously on the calling thread and are expected to be
 * pure, total and fast.
 */
public class InductionProof extends Proof {

	private static final Logger log = LogManager.getLogger();

	/** The inductive variable. */
	public static final String VARIABLE = "n";

	/** Base case used when none is given. */
	public static final int DEFAULT_BASE_CASE = 1;

	private static final int DEFAULT_SAMPLE_COUNT = 3;

	private final int baseCase;

	public InductionProof() {
		this(DEFAULT_BASE_CASE);
	}

	/**
	 * Creates an induction proof.
	 * @param baseCase the first value of n the proof covers
	 */
	public InductionProof(int baseCase) {
		super(ProofStrategy.INDUCTION);
		this.baseCase = baseCase;
	}

	public int getBaseCase() {
		return baseCase;
	}

	public String getVariable() {
		return VARIABLE;
	}

	/**
	 * Returns the sample values the inductive step is checked at by default.
	 * Values past {@link Integer#MAX_VALUE} are left out rather than wrapped.
	 * @return {@code [base, base+1, base+2]}, shorter near the top of the int range
	 */
	public List<Integer> getDefaultTestValues() {
		List<Integer> values = new ArrayList<>(DEFAULT_SAMPLE_COUNT);
		for (int i = 0; i < DEFAULT_SAMPLE_COUNT; i++) {
			long n = (long) baseCase + i;
			if (n > Integer.MAX_VALUE) {
				break;
			}
			values.add((int) n);
		}
		return Collections.unmodifiableList(values);
	}

	/**
	 * Checks the base case and records it. The step is appended whether or not the
	 * predicate holds, so a failed attempt stays visible in the ledger.
	 *
	 * @param statement the base case statement
	 * @param verification evaluated once at the base case
	 * @return the ledger index of the new step
	 * @throws ProofConstructionException if the predicate is false at the base case
	 */
	public int addBaseCase(String statement, IntPredicate verification)
			throws ProofConstructionException {
		Objects.requireNonNull(statement, "statement is required");
		Objects.requireNonNull(verification, "verification is required");
		boolean holds = verification.test(baseCase);
		int index = append(statement, StepKind.BASE_CASE, Collections.emptyList());
		if (!holds) {
			log.warn("Base case rejected for {}={} at step {}: {}", VARIABLE, baseCase,
				index + 1, statement);
			throw new ProofConstructionException(ProofConstructionException.Phase.BASE_CASE,
				statement, baseCase);
		}
		return index;
	}

	/**
	 * Records the inductive hypothesis. Nothing is checked.
	 * @param statement the hypothesis, typically stated for some n = k
	 * @return the ledger index of the new step
	 */
	public int addInductiveHypothesis(String statement) {
		return append(statement, StepKind.INDUCTIVE_HYPOTHESIS, Collections.emptyList());
	}

	/**
	 * Checks the inductive step at the default sample values and records it.
	 * @see #addInductiveStep(String, IntPredicate, List)
	 */
	public int addInductiveStep(String statement, IntPredicate verification)
			throws ProofConstructionException {
		return addInductiveStep(statement, verification, null);
	}

	/**
	 * Checks the inductive step at each sample value in order and records it only if
	 * every check passes. Checking stops at the first rejected value and nothing is
	 * appended in that case.
	 *
	 * @param statement the inductive step statement
	 * @param verification evaluated at each sample value
	 * @param testValues the sample values, none of them null; null or empty means the
	 * defaults
	 * @return the ledger index of the new step
	 * @throws ProofConstructionException naming the first value the predicate rejected
	 */
	public int addInductiveStep(String statement, IntPredicate verification,
			List<Integer> testValues) throws ProofConstructionException {
		Objects.requireNonNull(statement, "statement is required");
		Objects.requireNonNull(verification, "verification is required");
		List<Integer> values =
			testValues == null || testValues.isEmpty() ? getDefaultTestValues() : testValues;
		for (Integer n : values) {
			Objects.requireNonNull(n, "testValues must not contain null");
		}
		for (int n : values) {
			if (!verification.test(n)) {
				log.warn("Inductive step rejected for {}={}: {}", VARIABLE, n, statement);
				throw new ProofConstructionException(
					ProofConstructionException.Phase.INDUCTIVE_STEP, statement, n);
			}
		}
		return append(statement, StepKind.INDUCTIVE_STEP, Collections.emptyList());
	}
}
