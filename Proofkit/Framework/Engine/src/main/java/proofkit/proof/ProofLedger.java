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
import java.util.stream.Collectors;

/**
 * The ordered, append-only history of steps belonging to one {@link Proof}.
 * Steps are never edited or removed once appended.
 *
 * <p>Not thread-safe. A ledger is owned by a single proof and mutated only by it.
 */
public final class ProofLedger {

	private final List<ProofStep> steps = new ArrayList<>();

	ProofLedger() {
	}

	/**
	 * Appends a step and returns its zero-based index.
	 * @param step the step to append
	 * @return the index of the new step
	 */
	int append(ProofStep step) {
		steps.add(Objects.requireNonNull(step, "step must not be null"));
		return steps.size() - 1;
	}

	/**
	 * Returns the step at the given zero-based index.
	 * @param index the ledger index
	 * @return the step
	 * @throws IllegalArgumentException if the index is not in the ledger
	 */
	public ProofStep get(int index) {
		if (!contains(index)) {
			throw new IllegalArgumentException(
				"No step at index " + index + " (ledger size " + steps.size() + ")");
		}
		return steps.get(index);
	}

	/**
	 * Returns whether the index currently names a step in this ledger.
	 * @param index a zero-based index
	 * @return true if {@code 0 <= index < size()}
	 */
	public boolean contains(int index) {
		return index >= 0 && index < steps.size();
	}

	public int size() {
		return steps.size();
	}

	public boolean isEmpty() {
		return steps.isEmpty();
	}

	/**
	 * Returns a snapshot of the ledger in append order.
	 * @return unmodifiable list of steps
	 */
	public List<ProofStep> getSteps() {
		return Collections.unmodifiableList(new ArrayList<>(steps));
	}

	/**
	 * Returns the distinct statements of all steps of the given kind, in first-seen order.
	 * @param kind the step kind
	 * @return unmodifiable set of statement texts
	 */
	public Set<String> statementsOfKind(StepKind kind) {
		LinkedHashSet<String> statements = steps.stream()
			.filter(s -> s.getKind() == kind)
			.map(ProofStep::getStatement)
			.collect(Collectors.toCollection(LinkedHashSet::new));
		return Collections.unmodifiableSet(statements);
	}
}
