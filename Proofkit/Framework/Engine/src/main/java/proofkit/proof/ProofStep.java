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
 * An immutable entry in a proof ledger: a statement, the reason it holds, and the
 * zero-based ledger indices of the earlier steps it derives from.
 *
 * <p>References are not range checked here. A step may point at an index that does
 * not exist yet; {@link Proof#verify()} reports such references later.
 */
public final class ProofStep {

	private final String statement;
	private final String reason;
	private final List<Integer> references;
	private final StepKind kind;

	public ProofStep(String statement, String reason, List<Integer> references) {
		this(statement, reason, references, StepKind.DERIVED);
	}

	public ProofStep(String statement, String reason, List<Integer> references,
			StepKind kind) {
		this.statement = Objects.requireNonNull(statement, "statement is required");
		this.reason = Objects.requireNonNull(reason, "reason is required");
		this.kind = Objects.requireNonNull(kind, "kind is required");
		if (references == null) {
			this.references = Collections.emptyList();
		}
		else {
			for (Integer ref : references) {
				Objects.requireNonNull(ref, "references must not contain null");
			}
			this.references = Collections.unmodifiableList(new ArrayList<>(references));
		}
	}

	public String getStatement() {
		return statement;
	}

	public String getReason() {
		return reason;
	}

	/**
	 * Returns the zero-based ledger indices this step derives from.
	 * @return unmodifiable list of references, empty if none
	 */
	public List<Integer> getReferences() {
		return references;
	}

	public StepKind getKind() {
		return kind;
	}

	public boolean hasReferences() {
		return !references.isEmpty();
	}

	/**
	 * Renders the step as {@code statement [reason]}, followed by the one-based numbers
	 * of the steps it derives from when it has references.
	 */
	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append(statement).append(" [").append(reason).append(']');
		if (hasReferences()) {
			sb.append(" (from steps ");
			sb.append(references.stream()
				.map(ref -> String.valueOf((long) ref + 1))
				.collect(Collectors.joining(", ")));
			sb.append(')');
		}
		return sb.toString();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof ProofStep)) {
			return false;
		}
		ProofStep other = (ProofStep) obj;
		return statement.equals(other.statement) &&
			reason.equals(other.reason) &&
			references.equals(other.references) &&
			kind == other.kind;
	}

	@Override
	public int hashCode() {
		return Objects.hash(statement, reason, references, kind);
	}
}
