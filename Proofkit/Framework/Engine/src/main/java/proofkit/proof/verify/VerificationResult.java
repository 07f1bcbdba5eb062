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

import java.util.*;

import proofkit.proof.ProofStrategy;

/**
 * The outcome of structurally verifying a proof. A proof is well-formed when the
 * result holds no issues. Well-formed says nothing about mathematical truth.
 */
public final class VerificationResult {

	private final ProofStrategy strategy;
	private final List<VerificationIssue> issues;

	public VerificationResult(ProofStrategy strategy, List<VerificationIssue> issues) {
		this.strategy = Objects.requireNonNull(strategy, "strategy is required");
		this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
	}

	public ProofStrategy getStrategy() {
		return strategy;
	}

	public List<VerificationIssue> getIssues() {
		return issues;
	}

	public boolean isValid() {
		return issues.isEmpty();
	}

	/**
	 * Returns whether an issue of the given type was found.
	 * @param type the issue type
	 * @return true if at least one issue has this type
	 */
	public boolean hasIssue(VerificationIssue.Type type) {
		for (VerificationIssue issue : issues) {
			if (issue.getType() == type) {
				return true;
			}
		}
		return false;
	}

	@Override
	public String toString() {
		if (isValid()) {
			return String.format("VerificationResult[%s valid]", strategy);
		}
		return String.format("VerificationResult[%s issues=%s]", strategy, issues);
	}
}
