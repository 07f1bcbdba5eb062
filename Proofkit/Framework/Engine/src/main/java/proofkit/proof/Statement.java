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

import java.util.Objects;

/**
 * An atomic textual proposition, optionally tagged as a premise or as the conclusion
 * of a proof. Statements are compared by value and need not be unique.
 */
public final class Statement {

	private final String content;
	private final boolean premise;
	private final boolean conclusion;
	private final String justification;

	public Statement(String content) {
		this(content, false, false, null);
	}

	public Statement(String content, boolean premise, boolean conclusion,
			String justification) {
		this.content = Objects.requireNonNull(content, "content is required");
		this.premise = premise;
		this.conclusion = conclusion;
		this.justification = justification;
	}

	public String getContent() {
		return content;
	}

	public boolean isPremise() {
		return premise;
	}

	public boolean isConclusion() {
		return conclusion;
	}

	public String getJustification() {
		return justification;
	}

	@Override
	public String toString() {
		return content;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Statement)) {
			return false;
		}
		Statement other = (Statement) obj;
		return premise == other.premise &&
			conclusion == other.conclusion &&
			content.equals(other.content) &&
			Objects.equals(justification, other.justification);
	}

	@Override
	public int hashCode() {
		return Objects.hash(content, premise, conclusion, justification);
	}
}
