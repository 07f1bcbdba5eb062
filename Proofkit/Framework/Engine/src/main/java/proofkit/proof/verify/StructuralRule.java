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

import java.util.List;

import proofkit.proof.Proof;

/**
 * A strategy-specific structural check. Rules only read the proof.
 */
@FunctionalInterface
public interface StructuralRule {

	/**
	 * Evaluates this rule against a proof.
	 * @param proof the proof to inspect
	 * @return the issues found, empty if the rule is satisfied
	 */
	List<VerificationIssue> evaluate(Proof proof);
}
