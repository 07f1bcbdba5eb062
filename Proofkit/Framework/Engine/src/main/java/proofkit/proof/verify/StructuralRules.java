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

import proofkit.proof.*;

/**
 * The closed set of structural rules, one per {@link ProofStrategy}.
 *
 * <p>Text matching is case-insensitive:
 * <ul>
 *   <li>contradiction: at least one assumption, and a step whose statement contains
 *   "contradiction"</li>
 *   <li>induction: a step whose reason contains "base case", and a step whose reason
 *   contains "inductive step"</li>
 *   <li>direct, contrapositive: nothing beyond the shared pre-checks</li>
 * </ul>
 */
public final class StructuralRules {

	static final String CONTRADICTION_MARKER = "contradiction";
	static final String BASE_CASE_MARKER = "base case";
	static final String INDUCTIVE_STEP_MARKER = "inductive step";

	private static final StructuralRule NO_ADDITIONAL_RULES = proof -> Collections.emptyList();

	private static final Map<ProofStrategy, StructuralRule> RULES = createRules();

	private StructuralRules() {
	}

	private static Map<ProofStrategy, StructuralRule> createRules() {
		Map<ProofStrategy, StructuralRule> rules = new EnumMap<>(ProofStrategy.class);
		rules.put(ProofStrategy.DIRECT, NO_ADDITIONAL_RULES);
		rules.put(ProofStrategy.CONTRAPOSITIVE, NO_ADDITIONAL_RULES);
		rules.put(ProofStrategy.CONTRADICTION, StructuralRules::checkContradiction);
		rules.put(ProofStrategy.INDUCTION, StructuralRules::checkInduction);
		return Collections.unmodifiableMap(rules);
	}

	/**
	 * Returns the rule for a strategy.
	 * @param strategy the strategy
	 * @return the rule, never null
	 */
	public static StructuralRule forStrategy(ProofStrategy strategy) {
		return RULES.get(Objects.requireNonNull(strategy, "strategy must not be null"));
	}

	private static List<VerificationIssue> checkContradiction(Proof proof) {
		List<VerificationIssue> issues = new ArrayList<>();
		if (proof.getAssumptions().isEmpty()) {
			issues.add(VerificationIssue.of(VerificationIssue.Type.MISSING_ASSUMPTION));
		}
		boolean contradictionStated = proof.getSteps()
			.stream()
			.anyMatch(s -> containsIgnoreCase(s.getStatement(), CONTRADICTION_MARKER));
		if (!contradictionStated) {
			issues.add(VerificationIssue.of(VerificationIssue.Type.MISSING_CONTRADICTION));
		}
		return issues;
	}

	private static List<VerificationIssue> checkInduction(Proof proof) {
		List<VerificationIssue> issues = new ArrayList<>();
		List<ProofStep> steps = proof.getSteps();
		if (steps.stream().noneMatch(s -> containsIgnoreCase(s.getReason(), BASE_CASE_MARKER))) {
			issues.add(VerificationIssue.of(VerificationIssue.Type.MISSING_BASE_CASE));
		}
		if (steps.stream()
				.noneMatch(s -> containsIgnoreCase(s.getReason(), INDUCTIVE_STEP_MARKER))) {
			issues.add(VerificationIssue.of(VerificationIssue.Type.MISSING_INDUCTIVE_STEP));
		}
		return issues;
	}

	static boolean containsIgnoreCase(String text, String marker) {
		return text.toLowerCase(Locale.ROOT).contains(marker);
	}
}
