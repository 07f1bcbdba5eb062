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

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

import proofkit.proof.*;

/**
 * Tests for {@link VerificationEngine}, {@link StructuralRules} and {@link VerificationResult}.
 */
public class VerificationEngineTest {

	private final VerificationEngine engine = VerificationEngine.getInstance();

	@Test
	public void testEmptyProofReportsSharedIssues() {
		VerificationResult result = engine.verify(new Proof(ProofStrategy.DIRECT));

		assertFalse(result.isValid());
		assertTrue(result.hasIssue(VerificationIssue.Type.EMPTY_LEDGER));
		assertTrue(result.hasIssue(VerificationIssue.Type.MISSING_CONCLUSION));
		assertEquals(2, result.getIssues().size());
	}

	@Test
	public void testEachOutOfRangeReferenceIsReported() {
		Proof proof = new Proof(ProofStrategy.DIRECT);
		proof.addPremise("p");
		proof.addStep("q", "Derived", 0, 4, -2);
		proof.setConclusion("q");

		List<VerificationIssue> issues = engine.verify(proof).getIssues();

		assertEquals(2, issues.size());
		for (VerificationIssue issue : issues) {
			assertEquals(VerificationIssue.Type.REFERENCE_OUT_OF_RANGE, issue.getType());
			assertEquals(1, issue.getStepIndex());
		}
		assertEquals("Step 2 references index 4, ledger has 2 steps",
			issues.get(0).getMessage());
	}

	@Test
	public void testReferenceToOwnIndexIsInRange() {
		Proof proof = new Proof(ProofStrategy.DIRECT);
		proof.addStep("p", "Self evident", 0);
		proof.setConclusion("p");
		assertTrue(engine.verify(proof).isValid());
	}

	@Test
	public void testContradictionIssues() {
		Proof proof = new Proof(ProofStrategy.CONTRADICTION);
		proof.addPremise("p");
		proof.setConclusion("q");

		VerificationResult result = engine.verify(proof);

		assertTrue(result.hasIssue(VerificationIssue.Type.MISSING_ASSUMPTION));
		assertTrue(result.hasIssue(VerificationIssue.Type.MISSING_CONTRADICTION));
		assertEquals(ProofStrategy.CONTRADICTION, result.getStrategy());
	}

	@Test
	public void testContradictionMarkerMatchesStatementNotReason() {
		Proof proof = new Proof(ProofStrategy.CONTRADICTION);
		proof.addAssumption("p");
		proof.addStep("q", "contradiction");
		proof.setConclusion("not p");

		assertTrue(engine.verify(proof).hasIssue(VerificationIssue.Type.MISSING_CONTRADICTION));
	}

	@Test
	public void testInductionMarkerMatchesReasonNotStatement() {
		Proof proof = new Proof(ProofStrategy.INDUCTION);
		proof.addStep("base case holds", "Checked");
		proof.addStep("inductive step holds", "Checked");
		proof.setConclusion("P(n)");

		VerificationResult result = engine.verify(proof);
		assertTrue(result.hasIssue(VerificationIssue.Type.MISSING_BASE_CASE));
		assertTrue(result.hasIssue(VerificationIssue.Type.MISSING_INDUCTIVE_STEP));
	}

	@Test
	public void testDirectAndContrapositiveHaveNoStrategyRule() {
		Proof proof = new Proof(ProofStrategy.INDUCTION);
		proof.addPremise("p");
		proof.setConclusion("p");

		assertTrue(StructuralRules.forStrategy(ProofStrategy.DIRECT).evaluate(proof).isEmpty());
		assertTrue(
			StructuralRules.forStrategy(ProofStrategy.CONTRAPOSITIVE).evaluate(proof).isEmpty());
		assertEquals(2, StructuralRules.forStrategy(ProofStrategy.INDUCTION)
			.evaluate(proof)
			.size());
	}

	@Test
	public void testEveryStrategyHasARule() {
		for (ProofStrategy strategy : ProofStrategy.values()) {
			assertNotNull(StructuralRules.forStrategy(strategy));
		}
	}

	@Test
	public void testResultToString() {
		Proof proof = new Proof(ProofStrategy.DIRECT);
		proof.addPremise("p");
		proof.setConclusion("p");

		assertEquals("VerificationResult[direct valid]", engine.verify(proof).toString());
	}

	@Test
	public void testVerifyAgreesWithDetailedResult() {
		Proof proof = new Proof(ProofStrategy.CONTRADICTION);
		proof.addAssumption("p");
		proof.setConclusion("not p");

		assertFalse(proof.verify());
		assertFalse(proof.verifyDetailed().isValid());
		assertEquals(1, proof.verifyDetailed().getIssues().size());
	}
}
