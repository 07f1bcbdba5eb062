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
package proofkit.proof.render;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

import proofkit.proof.*;

/**
 * Tests for {@link ProofRenderer}.
 */
public class ProofRendererTest {

	@Test
	public void testRenderEmptyProof() {
		List<String> lines = ProofRenderer.render(new Proof(ProofStrategy.DIRECT));

		assertEquals(List.of(
			"Proof (direct)",
			"Premises: (none)",
			"Assumptions: (none)",
			"Steps:",
			"Conclusion: (not set)"), lines);
	}

	@Test
	public void testRenderContradictionProof() {
		ContradictionProof proof = new ContradictionProof();
		proof.addPremise("n is even");
		proof.addAssumption("n is odd");
		proof.addContradiction("n is even", "n is odd", 0, 1);
		proof.setConclusion("n is not odd");

		List<String> lines = ProofRenderer.render(proof);

		assertEquals(List.of(
			"Proof (contradiction)",
			"Premises: n is even",
			"Assumptions: n is odd",
			"Steps:",
			"  1. n is even [Given premise]",
			"  2. n is odd [Assumption]",
			"  3. Contradiction: n is even contradicts n is odd [Logical contradiction] " +
				"(from steps 1, 2)",
			"Conclusion: n is not odd"), lines);
	}

	@Test
	public void testStepNumberIsLedgerIndexPlusOne() {
		Proof proof = new Proof(ProofStrategy.DIRECT);
		for (int i = 0; i < 12; i++) {
			proof.addStep("s" + i, "r");
		}

		List<String> lines = ProofRenderer.render(proof);
		List<ProofStep> steps = proof.getSteps();
		for (int i = 0; i < steps.size(); i++) {
			assertEquals(ProofRenderer.formatStep(i, steps.get(i)), lines.get(4 + i));
			assertTrue(lines.get(4 + i).startsWith("  " + (i + 1) + ". s" + i));
		}
	}

	@Test
	public void testDuplicatePremisesRenderOnceInHeader() {
		Proof proof = new Proof(ProofStrategy.DIRECT);
		proof.addPremise("a");
		proof.addPremise("b");
		proof.addPremise("a");

		List<String> lines = ProofRenderer.render(proof);
		assertEquals("Premises: a, b", lines.get(1));
		assertEquals(8, lines.size());
	}
}
