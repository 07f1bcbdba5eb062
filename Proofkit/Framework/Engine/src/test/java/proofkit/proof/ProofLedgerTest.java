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

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.junit.Before;
import org.junit.Test;

public class ProofLedgerTest {

	private ProofLedger ledger;

	@Before
	public void setUp() {
		ledger = new ProofLedger();
	}

	@Test
	public void testStatementsOfKindKeepFirstSeenOrder() {
		ledger.append(new ProofStep("c", "Given premise", null, StepKind.PREMISE));
		ledger.append(new ProofStep("a", "Given premise", null, StepKind.PREMISE));
		ledger.append(new ProofStep("x", "Assumption", null, StepKind.ASSUMPTION));
		ledger.append(new ProofStep("c", "Given premise", null, StepKind.PREMISE));
		ledger.append(new ProofStep("b", "Given premise", null, StepKind.PREMISE));

		Set<String> premises = ledger.statementsOfKind(StepKind.PREMISE);
		assertEquals(List.of("c", "a", "b"), new ArrayList<>(premises));
		assertEquals(Set.of("x"), ledger.statementsOfKind(StepKind.ASSUMPTION));
		assertTrue(ledger.statementsOfKind(StepKind.DERIVED).isEmpty());
	}

	@Test(expected = UnsupportedOperationException.class)
	public void testStatementsOfKindIsUnmodifiable() {
		ledger.append(new ProofStep("p", "Given premise", null, StepKind.PREMISE));
		ledger.statementsOfKind(StepKind.PREMISE).add("q");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testGetOutOfRange() {
		ledger.get(0);
	}
}
