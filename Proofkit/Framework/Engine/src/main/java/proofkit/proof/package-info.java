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
/**
 * Proofs as structured, checkable objects.
 *
 * <p>A {@link proofkit.proof.Proof} is built from ordered construction calls that append
 * to an append-only ledger, then checked with {@link proofkit.proof.Proof#verify()}.
 * Verification is structural only: it confirms the proof is well-formed for its declared
 * {@link proofkit.proof.ProofStrategy}, never that the mathematics is true.
 *
 * <p>{@link proofkit.proof.InductionProof} and {@link proofkit.proof.ContradictionProof}
 * add strategy-specific builders. The induction builders evaluate caller-supplied
 * predicates at a handful of sample values; that is evidence, not proof.
 */
package proofkit.proof;
