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
import java.util.function.Consumer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import proofkit.proof.render.LoggingLineSink;
import proofkit.proof.render.ProofRenderer;
import proofkit.proof.verify.VerificationEngine;
import proofkit.proof.verify.VerificationResult;

/**
 * A proof assembled from discrete, justified steps under a declared {@link ProofStrategy}.
 *
 * <p>Every construction call appends to an append-only {@link ProofLedger}. The ledger is
 * the single source of truth: {@link #getPremises()} and {@link #getAssumptions()} are
 * projections over the steps recorded by {@link #addPremise(String)} and
 * {@link #addAssumption(String)}. Setting the conclusion does not add a step.
 *
 * <p>References are never checked when a step is added. A step may reference an index
 * that does not exist yet; {@link #verify()} reports any reference still out of range.
 *
 * <p>Instances are not thread-safe. Callers sharing a proof across threads must
 * serialize access themselves.
 */
public class Proof {

	private static final Logger log = LogManager.getLogger();

	private final String id;
	private final ProofStrategy strategy;
	private final ProofLedger ledger;
	private String conclusion;

	/**
	 * Creates an empty proof.
	 * @param strategy the reasoning strategy, fixed for the life of the proof
	 */
	public Proof(ProofStrategy strategy) {
		this.id = UUID.randomUUID().toString();
		this.strategy = Objects.requireNonNull(strategy, "strategy is required");
		this.ledger = new ProofLedger();
	}

	public String getId() {
		return id;
	}

	public ProofStrategy getStrategy() {
		return strategy;
	}

	public ProofLedger getLedger() {
		return ledger;
	}

	/**
	 * Returns a snapshot of the ledger steps in append order.
	 * @return unmodifiable list of steps
	 */
	public List<ProofStep> getSteps() {
		return ledger.getSteps();
	}

	/**
	 * Returns the distinct premise texts recorded in the ledger.
	 * @return unmodifiable set of premises
	 */
	public Set<String> getPremises() {
		return ledger.statementsOfKind(StepKind.PREMISE);
	}

	/**
	 * Returns the distinct assumption texts recorded in the ledger.
	 * @return unmodifiable set of assumptions
	 */
	public Set<String> getAssumptions() {
		return ledger.statementsOfKind(StepKind.ASSUMPTION);
	}

	/**
	 * Returns the conclusion text.
	 * @return the conclusion, or null if not set
	 */
	public String getConclusion() {
		return conclusion;
	}

	public boolean hasConclusion() {
		return conclusion != null;
	}

	/**
	 * Returns the ledger as statements, one per step, followed by the conclusion when set.
	 * @return unmodifiable list of statements
	 */
	public List<Statement> getStatements() {
		List<Statement> statements = new ArrayList<>();
		for (ProofStep step : ledger.getSteps()) {
			statements.add(new Statement(step.getStatement(),
				step.getKind() == StepKind.PREMISE, false, step.getReason()));
		}
		if (conclusion != null) {
			statements.add(new Statement(conclusion, false, true, null));
		}
		return Collections.unmodifiableList(statements);
	}

	/**
	 * Adds a premise. A ledger step is appended on every call, even when the premise
	 * text was already given.
	 * @param statement the premise text
	 * @return the ledger index of the new step
	 */
	public int addPremise(String statement) {
		return append(statement, StepKind.PREMISE, Collections.emptyList());
	}

	/**
	 * Adds an assumption. A ledger step is appended on every call.
	 * @param statement the assumption text
	 * @return the ledger index of the new step
	 */
	public int addAssumption(String statement) {
		return append(statement, StepKind.ASSUMPTION, Collections.emptyList());
	}

	/**
	 * Adds a step with no references.
	 * @param statement the step text
	 * @param reason the justification for the step
	 * @return the ledger index of the new step
	 */
	public int addStep(String statement, String reason) {
		return addStep(statement, reason, Collections.emptyList());
	}

	/**
	 * Adds a step deriving from earlier steps.
	 * @param statement the step text
	 * @param reason the justification for the step
	 * @param references zero-based ledger indices, not checked until verification
	 * @return the ledger index of the new step
	 */
	public int addStep(String statement, String reason, List<Integer> references) {
		Objects.requireNonNull(reason, "reason is required");
		return appendStep(new ProofStep(statement, reason, references, StepKind.DERIVED));
	}

	/**
	 * Adds a step deriving from earlier steps.
	 * @param statement the step text
	 * @param reason the justification for the step
	 * @param references zero-based ledger indices, not checked until verification
	 * @return the ledger index of the new step
	 */
	public int addStep(String statement, String reason, int... references) {
		List<Integer> refs = new ArrayList<>(references.length);
		for (int ref : references) {
			refs.add(ref);
		}
		return addStep(statement, reason, refs);
	}

	/**
	 * Sets the conclusion, replacing any earlier one. No ledger step is added.
	 * @param statement the conclusion text
	 */
	public void setConclusion(String statement) {
		this.conclusion = Objects.requireNonNull(statement, "conclusion is required");
		log.debug("Proof {} conclusion: {}", id, statement);
	}

	/**
	 * Returns whether this proof is structurally well-formed for its strategy.
	 * This is not a check of mathematical truth. Never throws for an ill-formed proof
	 * and never modifies it.
	 * @return true if no structural issue was found
	 */
	public boolean verify() {
		return verifyDetailed().isValid();
	}

	/**
	 * Verifies this proof and reports every unmet structural condition.
	 * @return the verification result
	 */
	public VerificationResult verifyDetailed() {
		return VerificationEngine.getInstance().verify(this);
	}

	/**
	 * Renders this proof to the log.
	 */
	public void display() {
		display(new LoggingLineSink());
	}

	/**
	 * Renders this proof line by line to a sink.
	 * @param sink receives each rendered line
	 */
	public void display(Consumer<String> sink) {
		Objects.requireNonNull(sink, "sink must not be null");
		ProofRenderer.render(this).forEach(sink);
	}

	/**
	 * Appends a step with the fixed reason of its kind.
	 */
	int append(String statement, StepKind kind, List<Integer> references) {
		return appendStep(new ProofStep(statement, kind.getDefaultReason(), references, kind));
	}

	/**
	 * Appends a step to the ledger.
	 * @param step the step
	 * @return the ledger index of the step
	 */
	protected int appendStep(ProofStep step) {
		int index = ledger.append(step);
		log.debug("Proof {} step {}: {}", id, index + 1, step);
		return index;
	}

	@Override
	public String toString() {
		return String.format("Proof[%s strategy=%s steps=%d conclusion=%s]",
			id.substring(0, 8), strategy, ledger.size(), conclusion);
	}
}
