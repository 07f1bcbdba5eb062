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

/**
 * The declared reasoning pattern of a proof. The strategy is fixed when a {@link Proof}
 * is created and selects which structural rules verification applies.
 */
public enum ProofStrategy {

	/** Premises lead to the conclusion through derived steps. */
	DIRECT("direct"),

	/** An assumption is shown to lead to a contradiction. */
	CONTRADICTION("contradiction"),

	/** A base case plus an inductive step over the natural numbers. */
	INDUCTION("induction"),

	/** The negated conclusion is shown to imply the negated premise. */
	CONTRAPOSITIVE("contrapositive");

	private final String identifier;

	ProofStrategy(String identifier) {
		this.identifier = identifier;
	}

	/**
	 * Returns the string identifier for this strategy.
	 * @return the strategy identifier
	 */
	public String getIdentifier() {
		return identifier;
	}

	/**
	 * Parses a strategy from its identifier.
	 * @param identifier the identifier to parse
	 * @return the corresponding strategy, or null if not found
	 */
	public static ProofStrategy fromIdentifier(String identifier) {
		if (identifier == null) {
			return null;
		}
		for (ProofStrategy strategy : values()) {
			if (strategy.identifier.equalsIgnoreCase(identifier)) {
				return strategy;
			}
		}
		return null;
	}

	@Override
	public String toString() {
		return identifier;
	}
}
