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

import java.util.Objects;
import java.util.function.Consumer;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A display sink that writes each rendered line to a Log4j logger.
 */
public class LoggingLineSink implements Consumer<String> {

	private final Logger logger;
	private final Level level;

	/**
	 * Creates a sink writing at INFO to this class's logger.
	 */
	public LoggingLineSink() {
		this(LogManager.getLogger(LoggingLineSink.class), Level.INFO);
	}

	public LoggingLineSink(Logger logger, Level level) {
		this.logger = Objects.requireNonNull(logger, "logger must not be null");
		this.level = Objects.requireNonNull(level, "level must not be null");
	}

	@Override
	public void accept(String line) {
		logger.log(level, line);
	}
}
