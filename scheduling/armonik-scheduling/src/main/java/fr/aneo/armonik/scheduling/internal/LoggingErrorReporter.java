/*
 * Copyright © 2025 ANEO (armonik@aneo.fr)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package fr.aneo.armonik.scheduling.internal;

import fr.aneo.armonik.scheduling.domain.ErrorReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ErrorReporter} writing reports to the log. Used when the application supplies no reporter.
 */
public final class LoggingErrorReporter implements ErrorReporter {
  private static final Logger logger = LoggerFactory.getLogger(LoggingErrorReporter.class);

  @Override
  public void report(String source, Throwable throwable) {
    logger.warn("Error reported by {}: {}", source, String.valueOf(throwable));
  }
}
