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
package fr.aneo.armonik.scheduling.domain;

/**
 * Sink for unexpected, non-fatal exceptions raised by caller-supplied work.
 * <p>
 * Workers call this after logging the failure and then carry on; an implementation must therefore never
 * throw.
 * </p>
 */
@FunctionalInterface
public interface ErrorReporter {

  /**
   * Reports a failure.
   *
   * @param source    a human-readable name of the component that caught the failure
   * @param throwable the failure; never {@code null}
   */
  void report(String source, Throwable throwable);
}
