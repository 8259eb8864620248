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
 * Signals that the current thread has been asked to stop.
 * <p>
 * Shutdown in the scheduling subsystem is cooperative: long-running loops poll their shutdown state at
 * well-defined checkpoints and throw this exception when it is set. It is expected control flow, not a
 * defect. Worker loops let it propagate to their outermost frame and exit quietly, without logging it as
 * an error or forwarding it to an {@link ErrorReporter}.
 * </p>
 */
public class ShutdownException extends RuntimeException {

  /**
   * Creates a new shutdown signal.
   *
   * @param message a short description of what was shutting down
   */
  public ShutdownException(String message) {
    super(message);
  }

  /**
   * Creates a new shutdown signal caused by another throwable, typically an {@link InterruptedException}.
   *
   * @param message a short description of what was shutting down
   * @param cause   the underlying cause
   */
  public ShutdownException(String message, Throwable cause) {
    super(message, cause);
  }
}
