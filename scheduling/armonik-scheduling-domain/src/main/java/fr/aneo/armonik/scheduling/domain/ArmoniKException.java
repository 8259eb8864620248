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
 * Base runtime exception for scheduling-related failures.
 * <p>
 * {@code ArmoniKException} is thrown when an operation of the scheduling subsystem fails because of:
 * </p>
 * <ul>
 *   <li>Invalid configuration values (environment variables, tunables)</li>
 *   <li>I/O errors while talking to an external process</li>
 *   <li>Other infrastructure-level failures</li>
 * </ul>
 * <p>
 * It is deliberately unrelated to {@link ShutdownException}: catching {@code ArmoniKException} never
 * swallows a cooperative shutdown.
 * </p>
 *
 * @see ShutdownException
 */
public class ArmoniKException extends RuntimeException {

  /**
   * Creates a new ArmoniK exception with the specified error message.
   *
   * @param message the detail message explaining the error; should not be {@code null}
   */
  public ArmoniKException(String message) {
    super(message);
  }

  /**
   * Creates a new ArmoniK exception with the specified error message and cause.
   *
   * @param message the detail message explaining the error; should not be {@code null}
   * @param cause   the underlying cause of this exception; may be {@code null}
   */
  public ArmoniKException(String message, Throwable cause) {
    super(message, cause);
  }
}
