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

import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import fr.aneo.armonik.scheduling.domain.ArmoniKException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Strings.isNullOrEmpty;

/**
 * Typed readers for {@code Scheduling__*} environment variables.
 * <p>
 * Each reader returns {@link Optional#empty()} when the variable is absent or blank, so callers can fall
 * back to a default. Malformed values are rejected with an {@link ArmoniKException} naming the variable.
 * </p>
 */
public final class EnvironmentValues {
  private static final Logger logger = LoggerFactory.getLogger(EnvironmentValues.class);

  private EnvironmentValues() {
  }

  /**
   * Reads a duration expressed in milliseconds.
   *
   * @param environment the variables to read from
   * @param name        the variable name
   * @return the duration, or empty if the variable is unset
   * @throws ArmoniKException if the value is not a non-negative integer
   */
  public static Optional<Duration> millis(Map<String, String> environment, String name) {
    var raw = environment.get(name);
    if (isNullOrEmpty(raw) || raw.isBlank()) return Optional.empty();

    var value = Longs.tryParse(raw.trim());
    if (value == null || value < 0) {
      logger.error("Invalid duration in {}: '{}'", name, raw);
      throw new ArmoniKException("Environment variable " + name + " must be a non-negative number of milliseconds, got: " + raw);
    }
    return Optional.of(Duration.ofMillis(value));
  }

  /**
   * Reads a strictly positive integer.
   *
   * @param environment the variables to read from
   * @param name        the variable name
   * @return the integer, or empty if the variable is unset
   * @throws ArmoniKException if the value is not a positive integer
   */
  public static Optional<Integer> positiveInt(Map<String, String> environment, String name) {
    var raw = environment.get(name);
    if (isNullOrEmpty(raw) || raw.isBlank()) return Optional.empty();

    var value = Ints.tryParse(raw.trim());
    if (value == null || value <= 0) {
      logger.error("Invalid integer in {}: '{}'", name, raw);
      throw new ArmoniKException("Environment variable " + name + " must be a positive integer, got: " + raw);
    }
    return Optional.of(value);
  }

  /**
   * Reads a boolean; accepts {@code true/false}, {@code yes/no} and {@code 1/0}, case-insensitively.
   *
   * @param environment the variables to read from
   * @param name        the variable name
   * @return the boolean, or empty if the variable is unset
   * @throws ArmoniKException if the value is not recognised
   */
  public static Optional<Boolean> flag(Map<String, String> environment, String name) {
    var raw = environment.get(name);
    if (isNullOrEmpty(raw) || raw.isBlank()) return Optional.empty();

    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "1" -> Optional.of(true);
      case "false", "no", "0" -> Optional.of(false);
      default -> {
        logger.error("Invalid boolean in {}: '{}'", name, raw);
        throw new ArmoniKException("Environment variable " + name + " must be a boolean, got: " + raw);
      }
    };
  }
}
