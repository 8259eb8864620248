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
package fr.aneo.armonik.scheduling.thread;

import java.time.Duration;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Immutable settings of a {@link PeriodicWorker}.
 * <p>
 * Start from {@link #named(String)}, which applies the defaults below, and adjust with the {@code with*}
 * methods.
 * </p>
 *
 * @param name         human-readable name, also used as the thread name
 * @param period       wait between two runs, cut short by a wake (default 1 hour)
 * @param initialDelay wait before the first run, cut short by a wake (default 3 seconds)
 * @param preCallDelay wait before each run, <em>not</em> cut short by a wake (default zero)
 * @param topics       additional topics whose publication wakes the worker
 * @param admission    gate polled before each run
 */
public record PeriodicWorkerConfig(
  String name,
  Duration period,
  Duration initialDelay,
  Duration preCallDelay,
  List<String> topics,
  AdmissionPolicy admission
) {

  public PeriodicWorkerConfig {
    requireNonNull(name, "name must not be null");
    requireNotNegative(period, "period");
    requireNotNegative(initialDelay, "initialDelay");
    requireNotNegative(preCallDelay, "preCallDelay");
    topics = List.copyOf(requireNonNull(topics, "topics must not be null"));
    requireNonNull(admission, "admission must not be null");
  }

  public static PeriodicWorkerConfig named(String name) {
    return new PeriodicWorkerConfig(name, Duration.ofHours(1), Duration.ofSeconds(3), Duration.ZERO, List.of(), AdmissionPolicy.always());
  }

  public PeriodicWorkerConfig withPeriod(Duration period) {
    return new PeriodicWorkerConfig(name, period, initialDelay, preCallDelay, topics, admission);
  }

  public PeriodicWorkerConfig withInitialDelay(Duration initialDelay) {
    return new PeriodicWorkerConfig(name, period, initialDelay, preCallDelay, topics, admission);
  }

  public PeriodicWorkerConfig withPreCallDelay(Duration preCallDelay) {
    return new PeriodicWorkerConfig(name, period, initialDelay, preCallDelay, topics, admission);
  }

  public PeriodicWorkerConfig withTopics(String... topics) {
    return new PeriodicWorkerConfig(name, period, initialDelay, preCallDelay, List.of(topics), admission);
  }

  public PeriodicWorkerConfig withAdmission(AdmissionPolicy admission) {
    return new PeriodicWorkerConfig(name, period, initialDelay, preCallDelay, topics, admission);
  }

  private static void requireNotNegative(Duration duration, String name) {
    requireNonNull(duration, name + " must not be null");
    if (duration.isNegative()) {
      throw new IllegalArgumentException(name + " must not be negative, got: " + duration);
    }
  }
}
