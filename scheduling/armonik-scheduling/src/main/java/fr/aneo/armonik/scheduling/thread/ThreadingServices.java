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

import fr.aneo.armonik.scheduling.SchedulingConfig;
import fr.aneo.armonik.scheduling.domain.ErrorReporter;
import fr.aneo.armonik.scheduling.domain.EventBus;

import static java.util.Objects.requireNonNull;

/**
 * Collaborators shared by every long-running thread of the subsystem.
 *
 * @param registry      thread registry used for cooperative shutdown
 * @param eventBus      bus delivering the wake and shutdown broadcasts
 * @param errorReporter sink for unexpected failures of caller-supplied work
 * @param config        tunables
 */
public record ThreadingServices(
  ThreadRegistry registry,
  EventBus eventBus,
  ErrorReporter errorReporter,
  SchedulingConfig config
) {

  public ThreadingServices {
    requireNonNull(registry, "registry must not be null");
    requireNonNull(eventBus, "eventBus must not be null");
    requireNonNull(errorReporter, "errorReporter must not be null");
    requireNonNull(config, "config must not be null");
  }
}
