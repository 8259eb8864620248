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

import fr.aneo.armonik.scheduling.domain.ApplicationState;

import static java.util.Objects.requireNonNull;

/**
 * Decides whether a {@link PeriodicWorker} may start its next unit of work.
 * <p>
 * The worker polls the policy once per poll interval until it passes. This is how heavy maintenance work
 * is kept from competing with interactive use or with other heavy work.
 * </p>
 */
@FunctionalInterface
public interface AdmissionPolicy {

  boolean canStart();

  /**
   * @return a policy that always admits
   */
  static AdmissionPolicy always() {
    return () -> true;
  }

  /**
   * Admits big work, such as database maintenance, only while nothing important is going on.
   */
  static AdmissionPolicy backgroundWork(ApplicationState applicationState) {
    requireNonNull(applicationState, "applicationState must not be null");
    return applicationState::isGoodTimeForBackgroundWork;
  }

  /**
   * Admits big, user-visible work only when it does not come at the expense of something else.
   */
  static AdmissionPolicy foregroundWork(ApplicationState applicationState) {
    requireNonNull(applicationState, "applicationState must not be null");
    return applicationState::isGoodTimeForForegroundWork;
  }
}
