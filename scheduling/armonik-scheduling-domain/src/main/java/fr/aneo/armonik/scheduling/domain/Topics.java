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
 * Well-known {@link EventBus} topics.
 */
public final class Topics {

  /** Wakes every daemon from its interruptible wait so it re-checks for work immediately. */
  public static final String WAKE_DAEMONS = "wake_daemons";

  /** Asks every daemon and the job scheduler to stop. */
  public static final String SHUTDOWN = "shutdown";

  private Topics() {
  }
}
