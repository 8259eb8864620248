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
 * Named counting resource used for admission control.
 * <p>
 * Each slot type bounds how many jobs of one category may run at the same time. A job that fails to
 * acquire a slot is never blocked; it is rescheduled instead. Every successful {@link #acquire(String)}
 * is paired with exactly one {@link #release(String)} once the job has finished.
 * </p>
 */
public interface ThreadSlots {

  /**
   * Tries to take one slot of the given type without blocking.
   *
   * @param slotType the slot category; never {@code null}
   * @return {@code true} if a slot was taken
   */
  boolean acquire(String slotType);

  /**
   * Gives back a slot previously obtained with {@link #acquire(String)}.
   *
   * @param slotType the slot category; never {@code null}
   */
  void release(String slotType);
}
