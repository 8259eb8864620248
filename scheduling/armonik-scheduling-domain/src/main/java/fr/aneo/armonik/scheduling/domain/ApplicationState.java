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
 * Application-wide state consulted by the scheduling subsystem.
 * <p>
 * The hosting application owns these flags. The scheduler and its workers only read them, at every
 * cooperative checkpoint, so implementations must be cheap and thread-safe.
 * </p>
 *
 * <h2>Shutdown flags</h2>
 * <p>
 * Two global flags exist because the application stops in two phases. Daemon-class threads (periodic
 * workers and pool threads) stop when the <em>view</em> shuts down; every other thread, including the job
 * scheduler, keeps running until the <em>model</em> shuts down.
 * </p>
 */
public interface ApplicationState {

  /**
   * @return {@code true} when the application is exiting without a graceful shutdown
   */
  boolean isFastExiting();

  /**
   * @return {@code true} once the view-side shutdown has started; applies to daemon-class threads
   */
  boolean isViewShuttingDown();

  /**
   * @return {@code true} once the model-side shutdown has started; applies to all other threads
   */
  boolean isModelShuttingDown();

  /**
   * @return {@code true} while the host has recently resumed from a sleep or suspend state
   */
  boolean justWokeFromSleep();

  /**
   * Asks whether heavy maintenance work may start now without competing with interactive use.
   *
   * @return {@code true} if background work may start
   */
  boolean isGoodTimeForBackgroundWork();

  /**
   * Asks whether user-visible heavy work may start now without starving other heavy work.
   *
   * @return {@code true} if foreground work may start
   */
  boolean isGoodTimeForForegroundWork();
}
