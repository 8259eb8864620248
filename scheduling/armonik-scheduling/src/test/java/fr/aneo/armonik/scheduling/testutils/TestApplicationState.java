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
package fr.aneo.armonik.scheduling.testutils;

import fr.aneo.armonik.scheduling.domain.ApplicationState;

/**
 * Application state whose flags are set directly by tests. Everything is off, and work always admitted, by
 * default.
 */
public final class TestApplicationState implements ApplicationState {
  public volatile boolean fastExiting;
  public volatile boolean viewShuttingDown;
  public volatile boolean modelShuttingDown;
  public volatile boolean justWokeFromSleep;
  public volatile boolean goodTimeForBackgroundWork = true;
  public volatile boolean goodTimeForForegroundWork = true;

  @Override
  public boolean isFastExiting() {
    return fastExiting;
  }

  @Override
  public boolean isViewShuttingDown() {
    return viewShuttingDown;
  }

  @Override
  public boolean isModelShuttingDown() {
    return modelShuttingDown;
  }

  @Override
  public boolean justWokeFromSleep() {
    return justWokeFromSleep;
  }

  @Override
  public boolean isGoodTimeForBackgroundWork() {
    return goodTimeForBackgroundWork;
  }

  @Override
  public boolean isGoodTimeForForegroundWork() {
    return goodTimeForForegroundWork;
  }
}
