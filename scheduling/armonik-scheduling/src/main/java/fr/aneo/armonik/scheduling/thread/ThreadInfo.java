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

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-thread shutdown state held by a {@link ThreadRegistry}.
 * <p>
 * The shutdown flag is one-way: once set it is never cleared.
 * </p>
 */
public final class ThreadInfo {
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private volatile ThreadKind kind = ThreadKind.REGULAR;

  ThreadInfo() {
  }

  public boolean isShuttingDown() {
    return shuttingDown.get();
  }

  /**
   * Sets the shutdown flag.
   *
   * @return {@code true} if this call set it, {@code false} if it was already set
   */
  public boolean markShuttingDown() {
    return shuttingDown.compareAndSet(false, true);
  }

  public ThreadKind kind() {
    return kind;
  }

  void kind(ThreadKind kind) {
    this.kind = kind;
  }

  @Override
  public String toString() {
    return "ThreadInfo{kind=" + kind + ", shuttingDown=" + shuttingDown.get() + '}';
  }
}
