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

import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Manually reset wake flag that a thread can wait on with a timeout.
 * <p>
 * {@link #set()} releases every waiter and keeps the flag raised until {@link #clear()} is called, so a
 * signal sent while nobody waits is not lost.
 * </p>
 */
public final class WakeEvent {
  private final Object monitor = new Object();
  private boolean flag;

  public void set() {
    synchronized (monitor) {
      flag = true;
      monitor.notifyAll();
    }
  }

  public void clear() {
    synchronized (monitor) {
      flag = false;
    }
  }

  /**
   * Waits until the flag is raised or the timeout elapses.
   *
   * @param timeout maximum time to wait; zero or negative returns immediately
   * @return the state of the flag when the wait ended
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public boolean await(Duration timeout) throws InterruptedException {
    var remaining = timeout.toNanos();
    var deadline = System.nanoTime() + remaining;

    synchronized (monitor) {
      while (!flag && remaining > 0) {
        NANOSECONDS.timedWait(monitor, remaining);
        remaining = deadline - System.nanoTime();
      }
      return flag;
    }
  }
}
