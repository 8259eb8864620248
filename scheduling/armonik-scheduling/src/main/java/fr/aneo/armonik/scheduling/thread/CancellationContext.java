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

import fr.aneo.armonik.scheduling.domain.ShutdownException;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Cancellation token of one long-running thread.
 * <p>
 * A context carries the thread's {@link ThreadInfo} and its {@link WakeEvent}, and is handed to the loop
 * the thread runs. The loop never blocks indefinitely: every wait offered here is bounded by the poll
 * interval, after which the caller re-checks {@link #checkShutdown()}.
 * </p>
 *
 * <h2>Interruption</h2>
 * <p>
 * Shutdown is cooperative and does not rely on {@link Thread#interrupt()}. If a waiting thread is
 * interrupted anyway, its interrupt flag is restored and the wait ends with a {@link ShutdownException}.
 * </p>
 */
public final class CancellationContext {
  private final ThreadRegistry registry;
  private final ThreadInfo info;
  private final WakeEvent wakeEvent;
  private final Duration pollInterval;

  private CancellationContext(ThreadRegistry registry, ThreadInfo info, Duration pollInterval) {
    this.registry = registry;
    this.info = info;
    this.wakeEvent = new WakeEvent();
    this.pollInterval = pollInterval;
  }

  /**
   * Registers {@code thread} in {@code registry} and returns its context.
   *
   * @param registry     the thread registry
   * @param thread       the thread that will run the loop; may not be started yet
   * @param kind         the class of the thread
   * @param pollInterval granularity of the bounded waits
   * @return a new context
   */
  public static CancellationContext forThread(ThreadRegistry registry, Thread thread, ThreadKind kind, Duration pollInterval) {
    requireNonNull(registry, "registry must not be null");
    requireNonNull(pollInterval, "pollInterval must not be null");
    return new CancellationContext(registry, registry.register(thread, kind), pollInterval);
  }

  public boolean isShuttingDown() {
    return registry.isShuttingDown(info);
  }

  /**
   * @throws ShutdownException if the owning thread should stop
   */
  public void checkShutdown() {
    if (isShuttingDown()) {
      throw new ShutdownException("Thread is shutting down!");
    }
  }

  /**
   * Marks the owning thread as shutting down and wakes it so it notices promptly.
   */
  public void requestShutdown() {
    info.markShuttingDown();
    wakeEvent.set();
  }

  public void wake() {
    wakeEvent.set();
  }

  /**
   * Waits on the wake event. When the event was raised it is cleared before returning.
   *
   * @param timeout maximum time to wait
   * @return {@code true} if the thread was woken
   * @throws ShutdownException if interrupted
   */
  public boolean awaitWake(Duration timeout) {
    try {
      if (wakeEvent.await(timeout)) {
        wakeEvent.clear();
        return true;
      }
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ShutdownException("Interrupted while waiting to be woken", e);
    }
  }

  /**
   * Suspends the owning thread for {@code duration}, one poll interval at a time, checking for shutdown
   * after every step.
   *
   * @param duration total time to wait; zero returns immediately
   * @param wakeable whether {@link #wake()} ends the wait early
   * @throws ShutdownException as soon as a shutdown is observed
   */
  public void pause(Duration duration, boolean wakeable) {
    var ticker = registry.ticker();
    var deadline = ticker.read() + duration.toNanos();

    while (ticker.read() - deadline < 0) {
      if (wakeable) {
        if (awaitWake(pollInterval)) return;
      } else {
        sleep(pollInterval);
      }
      checkShutdown();
    }
  }

  /**
   * Sleeps without observing the wake event.
   *
   * @param duration how long to sleep
   * @throws ShutdownException if interrupted
   */
  public void sleep(Duration duration) {
    try {
      NANOSECONDS.sleep(duration.toNanos());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ShutdownException("Interrupted while sleeping", e);
    }
  }

  /**
   * Takes the head of {@code queue}, waiting at most {@code timeout}.
   *
   * @return the head, or {@code null} if the queue stayed empty
   * @throws ShutdownException if interrupted
   */
  public <T> T poll(BlockingQueue<T> queue, Duration timeout) {
    try {
      return queue.poll(timeout.toNanos(), NANOSECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ShutdownException("Interrupted while polling work queue", e);
    }
  }

  public Duration pollInterval() {
    return pollInterval;
  }

  public ThreadInfo info() {
    return info;
  }
}
