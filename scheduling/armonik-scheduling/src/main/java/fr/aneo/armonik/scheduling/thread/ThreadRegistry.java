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

import com.google.common.base.Ticker;
import fr.aneo.armonik.scheduling.domain.ApplicationState;
import fr.aneo.armonik.scheduling.domain.ShutdownException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Mapping from live threads to their {@link ThreadInfo}.
 * <p>
 * The registry answers one question for every cooperative checkpoint of the subsystem: <em>should this
 * thread stop now?</em> A thread stops when any of the following holds:
 * </p>
 * <ul>
 *   <li>the application is fast-exiting,</li>
 *   <li>the global shutdown flag for the thread's {@link ThreadKind} is set,</li>
 *   <li>the thread's own flag was set through {@link #markShuttingDown(Thread)},</li>
 *   <li>the registry itself has been {@linkplain #close() closed}.</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <p>
 * A registry is created with {@link #open(ApplicationState, Ticker, Duration)} and passed by reference to
 * the components that need it. Entries are created lazily on first lookup. Entries of terminated threads
 * are swept at most once per sweep interval, opportunistically, during a lookup; threads that have not
 * started yet are never swept.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Every mutation of the map happens under a single lock, and the sweep iterates over a snapshot of the keys.
 * </p>
 */
public final class ThreadRegistry implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(ThreadRegistry.class);

  private final ApplicationState applicationState;
  private final Ticker ticker;
  private final long sweepIntervalNanos;
  private final Object lock = new Object();
  private final Map<Thread, ThreadInfo> threads = new HashMap<>();
  private long nextSweepAt;
  private volatile boolean closed;

  private ThreadRegistry(ApplicationState applicationState, Ticker ticker, Duration sweepInterval) {
    this.applicationState = requireNonNull(applicationState, "applicationState must not be null");
    this.ticker = requireNonNull(ticker, "ticker must not be null");
    this.sweepIntervalNanos = requireNonNull(sweepInterval, "sweepInterval must not be null").toNanos();
    this.nextSweepAt = ticker.read() + sweepIntervalNanos;
  }

  /**
   * Opens a new, empty registry.
   *
   * @param applicationState source of the global shutdown flags
   * @param ticker           monotonic time source used for the sweep interval
   * @param sweepInterval    minimum time between two sweeps of terminated threads
   * @return an open registry
   */
  public static ThreadRegistry open(ApplicationState applicationState, Ticker ticker, Duration sweepInterval) {
    return new ThreadRegistry(applicationState, ticker, sweepInterval);
  }

  /**
   * Returns the info of {@code thread}, creating it if absent.
   *
   * @param thread the thread; never {@code null}
   * @return its info
   */
  public ThreadInfo info(Thread thread) {
    requireNonNull(thread, "thread must not be null");
    sweepIfDue();

    synchronized (lock) {
      return threads.computeIfAbsent(thread, t -> new ThreadInfo());
    }
  }

  /**
   * Records the class of {@code thread}.
   *
   * @param thread the thread; never {@code null}
   * @param kind   its class; never {@code null}
   * @return its info
   */
  public ThreadInfo register(Thread thread, ThreadKind kind) {
    requireNonNull(kind, "kind must not be null");
    var info = info(thread);
    info.kind(kind);
    return info;
  }

  /**
   * Sets the shutdown flag of {@code thread}. Idempotent.
   *
   * @param thread the thread; never {@code null}
   */
  public void markShuttingDown(Thread thread) {
    if (info(thread).markShuttingDown()) {
      logger.debug("Thread '{}' marked as shutting down", thread.getName());
    }
  }

  /**
   * @return whether the calling thread should stop
   */
  public boolean isShuttingDown() {
    return isShuttingDown(Thread.currentThread());
  }

  /**
   * @param thread the thread to check; never {@code null}
   * @return whether {@code thread} should stop
   */
  public boolean isShuttingDown(Thread thread) {
    return isShuttingDown(info(thread));
  }

  /**
   * @param info the info of the thread to check; never {@code null}
   * @return whether the thread owning {@code info} should stop
   */
  public boolean isShuttingDown(ThreadInfo info) {
    if (closed || applicationState.isFastExiting()) return true;

    var globalFlag = info.kind() == ThreadKind.DAEMON
      ? applicationState.isViewShuttingDown()
      : applicationState.isModelShuttingDown();

    return globalFlag || info.isShuttingDown();
  }

  /**
   * Throws if the calling thread should stop.
   *
   * @throws ShutdownException if {@link #isShuttingDown()} is {@code true}
   */
  public void checkShuttingDown() {
    if (isShuttingDown()) {
      throw new ShutdownException("Thread is shutting down!");
    }
  }

  /**
   * @return the number of tracked threads
   */
  public int size() {
    synchronized (lock) {
      return threads.size();
    }
  }

  public Ticker ticker() {
    return ticker;
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Closes the registry. Every thread is considered shutting down afterwards.
   */
  @Override
  public void close() {
    if (closed) return;

    closed = true;
    synchronized (lock) {
      logger.debug("Closing thread registry with {} tracked threads", threads.size());
      threads.clear();
    }
  }

  private void sweepIfDue() {
    synchronized (lock) {
      var now = ticker.read();
      if (now - nextSweepAt < 0) return;

      nextSweepAt = now + sweepIntervalNanos;
      int removed = 0;
      for (var thread : List.copyOf(threads.keySet())) {
        if (thread.getState() == Thread.State.TERMINATED) {
          threads.remove(thread);
          removed++;
        }
      }
      if (removed > 0) {
        logger.debug("Swept {} terminated threads, {} remaining", removed, threads.size());
      }
    }
  }
}
