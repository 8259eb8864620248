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
package fr.aneo.armonik.scheduling.job;

import com.google.common.util.concurrent.Uninterruptibles;
import fr.aneo.armonik.scheduling.domain.Subscription;
import fr.aneo.armonik.scheduling.internal.Durations;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

import static java.util.Objects.requireNonNull;

/**
 * A unit of deferred work owned by a {@link JobScheduler}.
 * <p>
 * A job has a due time on the scheduler's monotonic clock, a one-way cancellation flag, an optional named
 * admission slot and a private run lock. The scheduler holds the only reference to the pending job; the
 * creator keeps its own reference to {@link #wake() wake} or {@link #cancel() cancel} it.
 * </p>
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>Created with an initial delay and handed to {@link JobScheduler#addJob(SchedulableJob)}.</li>
 *   <li>Once due, the scheduler pops it and calls {@link #checkAdmission()}. A refused job has already
 *       been pushed back by the slot retry delay and is reinserted.</li>
 *   <li>An admitted job is started with {@link #startWork()}, which hands {@link #work()} to the worker
 *       pool. The job body never runs on the scheduler thread.</li>
 * </ol>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * All flags are safe to read and write from any thread. Changing the due time does not re-sort the
 * scheduler synchronously; it only tells the scheduler that a re-sort is needed before the next dispatch.
 * The run lock guarantees at most one concurrent execution of a given instance.
 * </p>
 */
public class SchedulableJob {

  /**
   * Orders jobs by ascending due time. Ties are unordered.
   */
  public static final Comparator<SchedulableJob> BY_DUE_TIME = (a, b) -> Long.signum(a.nextWorkTime - b.nextWorkTime);

  protected final JobScheduler scheduler;
  private final Runnable action;
  private final ReentrantLock runLock = new ReentrantLock();
  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final AtomicBoolean currentlyWorking = new AtomicBoolean();
  // One entry per admitted dispatch not yet released. A job re-submitted while running holds two.
  private final Queue<String> heldSlots = new ConcurrentLinkedQueue<>();
  private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();

  private volatile long nextWorkTime;
  private volatile String threadSlotType;
  private volatile boolean shouldDelayOnWakeup;

  /**
   * @param scheduler    the scheduler that will own the job
   * @param initialDelay time from now until the job is first due
   * @param action       the work to run
   */
  public SchedulableJob(JobScheduler scheduler, Duration initialDelay, Runnable action) {
    this.scheduler = requireNonNull(scheduler, "scheduler must not be null");
    this.action = requireNonNull(action, "action must not be null");
    requireNonNull(initialDelay, "initialDelay must not be null");
    this.nextWorkTime = now() + initialDelay.toNanos();
  }

  /**
   * Makes the job due immediately.
   */
  public void wake() {
    wake(Duration.ZERO);
  }

  /**
   * Reschedules the job to {@code delay} from now.
   */
  public void wake(Duration delay) {
    requireNonNull(delay, "delay must not be null");
    nextWorkTime = now() + delay.toNanos();
    scheduler.workTimesHaveChanged();
  }

  /**
   * Aborts scheduled work. A run already in progress finishes. Terminal.
   */
  public void cancel() {
    cancelled.set(true);
    subscriptions.forEach(Subscription::close);
    subscriptions.clear();
    scheduler.jobCancelled();
  }

  /**
   * Associates the job with a named admission slot, so that no one class of job monopolizes compute.
   *
   * @param threadSlotType the slot name, or {@code null} for no admission control
   */
  public void setThreadSlotType(String threadSlotType) {
    this.threadSlotType = threadSlotType;
  }

  /**
   * When set, a run started while the host has just woken from sleep waits for that state to clear.
   */
  public void setShouldDelayOnWakeup(boolean shouldDelayOnWakeup) {
    this.shouldDelayOnWakeup = shouldDelayOnWakeup;
  }

  /**
   * Wakes the job whenever {@code topic} is published, until the job is cancelled.
   *
   * @param topic the topic to listen to
   */
  public void wakeOnTopic(String topic) {
    subscriptions.add(scheduler.eventBus().subscribe(topic, payload -> wake()));
  }

  /**
   * Tries to take the job's admission slot.
   * <p>
   * A job without slot type is always admitted. A refused job is pushed back to now plus the slot retry
   * delay and a random jitter, so it is reconsidered later without spinning.
   * </p>
   *
   * @return whether the job may start now
   */
  public boolean checkAdmission() {
    var slotType = threadSlotType;
    if (slotType == null) return true;

    if (scheduler.threadSlots().acquire(slotType)) {
      heldSlots.add(slotType);
      return true;
    }

    var config = scheduler.config();
    var jitterBound = config.slotRetryJitter().toNanos();
    var jitter = jitterBound > 0 ? ThreadLocalRandom.current().nextLong(jitterBound) : 0L;
    nextWorkTime = now() + config.slotRetryDelay().toNanos() + jitter;
    return false;
  }

  /**
   * Hands {@link #work()} to the worker pool, unless the job was cancelled in the meantime.
   */
  public void startWork() {
    if (isCancelled()) {
      releaseSlot();
      return;
    }

    currentlyWorking.set(true);
    try {
      scheduler.workerPool().submit(this::work);
    } catch (RuntimeException e) {
      currentlyWorking.set(false);
      releaseSlot();
      throw e;
    }
  }

  /**
   * Runs the job body under the run lock. The admission slot is released and the working flag cleared
   * whatever the outcome.
   */
  public void work() {
    try {
      if (shouldDelayOnWakeup) {
        while (scheduler.applicationState().justWokeFromSleep()) {
          if (scheduler.registry().isShuttingDown()) return;

          Uninterruptibles.sleepUninterruptibly(scheduler.config().pollInterval());
        }
      }

      runLock.lock();
      try {
        action.run();
      } finally {
        runLock.unlock();
      }
    } finally {
      releaseSlot();
      currentlyWorking.set(false);
    }
  }

  public boolean currentlyWorking() {
    return currentlyWorking.get();
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  public boolean isDue() {
    return now() - nextWorkTime >= 0;
  }

  /**
   * Jobs reporting {@code true} are dropped by {@link JobScheduler#clearOutDead()}. Subclasses whose
   * owner can disappear override this.
   */
  public boolean isDead() {
    return false;
  }

  /**
   * @return the time left until the job is due, never negative
   */
  public Duration timeUntilDue() {
    return Duration.ofNanos(Math.max(0L, nextWorkTime - now()));
  }

  public String threadSlotType() {
    return threadSlotType;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + ": " + action + " next in " + Durations.pretty(Duration.ofNanos(nextWorkTime - now()));
  }

  long nextWorkTime() {
    return nextWorkTime;
  }

  /**
   * Moves the due time without notifying the scheduler. Only for a job that is not in the pending heap.
   */
  void reschedule(Duration fromNow) {
    nextWorkTime = now() + fromNow.toNanos();
  }

  /**
   * Releases the slot taken by one admitted dispatch, if any.
   */
  void releaseSlot() {
    var slotType = heldSlots.poll();
    if (slotType != null) {
      scheduler.threadSlots().release(slotType);
    }
  }

  private long now() {
    return scheduler.ticker().read();
  }
}
