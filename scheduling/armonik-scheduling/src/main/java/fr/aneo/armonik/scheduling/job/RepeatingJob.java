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

import fr.aneo.armonik.scheduling.domain.ShutdownException;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * A job that re-adds itself to its scheduler after every run, one period later, until cancelled.
 * <p>
 * Cancellation raises a terminal "stop repeating" flag on top of the base cancellation flag. A run already
 * popped for dispatch when the job is cancelled does not start, and a run in progress does not reschedule.
 * </p>
 * <p>
 * A run that fails with an ordinary exception still reschedules: the failure is reported by the pool and
 * the job tries again one period later. A run ended by a {@link ShutdownException} does not.
 * </p>
 */
public class RepeatingJob extends SchedulableJob {
  private final AtomicBoolean stopRepeating = new AtomicBoolean();
  private volatile Duration period;

  public RepeatingJob(JobScheduler scheduler, Duration initialDelay, Duration period, Runnable action) {
    super(scheduler, initialDelay, action);
    this.period = requireNotNegative(period);
  }

  @Override
  public void cancel() {
    stopRepeating.set(true);
    super.cancel();
  }

  /**
   * Reschedules the next run to {@code delay} from now.
   */
  public void delay(Duration delay) {
    wake(delay);
  }

  public boolean isRepeatingWorkFinished() {
    return stopRepeating.get();
  }

  public Duration period() {
    return period;
  }

  /**
   * Changes the period. Periods above {@link fr.aneo.armonik.scheduling.SchedulingConfig#periodJitterThreshold()}
   * get a random jitter, so jobs sharing a period do not all fire in lockstep.
   */
  public void setPeriod(Duration period) {
    requireNotNegative(period);

    var config = scheduler.config();
    var jitterBound = config.periodJitter().toNanos();
    if (period.compareTo(config.periodJitterThreshold()) > 0 && jitterBound > 0) {
      period = period.plusNanos(ThreadLocalRandom.current().nextLong(jitterBound));
    }
    this.period = period;
  }

  @Override
  public void startWork() {
    if (stopRepeating.get()) {
      releaseSlot();
      return;
    }

    super.startWork();
  }

  @Override
  public void work() {
    var shuttingDown = false;
    try {
      super.work();
    } catch (ShutdownException e) {
      shuttingDown = true;
      throw e;
    } finally {
      if (!shuttingDown && !stopRepeating.get()) {
        reschedule(period);
        scheduler.addJob(this);
      }
    }
  }

  private static Duration requireNotNegative(Duration period) {
    requireNonNull(period, "period must not be null");
    if (period.isNegative()) {
      throw new IllegalArgumentException("period must not be negative, got: " + period);
    }
    return period;
  }
}
