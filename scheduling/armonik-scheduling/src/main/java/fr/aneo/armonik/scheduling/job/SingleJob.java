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
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A job that runs once and signals its completion.
 * <p>
 * The completion signal is raised after the single run whether the action succeeded or failed, except when
 * the run was ended by a {@link ShutdownException}. It never reverts.
 * </p>
 */
public class SingleJob extends SchedulableJob {
  private final CountDownLatch workComplete = new CountDownLatch(1);

  public SingleJob(JobScheduler scheduler, Duration initialDelay, Runnable action) {
    super(scheduler, initialDelay, action);
  }

  public boolean isWorkComplete() {
    return workComplete.getCount() == 0;
  }

  /**
   * Blocks until the run completed.
   *
   * @param timeout maximum time to wait
   * @return {@code true} if the run completed in time
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public boolean awaitCompletion(Duration timeout) throws InterruptedException {
    return workComplete.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
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
      if (!shuttingDown) {
        workComplete.countDown();
      }
    }
  }
}
