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

import com.google.common.base.Ticker;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import fr.aneo.armonik.scheduling.SchedulingConfig;
import fr.aneo.armonik.scheduling.domain.ApplicationState;
import fr.aneo.armonik.scheduling.domain.ErrorReporter;
import fr.aneo.armonik.scheduling.domain.EventBus;
import fr.aneo.armonik.scheduling.domain.ShutdownException;
import fr.aneo.armonik.scheduling.domain.Subscription;
import fr.aneo.armonik.scheduling.domain.ThreadSlots;
import fr.aneo.armonik.scheduling.domain.Topics;
import fr.aneo.armonik.scheduling.domain.WorkerPool;
import fr.aneo.armonik.scheduling.thread.CancellationContext;
import fr.aneo.armonik.scheduling.thread.ThreadKind;
import fr.aneo.armonik.scheduling.thread.ThreadRegistry;
import fr.aneo.armonik.scheduling.thread.ThreadingServices;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Dispatches {@link SchedulableJob}s to a {@link WorkerPool} in ascending due-time order.
 * <p>
 * The scheduler runs on one dedicated thread, registered as a {@link ThreadKind#REGULAR} thread: it stops
 * with the application's model, not with its view. It holds the pending jobs in a binary min-heap keyed on
 * due time and never runs a job body itself.
 * </p>
 *
 * <h2>Lazy Maintenance</h2>
 * <p>
 * Rescheduling or cancelling a job does not touch the heap. It only raises one of two flags:
 * </p>
 * <ul>
 *   <li>{@link #workTimesHaveChanged()}: the heap is rebuilt before the next dispatch decision;</li>
 *   <li>{@link #jobCancelled()}: cancelled jobs are filtered out before the next dispatch decision.</li>
 * </ul>
 * <p>
 * Between a change and the next rebuild the order may be stale. Due-ness is re-checked at dispatch, so a
 * stale order at worst starts a newly urgent job one loop late, bounded by
 * {@link SchedulingConfig#maxLoopWait()}.
 * </p>
 *
 * <h2>Dispatch</h2>
 * <p>
 * Each dispatch phase starts at most {@link SchedulingConfig#maxJobsPerTick()} jobs, so that a large
 * backlog after a long suspend does not flood the pool in one burst. A popped job that was cancelled is
 * dropped, a job refused by admission control is reinserted at its retry time, and an admitted job is
 * started. The phase ends at the first job that is not yet due.
 * </p>
 *
 * <h2>Failure Handling</h2>
 * <p>
 * A {@link ShutdownException} ends the loop. Any other exception is logged, reported, and the loop goes on.
 * </p>
 */
public final class JobScheduler {
  private static final Logger logger = LoggerFactory.getLogger(JobScheduler.class);

  public static final String NAME = "Job Scheduler";

  private final ThreadRegistry registry;
  private final EventBus eventBus;
  private final ErrorReporter errorReporter;
  private final SchedulingConfig config;
  private final ApplicationState applicationState;
  private final ThreadSlots threadSlots;
  private final WorkerPool workerPool;

  private final Object lock = new Object();
  private final PriorityQueue<SchedulableJob> waiting = new PriorityQueue<>(SchedulableJob.BY_DUE_TIME);
  private final AtomicBoolean cancelFilterNeeded = new AtomicBoolean();
  private final AtomicBoolean sortNeeded = new AtomicBoolean();

  private final Thread thread;
  private final CancellationContext context;
  private final Subscription shutdownSubscription;

  public JobScheduler(ThreadingServices services, ApplicationState applicationState, ThreadSlots threadSlots, WorkerPool workerPool) {
    requireNonNull(services, "services must not be null");
    this.registry = services.registry();
    this.eventBus = services.eventBus();
    this.errorReporter = services.errorReporter();
    this.config = services.config();
    this.applicationState = requireNonNull(applicationState, "applicationState must not be null");
    this.threadSlots = requireNonNull(threadSlots, "threadSlots must not be null");
    this.workerPool = requireNonNull(workerPool, "workerPool must not be null");

    this.thread = new ThreadFactoryBuilder()
      .setNameFormat(NAME)
      .setDaemon(true)
      .setUncaughtExceptionHandler((t, e) -> logger.error("{} died with an uncaught error", NAME, e))
      .build()
      .newThread(this::runLoop);
    this.context = CancellationContext.forThread(registry, thread, ThreadKind.REGULAR, config.pollInterval());
    this.shutdownSubscription = eventBus.subscribe(Topics.SHUTDOWN, payload -> shutdown());
  }

  public void start() {
    thread.start();
    logger.info("{} started", NAME);
  }

  /**
   * Adds a job to the pending heap and wakes the dispatch loop.
   *
   * @param job the job; never {@code null}
   */
  public void addJob(SchedulableJob job) {
    requireNonNull(job, "job must not be null");
    synchronized (lock) {
      waiting.add(job);
    }
    context.wake();
  }

  /**
   * Requests a filtering of cancelled jobs before the next dispatch decision.
   */
  public void jobCancelled() {
    cancelFilterNeeded.set(true);
  }

  /**
   * Requests a rebuild of the pending heap before the next dispatch decision, and wakes the loop so the
   * rebuild happens now rather than at the end of the current wait.
   */
  public void workTimesHaveChanged() {
    sortNeeded.set(true);
    context.wake();
  }

  /**
   * Marks the scheduler thread as shutting down and wakes it. Pending jobs are abandoned.
   */
  public void shutdown() {
    context.requestShutdown();
  }

  /**
   * Waits for the scheduler thread to end.
   *
   * @param timeout maximum time to wait
   * @return {@code true} if the thread has ended, or was never started
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    if (thread.getState() == Thread.State.NEW) return true;

    thread.join(Math.max(1, timeout.toMillis()));
    return !thread.isAlive();
  }

  public int pendingCount() {
    synchronized (lock) {
      return waiting.size();
    }
  }

  /**
   * Drops every pending job reporting itself as dead.
   */
  public void clearOutDead() {
    synchronized (lock) {
      if (waiting.removeIf(SchedulableJob::isDead)) {
        logger.debug("Cleared dead jobs, {} left", waiting.size());
      }
    }
  }

  public String currentJobSummary() {
    return String.format("%,d jobs", pendingCount());
  }

  /**
   * @return one header line followed by one line per pending job, earliest first
   */
  public String prettyJobSummary() {
    // Due times can move under a concurrent wake(), so sort on a frozen copy of them.
    var snapshot = new ArrayList<DueJob>();
    synchronized (lock) {
      waiting.forEach(job -> snapshot.add(new DueJob(job.nextWorkTime(), job)));
    }
    snapshot.sort(DueJob.BY_DUE_TIME);

    return Stream.concat(Stream.of(String.format("%,d jobs:", snapshot.size())), snapshot.stream().map(due -> due.job().toString()))
                 .collect(Collectors.joining(System.lineSeparator()));
  }

  private record DueJob(long dueTime, SchedulableJob job) {
    static final Comparator<DueJob> BY_DUE_TIME = (a, b) -> Long.signum(a.dueTime - b.dueTime);
  }

  /**
   * Runs one dispatch phase.
   *
   * @return the number of jobs started
   */
  int startDueJobs() {
    var started = 0;

    while (started < config.maxJobsPerTick()) {
      SchedulableJob job;
      synchronized (lock) {
        var next = waiting.peek();
        if (next == null || !next.isDue()) break;

        job = waiting.poll();
      }

      if (job.isCancelled()) continue;

      if (job.checkAdmission()) {
        job.startWork();
        started++;
      } else {
        synchronized (lock) {
          waiting.add(job);
        }
      }
    }

    return started;
  }

  Ticker ticker() {
    return registry.ticker();
  }

  ThreadRegistry registry() {
    return registry;
  }

  EventBus eventBus() {
    return eventBus;
  }

  SchedulingConfig config() {
    return config;
  }

  ApplicationState applicationState() {
    return applicationState;
  }

  ThreadSlots threadSlots() {
    return threadSlots;
  }

  WorkerPool workerPool() {
    return workerPool;
  }

  private void runLoop() {
    MDC.put("thread", NAME);
    try {
      while (true) {
        try {
          while (noWorkToStart()) {
            if (context.isShuttingDown()) return;

            if (cancelFilterNeeded.getAndSet(false)) {
              filterCancelled();
            }

            if (sortNeeded.getAndSet(false)) {
              sortWaiting();
              continue;
            }

            context.awaitWake(loopWaitTime());
          }

          startDueJobs();
        } catch (ShutdownException e) {
          return;
        } catch (RuntimeException e) {
          logger.error("{} failed to dispatch jobs", NAME, e);
          errorReporter.report(NAME, e);
        }

        Thread.yield();
      }
    } finally {
      shutdownSubscription.close();
      logger.info("{} stopped with {} pending jobs", NAME, pendingCount());
      MDC.clear();
    }
  }

  private boolean noWorkToStart() {
    synchronized (lock) {
      var next = waiting.peek();
      return next == null || !next.isDue();
    }
  }

  private Duration loopWaitTime() {
    SchedulableJob next;
    synchronized (lock) {
      next = waiting.peek();
    }
    if (next == null) return config.emptyQueueWait();

    var untilDue = next.timeUntilDue();
    return untilDue.compareTo(config.maxLoopWait()) < 0 ? untilDue : config.maxLoopWait();
  }

  private void filterCancelled() {
    synchronized (lock) {
      waiting.removeIf(SchedulableJob::isCancelled);
    }
  }

  private void sortWaiting() {
    synchronized (lock) {
      var jobs = new ArrayList<>(waiting);
      waiting.clear();
      waiting.addAll(jobs);
    }
  }
}
