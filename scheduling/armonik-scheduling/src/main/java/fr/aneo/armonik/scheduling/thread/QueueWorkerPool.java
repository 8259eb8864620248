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

import fr.aneo.armonik.scheduling.domain.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

import static java.util.Objects.requireNonNull;

/**
 * {@link WorkerPool} made of {@link QueueWorker} threads, grown on demand.
 * <p>
 * For each submission the pool picks:
 * </p>
 * <ol>
 *   <li>the first idle worker, if any;</li>
 *   <li>otherwise a brand-new worker, if the pool holds fewer than
 *       {@link fr.aneo.armonik.scheduling.SchedulingConfig#maxPoolThreads()} workers or the caller is itself a
 *       pool thread (so a pool action that submits more work cannot wait on itself);</li>
 *   <li>otherwise a random busy worker, whose queue then holds the action.</li>
 * </ol>
 * <p>
 * Selection and submission happen under the pool lock, so two quick submissions never land on the same
 * idle worker. Workers whose thread has ended are pruned on every submission.
 * </p>
 */
public final class QueueWorkerPool implements WorkerPool {
  private static final Logger logger = LoggerFactory.getLogger(QueueWorkerPool.class);

  private final ThreadingServices services;
  private final String namePrefix;
  private final Object lock = new Object();
  private final List<QueueWorker> workers = new ArrayList<>();
  private final AtomicInteger sequence = new AtomicInteger();
  private volatile boolean shutdown;

  public QueueWorkerPool(String namePrefix, ThreadingServices services) {
    this.namePrefix = requireNonNull(namePrefix, "namePrefix must not be null");
    this.services = requireNonNull(services, "services must not be null");
  }

  /**
   * @throws IllegalStateException if the pool has been shut down
   */
  @Override
  public void submit(Runnable action) {
    requireNonNull(action, "action must not be null");

    synchronized (lock) {
      if (shutdown) throw new IllegalStateException("Worker pool has been shut down");

      selectWorker().submit(action);
    }
  }

  /**
   * Asks every worker to stop. Queued actions that have not started are abandoned.
   */
  public void shutdown() {
    List<QueueWorker> snapshot;
    synchronized (lock) {
      shutdown = true;
      snapshot = List.copyOf(workers);
    }
    logger.info("Shutting down worker pool '{}' ({} workers)", namePrefix, snapshot.size());
    snapshot.forEach(QueueWorker::shutdown);
  }

  /**
   * Waits for every worker thread to end.
   *
   * @param timeout maximum total time to wait
   * @return {@code true} if all workers ended in time
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    List<QueueWorker> snapshot;
    synchronized (lock) {
      snapshot = List.copyOf(workers);
    }

    var deadline = System.nanoTime() + timeout.toNanos();
    for (var worker : snapshot) {
      var remaining = Duration.ofNanos(deadline - System.nanoTime());
      if (remaining.isNegative() || !worker.join(remaining)) {
        logger.warn("Worker {} did not stop within {}", worker.name(), timeout);
        return false;
      }
    }
    return true;
  }

  public int size() {
    synchronized (lock) {
      return workers.size();
    }
  }

  public int idleCount() {
    synchronized (lock) {
      return (int) workers.stream().filter(w -> !w.currentlyWorking()).count();
    }
  }

  /**
   * @return one summary line per worker, for diagnostics
   */
  public List<String> jobSummaries() {
    synchronized (lock) {
      return workers.stream().map(w -> w.name() + ": " + w.currentJobSummary()).toList();
    }
  }

  private QueueWorker selectWorker() {
    workers.removeIf(worker -> !worker.isAlive());

    for (var worker : workers) {
      if (!worker.currentlyWorking()) return worker;
    }

    var callingFromPool = workers.stream().anyMatch(QueueWorker::isCurrentThread);
    if (callingFromPool || workers.size() < services.config().maxPoolThreads()) {
      var worker = new QueueWorker(namePrefix + "-" + sequence.incrementAndGet(), services);
      worker.start();
      workers.add(worker);
      logger.debug("Started pool worker {} ({} workers)", worker.name(), workers.size());
      return worker;
    }

    return workers.get(ThreadLocalRandom.current().nextInt(workers.size()));
  }
}
