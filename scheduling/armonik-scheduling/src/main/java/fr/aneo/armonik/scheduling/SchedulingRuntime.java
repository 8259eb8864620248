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
package fr.aneo.armonik.scheduling;

import com.google.common.base.Ticker;
import fr.aneo.armonik.scheduling.domain.ApplicationState;
import fr.aneo.armonik.scheduling.domain.ErrorReporter;
import fr.aneo.armonik.scheduling.domain.EventBus;
import fr.aneo.armonik.scheduling.domain.ThreadSlots;
import fr.aneo.armonik.scheduling.domain.Topics;
import fr.aneo.armonik.scheduling.internal.BoundedThreadSlots;
import fr.aneo.armonik.scheduling.internal.LoggingErrorReporter;
import fr.aneo.armonik.scheduling.internal.SimpleEventBus;
import fr.aneo.armonik.scheduling.job.JobScheduler;
import fr.aneo.armonik.scheduling.job.RepeatingJob;
import fr.aneo.armonik.scheduling.job.SingleJob;
import fr.aneo.armonik.scheduling.process.ProcessResult;
import fr.aneo.armonik.scheduling.process.SubprocessWaiter;
import fr.aneo.armonik.scheduling.thread.PeriodicWorker;
import fr.aneo.armonik.scheduling.thread.PeriodicWorkerConfig;
import fr.aneo.armonik.scheduling.thread.QueueWorkerPool;
import fr.aneo.armonik.scheduling.thread.ThreadRegistry;
import fr.aneo.armonik.scheduling.thread.ThreadingServices;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * Entry point of the scheduling subsystem.
 * <p>
 * A runtime wires together one {@link ThreadRegistry}, one {@link QueueWorkerPool}, one {@link JobScheduler}
 * and the periodic workers started through it, on top of the collaborators supplied by the hosting
 * application.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * try (var runtime = SchedulingRuntime.builder(applicationState).build()) {
 *   runtime.start();
 *   var job = runtime.callRepeating(Duration.ofSeconds(5), Duration.ofMinutes(1), this::syncSubscriptions);
 *   job.setThreadSlotType("network");
 *   ...
 * }
 * }</pre>
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li><strong>Build</strong>: collaborators left unset get defaults: a {@link SimpleEventBus}, unbounded
 *       {@link BoundedThreadSlots}, a {@link LoggingErrorReporter}, {@link SchedulingConfig#DEFAULT} and the
 *       system ticker.</li>
 *   <li><strong>Start</strong>: {@link #start()} starts the scheduler thread. Jobs may be added before.</li>
 *   <li><strong>Close</strong>: {@link #close()} publishes {@link Topics#SHUTDOWN}, stops every thread, waits
 *       up to 30 seconds for them, then closes the registry.</li>
 * </ol>
 */
public final class SchedulingRuntime implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(SchedulingRuntime.class);
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(30);

  private final EventBus eventBus;
  private final SchedulingConfig config;
  private final ThreadRegistry registry;
  private final ThreadingServices services;
  private final QueueWorkerPool workerPool;
  private final JobScheduler scheduler;
  private final SubprocessWaiter subprocessWaiter;
  private final List<PeriodicWorker> periodicWorkers = new CopyOnWriteArrayList<>();
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean closed = new AtomicBoolean();

  private SchedulingRuntime(Builder builder) {
    this.eventBus = builder.eventBus;
    this.config = builder.config;
    this.registry = ThreadRegistry.open(builder.applicationState, builder.ticker, config.threadSweepInterval());
    this.services = new ThreadingServices(registry, eventBus, builder.errorReporter, config);
    this.workerPool = new QueueWorkerPool("CallToThread", services);
    this.scheduler = new JobScheduler(services, builder.applicationState, builder.threadSlots, workerPool);
    this.subprocessWaiter = new SubprocessWaiter(builder.applicationState, config.subprocessPollTimeout());
  }

  public static Builder builder(ApplicationState applicationState) {
    return new Builder(applicationState);
  }

  /**
   * Starts the job scheduler. Idempotent.
   *
   * @throws IllegalStateException if the runtime is closed
   */
  public void start() {
    ensureNotClosed();
    if (started.compareAndSet(false, true)) {
      scheduler.start();
    }
  }

  /**
   * Schedules {@code action} to run once, {@code delay} from now.
   *
   * @return the job, to wake, cancel or wait on it
   * @throws IllegalStateException if the runtime is closed
   */
  public SingleJob callLater(Duration delay, Runnable action) {
    ensureNotClosed();
    var job = new SingleJob(scheduler, delay, action);
    scheduler.addJob(job);
    return job;
  }

  /**
   * Schedules {@code action} to run after {@code initialDelay}, then every {@code period} after the end of
   * the previous run.
   *
   * @return the job, to wake, delay or cancel it
   * @throws IllegalStateException if the runtime is closed
   */
  public RepeatingJob callRepeating(Duration initialDelay, Duration period, Runnable action) {
    ensureNotClosed();
    var job = new RepeatingJob(scheduler, initialDelay, period, action);
    scheduler.addJob(job);
    return job;
  }

  /**
   * Runs {@code action} on a pool thread as soon as possible.
   *
   * @throws IllegalStateException if the runtime is closed
   */
  public void callToThread(Runnable action) {
    ensureNotClosed();
    workerPool.submit(action);
  }

  /**
   * Creates and starts a periodic worker that lives until the runtime is closed.
   *
   * @throws IllegalStateException if the runtime is closed
   */
  public PeriodicWorker startPeriodicWorker(PeriodicWorkerConfig workerConfig, Runnable action) {
    ensureNotClosed();
    var worker = new PeriodicWorker(workerConfig, action, services);
    periodicWorkers.add(worker);
    worker.start();
    return worker;
  }

  /**
   * Wakes every daemon, cutting short their interruptible waits.
   */
  public void wakeDaemons() {
    eventBus.publish(Topics.WAKE_DAEMONS);
  }

  /**
   * Waits for an external process, killing it if the application shuts down meanwhile.
   *
   * @see SubprocessWaiter#communicate(Process)
   */
  public ProcessResult communicate(Process process) {
    return subprocessWaiter.communicate(process);
  }

  public JobScheduler scheduler() {
    return scheduler;
  }

  public QueueWorkerPool workerPool() {
    return workerPool;
  }

  public ThreadRegistry registry() {
    return registry;
  }

  public EventBus eventBus() {
    return eventBus;
  }

  public SchedulingConfig config() {
    return config;
  }

  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Stops every thread of the runtime and closes its registry. Pending jobs are abandoned; actions already
   * running are given up to 30 seconds to finish. Idempotent.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) return;

    logger.info("Shutting down scheduling runtime ({} pending jobs, {} pool workers, {} periodic workers)",
                scheduler.pendingCount(), workerPool.size(), periodicWorkers.size());

    eventBus.publish(Topics.SHUTDOWN);
    scheduler.shutdown();
    periodicWorkers.forEach(PeriodicWorker::shutdown);
    workerPool.shutdown();

    try {
      var deadline = System.nanoTime() + CLOSE_TIMEOUT.toNanos();
      if (!scheduler.awaitTermination(CLOSE_TIMEOUT)) {
        logger.warn("{} did not stop within {}", JobScheduler.NAME, CLOSE_TIMEOUT);
      }
      for (var worker : periodicWorkers) {
        if (!worker.join(Duration.ofNanos(Math.max(0, deadline - System.nanoTime())))) {
          logger.warn("Periodic worker {} did not stop within {}", worker.name(), CLOSE_TIMEOUT);
        }
      }
      workerPool.awaitTermination(Duration.ofNanos(Math.max(0, deadline - System.nanoTime())));
    } catch (InterruptedException e) {
      logger.warn("Interrupted while waiting for scheduling threads to stop");
      Thread.currentThread().interrupt();
    } finally {
      registry.close();
      logger.info("Scheduling runtime stopped");
    }
  }

  private void ensureNotClosed() {
    if (closed.get()) throw new IllegalStateException("Scheduling runtime has been closed");
  }

  /**
   * Builder for {@link SchedulingRuntime}. Only the application state is mandatory.
   */
  public static final class Builder {
    private final ApplicationState applicationState;
    private EventBus eventBus = new SimpleEventBus();
    private ThreadSlots threadSlots = BoundedThreadSlots.unbounded();
    private ErrorReporter errorReporter = new LoggingErrorReporter();
    private SchedulingConfig config = SchedulingConfig.DEFAULT;
    private Ticker ticker = Ticker.systemTicker();

    private Builder(ApplicationState applicationState) {
      this.applicationState = requireNonNull(applicationState, "applicationState must not be null");
    }

    public Builder eventBus(EventBus eventBus) {
      this.eventBus = requireNonNull(eventBus, "eventBus must not be null");
      return this;
    }

    public Builder threadSlots(ThreadSlots threadSlots) {
      this.threadSlots = requireNonNull(threadSlots, "threadSlots must not be null");
      return this;
    }

    public Builder errorReporter(ErrorReporter errorReporter) {
      this.errorReporter = requireNonNull(errorReporter, "errorReporter must not be null");
      return this;
    }

    public Builder config(SchedulingConfig config) {
      this.config = requireNonNull(config, "config must not be null");
      return this;
    }

    public Builder ticker(Ticker ticker) {
      this.ticker = requireNonNull(ticker, "ticker must not be null");
      return this;
    }

    public SchedulingRuntime build() {
      return new SchedulingRuntime(this);
    }
  }
}
