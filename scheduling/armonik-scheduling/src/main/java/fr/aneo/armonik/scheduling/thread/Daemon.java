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

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import fr.aneo.armonik.scheduling.SchedulingConfig;
import fr.aneo.armonik.scheduling.domain.ErrorReporter;
import fr.aneo.armonik.scheduling.domain.EventBus;
import fr.aneo.armonik.scheduling.domain.ShutdownException;
import fr.aneo.armonik.scheduling.domain.Subscription;
import fr.aneo.armonik.scheduling.domain.Topics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Base of the long-lived, cooperatively stoppable threads of the subsystem.
 * <p>
 * A daemon owns one named Java thread, a {@link CancellationContext} and its subscriptions on the
 * {@link EventBus}. It is never preempted: its {@link #loop()} polls the context at defined checkpoints
 * and leaves by throwing a {@link ShutdownException}, which ends the thread quietly.
 * </p>
 *
 * <h2>Broadcasts</h2>
 * <p>
 * On construction a daemon subscribes to:
 * </p>
 * <ul>
 *   <li>{@link Topics#WAKE_DAEMONS}, which calls {@link #wake()}</li>
 *   <li>{@link Topics#SHUTDOWN}, which calls {@link #shutdown()}</li>
 * </ul>
 * <p>
 * Subscriptions are closed when the thread exits.
 * </p>
 *
 * <h2>Shutdown Class</h2>
 * <p>
 * Daemon threads are registered as {@link ThreadKind#DAEMON}: they also stop when the application's view
 * shuts down.
 * </p>
 *
 * @see PeriodicWorker
 * @see QueueWorker
 */
public abstract class Daemon {
  private static final Logger logger = LoggerFactory.getLogger(Daemon.class);

  protected final String name;
  protected final CancellationContext context;
  protected final ErrorReporter errorReporter;
  protected final SchedulingConfig config;

  private final EventBus eventBus;
  private final Thread thread;
  private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();

  protected Daemon(String name, ThreadingServices services) {
    this.name = requireNonNull(name, "name must not be null");
    requireNonNull(services, "services must not be null");
    this.eventBus = services.eventBus();
    this.errorReporter = services.errorReporter();
    this.config = services.config();
    this.thread = new ThreadFactoryBuilder()
      .setDaemon(true)
      .setUncaughtExceptionHandler((t, e) -> logger.error("Daemon {} died with an uncaught error", name, e))
      .build()
      .newThread(this::runLoop);
    this.thread.setName(name);
    this.context = CancellationContext.forThread(services.registry(), thread, ThreadKind.DAEMON, config.pollInterval());

    subscribe(Topics.WAKE_DAEMONS, payload -> wake());
    subscribe(Topics.SHUTDOWN, payload -> shutdown());
  }

  /**
   * Body of the daemon. Implementations call {@link CancellationContext#checkShutdown()} between every
   * blocking or long-running step.
   */
  protected abstract void loop();

  public void start() {
    thread.start();
    logger.debug("Daemon {} started", name);
  }

  /**
   * Cuts short the interruptible wait the daemon may be in.
   */
  public void wake() {
    context.wake();
  }

  /**
   * Marks the daemon's thread as shutting down and wakes it.
   */
  public void shutdown() {
    context.requestShutdown();
  }

  /**
   * Waits for the thread to end.
   *
   * @param timeout maximum time to wait
   * @return {@code true} if the thread has ended
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public boolean join(Duration timeout) throws InterruptedException {
    thread.join(Math.max(1, timeout.toMillis()));
    return !thread.isAlive();
  }

  public boolean isAlive() {
    return thread.isAlive();
  }

  public String name() {
    return name;
  }

  /**
   * @return a human-readable description of what the daemon is doing, for diagnostics
   */
  public String currentJobSummary() {
    return "unknown job";
  }

  boolean isCurrentThread() {
    return Thread.currentThread() == thread;
  }

  /**
   * Subscribes the daemon to a topic for as long as its thread lives.
   */
  protected final void subscribe(String topic, Consumer<Object> handler) {
    subscriptions.add(eventBus.subscribe(topic, handler));
  }

  /**
   * Hook run right before each unit of work.
   */
  protected void preCall() {
    if (config.daemonReportMode()) {
      logger.info("{} doing a job.", name);
    } else {
      logger.debug("{} doing a job.", name);
    }
  }

  private void runLoop() {
    MDC.put("thread", name);
    try {
      loop();
    } catch (ShutdownException e) {
      logger.debug("Daemon {} shut down: {}", name, e.getMessage());
    } finally {
      subscriptions.forEach(Subscription::close);
      subscriptions.clear();
      MDC.clear();
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{name='" + name + "', alive=" + thread.isAlive() + '}';
  }
}
