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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * A {@link Daemon} draining a producer/consumer queue of actions, one at a time.
 * <p>
 * Queue workers are the elements of a {@link QueueWorkerPool}. {@link #submit(Runnable)} marks the worker
 * busy immediately, before the action even starts, so that pool selection never hands a second caller a
 * worker that already has queued work. A new worker is busy from the start for the same reason.
 * </p>
 *
 * <h2>Loop</h2>
 * <ol>
 *   <li>While the queue looks empty, wait on the wake event for up to the queue idle wait. The emptiness
 *       check is not atomic with producers; an action queued right after it is picked up by the next
 *       check at the latest.</li>
 *   <li>Dequeue with a short timeout. An empty result is not an error: it is logged and the loop retries.</li>
 *   <li>Run the action. Failures other than {@link ShutdownException} are logged and reported.</li>
 *   <li>Clear the busy flag, whatever the outcome, and yield.</li>
 * </ol>
 */
public final class QueueWorker extends Daemon {
  private static final Logger logger = LoggerFactory.getLogger(QueueWorker.class);

  private final BlockingQueue<Runnable> queue = new LinkedBlockingQueue<>();
  private final AtomicBoolean currentlyWorking = new AtomicBoolean(true);
  private volatile Runnable currentAction;

  public QueueWorker(String name, ThreadingServices services) {
    super(name, services);
  }

  /**
   * Queues an action and wakes the worker.
   *
   * @param action the action; never {@code null}
   */
  public void submit(Runnable action) {
    requireNonNull(action, "action must not be null");
    currentlyWorking.set(true);
    queue.add(action);
    wake();
  }

  /**
   * @return whether the worker is running, or about to run, an action
   */
  public boolean currentlyWorking() {
    return currentlyWorking.get();
  }

  public int queuedCount() {
    return queue.size();
  }

  @Override
  public String currentJobSummary() {
    var action = currentAction;
    return action == null ? "idle" : action.toString();
  }

  @Override
  protected void loop() {
    while (true) {
      while (queue.isEmpty()) {
        context.checkShutdown();
        context.awaitWake(config.queueIdleWait());
      }

      context.checkShutdown();

      try {
        var action = context.poll(queue, config.queueDequeueTimeout());
        if (action == null) {
          logger.debug("Queue worker {} saw a non-empty queue but dequeued nothing, retrying", name);
          continue;
        }

        preCall();
        currentAction = action;
        action.run();
      } catch (ShutdownException e) {
        throw e;
      } catch (Exception e) {
        logger.error("Queue worker {} failed to run an action", name, e);
        errorReporter.report(name, e);
      } finally {
        currentAction = null;
        currentlyWorking.set(false);
      }

      Thread.yield();
    }
  }
}
