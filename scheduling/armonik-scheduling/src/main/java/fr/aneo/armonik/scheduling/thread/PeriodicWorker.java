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

import static java.util.Objects.requireNonNull;

/**
 * A {@link Daemon} that checks for work at a set interval.
 * <p>
 * The worker runs the following cycle until it is shut down:
 * </p>
 * <pre>
 * initial delay (wakeable)
 * loop:
 *   pre-call delay (not wakeable)
 *   wait for admission, polling once per poll interval (not wakeable)
 *   pre-call hook
 *   run the action
 *   period (wakeable)
 * </pre>
 * <p>
 * Shutdown is checked between every step. A wake, either explicit through {@link #wake()} or from one of
 * the configured topics, ends a wakeable wait early so the cycle re-evaluates immediately.
 * </p>
 *
 * <h2>Failure Handling</h2>
 * <p>
 * A {@link ShutdownException} raised by the action ends the worker. Any other exception is logged,
 * reported, and the worker carries on with its period wait: the action is retried on the next cycle.
 * </p>
 */
public final class PeriodicWorker extends Daemon {
  private static final Logger logger = LoggerFactory.getLogger(PeriodicWorker.class);

  private final PeriodicWorkerConfig workerConfig;
  private final Runnable action;

  public PeriodicWorker(PeriodicWorkerConfig workerConfig, Runnable action, ThreadingServices services) {
    super(requireNonNull(workerConfig, "workerConfig must not be null").name(), services);
    this.workerConfig = workerConfig;
    this.action = requireNonNull(action, "action must not be null");

    workerConfig.topics().forEach(topic -> subscribe(topic, payload -> wake()));
  }

  @Override
  protected void loop() {
    context.pause(workerConfig.initialDelay(), true);

    while (true) {
      context.checkShutdown();
      context.pause(workerConfig.preCallDelay(), false);
      context.checkShutdown();
      awaitAdmission();
      context.checkShutdown();
      preCall();

      try {
        action.run();
      } catch (ShutdownException e) {
        return;
      } catch (Exception e) {
        logger.error("Daemon {} encountered an exception", name, e);
        errorReporter.report(name, e);
      }

      context.pause(workerConfig.period(), true);
    }
  }

  @Override
  public String currentJobSummary() {
    return action.toString();
  }

  private void awaitAdmission() {
    while (!workerConfig.admission().canStart()) {
      context.sleep(context.pollInterval());
      context.checkShutdown();
    }
  }
}
