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
package fr.aneo.armonik.scheduling.process;

import com.google.common.io.CharStreams;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import fr.aneo.armonik.scheduling.domain.ApplicationState;
import fr.aneo.armonik.scheduling.domain.ArmoniKException;
import fr.aneo.armonik.scheduling.domain.ShutdownException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;

/**
 * Shutdown-aware wait on an external process.
 * <p>
 * {@link #communicate(Process)} collects the output of a process while waiting for it in bounded steps.
 * Between steps it checks the application state: once the model is shutting down, or the application is
 * exiting fast, the process is killed forcibly and the wait ends with a {@link ShutdownException}.
 * </p>
 * <p>
 * Both output pipes are drained concurrently, on dedicated daemon threads, so a process filling one pipe
 * never blocks on it.
 * </p>
 */
public final class SubprocessWaiter {
  private static final Logger logger = LoggerFactory.getLogger(SubprocessWaiter.class);

  private final ApplicationState applicationState;
  private final Duration pollTimeout;
  private final Charset outputCharset;
  private final ThreadFactory drainThreads = new ThreadFactoryBuilder()
    .setNameFormat("subprocess-drain-%d")
    .setDaemon(true)
    .build();

  /**
   * Creates a waiter decoding process output with the platform default charset, which is what a child
   * process inheriting the JVM's locale writes.
   */
  public SubprocessWaiter(ApplicationState applicationState, Duration pollTimeout) {
    this(applicationState, pollTimeout, Charset.defaultCharset());
  }

  /**
   * @param applicationState the state checked between waits
   * @param pollTimeout      how long each bounded wait lasts; must be positive
   * @param outputCharset    the charset used to decode stdout and stderr
   */
  public SubprocessWaiter(ApplicationState applicationState, Duration pollTimeout, Charset outputCharset) {
    this.applicationState = requireNonNull(applicationState, "applicationState must not be null");
    this.pollTimeout = requireNonNull(pollTimeout, "pollTimeout must not be null");
    this.outputCharset = requireNonNull(outputCharset, "outputCharset must not be null");
    if (pollTimeout.isZero() || pollTimeout.isNegative()) {
      throw new IllegalArgumentException("pollTimeout must be > 0, got: " + pollTimeout);
    }
  }

  /**
   * Waits for {@code process} to exit and returns its output.
   *
   * @param process a started process
   * @return exit code and output
   * @throws ShutdownException if the application shuts down first; the process has then been killed
   * @throws ArmoniKException  if the output cannot be read
   */
  public ProcessResult communicate(Process process) {
    requireNonNull(process, "process must not be null");
    checkShutdown(process);

    var stdout = drain(process.getInputStream());
    var stderr = drain(process.getErrorStream());

    try {
      while (!process.waitFor(pollTimeout.toNanos(), TimeUnit.NANOSECONDS)) {
        logger.debug("Process {} still running after {}", process.pid(), pollTimeout);
        checkShutdown(process);
      }
      return new ProcessResult(process.exitValue(), stdout.get(), stderr.get());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
      throw new ShutdownException("Interrupted while waiting for process " + process.pid(), e);
    } catch (ExecutionException e) {
      throw new ArmoniKException("Failed to read output of process " + process.pid(), e.getCause());
    }
  }

  private void checkShutdown(Process process) {
    if (applicationState.isModelShuttingDown() || applicationState.isFastExiting()) {
      logger.warn("Killing process {} because the application is shutting down", process.pid());
      process.destroyForcibly();
      throw new ShutdownException("Application is shutting down!");
    }
  }

  private CompletableFuture<String> drain(InputStream stream) {
    var future = new CompletableFuture<String>();
    drainThreads.newThread(() -> {
      try (var reader = new InputStreamReader(stream, outputCharset)) {
        future.complete(CharStreams.toString(reader));
      } catch (IOException e) {
        future.completeExceptionally(new UncheckedIOException(e));
      }
    }).start();
    return future;
  }
}
