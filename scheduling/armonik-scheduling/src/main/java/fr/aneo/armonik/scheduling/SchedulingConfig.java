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

import fr.aneo.armonik.scheduling.internal.EnvironmentValues;

import java.time.Duration;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Immutable tunables of the scheduling subsystem.
 * <p>
 * Every suspension point of the subsystem is bounded so that shutdown and cancellation flags are re-checked
 * promptly. The values below fix those bounds, together with the admission and anti-spike constants of the
 * job scheduler. {@link #DEFAULT} holds the production values; tests usually shrink the waits through the
 * {@link Builder}.
 * </p>
 *
 * <h2>Environment</h2>
 * <p>
 * {@link #fromEnvironment(Map)} overrides defaults with the following variables (durations in milliseconds):
 * </p>
 * <dl>
 *   <dt><code>Scheduling__PollIntervalMs</code></dt><dd>{@link #pollInterval()}</dd>
 *   <dt><code>Scheduling__QueueIdleWaitMs</code></dt><dd>{@link #queueIdleWait()}</dd>
 *   <dt><code>Scheduling__QueueDequeueTimeoutMs</code></dt><dd>{@link #queueDequeueTimeout()}</dd>
 *   <dt><code>Scheduling__SlotRetryDelayMs</code></dt><dd>{@link #slotRetryDelay()}</dd>
 *   <dt><code>Scheduling__SlotRetryJitterMs</code></dt><dd>{@link #slotRetryJitter()}</dd>
 *   <dt><code>Scheduling__MaxJobsPerTick</code></dt><dd>{@link #maxJobsPerTick()}</dd>
 *   <dt><code>Scheduling__EmptyQueueWaitMs</code></dt><dd>{@link #emptyQueueWait()}</dd>
 *   <dt><code>Scheduling__MaxLoopWaitMs</code></dt><dd>{@link #maxLoopWait()}</dd>
 *   <dt><code>Scheduling__ThreadSweepIntervalMs</code></dt><dd>{@link #threadSweepInterval()}</dd>
 *   <dt><code>Scheduling__SubprocessPollTimeoutMs</code></dt><dd>{@link #subprocessPollTimeout()}</dd>
 *   <dt><code>Scheduling__PeriodJitterThresholdMs</code></dt><dd>{@link #periodJitterThreshold()}</dd>
 *   <dt><code>Scheduling__PeriodJitterMs</code></dt><dd>{@link #periodJitter()}</dd>
 *   <dt><code>Scheduling__MaxPoolThreads</code></dt><dd>{@link #maxPoolThreads()}</dd>
 *   <dt><code>Scheduling__DaemonReportMode</code></dt><dd>{@link #daemonReportMode()}</dd>
 * </dl>
 *
 * @param pollInterval          granularity of every cooperative wait (default 1s)
 * @param queueIdleWait         how long an idle queue worker waits for its wake signal (default 10s)
 * @param queueDequeueTimeout   timeout of a single dequeue attempt (default 1s)
 * @param slotRetryDelay        delay before a job refused by admission control is reconsidered (default 10s)
 * @param slotRetryJitter       upper bound of the random jitter added to {@code slotRetryDelay} (default 1s)
 * @param maxJobsPerTick        maximum number of jobs started by one dispatch phase (default 10)
 * @param emptyQueueWait        scheduler wait when no job is pending (default 200ms)
 * @param maxLoopWait           upper bound of a scheduler wait when jobs are pending (default 1s)
 * @param threadSweepInterval   minimum time between two sweeps of dead thread entries (default 600s)
 * @param subprocessPollTimeout bounded wait on an external process between shutdown checks (default 10s)
 * @param periodJitterThreshold periods strictly above this get a random jitter (default 10s)
 * @param periodJitter          upper bound of that jitter (default 1s)
 * @param maxPoolThreads        number of pool threads above which busy threads are reused (default 200)
 * @param daemonReportMode      log every daemon job start at INFO instead of DEBUG (default false)
 */
public record SchedulingConfig(
  Duration pollInterval,
  Duration queueIdleWait,
  Duration queueDequeueTimeout,
  Duration slotRetryDelay,
  Duration slotRetryJitter,
  int maxJobsPerTick,
  Duration emptyQueueWait,
  Duration maxLoopWait,
  Duration threadSweepInterval,
  Duration subprocessPollTimeout,
  Duration periodJitterThreshold,
  Duration periodJitter,
  int maxPoolThreads,
  boolean daemonReportMode
) {

  /**
   * Production values.
   */
  public static final SchedulingConfig DEFAULT = builder().build();

  /**
   * Validates every parameter.
   *
   * @throws NullPointerException     if a duration is {@code null}
   * @throws IllegalArgumentException if a duration is negative, a wait is zero, or a count is not positive
   */
  public SchedulingConfig {
    requirePositive(pollInterval, "pollInterval");
    requirePositive(queueIdleWait, "queueIdleWait");
    requirePositive(queueDequeueTimeout, "queueDequeueTimeout");
    requirePositive(slotRetryDelay, "slotRetryDelay");
    requireNotNegative(slotRetryJitter, "slotRetryJitter");
    requirePositive(emptyQueueWait, "emptyQueueWait");
    requirePositive(maxLoopWait, "maxLoopWait");
    requireNotNegative(threadSweepInterval, "threadSweepInterval");
    requirePositive(subprocessPollTimeout, "subprocessPollTimeout");
    requireNotNegative(periodJitterThreshold, "periodJitterThreshold");
    requireNotNegative(periodJitter, "periodJitter");

    if (maxJobsPerTick <= 0) {
      throw new IllegalArgumentException("maxJobsPerTick must be > 0, got: " + maxJobsPerTick);
    }
    if (maxPoolThreads <= 0) {
      throw new IllegalArgumentException("maxPoolThreads must be > 0, got: " + maxPoolThreads);
    }
  }

  /**
   * Builds a configuration from {@code Scheduling__*} environment variables, using {@link #DEFAULT} for
   * anything unset.
   *
   * @param environment the variables, usually {@link System#getenv()}
   * @return the resulting configuration
   * @throws fr.aneo.armonik.scheduling.domain.ArmoniKException if a variable is malformed
   */
  public static SchedulingConfig fromEnvironment(Map<String, String> environment) {
    requireNonNull(environment, "environment must not be null");

    var builder = builder();
    EnvironmentValues.millis(environment, "Scheduling__PollIntervalMs").ifPresent(builder::pollInterval);
    EnvironmentValues.millis(environment, "Scheduling__QueueIdleWaitMs").ifPresent(builder::queueIdleWait);
    EnvironmentValues.millis(environment, "Scheduling__QueueDequeueTimeoutMs").ifPresent(builder::queueDequeueTimeout);
    EnvironmentValues.millis(environment, "Scheduling__SlotRetryDelayMs").ifPresent(builder::slotRetryDelay);
    EnvironmentValues.millis(environment, "Scheduling__SlotRetryJitterMs").ifPresent(builder::slotRetryJitter);
    EnvironmentValues.positiveInt(environment, "Scheduling__MaxJobsPerTick").ifPresent(builder::maxJobsPerTick);
    EnvironmentValues.millis(environment, "Scheduling__EmptyQueueWaitMs").ifPresent(builder::emptyQueueWait);
    EnvironmentValues.millis(environment, "Scheduling__MaxLoopWaitMs").ifPresent(builder::maxLoopWait);
    EnvironmentValues.millis(environment, "Scheduling__ThreadSweepIntervalMs").ifPresent(builder::threadSweepInterval);
    EnvironmentValues.millis(environment, "Scheduling__SubprocessPollTimeoutMs").ifPresent(builder::subprocessPollTimeout);
    EnvironmentValues.millis(environment, "Scheduling__PeriodJitterThresholdMs").ifPresent(builder::periodJitterThreshold);
    EnvironmentValues.millis(environment, "Scheduling__PeriodJitterMs").ifPresent(builder::periodJitter);
    EnvironmentValues.positiveInt(environment, "Scheduling__MaxPoolThreads").ifPresent(builder::maxPoolThreads);
    EnvironmentValues.flag(environment, "Scheduling__DaemonReportMode").ifPresent(builder::daemonReportMode);
    return builder.build();
  }

  /**
   * Creates a builder initialised with the production values.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a builder initialised with this configuration's values.
   *
   * @return a new builder
   */
  public Builder toBuilder() {
    return new Builder()
      .pollInterval(pollInterval)
      .queueIdleWait(queueIdleWait)
      .queueDequeueTimeout(queueDequeueTimeout)
      .slotRetryDelay(slotRetryDelay)
      .slotRetryJitter(slotRetryJitter)
      .maxJobsPerTick(maxJobsPerTick)
      .emptyQueueWait(emptyQueueWait)
      .maxLoopWait(maxLoopWait)
      .threadSweepInterval(threadSweepInterval)
      .subprocessPollTimeout(subprocessPollTimeout)
      .periodJitterThreshold(periodJitterThreshold)
      .periodJitter(periodJitter)
      .maxPoolThreads(maxPoolThreads)
      .daemonReportMode(daemonReportMode);
  }

  private static void requirePositive(Duration duration, String name) {
    requireNonNull(duration, name + " must not be null");
    if (duration.isZero() || duration.isNegative()) {
      throw new IllegalArgumentException(name + " must be > 0, got: " + duration);
    }
  }

  private static void requireNotNegative(Duration duration, String name) {
    requireNonNull(duration, name + " must not be null");
    if (duration.isNegative()) {
      throw new IllegalArgumentException(name + " must not be negative, got: " + duration);
    }
  }

  /**
   * Builder for {@link SchedulingConfig}. Validation happens in {@link #build()}.
   */
  public static final class Builder {
    private Duration pollInterval = Duration.ofSeconds(1);
    private Duration queueIdleWait = Duration.ofSeconds(10);
    private Duration queueDequeueTimeout = Duration.ofSeconds(1);
    private Duration slotRetryDelay = Duration.ofSeconds(10);
    private Duration slotRetryJitter = Duration.ofSeconds(1);
    private int maxJobsPerTick = 10;
    private Duration emptyQueueWait = Duration.ofMillis(200);
    private Duration maxLoopWait = Duration.ofSeconds(1);
    private Duration threadSweepInterval = Duration.ofSeconds(600);
    private Duration subprocessPollTimeout = Duration.ofSeconds(10);
    private Duration periodJitterThreshold = Duration.ofSeconds(10);
    private Duration periodJitter = Duration.ofSeconds(1);
    private int maxPoolThreads = 200;
    private boolean daemonReportMode = false;

    private Builder() {
    }

    public Builder pollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
      return this;
    }

    public Builder queueIdleWait(Duration queueIdleWait) {
      this.queueIdleWait = queueIdleWait;
      return this;
    }

    public Builder queueDequeueTimeout(Duration queueDequeueTimeout) {
      this.queueDequeueTimeout = queueDequeueTimeout;
      return this;
    }

    public Builder slotRetryDelay(Duration slotRetryDelay) {
      this.slotRetryDelay = slotRetryDelay;
      return this;
    }

    public Builder slotRetryJitter(Duration slotRetryJitter) {
      this.slotRetryJitter = slotRetryJitter;
      return this;
    }

    public Builder maxJobsPerTick(int maxJobsPerTick) {
      this.maxJobsPerTick = maxJobsPerTick;
      return this;
    }

    public Builder emptyQueueWait(Duration emptyQueueWait) {
      this.emptyQueueWait = emptyQueueWait;
      return this;
    }

    public Builder maxLoopWait(Duration maxLoopWait) {
      this.maxLoopWait = maxLoopWait;
      return this;
    }

    public Builder threadSweepInterval(Duration threadSweepInterval) {
      this.threadSweepInterval = threadSweepInterval;
      return this;
    }

    public Builder subprocessPollTimeout(Duration subprocessPollTimeout) {
      this.subprocessPollTimeout = subprocessPollTimeout;
      return this;
    }

    public Builder periodJitterThreshold(Duration periodJitterThreshold) {
      this.periodJitterThreshold = periodJitterThreshold;
      return this;
    }

    public Builder periodJitter(Duration periodJitter) {
      this.periodJitter = periodJitter;
      return this;
    }

    public Builder maxPoolThreads(int maxPoolThreads) {
      this.maxPoolThreads = maxPoolThreads;
      return this;
    }

    public Builder daemonReportMode(boolean daemonReportMode) {
      this.daemonReportMode = daemonReportMode;
      return this;
    }

    /**
     * Builds the validated configuration.
     *
     * @return a new {@link SchedulingConfig}
     * @throws IllegalArgumentException if a value is out of range
     */
    public SchedulingConfig build() {
      return new SchedulingConfig(
        pollInterval,
        queueIdleWait,
        queueDequeueTimeout,
        slotRetryDelay,
        slotRetryJitter,
        maxJobsPerTick,
        emptyQueueWait,
        maxLoopWait,
        threadSweepInterval,
        subprocessPollTimeout,
        periodJitterThreshold,
        periodJitter,
        maxPoolThreads,
        daemonReportMode);
    }
  }
}
