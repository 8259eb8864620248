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

import fr.aneo.armonik.scheduling.domain.ErrorReporter;
import fr.aneo.armonik.scheduling.internal.BoundedThreadSlots;
import fr.aneo.armonik.scheduling.testutils.TestApplicationState;
import fr.aneo.armonik.scheduling.testutils.TestServices;
import fr.aneo.armonik.scheduling.thread.PeriodicWorkerConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

class SchedulingRuntimeTest {

  private static final Duration WAIT = Duration.ofSeconds(5);

  private TestApplicationState applicationState;
  private ErrorReporter errorReporter;
  private SchedulingRuntime runtime;

  @BeforeEach
  void setUp() {
    applicationState = new TestApplicationState();
    errorReporter = mock(ErrorReporter.class);
    runtime = SchedulingRuntime.builder(applicationState)
                               .config(TestServices.FAST_CONFIG)
                               .errorReporter(errorReporter)
                               .build();
  }

  @AfterEach
  void tearDown() {
    runtime.close();
  }

  @Test
  @DisplayName("call later should run the action once on a pool thread")
  void call_later_should_run_the_action_once_on_a_pool_thread() throws InterruptedException {
    // Given
    var threadName = new AtomicReference<String>();
    runtime.start();

    // When
    var job = runtime.callLater(Duration.ofMillis(10), () -> threadName.set(Thread.currentThread().getName()));

    // Then
    assertThat(job.awaitCompletion(WAIT)).isTrue();
    assertThat(threadName.get()).startsWith("CallToThread-");
    assertThat(runtime.scheduler().pendingCount()).isZero();
  }

  @Test
  @DisplayName("jobs added before start should run once started")
  void jobs_added_before_start_should_run_once_started() throws InterruptedException {
    // Given
    var job = runtime.callLater(Duration.ZERO, () -> {});

    // When
    runtime.start();

    // Then
    assertThat(job.awaitCompletion(WAIT)).isTrue();
  }

  @Test
  @DisplayName("call repeating should keep running the action until cancelled")
  void call_repeating_should_keep_running_the_action_until_cancelled() throws InterruptedException {
    // Given
    var runs = new CountDownLatch(3);
    runtime.start();

    // When
    var job = runtime.callRepeating(Duration.ZERO, Duration.ofMillis(20), runs::countDown);

    // Then
    assertThat(runs.await(5, SECONDS)).isTrue();
    job.cancel();
    assertThat(job.isRepeatingWorkFinished()).isTrue();
  }

  @Test
  @DisplayName("failing repeating action should be reported and retried")
  void failing_repeating_action_should_be_reported_and_retried() throws InterruptedException {
    // Given
    var attempts = new AtomicInteger();
    var recovered = new CountDownLatch(1);
    runtime.start();

    // When
    runtime.callRepeating(Duration.ZERO, Duration.ofMillis(20), () -> {
      if (attempts.incrementAndGet() == 1) throw new IllegalStateException("first attempt fails");
      recovered.countDown();
    });

    // Then
    assertThat(recovered.await(5, SECONDS)).isTrue();
    verify(errorReporter, timeout(5000)).report(startsWith("CallToThread-"), any(IllegalStateException.class));
  }

  @Test
  @DisplayName("admission slots should bound concurrent jobs of one category without dropping any")
  void admission_slots_should_bound_concurrent_jobs_of_one_category_without_dropping_any() throws InterruptedException {
    // Given
    runtime.close();
    var config = TestServices.FAST_CONFIG.toBuilder()
                                         .slotRetryDelay(Duration.ofMillis(30))
                                         .slotRetryJitter(Duration.ofMillis(10))
                                         .build();
    runtime = SchedulingRuntime.builder(applicationState)
                               .config(config)
                               .threadSlots(new BoundedThreadSlots(Map.of("heavy", 1)))
                               .build();
    runtime.start();
    var running = new AtomicInteger();
    var maxRunning = new AtomicInteger();
    var completed = new CountDownLatch(3);
    Runnable heavyWork = () -> {
      maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
      try {
        Thread.sleep(50);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      running.decrementAndGet();
      completed.countDown();
    };

    // When
    for (int i = 0; i < 3; i++) {
      runtime.callLater(Duration.ZERO, heavyWork).setThreadSlotType("heavy");
    }

    // Then
    assertThat(completed.await(10, SECONDS)).isTrue();
    assertThat(maxRunning.get()).isEqualTo(1);
  }

  @Test
  @DisplayName("call to thread should run the action as soon as possible")
  void call_to_thread_should_run_the_action_as_soon_as_possible() throws InterruptedException {
    // Given
    var done = new CountDownLatch(1);

    // When
    runtime.callToThread(done::countDown);

    // Then
    assertThat(done.await(5, SECONDS)).isTrue();
  }

  @Test
  @DisplayName("wake daemons should wake periodic workers")
  void wake_daemons_should_wake_periodic_workers() throws InterruptedException {
    // Given
    var runs = new CountDownLatch(1);
    runtime.startPeriodicWorker(PeriodicWorkerConfig.named("maintenance").withInitialDelay(Duration.ofHours(1)), runs::countDown);

    // When
    runtime.wakeDaemons();

    // Then
    assertThat(runs.await(5, SECONDS)).isTrue();
  }

  @Test
  @DisplayName("close should stop every thread and reject further work")
  void close_should_stop_every_thread_and_reject_further_work() throws InterruptedException {
    // Given
    runtime.start();
    var worker = runtime.startPeriodicWorker(PeriodicWorkerConfig.named("maintenance"), () -> {});
    var done = new CountDownLatch(1);
    runtime.callToThread(done::countDown);
    assertThat(done.await(5, SECONDS)).isTrue();

    // When
    runtime.close();
    runtime.close();

    // Then
    assertThat(runtime.isClosed()).isTrue();
    assertThat(worker.isAlive()).isFalse();
    assertThat(runtime.scheduler().awaitTermination(WAIT)).isTrue();
    assertThat(runtime.workerPool().awaitTermination(WAIT)).isTrue();
    assertThat(runtime.registry().isClosed()).isTrue();
    assertThatThrownBy(() -> runtime.callLater(Duration.ZERO, () -> {}))
      .isInstanceOf(IllegalStateException.class)
      .hasMessageContaining("closed");
  }
}
