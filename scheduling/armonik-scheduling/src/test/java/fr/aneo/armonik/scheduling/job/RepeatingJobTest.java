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

import fr.aneo.armonik.scheduling.domain.ErrorReporter;
import fr.aneo.armonik.scheduling.internal.BoundedThreadSlots;
import fr.aneo.armonik.scheduling.testutils.MutableTicker;
import fr.aneo.armonik.scheduling.testutils.RecordingWorkerPool;
import fr.aneo.armonik.scheduling.testutils.TestApplicationState;
import fr.aneo.armonik.scheduling.testutils.TestServices;
import fr.aneo.armonik.scheduling.thread.ThreadingServices;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class RepeatingJobTest {

  private MutableTicker ticker;
  private ThreadingServices services;
  private RecordingWorkerPool pool;
  private BoundedThreadSlots slots;
  private JobScheduler scheduler;

  @BeforeEach
  void setUp() {
    var applicationState = new TestApplicationState();
    ticker = new MutableTicker();
    services = TestServices.create(applicationState, mock(ErrorReporter.class), ticker, TestServices.FAST_CONFIG);
    pool = new RecordingWorkerPool();
    slots = new BoundedThreadSlots(Map.of("network", 1));
    scheduler = new JobScheduler(services, applicationState, slots, pool);
  }

  @AfterEach
  void tearDown() {
    services.registry().close();
  }

  @Test
  @DisplayName("job should reschedule itself one period after each run")
  void job_should_reschedule_itself_one_period_after_each_run() {
    // Given
    var runs = new AtomicInteger();
    var job = new RepeatingJob(scheduler, Duration.ZERO, Duration.ofSeconds(30), runs::incrementAndGet);
    scheduler.addJob(job);

    // When
    var firstTick = scheduler.startDueJobs();
    pool.runAll();
    var tickBeforePeriod = scheduler.startDueJobs();
    ticker.advance(Duration.ofSeconds(30));
    var tickAfterPeriod = scheduler.startDueJobs();
    pool.runAll();

    // Then
    assertThat(firstTick).isEqualTo(1);
    assertThat(tickBeforePeriod).isZero();
    assertThat(tickAfterPeriod).isEqualTo(1);
    assertThat(runs.get()).isEqualTo(2);
    assertThat(scheduler.pendingCount()).isEqualTo(1);
    assertThat(job.timeUntilDue()).isEqualTo(Duration.ofSeconds(30));
  }

  @Test
  @DisplayName("failing run should still reschedule the job")
  void failing_run_should_still_reschedule_the_job() {
    // Given
    var job = new RepeatingJob(scheduler, Duration.ZERO, Duration.ofSeconds(5), () -> {
      throw new IllegalStateException("remote down");
    });

    // When / Then
    assertThatThrownBy(job::work).isInstanceOf(IllegalStateException.class);
    assertThat(scheduler.pendingCount()).isEqualTo(1);
    assertThat(job.timeUntilDue()).isEqualTo(Duration.ofSeconds(5));
  }

  @Test
  @DisplayName("cancel during a run should stop the job from rescheduling")
  void cancel_during_a_run_should_stop_the_job_from_rescheduling() {
    // Given
    var holder = new RepeatingJob[1];
    var job = new RepeatingJob(scheduler, Duration.ZERO, Duration.ofSeconds(5), () -> holder[0].cancel());
    holder[0] = job;

    // When
    job.work();

    // Then
    assertThat(job.isRepeatingWorkFinished()).isTrue();
    assertThat(job.isCancelled()).isTrue();
    assertThat(scheduler.pendingCount()).isZero();
  }

  @Test
  @DisplayName("cancelled job popped for dispatch should not start and should give its slot back")
  void cancelled_job_popped_for_dispatch_should_not_start_and_should_give_its_slot_back() {
    // Given
    var job = new RepeatingJob(scheduler, Duration.ZERO, Duration.ofSeconds(5), () -> {});
    job.setThreadSlotType("network");
    job.checkAdmission();

    // When
    job.cancel();
    job.startWork();

    // Then
    assertThat(pool.submittedCount()).isZero();
    assertThat(slots.inUse("network")).isZero();
  }

  @Test
  @DisplayName("set period should add up to one second of jitter to long periods only")
  void set_period_should_add_up_to_one_second_of_jitter_to_long_periods_only() {
    // Given
    var job = new RepeatingJob(scheduler, Duration.ZERO, Duration.ofSeconds(1), () -> {});

    // When
    job.setPeriod(Duration.ofSeconds(10));
    var atThreshold = job.period();
    job.setPeriod(Duration.ofSeconds(60));
    var longPeriod = job.period();

    // Then
    assertThat(atThreshold).isEqualTo(Duration.ofSeconds(10));
    assertThat(longPeriod).isGreaterThanOrEqualTo(Duration.ofSeconds(60)).isLessThan(Duration.ofSeconds(61));
  }

  @Test
  @DisplayName("delay should push the next run back")
  void delay_should_push_the_next_run_back() {
    // Given
    var job = new RepeatingJob(scheduler, Duration.ZERO, Duration.ofSeconds(5), () -> {});

    // When
    job.delay(Duration.ofMinutes(2));

    // Then
    assertThat(job.timeUntilDue()).isEqualTo(Duration.ofMinutes(2));
    assertThat(job.isRepeatingWorkFinished()).isFalse();
  }

  @Test
  @DisplayName("negative period should be rejected")
  void negative_period_should_be_rejected() {
    assertThatThrownBy(() -> new RepeatingJob(scheduler, Duration.ZERO, Duration.ofSeconds(-1), () -> {}))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("period");
  }
}
