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

import com.google.common.base.Ticker;
import fr.aneo.armonik.scheduling.domain.ErrorReporter;
import fr.aneo.armonik.scheduling.testutils.Conditions;
import fr.aneo.armonik.scheduling.testutils.TestApplicationState;
import fr.aneo.armonik.scheduling.testutils.TestServices;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class QueueWorkerPoolTest {

  private ThreadingServices services;
  private QueueWorkerPool pool;

  @AfterEach
  void tearDown() throws InterruptedException {
    if (pool != null) {
      pool.shutdown();
      pool.awaitTermination(Duration.ofSeconds(5));
    }
    services.registry().close();
  }

  @Test
  @DisplayName("submit should run the action on a named pool thread")
  void submit_should_run_the_action_on_a_named_pool_thread() throws InterruptedException {
    // Given
    createPool(200);
    var threadName = new AtomicReference<String>();
    var done = new CountDownLatch(1);

    // When
    pool.submit(() -> {
      threadName.set(Thread.currentThread().getName());
      done.countDown();
    });

    // Then
    assertThat(done.await(5, SECONDS)).isTrue();
    assertThat(threadName.get()).isEqualTo("CallToThread-1");
  }

  @Test
  @DisplayName("submit should reuse an idle worker")
  void submit_should_reuse_an_idle_worker() throws InterruptedException {
    // Given
    createPool(200);
    var first = new CountDownLatch(1);
    pool.submit(first::countDown);
    assertThat(first.await(5, SECONDS)).isTrue();
    assertThat(Conditions.eventually(Duration.ofSeconds(5), () -> pool.idleCount() == 1)).isTrue();

    // When
    var second = new CountDownLatch(1);
    pool.submit(second::countDown);

    // Then
    assertThat(second.await(5, SECONDS)).isTrue();
    assertThat(pool.size()).isEqualTo(1);
  }

  @Test
  @DisplayName("submit should start a new worker when every worker is busy")
  void submit_should_start_a_new_worker_when_every_worker_is_busy() throws InterruptedException {
    // Given
    createPool(200);
    var release = new CountDownLatch(1);
    var bothRunning = new CountDownLatch(2);

    // When
    pool.submit(() -> block(bothRunning, release));
    pool.submit(() -> block(bothRunning, release));

    // Then
    assertThat(bothRunning.await(5, SECONDS)).isTrue();
    assertThat(pool.size()).isEqualTo(2);
    release.countDown();
  }

  @Test
  @DisplayName("submit should queue on a busy worker once the pool is full")
  void submit_should_queue_on_a_busy_worker_once_the_pool_is_full() throws InterruptedException {
    // Given
    createPool(1);
    var release = new CountDownLatch(1);
    var firstRunning = new CountDownLatch(1);
    var secondDone = new CountDownLatch(1);
    pool.submit(() -> block(firstRunning, release));
    assertThat(firstRunning.await(5, SECONDS)).isTrue();

    // When
    pool.submit(secondDone::countDown);
    var secondRanWhileBlocked = secondDone.await(100, MILLISECONDS);
    release.countDown();

    // Then
    assertThat(secondRanWhileBlocked).isFalse();
    assertThat(secondDone.await(5, SECONDS)).isTrue();
    assertThat(pool.size()).isEqualTo(1);
  }

  @Test
  @DisplayName("job summaries should name each worker and what it runs")
  void job_summaries_should_name_each_worker_and_what_it_runs() throws InterruptedException {
    // Given
    createPool(1);
    var release = new CountDownLatch(1);
    var running = new CountDownLatch(1);
    pool.submit(new Runnable() {
      @Override
      public void run() {
        block(running, release);
      }

      @Override
      public String toString() {
        return "compaction";
      }
    });
    assertThat(running.await(5, SECONDS)).isTrue();

    // When
    var summaries = pool.jobSummaries();
    release.countDown();

    // Then
    assertThat(summaries).containsExactly("CallToThread-1: compaction");
  }

  @Test
  @DisplayName("submit from a pool thread should grow a full pool")
  void submit_from_a_pool_thread_should_grow_a_full_pool() throws InterruptedException {
    // Given
    createPool(1);
    var nestedDone = new CountDownLatch(1);
    var outerDone = new CountDownLatch(1);

    // When
    pool.submit(() -> {
      pool.submit(nestedDone::countDown);
      try {
        if (nestedDone.await(5, SECONDS)) outerDone.countDown();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    });

    // Then
    assertThat(outerDone.await(10, SECONDS)).isTrue();
    assertThat(pool.size()).isEqualTo(2);
  }

  @Test
  @DisplayName("submit should fail once the pool is shut down")
  void submit_should_fail_once_the_pool_is_shut_down() throws InterruptedException {
    // Given
    createPool(200);
    var done = new CountDownLatch(1);
    pool.submit(done::countDown);
    assertThat(done.await(5, SECONDS)).isTrue();

    // When
    pool.shutdown();

    // Then
    assertThat(pool.awaitTermination(Duration.ofSeconds(5))).isTrue();
    assertThatThrownBy(() -> pool.submit(() -> {}))
      .isInstanceOf(IllegalStateException.class)
      .hasMessageContaining("shut down");
  }

  private void createPool(int maxPoolThreads) {
    var config = TestServices.FAST_CONFIG.toBuilder().maxPoolThreads(maxPoolThreads).build();
    services = TestServices.create(new TestApplicationState(), mock(ErrorReporter.class), Ticker.systemTicker(), config);
    pool = new QueueWorkerPool("CallToThread", services);
  }

  private static void block(CountDownLatch running, CountDownLatch release) {
    running.countDown();
    try {
      release.await(5, SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
