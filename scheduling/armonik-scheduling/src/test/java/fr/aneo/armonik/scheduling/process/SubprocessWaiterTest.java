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

import fr.aneo.armonik.scheduling.domain.ShutdownException;
import fr.aneo.armonik.scheduling.testutils.TestApplicationState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@EnabledOnOs({OS.LINUX, OS.MAC})
class SubprocessWaiterTest {

  private TestApplicationState applicationState;
  private SubprocessWaiter waiter;
  private Process process;

  @BeforeEach
  void setUp() {
    applicationState = new TestApplicationState();
    waiter = new SubprocessWaiter(applicationState, Duration.ofMillis(50));
  }

  @AfterEach
  void tearDown() {
    if (process != null) {
      process.destroyForcibly();
    }
  }

  @Test
  @DisplayName("communicate should return the exit code and both outputs")
  void communicate_should_return_the_exit_code_and_both_outputs() throws IOException {
    // Given
    process = new ProcessBuilder("sh", "-c", "echo out; echo err 1>&2; exit 3").start();

    // When
    var result = waiter.communicate(process);

    // Then
    assertThat(result.exitCode()).isEqualTo(3);
    assertThat(result.isSuccess()).isFalse();
    assertThat(result.stdout()).isEqualTo("out\n");
    assertThat(result.stderr()).isEqualTo("err\n");
  }

  @Test
  @DisplayName("communicate should decode the output with the configured charset")
  void communicate_should_decode_the_output_with_the_configured_charset() throws IOException {
    // Given
    var utf8Waiter = new SubprocessWaiter(applicationState, Duration.ofMillis(50), UTF_8);
    var latin1Waiter = new SubprocessWaiter(applicationState, Duration.ofMillis(50), ISO_8859_1);
    var script = "printf '\\303\\251t\\303\\251'";

    // When
    process = new ProcessBuilder("sh", "-c", script).start();
    var asUtf8 = utf8Waiter.communicate(process);
    process = new ProcessBuilder("sh", "-c", script).start();
    var asLatin1 = latin1Waiter.communicate(process);

    // Then
    assertThat(asUtf8.stdout()).isEqualTo("\u00e9t\u00e9");
    assertThat(asLatin1.stdout()).isEqualTo("\u00c3\u00a9t\u00c3\u00a9");
  }

  @Test
  @DisplayName("waiter should reject a missing charset")
  void waiter_should_reject_a_missing_charset() {
    assertThatThrownBy(() -> new SubprocessWaiter(applicationState, Duration.ofMillis(50), null))
      .isInstanceOf(NullPointerException.class);
  }

  @Test
  @DisplayName("communicate should kill the process when the model is already shutting down")
  void communicate_should_kill_the_process_when_the_model_is_already_shutting_down() throws Exception {
    // Given
    process = new ProcessBuilder("sleep", "30").start();
    applicationState.modelShuttingDown = true;

    // When / Then
    assertThatThrownBy(() -> waiter.communicate(process))
      .isInstanceOf(ShutdownException.class)
      .hasMessage("Application is shutting down!");
    assertThat(process.waitFor(5, SECONDS)).isTrue();
  }

  @Test
  @DisplayName("communicate should kill the process when shutdown starts while waiting")
  void communicate_should_kill_the_process_when_shutdown_starts_while_waiting() throws Exception {
    // Given
    process = new ProcessBuilder("sleep", "30").start();
    var waiting = CompletableFuture.supplyAsync(() -> {
      try {
        waiter.communicate(process);
        return "exited";
      } catch (ShutdownException e) {
        return "killed";
      }
    });
    Thread.sleep(100);

    // When
    applicationState.fastExiting = true;

    // Then
    assertThat(waiting.get(5, SECONDS)).isEqualTo("killed");
    assertThat(process.waitFor(5, SECONDS)).isTrue();
  }

  @Test
  @DisplayName("view shutdown alone should not kill the process")
  void view_shutdown_alone_should_not_kill_the_process() throws IOException {
    // Given
    applicationState.viewShuttingDown = true;
    process = new ProcessBuilder("sh", "-c", "sleep 0.2; echo done").start();

    // When
    var result = waiter.communicate(process);

    // Then
    assertThat(result.isSuccess()).isTrue();
    assertThat(result.stdout()).isEqualTo("done\n");
  }
}
