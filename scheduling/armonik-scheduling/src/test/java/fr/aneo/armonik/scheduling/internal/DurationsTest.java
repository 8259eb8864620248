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
package fr.aneo.armonik.scheduling.internal;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class DurationsTest {

  @ParameterizedTest(name = "{0} ms should render as ''{1}''")
  @CsvSource({
    "0, 0ms",
    "250, 250ms",
    "12000, 12s",
    "90000, 1m 30s",
    "3900000, 1h 5m",
    "90000000, 1d 1h",
    "-3000, -3s"
  })
  void pretty_should_keep_the_two_most_significant_units(long millis, String expected) {
    assertThat(Durations.pretty(Duration.ofMillis(millis))).isEqualTo(expected);
  }
}
