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

import java.time.Duration;

/**
 * Human-readable rendering of durations for diagnostic summaries.
 */
public final class Durations {

  private Durations() {
  }

  /**
   * Renders a duration with its two most significant units, e.g. {@code 1h 5m}, {@code 12s}, {@code 250ms}.
   * Negative durations are prefixed with a minus sign.
   *
   * @param duration the duration; never {@code null}
   * @return the rendering
   */
  public static String pretty(Duration duration) {
    if (duration.isNegative()) return "-" + pretty(duration.negated());

    var days = duration.toDays();
    var hours = duration.toHoursPart();
    var minutes = duration.toMinutesPart();
    var seconds = duration.toSecondsPart();

    if (days > 0) return days + "d " + hours + "h";
    if (hours > 0) return hours + "h " + minutes + "m";
    if (minutes > 0) return minutes + "m " + seconds + "s";
    if (seconds > 0) return seconds + "s";
    return duration.toMillisPart() + "ms";
  }
}
