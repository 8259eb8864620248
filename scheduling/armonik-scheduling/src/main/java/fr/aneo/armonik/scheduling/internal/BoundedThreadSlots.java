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

import fr.aneo.armonik.scheduling.domain.ThreadSlots;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * {@link ThreadSlots} backed by per-type counters with fixed maxima.
 * <p>
 * Slot types without a configured maximum are unbounded: acquiring them always succeeds.
 * </p>
 */
public final class BoundedThreadSlots implements ThreadSlots {
  private static final Logger logger = LoggerFactory.getLogger(BoundedThreadSlots.class);

  private final Map<String, Integer> maxima;
  private final Map<String, Integer> inUse = new HashMap<>();
  private final Object lock = new Object();

  /**
   * @param maxima maximum concurrent holders per slot type; every value must be positive
   */
  public BoundedThreadSlots(Map<String, Integer> maxima) {
    requireNonNull(maxima, "maxima must not be null");
    maxima.forEach((type, max) -> {
      if (max == null || max <= 0) {
        throw new IllegalArgumentException("Maximum of slot type '" + type + "' must be > 0, got: " + max);
      }
    });
    this.maxima = Map.copyOf(maxima);
  }

  /**
   * @return slots with no bounded type
   */
  public static BoundedThreadSlots unbounded() {
    return new BoundedThreadSlots(Map.of());
  }

  @Override
  public boolean acquire(String slotType) {
    requireNonNull(slotType, "slotType must not be null");

    var max = maxima.get(slotType);
    if (max == null) return true;

    synchronized (lock) {
      var current = inUse.getOrDefault(slotType, 0);
      if (current >= max) {
        logger.debug("No free '{}' slot ({}/{})", slotType, current, max);
        return false;
      }
      inUse.put(slotType, current + 1);
      return true;
    }
  }

  @Override
  public void release(String slotType) {
    requireNonNull(slotType, "slotType must not be null");
    if (!maxima.containsKey(slotType)) return;

    synchronized (lock) {
      var current = inUse.getOrDefault(slotType, 0);
      if (current <= 0) {
        logger.warn("Released '{}' slot that was not held", slotType);
        return;
      }
      inUse.put(slotType, current - 1);
    }
  }

  public int inUse(String slotType) {
    synchronized (lock) {
      return inUse.getOrDefault(slotType, 0);
    }
  }
}
