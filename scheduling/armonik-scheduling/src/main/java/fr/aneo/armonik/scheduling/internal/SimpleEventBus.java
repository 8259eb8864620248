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

import fr.aneo.armonik.scheduling.domain.EventBus;
import fr.aneo.armonik.scheduling.domain.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * In-process {@link EventBus} delivering synchronously on the publishing thread.
 * <p>
 * A failing handler is logged and skipped; the remaining handlers still receive the payload.
 * </p>
 */
public final class SimpleEventBus implements EventBus {
  private static final Logger logger = LoggerFactory.getLogger(SimpleEventBus.class);

  private final Map<String, List<Consumer<Object>>> handlers = new ConcurrentHashMap<>();

  @Override
  public void publish(String topic, Object payload) {
    requireNonNull(topic, "topic must not be null");

    var topicHandlers = handlers.get(topic);
    if (topicHandlers == null) return;

    logger.debug("Publishing '{}' to {} handlers", topic, topicHandlers.size());
    for (var handler : topicHandlers) {
      try {
        handler.accept(payload);
      } catch (RuntimeException e) {
        logger.error("Handler of topic '{}' failed", topic, e);
      }
    }
  }

  @Override
  public Subscription subscribe(String topic, Consumer<Object> handler) {
    requireNonNull(topic, "topic must not be null");
    requireNonNull(handler, "handler must not be null");

    var topicHandlers = handlers.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>());
    topicHandlers.add(handler);

    var closed = new AtomicBoolean();
    return () -> {
      if (closed.compareAndSet(false, true)) {
        topicHandlers.remove(handler);
      }
    };
  }

  public int subscriberCount(String topic) {
    var topicHandlers = handlers.get(topic);
    return topicHandlers == null ? 0 : topicHandlers.size();
  }
}
