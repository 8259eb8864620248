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
package fr.aneo.armonik.scheduling.domain;

import java.util.function.Consumer;

/**
 * Publish/subscribe notification bus the scheduling subsystem depends on.
 * <p>
 * Daemons subscribe to {@link Topics#WAKE_DAEMONS} and {@link Topics#SHUTDOWN}; jobs and periodic workers
 * may also subscribe to application-specific topics to be woken early. Handlers must be short and must
 * not block: they typically only set a wake flag.
 * </p>
 */
public interface EventBus {

  /**
   * Delivers a payload to every handler currently subscribed to {@code topic}.
   *
   * @param topic   the topic name; never {@code null}
   * @param payload an optional payload; may be {@code null}
   */
  void publish(String topic, Object payload);

  /**
   * Delivers a topic with no payload.
   *
   * @param topic the topic name; never {@code null}
   */
  default void publish(String topic) {
    publish(topic, null);
  }

  /**
   * Registers a handler for a topic.
   *
   * @param topic   the topic name; never {@code null}
   * @param handler the handler, called with the published payload; never {@code null}
   * @return a subscription that removes the handler when closed
   */
  Subscription subscribe(String topic, Consumer<Object> handler);
}
