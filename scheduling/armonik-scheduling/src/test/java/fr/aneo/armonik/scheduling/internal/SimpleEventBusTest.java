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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SimpleEventBusTest {

  private SimpleEventBus eventBus;

  @BeforeEach
  void setUp() {
    eventBus = new SimpleEventBus();
  }

  @Test
  @DisplayName("publish should deliver the payload to every subscriber of the topic")
  void publish_should_deliver_the_payload_to_every_subscriber_of_the_topic() {
    // Given
    List<Object> first = new ArrayList<>();
    List<Object> second = new ArrayList<>();
    List<Object> other = new ArrayList<>();
    eventBus.subscribe("files_changed", first::add);
    eventBus.subscribe("files_changed", second::add);
    eventBus.subscribe("shutdown", other::add);

    // When
    eventBus.publish("files_changed", "payload");

    // Then
    assertThat(first).containsExactly("payload");
    assertThat(second).containsExactly("payload");
    assertThat(other).isEmpty();
  }

  @Test
  @DisplayName("failing handler should not prevent delivery to the others")
  void failing_handler_should_not_prevent_delivery_to_the_others() {
    // Given
    List<Object> received = new ArrayList<>();
    eventBus.subscribe("wake_daemons", payload -> {
      throw new IllegalStateException("broken handler");
    });
    eventBus.subscribe("wake_daemons", received::add);

    // When
    eventBus.publish("wake_daemons");

    // Then
    assertThat(received).hasSize(1);
  }

  @Test
  @DisplayName("closed subscription should stop delivery and closing twice should be harmless")
  void closed_subscription_should_stop_delivery_and_closing_twice_should_be_harmless() {
    // Given
    List<Object> received = new ArrayList<>();
    var subscription = eventBus.subscribe("files_changed", received::add);

    // When
    subscription.close();
    subscription.close();
    eventBus.publish("files_changed", 1);

    // Then
    assertThat(received).isEmpty();
    assertThat(eventBus.subscriberCount("files_changed")).isZero();
  }

  @Test
  @DisplayName("publish without subscribers should do nothing")
  void publish_without_subscribers_should_do_nothing() {
    eventBus.publish("nobody_listens", new Object());

    assertThat(eventBus.subscriberCount("nobody_listens")).isZero();
  }
}
