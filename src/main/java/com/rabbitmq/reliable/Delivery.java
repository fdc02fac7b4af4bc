// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.rabbitmq.reliable;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inbound unit of work handed to a {@link ConsumptionEngine}.
 *
 * <p>The {@link #id()} identifies this very delivery for the transport, the {@link
 * #correlationKey()} identifies the underlying message. Several deliveries of a requeued message
 * share the same correlation key.
 *
 * <p>Instances are immutable.
 */
public final class Delivery {

  private final String id;
  private final String correlationKey;
  private final byte[] payload;
  private final boolean attemptHint;
  private final Map<String, String> properties;

  private Delivery(Builder builder) {
    this.id = builder.id;
    this.correlationKey = builder.correlationKey;
    this.payload = builder.payload == null ? new byte[0] : builder.payload.clone();
    this.attemptHint = builder.attemptHint;
    this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.properties));
  }

  /**
   * Create a delivery.
   *
   * @param id transport handle of the delivery
   * @param correlationKey business identity of the message
   * @param payload message body
   * @return the delivery
   */
  public static Delivery of(String id, String correlationKey, byte[] payload) {
    return builder().id(id).correlationKey(correlationKey).payload(payload).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Transport handle of the delivery.
   *
   * @return the delivery ID
   */
  public String id() {
    return this.id;
  }

  /**
   * Business identity of the message, used to count attempts across redeliveries.
   *
   * @return the correlation key
   */
  public String correlationKey() {
    return this.correlationKey;
  }

  /**
   * Copy of the message body.
   *
   * @return the payload
   */
  public byte[] payload() {
    return Arrays.copyOf(this.payload, this.payload.length);
  }

  /**
   * Whether the transport reports this delivery as a redelivery.
   *
   * <p>This is informational only, attempts are counted by the {@link RetryLedger}.
   *
   * @return true if the broker flagged the delivery as redelivered
   */
  public boolean attemptHint() {
    return this.attemptHint;
  }

  /**
   * Transport metadata of the delivery.
   *
   * @return read-only properties, never null
   */
  public Map<String, String> properties() {
    return this.properties;
  }

  @Override
  public String toString() {
    return "Delivery{"
        + "id='"
        + id
        + '\''
        + ", correlationKey='"
        + correlationKey
        + '\''
        + ", payloadSize="
        + payload.length
        + ", attemptHint="
        + attemptHint
        + '}';
  }

  /** Builder for {@link Delivery} instances. */
  public static final class Builder {

    private String id;
    private String correlationKey;
    private byte[] payload = new byte[0];
    private boolean attemptHint = false;
    private final Map<String, String> properties = new LinkedHashMap<>();

    private Builder() {}

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder correlationKey(String correlationKey) {
      this.correlationKey = correlationKey;
      return this;
    }

    public Builder payload(byte[] payload) {
      this.payload = payload == null ? new byte[0] : Arrays.copyOf(payload, payload.length);
      return this;
    }

    public Builder attemptHint(boolean attemptHint) {
      this.attemptHint = attemptHint;
      return this;
    }

    public Builder property(String key, String value) {
      this.properties.put(key, value);
      return this;
    }

    public Delivery build() {
      if (this.id == null) {
        throw new IllegalArgumentException("Delivery ID cannot be null");
      }
      if (this.correlationKey == null) {
        throw new IllegalArgumentException("Correlation key cannot be null");
      }
      return new Delivery(this);
    }
  }
}
