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
package com.rabbitmq.reliable.impl;

import static com.rabbitmq.reliable.Resource.State.CLOSED;
import static com.rabbitmq.reliable.Resource.State.CLOSING;
import static com.rabbitmq.reliable.Resource.State.OPEN;
import static com.rabbitmq.reliable.Resource.State.OPENING;

import com.rabbitmq.reliable.ConsumptionException;
import com.rabbitmq.reliable.Resource;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lifecycle of an engine: state transitions, open checks and listener notification.
 *
 * <p>Listeners are called on the thread that changes the state, in registration order. A failing
 * listener does not prevent the transition nor the other listeners from being called.
 */
abstract class ResourceBase implements Resource {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResourceBase.class);

  private final AtomicReference<State> state = new AtomicReference<>();
  private final List<StateListener> listeners;
  private volatile Throwable closeReason;

  ResourceBase(List<StateListener> listeners) {
    this.listeners = new CopyOnWriteArrayList<>(listeners);
    this.state(OPENING);
  }

  protected void checkOpen() {
    State state = this.state.get();
    if (state == CLOSING || state == CLOSED) {
      throw new ConsumptionException.ConsumptionClosedException("Engine is closed");
    } else if (state != OPEN) {
      throw new ConsumptionException.ConsumptionInvalidStateException(
          "Engine is not open, current state is %s", state.name());
    }
  }

  protected State state() {
    return this.state.get();
  }

  protected void state(State state) {
    this.state(state, null);
  }

  protected void state(State state, Throwable failureCause) {
    State previousState = this.state.getAndSet(state);
    if (state != previousState) {
      if ((state == CLOSING || state == CLOSED) && this.closeReason == null) {
        this.closeReason = failureCause;
      }
      notifyListeners(new StateChange(this, failureCause, previousState, state));
    }
  }

  protected Throwable closeReason() {
    return this.closeReason;
  }

  private void notifyListeners(StateChange change) {
    for (StateListener listener : this.listeners) {
      try {
        listener.handle(change);
      } catch (Exception e) {
        LOGGER.warn(
            "Error in engine state listener ({} -> {})",
            change.previousState,
            change.currentState,
            e);
      }
    }
  }

  private static final class StateChange implements Context {

    private final Resource resource;
    private final Throwable failureCause;
    private final State previousState;
    private final State currentState;

    private StateChange(
        Resource resource, Throwable failureCause, State previousState, State currentState) {
      this.resource = resource;
      this.failureCause = failureCause;
      this.previousState = previousState;
      this.currentState = currentState;
    }

    @Override
    public Resource resource() {
      return this.resource;
    }

    @Override
    public Throwable failureCause() {
      return this.failureCause;
    }

    @Override
    public State previousState() {
      return this.previousState;
    }

    @Override
    public State currentState() {
      return this.currentState;
    }
  }
}
