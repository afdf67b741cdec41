// Copyright (c) 2025 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// This software, the RabbitMQ Reliable Messaging Java client library, is dual-licensed under the
// Mozilla Public License 2.0 ("MPL"), and the Apache License version 2 ("ASL").
// For the MPL, please see LICENSE-MPL-RabbitMQ. For the ASL,
// please see LICENSE-APACHE2.
//
// This software is distributed on an "AS IS" basis, WITHOUT WARRANTY OF ANY KIND,
// either express or implied. See the LICENSE file for specific language governing
// rights and limitations of this software.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.rabbitmq.reliable.impl;

import static com.rabbitmq.reliable.Resource.State.OPENING;

import com.rabbitmq.reliable.Resource;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

abstract class ResourceBase implements Resource {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResourceBase.class);

  private final AtomicReference<State> state = new AtomicReference<>();
  private final List<StateListener> listeners;

  ResourceBase(List<StateListener> listeners) {
    this.listeners = List.copyOf(listeners);
    this.state.set(OPENING);
  }

  /** Notify listeners of the initial state, once the subclass is fully constructed. */
  protected void opening() {
    if (this.state.get() == OPENING) {
      this.dispatch(null, OPENING);
    }
  }

  protected State state() {
    return this.state.get();
  }

  protected void state(State state) {
    State previousState = this.state.getAndSet(state);
    if (state != previousState) {
      this.dispatch(previousState, state);
    }
  }

  /**
   * Move to a new state only if the resource is in the expected one.
   *
   * @return true if the transition happened
   */
  protected boolean transition(State expected, State state) {
    if (this.state.compareAndSet(expected, state)) {
      this.dispatch(expected, state);
      return true;
    } else {
      return false;
    }
  }

  private void dispatch(State previous, State current) {
    if (this.listeners.isEmpty()) {
      return;
    }
    Context context = new StateChange(this, previous, current);
    for (StateListener listener : this.listeners) {
      try {
        listener.handle(context);
      } catch (Exception e) {
        LOGGER.warn("Error in state listener ({} -> {})", previous, current, e);
      }
    }
  }

  private static final class StateChange implements Context {

    private final Resource resource;
    private final State previousState;
    private final State currentState;

    private StateChange(Resource resource, State previousState, State currentState) {
      this.resource = resource;
      this.previousState = previousState;
      this.currentState = currentState;
    }

    @Override
    public Resource resource() {
      return this.resource;
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
