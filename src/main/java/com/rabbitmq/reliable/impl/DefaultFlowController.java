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

import static com.rabbitmq.reliable.impl.Assert.atLeastOne;
import static com.rabbitmq.reliable.impl.Assert.notNull;

import com.rabbitmq.reliable.ConsumptionException;
import com.rabbitmq.reliable.FlowController;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link FlowController} with a counter guarded by a lock.
 *
 * <p>Invariant: <code>0 &lt;= inFlight &lt;= maxInFlight</code> and <code>inFlight</code> is the
 * number of permits acquired and not released yet.
 */
final class DefaultFlowController implements FlowController {

  private final int maxInFlight;
  private final Lock lock = new ReentrantLock();
  private final Condition budgetAvailable = lock.newCondition();
  private final Condition drained = lock.newCondition();
  private final AtomicLong permitSequence = new AtomicLong(0);
  private int inFlight = 0;
  private boolean closed = false;

  DefaultFlowController(int maxInFlight) {
    this.maxInFlight = atLeastOne(maxInFlight, "Max in-flight");
  }

  @Override
  public Permit acquire() throws InterruptedException {
    this.lock.lockInterruptibly();
    try {
      while (true) {
        checkNotClosed();
        if (this.inFlight < this.maxInFlight) {
          return newPermit();
        }
        this.budgetAvailable.await();
      }
    } finally {
      this.lock.unlock();
    }
  }

  @Override
  public Permit tryAcquire(Duration timeout) throws InterruptedException {
    notNull(timeout, "Timeout cannot be null");
    long remaining = timeout.toNanos();
    this.lock.lockInterruptibly();
    try {
      while (true) {
        checkNotClosed();
        if (this.inFlight < this.maxInFlight) {
          return newPermit();
        }
        if (remaining <= 0) {
          return null;
        }
        remaining = this.budgetAvailable.awaitNanos(remaining);
      }
    } finally {
      this.lock.unlock();
    }
  }

  @Override
  public void release(Permit permit) {
    notNull(permit, "Permit cannot be null");
    if (!(permit instanceof DefaultPermit) || ((DefaultPermit) permit).owner != this) {
      throw new IllegalArgumentException("Permit does not belong to this flow controller");
    }
    DefaultPermit p = (DefaultPermit) permit;
    if (!p.released.compareAndSet(false, true)) {
      throw new IllegalStateException("Permit " + p.id + " has already been released");
    }
    this.lock.lock();
    try {
      this.inFlight--;
      this.budgetAvailable.signal();
      if (this.inFlight == 0) {
        this.drained.signalAll();
      }
    } finally {
      this.lock.unlock();
    }
  }

  @Override
  public int inFlight() {
    this.lock.lock();
    try {
      return this.inFlight;
    } finally {
      this.lock.unlock();
    }
  }

  @Override
  public int maxInFlight() {
    return this.maxInFlight;
  }

  @Override
  public boolean awaitDrained(Duration timeout) throws InterruptedException {
    notNull(timeout, "Timeout cannot be null");
    long remaining = timeout.toNanos();
    this.lock.lockInterruptibly();
    try {
      while (this.inFlight > 0) {
        if (remaining <= 0) {
          return false;
        }
        remaining = this.drained.awaitNanos(remaining);
      }
      return true;
    } finally {
      this.lock.unlock();
    }
  }

  @Override
  public void close() {
    this.lock.lock();
    try {
      this.closed = true;
      // wakes up waiters so that they fail
      this.budgetAvailable.signalAll();
    } finally {
      this.lock.unlock();
    }
  }

  boolean isClosed() {
    this.lock.lock();
    try {
      return this.closed;
    } finally {
      this.lock.unlock();
    }
  }

  // must be called with the lock held
  private void checkNotClosed() {
    if (this.closed) {
      throw new ConsumptionException.ConsumptionClosedException("Flow controller is closed");
    }
  }

  // must be called with the lock held
  private Permit newPermit() {
    this.inFlight++;
    return new DefaultPermit(this, this.permitSequence.getAndIncrement());
  }

  @Override
  public String toString() {
    return "DefaultFlowController{" + "maxInFlight=" + maxInFlight + '}';
  }

  private static final class DefaultPermit implements Permit {

    private final DefaultFlowController owner;
    private final long id;
    private final AtomicBoolean released = new AtomicBoolean(false);

    private DefaultPermit(DefaultFlowController owner, long id) {
      this.owner = owner;
      this.id = id;
    }

    @Override
    public long id() {
      return this.id;
    }

    @Override
    public String toString() {
      return "Permit{" + "id=" + id + '}';
    }
  }
}
