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

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.function.Predicate;

abstract class ExceptionUtils {

  private ExceptionUtils() {}

  static String exceptionMessage(Throwable e) {
    if (e == null) {
      return "unknown";
    } else if (e.getMessage() == null) {
      return e.getClass().getSimpleName();
    } else {
      return e.getMessage() + " [" + e.getClass().getSimpleName() + "]";
    }
  }

  /**
   * Test the predicate on the exception and its causes.
   *
   * <p>Stops on cause cycles.
   */
  static boolean anyInCauseChain(Throwable e, Predicate<Throwable> predicate) {
    Set<Throwable> visited = Collections.newSetFromMap(new IdentityHashMap<>());
    Throwable current = e;
    while (current != null && visited.add(current)) {
      if (predicate.test(current)) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  static boolean isInterruption(Throwable e) {
    return anyInCauseChain(e, t -> t instanceof InterruptedException);
  }
}
