/*
 * Copyright 2026 The Solir Authors.
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

package com.solir.compiler;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A cooperative cancellation flag shared between a build and whoever requested it. Passes call
 * {@link #throwIfCancelled()} between units of work.
 */
public final class CancellationToken {
  private final AtomicBoolean cancelled = new AtomicBoolean();

  private CancellationToken() {}

  public static CancellationToken create() {
    return new CancellationToken();
  }

  /** Requests cancellation. Returns true if this call changed the state. */
  public boolean cancel() {
    return cancelled.compareAndSet(false, true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /** @throws BuildCancelledException if cancellation was requested */
  public void throwIfCancelled() {
    if (cancelled.get()) {
      throw new BuildCancelledException();
    }
  }
}
