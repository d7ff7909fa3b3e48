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
package fr.aneo.imagepublisher.client.internal.concurrent;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * Shared scheduler used for retry backoff delays and operation polling intervals.
 * <p>
 * A single daemon thread is enough: scheduled tasks only start the next asynchronous attempt or
 * probe and never block. Canceled tasks are removed immediately so that abandoned waits do not
 * accumulate in the queue.
 * <p>
 * A JVM shutdown hook shuts the scheduler down when the application terminates.
 */
public final class Schedulers {

  private static final ScheduledThreadPoolExecutor SHARED;

  private Schedulers() {
  }

  static {
    SHARED = new ScheduledThreadPoolExecutor(
      1,
      r -> {
        Thread t = new Thread(r, "image-publisher-scheduler");
        t.setDaemon(true);
        return t;
      }
    );
    SHARED.setRemoveOnCancelPolicy(true);
    SHARED.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);

    Runtime.getRuntime().addShutdownHook(new Thread(SHARED::shutdown, "image-publisher-scheduler-shutdown"));
  }

  /**
   * Returns the shared scheduler. Callers must not shut it down.
   *
   * @return the shared scheduled executor service
   */
  public static ScheduledExecutorService shared() {
    return SHARED;
  }
}
