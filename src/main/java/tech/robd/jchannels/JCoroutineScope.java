/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/JCoroutineScope.java
 description: Scope that starts coroutines (units of work handed an explicit SuspendContext) on
              its executor and cancels them together on close().
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
 tags: [robokeytags,v1]
 [/File Info]
*/
/*
 * Copyright (c) 2025 Rob Deas Ltd.
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
package tech.robd.jchannels;

import org.jspecify.annotations.Nullable;
import tech.robd.jchannels.fn.JCoroutineHandle;

import java.util.concurrent.Executor;

/**
 * Owner of running coroutines.
 * <p>
 * A coroutine here is a {@link SuspendFunction} / {@link SuspendRunnable} running on the
 * scope's {@link Executor}. It suspends inside {@link Channel}, {@link Select} and
 * {@link Mutex} operations by parking its worker until a counterpart resumes it;
 * {@link #close()} cancels everything still running.
 *
 * <h2>Contract with the channel primitives</h2>
 * <ul>
 *   <li>Every started block gets its own child {@link CancellationToken}.</li>
 *   <li>A suspended block is resumed exactly once, never before its waiter is registered.</li>
 *   <li>The executor must not bound the number of concurrently suspended coroutines;
 *       a suspended coroutine holds its thread.</li>
 * </ul>
 *
 * @author Rob Deas
 * @since 0.1.0
 */
public interface JCoroutineScope extends AutoCloseable {

    // 🧩 Section: api

    /**
     * Start a coroutine producing a value.
     */
    <T extends @Nullable Object> JCoroutineHandle<T> async(SuspendFunction<T> block);

    /**
     * Start a coroutine for its side effects. Failures complete the handle exceptionally
     * and are logged.
     */
    JCoroutineHandle<Void> launch(SuspendRunnable block);

    /**
     * Run {@code block} on the calling thread inside this scope and return its result.
     * This is the bridge from plain blocking Java code.
     *
     * @throws java.util.concurrent.CancellationException if the scope closes meanwhile
     */
    <T extends @Nullable Object> T runBlocking(SuspendFunction<T> block);

    Executor executor();

    /**
     * Cancel every coroutine of this scope and release the executor. Idempotent.
     */
    @Override
    void close();

    // [/🧩 Section: api]
}
