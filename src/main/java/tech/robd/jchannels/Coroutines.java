/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/Coroutines.java
 description: Static entry points: a global scope, runBlocking, async/launch and shutdown.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
 [/File Info]
*/

/*
 * Copyright (c) 2025 Rob Deas Ltd.
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

package tech.robd.jchannels;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jchannels.fn.JCoroutineHandle;
import tech.robd.jchannels.internal.JCoroutineScopeImpl;

/**
 * Static convenience API for running coroutines from plain Java.
 *
 * <ul>
 *   <li>{@link #runBlocking(SuspendFunction)}: run a block on the caller's thread inside a
 *       fresh scope; children still running when the block returns are cancelled.</li>
 *   <li>{@link #async(SuspendFunction)} / {@link #launch(SuspendRunnable)}: start work on
 *       the shared global scope.</li>
 *   <li>{@link #shutdown()}: cancel whatever still runs on the global scope.</li>
 * </ul>
 */
public final class Coroutines {

    // [🧩 Section: global-scope]
    private static final JCoroutineScope GLOBAL_SCOPE = new JCoroutineScopeImpl("global");
    // [/🧩 Section: global-scope]

    private Coroutines() {
    }

    // [🧩 Section: factories]

    /**
     * New root scope owned by the caller. Close it to cancel its coroutines.
     */
    public static @NonNull JCoroutineScope newScope() {
        return new JCoroutineScopeImpl();
    }

    public static @NonNull JCoroutineScope newScope(@NonNull String name) {
        return new JCoroutineScopeImpl(name);
    }
    // [/🧩 Section: factories]

    // [🧩 Section: runBlocking]

    /**
     * Run a suspend block on the calling thread and return its result.
     */
    public static <T extends @Nullable Object> T runBlocking(@NonNull SuspendFunction<T> block) {
        if (block == null) throw new IllegalArgumentException("Block cannot be null");
        try (JCoroutineScope scope = new JCoroutineScopeImpl()) {
            return scope.runBlocking(block);
        }
    }
    // [/🧩 Section: runBlocking]

    // [🧩 Section: async-launch]
    public static <T extends @Nullable Object> @NonNull JCoroutineHandle<T> async(@NonNull SuspendFunction<T> block) {
        if (block == null) throw new IllegalArgumentException("Block cannot be null");
        return GLOBAL_SCOPE.async(block);
    }

    public static @NonNull JCoroutineHandle<Void> launch(@NonNull SuspendRunnable block) {
        if (block == null) throw new IllegalArgumentException("Block cannot be null");
        return GLOBAL_SCOPE.launch(block);
    }
    // [/🧩 Section: async-launch]

    // [🧩 Section: shutdown]

    /**
     * Cancel everything on the global scope. Coroutines suspended on channels withdraw with
     * {@link java.util.concurrent.CancellationException}. Afterwards the global scope rejects
     * new work.
     */
    public static void shutdown() {
        GLOBAL_SCOPE.close();
    }
    // [/🧩 Section: shutdown]
}
