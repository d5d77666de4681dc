/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/internal/Continuation.java
 description: One-shot resumption handle a suspended coroutine parks on until a counterpart resumes it.
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

package tech.robd.jchannels.internal;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jchannels.BrokenInvariantError;
import tech.robd.jchannels.SuspendContext;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.BooleanSupplier;

/**
 * Suspension point of one coroutine.
 *
 * <p>The owner calls {@link #await(SuspendContext, BooleanSupplier)} after registering its
 * waiter; a counterpart calls {@link #resume(Object)} or {@link #resumeWithException(Throwable)}
 * exactly once, outside any channel lock. Resuming twice is a {@link BrokenInvariantError}.</p>
 *
 * @param <T> value delivered on resumption
 */
public final class Continuation<T extends @Nullable Object> {

    private final CompletableFuture<T> future = new CompletableFuture<>();

    // 🧩 Section: resume
    public void resume(T value) {
        if (!future.complete(value)) {
            throw new BrokenInvariantError("continuation resumed twice");
        }
    }

    public void resumeWithException(@NonNull Throwable error) {
        if (!future.completeExceptionally(error)) {
            throw new BrokenInvariantError("continuation resumed twice");
        }
    }
    // [/🧩 Section: resume]

    // 🧩 Section: await

    /**
     * Park until resumed.
     *
     * <p>Cancellation of {@code s} interrupts the parked thread. The owner then gets one chance
     * to take its waiter back: {@code withdraw} runs under the owner's lock and returns
     * {@code true} when the waiter was still pending and is now gone, in which case the
     * suspension ends with {@link CancellationException}. A {@code false} means a counterpart
     * already committed to this continuation, so the delivered outcome is awaited and
     * returned instead of being lost.</p>
     *
     * @param s        context whose token can cancel the wait
     * @param withdraw unlinks the waiter if it is still pending
     * @return the delivered value
     */
    public T await(@NonNull SuspendContext s, @NonNull BooleanSupplier withdraw) {
        Thread current = Thread.currentThread();
        AutoCloseable reg = s.getCancellationToken().onCancel(current::interrupt);
        boolean delivered = false;
        try {
            try {
                T value = future.get();
                delivered = true;
                return value;
            } catch (InterruptedException ie) {
                if (withdraw.getAsBoolean()) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException(SuspendContext.COROUTINE_WAS_CANCELLED);
                }
                Thread.currentThread().interrupt();
                return future.join();
            }
        } catch (ExecutionException | CompletionException e) {
            throw rethrow(e.getCause() != null ? e.getCause() : e);
        } finally {
            try {
                reg.close();
            } catch (Exception e) {
                // registration handles of CancellationTokenImpl never throw
                throw new IllegalStateException(e);
            }
            // the cancel hook may fire between get() and close()
            if (delivered && !s.isCancelled()) Thread.interrupted();
        }
    }
    // [/🧩 Section: await]

    private static RuntimeException rethrow(Throwable t) {
        if (t instanceof RuntimeException re) return re;
        if (t instanceof Error err) throw err;
        return new CompletionException(t);
    }
}
