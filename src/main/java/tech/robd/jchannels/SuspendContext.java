/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/SuspendContext.java
 description: Explicit suspending execution context: cancellation, delay, and child
              launch/async inheriting the parent's cancellation.
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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jchannels.diagnostics.Diagnostics;
import tech.robd.jchannels.fn.JCoroutineHandle;
import tech.robd.jchannels.internal.JCoroutineHandleImpl;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;

/**
 * Explicit context passed to every suspending operation.
 * <p>
 * Channel, select and mutex operations take the caller's {@code SuspendContext} as their
 * first argument. They check its {@link CancellationToken} before doing anything, and a
 * suspension honours cancellation for as long as it lasts.
 * </p>
 *
 * <pre>{@code
 * Coroutines.runBlocking(s -> {
 *     Channel<String> ch = new Channel<>(1);
 *     s.launch(c -> ch.send(c, "ping"));
 *     return ch.receive(s);
 * });
 * }</pre>
 */
public final class SuspendContext {

    private static final Diagnostics DIAG = Diagnostics.of(SuspendContext.class);
    public static final String COROUTINE_WAS_CANCELLED = "Coroutine was cancelled";

    private final @NonNull CancellationToken cancellationToken;
    private final @NonNull JCoroutineScope scope;

    private SuspendContext(@NonNull JCoroutineScope scope, @NonNull CancellationToken token) {
        this.scope = scope;
        this.cancellationToken = token;
    }

    // 🧩 Section: factories

    public static @NonNull SuspendContext create(@NonNull JCoroutineScope scope, @NonNull CancellationToken token) {
        if (scope == null || token == null) throw new IllegalArgumentException("Scope and token cannot be null");
        return new SuspendContext(scope, token);
    }
    // [/🧩 Section: factories]

    // 🧩 Section: cancellation

    /**
     * @throws CancellationException if this context has been cancelled
     */
    public void checkCancellation() {
        if (cancellationToken.isCancelled()) {
            throw new CancellationException(COROUTINE_WAS_CANCELLED);
        }
    }

    public boolean isCancelled() {
        return cancellationToken.isCancelled();
    }

    public @NonNull CancellationToken getCancellationToken() {
        return cancellationToken;
    }
    // [/🧩 Section: cancellation]

    // 🧩 Section: timing

    /**
     * Sleep for {@code millis}; cancellation or interruption ends the sleep early with
     * {@link CancellationException}.
     */
    public void delay(long millis) {
        checkCancellation();
        Thread current = Thread.currentThread();
        AutoCloseable reg = cancellationToken.onCancel(current::interrupt);
        try {
            long remaining = Math.max(0L, millis);
            final long SLICE_MS = 10L;
            while (remaining > 0L) {
                checkCancellation();
                long sleep = Math.min(SLICE_MS, remaining);
                try {
                    Thread.sleep(sleep);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Interrupted during delay");
                }
                remaining -= sleep;
            }
        } finally {
            closeQuietly(reg);
        }
    }
    // [/🧩 Section: timing]

    // 🧩 Section: children

    /**
     * Start {@code block} as a child coroutine on this context's scope. The child is
     * cancelled with this context.
     */
    public <T extends @Nullable Object> @NonNull JCoroutineHandle<T> async(@NonNull SuspendFunction<T> block) {
        if (block == null) throw new IllegalArgumentException("Block cannot be null");
        checkCancellation();

        CancellationToken childToken = cancellationToken.child();
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(() -> {
                try {
                    return block.apply(SuspendContext.create(scope, childToken));
                } catch (RuntimeException re) {
                    throw re;
                } catch (Exception e) {
                    throw new CompletionException(e);
                }
            }, scope.executor());
        } catch (RejectedExecutionException rex) {
            DIAG.warn("async rejected: scope {} no longer accepts work", scope);
            future = CompletableFuture.failedFuture(new CancellationException("Scope rejected child coroutine"));
            childToken.cancel();
        }
        return new JCoroutineHandleImpl<>(future, childToken);
    }

    /**
     * Fire-and-forget child coroutine; failures other than cancellation are logged and
     * complete the returned handle exceptionally.
     */
    public @NonNull JCoroutineHandle<Void> launch(@NonNull SuspendRunnable block) {
        if (block == null) throw new IllegalArgumentException("Block cannot be null");
        JCoroutineHandle<Void> handle = async(s -> {
            block.run(s);
            return null;
        });
        handle.result().whenComplete((r, t) -> {
            if (t == null) return;
            Throwable cause = t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
            if (cause instanceof CancellationException) {
                DIAG.debug("launched coroutine cancelled: {}", cause.getMessage());
            } else {
                DIAG.error("Uncaught exception in launched coroutine: {}", cause.toString(), cause);
            }
        });
        return handle;
    }
    // [/🧩 Section: children]

    private static void closeQuietly(AutoCloseable reg) {
        try {
            reg.close();
        } catch (Exception e) {
            DIAG.debug("cancel hook close failed: {}", e.toString());
        }
    }

    @Override
    public String toString() {
        return "SuspendContext{" +
                "thread=" + Thread.currentThread().getName() +
                ", cancelled=" + cancellationToken.isCancelled() +
                ", scope=" + scope +
                '}';
    }
}
