/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/internal/JCoroutineHandleImpl.java
 description: Default JCoroutineHandle. Ties a CompletableFuture to a CancellationToken in both
              directions and unwraps failures on join().
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

import tech.robd.jchannels.CancellationToken;
import tech.robd.jchannels.diagnostics.Diagnostics;
import tech.robd.jchannels.fn.JCoroutineHandle;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * {@link JCoroutineHandle} over a {@link CompletableFuture} and the coroutine's
 * {@link CancellationToken}. {@link #cancel()} cancels the token, which the running body
 * observes at its next suspend point; a finished future marks the token completed.
 *
 * @param <T> result type of the coroutine
 */
public final class JCoroutineHandleImpl<T> implements JCoroutineHandle<T> {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(JCoroutineHandleImpl.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private final int handleId = System.identityHashCode(this);
    private final CompletableFuture<T> future;
    private final CancellationToken cancellationToken;
    // [/🧩 Section: state]

    // 🧩 Section: construction
    public JCoroutineHandleImpl(CompletableFuture<T> future, CancellationToken cancellationToken) {
        if (future == null) throw new IllegalArgumentException("Future cannot be null");
        if (cancellationToken == null) throw new IllegalArgumentException("CancellationToken cannot be null");
        this.future = future;
        this.cancellationToken = cancellationToken;

        // 🧩 Point: construction/future→token
        future.whenComplete((result, throwable) -> {
            if (future.isCancelled()) {
                DIAG.debug("hdl#{} completed: CANCELLED", handleId);
                cancellationToken.cancel();
            } else {
                DIAG.debug("hdl#{} completed: {}", handleId, throwable == null ? "OK" : "EX " + throwable.getClass().getSimpleName());
                if (cancellationToken instanceof CancellationTokenImpl impl) impl.markCompleted();
            }
        });
    }
    // [/🧩 Section: construction]

    // 🧩 Section: API
    @Override
    public boolean cancel() {
        boolean first = !cancellationToken.isCancelled() && !future.isDone();
        DIAG.debug("hdl#{} cancel() requested (first={})", handleId, first);
        try {
            cancellationToken.cancel();
        } catch (Throwable t) {
            // never let cancel() throw out to callers
            DIAG.error("hdl#{} cancel() propagation failed: {}", handleId, t.toString());
        }
        return first;
    }

    @Override
    public boolean isActive() {
        return !future.isDone() && !cancellationToken.isCancelled();
    }

    @Override
    public boolean isCompleted() {
        return future.isDone();
    }

    @Override
    public CompletableFuture<T> result() {
        return future;
    }

    @Override
    public T join() throws Exception {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) throw ex;
            if (cause instanceof Error err) throw err;
            throw new RuntimeException("Unexpected throwable", cause);
        }
    }
    // [/🧩 Section: API]

    @Override
    public String toString() {
        String status;
        if (isCompleted()) {
            status = future.isCancelled() ? "CANCELLED" :
                    future.isCompletedExceptionally() ? "FAILED" : "COMPLETED";
        } else {
            status = cancellationToken.isCancelled() ? "CANCELLING" : "ACTIVE";
        }
        return "JCoroutineHandle[" + status + "]";
    }
}
