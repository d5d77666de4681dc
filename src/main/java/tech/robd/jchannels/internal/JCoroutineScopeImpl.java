/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/internal/JCoroutineScopeImpl.java
 description: Default JCoroutineScope. Runs coroutines on a cached pool of named daemon
              threads with CancellationToken-based structured cancellation.
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

import org.jspecify.annotations.Nullable;
import tech.robd.jchannels.CancellationToken;
import tech.robd.jchannels.JCoroutineScope;
import tech.robd.jchannels.SuspendContext;
import tech.robd.jchannels.SuspendFunction;
import tech.robd.jchannels.SuspendRunnable;
import tech.robd.jchannels.diagnostics.Diagnostics;
import tech.robd.jchannels.fn.JCoroutineHandle;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scope backed by {@link Executors#newCachedThreadPool(ThreadFactory)}.
 *
 * <p>Channel, select and mutex suspension parks the worker thread, so the pool is unbounded:
 * a fixed pool would deadlock once every worker waits on a counterpart that cannot be
 * scheduled. Workers are daemon threads named {@code <scope>-worker-<n>}.</p>
 *
 * <p>Cancellation is event-driven: every coroutine gets a child of the scope token and
 * {@link #close()} cancels the root, which wakes suspended coroutines through their
 * interrupt hooks.</p>
 */
public final class JCoroutineScopeImpl implements JCoroutineScope {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(JCoroutineScopeImpl.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private static final AtomicInteger COUNTER = new AtomicInteger();

    private final ExecutorService executor;
    private final CancellationToken scopeToken;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final String name;
    private final int scopeId = System.identityHashCode(this);
    // [/🧩 Section: state]

    // 🧩 Section: construction
    public JCoroutineScopeImpl() {
        this("jc-scope-" + COUNTER.incrementAndGet());
    }

    public JCoroutineScopeImpl(@Nullable String name) {
        this.name = Objects.requireNonNullElse(name, "jc-scope");
        this.executor = Executors.newCachedThreadPool(workerFactory(this.name));
        this.scopeToken = new CancellationTokenImpl();
        DIAG.debug("scope#{} created name={}", scopeId, this.name);
    }

    private static ThreadFactory workerFactory(String scopeName) {
        AtomicInteger workers = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, scopeName + "-worker-" + workers.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
    // [/🧩 Section: construction]

    // 🧩 Section: async-launch
    @Override
    public <T extends @Nullable Object> JCoroutineHandle<T> async(SuspendFunction<T> block) {
        if (block == null) throw new IllegalArgumentException("block is null");
        if (closed.get()) {
            DIAG.warn("scope#{} rejected async: CLOSED", scopeId);
            return cancelledHandle("Scope is closed");
        }
        // the root context of the scope; async() on it creates the per-coroutine child token
        return SuspendContext.create(this, scopeToken).async(block);
    }

    @Override
    public JCoroutineHandle<Void> launch(SuspendRunnable block) {
        if (block == null) throw new IllegalArgumentException("block is null");
        if (closed.get()) {
            DIAG.warn("scope#{} rejected launch: CLOSED", scopeId);
            return cancelledHandle("Scope is closed");
        }
        return SuspendContext.create(this, scopeToken).launch(block);
    }
    // [/🧩 Section: async-launch]

    // 🧩 Section: runBlocking
    @Override
    public <T extends @Nullable Object> T runBlocking(SuspendFunction<T> block) {
        if (block == null) throw new IllegalArgumentException("block == null");
        if (closed.get()) throw new IllegalStateException("Scope is closed");

        final CancellationToken child = scopeToken.child();
        final SuspendContext s = SuspendContext.create(this, child);
        DIAG.debug("scope#{} runBlocking on {}", scopeId, Thread.currentThread().getName());
        try {
            return block.apply(s);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted");
        } catch (RuntimeException re) {
            throw re;
        } catch (Exception e) {
            throw new RuntimeException(e);
        } finally {
            if (child instanceof CancellationTokenImpl impl) impl.markCompleted();
        }
    }
    // [/🧩 Section: runBlocking]

    // 🧩 Section: lifecycle
    @Override
    public Executor executor() {
        return executor;
    }

    private <T> JCoroutineHandle<T> cancelledHandle(String reason) {
        CancellationToken token = new CancellationTokenImpl();
        token.cancel();
        CompletableFuture<T> cf = CompletableFuture.failedFuture(new CancellationException(reason));
        return new JCoroutineHandleImpl<>(cf, token);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            DIAG.debug("scope#{} closing -> cancel token & shutdown", scopeId);
            scopeToken.cancel();
            executor.shutdownNow();
        } else {
            DIAG.debug("scope#{} close() ignored (already closed)", scopeId);
        }
    }

    public String getName() {
        return name;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public String toString() {
        return "JCoroutineScope[" + name + " " + (closed.get() ? "CLOSED" : "OPEN") + "]";
    }
    // [/🧩 Section: lifecycle]
}
