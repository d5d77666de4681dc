/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/internal/CancellationTokenImpl.java
 description: Default CancellationToken: at-most-once callbacks, weakly referenced children,
              cascading cancel, and detach-on-completion so finished work is not retained.
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
import tech.robd.jchannels.diagnostics.Diagnostics;

import java.lang.ref.WeakReference;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

public final class CancellationTokenImpl implements CancellationToken {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(CancellationTokenImpl.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private final int tokId = System.identityHashCode(this);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean completed = new AtomicBoolean(false);
    private final ConcurrentLinkedQueue<Callback> callbacks = new ConcurrentLinkedQueue<>();

    // registration in the parent, closed once this token completes
    private volatile @Nullable AutoCloseable parentLink;
    // [/🧩 Section: state]

    // 🧩 Section: callback

    /**
     * Runs its action at most once, whether fired by cancel() or the registration race.
     */
    private static final class Callback {
        private final AtomicReference<@Nullable Runnable> action;

        Callback(Runnable action) {
            this.action = new AtomicReference<>(action);
        }

        void fire() {
            Runnable r = action.getAndSet(null);
            if (r != null) r.run();
        }

        void clear() {
            action.set(null);
        }
    }
    // [/🧩 Section: callback]

    // 🧩 Section: query
    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }
    // [/🧩 Section: query]

    // 🧩 Section: registration
    @Override
    public AutoCloseable onCancel(Runnable callback) {
        Objects.requireNonNull(callback, "Callback cannot be null");
        Callback cb = new Callback(callback);

        if (cancelled.get()) {
            safeFire(cb, "onCancel-immediate");
            return () -> {
            };
        }

        callbacks.offer(cb);

        // cancel() may have drained the queue between the check and the offer
        if (cancelled.get() && callbacks.remove(cb)) {
            DIAG.debug("tok#{} onCancel: race -> run after registration", tokId);
            safeFire(cb, "onCancel-race");
        }

        return () -> {
            if (callbacks.remove(cb)) cb.clear();
        };
    }
    // [/🧩 Section: registration]

    // 🧩 Section: child
    @Override
    public CancellationToken child() {
        CancellationTokenImpl child = new CancellationTokenImpl();
        if (cancelled.get()) {
            child.cancel();
            return child;
        }

        WeakReference<CancellationTokenImpl> ref = new WeakReference<>(child);
        child.parentLink = onCancel(() -> {
            CancellationTokenImpl c = ref.get();
            if (c != null) {
                DIAG.debug("tok#{} cascading cancel to child tok#{}", tokId, c.tokId);
                c.cancel();
            }
        });
        DIAG.debug("tok#{} child tok#{} created", tokId, child.tokId);
        return child;
    }
    // [/🧩 Section: child]

    // 🧩 Section: cancel
    @Override
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        DIAG.debug("tok#{} cancel: firing {} callback(s)", tokId, callbacks.size());

        Callback cb;
        while ((cb = callbacks.poll()) != null) {
            safeFire(cb, "cancel");
        }
        markCompleted();
        return true;
    }
    // [/🧩 Section: cancel]

    // 🧩 Section: completion

    /**
     * Detach from the parent and drop pending callbacks. Called when the owning
     * coroutine finishes, so long-lived parents do not accumulate dead children.
     */
    public void markCompleted() {
        if (!completed.compareAndSet(false, true)) return;

        AutoCloseable link = parentLink;
        parentLink = null;
        if (link != null) {
            try {
                link.close();
            } catch (Exception e) {
                DIAG.debug("tok#{} error detaching from parent: {}", tokId, e.toString());
            }
        }
        if (!cancelled.get()) {
            Callback cb;
            while ((cb = callbacks.poll()) != null) cb.clear();
        }
    }

    public int getPendingCallbackCount() {
        return callbacks.size();
    }
    // [/🧩 Section: completion]

    private void safeFire(Callback cb, String where) {
        try {
            cb.fire();
        } catch (Throwable t) {
            DIAG.error("tok#{} callback error @{}: {}", tokId, where, t.toString());
        }
    }

    @Override
    public String toString() {
        if (cancelled.get()) return "CancellationToken[CANCELLED]";
        return completed.get() ? "CancellationToken[COMPLETED]"
                : "CancellationToken[ACTIVE, callbacks=" + callbacks.size() + "]";
    }
}
