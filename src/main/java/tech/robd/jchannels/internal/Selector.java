/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/internal/Selector.java
 description: Shared state of one select call: a one-shot resolved flag and the selecting coroutine's continuation.
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
import tech.robd.jchannels.SuspendContext;
import tech.robd.jchannels.diagnostics.Diagnostics;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Commit point of a select.
 *
 * <p>Cases of one selector may sit in the wait queues of several channels, each guarded by
 * its own lock. Whoever wants to complete a case first wins {@link #tryResolve()}; every
 * other party then treats the selector's remaining cases as stale. The winner hands the
 * selecting coroutine an {@link Outcome} through {@link #resume(Outcome)}.</p>
 *
 * @param <R> result type of the select
 */
public final class Selector<R> {

    /**
     * Completed case, run by the selecting coroutine once it wakes.
     */
    @FunctionalInterface
    public interface Outcome<R> {
        R complete(@NonNull SuspendContext s) throws Exception;
    }

    private static final Diagnostics DIAG = Diagnostics.of(Selector.class);
    private static final AtomicLong COUNTER = new AtomicLong();

    private final long selId = COUNTER.incrementAndGet();
    private final AtomicBoolean resolved = new AtomicBoolean(false);
    private final Continuation<Outcome<R>> continuation = new Continuation<>();

    // 🧩 Section: resolution

    /**
     * One-shot CAS; {@code true} for exactly one caller over the selector's lifetime.
     */
    public boolean tryResolve() {
        boolean won = resolved.compareAndSet(false, true);
        if (won) DIAG.debug("sel#{} resolved by {}", selId, Thread.currentThread().getName());
        return won;
    }

    public boolean isResolved() {
        return resolved.get();
    }

    public void resume(@NonNull Outcome<R> winner) {
        continuation.resume(winner);
    }

    /**
     * Park the selecting coroutine until a case wins. Cancellation withdraws by resolving
     * the selector itself; if a case already won, its outcome is returned instead.
     */
    public @NonNull Outcome<R> await(@NonNull SuspendContext s) {
        return continuation.await(s, this::tryResolve);
    }
    // [/🧩 Section: resolution]

    @Override
    public String toString() {
        return "Selector#" + selId + (resolved.get() ? "(resolved)" : "(pending)");
    }
}
