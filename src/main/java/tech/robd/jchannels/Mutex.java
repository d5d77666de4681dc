/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/Mutex.java
 description: Cooperative non-reentrant mutex: CAS state word, register-then-retry slow path, ghost waiters skipped on unlock.
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
import tech.robd.jchannels.diagnostics.Diagnostics;
import tech.robd.jchannels.internal.Continuation;
import tech.robd.jchannels.internal.WaitQueue;

import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutual exclusion between coroutines. A coroutine that finds the mutex locked suspends
 * instead of spinning.
 *
 * <h2>State word</h2>
 * <ul>
 *   <li>{@code -1}: unlocked.</li>
 *   <li>{@code N >= 0}: locked, with {@code N} suspended waiters counted.</li>
 * </ul>
 * <p>
 * A contended {@link #lock(SuspendContext)} queues its waiter <em>before</em> counting itself.
 * If the mutex gets released in that window the waiter takes the lock directly and is left
 * behind as a ghost; {@link #unlock()} skips ghosts when picking the next owner.
 * </p>
 * <p>Not reentrant. {@link #unlock()} must be called by the owner; that is not checked.</p>
 *
 * @author Rob Deas
 * @since 0.1.0
 */
public final class Mutex {

    private static final Diagnostics DIAG = Diagnostics.of(Mutex.class);
    private static final AtomicLong COUNTER = new AtomicLong();

    // 🧩 Section: waiter
    private static final int WAITING = 0;
    private static final int RESUMED = 1;
    private static final int GHOST = 2;
    private static final int ABANDONED = 3;

    private static final class LockWaiter extends WaitQueue.Node {
        final AtomicInteger status = new AtomicInteger(WAITING);
        final Continuation<Boolean> continuation = new Continuation<>();
    }
    // [/🧩 Section: waiter]

    // 🧩 Section: state
    private final long mxId = COUNTER.incrementAndGet();
    private final AtomicInteger state = new AtomicInteger(-1);
    private final WaitQueue<LockWaiter> waiters = new WaitQueue<>();
    private final ReentrantLock queueLock = new ReentrantLock();
    private final AtomicLong retryAcquisitions = new AtomicLong();
    // [/🧩 Section: state]

    // 🧩 Section: lock

    /**
     * Acquire the mutex, suspending while another coroutine holds it.
     *
     * @throws java.util.concurrent.CancellationException if {@code s} is cancelled while
     *                                                    waiting; the mutex is then not held
     */
    public void lock(@NonNull SuspendContext s) {
        s.checkCancellation();
        if (state.compareAndSet(-1, 0)) {
            DIAG.debug("mx#{} lock fast path", mxId);
            return;
        }

        LockWaiter w = new LockWaiter();
        enqueue(w);
        for (; ; ) {
            int cur = state.get();
            if (cur == -1) {
                if (state.compareAndSet(-1, 0)) {
                    if (!w.status.compareAndSet(WAITING, GHOST)) {
                        throw new BrokenInvariantError("mx#" + mxId + " waiter resumed before it was counted");
                    }
                    removeGhost(w);
                    retryAcquisitions.incrementAndGet();
                    DIAG.debug("mx#{} lock acquired on retry", mxId);
                    return;
                }
            } else if (state.compareAndSet(cur, cur + 1)) {
                break;
            }
        }

        DIAG.debug("mx#{} lock -> suspend", mxId);
        w.continuation.await(s, () -> w.status.compareAndSet(WAITING, ABANDONED));
    }

    /**
     * Acquire only if free right now.
     */
    public boolean tryLock() {
        return state.compareAndSet(-1, 0);
    }
    // [/🧩 Section: lock]

    // 🧩 Section: unlock

    /**
     * Release the mutex, handing it to the oldest suspended waiter if there is one.
     *
     * @throws BrokenInvariantError if the mutex is not locked
     */
    public void unlock() {
        for (; ; ) {
            int cur = state.get();
            if (cur == 0) {
                if (state.compareAndSet(0, -1)) {
                    DIAG.debug("mx#{} unlocked", mxId);
                    return;
                }
            } else if (cur < 0) {
                throw new BrokenInvariantError("mx#" + mxId + " unlock while not locked");
            } else if (state.compareAndSet(cur, cur - 1)) {
                LockWaiter next = retrieveWaiter();
                if (next == null) {
                    throw new BrokenInvariantError("mx#" + mxId + " counted " + cur + " waiter(s) but found none");
                }
                if (next.status.compareAndSet(WAITING, RESUMED)) {
                    DIAG.debug("mx#{} unlock -> handoff", mxId);
                    next.continuation.resume(Boolean.TRUE);
                    return;
                }
                // cancelled while waiting: the lock is still ours to hand on
                DIAG.debug("mx#{} unlock skipped abandoned waiter", mxId);
            }
        }
    }
    // [/🧩 Section: unlock]

    // 🧩 Section: helpers

    /**
     * Run {@code action} while holding the mutex.
     */
    public <R extends @Nullable Object> R withLock(@NonNull SuspendContext s, @NonNull SuspendFunction<R> action) {
        lock(s);
        try {
            return action.apply(s);
        } catch (RuntimeException re) {
            throw re;
        } catch (Exception e) {
            throw new CompletionException(e);
        } finally {
            unlock();
        }
    }

    public boolean isLocked() {
        return state.get() != -1;
    }

    /**
     * @return suspended waiters currently counted in the state word
     */
    public int waiterCount() {
        return Math.max(state.get(), 0);
    }

    /**
     * @return how often a queued waiter took the lock on its retry instead of suspending
     */
    long retryAcquisitions() {
        return retryAcquisitions.get();
    }

    private void enqueue(LockWaiter w) {
        queueLock.lock();
        try {
            waiters.addLast(w);
        } finally {
            queueLock.unlock();
        }
    }

    private void removeGhost(LockWaiter w) {
        queueLock.lock();
        try {
            if (w.isLinked()) waiters.unlink(w);
        } finally {
            queueLock.unlock();
        }
    }

    private @Nullable LockWaiter retrieveWaiter() {
        queueLock.lock();
        try {
            for (; ; ) {
                LockWaiter w = waiters.pollFirst();
                if (w == null || w.status.get() != GHOST) return w;
            }
        } finally {
            queueLock.unlock();
        }
    }
    // [/🧩 Section: helpers]

    @Override
    public String toString() {
        int cur = state.get();
        return "Mutex #" + mxId + (cur == -1 ? " unlocked" : " locked, waiters=" + cur);
    }
}
