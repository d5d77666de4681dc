/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/internal/BaseChannel.java
 description: Lock-guarded core of a buffered channel: FIFO buffer, waiter queue, close protocol and select hooks.
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
import tech.robd.jchannels.ChannelClosedException;
import tech.robd.jchannels.NullPayloadException;
import tech.robd.jchannels.ReceiveIterator;
import tech.robd.jchannels.SuspendContext;
import tech.robd.jchannels.diagnostics.Diagnostics;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Abstract base for coroutine channels.
 *
 * <p>State is a bounded {@link ArrayDeque} buffer, a monotonic closed flag and a
 * {@link WaitQueue} of suspended operations, all guarded by one {@link ReentrantLock} per
 * channel. Critical sections only move elements and waiters; continuations are resumed and
 * errors are thrown after the lock is released.</p>
 *
 * <p>Queue discipline:</p>
 * <ul>
 *   <li>Senders wait only while the buffer is full, receivers only while it is empty.</li>
 *   <li>A receive that frees a slot moves the oldest sender's value into it.</li>
 *   <li>A send into an empty buffer hands the value straight to the oldest receiver.</li>
 *   <li>Select cases resolved through another channel stay queued until their selector
 *       unregisters them; anyone meeting one skips it.</li>
 * </ul>
 *
 * @param <T> channel element type
 */
public abstract class BaseChannel<T> {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(BaseChannel.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private static final AtomicLong COUNTER = new AtomicLong();

    /**
     * Outcomes of {@link #receiveOrRegister(Waiter)} that are not elements.
     */
    private static final Object CLOSED = new Object() {
        @Override
        public String toString() {
            return "CLOSED_SENTINEL";
        }
    };
    private static final Object SUSPENDED = new Object() {
        @Override
        public String toString() {
            return "SUSPENDED_SENTINEL";
        }
    };

    private final long chId = COUNTER.incrementAndGet();
    private final int capacity;
    private final ArrayDeque<T> buffer;
    private final WaitQueue<Waiter<T>> waiters = new WaitQueue<>();
    private final ReentrantLock lock = new ReentrantLock();
    private volatile boolean closed = false;
    // [/🧩 Section: state]

    // 🧩 Section: construction
    protected BaseChannel(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(capacity);
        DIAG.debug("ch#{} init capacity={}", chId, capacity);
    }
    // [/🧩 Section: construction]

    // 🧩 Section: send

    /**
     * Suspending send.
     *
     * @throws ChannelClosedException send side, when closed before or while waiting
     */
    protected void sendInternal(@NonNull SuspendContext s, T item) {
        s.checkCancellation();
        if (item == null) {
            DIAG.error("ch#{} send rejected: null payload", chId);
            throw NullPayloadException.forSend();
        }
        Waiter<T> receiver = null;
        Waiter.Send<T> self = null;
        boolean rejected = false;

        lock.lock();
        try {
            if (closed) {
                rejected = true;
            } else if (isFull()) {
                self = new Waiter.Send<>(item);
                waiters.addLast(self);
            } else {
                receiver = pollLive();
                if (receiver == null) buffer.addLast(item);
            }
        } finally {
            lock.unlock();
        }

        if (rejected) {
            DIAG.debug("ch#{} send rejected: closed", chId);
            throw ChannelClosedException.forSend();
        }
        if (self != null) {
            DIAG.debug("ch#{} send -> suspend (buffer full)", chId);
            awaitSend(s, self);
            return;
        }
        if (receiver != null) {
            DIAG.debug("ch#{} send -> handoff to {}", chId, receiver);
            receiver.deliver(item);
        } else {
            DIAG.debug("ch#{} send -> buffered", chId);
        }
    }

    private void awaitSend(SuspendContext s, Waiter.Send<T> self) {
        self.continuation().await(s, () -> withdraw(self));
    }

    /**
     * Non-suspending send.
     *
     * @return {@code false} when the buffer is full or the channel is closed
     */
    protected boolean trySendInternal(T item) {
        if (item == null) throw NullPayloadException.forSend();
        Waiter<T> receiver;
        lock.lock();
        try {
            if (closed || isFull()) return false;
            receiver = pollLive();
            if (receiver == null) buffer.addLast(item);
        } finally {
            lock.unlock();
        }
        if (receiver != null) receiver.deliver(item);
        DIAG.debug("ch#{} trySend ok", chId);
        return true;
    }
    // [/🧩 Section: send]

    // 🧩 Section: receive

    /**
     * Suspending receive.
     *
     * @throws ChannelClosedException receive side, when closed and drained
     */
    @SuppressWarnings("unchecked")
    protected T receiveInternal(@NonNull SuspendContext s) {
        s.checkCancellation();
        Waiter.Receive<T> self = new Waiter.Receive<>();
        Object r = receiveOrRegister(self);
        if (r == CLOSED) {
            DIAG.debug("ch#{} recv -> CLOSED (empty)", chId);
            throw ChannelClosedException.forReceive();
        }
        if (r == SUSPENDED) {
            DIAG.debug("ch#{} recv -> suspend (buffer empty)", chId);
            return self.continuation().await(s, () -> withdraw(self));
        }
        return (T) r;
    }

    /**
     * Suspending receive that reports a closed, drained channel as {@code null}.
     */
    @SuppressWarnings("unchecked")
    protected @Nullable T receiveOrNullInternal(@NonNull SuspendContext s) {
        s.checkCancellation();
        Waiter.ReceiveOrNull<T> self = new Waiter.ReceiveOrNull<>();
        Object r = receiveOrRegister(self);
        if (r == CLOSED) return null;
        if (r == SUSPENDED) {
            return self.continuation().await(s, () -> withdraw(self));
        }
        return (T) r;
    }

    /**
     * Non-suspending receive.
     *
     * @return the front element, or {@code null} when the buffer is empty
     * @throws ChannelClosedException receive side, when closed and drained
     */
    protected @Nullable T tryReceiveInternal() {
        T result;
        Waiter<T> sender = null;
        boolean exhausted = false;
        lock.lock();
        try {
            if (buffer.isEmpty()) {
                if (!closed) return null;
                exhausted = true;
                result = null;
            } else {
                result = buffer.pollFirst();
                sender = pollLive();
                if (sender != null) buffer.addLast(sender.sendValue());
            }
        } finally {
            lock.unlock();
        }
        if (exhausted) throw ChannelClosedException.forReceive();
        if (sender != null) sender.resumeSent();
        return result;
    }

    /**
     * Shared receive step. Returns the dequeued element, {@link #CLOSED} when the channel is
     * closed and drained, or {@link #SUSPENDED} after queueing {@code self}.
     */
    private Object receiveOrRegister(Waiter<T> self) {
        Object result;
        Waiter<T> sender = null;
        lock.lock();
        try {
            if (buffer.isEmpty()) {
                if (closed) {
                    result = CLOSED;
                } else {
                    waiters.addLast(self);
                    result = SUSPENDED;
                }
            } else {
                result = buffer.pollFirst();
                sender = pollLive();
                if (sender != null) buffer.addLast(sender.sendValue());
            }
        } finally {
            lock.unlock();
        }
        if (sender != null) {
            DIAG.debug("ch#{} recv -> moved {} into buffer", chId, sender);
            sender.resumeSent();
        }
        return result;
    }
    // [/🧩 Section: receive]

    // 🧩 Section: select

    /**
     * Select hook for a send case.
     *
     * @return {@code true} once the case's selector is resolved (here or earlier);
     * {@code false} when the case was queued
     */
    public boolean selectSend(SelectCase.@NonNull Send<T, ?> c) {
        Waiter<T> receiver = null;
        boolean closedWin = false;
        lock.lock();
        try {
            if (c.isStale()) return true;
            if (!closed && isFull()) {
                waiters.addLast(c);
                return false;
            }
            // claim before consuming: our own cases queued here become stale and get skipped
            if (!c.claim()) return true;
            if (closed) {
                closedWin = true;
            } else {
                receiver = pollLive();
                if (receiver == null) buffer.addLast(c.sendValue());
            }
        } finally {
            lock.unlock();
        }
        if (closedWin) {
            DIAG.debug("ch#{} selectSend -> CLOSED", chId);
            c.resumeClosed();
            return true;
        }
        if (receiver != null) receiver.deliver(c.sendValue());
        DIAG.debug("ch#{} selectSend -> sent", chId);
        c.resumeSent();
        return true;
    }

    /**
     * Select hook for a receive case. Same contract as {@link #selectSend(SelectCase.Send)}.
     */
    public boolean selectReceive(SelectCase.@NonNull Receive<T, ?> c) {
        Waiter<T> sender = null;
        T value = null;
        boolean closedWin = false;
        lock.lock();
        try {
            if (c.isStale()) return true;
            if (buffer.isEmpty() && !closed) {
                waiters.addLast(c);
                return false;
            }
            if (!c.claim()) return true;
            if (buffer.isEmpty()) {
                closedWin = true;
            } else {
                value = buffer.pollFirst();
                sender = pollLive();
                if (sender != null) buffer.addLast(sender.sendValue());
            }
        } finally {
            lock.unlock();
        }
        if (sender != null) sender.resumeSent();
        if (closedWin) {
            DIAG.debug("ch#{} selectReceive -> CLOSED", chId);
            c.resumeClosed();
        } else {
            DIAG.debug("ch#{} selectReceive -> received", chId);
            c.deliver(value);
        }
        return true;
    }
    // [/🧩 Section: select]

    // 🧩 Section: waiters

    /**
     * Pop the oldest waiter that can still be completed, dropping stale select cases.
     * Caller holds the lock.
     */
    private @Nullable Waiter<T> pollLive() {
        for (; ; ) {
            Waiter<T> w = waiters.pollFirst();
            if (w == null) return null;
            if (w.claim()) return w;
            DIAG.debug("ch#{} skip stale {}", chId, w);
        }
    }

    /**
     * Unlink {@code w} if it is still queued.
     *
     * @return {@code true} when this call removed it, {@code false} when a counterpart or
     * {@link #close()} took it first
     */
    boolean withdraw(@NonNull Waiter<T> w) {
        lock.lock();
        try {
            if (!w.isLinked()) return false;
            waiters.unlink(w);
        } finally {
            lock.unlock();
        }
        DIAG.debug("ch#{} withdrew {}", chId, w);
        return true;
    }

    private boolean isFull() {
        return buffer.size() == capacity;
    }
    // [/🧩 Section: waiters]

    // 🧩 Section: lifecycle

    /**
     * Close the channel. Idempotent.
     *
     * <p>Buffered elements stay receivable. With an empty buffer every queued receiver is
     * woken with the closed outcome; with a full buffer every queued sender is. A channel
     * that is neither empty nor full cannot have waiters, so finding one there is a
     * {@link BrokenInvariantError}.</p>
     */
    public void close() {
        List<Waiter<T>> woken = new ArrayList<>();
        boolean broken = false;
        lock.lock();
        try {
            if (closed) {
                DIAG.debug("ch#{} close() ignored (already closed)", chId);
                return;
            }
            closed = true;
            boolean wakeAll = buffer.isEmpty() || isFull();
            for (Waiter<T> w = waiters.pollFirst(); w != null; w = waiters.pollFirst()) {
                if (w.isStale()) continue;
                if (!wakeAll) {
                    broken = true;
                } else if (w.claim()) {
                    woken.add(w);
                }
            }
        } finally {
            lock.unlock();
        }
        if (broken) {
            throw new BrokenInvariantError("ch#" + chId + " closed while neither empty nor full but had waiters");
        }
        DIAG.debug("ch#{} closed, waking {} waiter(s)", chId, woken.size());
        for (Waiter<T> w : woken) {
            w.resumeClosed();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean isEmpty() {
        lock.lock();
        try {
            return buffer.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return number of buffered elements
     */
    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public long getChannelId() {
        return chId;
    }

    /**
     * @return number of queued waiters, stale select cases included
     */
    public int waiterCount() {
        lock.lock();
        try {
            return waiters.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        lock.lock();
        try {
            return "Channel #" + chId + " closed=" + closed + ", buffer=" + buffer + ", waiters=" + waiters.size();
        } finally {
            lock.unlock();
        }
    }
    // [/🧩 Section: lifecycle]

    // 🧩 Section: iteration

    protected @NonNull ReceiveIterator<T> iteratorInternal(@NonNull SuspendContext s) {
        return new ChannelIterator(s);
    }

    /**
     * Iterator over one channel for one coroutine. {@code hasNext()} receives ahead and caches
     * the element; {@code next()} without a cached element performs a plain receive.
     */
    private final class ChannelIterator implements ReceiveIterator<T> {
        private final SuspendContext s;
        private boolean computed;
        private boolean hasValue;
        private @Nullable T next;

        private ChannelIterator(@NonNull SuspendContext s) {
            this.s = s;
        }

        @Override
        @SuppressWarnings("unchecked")
        public boolean hasNext() {
            if (computed) return hasValue;
            s.checkCancellation();
            Waiter.HasNext<T> self = new Waiter.HasNext<>();
            Object r = receiveOrRegister(self);
            if (r == CLOSED) {
                setClosed();
            } else if (r == SUSPENDED) {
                boolean got = self.continuation().await(s, () -> withdraw(self));
                if (got) setNext(self.value());
                else setClosed();
            } else {
                setNext((T) r);
            }
            return hasValue;
        }

        @Override
        public T next() {
            if (computed) {
                if (!hasValue) throw new NoSuchElementException("Channel was closed");
                T result = next;
                computed = false;
                next = null;
                return result;
            }
            try {
                return receiveInternal(s);
            } catch (ChannelClosedException e) {
                NoSuchElementException nse = new NoSuchElementException("Channel was closed");
                nse.initCause(e);
                throw nse;
            }
        }

        private void setNext(@Nullable T value) {
            computed = true;
            hasValue = true;
            next = value;
        }

        private void setClosed() {
            computed = true;
            hasValue = false;
            next = null;
        }
    }
    // [/🧩 Section: iteration]
}
