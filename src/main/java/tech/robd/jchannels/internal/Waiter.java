/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/internal/Waiter.java
 description: Sealed family of channel waiters: blocked senders, receivers, iterator look-aheads and select cases.
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
import tech.robd.jchannels.BrokenInvariantError;
import tech.robd.jchannels.ChannelClosedException;

/**
 * A suspended channel operation queued in a channel's {@link WaitQueue}.
 *
 * <p>A channel queue holds only one kind at a time: senders while the buffer is full,
 * receivers while it is empty. Operations that do not apply to a waiter's kind raise
 * {@link BrokenInvariantError}. All resume methods run after the channel lock is released.</p>
 *
 * @param <T> channel element type
 */
public abstract sealed class Waiter<T> extends WaitQueue.Node
        permits Waiter.Send, Waiter.Receive, Waiter.ReceiveOrNull, Waiter.HasNext, SelectCase {

    // 🧩 Section: claim

    /**
     * Take ownership of this waiter before consuming it. Plain waiters always succeed; a
     * select case succeeds only for the party that resolves its selector.
     */
    public boolean claim() {
        return true;
    }

    /**
     * @return {@code true} for a select case whose selector was resolved elsewhere
     */
    public boolean isStale() {
        return false;
    }
    // [/🧩 Section: claim]

    // 🧩 Section: sender-side
    public T sendValue() {
        throw new BrokenInvariantError(this + " has no value to send");
    }

    public void resumeSent() {
        throw new BrokenInvariantError(this + " is not a sender");
    }
    // [/🧩 Section: sender-side]

    // 🧩 Section: receiver-side
    public void deliver(T value) {
        throw new BrokenInvariantError(this + " is not a receiver");
    }
    // [/🧩 Section: receiver-side]

    /**
     * Wake this waiter because its channel was closed.
     */
    public abstract void resumeClosed();

    @Override
    public String toString() {
        return getClass().getSimpleName() + (isLinked() ? "(linked)" : "");
    }

    // 🧩 Section: kinds

    /**
     * {@code send} blocked on a full buffer.
     */
    public static final class Send<T> extends Waiter<T> {
        private final T value;
        private final Continuation<Boolean> continuation = new Continuation<>();

        public Send(T value) {
            this.value = value;
        }

        public Continuation<Boolean> continuation() {
            return continuation;
        }

        @Override
        public T sendValue() {
            return value;
        }

        @Override
        public void resumeSent() {
            continuation.resume(Boolean.TRUE);
        }

        @Override
        public void resumeClosed() {
            continuation.resumeWithException(ChannelClosedException.forSend());
        }
    }

    /**
     * {@code receive} blocked on an empty buffer.
     */
    public static final class Receive<T> extends Waiter<T> {
        private final Continuation<T> continuation = new Continuation<>();

        public Continuation<T> continuation() {
            return continuation;
        }

        @Override
        public void deliver(T value) {
            continuation.resume(value);
        }

        @Override
        public void resumeClosed() {
            continuation.resumeWithException(ChannelClosedException.forReceive());
        }
    }

    /**
     * {@code receiveOrNull} blocked on an empty buffer; close resumes it with {@code null}.
     */
    public static final class ReceiveOrNull<T> extends Waiter<T> {
        private final Continuation<@Nullable T> continuation = new Continuation<>();

        public Continuation<@Nullable T> continuation() {
            return continuation;
        }

        @Override
        public void deliver(T value) {
            continuation.resume(value);
        }

        @Override
        public void resumeClosed() {
            continuation.resume(null);
        }
    }

    /**
     * Iterator {@code hasNext()} blocked on an empty buffer. The element travels in
     * {@link #value()}; the continuation only says whether there is one.
     */
    public static final class HasNext<T> extends Waiter<T> {
        private final Continuation<Boolean> continuation = new Continuation<>();
        private @Nullable T value;

        public Continuation<Boolean> continuation() {
            return continuation;
        }

        public @Nullable T value() {
            return value;
        }

        @Override
        public void deliver(T value) {
            this.value = value;
            continuation.resume(Boolean.TRUE);
        }

        @Override
        public void resumeClosed() {
            continuation.resume(Boolean.FALSE);
        }
    }
    // [/🧩 Section: kinds]
}
